package com.trading.retention.cleanup;

import com.trading.retention.policy.RetentionPolicy;

import java.time.Duration;
import java.time.Instant;

/**
 * How a cutoff date is derived from a policy. Records strictly older than the cutoff are
 * eligible for deletion.
 */
public enum CutoffRule {

    /**
     * {@code now - retentionDays}.
     */
    STANDARD {
        @Override
        public double retainedDays(RetentionPolicy policy) {
            return policy.retentionDays();
        }
    },

    /**
     * {@code now - 1.1 x longest window}. Keeps critical data longer than any configured window.
     */
    CONSERVATIVE {
        @Override
        public double retainedDays(RetentionPolicy policy) {
            return policy.longestWindowDays() * CONSERVATIVE_FACTOR;
        }
    },

    /**
     * {@code now - 0.9 x shortest window}. Prunes low-value data ahead of its shortest window.
     */
    AGGRESSIVE {
        @Override
        public double retainedDays(RetentionPolicy policy) {
            return policy.shortestWindowDays() * AGGRESSIVE_FACTOR;
        }
    };

    static final double CONSERVATIVE_FACTOR = 1.1;
    static final double AGGRESSIVE_FACTOR = 0.9;

    private static final long SECONDS_PER_DAY = 86_400L;

    /**
     * Number of days, possibly fractional, that this rule keeps for the given policy.
     */
    public abstract double retainedDays(RetentionPolicy policy);

    /**
     * Computes the cutoff instant for the policy relative to {@code now}.
     */
    public Instant cutoff(RetentionPolicy policy, Instant now) {
        long seconds = Math.round(retainedDays(policy) * SECONDS_PER_DAY);
        return now.minus(Duration.ofSeconds(seconds));
    }
}
