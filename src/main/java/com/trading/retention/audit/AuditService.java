package com.trading.retention.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Audit trail of cleanup operations, cleanup cycles and backups.
 * Holds at most {@code maxEntries} entries; the oldest entry is evicted when a new one
 * would exceed the bound.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final Deque<AuditEntry> entries = new ArrayDeque<>();
    private final Clock clock;
    private final int maxEntries;
    private long evicted;

    public AuditService() {
        this(Clock.systemUTC());
    }

    public AuditService(Clock clock) {
        this(clock, DEFAULT_MAX_ENTRIES);
    }

    public AuditService(Clock clock, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxEntries = maxEntries;
    }

    public AuditEntry record(AuditEntry entry) {
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > maxEntries) {
                entries.removeFirst();
                evicted++;
            }
        }
        log.debug("audit.recorded action={} subject={} actor={}",
                entry.action(), entry.subject(), entry.actor());
        return entry;
    }

    public AuditEntry record(AuditAction action, String subject, String actor, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .subject(subject)
                .actor(actor)
                .details(details)
                .timestamp(clock.instant())
                .build());
    }

    public AuditEntry record(AuditAction action, String subject, String actor) {
        return record(action, subject, actor, null);
    }

    /**
     * Gets all audit entries (immutable view).
     */
    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(snapshot());
    }

    public List<AuditEntry> getEntriesForSubject(String subject) {
        return snapshot().stream()
                .filter(e -> subject.equals(e.subject()))
                .toList();
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return snapshot().stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    /**
     * Gets audit entries recorded within {@code [start, end]}.
     */
    public List<AuditEntry> getEntriesBetween(Instant start, Instant end) {
        return snapshot().stream()
                .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
                .toList();
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    /**
     * Number of entries dropped so far to stay within {@link #getMaxEntries()}.
     */
    public long getEvictedCount() {
        synchronized (entries) {
            return evicted;
        }
    }

    /**
     * Gets the most recent entries, up to the specified limit.
     */
    public List<AuditEntry> getRecentEntries(int limit) {
        List<AuditEntry> all = snapshot();
        int size = all.size();
        if (size <= limit) {
            return Collections.unmodifiableList(all);
        }
        return Collections.unmodifiableList(new ArrayList<>(all.subList(size - limit, size)));
    }

    private List<AuditEntry> snapshot() {
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }
}
