package com.trading.retention.cleanup;

import com.trading.retention.policy.DataPriority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Tier and strategy registries")
class RegistryTest {

    @Nested
    @DisplayName("TierRegistry")
    class TierTests {

        private final TierRegistry tiers = TierRegistry.defaults();

        @Test
        @DisplayName("Should order critical, then important, then operational")
        void testOrdering() {
            List<String> ordered = tiers.order(
                    List.of("market_data", "trades", "equity_curve", "orders", "positions"));

            assertEquals(List.of("trades", "orders", "positions", "equity_curve", "market_data"), ordered);
        }

        @Test
        @DisplayName("Unknown types should sort after operational types")
        void testUnknownLast() {
            assertEquals(List.of("unknown_type"), tiers.order(List.of("unknown_type")));
            assertEquals(List.of("trades", "market_data", "unknown_type"),
                    tiers.order(List.of("unknown_type", "market_data", "trades")));
        }

        @Test
        @DisplayName("Rank of an unknown type should be past the last tier")
        void testRank() {
            assertEquals(0, tiers.rank("trades"));
            assertEquals(2, tiers.rank("market_data"));
            assertEquals(3, tiers.rank("unknown_type"));
            assertTrue(tiers.tierOf("unknown_type").isEmpty());
        }
    }

    @Nested
    @DisplayName("StrategyRegistry")
    class StrategyTests {

        private final StrategyRegistry strategies = StrategyRegistry.defaults();

        @Test
        @DisplayName("Should map each tier's names to its strategy")
        void testRegisteredStrategies() {
            assertEquals(CutoffRule.CONSERVATIVE, strategies.strategyFor("trades").cutoff());
            assertInstanceOf(VerifiedDeletion.class, strategies.strategyFor("positions").deletion());
            assertEquals(CutoffRule.STANDARD, strategies.strategyFor("equity_curve").cutoff());
            assertInstanceOf(BatchedDeletion.class, strategies.strategyFor("equity_curve").deletion());
            assertEquals(CutoffRule.AGGRESSIVE, strategies.strategyFor("market_data").cutoff());
            assertInstanceOf(BulkDeletion.class, strategies.strategyFor("market_data").deletion());
        }

        @Test
        @DisplayName("Unregistered names should get the standard fallback")
        void testFallback() {
            CleanupStrategy strategy = strategies.strategyFor("unknown_type");

            assertFalse(strategies.isRegistered("unknown_type"));
            assertEquals("standard", strategy.name());
            assertEquals(CutoffRule.STANDARD, strategy.cutoff());
        }

        @Test
        @DisplayName("Custom registries should be independent of tier registration")
        void testIndependentRegistries() {
            TierRegistry tiers = new TierRegistry(Map.of("fills", DataPriority.CRITICAL));
            StrategyRegistry custom = new StrategyRegistry(Map.of(), CleanupStrategy.standard());

            assertEquals(0, tiers.rank("fills"));
            assertEquals("standard", custom.strategyFor("fills").name());
        }
    }
}
