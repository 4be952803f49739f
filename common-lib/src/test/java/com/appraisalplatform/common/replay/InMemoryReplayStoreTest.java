package com.appraisalplatform.common.replay;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryReplayStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static ReplayRecord record(String agentId, double priority) {
        return ReplayRecord.of(agentId, Map.of("p", priority), Map.of(), ReplayOutcome.SUCCESS, priority).at(NOW);
    }

    private static List<Double> priorities(List<ReplayRecord> records) {
        return records.stream().map(ReplayRecord::priority).toList();
    }

    // ── eviction ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("append(): eviction over maxSize")
    class EvictionTests {

        @Test
        @DisplayName("prioritized: [0.2, 0.9, 0.5, 0.1] into maxSize 3 evicts 0.1")
        void prioritized_evictsLowest() {
            InMemoryReplayStore store = new InMemoryReplayStore(ReplaySettings.inMemory(3, true), CLOCK);

            for (double p : new double[] {0.2, 0.9, 0.5, 0.1}) {
                store.append(record("a", p));
            }

            assertEquals(3, store.size());
            assertEquals(List.of(0.2, 0.9, 0.5), priorities(store.getAll()));
            assertEquals(List.of(0.9, 0.5, 0.2), priorities(store.sample(3, true)));
        }

        @Test
        @DisplayName("prioritized: equal lowest priorities evict the oldest first")
        void prioritized_tieEvictsOldest() {
            InMemoryReplayStore store = new InMemoryReplayStore(ReplaySettings.inMemory(2, true), CLOCK);
            ReplayRecord first = record("a", 0.3);
            ReplayRecord second = record("b", 0.3);

            store.append(first);
            store.append(second);
            store.append(record("c", 0.8));

            List<ReplayRecord> remaining = store.getAll();
            assertEquals(2, remaining.size());
            assertFalse(remaining.contains(first));
            assertTrue(remaining.contains(second));
        }

        @Test
        @DisplayName("FIFO: oldest record evicted regardless of priority")
        void fifo_evictsOldest() {
            InMemoryReplayStore store = new InMemoryReplayStore(ReplaySettings.inMemory(3, false), CLOCK);

            for (double p : new double[] {0.9, 0.1, 0.5, 0.2}) {
                store.append(record("a", p));
            }

            assertEquals(List.of(0.1, 0.5, 0.2), priorities(store.getAll()));
        }
    }

    // ── sampling ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("sample() and filtered reads")
    class SamplingTests {

        @Test
        @DisplayName("non-prioritized sample keeps insertion order and caps at n")
        void insertionOrderSample() {
            InMemoryReplayStore store = new InMemoryReplayStore(ReplaySettings.inMemory(10, true), CLOCK);
            store.append(record("a", 0.1));
            store.append(record("a", 0.9));
            store.append(record("a", 0.5));

            assertEquals(List.of(0.1, 0.9), priorities(store.sample(2, false)));
            assertEquals(3, store.sample(50, false).size());
            assertTrue(store.sample(0, true).isEmpty());
        }

        @Test
        @DisplayName("sampleByAgent and highPriority filter by agent and threshold")
        void filteredReads() {
            InMemoryReplayStore store = new InMemoryReplayStore(ReplaySettings.inMemory(10, true), CLOCK);
            store.append(record("a", 0.1));
            store.append(record("b", 0.7));
            store.append(record("a", 0.95));

            assertEquals(2, store.sampleByAgent("a", 5).size());
            assertEquals(1, store.sampleByAgent("a", 1).size());
            assertEquals(List.of(0.7, 0.95), priorities(store.highPriority()));
        }
    }

    // ── retention & statistics ─────────────────────────────────────────────

    @Nested
    @DisplayName("retention and statistics")
    class RetentionTests {

        @Test
        @DisplayName("purgeExpired drops records older than retentionDays")
        void purgeExpired() {
            InMemoryReplayStore store = new InMemoryReplayStore(
                ReplaySettings.inMemory(10, true).withRetentionDays(30), CLOCK);
            store.append(record("a", 0.5));
            store.append(record("a", 0.5).at(NOW.minus(Duration.ofDays(29))));
            // already outside the window: purged during its own append
            store.append(record("a", 0.5).at(NOW.minus(Duration.ofDays(31))));

            assertEquals(2, store.size());
            assertEquals(0, store.purgeExpired());
        }

        @Test
        @DisplayName("retentionDays 0 keeps everything")
        void zeroRetentionKeepsAll() {
            InMemoryReplayStore store = new InMemoryReplayStore(ReplaySettings.inMemory(10, true), CLOCK);
            store.append(record("a", 0.5).at(NOW.minus(Duration.ofDays(3650))));

            assertEquals(0, store.purgeExpired());
            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("statistics counts by agent, outcome and high priority")
        void statistics() {
            InMemoryReplayStore store = new InMemoryReplayStore(ReplaySettings.inMemory(10, true), CLOCK);
            store.append(record("a", 0.9));
            store.append(record("b", 0.2));
            store.append(ReplayRecord.of("a", null, null, ReplayOutcome.FAILURE, 0.8).at(NOW));

            ReplayStatistics stats = store.statistics();

            assertEquals(3, stats.total());
            assertEquals(2L, stats.byAgent().get("a"));
            assertEquals(1L, stats.byOutcome().get(ReplayOutcome.FAILURE));
            assertEquals(2L, stats.highPriorityCount());
            assertFalse(stats.trainingThresholdReached());

            store.clear();
            assertEquals(0, store.size());
        }
    }

    @Test
    @DisplayName("priority outside [0, 1] is rejected")
    void invalidPriorityRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> ReplayRecord.of("a", null, null, ReplayOutcome.SUCCESS, 1.5));
    }

    // ── deduplication and types ────────────────────────────────────────────

    @Nested
    @DisplayName("append(): deduplication of similar records")
    class DeduplicationTests {

        private final InMemoryReplayStore store =
            new InMemoryReplayStore(ReplaySettings.inMemory(10, true).deduplicating(), CLOCK);

        @Test
        @DisplayName("same agent, type and input fold into one record")
        void similarRecordsMerge() {
            ReplayRecord first = ReplayRecord.of("a", ReplayRecord.TYPE_REQUEST, Map.of("op", "value"),
                Map.of("v", 1), ReplayOutcome.SUCCESS, 0.8).at(NOW.minusSeconds(60));
            ReplayRecord second = ReplayRecord.of("a", ReplayRecord.TYPE_REQUEST, Map.of("op", "value"),
                Map.of("v", 2), ReplayOutcome.FAILURE, 0.3).at(NOW);

            store.append(first);
            store.append(second);

            assertEquals(1, store.size());
            ReplayRecord merged = store.getAll().get(0);
            assertEquals(first.id(), merged.id());
            assertEquals(2, merged.occurrences());
            assertEquals(0.8, merged.priority());
            assertEquals(Map.of("v", 2), merged.output());
            assertEquals(ReplayOutcome.FAILURE, merged.outcome());
            assertEquals(-1.0, merged.reward());
            assertEquals(NOW, merged.timestamp());
        }

        @Test
        @DisplayName("a different agent, type or input is kept apart")
        void dissimilarRecordsKept() {
            store.append(ReplayRecord.of("a", ReplayRecord.TYPE_REQUEST, Map.of("op", "value"), null,
                ReplayOutcome.SUCCESS, 0.5).at(NOW));
            store.append(ReplayRecord.of("b", ReplayRecord.TYPE_REQUEST, Map.of("op", "value"), null,
                ReplayOutcome.SUCCESS, 0.5).at(NOW));
            store.append(ReplayRecord.of("a", ReplayRecord.TYPE_DELIVERY, Map.of("op", "value"), null,
                ReplayOutcome.FAILURE, 0.5).at(NOW));
            store.append(ReplayRecord.of("a", ReplayRecord.TYPE_REQUEST, Map.of("op", "review"), null,
                ReplayOutcome.SUCCESS, 0.5).at(NOW));

            assertEquals(4, store.size());
            assertTrue(store.getAll().stream().allMatch(r -> r.occurrences() == 1));
        }

        @Test
        @DisplayName("without deduplication every append is its own record")
        void offByDefault() {
            InMemoryReplayStore plain = new InMemoryReplayStore(ReplaySettings.inMemory(10, true), CLOCK);
            plain.append(record("a", 0.5));
            plain.append(record("a", 0.5));

            assertEquals(2, plain.size());
        }
    }

    @Test
    @DisplayName("sampleByType returns records of one type in insertion order and counts types")
    void sampleByType() {
        InMemoryReplayStore store = new InMemoryReplayStore(ReplaySettings.inMemory(10, true), CLOCK);
        ReplayRecord request1 = ReplayRecord.of("a", ReplayRecord.TYPE_REQUEST, 1, null, ReplayOutcome.SUCCESS, 0.2).at(NOW);
        ReplayRecord delivery = ReplayRecord.of("a", ReplayRecord.TYPE_DELIVERY, 2, null, ReplayOutcome.FAILURE, 0.9).at(NOW);
        ReplayRecord request2 = ReplayRecord.of("b", ReplayRecord.TYPE_REQUEST, 3, null, ReplayOutcome.SUCCESS, 0.7).at(NOW);
        store.append(request1);
        store.append(delivery);
        store.append(request2);

        assertEquals(List.of(request1, request2), store.sampleByType(ReplayRecord.TYPE_REQUEST, 5));
        assertEquals(List.of(request1), store.sampleByType(ReplayRecord.TYPE_REQUEST, 1));
        assertTrue(store.sampleByType("unknown", 5).isEmpty());
        assertTrue(store.sampleByType(ReplayRecord.TYPE_REQUEST, 0).isEmpty());
        assertEquals(Map.of(ReplayRecord.TYPE_REQUEST, 2L, ReplayRecord.TYPE_DELIVERY, 1L), store.statistics().byType());
    }

    @Test
    @DisplayName("a record without a type is an interaction")
    void defaultType() {
        assertEquals(ReplayRecord.TYPE_INTERACTION, record("a", 0.5).type());
        assertEquals(1, record("a", 0.5).occurrences());
    }
}
