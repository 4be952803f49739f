package com.appraisalplatform.common.replay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded in-memory {@link ReplayStore}.
 *
 * <p><strong>Eviction:</strong> once {@code maxSize} is exceeded, prioritized mode removes
 * the lowest-priority record (the oldest among equals); otherwise the oldest record goes
 * first. Records are kept in insertion order, so "oldest" is always the lower index.
 *
 * <p><strong>Deduplication:</strong> when enabled, a record similar to a stored one
 * ({@link ReplayRecord#isSimilarTo}) is merged into it in place and nothing is appended.
 *
 * <p>All access is serialized on the store's monitor; every method is a short
 * in-memory operation.
 */
public class InMemoryReplayStore implements ReplayStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReplayStore.class);

    private final ReplaySettings settings;
    private final Clock clock;
    private final List<ReplayRecord> records = new ArrayList<>();

    public InMemoryReplayStore(ReplaySettings settings) {
        this(settings, Clock.systemUTC());
    }

    public InMemoryReplayStore(ReplaySettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized void append(ReplayRecord record) {
        Objects.requireNonNull(record, "record");
        if (settings.deduplicateSimilar() && mergeIntoSimilar(record)) {
            purgeExpiredLocked();
            return;
        }
        records.add(record);
        purgeExpiredLocked();
        int evicted = 0;
        while (records.size() > settings.maxSize()) {
            records.remove(evictionIndex());
            evicted++;
        }
        if (evicted > 0) {
            log.debug("Replay eviction. evicted={} size={} prioritized={}",
                      evicted, records.size(), settings.usePrioritizedSampling());
        }
    }

    @Override
    public synchronized List<ReplayRecord> sample(int n, boolean prioritized) {
        if (n <= 0 || records.isEmpty()) {
            return List.of();
        }
        if (!prioritized) {
            return List.copyOf(records.subList(0, Math.min(n, records.size())));
        }
        // List.sort is stable: equal priorities keep insertion order
        List<ReplayRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingDouble(ReplayRecord::priority).reversed());
        return List.copyOf(sorted.subList(0, Math.min(n, sorted.size())));
    }

    @Override
    public synchronized List<ReplayRecord> sampleByAgent(String agentId, int n) {
        if (n <= 0) {
            return List.of();
        }
        return records.stream()
            .filter(r -> r.agentId().equals(agentId))
            .limit(n)
            .toList();
    }

    @Override
    public synchronized List<ReplayRecord> sampleByType(String type, int n) {
        if (n <= 0) {
            return List.of();
        }
        return records.stream()
            .filter(r -> r.type().equals(type))
            .limit(n)
            .toList();
    }

    @Override
    public synchronized List<ReplayRecord> highPriority() {
        return records.stream()
            .filter(r -> r.priority() >= settings.priorityThreshold())
            .toList();
    }

    @Override
    public synchronized List<ReplayRecord> getAll() {
        return List.copyOf(records);
    }

    @Override
    public synchronized int size() {
        return records.size();
    }

    @Override
    public synchronized int purgeExpired() {
        return purgeExpiredLocked();
    }

    @Override
    public synchronized ReplayStatistics statistics() {
        Map<String, Long> byAgent = new LinkedHashMap<>();
        Map<String, Long> byType = new LinkedHashMap<>();
        Map<ReplayOutcome, Long> byOutcome = new EnumMap<>(ReplayOutcome.class);
        long highPriority = 0;
        for (ReplayRecord record : records) {
            byAgent.merge(record.agentId(), 1L, Long::sum);
            byType.merge(record.type(), 1L, Long::sum);
            byOutcome.merge(record.outcome(), 1L, Long::sum);
            if (record.priority() >= settings.priorityThreshold()) {
                highPriority++;
            }
        }
        return new ReplayStatistics(records.size(), byAgent, byType, byOutcome, highPriority,
                                    records.size() >= settings.trainingThreshold());
    }

    @Override
    public synchronized void clear() {
        records.clear();
    }

    public ReplaySettings settings() {
        return settings;
    }

    // ── internals (caller holds the monitor) ───────────────────────────────

    private boolean mergeIntoSimilar(ReplayRecord record) {
        for (int i = 0; i < records.size(); i++) {
            ReplayRecord existing = records.get(i);
            if (existing.isSimilarTo(record)) {
                ReplayRecord merged = existing.merge(record);
                records.set(i, merged);
                log.debug("Similar replay record merged. recordId={} agentId={} occurrences={}",
                          merged.id(), merged.agentId(), merged.occurrences());
                return true;
            }
        }
        return false;
    }

    private int evictionIndex() {
        if (!settings.usePrioritizedSampling()) {
            return 0;
        }
        int lowest = 0;
        for (int i = 1; i < records.size(); i++) {
            // strict comparison keeps the oldest among equal priorities
            if (records.get(i).priority() < records.get(lowest).priority()) {
                lowest = i;
            }
        }
        return lowest;
    }

    private int purgeExpiredLocked() {
        if (settings.retentionDays() == 0) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(settings.retentionDays()));
        int before = records.size();
        records.removeIf(r -> r.timestamp().isBefore(cutoff));
        int removed = before - records.size();
        if (removed > 0) {
            log.info("Replay retention purge. removed={} retentionDays={}", removed, settings.retentionDays());
        }
        return removed;
    }
}
