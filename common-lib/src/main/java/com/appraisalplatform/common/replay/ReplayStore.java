package com.appraisalplatform.common.replay;

import java.util.List;

/**
 * Append-only store of processed interactions.
 *
 * <p>Backends differ only in durability; eviction over {@code maxSize} and sampling
 * follow {@link InMemoryReplayStore} for all of them. Implementations tolerate
 * concurrent writers.
 */
public interface ReplayStore {

    /**
     * Adds {@code record}. With similar-record deduplication enabled, a record similar to
     * one already stored is folded into it instead.
     */
    void append(ReplayRecord record);

    /**
     * Up to {@code n} records. Prioritized sampling returns the highest priorities
     * first; otherwise records come back in insertion order.
     */
    List<ReplayRecord> sample(int n, boolean prioritized);

    List<ReplayRecord> sampleByAgent(String agentId, int n);

    /**
     * Up to {@code n} records of the given {@link ReplayRecord#type()}, in insertion order.
     */
    List<ReplayRecord> sampleByType(String type, int n);

    /**
     * Records whose priority reaches the configured threshold.
     */
    List<ReplayRecord> highPriority();

    List<ReplayRecord> getAll();

    int size();

    /**
     * Drops records older than the retention window.
     *
     * @return the number of records removed
     */
    int purgeExpired();

    ReplayStatistics statistics();

    void clear();
}
