package com.appraisalplatform.common.replay;

/**
 * Replay buffer policy.
 *
 * <ul>
 *   <li>{@code maxSize}                – records kept before eviction</li>
 *   <li>{@code priorityThreshold}      – lower bound for {@link ReplayStore#highPriority()}</li>
 *   <li>{@code usePrioritizedSampling} – evict lowest priority instead of FIFO</li>
 *   <li>{@code retentionDays}          – age limit for {@link ReplayStore#purgeExpired()}, 0 keeps forever</li>
 *   <li>{@code trainingThreshold}      – record count reported as "threshold reached" in statistics</li>
 *   <li>{@code deduplicateSimilar}     – fold a record into an earlier similar one instead of appending</li>
 * </ul>
 */
public record ReplaySettings(
    ReplayBackend type,
    int maxSize,
    double priorityThreshold,
    boolean usePrioritizedSampling,
    boolean persistExperiences,
    String filePath,
    int retentionDays,
    int trainingThreshold,
    boolean deduplicateSimilar
) {
    public ReplaySettings {
        type = type == null ? ReplayBackend.IN_MEMORY : type;
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive but was " + maxSize);
        }
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must not be negative but was " + retentionDays);
        }
    }

    public static ReplaySettings inMemory(int maxSize, boolean usePrioritizedSampling) {
        return new ReplaySettings(ReplayBackend.IN_MEMORY, maxSize, 0.7, usePrioritizedSampling,
                                  false, null, 0, 1000, false);
    }

    public ReplaySettings withRetentionDays(int retentionDays) {
        return new ReplaySettings(type, maxSize, priorityThreshold, usePrioritizedSampling,
                                  persistExperiences, filePath, retentionDays, trainingThreshold, deduplicateSimilar);
    }

    public ReplaySettings deduplicating() {
        return new ReplaySettings(type, maxSize, priorityThreshold, usePrioritizedSampling,
                                  persistExperiences, filePath, retentionDays, trainingThreshold, true);
    }
}
