package com.appraisalplatform.orchestrator.config;

import com.appraisalplatform.common.config.AgentConfig;
import com.appraisalplatform.common.config.PerformanceThresholds;
import com.appraisalplatform.common.replay.ReplayBackend;
import com.appraisalplatform.common.replay.ReplaySettings;
import com.appraisalplatform.orchestrator.manager.SupervisionSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of the agent system, bound from {@code agent-system.*}.
 * <p>
 * Environment variants come from Spring profiles ({@code development}, {@code staging},
 * {@code production}); the core reads these values once at startup.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "agent-system")
public class AgentSystemProperties {

    @NotBlank
    private String systemName = "Appraisal Agent System";

    private String version = "1.0.0";

    /** development | staging | production */
    private String environment = "development";

    @Valid
    private final MessageBroker messageBroker = new MessageBroker();
    @Valid
    private final ReplayBuffer replayBuffer = new ReplayBuffer();
    @Valid
    private final Training training = new Training();
    @Valid
    private final Monitoring monitoring = new Monitoring();
    @Valid
    private final Logger logger = new Logger();
    private final Dashboard dashboard = new Dashboard();
    private final Security security = new Security();

    @Valid
    private List<Agent> agents = new ArrayList<>();

    /**
     * Message bus backend and request/response behaviour.
     */
    @Data
    public static class MessageBroker {
        /** in-memory | redis | kafka | mqtt; only in-memory is implemented */
        @NotBlank
        private String type = "in-memory";

        /** How long executeAgent waits for the correlated response */
        @NotNull
        private Duration responseTimeout = Duration.ofSeconds(30);

        /** Messages retained for getMessages */
        @PositiveOrZero
        private int historySize = 1000;
    }

    @Data
    public static class ReplayBuffer {
        /** in-memory | redis | database | file */
        @NotBlank
        private String type = "in-memory";

        @Positive
        private int maxSize = 10000;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double priorityThreshold = 0.7;

        private boolean usePrioritizedSampling = true;
        private boolean persistExperiences = false;
        private String filePath = "data/replay-buffer.jsonl";

        /** 0 keeps records forever */
        @PositiveOrZero
        private int retentionDays = 30;

        /** Fold a record into an earlier one with the same agent, type and input */
        private boolean deduplicateSimilar = false;
    }

    @Data
    public static class Training {
        private boolean enabled = false;

        @Positive
        private int bufferSizeThreshold = 1000;

        @Positive
        private int batchSize = 32;

        private Duration trainingInterval = Duration.ofHours(1);
    }

    /**
     * Supervision loop timing.
     */
    @Data
    public static class Monitoring {
        private boolean enabled = true;

        @NotNull
        private Duration healthCheckInterval = Duration.ofSeconds(60);

        @NotNull
        private Duration performanceCheckInterval = Duration.ofSeconds(300);

        @NotNull
        private Duration healthCheckTimeout = Duration.ofSeconds(5);

        /** Reinitializations of an unhealthy agent before an admin alert; 0 disables recovery */
        @PositiveOrZero
        private int maxRecoveryAttempts = SupervisionSettings.DEFAULT_MAX_RECOVERY_ATTEMPTS;

        @NotNull
        private Duration recoveryCooldown = SupervisionSettings.DEFAULT_RECOVERY_COOLDOWN;

        /** Broadcast a system_health notification after every health pass */
        private boolean broadcastHealthStatus = true;
    }

    @Data
    public static class Logger {
        private String level = "info";
        private boolean console = true;
        private boolean file = false;
        private String filePath = "logs/agent-system.log";
        private boolean remote = false;

        /** Events kept in memory for the status endpoint */
        @PositiveOrZero
        private int historySize = 1000;
    }

    @Data
    public static class Dashboard {
        private boolean enabled = true;
        private Duration refreshInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class Security {
        private boolean encryptSensitiveData = false;
        private String encryptionKey;

        public boolean hasEncryptionKey() {
            return encryptionKey != null && !encryptionKey.isBlank();
        }
    }

    @Data
    public static class Agent {
        @NotBlank
        private String id;
        private String name;
        private List<String> capabilities = new ArrayList<>();
        private boolean enabled = true;
        private Thresholds performanceThresholds;
        private Map<String, Object> settings = new HashMap<>();
    }

    @Data
    public static class Thresholds {
        private Double maxErrorRate;
        private Long maxAvgProcessingTimeMs;
        private Integer maxConsecutiveFailures;
    }

    // ── conversions into core types ──────────────────────────────────────────

    public List<AgentConfig> toAgentConfigs() {
        return agents.stream().map(AgentSystemProperties::toAgentConfig).toList();
    }

    public ReplaySettings toReplaySettings(ReplayBackend backend) {
        return new ReplaySettings(
            backend,
            replayBuffer.getMaxSize(),
            replayBuffer.getPriorityThreshold(),
            replayBuffer.isUsePrioritizedSampling(),
            replayBuffer.isPersistExperiences(),
            replayBuffer.getFilePath(),
            replayBuffer.getRetentionDays(),
            training.getBufferSizeThreshold(),
            replayBuffer.isDeduplicateSimilar()
        );
    }

    public SupervisionSettings toSupervisionSettings() {
        return new SupervisionSettings(
            monitoring.getHealthCheckInterval(),
            monitoring.getPerformanceCheckInterval(),
            monitoring.getHealthCheckTimeout(),
            monitoring.isEnabled(),
            monitoring.getMaxRecoveryAttempts(),
            monitoring.getRecoveryCooldown(),
            monitoring.isBroadcastHealthStatus()
        );
    }

    /**
     * Effective settings logged at startup and served by the health endpoint.
     * The encryption key itself never appears, only whether one is set.
     */
    public Map<String, Object> startupSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("systemName", systemName);
        summary.put("version", version);
        summary.put("environment", environment);
        summary.put("messageBroker", messageBroker.getType());
        summary.put("replayBuffer", replayBuffer.getType());
        summary.put("trainingEnabled", training.isEnabled());
        summary.put("trainingBatchSize", training.getBatchSize());
        summary.put("trainingInterval", String.valueOf(training.getTrainingInterval()));
        summary.put("trainingBufferThreshold", training.getBufferSizeThreshold());
        summary.put("dashboardEnabled", dashboard.isEnabled());
        summary.put("dashboardRefreshInterval", String.valueOf(dashboard.getRefreshInterval()));
        summary.put("encryptSensitiveData", security.isEncryptSensitiveData());
        summary.put("encryptionKeyConfigured", security.hasEncryptionKey());
        return summary;
    }

    private static AgentConfig toAgentConfig(Agent agent) {
        Thresholds t = agent.getPerformanceThresholds();
        PerformanceThresholds thresholds = t == null
            ? null
            : new PerformanceThresholds(t.getMaxErrorRate(), t.getMaxAvgProcessingTimeMs(), t.getMaxConsecutiveFailures());
        return new AgentConfig(agent.getId(), agent.getName(), agent.getCapabilities(),
                               agent.isEnabled(), thresholds, agent.getSettings());
    }
}
