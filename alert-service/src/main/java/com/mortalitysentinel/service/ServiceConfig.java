package com.mortalitysentinel.service;

import com.mortalitysentinel.core.model.ComplexityClass;

import java.time.Duration;

/**
 * Typed, immutable configuration of the alert service.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * service runs unchanged under Docker {@code -e} flags, a Kubernetes
 * Deployment or a cron shell.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * in tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // HTTP
    // ---------------------------------------------------------------
    private final int httpPort;

    // ---------------------------------------------------------------
    // Data and models
    // ---------------------------------------------------------------
    private final String dataDir;
    private final String modelsConfigPath;

    // ---------------------------------------------------------------
    // Chat delivery
    // ---------------------------------------------------------------
    private final String googleChatWebhookUrl;
    private final int webhookTimeoutSeconds;

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------
    private final int simpleModelTimeoutSeconds;
    private final int standardModelTimeoutSeconds;
    private final int extendedModelTimeoutSeconds;
    private final int evaluationThreads;

    private ServiceConfig(Builder b) {
        this.httpPort = b.httpPort;
        this.dataDir = b.dataDir;
        this.modelsConfigPath = b.modelsConfigPath;
        this.googleChatWebhookUrl = b.googleChatWebhookUrl;
        this.webhookTimeoutSeconds = b.webhookTimeoutSeconds;
        this.simpleModelTimeoutSeconds = b.simpleModelTimeoutSeconds;
        this.standardModelTimeoutSeconds = b.standardModelTimeoutSeconds;
        this.extendedModelTimeoutSeconds = b.extendedModelTimeoutSeconds;
        this.evaluationThreads = b.evaluationThreads;
    }

    // ---------------------------------------------------------------
    // Factory, resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .httpPort(parseIntEnv("HTTP_PORT", "8080"))
                    .dataDir(env("DATA_DIR", "data"))
                    .modelsConfigPath(env("MODELS_CONFIG_PATH", ""))
                    .googleChatWebhookUrl(env("GOOGLE_CHAT_WEBHOOK_URL", ""))
                    .webhookTimeoutSeconds(parseIntEnv("WEBHOOK_TIMEOUT_SECONDS", "30"))
                    .simpleModelTimeoutSeconds(parseIntEnv("SIMPLE_MODEL_TIMEOUT_SECONDS", "30"))
                    .standardModelTimeoutSeconds(parseIntEnv("STANDARD_MODEL_TIMEOUT_SECONDS", "60"))
                    .extendedModelTimeoutSeconds(parseIntEnv("EXTENDED_MODEL_TIMEOUT_SECONDS", "120"))
                    .evaluationThreads(parseIntEnv("EVALUATION_THREADS", "4"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Evaluation timeout of a model's complexity class.
     */
    public Duration timeoutFor(ComplexityClass complexityClass) {
        return switch (complexityClass) {
            case SIMPLE -> Duration.ofSeconds(simpleModelTimeoutSeconds);
            case STANDARD -> Duration.ofSeconds(standardModelTimeoutSeconds);
            case EXTENDED -> Duration.ofSeconds(extendedModelTimeoutSeconds);
        };
    }

    /**
     * @return {@code true} if a chat webhook is configured
     */
    public boolean isChatDeliveryEnabled() {
        return !googleChatWebhookUrl.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getHttpPort() {
        return httpPort;
    }

    public String getDataDir() {
        return dataDir;
    }

    public String getModelsConfigPath() {
        return modelsConfigPath;
    }

    public String getGoogleChatWebhookUrl() {
        return googleChatWebhookUrl;
    }

    public Duration getWebhookTimeout() {
        return Duration.ofSeconds(webhookTimeoutSeconds);
    }

    public int getEvaluationThreads() {
        return evaluationThreads;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (port in [1, 65535], timeouts and thread count &gt; 0, non-blank
     * data directory).
     * </p>
     */
    public static class Builder {
        private int httpPort = 8080;
        private String dataDir = "data";
        private String modelsConfigPath = "";
        private String googleChatWebhookUrl = "";
        private int webhookTimeoutSeconds = 30;
        private int simpleModelTimeoutSeconds = 30;
        private int standardModelTimeoutSeconds = 60;
        private int extendedModelTimeoutSeconds = 120;
        private int evaluationThreads = 4;

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder dataDir(String v) {
            this.dataDir = v;
            return this;
        }

        public Builder modelsConfigPath(String v) {
            this.modelsConfigPath = v == null ? "" : v;
            return this;
        }

        public Builder googleChatWebhookUrl(String v) {
            this.googleChatWebhookUrl = v == null ? "" : v;
            return this;
        }

        public Builder webhookTimeoutSeconds(int v) {
            this.webhookTimeoutSeconds = v;
            return this;
        }

        public Builder simpleModelTimeoutSeconds(int v) {
            this.simpleModelTimeoutSeconds = v;
            return this;
        }

        public Builder standardModelTimeoutSeconds(int v) {
            this.standardModelTimeoutSeconds = v;
            return this;
        }

        public Builder extendedModelTimeoutSeconds(int v) {
            this.extendedModelTimeoutSeconds = v;
            return this;
        }

        public Builder evaluationThreads(int v) {
            this.evaluationThreads = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            if (dataDir == null || dataDir.isBlank()) {
                throw new IllegalArgumentException("dataDir must not be null or blank");
            }
            if (httpPort < 1 || httpPort > 65_535) {
                throw new IllegalArgumentException("httpPort must be in [1, 65535], got: " + httpPort);
            }
            requirePositive(webhookTimeoutSeconds, "webhookTimeoutSeconds");
            requirePositive(simpleModelTimeoutSeconds, "simpleModelTimeoutSeconds");
            requirePositive(standardModelTimeoutSeconds, "standardModelTimeoutSeconds");
            requirePositive(extendedModelTimeoutSeconds, "extendedModelTimeoutSeconds");
            requirePositive(evaluationThreads, "evaluationThreads");

            return new ServiceConfig(this);
        }

        private static void requirePositive(int value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue).trim());
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "httpPort=" + httpPort +
                ", dataDir='" + dataDir + '\'' +
                ", modelsConfigPath='" + modelsConfigPath + '\'' +
                ", chatDeliveryEnabled=" + isChatDeliveryEnabled() +
                ", webhookTimeoutSeconds=" + webhookTimeoutSeconds +
                ", simpleModelTimeoutSeconds=" + simpleModelTimeoutSeconds +
                ", standardModelTimeoutSeconds=" + standardModelTimeoutSeconds +
                ", extendedModelTimeoutSeconds=" + extendedModelTimeoutSeconds +
                ", evaluationThreads=" + evaluationThreads +
                '}';
    }
}
