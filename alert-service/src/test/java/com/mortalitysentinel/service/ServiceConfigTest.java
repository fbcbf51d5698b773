package com.mortalitysentinel.service;

import com.mortalitysentinel.core.model.ComplexityClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Builder defaults should match the documented environment defaults")
    void shouldApplyDefaults() {
        ServiceConfig config = new ServiceConfig.Builder().build();

        assertThat(config.getHttpPort()).isEqualTo(8080);
        assertThat(config.getDataDir()).isEqualTo("data");
        assertThat(config.getModelsConfigPath()).isEmpty();
        assertThat(config.isChatDeliveryEnabled()).isFalse();
        assertThat(config.getWebhookTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getEvaluationThreads()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should map complexity classes to their timeouts")
    void shouldResolveTimeouts() {
        ServiceConfig config = new ServiceConfig.Builder()
                .simpleModelTimeoutSeconds(5)
                .standardModelTimeoutSeconds(10)
                .extendedModelTimeoutSeconds(20)
                .build();

        assertThat(config.timeoutFor(ComplexityClass.SIMPLE)).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.timeoutFor(ComplexityClass.STANDARD)).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.timeoutFor(ComplexityClass.EXTENDED)).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    @DisplayName("Should reject port out of range")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().httpPort(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("httpPort");
        assertThatThrownBy(() -> new ServiceConfig.Builder().httpPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject non-positive timeouts and thread counts")
    void shouldRejectNonPositiveValues() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().standardModelTimeoutSeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("standardModelTimeoutSeconds");
        assertThatThrownBy(() -> new ServiceConfig.Builder().evaluationThreads(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("evaluationThreads");
    }

    @Test
    @DisplayName("Should reject blank data directory")
    void shouldRejectBlankDataDir() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().dataDir(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toString should not expose the webhook URL")
    void shouldMaskWebhookUrl() {
        ServiceConfig config = new ServiceConfig.Builder()
                .googleChatWebhookUrl("https://chat.example.com/v1/spaces/x/messages?key=secret")
                .build();

        assertThat(config.isChatDeliveryEnabled()).isTrue();
        assertThat(config.toString()).doesNotContain("secret").contains("chatDeliveryEnabled=true");
    }
}
