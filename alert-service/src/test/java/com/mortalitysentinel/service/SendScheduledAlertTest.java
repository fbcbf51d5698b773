package com.mortalitysentinel.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the exit codes of {@link SendScheduledAlert}.
 */
class SendScheduledAlertTest {

    @Test
    @DisplayName("Unknown model should exit with status 1")
    void shouldFailForUnknownModel() {
        assertThat(SendScheduledAlert.run(new String[]{"model99"})).isEqualTo(1);
    }
}
