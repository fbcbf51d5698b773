package com.mortalitysentinel.core.engine;

import com.mortalitysentinel.core.model.Comparison;
import com.mortalitysentinel.core.model.Metric;
import com.mortalitysentinel.core.model.ModelDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertModelFactory}.
 */
class AlertModelFactoryTest {

    @Test
    @DisplayName("Should create a baseline comparison model for highest historical")
    void shouldCreateHighestHistorical() {
        AlertModel model = AlertModelFactory.create(
                new ModelDefinition("m", "M", Metric.DEATHS, 3, Comparison.HIGHEST_HISTORICAL));

        assertThat(model).isInstanceOf(BaselineComparisonModel.class);
        assertThat(model.getDefinition().getId()).isEqualTo("m");
    }

    @Test
    @DisplayName("Should create a baseline comparison model for avg + 1 SD")
    void shouldCreateAvgPlusOneSd() {
        AlertModel model = AlertModelFactory.create(
                new ModelDefinition("m", "M", Metric.SMR, 6, Comparison.AVG_PLUS_1SD));

        assertThat(model).isInstanceOf(BaselineComparisonModel.class);
    }

    @Test
    @DisplayName("Should create a trend model for increasing trend")
    void shouldCreateTrend() {
        AlertModel model = AlertModelFactory.create(
                new ModelDefinition("t", "T", Metric.MORTALITY_RATE, 3, Comparison.INCREASING_TREND));

        assertThat(model).isInstanceOf(IncreasingTrendModel.class);
    }

    @Test
    @DisplayName("Should reject null definition")
    void shouldRejectNull() {
        assertThatThrownBy(() -> AlertModelFactory.create(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should reject invalid definition")
    void shouldRejectInvalidDefinition() {
        assertThatThrownBy(() -> AlertModelFactory.create(
                new ModelDefinition("bad", "Bad", Metric.DEATHS, 5, Comparison.HIGHEST_HISTORICAL)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("windowMonths");
    }
}
