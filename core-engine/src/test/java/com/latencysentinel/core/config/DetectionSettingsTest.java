package com.latencysentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionSettings}.
 */
class DetectionSettingsTest {

    @Test
    @DisplayName("Defaults are window 20, threshold 3, history 50, relative policy")
    void shouldExposeDefaults() {
        DetectionSettings settings = DetectionSettings.defaults();

        assertThat(settings.getWindowSize()).isEqualTo(20);
        assertThat(settings.getThreshold()).isEqualTo(3.0);
        assertThat(settings.getHistoryLimit()).isEqualTo(50);
        assertThat(settings.getPolicy()).isEqualTo("relative");
        assertThatCode(settings::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should collect every validation error in one exception")
    void shouldCollectAllErrors() {
        DetectionSettings settings = new DetectionSettings();
        settings.setWindowSize(0);
        settings.setThreshold(-1);
        settings.setHistoryLimit(1);
        settings.setPolicy("magic");

        assertThatThrownBy(settings::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("windowSize")
                .hasMessageContaining("threshold")
                .hasMessageContaining("historyLimit")
                .hasMessageContaining("Unknown policy");
    }

    @Test
    @DisplayName("Should reject non-finite thresholds")
    void shouldRejectNonFiniteThreshold() {
        DetectionSettings settings = new DetectionSettings();
        settings.setThreshold(Double.POSITIVE_INFINITY);

        assertThatThrownBy(settings::validate).isInstanceOf(IllegalStateException.class);

        settings.setThreshold(Double.NaN);
        assertThatThrownBy(settings::validate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Policy names are normalised to lowercase")
    void shouldNormalisePolicy() {
        DetectionSettings settings = new DetectionSettings();
        settings.setPolicy("SIGMA-BAND");

        assertThat(settings.getPolicy()).isEqualTo("sigma-band");
        assertThatCode(settings::validate).doesNotThrowAnyException();
    }
}
