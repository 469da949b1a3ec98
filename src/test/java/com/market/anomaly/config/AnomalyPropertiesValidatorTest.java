package com.market.anomaly.config;

import com.market.anomaly.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnomalyPropertiesValidatorTest {

    private AnomalyProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AnomalyProperties();
    }

    @Test
    void validate_defaults_accepted() {
        assertThatCode(() -> AnomalyPropertiesValidator.validate(properties)).doesNotThrowAnyException();
    }

    @Test
    void validate_windowSpanAboveThirtyMinutes_rejected() {
        properties.getWindow().setSpan(Duration.ofMinutes(45));

        assertThatThrownBy(() -> AnomalyPropertiesValidator.validate(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("anomaly.window.span");
    }

    @Test
    void validate_windowSpanBelowFifteenMinutes_rejected() {
        properties.getWindow().setSpan(Duration.ofMinutes(10));

        assertThatThrownBy(() -> AnomalyPropertiesValidator.validate(properties))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void validate_ruleWindowLongerThanSpan_rejected() {
        properties.getWindow().setSpan(Duration.ofMinutes(20));

        // the 30m volume baseline no longer fits
        assertThatThrownBy(() -> AnomalyPropertiesValidator.validate(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("volume-baseline-window");
    }

    @Test
    void validate_zeroMinSamples_rejected() {
        properties.getWindow().setMinSamples(0);

        assertThatThrownBy(() -> AnomalyPropertiesValidator.validate(properties))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void validate_unorderedWeights_rejected() {
        properties.getScoring().getWeights().setMedium(40);

        assertThatThrownBy(() -> AnomalyPropertiesValidator.validate(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("weights");
    }

    @Test
    void validate_negativeWeight_rejected() {
        properties.getScoring().getWeights().setLow(-1);

        assertThatThrownBy(() -> AnomalyPropertiesValidator.validate(properties))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void validate_greenThresholdAboveNeutral_rejected() {
        properties.getScoring().setGreenThreshold(55);

        assertThatThrownBy(() -> AnomalyPropertiesValidator.validate(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("green < 50 < red");
    }

    @Test
    void validate_negativeMaxAlerts_rejected() {
        properties.getNotification().setMaxAlertsPerHour(-1);

        assertThatThrownBy(() -> AnomalyPropertiesValidator.validate(properties))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void validate_zeroMaxAlerts_accepted() {
        properties.getNotification().setMaxAlertsPerHour(0);

        assertThatCode(() -> AnomalyPropertiesValidator.validate(properties)).doesNotThrowAnyException();
    }

    @Test
    void validate_zeroCooldown_rejected() {
        properties.getNotification().setCooldown(Duration.ZERO);

        assertThatThrownBy(() -> AnomalyPropertiesValidator.validate(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("cooldown");
    }

    @Test
    void validate_nonPositiveSpikeRatio_rejected() {
        properties.getRules().setVolumeSpikeRatio(0);

        assertThatThrownBy(() -> AnomalyPropertiesValidator.validate(properties))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void validate_bombRateAboveOne_rejected() {
        properties.getRules().setBombRateThreshold(30);

        assertThatThrownBy(() -> AnomalyPropertiesValidator.validate(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("bomb-rate-threshold");
    }

    @Test
    void validateOnStartup_invalidProperties_failsBean() {
        properties.getPipeline().setRuleThreads(0);
        AnomalyPropertiesValidator validator = new AnomalyPropertiesValidator(properties);

        assertThatThrownBy(validator::validateOnStartup).isInstanceOf(ConfigurationException.class);
    }
}
