package com.infomedia.abacox.pnrquality.component.configmanager;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigServiceTest {

    @Test
    void keysAreLowerCamelCase() {
        assertThat(ConfigKey.MAX_TREND_DAYS.getKey()).isEqualTo("maxTrendDays");
        assertThat(ConfigKey.TIME_ZONE.getProperty()).isEqualTo("pnrquality.timeZone");
    }

    @Test
    void fallsBackToDefaults() {
        ConfigService configService = new ConfigService(new MockEnvironment());

        assertThat(configService.getValue(ConfigKey.DEFAULT_TREND_DAYS).asInteger()).isEqualTo(30);
        assertThat(configService.getValue(ConfigKey.TIME_ZONE).asZoneId()).isEqualTo(ZoneId.of("Africa/Nairobi"));
        assertThat(configService.getConfigurationMap()).containsEntry("goodScoreThreshold", "60");
    }

    @Test
    void readsEnvironmentOverrides() {
        MockEnvironment environment = new MockEnvironment().withProperty("pnrquality.excellentScoreThreshold", "90");
        ConfigService configService = new ConfigService(environment);

        assertThat(configService.getValue(ConfigKey.EXCELLENT_SCORE_THRESHOLD).asInteger()).isEqualTo(90);
    }

    @Test
    void reportsUnconvertibleValues() {
        Value value = new Value("maxTrendDays", "many");

        assertThatThrownBy(value::asInteger)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxTrendDays");
    }
}
