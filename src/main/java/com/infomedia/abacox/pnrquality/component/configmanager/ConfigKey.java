package com.infomedia.abacox.pnrquality.component.configmanager;

import lombok.Getter;

import java.util.Locale;

/**
 * Every tunable setting of the application with its default value, so the application can
 * always run without explicit configuration. Values are read from the {@code pnrquality.*}
 * properties.
 */
@Getter
public enum ConfigKey {

    // --- Time series ---
    TIME_ZONE("Africa/Nairobi"),
    DEFAULT_TREND_DAYS("30"),
    MAX_TREND_DAYS("365"),

    // --- Quality bands ---
    EXCELLENT_SCORE_THRESHOLD("80"),
    GOOD_SCORE_THRESHOLD("60");

    private final String defaultValue;

    ConfigKey(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    /**
     * Converts the enum's name from UPPER_SNAKE_CASE to lowerCamelCase,
     * e.g. MAX_TREND_DAYS becomes maxTrendDays.
     */
    public String getKey() {
        String[] parts = this.name().toLowerCase(Locale.ROOT).split("_");
        StringBuilder camelCase = new StringBuilder(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            camelCase.append(Character.toUpperCase(parts[i].charAt(0)))
                    .append(parts[i].substring(1));
        }
        return camelCase.toString();
    }

    public String getProperty() {
        return ConfigService.PROPERTY_PREFIX + getKey();
    }
}
