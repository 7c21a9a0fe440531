package com.jsanalyzer.analyze.config;

import java.util.Locale;

/**
 * Explicit per-rule switch, overriding the recommended preset.
 */
public enum RuleSetting {
    ON,
    OFF;

    /**
     * Parses a setting as written in configuration files: {@code "on"} or {@code "off"}, in any case.
     */
    public static RuleSetting parse(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "on" -> ON;
            case "off" -> OFF;
            default -> throw new IllegalArgumentException("Invalid rule setting '" + value + "', expected 'on' or 'off'");
        };
    }

    public String configValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
