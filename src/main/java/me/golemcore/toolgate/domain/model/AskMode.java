package me.golemcore.toolgate.domain.model;

import java.util.Locale;

public enum AskMode {

    OFF, ON_MISS, ALWAYS;

    public static AskMode parse(String value) {
        if (value == null || value.isBlank()) {
            return ON_MISS;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid ask mode: " + value + " (valid: off, on-miss, always)", e);
        }
    }
}
