package com.example.playout.timeline;

import java.util.Locale;

public enum DurationCategory {
    ID,
    SPOTS,
    SHORT_FORM,
    LONG_FORM;

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DurationCategory fromToken(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        String normalized = token.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return DurationCategory.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown duration category: " + token, e);
        }
    }
}
