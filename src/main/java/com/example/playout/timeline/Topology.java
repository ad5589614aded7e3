package com.example.playout.timeline;

import java.util.Locale;

public enum Topology {
    DAILY(1),
    WEEKLY(7),
    MONTHLY(31);

    private final int defaultDays;

    Topology(int defaultDays) {
        this.defaultDays = defaultDays;
    }

    public int getDefaultDays() {
        return defaultDays;
    }

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts the lower-case tokens used by template files ("daily", "weekly", "monthly").
     */
    public static Topology fromToken(String token) {
        if (token == null || token.isBlank()) {
            return DAILY;
        }
        try {
            return Topology.valueOf(token.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown template type: " + token, e);
        }
    }
}
