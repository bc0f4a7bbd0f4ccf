package org.carball.ckmetrics.config;

import java.util.Locale;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH;

    public static OutputFormat fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both", e);
        }
    }
}
