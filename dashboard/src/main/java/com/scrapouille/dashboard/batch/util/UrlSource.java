package com.scrapouille.dashboard.batch.util;

import java.util.Locale;

public enum UrlSource {
    PASTED,
    CSV,
    TEXT_FILE;

    public static UrlSource fromFileName(String fileName) {
        if (fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            return CSV;
        }
        return TEXT_FILE;
    }

    public static UrlSource fromParam(String value) {
        if (value == null || value.isBlank()) {
            return PASTED;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "pasted", "paste" -> PASTED;
            case "csv" -> CSV;
            case "text", "txt", "text_file" -> TEXT_FILE;
            default -> throw new IllegalArgumentException("Unknown URL source: " + value);
        };
    }
}
