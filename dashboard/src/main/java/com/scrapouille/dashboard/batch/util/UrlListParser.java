package com.scrapouille.dashboard.batch.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns pasted text or uploaded file content into the ordered URL list of a batch.
 * Duplicates are kept: each occurrence becomes its own batch item.
 */
public final class UrlListParser {
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final String URL_PREFIX = "http";

    private UrlListParser() {
    }

    public static List<String> parse(String rawText, UrlSource source) {
        if (rawText == null || rawText.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String line : LINE_BREAK.split(rawText, -1)) {
            String candidate = switch (source) {
                case PASTED -> pastedValue(line);
                case CSV -> csvValue(line);
                case TEXT_FILE -> textFileValue(line);
            };
            if (candidate != null) {
                out.add(candidate);
            }
        }
        return out;
    }

    private static String pastedValue(String line) {
        String trimmed = line.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String csvValue(String line) {
        int comma = line.indexOf(',');
        String firstColumn = (comma >= 0 ? line.substring(0, comma) : line).trim();
        String value = stripQuotes(firstColumn);
        return value.startsWith(URL_PREFIX) ? value : null;
    }

    private static String textFileValue(String line) {
        String trimmed = line.trim();
        return trimmed.startsWith(URL_PREFIX) ? trimmed : null;
    }

    static String stripQuotes(String value) {
        String out = value;
        if (!out.isEmpty() && isQuote(out.charAt(0))) {
            out = out.substring(1);
        }
        if (!out.isEmpty() && isQuote(out.charAt(out.length() - 1))) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
