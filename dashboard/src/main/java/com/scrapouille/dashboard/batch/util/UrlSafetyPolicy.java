package com.scrapouille.dashboard.batch.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rejects URLs the extraction service must never be pointed at: non-http schemes, loopback,
 * private and link-local ranges.
 */
public final class UrlSafetyPolicy {
    private static final Set<String> LOCALHOST_NAMES = Set.of("localhost", "127.0.0.1", "0.0.0.0", "::1", "[::1]");
    private static final Pattern SUSPICIOUS_HOST = Pattern.compile("[\\x00-\\x1f\\s]");

    private UrlSafetyPolicy() {
    }

    /**
     * @return a human readable reason when the URL is rejected, or {@code null} when it is allowed
     */
    public static String violation(String url) {
        if (url == null || url.isBlank()) {
            return "URL is required";
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return "Invalid URL format: " + e.getMessage();
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return "Only http/https protocols allowed (got: " + (scheme.isEmpty() ? "none" : scheme) + ")";
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return "Invalid URL: missing hostname";
        }
        host = host.toLowerCase(Locale.ROOT);
        if (SUSPICIOUS_HOST.matcher(host).find()) {
            return "Invalid characters in hostname";
        }
        if (LOCALHOST_NAMES.contains(host)) {
            return "Cannot scrape localhost URLs (security policy)";
        }
        if (host.startsWith("10.")) {
            return "Cannot scrape private IP addresses (10.0.0.0/8)";
        }
        if (host.startsWith("172.") && isInSecondOctetRange(host, 16, 31)) {
            return "Cannot scrape private IP addresses (172.16.0.0/12)";
        }
        if (host.startsWith("192.168.")) {
            return "Cannot scrape private IP addresses (192.168.0.0/16)";
        }
        if (host.startsWith("169.254.")) {
            return "Cannot access link-local addresses (169.254.0.0/16)";
        }
        String bareHost = host.startsWith("[") ? host.substring(1) : host;
        if (bareHost.contains(":") && (bareHost.startsWith("fc") || bareHost.startsWith("fd"))) {
            return "Cannot scrape private IPv6 addresses";
        }
        return null;
    }

    public static boolean isAllowed(String url) {
        return violation(url) == null;
    }

    private static boolean isInSecondOctetRange(String host, int min, int max) {
        String[] parts = host.split("\\.");
        if (parts.length < 2) {
            return false;
        }
        try {
            int second = Integer.parseInt(parts[1]);
            return second >= min && second <= max;
        } catch (NumberFormatException ignored) {
            return false;
        }
    }
}
