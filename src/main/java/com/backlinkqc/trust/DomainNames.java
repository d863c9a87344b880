package com.backlinkqc.trust;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Host-name helpers shared by link classification and anchor typing.
 */
public final class DomainNames {

    private DomainNames() {
    }

    public static String normalize(String domain) {
        if (domain == null) {
            return "";
        }
        String d = domain.trim().toLowerCase(Locale.ROOT);
        if (d.startsWith("www.")) {
            d = d.substring(4);
        }
        while (d.endsWith(".")) {
            d = d.substring(0, d.length() - 1);
        }
        return d;
    }

    /**
     * Extracts the normalized host of a URL. A URL without scheme is read as https.
     */
    public static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String candidate = url.trim();
        if (!candidate.contains("://")) {
            candidate = "https://" + candidate;
        }
        String host;
        try {
            host = new URI(candidate).getHost();
        } catch (URISyntaxException ex) {
            host = null;
        }
        if (host != null) {
            return normalize(host);
        }
        String withoutScheme = candidate.substring(candidate.indexOf("://") + 3);
        int slash = withoutScheme.indexOf('/');
        return normalize(slash >= 0 ? withoutScheme.substring(0, slash) : withoutScheme);
    }

    /** True when {@code host} is {@code domain} or one of its subdomains. */
    public static boolean belongsTo(String host, String domain) {
        String h = normalize(host);
        String d = normalize(domain);
        if (h.isEmpty() || d.isEmpty()) {
            return false;
        }
        return h.equals(d) || h.endsWith("." + d);
    }

    /**
     * Brand-like tokens of a host: every label except the top-level one,
     * split on hyphens. {@code "best-casino.example.se"} gives
     * {@code [best, casino, example]}.
     */
    public static List<String> brandTokens(String host) {
        String[] labels = normalize(host).split("\\.");
        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < labels.length - 1; i++) {
            for (String part : labels[i].split("-")) {
                if (!part.isBlank()) {
                    tokens.add(part);
                }
            }
        }
        return tokens;
    }
}
