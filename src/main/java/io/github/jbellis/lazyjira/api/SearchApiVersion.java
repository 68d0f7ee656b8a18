package io.github.jbellis.lazyjira.api;

import java.util.Locale;

/** Which search endpoint the client talks to. */
public enum SearchApiVersion {
    /** {@code GET search}: full issue bodies in the page. */
    LEGACY,
    /** {@code GET search/jql}: ids only, issues are fetched one by one. */
    JQL;

    public static SearchApiVersion fromConfigValue(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "legacy", "v2" -> LEGACY;
            case "jql", "current", "" -> JQL;
            default -> throw new IllegalArgumentException("Unknown search API: " + value);
        };
    }
}
