package com.williamcallahan.movie_discovery_engine.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility methods for working with free-text catalog searches.
 * Keeps the client, the coalescer keys and the offline cache aligned
 * on what counts as "the same" search.
 */
public final class SearchQueryUtils {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CACHE_KEY_SANITIZER = Pattern.compile("[^\\p{L}\\p{M}\\p{N}_-]");

    private SearchQueryUtils() {
        // Utility class
    }

    /**
     * True when the query has nothing to search for. Such queries never reach the network.
     */
    public static boolean isBlank(String query) {
        return query == null || query.isBlank();
    }

    /**
     * Normalises a query for the remote API: trimmed, with inner whitespace runs collapsed.
     * Returns an empty string for null input.
     */
    public static String normalize(String query) {
        if (query == null) {
            return "";
        }
        return WHITESPACE.matcher(query.trim()).replaceAll(" ");
    }

    /**
     * Case-insensitive, key-safe fragment for coalescer and cache keys.
     * - "The  Matrix " and "the matrix" both become {@code the_matrix}
     * - Letters and digits of every script are kept, so "東京" and "大阪" stay distinct
     * - When punctuation or symbols are stripped, a hash of the full text is appended
     *   so "Alien!" and "Alien?" never share a key
     */
    public static String keyFragment(String query) {
        String canonical = Normalizer.normalize(normalize(query), Normalizer.Form.NFC)
            .toLowerCase(Locale.ROOT)
            .replace(' ', '_');
        String sanitized = CACHE_KEY_SANITIZER.matcher(canonical).replaceAll("");
        if (sanitized.length() == canonical.length()) {
            return sanitized;
        }
        return sanitized + "_" + Integer.toHexString(canonical.hashCode());
    }

    /**
     * Offline cache index name for a search
     */
    public static String searchIndexName(String query) {
        return "search_" + keyFragment(query);
    }
}
