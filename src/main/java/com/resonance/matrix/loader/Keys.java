package com.resonance.matrix.loader;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization helpers for slugs and paths.
 */
public final class Keys {

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");
    private static final Pattern TRAILING_SLASHES = Pattern.compile("/+$");

    private Keys() {
    }

    /**
     * Lower-cases, trims, collapses every run of non-alphanumerics into a dash and
     * strips leading and trailing dashes. Null becomes the empty string.
     */
    public static String normalizeKey(String value) {
        if (value == null) {
            return "";
        }
        String lowered = value.toLowerCase(Locale.ROOT).trim();
        String dashed = NON_ALNUM.matcher(lowered).replaceAll("-");
        return EDGE_DASHES.matcher(dashed).replaceAll("");
    }

    /**
     * Strips trailing slashes. Null stays null.
     */
    public static String normalizePath(String path) {
        if (path == null) {
            return null;
        }
        return TRAILING_SLASHES.matcher(path.trim()).replaceAll("");
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
