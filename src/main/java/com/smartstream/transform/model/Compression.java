package com.smartstream.transform.model;

import java.util.List;
import java.util.Locale;

public enum Compression {
    NONE,
    GZIP;

    private static final List<String> GZIP_SUFFIXES = List.of(".gz", ".gzip");

    /**
     * Resolves the compression marker from the object key and the storage content encoding.
     */
    public static Compression detect(String key, String contentEncoding) {
        if (contentEncoding != null && contentEncoding.toLowerCase(Locale.ROOT).contains("gzip")) {
            return GZIP;
        }
        return compressionSuffix(key) != null ? GZIP : NONE;
    }

    /**
     * Returns the compression suffix the key ends with, or null if it has none.
     */
    public static String compressionSuffix(String key) {
        if (key == null) {
            return null;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String suffix : GZIP_SUFFIXES) {
            if (lower.endsWith(suffix)) {
                return key.substring(key.length() - suffix.length());
            }
        }
        return null;
    }
}
