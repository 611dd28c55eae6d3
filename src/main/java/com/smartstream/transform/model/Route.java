package com.smartstream.transform.model;

import java.util.Locale;

/**
 * Destination of a cleaned record in the trusted zone, identified by domain and table.
 */
public record Route(String domain, String table) {

    public Route {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("Route domain must not be blank");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Route table must not be blank");
        }
        domain = domain.trim().toLowerCase(Locale.ROOT);
        table = table.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the {@code domain.table} form used in configuration.
     */
    public static Route parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Route must be of the form domain.table. Received: null");
        }
        int dot = value.indexOf('.');
        if (dot <= 0 || dot == value.length() - 1) {
            throw new IllegalArgumentException("Route must be of the form domain.table. Received: " + value);
        }
        return new Route(value.substring(0, dot), value.substring(dot + 1));
    }

    @Override
    public String toString() {
        return domain + "." + table;
    }
}
