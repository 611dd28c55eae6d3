package com.smartstream.transform.model;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Allow-list of source tables, mapping {@code (schema-name, table-name)} to the route their rows
 * are written to. A schema of {@value #ANY_SCHEMA} matches the table in every schema; an exact
 * schema entry wins over it.
 */
public final class RouteTable {

    public static final String ANY_SCHEMA = "*";

    private final ImmutableMap<String, Route> routes;

    private RouteTable(ImmutableMap<String, Route> routes) {
        this.routes = routes;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up the route of a source table; names are compared case-insensitively.
     */
    public Optional<Route> lookup(String schemaName, String tableName) {
        if (tableName == null || tableName.isBlank()) {
            return Optional.empty();
        }
        String schema = normalize(schemaName);
        String table = normalize(tableName);
        Route exact = routes.get(key(schema, table));
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(routes.get(key(ANY_SCHEMA, table)));
    }

    /**
     * Returns every entry as {@code schema.table -> route}, in registration order.
     */
    public Map<String, Route> entries() {
        return routes;
    }

    public int size() {
        return routes.size();
    }

    @Override
    public String toString() {
        return "RouteTable" + routes;
    }

    private static String key(String schema, String table) {
        return schema + "." + table;
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {

        private final Map<String, Route> routes = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Routes rows of {@code schema.table} to {@code domain/table}.
         */
        public Builder add(String schemaName, String tableName, String domain) {
            String table = normalize(tableName);
            if (table.isEmpty()) {
                throw new IllegalArgumentException("Table name must not be blank for schema " + schemaName);
            }
            String schema = normalize(schemaName);
            String key = key(schema.isEmpty() ? ANY_SCHEMA : schema, table);
            Route route = new Route(domain, table);
            Route existing = routes.putIfAbsent(key, route);
            if (existing != null && !existing.equals(route)) {
                throw new IllegalArgumentException("Source table " + key + " is routed to both "
                        + existing + " and " + route);
            }
            return this;
        }

        /**
         * Builds the table. Repeating an entry is harmless; routing one {@code schema.table} to two
         * different routes is a configuration error and is rejected by {@link #add}.
         */
        public RouteTable build() {
            return new RouteTable(ImmutableMap.copyOf(routes));
        }
    }
}
