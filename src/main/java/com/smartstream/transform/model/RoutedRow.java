package com.smartstream.transform.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A row accepted by the router, with the route it belongs to.
 *
 * @param metadata the CDC metadata of the envelope, or null for a bare row
 */
public record RoutedRow(Route route, ObjectNode row, JsonNode metadata) {

    public boolean enveloped() {
        return metadata != null;
    }
}
