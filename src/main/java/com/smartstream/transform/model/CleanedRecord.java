package com.smartstream.transform.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A row after null stripping and timestamp normalization. Never empty.
 */
public class CleanedRecord {

    private final ObjectNode fields;

    /**
     * Wraps the cleaned fields; rejects an empty mapping.
     */
    public CleanedRecord(ObjectNode fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("A cleaned record must carry at least one field");
        }
        this.fields = fields;
    }

    /**
     * Returns the cleaned fields in their original insertion order.
     */
    public ObjectNode getFields() { return fields; }

    public JsonNode get(String fieldName) {
        return fields.get(fieldName);
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
