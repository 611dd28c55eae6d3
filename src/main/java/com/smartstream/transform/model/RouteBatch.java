package com.smartstream.transform.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Deduplicated records of one source object destined for a single route.
 */
public class RouteBatch {

    private final Route route;
    private final List<CleanedRecord> records = new ArrayList<>();
    private final Set<String> seenHashes = new HashSet<>();
    private int duplicatesDropped;

    public RouteBatch(Route route) {
        this.route = route;
    }

    /**
     * Appends the record unless a record with the same content hash is already present.
     *
     * @return true if the record was kept
     */
    public boolean addIfAbsent(String contentHash, CleanedRecord record) {
        if (!seenHashes.add(contentHash)) {
            duplicatesDropped++;
            return false;
        }
        records.add(record);
        return true;
    }

    /**
     * Returns the route this batch is written to.
     */
    public Route getRoute() { return route; }

    /**
     * Returns the retained records in first-seen order.
     */
    public List<CleanedRecord> getRecords() { return Collections.unmodifiableList(records); }

    /**
     * Returns how many records were rejected as duplicates.
     */
    public int getDuplicatesDropped() { return duplicatesDropped; }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
