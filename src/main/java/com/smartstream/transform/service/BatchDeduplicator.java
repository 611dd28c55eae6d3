package com.smartstream.transform.service;

import com.smartstream.transform.model.CleanedRecord;
import com.smartstream.transform.model.Route;
import com.smartstream.transform.model.RouteBatch;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Groups the cleaned records of one source object by route and drops exact content duplicates
 * inside each group. Nothing is remembered between objects.
 */
@Service
public class BatchDeduplicator {

    private final ContentHashingService contentHashingService;

    public BatchDeduplicator(ContentHashingService contentHashingService) {
        this.contentHashingService = contentHashingService;
    }

    /**
     * Starts an empty grouping for one source object.
     */
    public Grouping newGrouping() {
        return new Grouping();
    }

    public final class Grouping {

        private final Map<Route, RouteBatch> batches = new LinkedHashMap<>();

        private Grouping() {
        }

        /**
         * Adds the record to the batch of its route.
         *
         * @return false if an identical record was already added to that route
         */
        public boolean add(Route route, CleanedRecord record) {
            String contentHash = contentHashingService.hashJson(record.getFields());
            return batches.computeIfAbsent(route, RouteBatch::new).addIfAbsent(contentHash, record);
        }

        /**
         * Returns the batches in the order their routes were first seen.
         */
        public Map<Route, RouteBatch> batches() {
            return batches;
        }
    }
}
