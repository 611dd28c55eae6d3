package com.smartstream.transform.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import com.smartstream.transform.model.Route;
import com.smartstream.transform.model.RouteTable;
import com.smartstream.transform.model.RoutedRow;
import com.smartstream.transform.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a decoded value is written and where.
 *
 * <p>CDC envelopes ({@code data} + {@code metadata}) are routed by their source schema and table
 * through the {@link RouteTable}; replication control records and tables outside the allow-list
 * are dropped. Bare objects are accepted on the legacy route.
 */
@Service
public class EnvelopeRouter {

    private static final Logger logger = LoggerFactory.getLogger(EnvelopeRouter.class);

    static final String DATA_FIELD = "data";
    static final String METADATA_FIELD = "metadata";
    static final String CONTROL_TABLE_PREFIX = "awsdms_";
    static final String DATA_RECORD_TYPE = "data";

    // Lineage columns copied from the envelope metadata when enabled
    private static final ImmutableMap<String, String> LINEAGE_COLUMNS = ImmutableMap.of(
            "operation", "op_type",
            "timestamp", "source_timestamp",
            "transaction-id", "transaction_id",
            "schema-name", "schema_name",
            "table-name", "table_name"
    );

    private final RouteTable routeTable;
    private final Route legacyRoute;
    private final boolean includeCdcMetadata;

    public EnvelopeRouter(RouteTable routeTable,
                          Route legacyRoute,
                          @Value("${app.transform.include-cdc-metadata:false}") boolean includeCdcMetadata) {
        this.routeTable = routeTable;
        this.legacyRoute = legacyRoute;
        this.includeCdcMetadata = includeCdcMetadata;
    }

    public StageResult<RoutedRow> route(JsonNode value) {
        if (value == null || !value.isObject()) {
            String type = value == null ? "null" : value.getNodeType().name().toLowerCase(Locale.ROOT);
            logger.warn("Dropping decoded value of type {}: only JSON objects can be routed", type);
            return StageResult.skip("not an object: " + type);
        }

        if (!value.has(DATA_FIELD) || !value.has(METADATA_FIELD)) {
            // Producers that bypass the replication layer send bare rows; no schema/table filter applies
            logger.debug("Accepting bare row without CDC envelope on legacy route {}", legacyRoute);
            return StageResult.ok(new RoutedRow(legacyRoute, ((ObjectNode) value).deepCopy(), null));
        }

        JsonNode metadata = value.get(METADATA_FIELD);
        if (!metadata.isObject()) {
            logger.warn("Dropping envelope whose metadata is {} instead of an object", metadata.getNodeType());
            return StageResult.skip("metadata is not an object");
        }

        String tableName = lowerText(metadata, "table-name");
        String schemaName = lowerText(metadata, "schema-name");

        if (tableName.startsWith(CONTROL_TABLE_PREFIX)) {
            logger.debug("Dropping replication control record from table {}", tableName);
            return StageResult.skip("control table " + tableName);
        }

        JsonNode recordType = metadata.get("record-type");
        if (recordType != null && !recordType.isNull()
                && !DATA_RECORD_TYPE.equalsIgnoreCase(recordType.asText())) {
            logger.debug("Dropping {} record from {}.{}", recordType.asText(), schemaName, tableName);
            return StageResult.skip("record-type " + recordType.asText());
        }

        Optional<Route> route = routeTable.lookup(schemaName, tableName);
        if (route.isEmpty()) {
            logger.debug("No route for {}.{}; dropping record", schemaName, tableName);
            return StageResult.skip("no route for " + schemaName + "." + tableName);
        }

        JsonNode data = value.get(DATA_FIELD);
        if (!data.isObject()) {
            logger.warn("Dropping envelope for {}.{} whose data is {} instead of an object",
                    schemaName, tableName, data.getNodeType());
            return StageResult.skip("data is not an object");
        }

        ObjectNode row = ((ObjectNode) data).deepCopy();
        if (includeCdcMetadata) {
            addLineageColumns(row, metadata);
        }
        return StageResult.ok(new RoutedRow(route.get(), row, metadata));
    }

    private static void addLineageColumns(ObjectNode row, JsonNode metadata) {
        for (Map.Entry<String, String> lineage : LINEAGE_COLUMNS.entrySet()) {
            JsonNode metaValue = metadata.get(lineage.getKey());
            String column = lineage.getValue();
            if (metaValue != null && !row.has(column)) {
                row.set(column, metaValue);
            }
        }
    }

    private static String lowerText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return "";
        }
        return value.asText("").trim().toLowerCase(Locale.ROOT);
    }
}
