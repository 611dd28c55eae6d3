package com.smartstream.transform.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartstream.transform.model.Route;
import com.smartstream.transform.model.RouteTable;
import com.smartstream.transform.model.RoutedRow;
import com.smartstream.transform.model.StageResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EnvelopeRouterTest {

    private static final Route LEGACY = new Route("hr", "employees");

    private final ObjectMapper objectMapper = new ObjectMapper();

    private RouteTable routeTable;
    private EnvelopeRouter router;

    @BeforeEach
    void setUp() {
        routeTable = RouteTable.builder()
                .add("finance", "transactions", "finance")
                .add("finance", "accounts", "finance")
                .add(RouteTable.ANY_SCHEMA, "employees", "hr")
                .build();
        router = new EnvelopeRouter(routeTable, LEGACY, false);
    }

    @Test
    void routesAllowListedFinanceTable() throws Exception {
        StageResult<RoutedRow> result = router.route(json(
                "{\"data\":{\"txn_id\":7,\"amount\":12.5},"
                        + "\"metadata\":{\"schema-name\":\"finance\",\"table-name\":\"transactions\",\"record-type\":\"data\"}}"));

        assertThat(result.isOk()).isTrue();
        RoutedRow row = result.orElseThrow();
        assertThat(row.route()).isEqualTo(new Route("finance", "transactions"));
        assertThat(row.row().toString()).isEqualTo("{\"txn_id\":7,\"amount\":12.5}");
        assertThat(row.enveloped()).isTrue();
    }

    @Test
    void matchesSchemaAndTableCaseInsensitively() throws Exception {
        StageResult<RoutedRow> result = router.route(json(
                "{\"data\":{\"id\":1},\"metadata\":{\"schema-name\":\"FINANCE\",\"table-name\":\"Accounts\"}}"));

        assertThat(result.isOk()).isTrue();
        assertThat(result.orElseThrow().route()).isEqualTo(new Route("finance", "accounts"));
    }

    @Test
    void dropsReplicationControlRecords() throws Exception {
        StageResult<RoutedRow> result = router.route(json(
                "{\"data\":{\"status\":\"ok\"},\"metadata\":{\"schema-name\":\"finance\",\"table-name\":\"awsdms_status\"}}"));

        assertThat(result.isSkip()).isTrue();
        assertThat(result.getReason()).contains("awsdms_status");
    }

    @Test
    void dropsTablesOutsideAllowList() throws Exception {
        StageResult<RoutedRow> result = router.route(json(
                "{\"data\":{\"id\":1},\"metadata\":{\"schema-name\":\"finance\",\"table-name\":\"unknown_table\"}}"));

        assertThat(result.isSkip()).isTrue();
    }

    @Test
    void dropsFinanceTableFromOtherSchema() throws Exception {
        StageResult<RoutedRow> result = router.route(json(
                "{\"data\":{\"id\":1},\"metadata\":{\"schema-name\":\"sales\",\"table-name\":\"transactions\"}}"));

        assertThat(result.isSkip()).isTrue();
    }

    @Test
    void acceptsEmployeesFromAnySchema() throws Exception {
        StageResult<RoutedRow> result = router.route(json(
                "{\"data\":{\"id\":1,\"name\":\"Ann\"},\"metadata\":{\"schema-name\":\"people\",\"table-name\":\"employees\"}}"));

        assertThat(result.isOk()).isTrue();
        assertThat(result.orElseThrow().route()).isEqualTo(LEGACY);
    }

    @Test
    void dropsNonDataRecordTypes() throws Exception {
        StageResult<RoutedRow> result = router.route(json(
                "{\"data\":{},\"metadata\":{\"schema-name\":\"finance\",\"table-name\":\"transactions\",\"record-type\":\"control\"}}"));

        assertThat(result.isSkip()).isTrue();
        assertThat(result.getReason()).isEqualTo("record-type control");
    }

    @Test
    void acceptsBareRowOnLegacyRoute() throws Exception {
        StageResult<RoutedRow> result = router.route(json("{\"id\":1,\"name\":\"Ann\"}"));

        assertThat(result.isOk()).isTrue();
        assertThat(result.orElseThrow().route()).isEqualTo(LEGACY);
        assertThat(result.orElseThrow().enveloped()).isFalse();
        assertThat(result.orElseThrow().row().get("name").asText()).isEqualTo("Ann");
    }

    @Test
    void skipsValuesThatAreNotObjects() throws Exception {
        assertThat(router.route(json("[1,2]")).isSkip()).isTrue();
        assertThat(router.route(json("\"text\"")).isSkip()).isTrue();
        assertThat(router.route(json("42")).isSkip()).isTrue();
    }

    @Test
    void skipsEnvelopeWhoseDataIsNotAnObject() throws Exception {
        StageResult<RoutedRow> result = router.route(json(
                "{\"data\":\"oops\",\"metadata\":{\"schema-name\":\"finance\",\"table-name\":\"transactions\"}}"));

        assertThat(result.isSkip()).isTrue();
    }

    @Test
    void addsLineageColumnsWhenEnabled() throws Exception {
        EnvelopeRouter lineageRouter = new EnvelopeRouter(routeTable, LEGACY, true);

        StageResult<RoutedRow> result = lineageRouter.route(json(
                "{\"data\":{\"id\":1},\"metadata\":{\"schema-name\":\"finance\",\"table-name\":\"accounts\","
                        + "\"operation\":\"update\",\"timestamp\":\"2026-02-07T10:00:00.000000Z\",\"transaction-id\":42}}"));

        JsonNode row = result.orElseThrow().row();
        assertThat(row.get("op_type").asText()).isEqualTo("update");
        assertThat(row.get("source_timestamp").asText()).isEqualTo("2026-02-07T10:00:00.000000Z");
        assertThat(row.get("transaction_id").asInt()).isEqualTo(42);
        assertThat(row.get("schema_name").asText()).isEqualTo("finance");
        assertThat(row.get("table_name").asText()).isEqualTo("accounts");
    }

    @Test
    void doesNotModifyInputValue() throws Exception {
        JsonNode envelope = json("{\"data\":{\"id\":1},\"metadata\":{\"schema-name\":\"finance\",\"table-name\":\"accounts\",\"operation\":\"insert\"}}");
        String before = envelope.toString();

        new EnvelopeRouter(routeTable, LEGACY, true).route(envelope);

        assertThat(envelope.toString()).isEqualTo(before);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }
}
