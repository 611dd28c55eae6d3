package com.smartstream.transform.config;

import com.google.common.base.Splitter;
import com.smartstream.transform.model.Route;
import com.smartstream.transform.model.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class RoutingConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(RoutingConfiguration.class);

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final Splitter ROUTE_SPLITTER = Splitter.on(':').trimResults().limit(2);
    private static final Splitter SOURCE_SPLITTER = Splitter.on('.').trimResults().omitEmptyStrings().limit(2);

    @Value("${app.routing.finance-schema:finance}")
    private String financeSchema;

    @Value("${app.routing.finance-tables:transactions,accounts}")
    private String financeTables;

    @Value("${app.routing.finance-domain:finance}")
    private String financeDomain;

    // Rows of this table are accepted from any schema, and bare rows without an envelope land here
    @Value("${app.routing.legacy-route:hr.employees}")
    private String legacyRoute;

    // Comma-separated schema.table:domain entries
    @Value("${app.routing.extra-routes:}")
    private String extraRoutes;

    @Bean
    public Route legacyRoute() {
        return Route.parse(legacyRoute);
    }

    @Bean
    public RouteTable routeTable(Route legacyRoute) {
        RouteTable table = buildRouteTable(financeSchema, financeTables, financeDomain, legacyRoute, extraRoutes);
        logger.info("Loaded route table with {} entries: {}", table.size(), table.entries().keySet());
        return table;
    }

    /**
     * Builds the route table from its configured parts.
     */
    static RouteTable buildRouteTable(String financeSchema,
                                      String financeTables,
                                      String financeDomain,
                                      Route legacyRoute,
                                      String extraRoutes) {
        RouteTable.Builder builder = RouteTable.builder();
        for (String table : LIST_SPLITTER.split(financeTables == null ? "" : financeTables)) {
            builder.add(financeSchema, table, financeDomain);
        }
        builder.add(RouteTable.ANY_SCHEMA, legacyRoute.table(), legacyRoute.domain());
        for (String entry : LIST_SPLITTER.split(extraRoutes == null ? "" : extraRoutes)) {
            List<String> parts = ROUTE_SPLITTER.splitToList(entry);
            List<String> source = parts.isEmpty() ? List.of() : SOURCE_SPLITTER.splitToList(parts.get(0));
            if (parts.size() != 2 || parts.get(1).isEmpty() || source.size() != 2) {
                throw new IllegalArgumentException("Extra route must look like schema.table:domain. Received: " + entry);
            }
            builder.add(source.get(0), source.get(1), parts.get(1));
        }
        return builder.build();
    }
}
