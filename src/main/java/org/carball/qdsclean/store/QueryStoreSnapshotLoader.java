package org.carball.qdsclean.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.qdsclean.model.store.CatalogObject;
import org.carball.qdsclean.model.store.PlanRecord;
import org.carball.qdsclean.model.store.QueryRecord;
import org.carball.qdsclean.model.store.RuntimeStatsEntry;
import org.carball.qdsclean.model.store.WaitStatsEntry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Loads a JSON export of a database's Query Store into an {@link InMemoryQueryStore}.
 * Retention is measured from the export timestamp, so a preview selects what a cleanup
 * at export time would have selected.
 */
@Slf4j
public class QueryStoreSnapshotLoader {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public InMemoryQueryStore load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Query Store export file not found: " + path);
        }
        JsonNode exportData = objectMapper.readTree(Files.readString(path));
        validateExportFormat(exportData);

        JsonNode metadata = exportData.get("export_metadata");
        String databaseName = metadata.get("database_name").asText();
        String serverName = metadata.path("server_name").asText("snapshot");
        String state = metadata.path("database_state").asText(InMemoryQueryStore.ONLINE);

        Clock clock = metadata.has("export_timestamp")
                ? Clock.fixed(parseTimestamp(metadata.get("export_timestamp").asText()).toInstant(), ZoneOffset.UTC)
                : Clock.systemUTC();

        InMemoryQueryStore store = new InMemoryQueryStore(databaseName, state, serverName, clock);

        for (JsonNode node : exportData.get("queries")) {
            long queryId = node.get("query_id").asLong();
            QueryRecord query = new QueryRecord(
                    queryId,
                    node.path("query_text_id").asLong(queryId),
                    node.path("object_id").asLong(0),
                    node.hasNonNull("last_execution_time") ? parseTimestamp(node.get("last_execution_time").asText()) : null,
                    node.path("is_internal_query").asBoolean(false)
            );
            store.addQuery(query, node.path("query_sql_text").asText(null));
        }
        for (JsonNode node : exportData.get("plans")) {
            store.addPlan(new PlanRecord(
                    node.get("plan_id").asLong(),
                    node.get("query_id").asLong(),
                    node.path("is_forced_plan").asBoolean(false),
                    node.path("query_plan").asText(null)
            ));
        }
        for (JsonNode node : exportData.path("runtime_stats")) {
            store.addRuntimeStats(new RuntimeStatsEntry(
                    node.path("runtime_stats_id").asLong(),
                    node.get("plan_id").asLong(),
                    node.path("count_executions").asLong(0)
            ));
        }
        for (JsonNode node : exportData.path("wait_stats")) {
            store.addWaitStats(new WaitStatsEntry(
                    node.path("wait_stats_id").asLong(),
                    node.get("plan_id").asLong()
            ));
        }
        for (JsonNode node : exportData.path("objects")) {
            store.addObject(new CatalogObject(
                    node.get("object_id").asLong(),
                    node.path("schema_name").asText("dbo"),
                    node.get("object_name").asText()
            ));
        }

        log.info("Loaded Query Store snapshot of [{}]: {} queries, {} plans",
                databaseName, store.countQueries(), store.getPlans().size());
        return store;
    }

    private void validateExportFormat(JsonNode exportData) {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in export file");
        }

        JsonNode metadata = exportData.get("export_metadata");
        if (metadata == null) {
            throw new IllegalStateException("Missing export_metadata section in export file");
        }
        if (!metadata.has("database_name")) {
            throw new IllegalStateException("Missing required metadata field: database_name");
        }

        String[] requiredSections = {"queries", "plans"};
        for (String section : requiredSections) {
            JsonNode node = exportData.get(section);
            if (node == null || !node.isArray()) {
                throw new IllegalStateException("Missing or invalid " + section + " section in export file");
            }
        }
    }

    private static OffsetDateTime parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Invalid timestamp in export file: " + value, e);
        }
    }
}
