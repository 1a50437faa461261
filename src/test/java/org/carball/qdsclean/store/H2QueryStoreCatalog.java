package org.carball.qdsclean.store;

import org.carball.qdsclean.model.store.CatalogObject;
import org.carball.qdsclean.model.store.PlanRecord;
import org.carball.qdsclean.model.store.QueryRecord;
import org.carball.qdsclean.model.store.QueryText;
import org.carball.qdsclean.model.store.RuntimeStatsEntry;
import org.carball.qdsclean.model.store.WaitStatsEntry;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * An H2 database in SQL Server mode carrying the parts of the {@code sys} catalog the cleanup reads,
 * filled from an {@link InMemoryQueryStore}. {@code DB_NAME()} and {@code DATALENGTH()} are
 * registered as aliases of the functions below.
 */
public final class H2QueryStoreCatalog {

    private H2QueryStoreCatalog() {
        // Utility class - prevent instantiation
    }

    public static String newUrl() {
        return "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MSSQLServer;DATABASE_TO_UPPER=FALSE;DB_CLOSE_DELAY=-1";
    }

    /**
     * Creates the catalog in the database behind {@code url}; {@code DB_NAME()} will answer {@code currentDatabase}.
     */
    public static void create(String url, String currentDatabase, InMemoryQueryStore store) throws SQLException {
        try (Connection conn = new ConnectionFactory(url, "sa", "").open();
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE ALIAS DB_NAME FOR 'org.carball.qdsclean.store.H2QueryStoreCatalog.currentDatabase'");
            stmt.execute("CREATE ALIAS DATALENGTH FOR 'org.carball.qdsclean.store.H2QueryStoreCatalog.dataLength'");
            stmt.execute("CREATE TABLE catalog_identity (name VARCHAR(128))");
            stmt.execute("CREATE SCHEMA sys");
            // is_internal_query is a bit column on SQL Server; TINYINT keeps "= 1" valid here
            stmt.execute("""
                CREATE TABLE sys.query_store_query (
                    query_id BIGINT PRIMARY KEY,
                    query_text_id BIGINT NOT NULL,
                    object_id BIGINT NOT NULL,
                    is_internal_query TINYINT NOT NULL,
                    last_execution_time TIMESTAMP WITH TIME ZONE
                )
                """);
            stmt.execute("""
                CREATE TABLE sys.query_store_query_text (
                    query_text_id BIGINT PRIMARY KEY,
                    query_sql_text VARCHAR
                )
                """);
            stmt.execute("""
                CREATE TABLE sys.query_store_plan (
                    plan_id BIGINT PRIMARY KEY,
                    query_id BIGINT NOT NULL,
                    is_forced_plan BOOLEAN NOT NULL,
                    query_plan VARCHAR
                )
                """);
            stmt.execute("""
                CREATE TABLE sys.query_store_runtime_stats (
                    runtime_stats_id BIGINT PRIMARY KEY,
                    plan_id BIGINT NOT NULL,
                    count_executions BIGINT NOT NULL
                )
                """);
            stmt.execute("""
                CREATE TABLE sys.query_store_wait_stats (
                    wait_stats_id BIGINT PRIMARY KEY,
                    plan_id BIGINT NOT NULL
                )
                """);
            stmt.execute("CREATE TABLE sys.schemas (schema_id INT PRIMARY KEY, name VARCHAR(128) NOT NULL)");
            stmt.execute("""
                CREATE TABLE sys.objects (
                    object_id BIGINT PRIMARY KEY,
                    schema_id INT NOT NULL,
                    name VARCHAR(128) NOT NULL
                )
                """);

            try (PreparedStatement insert = conn.prepareStatement("INSERT INTO catalog_identity (name) VALUES (?)")) {
                insert.setString(1, currentDatabase);
                insert.executeUpdate();
            }
            copy(conn, store);
        }
    }

    private static void copy(Connection conn, InMemoryQueryStore store) throws SQLException {
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO sys.query_store_query VALUES (?, ?, ?, ?, ?)")) {
            for (QueryRecord query : store.getQueries()) {
                insert.setLong(1, query.queryId());
                insert.setLong(2, query.queryTextId());
                insert.setLong(3, query.objectId());
                insert.setInt(4, query.internal() ? 1 : 0);
                insert.setObject(5, query.lastExecutionTime());
                insert.executeUpdate();
            }
        }
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO sys.query_store_query_text VALUES (?, ?)")) {
            for (QueryText text : store.getQueryTexts()) {
                insert.setLong(1, text.queryTextId());
                insert.setString(2, text.sqlText());
                insert.executeUpdate();
            }
        }
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO sys.query_store_plan VALUES (?, ?, ?, ?)")) {
            for (PlanRecord plan : store.getPlans()) {
                insert.setLong(1, plan.planId());
                insert.setLong(2, plan.queryId());
                insert.setBoolean(3, plan.forced());
                insert.setString(4, plan.queryPlan());
                insert.executeUpdate();
            }
        }
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO sys.query_store_runtime_stats VALUES (?, ?, ?)")) {
            for (RuntimeStatsEntry entry : store.getRuntimeStats()) {
                insert.setLong(1, entry.runtimeStatsId());
                insert.setLong(2, entry.planId());
                insert.setLong(3, entry.countExecutions());
                insert.executeUpdate();
            }
        }
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO sys.query_store_wait_stats VALUES (?, ?)")) {
            for (WaitStatsEntry entry : store.getWaitStats()) {
                insert.setLong(1, entry.waitStatsId());
                insert.setLong(2, entry.planId());
                insert.executeUpdate();
            }
        }

        Map<String, Integer> schemaIds = new LinkedHashMap<>();
        try (PreparedStatement insertSchema = conn.prepareStatement("INSERT INTO sys.schemas VALUES (?, ?)");
             PreparedStatement insertObject = conn.prepareStatement("INSERT INTO sys.objects VALUES (?, ?, ?)")) {
            for (CatalogObject object : store.getObjects()) {
                Integer schemaId = schemaIds.get(object.schemaName());
                if (schemaId == null) {
                    schemaId = schemaIds.size() + 1;
                    schemaIds.put(object.schemaName(), schemaId);
                    insertSchema.setInt(1, schemaId);
                    insertSchema.setString(2, object.schemaName());
                    insertSchema.executeUpdate();
                }
                insertObject.setLong(1, object.objectId());
                insertObject.setInt(2, schemaId);
                insertObject.setString(3, object.objectName());
                insertObject.executeUpdate();
            }
        }
    }

    public static String currentDatabase(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT name FROM catalog_identity")) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    // NVARCHAR stores two bytes per character
    public static Long dataLength(String value) {
        return value == null ? null : 2L * value.length();
    }
}
