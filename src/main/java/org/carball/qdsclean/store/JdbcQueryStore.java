package org.carball.qdsclean.store;

import lombok.extern.slf4j.Slf4j;
import org.carball.qdsclean.config.RetentionThresholds;
import org.carball.qdsclean.model.cleanup.DeletionCandidate;
import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.model.store.PlanFootprint;
import org.carball.qdsclean.model.store.QueryFootprint;
import org.carball.qdsclean.selector.RetentionPredicates;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Reads the Query Store catalog views of the database the connection points at.
 * The retention cutoff is computed from the local clock and bound as a parameter, so the
 * stale categories agree with {@link RetentionPredicates} for the same instant.
 */
@Slf4j
public class JdbcQueryStore implements QueryStoreRepository {

    // SQL Server accepts at most 2100 parameters per statement
    static final int MAX_IDS_PER_STATEMENT = 1000;

    private static final String DATABASE_STATE = """
        SELECT state_desc FROM sys.databases WHERE name = ?
    """;

    private static final String QUERY_COUNT = "SELECT COUNT(*) FROM sys.query_store_query";

    private static final String ADHOC_STALE_QUERIES = """
        SELECT qsq.query_id, qsp.plan_id, qsp.is_forced_plan
        FROM sys.query_store_query AS qsq
        JOIN sys.query_store_plan AS qsp ON qsp.query_id = qsq.query_id
        JOIN sys.query_store_runtime_stats AS qsrs ON qsrs.plan_id = qsp.plan_id
        WHERE qsq.object_id = 0
        GROUP BY qsq.query_id, qsp.plan_id, qsp.is_forced_plan
        HAVING SUM(qsrs.count_executions) < ?
           AND MAX(qsq.last_execution_time) < ?
        ORDER BY qsq.query_id, qsp.plan_id
    """;

    private static final String STALE_QUERIES = """
        SELECT qsq.query_id, qsp.plan_id, qsp.is_forced_plan
        FROM sys.query_store_query AS qsq
        JOIN sys.query_store_plan AS qsp ON qsp.query_id = qsq.query_id
        JOIN sys.query_store_runtime_stats AS qsrs ON qsrs.plan_id = qsp.plan_id
        GROUP BY qsq.query_id, qsp.plan_id, qsp.is_forced_plan
        HAVING SUM(qsrs.count_executions) < ?
           AND MAX(qsq.last_execution_time) < ?
        ORDER BY qsq.query_id, qsp.plan_id
    """;

    private static final String INTERNAL_QUERIES = """
        SELECT qsq.query_id, qsp.plan_id, qsp.is_forced_plan
        FROM sys.query_store_query AS qsq
        JOIN sys.query_store_plan AS qsp ON qsp.query_id = qsq.query_id
        WHERE qsq.is_internal_query = 1
        ORDER BY qsq.query_id, qsp.plan_id
    """;

    private static final String ORPHAN_QUERIES = """
        SELECT qsq.query_id, qsp.plan_id, qsp.is_forced_plan
        FROM sys.query_store_query AS qsq
        JOIN sys.query_store_plan AS qsp ON qsp.query_id = qsq.query_id
        WHERE qsq.object_id <> 0
          AND qsq.object_id NOT IN (SELECT object_id FROM sys.objects)
        ORDER BY qsq.query_id, qsp.plan_id
    """;

    private static final String QUERY_FOOTPRINTS = """
        SELECT qsq.query_id,
               qsq.object_id,
               s.name AS schema_name,
               o.name AS object_name,
               qsq.last_execution_time,
               qsqt.query_sql_text,
               ISNULL(DATALENGTH(qsqt.query_sql_text), 0) AS text_bytes
        FROM sys.query_store_query AS qsq
        LEFT JOIN sys.query_store_query_text AS qsqt ON qsqt.query_text_id = qsq.query_text_id
        LEFT JOIN sys.objects AS o ON o.object_id = qsq.object_id AND qsq.object_id <> 0
        LEFT JOIN sys.schemas AS s ON s.schema_id = o.schema_id
        WHERE qsq.query_id IN (%s)
        ORDER BY qsq.query_id
    """;

    private static final String PLAN_FOOTPRINTS = """
        SELECT qsp.plan_id,
               qsp.query_id,
               ISNULL(DATALENGTH(qsp.query_plan), 0) AS plan_bytes,
               (SELECT COUNT(*)
                FROM sys.query_store_runtime_stats AS qsrs
                WHERE qsrs.plan_id = qsp.plan_id) AS runtime_rows,
               (SELECT ISNULL(SUM(qsrs.count_executions), 0)
                FROM sys.query_store_runtime_stats AS qsrs
                WHERE qsrs.plan_id = qsp.plan_id) AS executions,
               (SELECT COUNT(*)
                FROM sys.query_store_wait_stats AS qsws
                WHERE qsws.plan_id = qsp.plan_id) AS wait_rows
        FROM sys.query_store_plan AS qsp
        WHERE qsp.plan_id IN (%s)
        ORDER BY qsp.plan_id
    """;

    private final ConnectionFactory connectionFactory;
    private final Clock clock;

    public JdbcQueryStore(ConnectionFactory connectionFactory, Clock clock) {
        this.connectionFactory = connectionFactory;
        this.clock = clock;
    }

    @Override
    public Optional<String> findDatabaseState(String databaseName) throws SQLException {
        try (Connection conn = connectionFactory.open();
             PreparedStatement stmt = conn.prepareStatement(DATABASE_STATE)) {
            stmt.setString(1, databaseName);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        }
    }

    @Override
    public String getServerName() throws SQLException {
        try (Connection conn = connectionFactory.open();
             PreparedStatement stmt = conn.prepareStatement("SELECT @@SERVERNAME");
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    @Override
    public long countQueries() throws SQLException {
        try (Connection conn = connectionFactory.open();
             PreparedStatement stmt = conn.prepareStatement(QUERY_COUNT);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    @Override
    public List<DeletionCandidate> findCandidates(QueryCategory category, RetentionThresholds thresholds)
            throws SQLException {
        String sql = candidateQuery(category);
        log.debug("Selecting {} candidates:\n{}", category.getLabel(), sql);

        List<DeletionCandidate> results = new ArrayList<>();
        try (Connection conn = connectionFactory.open();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (category == QueryCategory.ADHOC_STALE || category == QueryCategory.STALE) {
                stmt.setInt(1, thresholds.minExecutionCount());
                stmt.setObject(2, RetentionPredicates.retentionCutoff(thresholds, OffsetDateTime.now(clock)));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(new DeletionCandidate(
                            category,
                            rs.getLong("query_id"),
                            rs.getLong("plan_id"),
                            rs.getBoolean("is_forced_plan")
                    ));
                }
            }
        }
        return results;
    }

    @Override
    public List<QueryFootprint> findQueryFootprints(Collection<Long> queryIds) throws SQLException {
        List<QueryFootprint> results = new ArrayList<>();
        for (List<Long> chunk : chunk(queryIds)) {
            String sql = String.format(QUERY_FOOTPRINTS, placeholders(chunk.size()));
            try (Connection conn = connectionFactory.open();
                 PreparedStatement stmt = conn.prepareStatement(sql)) {
                bindIds(stmt, chunk);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        results.add(new QueryFootprint(
                                rs.getLong("query_id"),
                                rs.getLong("object_id"),
                                rs.getString("schema_name"),
                                rs.getString("object_name"),
                                rs.getObject("last_execution_time", OffsetDateTime.class),
                                rs.getString("query_sql_text"),
                                rs.getLong("text_bytes")
                        ));
                    }
                }
            }
        }
        return results;
    }

    @Override
    public List<PlanFootprint> findPlanFootprints(Collection<Long> planIds) throws SQLException {
        List<PlanFootprint> results = new ArrayList<>();
        for (List<Long> chunk : chunk(planIds)) {
            String sql = String.format(PLAN_FOOTPRINTS, placeholders(chunk.size()));
            try (Connection conn = connectionFactory.open();
                 PreparedStatement stmt = conn.prepareStatement(sql)) {
                bindIds(stmt, chunk);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        results.add(new PlanFootprint(
                                rs.getLong("plan_id"),
                                rs.getLong("query_id"),
                                rs.getLong("plan_bytes"),
                                rs.getLong("runtime_rows"),
                                rs.getLong("wait_rows"),
                                rs.getLong("executions")
                        ));
                    }
                }
            }
        }
        return results;
    }

    static String candidateQuery(QueryCategory category) {
        switch (category) {
            case ADHOC_STALE:
                return ADHOC_STALE_QUERIES;
            case STALE:
                return STALE_QUERIES;
            case INTERNAL:
                return INTERNAL_QUERIES;
            case ORPHAN:
                return ORPHAN_QUERIES;
            default:
                throw new IllegalArgumentException("Unsupported category: " + category);
        }
    }

    static List<List<Long>> chunk(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return Collections.emptyList();
        }
        List<Long> all = new ArrayList<>(ids);
        List<List<Long>> chunks = new ArrayList<>();
        for (int from = 0; from < all.size(); from += MAX_IDS_PER_STATEMENT) {
            chunks.add(all.subList(from, Math.min(from + MAX_IDS_PER_STATEMENT, all.size())));
        }
        return chunks;
    }

    static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private static void bindIds(PreparedStatement stmt, List<Long> ids) throws SQLException {
        for (int i = 0; i < ids.size(); i++) {
            stmt.setLong(i + 1, ids.get(i));
        }
    }
}
