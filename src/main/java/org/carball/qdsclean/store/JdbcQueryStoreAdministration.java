package org.carball.qdsclean.store;

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Calls the Query Store maintenance procedures of the database the connection points at.
 */
public class JdbcQueryStoreAdministration implements QueryStoreAdministration {

    private static final String UNFORCE_PLAN = "{call sys.sp_query_store_unforce_plan(?, ?)}";
    private static final String REMOVE_QUERY = "{call sys.sp_query_store_remove_query(?)}";

    private final ConnectionFactory connectionFactory;

    public JdbcQueryStoreAdministration(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    @Override
    public void unforcePlan(long queryId, long planId) throws SQLException {
        try (Connection conn = connectionFactory.open();
             CallableStatement stmt = conn.prepareCall(UNFORCE_PLAN)) {
            stmt.setLong(1, queryId);
            stmt.setLong(2, planId);
            stmt.execute();
        }
    }

    @Override
    public void removeQuery(long queryId) throws SQLException {
        try (Connection conn = connectionFactory.open();
             CallableStatement stmt = conn.prepareCall(REMOVE_QUERY)) {
            stmt.setLong(1, queryId);
            stmt.execute();
        }
    }

    @Override
    public String describeUnforcePlan(long queryId, long planId) {
        return "EXEC sys.sp_query_store_unforce_plan @query_id = " + queryId + ", @plan_id = " + planId + ";";
    }

    @Override
    public String describeRemoveQuery(long queryId) {
        return "EXEC sys.sp_query_store_remove_query @query_id = " + queryId + ";";
    }
}
