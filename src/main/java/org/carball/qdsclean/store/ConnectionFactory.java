package org.carball.qdsclean.store;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Opens connections to the target database. User and password are optional when the URL carries them.
 * When {@code database} is set, every connection is checked with {@code DB_NAME()} and refused
 * if the server put it on another database.
 */
public record ConnectionFactory(String url, String user, String password, String database) {

    private static final String CURRENT_DATABASE = "SELECT DB_NAME()";

    public ConnectionFactory(String url) {
        this(url, null, null, null);
    }

    public ConnectionFactory(String url, String user, String password) {
        this(url, user, password, null);
    }

    public Connection open() throws SQLException {
        Connection conn = user == null
                ? DriverManager.getConnection(url)
                : DriverManager.getConnection(url, user, password);
        if (database != null) {
            try {
                verifyDatabase(conn);
            } catch (SQLException e) {
                conn.close();
                throw e;
            }
        }
        return conn;
    }

    private void verifyDatabase(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(CURRENT_DATABASE);
             ResultSet rs = stmt.executeQuery()) {
            String current = rs.next() ? rs.getString(1) : null;
            if (!database.equalsIgnoreCase(current)) {
                throw new SQLException("Connection is on database [" + current
                        + "] but the cleanup targets [" + database + "]");
            }
        }
    }

    @Override
    public String toString() {
        String masked = url.replaceAll("(?i)(password=)(\\{(?:[^}]|}})*}|[^;]*)", "$1***");
        return "ConnectionFactory{url='" + masked + "', user='" + user + "', database='" + database + "'}";
    }
}
