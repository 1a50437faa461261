package org.carball.qdsclean.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.model.report.CleanupParameters;
import org.carball.qdsclean.report.SizeEstimator;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@Slf4j
public class CleanupConfig {

    private String databaseName;

    // Category toggles
    @Builder.Default
    private boolean cleanAdhocStale = false;

    @Builder.Default
    private boolean cleanStale = true;

    @Builder.Default
    private boolean cleanInternal = true;

    @Builder.Default
    private boolean cleanOrphan = true;

    // Stale thresholds
    @Builder.Default
    private int retentionHours = RetentionThresholds.DEFAULT_RETENTION_HOURS;

    @Builder.Default
    private int minExecutionCount = RetentionThresholds.DEFAULT_MIN_EXECUTION_COUNT;

    // Summary report
    private boolean reportAsTable;
    private boolean reportAsText;
    private String reportOutputTable;

    // Query details report
    private boolean queryDetailsAsTable;
    private String queryDetailsOutputTable;

    private String reportJsonFile;

    // Size estimation, bytes per statistics row
    @Builder.Default
    private int runtimeStatsRowBytes = SizeEstimator.DEFAULT_RUNTIME_STATS_ROW_BYTES;

    @Builder.Default
    private int waitStatsRowBytes = SizeEstimator.DEFAULT_WAIT_STATS_ROW_BYTES;

    // Run mode
    private boolean test;
    private boolean verbose;
    private boolean debug;

    // Store binding
    private String jdbcUrl;
    private String user;

    @ToString.Exclude
    private String password;

    private String snapshotFile;

    public RetentionThresholds getThresholds() {
        return new RetentionThresholds(retentionHours, minExecutionCount);
    }

    /**
     * Categories to select, in selection order. Stale cleanup covers ad-hoc queries too,
     * so the ad-hoc stale pass only runs when stale cleanup is off.
     */
    public List<QueryCategory> getEnabledCategories() {
        List<QueryCategory> categories = new ArrayList<>();
        if (cleanAdhocStale && !cleanStale) {
            categories.add(QueryCategory.ADHOC_STALE);
        }
        if (cleanStale) {
            categories.add(QueryCategory.STALE);
        }
        if (cleanInternal) {
            categories.add(QueryCategory.INTERNAL);
        }
        if (cleanOrphan) {
            categories.add(QueryCategory.ORPHAN);
        }
        return categories;
    }

    public boolean isSummaryRequested() {
        return reportAsTable || reportAsText || reportOutputTable != null || reportJsonFile != null;
    }

    public boolean isDetailsRequested() {
        return queryDetailsAsTable || queryDetailsOutputTable != null || reportJsonFile != null;
    }

    public boolean isSnapshotMode() {
        return snapshotFile != null;
    }

    public CleanupParameters toParameters() {
        return new CleanupParameters(cleanAdhocStale, cleanStale, retentionHours,
                minExecutionCount, cleanOrphan, cleanInternal);
    }

    /**
     * Points the JDBC URL at the target database. A {@code databaseName} or {@code database}
     * property already in the URL must name the same database; it is replaced by a brace-quoted one.
     */
    public String resolveJdbcUrl() {
        if (jdbcUrl == null || databaseName == null) {
            return jdbcUrl;
        }
        List<String> parts = splitUrlProperties(jdbcUrl);
        StringBuilder url = new StringBuilder(parts.get(0)).append(';');
        for (String property : parts.subList(1, parts.size())) {
            if (property.isBlank()) {
                continue;
            }
            int separator = property.indexOf('=');
            String key = separator < 0 ? property.trim() : property.substring(0, separator).trim();
            if (key.equalsIgnoreCase("databaseName") || key.equalsIgnoreCase("database")) {
                String named = separator < 0 ? "" : unquoteUrlValue(property.substring(separator + 1));
                if (!named.equalsIgnoreCase(databaseName)) {
                    throw new IllegalArgumentException("JDBC URL names database [" + named
                            + "] but the cleanup targets [" + databaseName + "]");
                }
                continue;
            }
            url.append(property).append(';');
        }
        return url.append("databaseName={").append(databaseName.replace("}", "}}")).append("};").toString();
    }

    // Splits on ';' outside brace-quoted values
    static List<String> splitUrlProperties(String url) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean braced = false;
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            if (braced) {
                current.append(c);
                if (c == '}') {
                    if (i + 1 < url.length() && url.charAt(i + 1) == '}') {
                        current.append('}');
                        i++;
                    } else {
                        braced = false;
                    }
                }
            } else if (c == '{') {
                braced = true;
                current.append(c);
            } else if (c == ';') {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    private static String unquoteUrlValue(String value) {
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return trimmed.substring(1, trimmed.length() - 1).replace("}}", "}");
        }
        return trimmed;
    }

    /**
     * Rejects configurations the cleanup cannot run with and logs warnings for odd ones.
     */
    public void validate() {
        if (databaseName == null || databaseName.isBlank()) {
            throw new IllegalArgumentException("Database name is required");
        }
        if (retentionHours < 0) {
            throw new IllegalArgumentException("Retention hours must not be negative: " + retentionHours);
        }
        if (minExecutionCount < 0) {
            throw new IllegalArgumentException("Minimum execution count must not be negative: " + minExecutionCount);
        }
        if (runtimeStatsRowBytes <= 0 || waitStatsRowBytes <= 0) {
            throw new IllegalArgumentException("Statistics row sizes must be positive");
        }
        if (!isSnapshotMode() && jdbcUrl == null) {
            throw new IllegalArgumentException("A JDBC URL or a snapshot file is required");
        }
        if (isSnapshotMode() && (reportOutputTable != null || queryDetailsOutputTable != null)) {
            throw new IllegalArgumentException("Report output tables need a JDBC connection, not a snapshot file");
        }

        if (cleanAdhocStale && cleanStale) {
            log.info("Stale cleanup includes ad-hoc queries, skipping the separate ad-hoc stale pass");
        }
        if (getEnabledCategories().isEmpty()) {
            log.warn("No cleanup category is enabled, nothing will be selected");
        }
        if (minExecutionCount == 0) {
            log.warn("Minimum execution count is 0, no query can be selected as stale");
        }
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Database: %s | Categories: %s | Retention: %dh | Min executions: %d | Test: %s",
                databaseName, getEnabledCategories(), retentionHours, minExecutionCount, test);
    }
}
