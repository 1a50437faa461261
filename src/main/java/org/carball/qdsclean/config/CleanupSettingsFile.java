package org.carball.qdsclean.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * YAML settings file. Only the keys present in the file override the defaults.
 */
@Data
public class CleanupSettingsFile {

    @JsonProperty("database_name")
    private String databaseName;

    @JsonProperty("clean_adhoc_stale")
    private Boolean cleanAdhocStale;

    @JsonProperty("clean_stale")
    private Boolean cleanStale;

    @JsonProperty("clean_internal")
    private Boolean cleanInternal;

    @JsonProperty("clean_orphan")
    private Boolean cleanOrphan;

    @JsonProperty("retention_hours")
    private Integer retentionHours;

    @JsonProperty("min_execution_count")
    private Integer minExecutionCount;

    @JsonProperty("report_as_table")
    private Boolean reportAsTable;

    @JsonProperty("report_as_text")
    private Boolean reportAsText;

    @JsonProperty("report_output_table")
    private String reportOutputTable;

    @JsonProperty("query_details_as_table")
    private Boolean queryDetailsAsTable;

    @JsonProperty("query_details_output_table")
    private String queryDetailsOutputTable;

    @JsonProperty("report_json_file")
    private String reportJsonFile;

    @JsonProperty("runtime_stats_row_bytes")
    private Integer runtimeStatsRowBytes;

    @JsonProperty("wait_stats_row_bytes")
    private Integer waitStatsRowBytes;

    @JsonProperty("jdbc_url")
    private String jdbcUrl;

    @JsonProperty("user")
    private String user;

    @JsonProperty("password")
    private String password;

    @JsonProperty("test")
    private Boolean test;

    @JsonProperty("verbose")
    private Boolean verbose;

    @JsonProperty("debug")
    private Boolean debug;

    void applyTo(CleanupConfig.CleanupConfigBuilder builder) {
        if (databaseName != null) builder.databaseName(databaseName);
        if (cleanAdhocStale != null) builder.cleanAdhocStale(cleanAdhocStale);
        if (cleanStale != null) builder.cleanStale(cleanStale);
        if (cleanInternal != null) builder.cleanInternal(cleanInternal);
        if (cleanOrphan != null) builder.cleanOrphan(cleanOrphan);
        if (retentionHours != null) builder.retentionHours(retentionHours);
        if (minExecutionCount != null) builder.minExecutionCount(minExecutionCount);
        if (reportAsTable != null) builder.reportAsTable(reportAsTable);
        if (reportAsText != null) builder.reportAsText(reportAsText);
        if (reportOutputTable != null) builder.reportOutputTable(reportOutputTable);
        if (queryDetailsAsTable != null) builder.queryDetailsAsTable(queryDetailsAsTable);
        if (queryDetailsOutputTable != null) builder.queryDetailsOutputTable(queryDetailsOutputTable);
        if (reportJsonFile != null) builder.reportJsonFile(reportJsonFile);
        if (runtimeStatsRowBytes != null) builder.runtimeStatsRowBytes(runtimeStatsRowBytes);
        if (waitStatsRowBytes != null) builder.waitStatsRowBytes(waitStatsRowBytes);
        if (jdbcUrl != null) builder.jdbcUrl(jdbcUrl);
        if (user != null) builder.user(user);
        if (password != null) builder.password(password);
        if (test != null) builder.test(test);
        if (verbose != null) builder.verbose(verbose);
        if (debug != null) builder.debug(debug);
    }
}
