package org.carball.qdsclean.model.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the selection parameters a cleanup ran with, stored next to every report row.
 */
public record CleanupParameters(
        @JsonProperty("clean_adhoc_stale") boolean cleanAdhocStale,
        @JsonProperty("clean_stale") boolean cleanStale,
        @JsonProperty("retention") int retentionHours,
        @JsonProperty("min_execution_count") int minExecutionCount,
        @JsonProperty("clean_orphan") boolean cleanOrphan,
        @JsonProperty("clean_internal") boolean cleanInternal
) {

    /**
     * Renders the parameters in the layout of the CleanupParameters XML column:
     * {@code <Root><CleanupParameters>...</CleanupParameters></Root>}.
     */
    public String toXml() {
        return "<Root><CleanupParameters>"
                + element("CleanAdhocStale", bit(cleanAdhocStale))
                + element("CleanStale", bit(cleanStale))
                + element("Retention", retentionHours)
                + element("MinExecutionCount", minExecutionCount)
                + element("CleanOrphan", bit(cleanOrphan))
                + element("CleanInternal", bit(cleanInternal))
                + "</CleanupParameters></Root>";
    }

    private static int bit(boolean value) {
        return value ? 1 : 0;
    }

    private static String element(String name, int value) {
        return "<" + name + ">" + value + "</" + name + ">";
    }
}
