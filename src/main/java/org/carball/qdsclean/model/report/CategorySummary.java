package org.carball.qdsclean.model.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.qdsclean.model.cleanup.QueryCategory;

/**
 * Estimated space held by the entries selected under one category.
 */
public record CategorySummary(
        @JsonProperty("query_type") QueryCategory category,
        @JsonProperty("query_count") long queryCount,
        @JsonProperty("plan_count") long planCount,
        @JsonProperty("query_text_kbs") long queryTextKBs,
        @JsonProperty("plan_xml_kbs") long planXmlKBs,
        @JsonProperty("run_stats_kbs") long runStatsKBs,
        @JsonProperty("wait_stats_kbs") long waitStatsKBs
) {

    public long totalKBs() {
        return queryTextKBs + planXmlKBs + runStatsKBs + waitStatsKBs;
    }
}
