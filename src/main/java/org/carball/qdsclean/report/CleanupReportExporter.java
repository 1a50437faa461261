package org.carball.qdsclean.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.qdsclean.model.report.CategorySummary;
import org.carball.qdsclean.model.report.QueryDetail;
import org.carball.qdsclean.model.report.ReportHeader;
import org.carball.qdsclean.util.QueryTextCompression;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes both reports of a run to one JSON document. Query texts are written decompressed.
 */
@Slf4j
public class CleanupReportExporter {

    private final ObjectMapper objectMapper;

    public CleanupReportExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson(ReportHeader header, List<CategorySummary> summary, List<QueryDetail> details)
            throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("execution_time", header.executionTime());
        document.put("server_name", header.serverName());
        document.put("database_name", header.databaseName());
        document.put("cleanup_parameters", header.parameters());
        document.put("summary", summary);
        document.put("query_details", details.stream().map(CleanupReportExporter::detailEntry).toList());
        return objectMapper.writeValueAsString(document);
    }

    public void export(Path file, ReportHeader header, List<CategorySummary> summary, List<QueryDetail> details)
            throws IOException {
        Files.writeString(file, toJson(header, summary, details));
        log.info("Cleanup report exported to {}", file);
    }

    // Inclusion rules do not reach map values, so absent values are left out here
    private static Map<String, Object> detailEntry(QueryDetail detail) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("query_type", detail.getCategory());
        entry.put("object_name", detail.getObjectName());
        entry.put("query_id", detail.getQueryId());
        if (detail.getLastExecutionTime() != null) {
            entry.put("last_execution_time", detail.getLastExecutionTime());
        }
        entry.put("execution_count", detail.getExecutionCount());
        if (detail.getQueryText() != null) {
            entry.put("query_text", QueryTextCompression.decompress(detail.getQueryText()));
        }
        return entry;
    }
}
