package org.carball.qdsclean.model.cleanup;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Retention categories a Query Store entry can be selected under.
 */
@Getter
public enum QueryCategory {

    ADHOC_STALE("AdhocStale", "Adhoc Stale"),
    STALE("Stale", "Stale"),
    INTERNAL("Internal", "Internal"),
    ORPHAN("Orphan", "Orphan");

    /** Value written to the QueryType column of the report tables. */
    private final String label;
    private final String displayName;

    QueryCategory(String label, String displayName) {
        this.label = label;
        this.displayName = displayName;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static QueryCategory fromLabel(String label) {
        for (QueryCategory category : values()) {
            if (category.label.equalsIgnoreCase(label)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown query category: " + label);
    }
}
