package org.carball.qdsclean.model.store;

import java.time.OffsetDateTime;

/**
 * What the reports need to know about a query: ownership, text and text size.
 * The schema and object name are null when the owning object is not in the catalog.
 */
public record QueryFootprint(
        long queryId,
        long objectId,
        String objectSchema,
        String objectName,
        OffsetDateTime lastExecutionTime,
        String queryText,
        long queryTextBytes
) {

    public boolean isObjectResolved() {
        return objectName != null;
    }
}
