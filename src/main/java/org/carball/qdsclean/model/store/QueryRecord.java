package org.carball.qdsclean.model.store;

import java.time.OffsetDateTime;

/**
 * A row of sys.query_store_query. An objectId of 0 marks an ad-hoc query.
 */
public record QueryRecord(
        long queryId,
        long queryTextId,
        long objectId,
        OffsetDateTime lastExecutionTime,
        boolean internal
) {

    public boolean isAdhoc() {
        return objectId == 0;
    }
}
