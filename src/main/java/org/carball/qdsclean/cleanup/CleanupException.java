package org.carball.qdsclean.cleanup;

import lombok.Getter;

/**
 * Aborts a cleanup run. Carries the identifiers of whatever the run was working on when it failed.
 */
@Getter
public class CleanupException extends RuntimeException {

    private final String databaseName;
    private final Long queryId;
    private final Long planId;

    public CleanupException(String message, String databaseName, Throwable cause) {
        this(message, databaseName, null, null, cause);
    }

    public CleanupException(String message, String databaseName, Long queryId, Long planId, Throwable cause) {
        super(message, cause);
        this.databaseName = databaseName;
        this.queryId = queryId;
        this.planId = planId;
    }
}
