package org.carball.qdsclean.cleanup;

/**
 * The target database does not exist or is not online. Raised before any selection work.
 */
public class DatabaseUnavailableException extends CleanupException {

    public DatabaseUnavailableException(String message, String databaseName) {
        super(message, databaseName, null);
    }
}
