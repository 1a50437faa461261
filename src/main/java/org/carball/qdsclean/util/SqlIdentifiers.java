package org.carball.qdsclean.util;

/**
 * SQL Server identifier quoting.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {
        // Utility class - prevent instantiation
    }

    /**
     * Same result as T-SQL QUOTENAME: wraps in brackets and doubles any closing bracket.
     */
    public static String quoteName(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    public static String qualifiedName(String schemaName, String objectName) {
        return quoteName(schemaName) + "." + quoteName(objectName);
    }
}
