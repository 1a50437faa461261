package org.carball.qdsclean.report;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.insert.Insert;
import org.carball.qdsclean.util.SqlIdentifiers;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Caller-supplied name of a report destination table, up to four parts
 * ({@code server.database.schema.table}, bracketed or not). Parsed once so that only
 * a plain table reference ever reaches an INSERT statement.
 */
public final class OutputTableName {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_#@][A-Za-z0-9_#@$]*");
    private static final int MAX_PARTS = 4;

    private final List<String> parts;

    private OutputTableName(List<String> parts) {
        this.parts = parts;
    }

    public static OutputTableName parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Output table name is empty");
        }

        // JSqlParser does not read SQL Server bracket identifiers
        String unbracketed = name.trim().replaceAll("\\[([^]]+)]", "$1");

        Table table;
        try {
            Statement statement = CCJSqlParserUtil.parse("INSERT INTO " + unbracketed + " (c) VALUES (1)");
            if (!(statement instanceof Insert insert)) {
                throw new IllegalArgumentException("Invalid output table name: " + name);
            }
            table = insert.getTable();
        } catch (JSQLParserException e) {
            throw new IllegalArgumentException("Invalid output table name: " + name, e);
        }

        List<String> parts = Arrays.asList(table.getFullyQualifiedName().split("\\.", -1));
        if (parts.size() > MAX_PARTS) {
            throw new IllegalArgumentException("Output table name has more than " + MAX_PARTS + " parts: " + name);
        }
        String tableName = parts.get(parts.size() - 1);
        if (tableName.isEmpty()) {
            throw new IllegalArgumentException("Output table name has no table part: " + name);
        }
        for (String part : parts) {
            // Empty parts stand for defaults, as in db..table
            if (!part.isEmpty() && !IDENTIFIER.matcher(part).matches()) {
                throw new IllegalArgumentException("Invalid identifier '" + part + "' in output table name: " + name);
            }
        }
        return new OutputTableName(List.copyOf(parts));
    }

    public List<String> getParts() {
        return parts;
    }

    public String getTableName() {
        return parts.get(parts.size() - 1);
    }

    /**
     * Bracket-quoted form, safe to splice into a statement.
     */
    public String toSql() {
        return parts.stream()
                .map(part -> part.isEmpty() ? "" : SqlIdentifiers.quoteName(part))
                .collect(Collectors.joining("."));
    }

    @Override
    public String toString() {
        return toSql();
    }
}
