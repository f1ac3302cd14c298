package de.t14d3.drawer.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SELECT statement builder with dialect-aware identifier quoting.
 *
 * Fragments handed to the builder are expected to be validated already; the builder only
 * quotes bare identifiers and assembles the statement.
 */
public class Query {
    private final Dialect dialect;
    private final StringBuilder sql;
    private final List<Object> parameters;

    private Query(Dialect dialect, StringBuilder sql, List<Object> parameters) {
        this.dialect = dialect;
        this.sql = sql;
        this.parameters = new ArrayList<>(parameters);
    }

    /**
     * Get the final SQL string.
     */
    public String getSql() {
        return sql.toString();
    }

    /**
     * Get the query parameters for prepared statement binding.
     */
    public List<Object> getParameters() {
        return new ArrayList<>(parameters);
    }

    /**
     * Create a new SELECT query builder for a table.
     */
    public static SelectBuilder select(Dialect dialect, String... columns) {
        return new SelectBuilder(dialect).select(columns);
    }

    public static class SelectBuilder {
        private final Dialect dialect;
        private final List<String> columns = new ArrayList<>();
        private String fromTable;
        private final StringBuilder whereClause = new StringBuilder();
        private final List<Object> parameters = new ArrayList<>();
        private String groupBy;
        private String orderBy;
        private Integer limit;
        private Integer offset;

        public SelectBuilder(Dialect dialect) {
            this.dialect = dialect;
        }

        public SelectBuilder select(String... columns) {
            this.columns.addAll(Arrays.asList(columns));
            return this;
        }

        public SelectBuilder from(String table) {
            this.fromTable = table;
            return this;
        }

        public SelectBuilder where(String condition, List<Object> params) {
            if (condition == null || condition.isBlank()) {
                return this;
            }
            if (!whereClause.isEmpty()) {
                whereClause.append(" AND ");
            }
            whereClause.append('(').append(condition).append(')');
            if (params != null) {
                parameters.addAll(params);
            }
            return this;
        }

        public SelectBuilder groupBy(String groupBy) {
            this.groupBy = groupBy;
            return this;
        }

        public SelectBuilder orderBy(String orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public SelectBuilder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public SelectBuilder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public Query build() {
            if (columns.isEmpty()) {
                throw new IllegalStateException("SELECT query must specify columns");
            }
            if (fromTable == null) {
                throw new IllegalStateException("SELECT query must specify a table");
            }

            StringBuilder sql = new StringBuilder("SELECT ");

            String columnList = columns.stream()
                    .map(this::quoteColumn)
                    .collect(Collectors.joining(", "));
            sql.append(columnList);

            sql.append(" FROM ").append(dialect.quoteIdentifier(fromTable));

            if (!whereClause.isEmpty()) {
                sql.append(" WHERE ").append(whereClause);
            }

            if (groupBy != null && !groupBy.trim().isEmpty()) {
                sql.append(" GROUP BY ").append(quoteList(groupBy));
            }

            if (orderBy != null && !orderBy.trim().isEmpty()) {
                sql.append(" ORDER BY ").append(processOrderBy(orderBy));
            }

            if (limit != null) {
                sql.append(" LIMIT ").append(limit);
            } else if (offset != null && dialect == Dialect.SQLITE) {
                // SQLite only accepts OFFSET after a LIMIT
                sql.append(" LIMIT -1");
            }

            if (offset != null) {
                sql.append(" OFFSET ").append(offset);
            }

            return new Query(dialect, sql, parameters);
        }

        private String quoteColumn(String col) {
            if (col == null) return "";
            String trimmed = col.trim();
            // bare identifiers are quoted so reserved words work as column names; expressions pass through
            if (ClauseValidator.isIdentifier(trimmed)) {
                return dialect.quoteIdentifier(trimmed);
            }
            if (trimmed.contains(".") && Arrays.stream(trimmed.split("\\.")).map(String::trim).allMatch(ClauseValidator::isIdentifier)) {
                return Arrays.stream(trimmed.split("\\."))
                        .map(String::trim)
                        .map(dialect::quoteIdentifier)
                        .collect(Collectors.joining("."));
            }
            return trimmed;
        }

        private String quoteList(String list) {
            return splitTopLevel(list).stream()
                    .map(this::quoteColumn)
                    .collect(Collectors.joining(", "));
        }

        private String processOrderBy(String orderBy) {
            return splitTopLevel(orderBy).stream()
                    .map(part -> {
                        if (part.isEmpty()) return part;
                        String col = part.split("\\s+")[0];
                        String quoted = quoteColumn(col);
                        // expressions are kept byte for byte, only a leading column reference is quoted
                        if (quoted.equals(col)) return part;
                        String rest = part.substring(col.length()).trim();
                        if (rest.isEmpty()) return quoted;
                        return quoted + " " + rest;
                    })
                    .collect(Collectors.joining(", "));
        }

        /**
         * Split on commas outside quotes and parentheses, trimming each part.
         */
        private static List<String> splitTopLevel(String list) {
            List<String> parts = new ArrayList<>();
            int depth = 0;
            char quote = 0;
            int start = 0;
            for (int i = 0; i < list.length(); i++) {
                char c = list.charAt(i);
                if (quote != 0) {
                    // a doubled quote inside a quoted span toggles out and straight back in
                    if (c == quote) quote = 0;
                } else if (c == '\'' || c == '"') {
                    quote = c;
                } else if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth = Math.max(0, depth - 1);
                } else if (c == ',' && depth == 0) {
                    parts.add(list.substring(start, i).trim());
                    start = i + 1;
                }
            }
            parts.add(list.substring(start).trim());
            return parts;
        }
    }
}
