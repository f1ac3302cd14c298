package de.t14d3.drawer.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Parameters of a validated SELECT issued through {@code Drawer.query}.
 *
 * Every free-form fragment (columns, where, group by, order by) is checked by the
 * {@link ClauseValidator} before the statement is built.
 */
public final class QueryRequest {
    private final String table;
    private final List<String> columns;
    private final String where;
    private final List<Object> parameters;
    private final String groupBy;
    private final String orderBy;
    private final Integer limit;
    private final Integer offset;
    private final Set<String> allowedFunctions;
    private final Set<String> forbiddenFunctions;
    private final boolean overrideAllowed;

    private QueryRequest(Builder b) {
        this.table = b.table;
        this.columns = b.columns.isEmpty() ? List.of("*") : List.copyOf(b.columns);
        this.where = b.where;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(b.parameters));
        this.groupBy = b.groupBy;
        this.orderBy = b.orderBy;
        this.limit = b.limit;
        this.offset = b.offset;
        this.allowedFunctions = Set.copyOf(b.allowedFunctions);
        this.forbiddenFunctions = Set.copyOf(b.forbiddenFunctions);
        this.overrideAllowed = b.overrideAllowed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return target table, or {@code null} for the drawer's own table
     */
    public String table() {
        return table;
    }

    public List<String> columns() {
        return columns;
    }

    public String where() {
        return where;
    }

    public List<Object> parameters() {
        return parameters;
    }

    public String groupBy() {
        return groupBy;
    }

    public String orderBy() {
        return orderBy;
    }

    public Integer limit() {
        return limit;
    }

    public Integer offset() {
        return offset;
    }

    public Set<String> allowedFunctions() {
        return allowedFunctions;
    }

    public Set<String> forbiddenFunctions() {
        return forbiddenFunctions;
    }

    public boolean overrideAllowed() {
        return overrideAllowed;
    }

    public static final class Builder {
        private String table;
        private final List<String> columns = new ArrayList<>();
        private String where;
        private final List<Object> parameters = new ArrayList<>();
        private String groupBy;
        private String orderBy;
        private Integer limit;
        private Integer offset;
        private Set<String> allowedFunctions = Set.of();
        private Set<String> forbiddenFunctions = Set.of();
        private boolean overrideAllowed;

        private Builder() {
        }

        public Builder table(String table) {
            this.table = table;
            return this;
        }

        public Builder columns(String... columns) {
            this.columns.addAll(Arrays.asList(columns));
            return this;
        }

        public Builder where(String where, Object... parameters) {
            this.where = where;
            this.parameters.clear();
            this.parameters.addAll(Arrays.asList(parameters));
            return this;
        }

        public Builder groupBy(String groupBy) {
            this.groupBy = groupBy;
            return this;
        }

        public Builder orderBy(String orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must be >= 0");
            }
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            if (offset < 0) {
                throw new IllegalArgumentException("offset must be >= 0");
            }
            this.offset = offset;
            return this;
        }

        public Builder allowFunctions(String... names) {
            this.allowedFunctions = Set.of(names);
            return this;
        }

        public Builder forbidFunctions(String... names) {
            this.forbiddenFunctions = Set.of(names);
            return this;
        }

        /**
         * Permit only the functions passed to {@link #allowFunctions} for this query.
         */
        public Builder overrideAllowed(boolean overrideAllowed) {
            this.overrideAllowed = overrideAllowed;
            return this;
        }

        public QueryRequest build() {
            return new QueryRequest(this);
        }
    }
}
