/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.store;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;


/**
 * An immutable predicate over the rows of a single table: the conjunction of
 * zero or more column conditions.  All comparisons are case-sensitive.
 */
public final class Query {

    /**
     * How a column value is compared to the value in a {@link Condition}.
     */
    public enum Match {
        EXACT,
        STARTS_WITH,
        ENDS_WITH,
        CONTAINS;

        boolean matches(String value, String pattern) {
            switch (this) {
            case EXACT:
                return value.equals(pattern);
            case STARTS_WITH:
                return value.startsWith(pattern);
            case ENDS_WITH:
                return value.endsWith(pattern);
            default:
                return value.contains(pattern);
            }
        }
    }

    /**
     * A comparison of one column against one value.
     */
    public static final class Condition {

        private final String column;

        private final String value;

        private final Match match;

        Condition(String column, String value, Match match) {
            if (column == null || value == null || match == null)
                throw new NullPointerException("Condition on " + column
                                               + " must be fully specified");
            this.column = column;
            this.value = value;
            this.match = match;
        }

        public String getColumn() {
            return column;
        }

        public String getValue() {
            return value;
        }

        public Match getMatch() {
            return match;
        }

        /**
         * Returns {@code true} if the row holds a value for this column that
         * satisfies the condition.
         */
        public boolean matches(Row row) {
            String v = row.get(column);
            return v != null && match.matches(v, value);
        }

        @Override public String toString() {
            switch (match) {
            case EXACT:
                return column + "='" + value + "'";
            case STARTS_WITH:
                return column + " LIKE '" + value + "%'";
            case ENDS_WITH:
                return column + " LIKE '%" + value + "'";
            default:
                return column + " LIKE '%" + value + "%'";
            }
        }
    }

    private static final Query ALL = new Query(ImmutableList.<Condition>of());

    private final List<Condition> conditions;

    private Query(List<Condition> conditions) {
        this.conditions = conditions;
    }

    /**
     * Returns the query that matches every row of a table.
     */
    public static Query all() {
        return ALL;
    }

    /**
     * Returns a query for rows whose column equals the value.
     */
    public static Query where(String column, String value) {
        return ALL.and(column, value, Match.EXACT);
    }

    public static Query where(String column, String value, Match match) {
        return ALL.and(column, value, match);
    }

    /**
     * Returns a new query that additionally requires the column to equal the
     * value.
     */
    public Query and(String column, String value) {
        return and(column, value, Match.EXACT);
    }

    public Query and(String column, String value, Match match) {
        return new Query(ImmutableList.<Condition>builder()
                         .addAll(conditions)
                         .add(new Condition(column, value, match))
                         .build());
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    /**
     * Returns {@code true} if the row satisfies every condition of this query.
     */
    public boolean matches(Row row) {
        for (Condition c : conditions) {
            if (!c.matches(row))
                return false;
        }
        return true;
    }

    @Override public boolean equals(Object o) {
        return o instanceof Query
            && ((Query)o).toString().equals(toString());
    }

    @Override public int hashCode() {
        return toString().hashCode();
    }

    @Override public String toString() {
        return conditions.isEmpty()
            ? "*" : Joiner.on(" AND ").join(conditions);
    }
}
