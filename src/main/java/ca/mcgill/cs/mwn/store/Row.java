/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;


/**
 * A single record returned by a {@link WordNetStore}, mapping column names to
 * their (possibly {@code null}) string values.
 */
public final class Row {

    /**
     * Splits the multi-valued columns, e.g., {@code hypers} or {@code id_n},
     * whose values are whitespace-separated tokens.
     */
    private static final Splitter TOKENS =
        Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults();

    private final Map<String,String> values;

    public Row(Map<String,String> values) {
        this.values = Collections.unmodifiableMap(
            new LinkedHashMap<String,String>(values));
    }

    /**
     * Returns the value of the column, or {@code null} if the column is
     * missing or holds no value.
     */
    public String get(String column) {
        return values.get(column);
    }

    /**
     * Returns {@code true} if the column holds a non-blank value.
     */
    public boolean isSet(String column) {
        String v = values.get(column);
        return v != null && !v.trim().isEmpty();
    }

    /**
     * Returns the whitespace-separated tokens of the column, which is empty if
     * the column is missing or blank.
     */
    public List<String> getTokens(String column) {
        String v = values.get(column);
        if (v == null)
            return Collections.<String>emptyList();
        return TOKENS.splitToList(v);
    }

    public Set<String> getColumns() {
        return values.keySet();
    }

    @Override public boolean equals(Object o) {
        return o instanceof Row && ((Row)o).values.equals(values);
    }

    @Override public int hashCode() {
        return values.hashCode();
    }

    @Override public String toString() {
        return "Row" + values;
    }
}
