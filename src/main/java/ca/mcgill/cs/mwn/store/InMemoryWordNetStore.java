/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;

import ca.mcgill.cs.mwn.Language;

import ca.mcgill.cs.mwn.util.MwnLogger;


/**
 * A {@link WordNetStore} whose tables are held in memory.  Tables are declared
 * with {@link #createTable(Language, String, String...)} and filled with
 * {@link #addRow(Language, String, String...)}.  The store also counts the
 * queries it answers, which is useful for observing caching behavior.
 */
public class InMemoryWordNetStore implements WordNetStore {

    private static class Table {

        final List<String> columns;

        final List<Row> rows = new ArrayList<Row>();

        Table(List<String> columns) {
            this.columns = columns;
        }
    }

    private final Map<String,Table> tables = new HashMap<String,Table>();

    private int queryCount;

    /**
     * Declares an empty table with the provided columns, replacing any table
     * of the same name.
     */
    public void createTable(Language language, String table,
                            String... columns) {
        tables.put(key(language, table),
                   new Table(ImmutableList.copyOf(columns)));
    }

    /**
     * Appends a row to a table.  Values are matched to columns by position
     * and may be {@code null}.
     *
     * @throws IllegalArgumentException if the table has not been created or
     *         the number of values does not match its columns
     */
    public void addRow(Language language, String table, String... values) {
        Table t = tables.get(key(language, table));
        if (t == null) {
            throw new IllegalArgumentException(
                "No table " + key(language, table));
        }
        if (values.length != t.columns.size()) {
            throw new IllegalArgumentException(
                "Expected " + t.columns.size() + " values for "
                + key(language, table) + ": " + Arrays.toString(values));
        }
        Map<String,String> row = new LinkedHashMap<String,String>();
        for (int i = 0; i < values.length; ++i)
            row.put(t.columns.get(i), values[i]);
        t.rows.add(new Row(row));
    }

    /**
     * {@inheritDoc}
     */
    @Override public Optional<List<Row>> query(Language language, String table,
                                               Query query) {
        queryCount++;
        Table t = tables.get(key(language, table));
        if (t == null)
            return Optional.absent();
        MwnLogger.veryVerbose("SELECT * FROM %s WHERE %s",
                              key(language, table), query);
        List<Row> matches = new ArrayList<Row>();
        for (Row row : t.rows) {
            if (query.matches(row))
                matches.add(row);
        }
        return Optional.<List<Row>>of(matches);
    }

    /**
     * {@inheritDoc}
     */
    @Override public boolean hasTable(Language language, String table) {
        return tables.containsKey(key(language, table));
    }

    /**
     * Returns the number of queries issued against this store so far.
     */
    public int getQueryCount() {
        return queryCount;
    }

    /**
     * Does nothing; the tables remain available.
     */
    @Override public void close() { }

    private static String key(Language language, String table) {
        return language.getCode() + "_" + table;
    }
}
