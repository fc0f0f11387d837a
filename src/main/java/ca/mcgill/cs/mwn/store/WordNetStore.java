/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.store;

import java.io.Closeable;

import java.util.List;

import com.google.common.base.Optional;

import ca.mcgill.cs.mwn.Language;


/**
 * The read-only backing store of the MultiWordNet.  Each language has its own
 * set of tables (see {@link Tables}); the {@link Language#COMMON} space holds
 * the tables shared by every language.
 *
 * <p>Implementations never fail because a table is missing.  A malformed query
 * or a fault of the storage engine is reported with a {@link StoreException}.
 */
public interface WordNetStore extends Closeable {

    /**
     * Returns the rows of the language's table that satisfy the query, in
     * store order, or {@link Optional#absent()} if the language has no such
     * table.
     *
     * @param language the language (or common space) that owns the table
     * @param table the unprefixed table name, e.g., {@link Tables#SYNSET}
     * @param query the predicate rows must satisfy
     *
     * @throws StoreException if the query cannot be executed
     */
    Optional<List<Row>> query(Language language, String table, Query query);

    /**
     * Returns {@code true} if the language has the table.
     */
    boolean hasTable(Language language, String table);

    /**
     * Releases any resources held by this store.
     */
    @Override void close();
}
