/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.store;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.List;

import ca.mcgill.cs.mwn.Language;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;


public class SqliteWordNetStoreTest {

    @Rule public TemporaryFolder folder = new TemporaryFolder();

    private SqliteWordNetStore store;

    @Before public void setUp() throws Exception {
        File dbDir = folder.getRoot();
        File english = new File(dbDir, "english");
        assertTrue(english.mkdirs());

        createTable(new File(english, "english_index.db"), "english_index",
                    "lemma, id_n, id_v, id_a, id_r",
                    new String[][] {
                        { "dog", "n#00003000", null, null, null },
                        { "domestic_dog", "n#00003000", null, null, null },
                        { "Dog", "n#00009999", null, null, null },
                        { "run", "n#00003003", "v#00100000", null, null } });
        // Older releases store the table under its bare name
        createTable(new File(english, "english_lemma.db"), "lemma",
                    "lemma, pos",
                    new String[][] { { "dog", "n" }, { "run", "v" } });

        store = new SqliteWordNetStore(dbDir);
    }

    @After public void tearDown() {
        store.close();
    }

    private static void createTable(File dbFile, String table, String columns,
                                    String[][] rows) throws Exception {
        int numCols = columns.split(",").length;
        StringBuilder marks = new StringBuilder("?");
        for (int i = 1; i < numCols; ++i)
            marks.append(", ?");
        try (Connection conn = DriverManager.getConnection(
                 "jdbc:sqlite:" + dbFile.getAbsolutePath())) {
            try (Statement st = conn.createStatement()) {
                st.executeUpdate("CREATE TABLE " + table + " (" + columns + ")");
            }
            try (PreparedStatement ps = conn.prepareStatement(
                     "INSERT INTO " + table + " VALUES (" + marks + ")")) {
                for (String[] row : rows) {
                    for (int i = 0; i < row.length; ++i)
                        ps.setString(i + 1, row[i]);
                    ps.executeUpdate();
                }
            }
        }
    }

    @Test public void testExactQuery() {
        List<Row> rows = store.query(Language.ENGLISH, Tables.INDEX,
                                     Query.where("lemma", "dog")).get();
        assertEquals(1, rows.size());
        assertEquals("n#00003000", rows.get(0).get("id_n"));
        assertNull(rows.get(0).get("id_v"));
        assertFalse(rows.get(0).isSet("id_v"));
    }

    @Test public void testMatchModesAreCaseSensitive() {
        assertEquals(2, store.query(Language.ENGLISH, Tables.INDEX,
            Query.where("lemma", "dog", Query.Match.CONTAINS)).get().size());
        assertEquals(1, store.query(Language.ENGLISH, Tables.INDEX,
            Query.where("lemma", "D", Query.Match.STARTS_WITH)).get().size());
        assertEquals(1, store.query(Language.ENGLISH, Tables.INDEX,
            Query.where("lemma", "_dog", Query.Match.ENDS_WITH)).get().size());
    }

    @Test public void testConjunction() {
        Query q = Query.where("id_n", "n#0000300", Query.Match.STARTS_WITH)
            .and("id_v", "v#", Query.Match.STARTS_WITH);
        List<Row> rows = store.query(Language.ENGLISH, Tables.INDEX, q).get();
        assertEquals(1, rows.size());
        assertEquals("run", rows.get(0).get("lemma"));
    }

    @Test public void testBareTableName() {
        assertTrue(store.hasTable(Language.ENGLISH, Tables.LEMMA));
        assertEquals(2, store.query(Language.ENGLISH, Tables.LEMMA,
                                    Query.all()).get().size());
    }

    @Test public void testMissingTable() {
        assertFalse(store.hasTable(Language.ENGLISH, Tables.SYNSET));
        assertFalse(store.hasTable(Language.ITALIAN, Tables.INDEX));
        assertFalse(store.query(Language.ITALIAN, Tables.INDEX, Query.all())
                    .isPresent());
    }

    @Test public void testDatabaseFile() {
        assertEquals(new File(new File(folder.getRoot(), "latin"),
                              "latin_morpho.db"),
                     store.getDatabaseFile(Language.LATIN, Tables.MORPHO));
    }

    @Test(expected=IllegalArgumentException.class)
    public void testMissingDirectory() {
        new SqliteWordNetStore(new File(folder.getRoot(), "nowhere"));
    }
}
