/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.store;

import java.util.List;

import ca.mcgill.cs.mwn.Language;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;


public class InMemoryWordNetStoreTest {

    private InMemoryWordNetStore store;

    @Before public void setUp() {
        store = new InMemoryWordNetStore();
        store.createTable(Language.ENGLISH, Tables.INDEX,
                          "lemma", "id_n", "id_v", "id_a", "id_r");
        store.addRow(Language.ENGLISH, Tables.INDEX,
                     "dog", "n#00003000", "", "", "");
        store.addRow(Language.ENGLISH, Tables.INDEX,
                     "domestic_dog", "n#00003000", "", "", "");
        store.addRow(Language.ENGLISH, Tables.INDEX,
                     "run", "n#00003003 n#00003004", "v#00100000", "", null);
    }

    @Test public void testExactMatch() {
        List<Row> rows = store.query(Language.ENGLISH, Tables.INDEX,
                                     Query.where("lemma", "dog")).get();
        assertEquals(1, rows.size());
        assertEquals("n#00003000", rows.get(0).get("id_n"));
    }

    @Test public void testMatchModes() {
        assertEquals(2, store.query(Language.ENGLISH, Tables.INDEX,
            Query.where("lemma", "dog", Query.Match.CONTAINS)).get().size());
        assertEquals(1, store.query(Language.ENGLISH, Tables.INDEX,
            Query.where("lemma", "dom", Query.Match.STARTS_WITH)).get().size());
        assertEquals(2, store.query(Language.ENGLISH, Tables.INDEX,
            Query.where("lemma", "dog", Query.Match.ENDS_WITH)).get().size());
    }

    @Test public void testConjunction() {
        Query q = Query.where("id_n", "n#00003000").and("lemma", "dog");
        assertEquals(1, store.query(Language.ENGLISH, Tables.INDEX, q)
                     .get().size());
        assertEquals(2, q.getConditions().size());
    }

    @Test public void testMatchIsCaseSensitive() {
        assertTrue(store.query(Language.ENGLISH, Tables.INDEX,
                               Query.where("lemma", "Dog")).get().isEmpty());
    }

    @Test public void testNullValuesNeverMatch() {
        // Every blank value contains "", but run's id_r is null
        assertEquals(2, store.query(Language.ENGLISH, Tables.INDEX,
            Query.where("id_r", "", Query.Match.CONTAINS)).get().size());
    }

    @Test public void testMissingTable() {
        assertFalse(store.hasTable(Language.ITALIAN, Tables.INDEX));
        assertFalse(store.query(Language.ITALIAN, Tables.INDEX, Query.all())
                    .isPresent());
    }

    @Test public void testTokens() {
        Row run = store.query(Language.ENGLISH, Tables.INDEX,
                              Query.where("lemma", "run")).get().get(0);
        assertEquals(2, run.getTokens("id_n").size());
        assertTrue(run.isSet("id_v"));
        assertFalse(run.isSet("id_a"));
        assertFalse(run.isSet("id_r"));
        assertTrue(run.getTokens("id_r").isEmpty());
    }

    @Test public void testQueryCount() {
        int before = store.getQueryCount();
        store.query(Language.ENGLISH, Tables.INDEX, Query.all());
        store.query(Language.ITALIAN, Tables.INDEX, Query.all());
        assertEquals(before + 2, store.getQueryCount());
    }

    @Test(expected=IllegalArgumentException.class)
    public void testWrongArity() {
        store.addRow(Language.ENGLISH, Tables.INDEX, "cat", "n#00003001");
    }

    @Test(expected=IllegalArgumentException.class)
    public void testUnknownTable() {
        store.addRow(Language.ENGLISH, Tables.LEMMA, "cat", "n");
    }

    @Test public void testQueryDescription() {
        assertEquals("*", Query.all().toString());
        assertEquals("lemma='dog' AND id_n LIKE 'n#%'",
                     Query.where("lemma", "dog")
                     .and("id_n", "n#", Query.Match.STARTS_WITH).toString());
    }
}
