/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import ca.mcgill.cs.mwn.Language;
import ca.mcgill.cs.mwn.Relation.RelationType;
import ca.mcgill.cs.mwn.Synset;
import ca.mcgill.cs.mwn.UnsupportedRelationException;
import ca.mcgill.cs.mwn.WordNet;

import ca.mcgill.cs.mwn.store.InMemoryWordNetStore;
import ca.mcgill.cs.mwn.store.Tables;

import org.junit.Before;
import org.junit.Test;

import static ca.mcgill.cs.mwn.FixtureStores.*;
import static org.junit.Assert.*;


public class SynsetGraphsTest {

    private WordNet wn;

    @Before public void setUp() {
        wn = new WordNet(Language.ENGLISH, create());
    }

    private Synset synset(String id) {
        return wn.getSynset(id).get();
    }

    private static List<String> ids(Iterable<Synset> synsets) {
        List<String> ids = new ArrayList<String>();
        for (Synset s : synsets)
            ids.add(s.getId());
        return ids;
    }

    @Test public void testHypernymClosure() {
        assertEquals(Arrays.asList(DOG, OBJECT, ENTITY),
                     ids(SynsetGraphs.closure(synset(PUPPY),
                                              RelationType.HYPERNYM, -1)));
    }

    @Test public void testHyponymClosureIsBreadthFirst() {
        List<String> down = ids(SynsetGraphs.closure(
            synset(ENTITY), RelationType.HYPONYM, -1));
        assertEquals(Arrays.asList(OBJECT, RUN_N, ROSE, DOG, CAT, PUPPY), down);
    }

    @Test public void testClosureDepthLimit() {
        assertEquals(Arrays.asList(OBJECT, RUN_N, ROSE),
                     ids(synset(ENTITY).getClosure(RelationType.HYPONYM, 1)));
        assertEquals(5, ids(synset(ENTITY).getClosure(
            RelationType.HYPONYM, 2)).size());
        assertTrue(ids(synset(ENTITY).getClosure(
            RelationType.HYPONYM, 0)).isEmpty());
    }

    @Test public void testClosureOfLeafIsEmpty() {
        assertFalse(synset(PUPPY).getClosure(RelationType.HYPONYM, -1)
                    .iterator().hasNext());
    }

    @Test public void testClosureCanBeIteratedAgain() {
        Iterable<Synset> up =
            synset(PUPPY).getClosure(RelationType.HYPERNYM, -1);
        Iterator<Synset> partial = up.iterator();
        assertEquals(DOG, partial.next().getId());
        assertEquals(3, ids(up).size());
    }

    @Test(expected=UnsupportedRelationException.class)
    public void testClosureOfUndefinedType() {
        synset(DOG).getClosure(RelationType.ENTAILMENT, -1);
    }

    @Test public void testDepths() {
        assertEquals(0, synset(ENTITY).getMaxDepth());
        assertEquals(0, synset(ENTITY).getMinDepth());
        assertEquals(3, synset(PUPPY).getMaxDepth());
        assertEquals(3, synset(PUPPY).getMinDepth());
        assertEquals(1, synset(SPRINT).getMaxDepth());
    }

    @Test public void testRoots() {
        assertEquals(Arrays.asList(ENTITY), ids(synset(PUPPY).getRoots()));
        assertEquals(Arrays.asList(ENTITY), ids(synset(ENTITY).getRoots()));
    }

    @Test public void testPathsToRoot() {
        List<List<Synset>> paths = synset(PUPPY).getPathsToRoot();
        assertEquals(1, paths.size());
        assertEquals(Arrays.asList(ENTITY, OBJECT, DOG, PUPPY),
                     ids(paths.get(0)));
    }

    @Test public void testHypernymDistances() {
        assertEquals(2, SynsetGraphs.hypernymDistances(synset(PUPPY))
                     .get(OBJECT));
        assertEquals(2, SynsetGraphs.shortestPathDistance(
            synset(DOG), synset(CAT)).get().intValue());
        assertEquals(0, SynsetGraphs.shortestPathDistance(
            synset(DOG), synset(DOG)).get().intValue());
        assertFalse(SynsetGraphs.shortestPathDistance(
            synset(GOOD), synset(BAD)).isPresent());
    }

    /**
     * n#00000010 and n#00000011 are each other's hypernyms, and n#00000011
     * also has the root n#00000012.
     */
    private static WordNet cyclic() {
        InMemoryWordNetStore store = new InMemoryWordNetStore();
        store.createTable(Language.ENGLISH, Tables.SYNSET,
                          "id", "word", "phrase", "gloss");
        store.createTable(Language.ENGLISH, Tables.RELATION, "type",
                          "id_source", "id_target", "w_source", "w_target",
                          "status");
        for (String id : new String[] { "n#00000010", "n#00000011",
                                        "n#00000012" }) {
            store.addRow(Language.ENGLISH, Tables.SYNSET, id, "x", "", "");
        }
        store.addRow(Language.ENGLISH, Tables.RELATION,
                     "@", "n#00000010", "n#00000011", "", "", "");
        store.addRow(Language.ENGLISH, Tables.RELATION,
                     "@", "n#00000011", "n#00000010", "", "", "");
        store.addRow(Language.ENGLISH, Tables.RELATION,
                     "@", "n#00000011", "n#00000012", "", "", "");
        return new WordNet(Language.ENGLISH, store);
    }

    /**
     * n#00000024 has two hypernyms: n#00000023, three levels below the root
     * n#00000020, and the root itself.
     */
    private static WordNet uneven() {
        InMemoryWordNetStore store = new InMemoryWordNetStore();
        store.createTable(Language.ENGLISH, Tables.SYNSET,
                          "id", "word", "phrase", "gloss");
        store.createTable(Language.ENGLISH, Tables.RELATION, "type",
                          "id_source", "id_target", "w_source", "w_target",
                          "status");
        for (int i = 20; i <= 24; ++i) {
            store.addRow(Language.ENGLISH, Tables.SYNSET,
                         "n#000000" + i, "x", "", "");
        }
        String[][] edges = {
            { "n#00000021", "n#00000020" },
            { "n#00000022", "n#00000021" },
            { "n#00000023", "n#00000022" },
            { "n#00000024", "n#00000023" },
            { "n#00000024", "n#00000020" },
        };
        for (String[] e : edges) {
            store.addRow(Language.ENGLISH, Tables.RELATION,
                         "@", e[0], e[1], "", "", "");
        }
        return new WordNet(Language.ENGLISH, store);
    }

    @Test public void testMultipleHypernyms() {
        Synset s = uneven().getSynset("n#00000024").get();
        assertEquals(4, s.getMaxDepth());
        assertEquals(1, s.getMinDepth());
        assertEquals(Arrays.asList("n#00000020"), ids(s.getRoots()));

        List<List<Synset>> paths = s.getPathsToRoot();
        assertEquals(2, paths.size());
        assertEquals(Arrays.asList("n#00000020", "n#00000021", "n#00000022",
                                   "n#00000023", "n#00000024"),
                     ids(paths.get(0)));
        assertEquals(Arrays.asList("n#00000020", "n#00000024"),
                     ids(paths.get(1)));
    }

    @Test public void testCyclesTerminate() {
        Synset s = cyclic().getSynset("n#00000010").get();
        assertEquals(Arrays.asList("n#00000011", "n#00000012"),
                     ids(s.getClosure(RelationType.HYPERNYM, -1)));
        assertEquals(2, s.getMaxDepth());
        assertEquals(2, s.getMinDepth());
        assertEquals(Arrays.asList("n#00000012"), ids(s.getRoots()));
        List<List<Synset>> paths = s.getPathsToRoot();
        assertEquals(1, paths.size());
        assertEquals(Arrays.asList("n#00000012", "n#00000011", "n#00000010"),
                     ids(paths.get(0)));
    }
}
