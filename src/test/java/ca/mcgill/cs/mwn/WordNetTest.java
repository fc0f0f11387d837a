/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import edu.mit.jwi.item.POS;

import ca.mcgill.cs.mwn.Relation.RelationType;

import ca.mcgill.cs.mwn.store.InMemoryWordNetStore;
import ca.mcgill.cs.mwn.store.Query;

import org.junit.Before;
import org.junit.Test;

import static ca.mcgill.cs.mwn.FixtureStores.*;
import static org.junit.Assert.*;


public class WordNetTest {

    private InMemoryWordNetStore store;

    private WordNet english;

    @Before public void setUp() {
        store = create();
        english = new WordNet(Language.ENGLISH, store);
    }

    private static <T> List<T> toList(Iterable<T> it) {
        List<T> list = new ArrayList<T>();
        for (T t : it)
            list.add(t);
        return list;
    }

    private static Set<String> forms(Iterable<Lemma> lemmas) {
        Set<String> forms = new HashSet<String>();
        for (Lemma l : lemmas)
            forms.add(l.getLemma() + "/" + l.getPosTag());
        return forms;
    }

    @Test public void testGetLemma() {
        Lemma dog = english.getLemma("dog", POS.NOUN).get();
        assertEquals(Arrays.asList(DOG), ids(dog.getSynsets()));
        assertFalse(english.getLemma("dog", POS.VERB).isPresent());
    }

    @Test(expected=DisambiguationException.class)
    public void testAmbiguousLemma() {
        english.getLemma("run", null);
    }

    @Test public void testLemmaLookupsAreKept() {
        english.getLemma("dog", POS.NOUN);
        int queries = store.getQueryCount();
        english.getLemma("dog", POS.NOUN);
        english.getLemma("dog", 'n', null);
        assertEquals(queries, store.getQueryCount());
    }

    @Test public void testSearch() {
        List<Lemma> r = english.get("r", Lemma.WILDCARD, null,
                                    Query.Match.STARTS_WITH);
        assertEquals(new HashSet<String>(Arrays.asList("run/n", "run/v",
                                                       "rose/n")),
                     forms(r));
        assertEquals(2, english.get("dog", 'n', null, Query.Match.ENDS_WITH)
                     .size());
        assertEquals(13, english.get(null, Lemma.WILDCARD, null,
                                     Query.Match.EXACT).size());
        int queries = store.getQueryCount();
        assertEquals(r, english.get("r", Lemma.WILDCARD, null,
                                    Query.Match.STARTS_WITH));
        assertEquals(queries, store.getQueryCount());
    }

    @Test public void testSearchResultsCannotAlterLaterSearches() {
        List<Lemma> first = english.get("r", Lemma.WILDCARD, null,
                                        Query.Match.STARTS_WITH);
        try {
            first.clear();
            fail("search results should be unmodifiable");
        }
        catch (UnsupportedOperationException expected) { }
        assertEquals(3, english.get("r", Lemma.WILDCARD, null,
                                    Query.Match.STARTS_WITH).size());
    }

    @Test public void testSearchKeepsHomographs() {
        WordNet latin = new WordNet(Language.LATIN, store);
        List<Lemma> nouns = latin.get(null, 'n', null, Query.Match.EXACT);
        assertEquals(3, nouns.size());
        List<Lemma> malum = latin.get("mal", 'n', "n-s---nn2-",
                                      Query.Match.STARTS_WITH);
        assertEquals(2, malum.size());
        assertEquals("3", malum.get(0).getId().get());
        assertEquals("4", malum.get(1).getId().get());
    }

    @Test public void testLemmaIteration() {
        List<Lemma> all = toList(english);
        // run is listed once per part of speech
        assertEquals(13, all.size());
        assertTrue(forms(all).contains("run/v"));
        int queries = store.getQueryCount();
        assertEquals(all, toList(english.lemmas()));
        assertEquals(queries, store.getQueryCount());
    }

    @Test public void testLatinLemmaIteration() {
        WordNet latin = new WordNet(Language.LATIN, store);
        List<Lemma> all = toList(latin);
        assertEquals(5, all.size());
        assertTrue(all.get(0).getMorpho().isPresent());
    }

    @Test public void testSynsetIteration() {
        assertEquals(11, toList(english.synsets()).size());
        assertEquals(7, toList(english.synsets(POS.NOUN)).size());
        assertEquals(Arrays.asList(RUN_V, SPRINT),
                     ids(english.synsets(POS.VERB)));
        int queries = store.getQueryCount();
        toList(english.synsets(POS.VERB));
        assertEquals(queries, store.getQueryCount());
    }

    @Test public void testRelationIteration() {
        List<Relation> all = toList(english.relations());
        // 14 shared, then 4 English
        assertEquals(18, all.size());
        assertEquals(Language.COMMON, all.get(0).getLanguage());
        assertEquals(Language.ENGLISH, all.get(all.size() - 1).getLanguage());
    }

    @Test public void testRelationsBetweenSynsets() {
        Synset dog = english.getSynset(DOG).get();
        Synset object = english.getSynset(OBJECT).get();
        List<Relation> rels = english.getRelations(dog, object, null);
        assertEquals(1, rels.size());
        assertEquals(RelationType.HYPERNYM, rels.get(0).getType().get());
        assertEquals(2, english.getRelations(null, object,
                                             RelationType.HYPERNYM).size());
        assertTrue(english.getRelations(object, dog, RelationType.HYPERNYM)
                   .isEmpty());
    }

    @Test public void testLexicalRelations() {
        Lemma good = english.getLemma("good", POS.ADJECTIVE).get();
        Lemma bad = english.getLemma("bad", POS.ADJECTIVE).get();
        List<Relation> rels = english.getLexicalRelations(good, bad, null);
        assertEquals(1, rels.size());
        Relation antonym = rels.get(0);
        assertTrue(antonym.isLexical());
        assertEquals("antonym (lexical)", antonym.getTypeName());
        assertEquals(bad, antonym.getTargetLemma().get());
        assertEquals(BAD, antonym.getTarget().get().getId());
    }

    @Test(expected=IllegalArgumentException.class)
    public void testLexicalRelationsNeedLemmas() {
        english.getLexicalRelations(null, null, RelationType.ANTONYM);
    }

    @Test public void testNewRelationsOfAnotherLanguage() {
        WordNet italian = new WordNet(Language.ITALIAN, store);
        Synset pasta = italian.getSynset(PASTA).get();
        Relation r = pasta.getRelations(RelationType.HYPERNYM).get(0);
        assertTrue(r.isNew());
        assertEquals(Language.ITALIAN, r.getLanguage());
        assertEquals(Arrays.asList(ENTITY), ids(pasta.getHypernyms()));
        assertEquals(Arrays.asList("pastasciutta"),
                     lemmaForms(pasta.getLemmas()));
    }

    @Test public void testSemfields() {
        assertEquals(6, toList(english.semfields()).size());
        assertEquals("Biology", english.getSemfield("Biology", null).get()
                     .getEnglish());
        assertEquals(2, english.getSemfieldsByEnglish("Zoology").size());
        assertEquals(1, english.getSemfieldsByCode("3.4").size());
    }

    @Test public void testMaxDepthFor() {
        assertEquals(3, english.maxDepthFor(POS.NOUN));
        assertEquals(1, english.maxDepthFor(POS.VERB));
        assertEquals(0, english.maxDepthFor(POS.ADVERB));
        int queries = store.getQueryCount();
        assertEquals(3, english.maxDepthFor(POS.NOUN));
        assertEquals(queries, store.getQueryCount());
    }

    private static List<String> ids(Iterable<Synset> synsets) {
        List<String> ids = new ArrayList<String>();
        for (Synset s : synsets)
            ids.add(s.getId());
        return ids;
    }

    private static List<String> lemmaForms(List<Lemma> lemmas) {
        List<String> forms = new ArrayList<String>();
        for (Lemma l : lemmas)
            forms.add(l.getLemma());
        return forms;
    }
}
