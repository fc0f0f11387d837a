/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import edu.mit.jwi.item.POS;

import ca.mcgill.cs.mwn.Language;
import ca.mcgill.cs.mwn.Lemma;
import ca.mcgill.cs.mwn.Morpho;
import ca.mcgill.cs.mwn.morph.MorphoFeature;

import ca.mcgill.cs.mwn.store.InMemoryWordNetStore;

import org.junit.Before;
import org.junit.Test;

import static ca.mcgill.cs.mwn.FixtureStores.*;
import static org.junit.Assert.*;


public class LemmaImplTest {

    private InMemoryWordNetStore store;

    private EntityResolver resolver;

    @Before public void setUp() {
        store = create();
        resolver = new EntityResolver(store);
    }

    private Lemma english(String form, char pos) {
        return resolver.getLemma(form, pos, null, null, Language.ENGLISH).get();
    }

    private Lemma lemma(String form, char pos, Language lang) {
        return new LemmaImpl(form, pos, lang, null, resolver);
    }

    @Test public void testSynsets() {
        assertEquals(RUN_N, english("run", 'n').getSynsets().get(0).getId());
        assertEquals(RUN_V, english("run", 'v').getSynsets().get(0).getId());
        assertEquals(Language.ITALIAN, lemma("cane", 'n', Language.ITALIAN)
                     .getSynsets().get(0).getLanguage());
    }

    @Test public void testClosedClassHasNoSynsets() {
        assertTrue(lemma("et", 'c', Language.LATIN).getSynsets().isEmpty());
        assertNull(lemma("et", 'c', Language.LATIN).getPOS());
    }

    @Test public void testListedSynonyms() {
        assertEquals(Collections.singleton(lemma("domestic_dog", 'n',
                                                 Language.ENGLISH)),
                     english("dog", 'n').getSynonyms());
    }

    @Test public void testSynonymsFromSynsetMembers() {
        assertEquals(Collections.singleton(lemma("physical_object", 'n',
                                                 Language.ENGLISH)),
                     english("object", 'n').getSynonyms());
        assertTrue(english("cat", 'n').getSynonyms().isEmpty());
    }

    @Test public void testAntonyms() {
        assertEquals(Arrays.asList(lemma("bad", 'a', Language.ENGLISH)),
                     english("good", 'a').getAntonyms());
    }

    @Test public void testDerivates() {
        Lemma run = english("run", 'v');
        List<Lemma> derivates = run.getDerivates();
        assertEquals(Arrays.asList(lemma("runner", 'n', Language.ENGLISH)),
                     derivates);
        assertEquals(POS.NOUN, derivates.get(0).getPOS());
        assertTrue(run.getDerivates(POS.VERB, POS.ADJECTIVE).isEmpty());
        assertEquals(1, run.getDerivates(POS.NOUN).size());
    }

    @Test public void testRelatives() {
        assertEquals(Arrays.asList(lemma("run", 'n', Language.ENGLISH)),
                     english("run", 'v').getRelatives());
        assertTrue(english("dog", 'n').getRelatives().isEmpty());
    }

    @Test public void testNoComposition() {
        assertTrue(english("dog", 'n').getComposedOf().isEmpty());
        assertTrue(english("dog", 'n').getComposes().isEmpty());
    }

    @Test public void testMorphology() {
        Lemma rosa = resolver.getLemma("rosa", 'n', null, null,
                                       Language.LATIN).get();
        Morpho m = rosa.getMorpho().get();
        assertEquals("rosa", m.getLemma());
        assertEquals("2", m.getId());
        assertEquals(Arrays.asList("ros"), m.getPrincipalParts());
        assertEquals("rosa", m.getAlternativeForms().get(0).x);
        assertEquals("rossa", m.getAlternativeForms().get(0).y);
        assertTrue(m.getIrregularForms().isEmpty());
        assertEquals("feminine",
                     m.getFeatureName(MorphoFeature.GENDER).get());
        assertEquals("1st declension",
                     m.getFeatureName(MorphoFeature.GROUP).get());
        assertFalse(m.getFeature(MorphoFeature.TENSE).isPresent());
        assertFalse(m.isIStem());
        assertEquals(Arrays.asList("rosa", "rosae", "f."),
                     m.getDictionaryForm());
        assertEquals(Arrays.asList(ROSE), Arrays.asList(
            rosa.getSynsets().get(0).getId()));
    }

    @Test public void testMorphologyLookedUpLazily() {
        Lemma amo = lemma("amo", 'v', Language.LATIN);
        assertEquals("1", amo.getMorpho().get().getId());
        assertFalse(english("dog", 'n').getMorpho().isPresent());
    }

    @Test public void testIdentity() {
        assertEquals(lemma("dog", 'n', Language.ENGLISH),
                     english("dog", 'n'));
        assertFalse(lemma("run", 'n', Language.ENGLISH)
                    .equals(lemma("run", 'v', Language.ENGLISH)));
        assertEquals(2, new HashSet<Lemma>(Arrays.asList(
            english("run", 'n'), english("run", 'v'),
            lemma("run", 'v', Language.ENGLISH))).size());
    }
}
