/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;

import java.util.List;
import java.util.Set;

import com.google.common.base.Optional;

import edu.mit.jwi.item.POS;


/**
 * The interface for a word or phrase of one language's WordNet.  Lemmas are
 * equal when their surface forms and part-of-speech tags are equal; the
 * language is not part of their identity.
 */
public interface Lemma {

    /**
     * The part-of-speech tag that, in a lookup, matches any part of speech.
     */
    public static final char WILDCARD = '*';

    /**
     * Returns the surface form, with words of a phrase joined by {@code _}.
     */
    String getLemma();

    /**
     * Returns the WordNet part of speech, or {@code null} for the closed
     * classes (pronouns, prepositions, etc.) of morphology tables.
     */
    POS getPOS();

    /**
     * Returns the one-character part-of-speech tag as stored.
     */
    char getPosTag();

    Language getLanguage();

    /**
     * Returns the id of the lemma's morphology entry, in languages that have
     * one.
     */
    Optional<String> getId();

    List<Synset> getSynsets();

    /**
     * Returns the other lemmas sharing a synset with this one.
     */
    Set<Lemma> getSynonyms();

    /**
     * Returns the lemmas derived from this one, limited to the parts of speech
     * given, or all of them if none is.
     */
    List<Lemma> getDerivates(POS... pos);

    /**
     * Returns the lemmas this one is related to, limited to the parts of
     * speech given, or all of them if none is.
     */
    List<Lemma> getRelatives(POS... pos);

    List<Lemma> getAntonyms();

    /**
     * Returns the lemmas this compound is made of.
     */
    List<Lemma> getComposedOf();

    /**
     * Returns the compounds this lemma is part of.
     */
    List<Lemma> getComposes();

    /**
     * Returns the morphological description of this lemma, if its language's
     * store has one.
     *
     * @throws DisambiguationException if several morphology entries match the
     *         lemma
     */
    Optional<Morpho> getMorpho();
}
