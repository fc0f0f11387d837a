/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.store;

import edu.mit.jwi.item.POS;


/**
 * The names of the MultiWordNet tables.  Stores prefix each name with the
 * language code, e.g., {@code latin_morpho} or {@code common_relation}.
 */
public final class Tables {

    /** id, word, phrase, gloss */
    public static final String SYNSET = "synset";

    /** lemma, pos */
    public static final String LEMMA = "lemma";

    /** lemma, id_n, id_v, id_a, id_r */
    public static final String INDEX = "index";

    /**
     * id, lemma, pos, principal_parts, irregular_forms, alternative_forms,
     * pronunciation, [script fields], miscellanea
     */
    public static final String MORPHO = "morpho";

    /** type, id_source, id_target, w_source, w_target, status */
    public static final String RELATION = "relation";

    /** pos, syn, lemma */
    public static final String SYNONYMS = "synonyms";

    /** english, synset */
    public static final String SEMFIELD = "semfield";

    /** code, english, hypers, hypons, normal */
    public static final String SEMFIELD_HIERARCHY = "semfield_hierarchy";

    private Tables() { }

    /**
     * Returns the column of the {@link #INDEX} table listing the synsets of a
     * lemma for the part of speech, e.g., {@code id_n}.
     */
    public static String indexColumn(POS pos) {
        return "id_" + pos.getTag();
    }
}
