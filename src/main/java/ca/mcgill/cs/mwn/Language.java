/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;

import java.util.Locale;


/**
 * The languages whose WordNets make up the MultiWordNet, plus the {@link
 * #COMMON} space that holds the relations and semantic fields shared by all
 * of them.
 */
public enum Language {

    ENGLISH(LemmaModel.INDEX),

    ITALIAN(LemmaModel.INDEX),

    SPANISH(LemmaModel.INDEX),

    FRENCH(LemmaModel.INDEX),

    LATIN(LemmaModel.MORPHOLOGY),

    HEBREW(LemmaModel.INDEX),

    ROMANIAN(LemmaModel.INDEX),

    PORTUGUESE(LemmaModel.INDEX),

    /**
     * The shared reference space; it has no lemmas of its own.
     */
    COMMON(LemmaModel.INDEX);

    /**
     * How the lemmas of a language are keyed in its store.
     */
    public enum LemmaModel {

        /**
         * Lemmas are rows of a per-part-of-speech index of synset ids.
         */
        INDEX,

        /**
         * Lemmas are rows of a morphology table, each carrying an id and a
         * grammatical tag string.
         */
        MORPHOLOGY
    }

    /**
     * The language in which every synset has an authoritative record.
     */
    public static final Language REFERENCE = ENGLISH;

    private final LemmaModel lemmaModel;

    private Language(LemmaModel lemmaModel) {
        this.lemmaModel = lemmaModel;
    }

    /**
     * Returns the name under which this language's tables are stored, e.g.,
     * {@code italian} for the {@code italian_synset} table.
     */
    public String getCode() {
        return name().toLowerCase(Locale.ENGLISH);
    }

    public LemmaModel getLemmaModel() {
        return lemmaModel;
    }

    /**
     * Returns the language with the given store code, ignoring case.
     *
     * @throws IllegalArgumentException if no language has that code
     */
    public static Language fromCode(String code) {
        for (Language l : values()) {
            if (l.getCode().equalsIgnoreCase(code.trim()))
                return l;
        }
        throw new IllegalArgumentException("Unknown language: " + code);
    }
}
