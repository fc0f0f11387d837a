/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.morph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * The grammatical features encoded, one character each, in a morphological tag
 * string.  Each feature knows the meaning of its codes; where the table of
 * codes depends on the part of speech (as for {@link #GROUP}), it is looked up
 * by the tag's part-of-speech character.
 */
public enum MorphoFeature {

    PART_OF_SPEECH("n", "noun", "v", "verb", "a", "adjective", "r", "adverb",
                   "p", "pronoun", "u", "punctuation", "s", "preposition",
                   "c", "conjunction", "t", "participle"),

    PERSON("1", "1st person", "2", "2nd person", "3", "3rd person"),

    DEGREE("p", "positive", "c", "comparative", "s", "superlative"),

    NUMBER("s", "singular", "d", "dual", "p", "plural"),

    TENSE("p", "present", "f", "future", "i", "imperfect", "r", "perfect",
          "l", "pluperfect", "t", "future perfect"),

    MOOD("n", "infinitive", "i", "indicative", "m", "imperative",
         "s", "subjunctive", "p", "participle", "g", "gerund",
         "d", "gerundive"),

    VOICE("a", "active", "p", "passive", "m", "middle", "d", "deponent",
          "s", "semideponent"),

    GENDER("m", "masculine", "f", "feminine", "n", "neuter",
           "c", "masculine or feminine",
           "a", "masculine or feminine or neuter"),

    CASE("n", "nominative", "g", "genitive", "d", "dative", "a", "accusative",
         "b", "ablative", "v", "vocative", "l", "locative"),

    /**
     * The declension of a noun or adjective, or the conjugation of a verb.
     */
    GROUP() {
        @Override public Map<Character,String> getMeanings(char posTag) {
            switch (posTag) {
            case 'n':
                return NOUN_GROUPS;
            case 'v':
                return VERB_GROUPS;
            case 'a':
                return ADJECTIVE_GROUPS;
            default:
                return Collections.<Character,String>emptyMap();
            }
        }
    },

    STEM("i", "i-stem");

    private static final Map<Character,String> NOUN_GROUPS =
        table("1", "1st declension", "2", "2nd declension",
              "3", "3rd declension", "4", "4th declension",
              "5", "5th declension", "-", "indeclinable");

    private static final Map<Character,String> VERB_GROUPS =
        table("1", "1st conjugation", "2", "2nd conjugation",
              "3", "3rd conjugation", "4", "4th conjugation");

    private static final Map<Character,String> ADJECTIVE_GROUPS =
        table("1", "1st/2nd declension", "3", "3rd declension");

    private final Map<Character,String> meanings;

    private MorphoFeature(String... codesAndMeanings) {
        this.meanings = table(codesAndMeanings);
    }

    /**
     * Returns the meaning of each code of this feature for a word with the
     * given part-of-speech tag.  An empty map means the feature does not
     * apply to that part of speech.
     */
    public Map<Character,String> getMeanings(char posTag) {
        return meanings;
    }

    private static Map<Character,String> table(String... codesAndMeanings) {
        Map<Character,String> m = new LinkedHashMap<Character,String>();
        for (int i = 0; i + 1 < codesAndMeanings.length; i += 2)
            m.put(codesAndMeanings[i].charAt(0), codesAndMeanings[i + 1]);
        return Collections.unmodifiableMap(m);
    }
}
