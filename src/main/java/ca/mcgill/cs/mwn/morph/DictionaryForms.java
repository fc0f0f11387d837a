/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.morph;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;

import ca.mcgill.cs.mwn.Language;
import ca.mcgill.cs.mwn.Morpho;


/**
 * Builds Latin headwords the way dictionaries list them: a verb with its
 * infinitive, perfect and supine, a noun with its genitive and gender, an
 * adjective with its other genders.
 */
public final class DictionaryForms {

    private DictionaryForms() { }

    /**
     * Returns the dictionary form of the entry, or just its lemma when the
     * entry is not Latin or its principal parts do not fit the convention for
     * its part of speech.
     */
    public static List<String> of(Morpho m) {
        String lemma = m.getLemma();
        List<String> parts = m.getPrincipalParts();
        if (m.getLanguage() != Language.LATIN || parts.isEmpty())
            return Collections.singletonList(lemma);

        Optional<Character> pos = m.getFeature(MorphoFeature.PART_OF_SPEECH);
        String group = codeOf(m, MorphoFeature.GROUP);
        String stem = parts.get(0);
        switch (pos.or('-')) {
        case 'v':
            return verb(m, lemma, parts, group);
        case 'n':
            return ImmutableList.of(lemma, stem + genitive(m, group),
                                    codeOf(m, MorphoFeature.GENDER) + ".");
        case 'a':
            return adjective(m, lemma, stem, group);
        default:
            return Collections.singletonList(lemma);
        }
    }

    private static List<String> verb(Morpho m, String lemma,
                                     List<String> parts, String group) {
        if (parts.size() == 2) {
            return ImmutableList.of(lemma, parts.get(0) + "isse",
                                    parts.get(1), group);
        }
        if (parts.size() != 3)
            return Collections.singletonList(lemma);

        String thematicVowel;
        if (group.equals("1"))
            thematicVowel = "a";
        else if (group.equals("2") || group.equals("3"))
            thematicVowel = "e";
        else
            thematicVowel = "i";

        if (codeOf(m, MorphoFeature.VOICE).equals("a")) {
            return ImmutableList.of(lemma, parts.get(0) + thematicVowel + "re",
                                    parts.get(1) + "isse", parts.get(2) + "um",
                                    group);
        }
        // Deponents have no active perfect
        return ImmutableList.of(lemma, parts.get(0) + thematicVowel + "ri",
                                parts.get(2) + "us sum", group);
    }

    private static String genitive(Morpho m, String group) {
        boolean singular = codeOf(m, MorphoFeature.NUMBER).equals("s");
        if (group.equals("1"))
            return (singular) ? "ae" : "arum";
        if (group.equals("2"))
            return (singular) ? "i" : "orum";
        if (group.equals("3"))
            return (singular) ? "is" : "um";
        if (group.equals("4"))
            return (singular) ? "us" : "uum";
        return (singular) ? "ēi" : "erum";
    }

    private static List<String> adjective(Morpho m, String lemma, String stem,
                                          String group) {
        if (group.equals("1"))
            return ImmutableList.of(lemma, stem + "a", stem + "um");
        if (!group.equals("3"))
            return Collections.singletonList(lemma);

        // The gender code gives the number of terminations
        String gender = codeOf(m, MorphoFeature.GENDER);
        if (gender.equals("m"))
            return ImmutableList.of(lemma, stem + "is", stem + "e", "m.f.n.");
        if (gender.equals("c"))
            return ImmutableList.of(lemma, stem + "e", "mf.n.");
        if (gender.equals("a"))
            return ImmutableList.of(lemma, "mfn.");
        return Collections.singletonList(lemma);
    }

    private static String codeOf(Morpho m, MorphoFeature feature) {
        Optional<Character> code = m.getFeature(feature);
        return (code.isPresent()) ? String.valueOf(code.get()) : "";
    }
}
