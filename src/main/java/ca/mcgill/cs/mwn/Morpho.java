/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;

import java.util.List;
import java.util.Map;

import com.google.common.base.Optional;

import edu.ucla.sspace.util.Duple;

import ca.mcgill.cs.mwn.morph.MorphoFeature;


/**
 * The interface for the morphological entry of a lemma in a language with a
 * morphology table, such as Latin or Hebrew.  The grammatical features are
 * decoded from the entry's fixed-layout tag.
 */
public interface Morpho {

    Language getLanguage();

    String getId();

    String getLemma();

    /**
     * Returns the part-of-speech tag as stored.
     */
    String getPos();

    List<String> getPrincipalParts();

    /**
     * Returns the irregular forms, each a pair of the form's description and
     * the form itself.
     */
    List<Duple<String,String>> getIrregularForms();

    List<Duple<String,String>> getAlternativeForms();

    String getPronunciation();

    /**
     * Returns a script field of the entry, e.g., {@code undotted} for Hebrew,
     * or the empty string if the entry has none.
     */
    String getScriptField(String column);

    /**
     * Returns the raw morphological tag.
     */
    String getTag();

    /**
     * Returns the code of every feature that applies to this entry.
     *
     * @throws DecodingException if the tag cannot be decoded
     */
    Map<MorphoFeature,Character> getFeatures();

    /**
     * Returns the code of the feature, if it applies to this entry.
     *
     * @throws DecodingException if the tag cannot be decoded
     */
    Optional<Character> getFeature(MorphoFeature feature);

    /**
     * Returns the meaning of the feature's code, e.g., "ablative" for {@link
     * MorphoFeature#CASE}.
     *
     * @throws DecodingException if the tag cannot be decoded
     */
    Optional<String> getFeatureName(MorphoFeature feature);

    boolean isIStem();

    /**
     * Returns the headword as a dictionary lists it, e.g., {@code [amo,
     * amare, amavisse, amatum, 1]}; for entries without such a convention this
     * is just the lemma.
     */
    List<String> getDictionaryForm();
}
