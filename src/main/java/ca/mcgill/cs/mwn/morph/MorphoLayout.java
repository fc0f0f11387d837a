/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.morph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.CharMatcher;
import com.google.common.base.Optional;

import ca.mcgill.cs.mwn.DecodingException;
import ca.mcgill.cs.mwn.Language;


/**
 * The positions of the features within a language's morphological tags.
 * Every tag of a layout has the same length; the first character is always
 * the part of speech.  A {@code -} marks a feature that does not apply, unless
 * the feature itself gives {@code -} a meaning (an indeclinable noun's
 * group).
 *
 * <p>A tag is decoded by {@link #decode(String)}, which fails on any character
 * its feature does not define rather than ignoring it.
 */
public final class MorphoLayout {

    /**
     * One position of a layout.
     */
    public static final class Field {

        private final int offset;

        private final MorphoFeature feature;

        /**
         * The part-of-speech tags for which the field is read, or empty for
         * all of them.
         */
        private final String posTags;

        Field(int offset, MorphoFeature feature, String posTags) {
            this.offset = offset;
            this.feature = feature;
            this.posTags = posTags;
        }

        public int getOffset() {
            return offset;
        }

        public MorphoFeature getFeature() {
            return feature;
        }

        /**
         * Returns {@code true} if this field is read for words with the
         * part-of-speech tag.
         */
        public boolean appliesTo(char posTag) {
            return posTags.isEmpty() || posTags.indexOf(posTag) >= 0;
        }
    }

    /**
     * {@code [pos][person|degree][number][tense][mood][voice][gender][case]
     * [group][stem]}, e.g., {@code v1spia--1-} for the first person singular
     * present indicative active of a first conjugation verb.
     */
    public static final MorphoLayout LATIN =
        new MorphoLayout(Language.LATIN, 10)
            .add(0, MorphoFeature.PART_OF_SPEECH, "")
            .add(1, MorphoFeature.PERSON, "v")
            .add(1, MorphoFeature.DEGREE, "ar")
            .add(2, MorphoFeature.NUMBER, "")
            .add(3, MorphoFeature.TENSE, "")
            .add(4, MorphoFeature.MOOD, "")
            .add(5, MorphoFeature.VOICE, "")
            .add(6, MorphoFeature.GENDER, "")
            .add(7, MorphoFeature.CASE, "")
            .add(8, MorphoFeature.GROUP, "")
            .add(9, MorphoFeature.STEM, "");

    /**
     * The Latin layout without case, group or stem; the last three positions
     * are not read.
     */
    public static final MorphoLayout HEBREW =
        new MorphoLayout(Language.HEBREW, 10)
            .add(0, MorphoFeature.PART_OF_SPEECH, "")
            .add(1, MorphoFeature.PERSON, "v")
            .add(1, MorphoFeature.DEGREE, "ar")
            .add(2, MorphoFeature.NUMBER, "")
            .add(3, MorphoFeature.TENSE, "")
            .add(4, MorphoFeature.MOOD, "")
            .add(5, MorphoFeature.VOICE, "")
            .add(6, MorphoFeature.GENDER, "");

    private static final char NOT_APPLICABLE = '-';

    private final Language language;

    private final int length;

    private final List<Field> fields = new ArrayList<Field>();

    private MorphoLayout(Language language, int length) {
        this.language = language;
        this.length = length;
    }

    private MorphoLayout add(int offset, MorphoFeature feature,
                             String posTags) {
        fields.add(new Field(offset, feature, posTags));
        return this;
    }

    /**
     * Returns the layout of the language's tags, if it has a morphology
     * table.
     */
    public static Optional<MorphoLayout> forLanguage(Language language) {
        switch (language) {
        case LATIN:
            return Optional.of(LATIN);
        case HEBREW:
            return Optional.of(HEBREW);
        default:
            return Optional.absent();
        }
    }

    public Language getLanguage() {
        return language;
    }

    public int getLength() {
        return length;
    }

    public List<Field> getFields() {
        return Collections.unmodifiableList(fields);
    }

    /**
     * Returns the code of each feature that applies to the word described by
     * the tag.  A missing or blank tag describes nothing and decodes to no
     * features.
     *
     * @throws DecodingException if the tag has the wrong length, contains
     *         whitespace, or has a code its feature does not define
     */
    public Map<MorphoFeature,Character> decode(String tag) {
        Map<MorphoFeature,Character> features =
            new EnumMap<MorphoFeature,Character>(MorphoFeature.class);
        if (tag == null || tag.trim().isEmpty())
            return features;
        if (tag.length() != length) {
            throw new DecodingException(tag, "expected " + length
                                        + " characters for " + language);
        }
        if (CharMatcher.whitespace().matchesAnyOf(tag))
            throw new DecodingException(tag, "contains whitespace");

        char posTag = tag.charAt(0);
        for (Field f : fields) {
            if (!f.appliesTo(posTag))
                continue;
            Map<Character,String> meanings = f.getFeature().getMeanings(posTag);
            if (meanings.isEmpty())
                continue;
            char code = tag.charAt(f.getOffset());
            if (meanings.containsKey(code))
                features.put(f.getFeature(), code);
            else if (code != NOT_APPLICABLE) {
                throw new DecodingException(tag, "unknown "
                    + f.getFeature().name().toLowerCase() + " code '" + code
                    + "' at " + f.getOffset());
            }
        }
        if (!features.containsKey(MorphoFeature.PART_OF_SPEECH))
            throw new DecodingException(tag, "no part of speech");
        return features;
    }
}
