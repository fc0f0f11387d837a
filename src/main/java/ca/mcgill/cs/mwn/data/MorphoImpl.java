/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import edu.ucla.sspace.util.Duple;

import ca.mcgill.cs.mwn.Language;
import ca.mcgill.cs.mwn.Morpho;

import ca.mcgill.cs.mwn.morph.DictionaryForms;
import ca.mcgill.cs.mwn.morph.MorphoFeature;
import ca.mcgill.cs.mwn.morph.MorphoLayout;

import ca.mcgill.cs.mwn.store.Row;


/**
 * A {@link Morpho} backed by one row of a morphology table.  The tag is
 * decoded on first access to a feature.
 */
public class MorphoImpl implements Morpho {

    private static final Splitter FORM_PAIR = Splitter.on('=').limit(2);

    private final Row row;

    private final Language language;

    private final Supplier<Map<MorphoFeature,Character>> features;

    public MorphoImpl(Row row, Language language) {
        this.row = row;
        this.language = language;
        this.features =
            Suppliers.memoize(new Supplier<Map<MorphoFeature,Character>>() {
                public Map<MorphoFeature,Character> get() {
                    return Collections.unmodifiableMap(decode());
                }
            });
    }

    private Map<MorphoFeature,Character> decode() {
        Optional<MorphoLayout> layout = MorphoLayout.forLanguage(language);
        if (!layout.isPresent()) {
            return new EnumMap<MorphoFeature,Character>(MorphoFeature.class);
        }
        return layout.get().decode(getTag());
    }

    /**
     * {@inheritDoc}
     */
    @Override public Language getLanguage() {
        return language;
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getId() {
        return valueOf("id");
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getLemma() {
        return valueOf("lemma");
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getPos() {
        return valueOf("pos");
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<String> getPrincipalParts() {
        return row.getTokens("principal_parts");
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Duple<String,String>> getIrregularForms() {
        return toPairs("irregular_forms");
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Duple<String,String>> getAlternativeForms() {
        return toPairs("alternative_forms");
    }

    /**
     * Splits each {@code key=form} token of the column into a pair.
     */
    private List<Duple<String,String>> toPairs(String column) {
        List<Duple<String,String>> pairs =
            new ArrayList<Duple<String,String>>();
        for (String token : row.getTokens(column)) {
            List<String> kv = FORM_PAIR.splitToList(token);
            pairs.add(new Duple<String,String>(
                kv.get(0), (kv.size() > 1) ? kv.get(1) : ""));
        }
        return pairs;
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getPronunciation() {
        return valueOf("pronunciation");
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getScriptField(String column) {
        return valueOf(column);
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getTag() {
        return valueOf("miscellanea");
    }

    /**
     * {@inheritDoc}
     */
    @Override public Map<MorphoFeature,Character> getFeatures() {
        return features.get();
    }

    /**
     * {@inheritDoc}
     */
    @Override public Optional<Character> getFeature(MorphoFeature feature) {
        return Optional.fromNullable(getFeatures().get(feature));
    }

    /**
     * {@inheritDoc}
     */
    @Override public Optional<String> getFeatureName(MorphoFeature feature) {
        Optional<Character> code = getFeature(feature);
        if (!code.isPresent())
            return Optional.absent();
        char posTag = getFeatures().get(MorphoFeature.PART_OF_SPEECH);
        return Optional.fromNullable(
            feature.getMeanings(posTag).get(code.get()));
    }

    /**
     * {@inheritDoc}
     */
    @Override public boolean isIStem() {
        return getFeature(MorphoFeature.STEM).or('-') == 'i';
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<String> getDictionaryForm() {
        return DictionaryForms.of(this);
    }

    private String valueOf(String column) {
        String v = row.get(column);
        return (v == null) ? "" : v;
    }

    public String toString() {
        return String.format("Morpho[%s (%s)]", getLemma(), getTag());
    }
}
