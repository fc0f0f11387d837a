/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.util;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

import ca.mcgill.cs.mwn.Lemma;
import ca.mcgill.cs.mwn.Morpho;
import ca.mcgill.cs.mwn.Relation;
import ca.mcgill.cs.mwn.Semfield;
import ca.mcgill.cs.mwn.Synset;

import ca.mcgill.cs.mwn.morph.MorphoFeature;


/**
 * Serializes entities as JSON for display.  Only the attributes an entity
 * holds directly are written; related entities appear by their keys.
 */
public class JsonUtils {

    private JsonUtils() { }

    public static JSONObject toJson(Synset s) {
        JSONObject json = new JSONObject();
        json.put("id", s.getId());
        json.put("language", s.getLanguage().getCode());
        json.put("origin", s.getOriginLanguage().getCode());
        json.put("pos", String.valueOf(s.getPOS().getTag()));
        json.put("gloss", s.getGloss());
        json.put("lemmas", toArray(s.getLemmas()));
        return json;
    }

    public static JSONObject toJson(Lemma l) {
        JSONObject json = new JSONObject();
        json.put("lemma", l.toString());
        json.put("pos", String.valueOf(l.getPosTag()));
        json.put("language", l.getLanguage().getCode());
        if (l.getId().isPresent())
            json.put("id", l.getId().get());
        return json;
    }

    public static JSONObject toJson(Relation r) {
        JSONObject json = new JSONObject();
        json.put("type", r.getTypeSymbol());
        if (r.getType().isPresent()
                && r.getType().get().isDefinedFor(
                    SynsetIds.getPOS(r.getSourceId()))) {
            json.put("name", r.getTypeName());
        }
        json.put("source", r.getSourceId());
        json.put("target", r.getTargetId());
        if (r.isLexical()) {
            json.put("w_source", r.getSourceLemma().get().toString());
            json.put("w_target", r.getTargetLemma().get().toString());
        }
        json.put("language", r.getLanguage().getCode());
        json.put("new", r.isNew());
        return json;
    }

    public static JSONObject toJson(Semfield f) {
        JSONObject json = new JSONObject();
        json.put("english", f.getEnglish());
        json.put("code", f.getCode());
        return json;
    }

    public static JSONObject toJson(Morpho m) {
        JSONObject json = new JSONObject();
        json.put("id", m.getId());
        json.put("lemma", m.getLemma());
        json.put("tag", m.getTag());
        JSONObject features = new JSONObject();
        for (Map.Entry<MorphoFeature,Character> e
                 : m.getFeatures().entrySet()) {
            features.put(e.getKey().name().toLowerCase(),
                         m.getFeatureName(e.getKey()).or(
                             String.valueOf(e.getValue())));
        }
        json.put("features", features);
        json.put("dictionary_form", toArray(m.getDictionaryForm()));
        return json;
    }

    /**
     * Returns the paths as arrays of synset ids.
     */
    public static JSONArray pathsToJson(List<List<Synset>> paths) {
        JSONArray arr = new JSONArray();
        for (List<Synset> path : paths)
            arr.put(idsToJson(path));
        return arr;
    }

    public static JSONArray idsToJson(Iterable<Synset> synsets) {
        JSONArray arr = new JSONArray();
        for (Synset s : synsets)
            arr.put(s.getId());
        return arr;
    }

    /**
     * Returns the {@code String} form of each value as an array.
     */
    public static JSONArray toArray(Collection<?> values) {
        JSONArray arr = new JSONArray();
        for (Object o : values)
            arr.put(String.valueOf(o));
        return arr;
    }
}
