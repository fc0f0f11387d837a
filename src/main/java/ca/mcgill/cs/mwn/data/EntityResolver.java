/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Optional;

import edu.mit.jwi.item.POS;

import ca.mcgill.cs.mwn.DisambiguationException;
import ca.mcgill.cs.mwn.Language;
import ca.mcgill.cs.mwn.Lemma;
import ca.mcgill.cs.mwn.Morpho;
import ca.mcgill.cs.mwn.Semfield;
import ca.mcgill.cs.mwn.Synset;

import ca.mcgill.cs.mwn.store.Query;
import ca.mcgill.cs.mwn.store.Row;
import ca.mcgill.cs.mwn.store.Tables;
import ca.mcgill.cs.mwn.store.WordNetStore;

import ca.mcgill.cs.mwn.util.SynsetIds;


/**
 * Turns keys into entities: synset ids into {@link Synset} instances, surface
 * forms into {@link Lemma} instances, and semantic-field names into {@link
 * Semfield} instances.  A key that matches nothing yields an absent result; a
 * key that must be unique but matches several entries fails with a {@link
 * DisambiguationException} naming them, and is never resolved by picking the
 * first.
 *
 * <p>Synsets are looked up in the store of their origin language first, then
 * in the store of the language they are requested through, and last in the
 * reference language's store.  The resolver keeps every synset it has looked
 * up for its lifetime.
 */
public class EntityResolver {

    private final WordNetStore store;

    /**
     * The result of each synset lookup, keyed by the view language and id.
     */
    private final Map<String,Optional<Synset>> synsets =
        new HashMap<String,Optional<Synset>>();

    public EntityResolver(WordNetStore store) {
        this.store = store;
    }

    public WordNetStore getStore() {
        return store;
    }

    /**
     * Returns the synset with the id as seen through the language, or absent
     * if no store in the fallback order has a record of it.
     *
     * @throws ca.mcgill.cs.mwn.DecodingException if the id is malformed
     */
    public Optional<Synset> getSynset(String id, Language language) {
        String key = language.getCode() + " " + id;
        Optional<Synset> synset = synsets.get(key);
        if (synset == null) {
            synset = (findSynsetRow(id, language).isPresent())
                ? Optional.<Synset>of(new SynsetImpl(id, language, this))
                : Optional.<Synset>absent();
            synsets.put(key, synset);
        }
        return synset;
    }

    /**
     * Returns the languages whose stores are consulted for the synset's
     * record, in order: its origin language, the requesting language, and the
     * reference language, without repeats.
     */
    public List<Language> getFallbackOrder(String id, Language language) {
        Set<Language> order = new LinkedHashSet<Language>();
        order.add(SynsetIds.getOriginLanguage(id));
        order.add(language);
        order.add(Language.REFERENCE);
        return new ArrayList<Language>(order);
    }

    /**
     * Returns the first record of the synset in the fallback order.
     */
    Optional<Row> findSynsetRow(String id, Language language) {
        for (Language l : getFallbackOrder(id, language)) {
            Optional<Row> row = selectFirst(l, Tables.SYNSET,
                                            Query.where("id", id));
            if (row.isPresent())
                return row;
        }
        return Optional.absent();
    }

    /**
     * Returns the lemma with the surface form and part-of-speech tag, which
     * may be {@link Lemma#WILDCARD}.  For languages with a morphology table,
     * the morphology id and tag may further narrow the lookup; either may be
     * {@code null}.
     *
     * @throws DisambiguationException if more than one entry matches
     */
    public Optional<Lemma> getLemma(String lemma, char posTag, String id,
                                    String miscellanea, Language language) {
        String form = LemmaImpl.normalize(lemma);
        if (language.getLemmaModel() == Language.LemmaModel.MORPHOLOGY)
            return getMorphologyLemma(form, posTag, id, miscellanea, language);
        return getIndexLemma(form, posTag, language);
    }

    private Optional<Lemma> getIndexLemma(String form, char posTag,
                                          Language language) {
        Optional<Row> row =
            selectFirst(language, Tables.INDEX, Query.where("lemma", form));
        if (!row.isPresent())
            return Optional.absent();

        if (posTag != Lemma.WILDCARD) {
            POS pos = SynsetIds.toPOS(posTag);
            if (pos == null || !row.get().isSet(Tables.indexColumn(pos)))
                return Optional.absent();
            return Optional.<Lemma>of(
                new LemmaImpl(form, posTag, language, null, this));
        }

        List<String> candidates = new ArrayList<String>();
        for (POS pos : POS.values()) {
            if (row.get().isSet(Tables.indexColumn(pos)))
                candidates.add(String.valueOf(pos.getTag()));
        }
        if (candidates.isEmpty())
            return Optional.absent();
        if (candidates.size() > 1)
            throw new DisambiguationException(form, candidates);
        return Optional.<Lemma>of(new LemmaImpl(
            form, candidates.get(0).charAt(0), language, null, this));
    }

    private Optional<Lemma> getMorphologyLemma(String form, char posTag,
                                               String id, String miscellanea,
                                               Language language) {
        Query q = Query.where("lemma", form);
        if (id != null)
            q = q.and("id", id);
        if (SynsetIds.toPOS(posTag) != null)
            q = q.and("pos", String.valueOf(posTag));
        if (miscellanea != null)
            q = q.and("miscellanea", miscellanea);

        List<Row> rows = select(language, Tables.MORPHO, q);
        if (rows.isEmpty())
            return Optional.absent();
        if (rows.size() > 1)
            throw new DisambiguationException(form, describeMorphoRows(rows));
        return Optional.<Lemma>of(fromMorphoRow(rows.get(0), language));
    }

    /**
     * Returns the lemma described by a row of a morphology table.
     */
    public Lemma fromMorphoRow(Row row, Language language) {
        char posTag = (row.isSet("pos"))
            ? row.get("pos").charAt(0) : Lemma.WILDCARD;
        return new LemmaImpl(row.get("lemma"), posTag, language,
                             row.get("id"), this,
                             Optional.<Morpho>of(new MorphoImpl(row, language)));
    }

    /**
     * Returns the morphology entry of the lemma, if its language has a
     * morphology table.
     *
     * @throws DisambiguationException if several entries match
     */
    Optional<Morpho> findMorpho(Lemma lemma) {
        Language language = lemma.getLanguage();
        if (!store.hasTable(language, Tables.MORPHO))
            return Optional.absent();
        Query q = Query.where("lemma", lemma.getLemma());
        if (lemma.getId().isPresent())
            q = q.and("id", lemma.getId().get());
        if (lemma.getPosTag() != Lemma.WILDCARD)
            q = q.and("pos", String.valueOf(lemma.getPosTag()));

        List<Row> rows = select(language, Tables.MORPHO, q);
        if (rows.isEmpty())
            return Optional.absent();
        if (rows.size() > 1) {
            throw new DisambiguationException(lemma.getLemma(),
                                              describeMorphoRows(rows));
        }
        return Optional.<Morpho>of(new MorphoImpl(rows.get(0), language));
    }

    private static List<String> describeMorphoRows(List<Row> rows) {
        List<String> described = new ArrayList<String>();
        for (Row r : rows)
            described.add(r.get("id") + " (" + r.get("miscellanea") + ")");
        return described;
    }

    /**
     * Returns the semantic field with the English name and, if not {@code
     * null}, the code.
     *
     * @throws DisambiguationException if no code is given and the name
     *         belongs to more than one field
     */
    public Optional<Semfield> getSemfield(String english, String code,
                                          Language language) {
        String name = english.replace(' ', '_');
        Query q = Query.where("english", name);
        if (code != null)
            q = q.and("code", code);
        List<Row> rows = select(Language.COMMON, Tables.SEMFIELD_HIERARCHY, q);
        if (rows.isEmpty())
            return Optional.absent();
        if (code == null && rows.size() > 1) {
            List<String> codes = new ArrayList<String>();
            for (Row r : rows)
                codes.add(r.get("code"));
            throw new DisambiguationException(name, codes);
        }
        return Optional.<Semfield>of(toSemfield(rows.get(0), language));
    }

    /**
     * Returns every field with the English name, one for each code.
     */
    public List<Semfield> getSemfieldsByEnglish(String english,
                                                Language language) {
        return toSemfields(select(Language.COMMON, Tables.SEMFIELD_HIERARCHY,
                                  Query.where("english",
                                              english.replace(' ', '_'))),
                           language);
    }

    /**
     * Returns every field with the code.
     */
    public List<Semfield> getSemfieldsByCode(String code, Language language) {
        return toSemfields(select(Language.COMMON, Tables.SEMFIELD_HIERARCHY,
                                  Query.where("code", code)),
                           language);
    }

    /**
     * Returns the field that a hierarchy column of the field with the code
     * names.  When the name belongs to several fields, the one whose code
     * shares the longest prefix with {@code code} is chosen.
     *
     * @throws DisambiguationException if several fields share that prefix
     */
    Optional<Semfield> resolveRelatedSemfield(String name, String code,
                                              Language language) {
        List<Row> rows = select(Language.COMMON, Tables.SEMFIELD_HIERARCHY,
                                Query.where("english", name));
        if (rows.isEmpty())
            return Optional.absent();
        if (rows.size() == 1)
            return Optional.<Semfield>of(toSemfield(rows.get(0), language));

        List<Row> best = new ArrayList<Row>();
        int bestLength = -1;
        for (Row r : rows) {
            int len = commonPrefixLength(code, r.get("code"));
            if (len > bestLength) {
                best.clear();
                bestLength = len;
            }
            if (len == bestLength)
                best.add(r);
        }
        if (best.size() > 1) {
            List<String> codes = new ArrayList<String>();
            for (Row r : best)
                codes.add(r.get("code"));
            throw new DisambiguationException(name, codes);
        }
        return Optional.<Semfield>of(toSemfield(best.get(0), language));
    }

    /**
     * Returns the hierarchy row of the field.
     */
    Optional<Row> findHierarchyRow(String english, String code) {
        return selectFirst(Language.COMMON, Tables.SEMFIELD_HIERARCHY,
                           Query.where("english", english).and("code", code));
    }

    public Semfield toSemfield(Row row, Language language) {
        return new SemfieldImpl(row.get("english"), row.get("code"),
                                language, this);
    }

    private List<Semfield> toSemfields(List<Row> rows, Language language) {
        List<Semfield> fields = new ArrayList<Semfield>();
        for (Row r : rows)
            fields.add(toSemfield(r, language));
        return fields;
    }

    private static int commonPrefixLength(String a, String b) {
        if (a == null || b == null)
            return 0;
        int n = Math.min(a.length(), b.length());
        int i = 0;
        while (i < n && a.charAt(i) == b.charAt(i))
            i++;
        return i;
    }

    /**
     * Returns the rows of the language's table that match the query, which is
     * empty if the language has no such table.
     */
    public List<Row> select(Language language, String table, Query query) {
        Optional<List<Row>> rows = store.query(language, table, query);
        return (rows.isPresent()) ? rows.get() : Collections.<Row>emptyList();
    }

    /**
     * Returns the first row of the language's table that matches the query.
     */
    public Optional<Row> selectFirst(Language language, String table,
                                     Query query) {
        List<Row> rows = select(language, table, query);
        return (rows.isEmpty())
            ? Optional.<Row>absent() : Optional.of(rows.get(0));
    }
}
