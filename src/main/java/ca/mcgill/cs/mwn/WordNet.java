/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Function;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import edu.mit.jwi.item.POS;

import ca.mcgill.cs.mwn.data.EntityResolver;
import ca.mcgill.cs.mwn.data.LemmaImpl;
import ca.mcgill.cs.mwn.data.RelationImpl;

import ca.mcgill.cs.mwn.store.Query;
import ca.mcgill.cs.mwn.store.Row;
import ca.mcgill.cs.mwn.store.Tables;
import ca.mcgill.cs.mwn.store.WordNetStore;

import ca.mcgill.cs.mwn.util.MaterializingIterable;
import ca.mcgill.cs.mwn.util.MwnLogger;
import ca.mcgill.cs.mwn.util.SynsetIds;


/**
 * The WordNet of one language within the MultiWordNet.  It looks up and
 * iterates over the language's lemmas, synsets, relations and the semantic
 * fields shared by all languages.
 *
 * <p>Iterating over lemmas, synsets, relations or fields the first time reads
 * them from the store as the iteration proceeds; once an iteration has run to
 * the end, later ones replay what it read.  Lemma lookups and the maximum
 * taxonomy depths are likewise kept for the lifetime of the instance.  An
 * instance is not thread-safe.
 */
public class WordNet implements Iterable<Lemma> {

    /**
     * The number of lemma lookups and searches whose results are kept.
     */
    private static final int LOOKUP_CACHE_SIZE = 2048;

    private final Language language;

    private final EntityResolver resolver;

    private final Cache<String,Optional<Lemma>> lemmaLookups;

    private final Cache<String,List<Lemma>> lemmaSearches;

    private final MaterializingIterable<Lemma> lemmas;

    /**
     * The synsets of each part of speech, keyed by tag, with all synsets under
     * {@link #ALL_POS}.
     */
    private final Map<String,MaterializingIterable<Synset>> synsets =
        new HashMap<String,MaterializingIterable<Synset>>();

    private static final String ALL_POS = "nvar";

    private final MaterializingIterable<Relation> relations;

    private final MaterializingIterable<Semfield> semfields;

    private final TObjectIntMap<POS> maxDepths = new TObjectIntHashMap<POS>();

    public WordNet(Language language, WordNetStore store) {
        this(language, new EntityResolver(store));
    }

    /**
     * Creates the WordNet of the language over a resolver that may be shared
     * with the WordNets of other languages.
     */
    public WordNet(Language language, EntityResolver resolver) {
        this.language = language;
        this.resolver = resolver;
        this.lemmaLookups = CacheBuilder.newBuilder()
            .maximumSize(LOOKUP_CACHE_SIZE).<String,Optional<Lemma>>build();
        this.lemmaSearches = CacheBuilder.newBuilder()
            .maximumSize(LOOKUP_CACHE_SIZE).<String,List<Lemma>>build();
        this.lemmas = new MaterializingIterable<Lemma>() {
                protected Iterator<Lemma> compute() {
                    return readLemmas();
                }
            };
        this.relations = new MaterializingIterable<Relation>() {
                protected Iterator<Relation> compute() {
                    return readRelations();
                }
            };
        this.semfields = new MaterializingIterable<Semfield>() {
                protected Iterator<Semfield> compute() {
                    return readSemfields();
                }
            };
    }

    public Language getLanguage() {
        return language;
    }

    public EntityResolver getResolver() {
        return resolver;
    }

    /**
     * Returns the synset with the id, looked up in the store of its origin
     * language, then this language's, then the reference language's.
     *
     * @throws DecodingException if the id is malformed
     */
    public Optional<Synset> getSynset(String id) {
        return resolver.getSynset(id, language);
    }

    /**
     * Returns the lemma with the surface form and part of speech, which may be
     * {@code null} to accept any.
     *
     * @throws DisambiguationException if {@code pos} is {@code null} and the
     *         form has entries for several parts of speech
     */
    public Optional<Lemma> getLemma(String lemma, POS pos) {
        return getLemma(lemma, (pos == null) ? Lemma.WILDCARD : pos.getTag(),
                        null);
    }

    /**
     * Returns the lemma with the surface form, part-of-speech tag (or {@link
     * Lemma#WILDCARD}) and, for languages with a morphology table, the
     * morphological tag, which may be {@code null}.
     *
     * @throws DisambiguationException if several entries match
     */
    public Optional<Lemma> getLemma(String lemma, char posTag,
                                    String miscellanea) {
        String key = Joiner.on('\t').useForNull("").join(
            LemmaImpl.normalize(lemma), posTag, miscellanea);
        Optional<Lemma> l = lemmaLookups.getIfPresent(key);
        if (l == null) {
            l = resolver.getLemma(lemma, posTag, null, miscellanea, language);
            lemmaLookups.put(key, l);
        }
        return l;
    }

    /**
     * Returns every lemma whose surface form matches {@code lemma} under the
     * match mode, restricted to the part of speech unless it is {@link
     * Lemma#WILDCARD} and, for languages with a morphology table, to the
     * morphological tag unless it is {@code null}.  A {@code null} lemma
     * matches every surface form.  The returned list is unmodifiable.
     */
    public List<Lemma> get(String lemma, char posTag, String miscellanea,
                           Query.Match match) {
        String key = Joiner.on('\t').useForNull("").join(
            lemma, posTag, miscellanea, match);
        List<Lemma> found = lemmaSearches.getIfPresent(key);
        if (found == null) {
            found = ImmutableList.copyOf(
                search(lemma, posTag, miscellanea, match));
            lemmaSearches.put(key, found);
        }
        return found;
    }

    private List<Lemma> search(String lemma, char posTag, String miscellanea,
                               Query.Match match) {
        Query q = Query.all();
        if (lemma != null)
            q = q.and("lemma", LemmaImpl.normalize(lemma), match);
        if (SynsetIds.toPOS(posTag) != null)
            q = q.and("pos", String.valueOf(posTag));

        List<Lemma> found = new ArrayList<Lemma>();
        if (language.getLemmaModel() == Language.LemmaModel.MORPHOLOGY) {
            if (miscellanea != null)
                q = q.and("miscellanea", miscellanea);
            // Homographs with distinct morphology ids are all kept
            for (Row r : resolver.select(language, Tables.MORPHO, q))
                found.add(resolver.fromMorphoRow(r, language));
        }
        else {
            Set<Lemma> distinct = new LinkedHashSet<Lemma>();
            for (Row r : resolver.select(language, Tables.LEMMA, q)) {
                if (!r.isSet("pos"))
                    continue;
                distinct.add(new LemmaImpl(r.get("lemma"),
                                           r.get("pos").charAt(0), language,
                                           null, resolver));
            }
            found.addAll(distinct);
        }
        MwnLogger.veryVerbose("%d lemmas match %s", found.size(), q);
        return found;
    }

    /**
     * Returns the lemmas of this language.
     */
    public Iterable<Lemma> lemmas() {
        return lemmas;
    }

    /**
     * Returns an iterator over the lemmas of this language.
     */
    public Iterator<Lemma> iterator() {
        return lemmas.iterator();
    }

    /**
     * Returns the synsets of this language's synset table.
     */
    public Iterable<Synset> synsets() {
        return synsets(null);
    }

    /**
     * Returns the synsets of this language's synset table with the part of
     * speech, or all of them if it is {@code null}.
     */
    public Iterable<Synset> synsets(final POS pos) {
        String key = (pos == null) ? ALL_POS : String.valueOf(pos.getTag());
        MaterializingIterable<Synset> it = synsets.get(key);
        if (it == null) {
            it = new MaterializingIterable<Synset>() {
                    protected Iterator<Synset> compute() {
                        return readSynsets(pos);
                    }
                };
            synsets.put(key, it);
        }
        return it;
    }

    /**
     * Returns the relations shared by all languages followed by those of this
     * language.
     */
    public Iterable<Relation> relations() {
        return relations;
    }

    /**
     * Returns the relations between the synsets of the type, shared or of
     * this language; any of the three may be {@code null} to match all.
     */
    public List<Relation> getRelations(Synset source, Synset target,
                                       Relation.RelationType type) {
        Query q = Query.all();
        if (source != null)
            q = q.and("id_source", source.getId());
        if (target != null)
            q = q.and("id_target", target.getId());
        if (type != null)
            q = q.and("type", type.getSymbol());

        List<Relation> found = new ArrayList<Relation>();
        for (Row r : resolver.select(Language.COMMON, Tables.RELATION, q))
            found.add(new RelationImpl(r, Language.COMMON, language, resolver));
        for (Row r : resolver.select(language, Tables.RELATION, q))
            found.add(new RelationImpl(r, language, language, resolver));
        return found;
    }

    /**
     * Returns this language's relations between the two lemmas, of the type
     * unless it is {@code null}.
     *
     * @throws IllegalArgumentException if either lemma is {@code null}
     */
    public List<Relation> getLexicalRelations(Lemma source, Lemma target,
                                              Relation.RelationType type) {
        if (source == null || target == null) {
            throw new IllegalArgumentException(
                "A source and a target lemma are required");
        }
        Query q = Query.where("w_source", source.getLemma())
            .and("w_target", target.getLemma());
        if (type != null)
            q = q.and("type", type.getSymbol());
        List<Relation> found = new ArrayList<Relation>();
        for (Row r : resolver.select(language, Tables.RELATION, q))
            found.add(new RelationImpl(r, language, language, resolver));
        return found;
    }

    /**
     * Returns every semantic field of the shared hierarchy.
     */
    public Iterable<Semfield> semfields() {
        return semfields;
    }

    /**
     * Returns the semantic field with the English name and, unless it is
     * {@code null}, the code.
     *
     * @throws DisambiguationException if no code is given and several fields
     *         have the name
     */
    public Optional<Semfield> getSemfield(String english, String code) {
        return resolver.getSemfield(english, code, language);
    }

    public List<Semfield> getSemfieldsByCode(String code) {
        return resolver.getSemfieldsByCode(code, language);
    }

    public List<Semfield> getSemfieldsByEnglish(String english) {
        return resolver.getSemfieldsByEnglish(english, language);
    }

    /**
     * Returns the greatest {@link Synset#getMaxDepth() maximum depth} of this
     * language's synsets with the part of speech.
     */
    public int maxDepthFor(POS pos) {
        if (maxDepths.containsKey(pos))
            return maxDepths.get(pos);
        int depth = 0;
        for (Synset s : synsets(pos))
            depth = Math.max(depth, s.getMaxDepth());
        MwnLogger.verbose("Maximum %s depth in %s: %d", pos, language, depth);
        maxDepths.put(pos, depth);
        return depth;
    }

    /**
     * Reads the lemmas from the morphology table or, for languages keyed by
     * index, one lemma for each part of speech of each index row.
     */
    private Iterator<Lemma> readLemmas() {
        if (language.getLemmaModel() == Language.LemmaModel.MORPHOLOGY) {
            return Iterators.transform(
                resolver.select(language, Tables.MORPHO, Query.all())
                    .iterator(),
                new Function<Row,Lemma>() {
                    public Lemma apply(Row r) {
                        return resolver.fromMorphoRow(r, language);
                    }
                });
        }
        final Iterator<Row> rows =
            resolver.select(language, Tables.INDEX, Query.all()).iterator();
        return new AbstractIterator<Lemma>() {
            private final Deque<Lemma> pending = new ArrayDeque<Lemma>();

            @Override protected Lemma computeNext() {
                while (pending.isEmpty() && rows.hasNext()) {
                    Row r = rows.next();
                    for (POS pos : POS.values()) {
                        if (r.isSet(Tables.indexColumn(pos))) {
                            pending.add(new LemmaImpl(r.get("lemma"),
                                                      pos.getTag(), language,
                                                      null, resolver));
                        }
                    }
                }
                return (pending.isEmpty()) ? endOfData() : pending.poll();
            }
        };
    }

    private Iterator<Synset> readSynsets(POS pos) {
        Query q = (pos == null)
            ? Query.all()
            : Query.where("id", pos.getTag() + "#", Query.Match.STARTS_WITH);
        final Iterator<Row> rows =
            resolver.select(language, Tables.SYNSET, q).iterator();
        return new AbstractIterator<Synset>() {
            @Override protected Synset computeNext() {
                while (rows.hasNext()) {
                    Optional<Synset> s =
                        resolver.getSynset(rows.next().get("id"), language);
                    if (s.isPresent())
                        return s.get();
                }
                return endOfData();
            }
        };
    }

    private Iterator<Relation> readRelations() {
        Iterator<Relation> shared = Iterators.transform(
            resolver.select(Language.COMMON, Tables.RELATION, Query.all())
                .iterator(),
            new Function<Row,Relation>() {
                public Relation apply(Row r) {
                    return new RelationImpl(r, Language.COMMON, language,
                                            resolver);
                }
            });
        Iterator<Relation> own = Iterators.transform(
            resolver.select(language, Tables.RELATION, Query.all()).iterator(),
            new Function<Row,Relation>() {
                public Relation apply(Row r) {
                    return new RelationImpl(r, language, language, resolver);
                }
            });
        return Iterators.concat(shared, own);
    }

    private Iterator<Semfield> readSemfields() {
        return Iterators.transform(
            resolver.select(Language.COMMON, Tables.SEMFIELD_HIERARCHY,
                            Query.all()).iterator(),
            new Function<Row,Semfield>() {
                public Semfield apply(Row r) {
                    return resolver.toSemfield(r, language);
                }
            });
    }

    public String toString() {
        return "WordNet[" + language.getCode() + "]";
    }
}
