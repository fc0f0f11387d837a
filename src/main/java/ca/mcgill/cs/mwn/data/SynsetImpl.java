/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.google.common.base.Optional;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import edu.mit.jwi.item.POS;

import ca.mcgill.cs.mwn.Language;
import ca.mcgill.cs.mwn.Lemma;
import ca.mcgill.cs.mwn.Relation;
import ca.mcgill.cs.mwn.Semfield;
import ca.mcgill.cs.mwn.Synset;
import ca.mcgill.cs.mwn.UnsupportedRelationException;

import ca.mcgill.cs.mwn.store.Query;
import ca.mcgill.cs.mwn.store.Row;
import ca.mcgill.cs.mwn.store.Tables;

import ca.mcgill.cs.mwn.util.SynsetGraphs;
import ca.mcgill.cs.mwn.util.SynsetIds;


/**
 * A {@link Synset} whose lemmas, gloss, semantic fields and relations are
 * read from the store on first access and kept thereafter.
 */
public class SynsetImpl implements Synset {

    /**
     * The placeholder stored for a concept that has no lexicalization in a
     * language.
     */
    static final String GAP = "GAP!";

    private final String id;

    private final Language language;

    private final EntityResolver resolver;

    private final Supplier<List<Lemma>> lemmas;

    private final Supplier<String> gloss;

    private final Supplier<List<Semfield>> semfields;

    private final Supplier<List<Relation>> relations;

    public SynsetImpl(String id, Language language, EntityResolver resolver) {
        this.id = id;
        this.language = language;
        this.resolver = resolver;
        this.lemmas = Suppliers.memoize(new Supplier<List<Lemma>>() {
                public List<Lemma> get() {
                    return Collections.unmodifiableList(readLemmas());
                }
            });
        this.gloss = Suppliers.memoize(new Supplier<String>() {
                public String get() {
                    return readGloss();
                }
            });
        this.semfields = Suppliers.memoize(new Supplier<List<Semfield>>() {
                public List<Semfield> get() {
                    return Collections.unmodifiableList(readSemfields());
                }
            });
        this.relations = Suppliers.memoize(new Supplier<List<Relation>>() {
                public List<Relation> get() {
                    return Collections.unmodifiableList(readRelations());
                }
            });
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getId() {
        return id;
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
    @Override public Language getOriginLanguage() {
        return SynsetIds.getOriginLanguage(id);
    }

    /**
     * {@inheritDoc}
     */
    @Override public POS getPOS() {
        return SynsetIds.getPOS(id);
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getOffset() {
        return SynsetIds.getOffset(id);
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Lemma> getLemmas() {
        return lemmas.get();
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getGloss() {
        return gloss.get();
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Semfield> getSemfields() {
        return semfields.get();
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Relation> getRelations() {
        return relations.get();
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Relation> getRelations(Relation.RelationType type) {
        if (!type.isDefinedFor(getPOS()))
            throw new UnsupportedRelationException(type, getPOS());
        List<Relation> ofType = new ArrayList<Relation>();
        for (Relation r : getRelations()) {
            if (r.getTypeSymbol().equals(type.getSymbol()))
                ofType.add(r);
        }
        return ofType;
    }

    /**
     * {@inheritDoc}
     */
    @Override public Optional<Relation> getRelationTo(Synset target) {
        for (Relation r : getRelations()) {
            if (r.getTargetId().equals(target.getId()))
                return Optional.of(r);
        }
        return Optional.absent();
    }

    /**
     * {@inheritDoc}
     */
    @Override public Iterable<Synset> getClosure(Relation.RelationType type,
                                                 int maxDepth) {
        return SynsetGraphs.closure(this, type, maxDepth);
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Synset> getHypernyms() {
        return SynsetGraphs.hypernyms(this);
    }

    /**
     * {@inheritDoc}
     */
    @Override public int getMaxDepth() {
        return SynsetGraphs.maxDepth(this);
    }

    /**
     * {@inheritDoc}
     */
    @Override public int getMinDepth() {
        return SynsetGraphs.minDepth(this);
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Synset> getRoots() {
        return SynsetGraphs.roots(this);
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<List<Synset>> getPathsToRoot() {
        return SynsetGraphs.pathsToRoot(this);
    }

    /**
     * Reads the words and then the phrases of the synset from the language's
     * synset table or, for languages without one, collects the lemmas whose
     * index entries list the synset.
     */
    private List<Lemma> readLemmas() {
        Set<Lemma> found = new LinkedHashSet<Lemma>();
        char posTag = id.charAt(0);
        if (resolver.getStore().hasTable(language, Tables.SYNSET)) {
            Optional<Row> row = resolver.selectFirst(
                language, Tables.SYNSET, Query.where("id", id));
            if (row.isPresent()) {
                for (String column : new String[] { "word", "phrase" }) {
                    for (String token : row.get().getTokens(column)) {
                        if (token.equalsIgnoreCase(GAP))
                            continue;
                        found.add(new LemmaImpl(token.toLowerCase(Locale.ROOT),
                                                posTag, language, null,
                                                resolver));
                    }
                }
            }
        }
        else {
            String column = Tables.indexColumn(getPOS());
            List<Row> rows = resolver.select(
                language, Tables.INDEX,
                Query.where(column, id, Query.Match.CONTAINS));
            for (Row r : rows) {
                // CONTAINS also matches ids of which this one is a prefix
                if (!r.getTokens(column).contains(id)
                        || r.get("lemma").equalsIgnoreCase(GAP))
                    continue;
                found.add(new LemmaImpl(r.get("lemma"), posTag, language,
                                        null, resolver));
            }
        }
        return new ArrayList<Lemma>(found);
    }

    private String readGloss() {
        for (Language l : resolver.getFallbackOrder(id, language)) {
            Optional<Row> row = resolver.selectFirst(
                l, Tables.SYNSET, Query.where("id", id));
            if (row.isPresent() && row.get().isSet("gloss"))
                return row.get().get("gloss");
        }
        return "";
    }

    /**
     * Reads the names of the synset's fields from the shared semfield table
     * or, if it has none there, from the language's own, and looks up every
     * field with each name.
     */
    private List<Semfield> readSemfields() {
        Query q = Query.where("synset", id);
        List<Row> rows = resolver.select(Language.COMMON, Tables.SEMFIELD, q);
        if (rows.isEmpty() && language != Language.COMMON)
            rows = resolver.select(language, Tables.SEMFIELD, q);

        Set<Semfield> fields = new LinkedHashSet<Semfield>();
        for (Row r : rows) {
            for (String name : r.getTokens("english"))
                fields.addAll(resolver.getSemfieldsByEnglish(name, language));
        }
        return new ArrayList<Semfield>(fields);
    }

    private List<Relation> readRelations() {
        Query q = Query.where("id_source", id);
        List<Relation> rels = new ArrayList<Relation>();
        for (Row r : resolver.select(Language.COMMON, Tables.RELATION, q))
            rels.add(new RelationImpl(r, Language.COMMON, language, resolver));
        if (language != Language.COMMON) {
            for (Row r : resolver.select(language, Tables.RELATION, q))
                rels.add(new RelationImpl(r, language, language, resolver));
        }
        return rels;
    }

    @Override public boolean equals(Object o) {
        return o instanceof Synset && ((Synset)o).getId().equals(id);
    }

    @Override public int hashCode() {
        return id.hashCode();
    }

    public String toString() {
        return String.format("Synset[%s (%s)]", id, language.getCode());
    }
}
