/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Optional;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import edu.mit.jwi.item.POS;

import ca.mcgill.cs.mwn.Language;
import ca.mcgill.cs.mwn.Lemma;
import ca.mcgill.cs.mwn.Morpho;
import ca.mcgill.cs.mwn.Relation.RelationType;
import ca.mcgill.cs.mwn.Synset;

import ca.mcgill.cs.mwn.store.Query;
import ca.mcgill.cs.mwn.store.Row;
import ca.mcgill.cs.mwn.store.Tables;

import ca.mcgill.cs.mwn.util.SynsetIds;


/**
 * A {@link Lemma} whose synsets, synonyms and morphology are read from the
 * store on first access and kept thereafter.  The lemmas it relates to are
 * built from the rows that name them without being looked up again.
 */
public class LemmaImpl implements Lemma {

    private final String lemma;

    private final char posTag;

    private final Language language;

    private final String id;

    private final EntityResolver resolver;

    private final Supplier<List<Synset>> synsets;

    private final Supplier<Set<Lemma>> synonyms;

    private final Supplier<Optional<Morpho>> morpho;

    public LemmaImpl(String lemma, char posTag, Language language, String id,
                     EntityResolver resolver) {
        this(lemma, posTag, language, id, resolver, null);
    }

    /**
     * Creates a lemma whose morphology entry is already known, or will be
     * looked up if {@code knownMorpho} is {@code null}.
     */
    public LemmaImpl(String lemma, char posTag, Language language, String id,
                     EntityResolver resolver,
                     final Optional<Morpho> knownMorpho) {
        this.lemma = normalize(lemma);
        this.posTag = posTag;
        this.language = language;
        this.id = id;
        this.resolver = resolver;
        this.synsets = Suppliers.memoize(new Supplier<List<Synset>>() {
                public List<Synset> get() {
                    return Collections.unmodifiableList(readSynsets());
                }
            });
        this.synonyms = Suppliers.memoize(new Supplier<Set<Lemma>>() {
                public Set<Lemma> get() {
                    return Collections.unmodifiableSet(readSynonyms());
                }
            });
        if (knownMorpho != null) {
            this.morpho = Suppliers.ofInstance(knownMorpho);
        }
        else {
            this.morpho = Suppliers.memoize(new Supplier<Optional<Morpho>>() {
                    public Optional<Morpho> get() {
                        return LemmaImpl.this.resolver.findMorpho(
                            LemmaImpl.this);
                    }
                });
        }
    }

    /**
     * Returns the surface form as stored, with the words of a phrase joined by
     * {@code _}.
     */
    public static String normalize(String lemma) {
        return lemma.trim().replace(' ', '_');
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getLemma() {
        return lemma;
    }

    /**
     * {@inheritDoc}
     */
    @Override public POS getPOS() {
        return SynsetIds.toPOS(posTag);
    }

    /**
     * {@inheritDoc}
     */
    @Override public char getPosTag() {
        return posTag;
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
    @Override public Optional<String> getId() {
        return Optional.fromNullable(id);
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Synset> getSynsets() {
        return synsets.get();
    }

    /**
     * {@inheritDoc}
     */
    @Override public Set<Lemma> getSynonyms() {
        return synonyms.get();
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Lemma> getDerivates(POS... pos) {
        return restrict(relatedBy(RelationType.DERIVED_FROM, false), pos);
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Lemma> getRelatives(POS... pos) {
        return restrict(relatedBy(RelationType.RELATED_TO, true), pos);
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Lemma> getAntonyms() {
        return relatedBy(RelationType.ANTONYM, true);
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Lemma> getComposedOf() {
        return relatedBy(RelationType.COMPOSED_OF, true);
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Lemma> getComposes() {
        return relatedBy(RelationType.COMPOSES, true);
    }

    /**
     * {@inheritDoc}
     */
    @Override public Optional<Morpho> getMorpho() {
        return morpho.get();
    }

    private List<Synset> readSynsets() {
        POS pos = getPOS();
        if (pos == null)
            return new ArrayList<Synset>();
        Optional<Row> row = resolver.selectFirst(language, Tables.INDEX,
                                                 Query.where("lemma", lemma));
        List<Synset> found = new ArrayList<Synset>();
        if (!row.isPresent())
            return found;
        for (String synsetId : row.get().getTokens(Tables.indexColumn(pos))) {
            Optional<Synset> s = resolver.getSynset(synsetId, language);
            if (s.isPresent())
                found.add(s.get());
        }
        return found;
    }

    /**
     * Reads the synonyms listed for each of the lemma's synsets or, if the
     * language lists none, the other members of those synsets.
     */
    private Set<Lemma> readSynonyms() {
        Set<Lemma> found = new LinkedHashSet<Lemma>();
        if (resolver.getStore().hasTable(language, Tables.SYNONYMS)) {
            for (Synset s : getSynsets()) {
                Query q = Query.where("pos", String.valueOf(posTag))
                    .and("syn", s.getOffset());
                for (Row r : resolver.select(language, Tables.SYNONYMS, q)) {
                    if (!r.get("lemma").equals(lemma)) {
                        found.add(new LemmaImpl(r.get("lemma"), posTag,
                                                language, null, resolver));
                    }
                }
            }
        }
        if (found.isEmpty()) {
            for (Synset s : getSynsets()) {
                for (Lemma l : s.getLemmas()) {
                    if (!l.equals(this))
                        found.add(l);
                }
            }
        }
        return found;
    }

    /**
     * Returns the lemmas at the other end of the language's lexical relations
     * of the type that start ({@code fromSource}) or end at this lemma.
     */
    private List<Lemma> relatedBy(RelationType type, boolean fromSource) {
        String thisEnd = (fromSource) ? "w_source" : "w_target";
        String otherEnd = (fromSource) ? "w_target" : "w_source";
        String otherId = (fromSource) ? "id_target" : "id_source";
        Query q = Query.where(thisEnd, lemma).and("type", type.getSymbol());

        Set<Lemma> found = new LinkedHashSet<Lemma>();
        for (Row r : resolver.select(language, Tables.RELATION, q)) {
            if (!r.isSet(otherEnd) || !r.isSet(otherId))
                continue;
            found.add(new LemmaImpl(r.get(otherEnd), r.get(otherId).charAt(0),
                                    language, null, resolver));
        }
        return new ArrayList<Lemma>(found);
    }

    private static List<Lemma> restrict(List<Lemma> lemmas, POS... pos) {
        if (pos.length == 0)
            return lemmas;
        List<POS> allowed = Arrays.asList(pos);
        List<Lemma> restricted = new ArrayList<Lemma>();
        for (Lemma l : lemmas) {
            if (allowed.contains(l.getPOS()))
                restricted.add(l);
        }
        return restricted;
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof Lemma))
            return false;
        Lemma l = (Lemma)o;
        return l.getLemma().equals(lemma) && l.getPosTag() == posTag;
    }

    @Override public int hashCode() {
        return lemma.hashCode() * 31 + posTag;
    }

    /**
     * Returns the surface form with spaces between the words of a phrase.
     */
    public String toString() {
        return lemma.replace('_', ' ');
    }
}
