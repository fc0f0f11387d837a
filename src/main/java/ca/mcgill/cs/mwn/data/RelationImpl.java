/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.data;

import com.google.common.base.Objects;
import com.google.common.base.Optional;

import ca.mcgill.cs.mwn.DecodingException;
import ca.mcgill.cs.mwn.Language;
import ca.mcgill.cs.mwn.Lemma;
import ca.mcgill.cs.mwn.Relation;
import ca.mcgill.cs.mwn.Synset;

import ca.mcgill.cs.mwn.store.Row;

import ca.mcgill.cs.mwn.util.SynsetIds;


/**
 * A basic implementation of the {@link Relation} interface, backed by one row
 * of a relation table.
 */
public class RelationImpl implements Relation {

    private static final String NEW_STATUS = "new";

    private final String type;

    private final String sourceId;

    private final String targetId;

    private final String sourceLemma;

    private final String targetLemma;

    private final String status;

    private final Language language;

    /**
     * The language through which the relation's synsets and lemmas are seen.
     */
    private final Language view;

    private final EntityResolver resolver;

    /**
     * Creates the relation stored in a row of the {@code language}'s relation
     * table.
     */
    public RelationImpl(Row row, Language language, Language view,
                        EntityResolver resolver) {
        this.type = row.get("type");
        this.sourceId = row.get("id_source");
        this.targetId = row.get("id_target");
        this.sourceLemma = (row.isSet("w_source")) ? row.get("w_source") : null;
        this.targetLemma = (row.isSet("w_target")) ? row.get("w_target") : null;
        this.status = row.get("status");
        this.language = language;
        this.view = view;
        this.resolver = resolver;
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getTypeSymbol() {
        return type;
    }

    /**
     * {@inheritDoc}
     */
    @Override public Optional<RelationType> getType() {
        return RelationType.fromSymbol(type);
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getTypeName() {
        Optional<RelationType> t = getType();
        if (!t.isPresent())
            throw new DecodingException(type, "unknown relation type");
        return t.get().getName(SynsetIds.getPOS(sourceId));
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getSourceId() {
        return sourceId;
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getTargetId() {
        return targetId;
    }

    /**
     * {@inheritDoc}
     */
    @Override public Optional<Synset> getSource() {
        return resolver.getSynset(sourceId, view);
    }

    /**
     * {@inheritDoc}
     */
    @Override public Optional<Synset> getTarget() {
        return resolver.getSynset(targetId, view);
    }

    /**
     * {@inheritDoc}
     */
    @Override public Optional<Lemma> getSourceLemma() {
        return toLemma(sourceLemma, sourceId);
    }

    /**
     * {@inheritDoc}
     */
    @Override public Optional<Lemma> getTargetLemma() {
        return toLemma(targetLemma, targetId);
    }

    private Optional<Lemma> toLemma(String form, String synsetId) {
        if (form == null)
            return Optional.absent();
        return Optional.<Lemma>of(new LemmaImpl(form, synsetId.charAt(0), view,
                                                null, resolver));
    }

    /**
     * {@inheritDoc}
     */
    @Override public boolean isLexical() {
        return sourceLemma != null && targetLemma != null;
    }

    /**
     * {@inheritDoc}
     */
    @Override public boolean isNew() {
        return NEW_STATUS.equalsIgnoreCase(status);
    }

    /**
     * {@inheritDoc}
     */
    @Override public Language getLanguage() {
        return language;
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof RelationImpl))
            return false;
        RelationImpl r = (RelationImpl)o;
        return Objects.equal(type, r.type)
            && Objects.equal(sourceId, r.sourceId)
            && Objects.equal(targetId, r.targetId)
            && Objects.equal(sourceLemma, r.sourceLemma)
            && Objects.equal(targetLemma, r.targetLemma)
            && language == r.language;
    }

    @Override public int hashCode() {
        return Objects.hashCode(type, sourceId, targetId, sourceLemma,
                                targetLemma, language);
    }

    public String toString() {
        if (isLexical()) {
            return String.format("Relation[%s %s %s]", sourceLemma, type,
                                 targetLemma);
        }
        return String.format("Relation[%s %s %s]", sourceId, type, targetId);
    }
}
