/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;

import com.google.common.base.Optional;

import edu.mit.jwi.item.POS;


/**
 * The interface for a directed, typed edge between two synsets.  A <i>lexical</i>
 * relation additionally names the specific source and target lemmas that it
 * connects, e.g., the antonymy of "hot" and "cold" rather than of their
 * synsets.
 */
public interface Relation {

    /**
     * The types of relation, each with the symbol by which it is stored and
     * its name for every part of speech that defines it.
     */
    public enum RelationType {

        ANTONYM("!", true, "antonym", "antonym", "antonym", "antonym"),

        HYPERNYM("@", false, "hypernym", "hypernym", "hypernym", "hypernym"),

        HYPONYM("~", false, "hyponym", "hyponym", "hyponym", "hyponym"),

        MEMBER_OF("#m", false, "member-of", null, null, null),

        SUBSTANCE_OF("#s", false, "substance-of", null, null, null),

        PART_OF("#p", false, "part-of", null, null, null),

        HAS_MEMBER("%m", false, "has-member", null, null, null),

        HAS_SUBSTANCE("%s", false, "has-substance", null, null, null),

        HAS_PART("%p", false, "has-part", null, null, null),

        /**
         * A noun for which an adjective expresses a value, e.g., "weight" for
         * "heavy"; seen from the adjective this is "is-value-of".
         */
        ATTRIBUTE("=", false, "attribute", null, "is-value-of", null),

        NEAREST("|", false, "nearest", "nearest", "nearest", "nearest"),

        HAS_ROLE("+r", false, "has-role", null, null, null),

        IS_ROLE_OF("-r", false, "is-role-of", null, null, null),

        COMPOSED_OF("+c", true, "composed-of", "composed-of", "composed-of",
                    "composed-of"),

        COMPOSES("-c", true, "composes", "composes", "composes", "composes"),

        /**
         * For adjectives, the noun to which the adjective pertains.
         */
        DERIVED_FROM("\\", true, "derived-from", "derived-from", "pertains-to",
                     "derived-from"),

        RELATED_TO("/", true, "related-to", "related-to", "related-to",
                   "related-to"),

        ENTAILMENT("*", false, null, "entailment", null, null),

        CAUSES(">", false, null, "causes", null, null),

        ALSO_SEE("^", false, null, "also-see", "also-see", null),

        VERB_GROUP("$", false, null, "verb-group", null, null),

        SIMILAR_TO("&", false, null, null, "similar-to", null),

        /**
         * An adjective that is the participle of a verb.
         */
        PARTICIPLE("<", true, null, null, "participle", null);

        private final String symbol;

        private final boolean lexical;

        private final String nounName;

        private final String verbName;

        private final String adjectiveName;

        private final String adverbName;

        private RelationType(String symbol, boolean lexical, String nounName,
                             String verbName, String adjectiveName,
                             String adverbName) {
            this.symbol = symbol;
            this.lexical = lexical;
            this.nounName = nounName;
            this.verbName = verbName;
            this.adjectiveName = adjectiveName;
            this.adverbName = adverbName;
        }

        /**
         * Returns the symbol stored in the {@code type} column of the relation
         * tables.
         */
        public String getSymbol() {
            return symbol;
        }

        /**
         * Returns {@code true} if relations of this type connect specific
         * lemmas rather than whole synsets.
         */
        public boolean isLexical() {
            return lexical;
        }

        /**
         * Returns {@code true} if synsets of the part of speech may have
         * relations of this type.
         */
        public boolean isDefinedFor(POS pos) {
            return pos != null && nameFor(pos) != null;
        }

        /**
         * Returns the name of this relation type for synsets of the part of
         * speech, with a "(lexical)" suffix for lexical types.
         *
         * @throws UnsupportedRelationException if the part of speech does not
         *         define this type
         */
        public String getName(POS pos) {
            String name = (pos == null) ? null : nameFor(pos);
            if (name == null)
                throw new UnsupportedRelationException(this, pos);
            return (lexical) ? name + " (lexical)" : name;
        }

        /**
         * Returns the type stored under the symbol, if any.
         */
        public static Optional<RelationType> fromSymbol(String symbol) {
            for (RelationType t : values()) {
                if (t.symbol.equals(symbol))
                    return Optional.of(t);
            }
            return Optional.absent();
        }

        private String nameFor(POS pos) {
            switch (pos) {
            case NOUN:
                return nounName;
            case VERB:
                return verbName;
            case ADJECTIVE:
                return adjectiveName;
            case ADVERB:
                return adverbName;
            default:
                return null;
            }
        }
    };

    /**
     * Returns the symbol of the relation's type as stored, which may not name
     * any {@link RelationType} in data from newer releases.
     */
    String getTypeSymbol();

    /**
     * Returns the type of this relation, or absent if its stored symbol is not
     * known.
     */
    Optional<RelationType> getType();

    /**
     * Returns the name of the relation's type for the part of speech of its
     * source synset.
     *
     * @throws UnsupportedRelationException if that part of speech does not
     *         define the type
     * @throws DecodingException if the stored symbol is not a known type
     */
    String getTypeName();

    String getSourceId();

    String getTargetId();

    /**
     * Returns the source synset, or absent if it is not in any store.
     */
    Optional<Synset> getSource();

    /**
     * Returns the target synset, or absent if it is not in any store.
     */
    Optional<Synset> getTarget();

    /**
     * Returns the lemma at the source end of a lexical relation.
     */
    Optional<Lemma> getSourceLemma();

    /**
     * Returns the lemma at the target end of a lexical relation.
     */
    Optional<Lemma> getTargetLemma();

    /**
     * Returns {@code true} if the relation names both a source and a target
     * lemma.
     */
    boolean isLexical();

    /**
     * Returns {@code true} if the relation was added in the language's own
     * release rather than inherited from the reference WordNet.
     */
    boolean isNew();

    /**
     * Returns the language whose relation table holds this relation.
     */
    Language getLanguage();
}
