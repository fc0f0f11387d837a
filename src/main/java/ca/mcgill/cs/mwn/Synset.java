/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;

import java.util.List;

import com.google.common.base.Optional;

import edu.mit.jwi.item.POS;


/**
 * The interface for a synset, i.e., one concept of the MultiWordNet as seen
 * through the WordNet of a particular language.  Two synsets are equal when
 * their ids are equal, regardless of the language through which each was
 * fetched.
 */
public interface Synset {

    /**
     * Returns the id, e.g., {@code n#00001740}.
     */
    String getId();

    /**
     * Returns the language of the WordNet through which this synset was
     * fetched.
     */
    Language getLanguage();

    /**
     * Returns the language for which this synset was first defined, as
     * encoded in its id.
     */
    Language getOriginLanguage();

    POS getPOS();

    /**
     * Returns the part of the id after the {@code #}.
     */
    String getOffset();

    /**
     * Returns the words and phrases of this synset in its language, in store
     * order.
     */
    List<Lemma> getLemmas();

    /**
     * Returns the gloss, or the empty string if no store defines one.
     */
    String getGloss();

    List<Semfield> getSemfields();

    /**
     * Returns every relation whose source is this synset, those shared by all
     * languages first.
     */
    List<Relation> getRelations();

    /**
     * Returns the relations of the given type whose source is this synset.
     *
     * @throws UnsupportedRelationException if synsets of this part of speech
     *         do not define the type
     */
    List<Relation> getRelations(Relation.RelationType type);

    /**
     * Returns the first relation from this synset to the target, if any.
     */
    Optional<Relation> getRelationTo(Synset target);

    /**
     * Returns the synsets reachable from this one by repeatedly following
     * relations of the given type, breadth first.  The synsets one edge away
     * are at depth 1; a negative {@code maxDepth} means no limit.
     *
     * @throws UnsupportedRelationException if synsets of this part of speech
     *         do not define the type
     */
    Iterable<Synset> getClosure(Relation.RelationType type, int maxDepth);

    /**
     * Returns the targets of this synset's hypernym relations.
     */
    List<Synset> getHypernyms();

    /**
     * Returns the length of the longest hypernym path to a root.
     */
    int getMaxDepth();

    /**
     * Returns the length of the shortest hypernym path to a root.
     */
    int getMinDepth();

    /**
     * Returns the synsets without hypernyms reachable from this synset,
     * including the synset itself if it has none.
     */
    List<Synset> getRoots();

    /**
     * Returns every hypernym path from a root down to this synset.
     */
    List<List<Synset>> getPathsToRoot();
}
