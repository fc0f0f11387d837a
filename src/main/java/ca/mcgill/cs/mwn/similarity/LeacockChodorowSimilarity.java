/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.similarity;

import com.google.common.base.Optional;

import ca.mcgill.cs.mwn.Synset;
import ca.mcgill.cs.mwn.WordNet;

import ca.mcgill.cs.mwn.util.SynsetGraphs;


/**
 * The similarity measure of Leacock and Chodorow (1998), which scales the
 * shortest hypernym path between two synsets by the depth of their taxonomy:
 * {@code -log((distance + 1) / (2 * depth))}, where the depth is the
 * WordNet's {@link WordNet#maxDepthFor(edu.mit.jwi.item.POS) maximum depth}
 * for the synsets' part of speech.
 */
public class LeacockChodorowSimilarity implements SimilarityFunction {

    private final WordNet wordNet;

    public LeacockChodorowSimilarity(WordNet wordNet) {
        this.wordNet = wordNet;
    }

    /**
     * {@inheritDoc}
     */
    @Override public Optional<Double> compare(Synset s1, Synset s2) {
        if (s1.getPOS() != s2.getPOS())
            return Optional.absent();
        Optional<Integer> distance = SynsetGraphs.shortestPathDistance(s1, s2);
        if (!distance.isPresent())
            return Optional.absent();
        // A flat taxonomy still counts as one level
        int depth = Math.max(1, wordNet.maxDepthFor(s1.getPOS()));
        return Optional.of(-Math.log((distance.get() + 1d) / (2d * depth)));
    }
}
