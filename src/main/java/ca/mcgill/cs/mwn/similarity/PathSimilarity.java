/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.similarity;

import com.google.common.base.Optional;

import ca.mcgill.cs.mwn.Synset;

import ca.mcgill.cs.mwn.util.SynsetGraphs;


/**
 * Scores two synsets by the inverse of the length of the shortest hypernym
 * path connecting them, {@code 1 / (1 + distance)}; a synset is 1.0 similar
 * to itself.
 */
public class PathSimilarity implements SimilarityFunction {

    /**
     * {@inheritDoc}
     */
    @Override public Optional<Double> compare(Synset s1, Synset s2) {
        if (s1.getPOS() != s2.getPOS())
            return Optional.absent();
        Optional<Integer> distance = SynsetGraphs.shortestPathDistance(s1, s2);
        if (!distance.isPresent())
            return Optional.absent();
        return Optional.of(1d / (1 + distance.get()));
    }
}
