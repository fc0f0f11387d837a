/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.similarity;

import com.google.common.base.Optional;

import ca.mcgill.cs.mwn.Synset;


/**
 * An interface representing the abstraction of a similarity function for
 * comparing the meaning of two synsets.
 */
public interface SimilarityFunction {

    /**
     * Compares the two synsets and returns their semantic similarity, or
     * absent if the function cannot relate them.
     */
    Optional<Double> compare(Synset s1, Synset s2);
}
