/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn;

import java.util.Collection;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;


/**
 * Thrown when a lookup that must produce a unique entity matched more than one
 * candidate.  The conflicting keys are available through {@link
 * #getCandidates()} so that the caller can repeat the lookup with a
 * disambiguating field, such as an explicit part of speech or semfield code.
 */
public class DisambiguationException extends WordNetException {

    private static final long serialVersionUID = 1L;

    private final String key;

    private final List<String> candidates;

    public DisambiguationException(String key, Collection<String> candidates) {
        super("cannot disambiguate \"" + key + "\" between "
              + Joiner.on(", ").join(candidates));
        this.key = key;
        this.candidates = ImmutableList.copyOf(candidates);
    }

    /**
     * Returns the key that was looked up.
     */
    public String getKey() {
        return key;
    }

    /**
     * Returns the keys of all the entries that matched, in store order.
     */
    public List<String> getCandidates() {
        return candidates;
    }
}
