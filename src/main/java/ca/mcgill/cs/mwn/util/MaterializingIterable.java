/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.AbstractIterator;


/**
 * An {@link Iterable} over a lazily computed sequence that keeps the
 * elements once an iteration has seen all of them.  Later iterations replay
 * the kept elements without computing them again.  An iteration abandoned
 * part way keeps nothing, so the next one starts the computation over.
 */
public abstract class MaterializingIterable<T> implements Iterable<T> {

    private List<T> elements;

    /**
     * Starts a new computation of the sequence.
     */
    protected abstract Iterator<T> compute();

    /**
     * Returns {@code true} if some iteration has completed.
     */
    public boolean isMaterialized() {
        return elements != null;
    }

    public Iterator<T> iterator() {
        if (elements != null)
            return elements.iterator();
        final Iterator<T> source = compute();
        final List<T> seen = new ArrayList<T>();
        return new AbstractIterator<T>() {
            @Override protected T computeNext() {
                if (source.hasNext()) {
                    T next = source.next();
                    seen.add(next);
                    return next;
                }
                if (elements == null)
                    elements = Collections.unmodifiableList(seen);
                return endOfData();
            }
        };
    }
}
