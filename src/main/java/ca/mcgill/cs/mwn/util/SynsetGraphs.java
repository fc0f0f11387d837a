/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Optional;
import com.google.common.collect.AbstractIterator;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import edu.ucla.sspace.util.Duple;

import ca.mcgill.cs.mwn.Relation;
import ca.mcgill.cs.mwn.Relation.RelationType;
import ca.mcgill.cs.mwn.Synset;
import ca.mcgill.cs.mwn.UnsupportedRelationException;


/**
 * A collection of walks over the relation graph of {@link Synset} instances:
 * transitive closures, depths in the hypernym taxonomy, its roots, and the
 * paths to them.
 *
 * <p>The hypernym walks tolerate cycles in the data.  A walk that returns to a
 * synset already on its current path abandons that branch and logs a
 * warning; a cyclic branch contributes a depth of 0.
 */
public class SynsetGraphs {

    private SynsetGraphs() { }

    /**
     * Returns the targets of the synset's relations of the type that exist in
     * some store.  Synsets whose part of speech does not define the type have
     * no such targets.
     */
    public static List<Synset> targets(Synset s, RelationType type) {
        List<Synset> targets = new ArrayList<Synset>();
        if (!type.isDefinedFor(s.getPOS()))
            return targets;
        for (Relation r : s.getRelations(type)) {
            Optional<Synset> t = r.getTarget();
            if (t.isPresent())
                targets.add(t.get());
        }
        return targets;
    }

    /**
     * Returns the synset's hypernyms.
     */
    public static List<Synset> hypernyms(Synset s) {
        return targets(s, RelationType.HYPERNYM);
    }

    /**
     * Returns the synsets reachable from {@code origin} through relations of
     * the type, in breadth-first order, each once and never the origin
     * itself.  The synsets one edge away are at depth 1 and no synset deeper
     * than {@code maxDepth} is returned; a negative {@code maxDepth} means no
     * limit.  The walk is performed anew, and lazily, by each iterator.
     *
     * @throws UnsupportedRelationException if the origin's part of speech does
     *         not define the type
     */
    public static Iterable<Synset> closure(final Synset origin,
                                           final RelationType type,
                                           final int maxDepth) {
        if (!type.isDefinedFor(origin.getPOS()))
            throw new UnsupportedRelationException(type, origin.getPOS());
        return new Iterable<Synset>() {
            public Iterator<Synset> iterator() {
                return new ClosureIterator(origin, type, maxDepth);
            }
        };
    }

    /**
     * A breadth-first walk that emits each synset when it is first reached.
     */
    private static class ClosureIterator extends AbstractIterator<Synset> {

        private final RelationType type;

        private final int maxDepth;

        /**
         * Synsets reached but not yet emitted, with their depths.
         */
        private final Deque<Duple<Synset,Integer>> pending =
            new ArrayDeque<Duple<Synset,Integer>>();

        /**
         * Reached synsets whose targets have not been followed.
         */
        private final Deque<Duple<Synset,Integer>> frontier =
            new ArrayDeque<Duple<Synset,Integer>>();

        private final Set<String> visited = new HashSet<String>();

        ClosureIterator(Synset origin, RelationType type, int maxDepth) {
            this.type = type;
            this.maxDepth = maxDepth;
            visited.add(origin.getId());
            frontier.add(new Duple<Synset,Integer>(origin, 0));
        }

        @Override protected Synset computeNext() {
            while (pending.isEmpty() && !frontier.isEmpty())
                expand(frontier.poll());
            if (pending.isEmpty())
                return endOfData();
            Duple<Synset,Integer> next = pending.poll();
            frontier.add(next);
            return next.x;
        }

        private void expand(Duple<Synset,Integer> node) {
            int depth = node.y;
            if (maxDepth >= 0 && depth >= maxDepth)
                return;
            for (Synset t : targets(node.x, type)) {
                if (visited.add(t.getId()))
                    pending.add(new Duple<Synset,Integer>(t, depth + 1));
            }
        }
    }

    /**
     * Returns the length of the longest hypernym path from the synset to a
     * root, which is 0 for a root.
     */
    public static int maxDepth(Synset s) {
        return depth(s, new HashSet<String>(), true);
    }

    /**
     * Returns the length of the shortest hypernym path from the synset to a
     * root, which is 0 for a root.
     */
    public static int minDepth(Synset s) {
        return depth(s, new HashSet<String>(), false);
    }

    private static int depth(Synset s, Set<String> onPath, boolean longest) {
        if (onPath.contains(s.getId())) {
            MwnLogger.warning("Hypernym cycle detected at %s", s.getId());
            return 0;
        }
        List<Synset> hypernyms = hypernyms(s);
        if (hypernyms.isEmpty())
            return 0;

        onPath.add(s.getId());
        int best = (longest) ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        for (Synset h : hypernyms) {
            int d = depth(h, onPath, longest);
            best = (longest) ? Math.max(best, d) : Math.min(best, d);
        }
        onPath.remove(s.getId());
        return best + 1;
    }

    /**
     * Returns the synsets without hypernyms that are reachable from the
     * synset by following hypernyms, which is the synset itself if it has
     * none.
     */
    public static List<Synset> roots(Synset s) {
        List<Synset> roots = new ArrayList<Synset>();
        Set<String> seen = new HashSet<String>();
        Deque<Synset> todo = new ArrayDeque<Synset>();
        todo.push(s);
        while (!todo.isEmpty()) {
            Synset next = todo.pop();
            if (!seen.add(next.getId()))
                continue;
            List<Synset> hypernyms = hypernyms(next);
            if (hypernyms.isEmpty())
                roots.add(next);
            else {
                for (Synset h : hypernyms)
                    todo.push(h);
            }
        }
        return roots;
    }

    /**
     * Returns every hypernym path between a root and the synset, each ordered
     * from the root down to the synset.  A hypernym edge that would close a
     * cycle is not followed; a synset all of whose hypernyms do so is treated
     * as a root.
     */
    public static List<List<Synset>> pathsToRoot(Synset s) {
        return pathsToRoot(s, new LinkedHashSet<String>());
    }

    private static List<List<Synset>> pathsToRoot(Synset s,
                                                  Set<String> onPath) {
        onPath.add(s.getId());
        List<List<Synset>> paths = new ArrayList<List<Synset>>();
        for (Synset h : hypernyms(s)) {
            if (onPath.contains(h.getId())) {
                MwnLogger.warning("Hypernym cycle detected between %s and %s",
                                  s.getId(), h.getId());
                continue;
            }
            for (List<Synset> ancestors : pathsToRoot(h, onPath)) {
                ancestors.add(s);
                paths.add(ancestors);
            }
        }
        onPath.remove(s.getId());

        if (paths.isEmpty()) {
            List<Synset> path = new ArrayList<Synset>();
            path.add(s);
            paths.add(path);
        }
        return paths;
    }

    /**
     * Returns the number of hypernym edges from the synset to each of its
     * ancestors, keyed by id, with the synset itself at distance 0.
     */
    public static TObjectIntMap<String> hypernymDistances(Synset s) {
        TObjectIntMap<String> distances = new TObjectIntHashMap<String>();
        distances.put(s.getId(), 0);
        List<Synset> frontier = new ArrayList<Synset>();
        frontier.add(s);
        int depth = 0;
        while (!frontier.isEmpty()) {
            depth++;
            List<Synset> next = new ArrayList<Synset>();
            for (Synset f : frontier) {
                for (Synset h : hypernyms(f)) {
                    if (!distances.containsKey(h.getId())) {
                        distances.put(h.getId(), depth);
                        next.add(h);
                    }
                }
            }
            frontier = next;
        }
        return distances;
    }

    /**
     * Returns the number of edges on the shortest path between the two
     * synsets that passes through a common hypernym ancestor, or absent if
     * they have none.
     */
    public static Optional<Integer> shortestPathDistance(Synset s1,
                                                         Synset s2) {
        if (s1.equals(s2))
            return Optional.of(0);
        TObjectIntMap<String> d1 = hypernymDistances(s1);
        TObjectIntMap<String> d2 = hypernymDistances(s2);
        int best = Integer.MAX_VALUE;
        for (String id : d1.keySet()) {
            if (d2.containsKey(id))
                best = Math.min(best, d1.get(id) + d2.get(id));
        }
        return (best == Integer.MAX_VALUE)
            ? Optional.<Integer>absent() : Optional.of(best);
    }
}
