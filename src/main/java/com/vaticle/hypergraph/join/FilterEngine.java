/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.join;

import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.AtomSpace;
import com.vaticle.hypergraph.graph.Link;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import static com.vaticle.hypergraph.graph.AtomType.JOIN_LINK;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_OUTPUT_LINK;

/**
 * Walks the containment order of an atom space.
 *
 * All walks keep an explicit worklist. Containment is acyclic, so each walk terminates, and each
 * atom is expanded at most once per walk.
 */
class FilterEngine {

    private final AtomSpace space;

    FilterEngine(AtomSpace space) {
        this.space = space;
    }

    /**
     * @return the atom together with every structure that transitively contains it
     */
    Set<Atom> principalFilter(Atom atom) {
        Set<Atom> filter = new LinkedHashSet<>();
        principalFilter(atom, filter);
        return filter;
    }

    private void principalFilter(Atom atom, Set<Atom> filter) {
        Deque<Atom> pending = new ArrayDeque<>();
        pending.push(atom);
        while (!pending.isEmpty()) {
            Atom next = pending.pop();
            if (isExcluded(next) || !filter.add(next)) continue;
            for (Link parent : space.incoming(next)) pending.push(parent);
        }
    }

    /**
     * With several variables, structures that do not contain a grounding of every variable are
     * dropped: they join some of the variables but not all.
     */
    Set<Atom> upperSet(Set<Atom> principals, Traverse traverse) {
        Set<Atom> upper = new LinkedHashSet<>();
        for (Atom principal : principals) principalFilter(principal, upper);
        if (traverse.variableCount() <= 1) return upper;

        Set<Atom> joined = new LinkedHashSet<>();
        for (Atom candidate : upper) {
            boolean isJoined = true;
            for (int i = 0; i < traverse.variableCount() && isJoined; i++) {
                isJoined = containsAny(candidate, traverse.joinMap(i));
            }
            if (isJoined) joined.add(candidate);
        }
        return joined;
    }

    /**
     * @return the minimal elements of the upper set: those with no direct child in the set
     */
    Set<Atom> supremum(Set<Atom> upperSet) {
        Set<Atom> minimal = new LinkedHashSet<>();
        for (Atom atom : upperSet) {
            if (atom.isLink() && atom.asLink().outgoing().stream().anyMatch(upperSet::contains)) continue;
            minimal.add(atom);
        }
        return minimal;
    }

    /**
     * @return the atoms with nothing above them, reachable upwards from the given containers
     */
    Set<Atom> findTop(Collection<Atom> containers) {
        Set<Atom> tops = new LinkedHashSet<>();
        Set<Atom> visited = new HashSet<>();
        Deque<Atom> pending = new ArrayDeque<>(containers);
        while (!pending.isEmpty()) {
            Atom next = pending.pop();
            if (next.isA(JOIN_LINK) || !visited.add(next)) continue;
            boolean hasParent = false;
            for (Link parent : space.incoming(next)) {
                if (parent.isA(JOIN_LINK)) continue;
                hasParent = true;
                pending.push(parent);
            }
            if (!hasParent) tops.add(next);
        }
        return tops;
    }

    /**
     * @return true if any of the atoms occurs in the container, the container itself included
     */
    static boolean containsAny(Atom container, Set<Atom> atoms) {
        if (atoms.isEmpty()) return false;
        Set<Atom> visited = new HashSet<>();
        Deque<Atom> pending = new ArrayDeque<>();
        pending.push(container);
        while (!pending.isEmpty()) {
            Atom next = pending.pop();
            if (!visited.add(next)) continue;
            if (atoms.contains(next)) return true;
            if (next.isLink()) next.asLink().outgoing().forEach(pending::push);
        }
        return false;
    }

    private static boolean isExcluded(Atom atom) {
        return atom.isA(JOIN_LINK) || atom.isA(TYPE_LINK) || atom.isA(TYPE_OUTPUT_LINK);
    }
}
