/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.substitution;

import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.Link;
import com.vaticle.hypergraph.graph.Node;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.vaticle.hypergraph.graph.AtomType.QUOTE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.UNQUOTE_LINK;

/**
 * Rewrites the occurrences of mapped atoms inside a term.
 *
 * A key is left in place where it is a variable rebound by a nested scope, and inside a quoted
 * region unless that region is unquoted again. Terms with nothing to rewrite are returned as the
 * same instance.
 */
public class ScopedSubstitution {

    private ScopedSubstitution() {}

    public static Atom substitute(Atom term, Map<? extends Atom, ? extends Atom> mapping) {
        if (mapping.isEmpty()) return term;
        return substitute(term, mapping, new HashSet<>(), false);
    }

    private static Atom substitute(Atom term, Map<? extends Atom, ? extends Atom> mapping,
                                   Set<Node> shadowed, boolean quoted) {
        if (!quoted && !shadowed.contains(term)) {
            Atom target = mapping.get(term);
            if (target != null) return target;
        }
        if (!term.isLink()) return term;

        Link link = term.asLink();
        Set<Node> innerShadowed = shadowed;
        boolean innerQuoted = quoted;
        if (link.type() == QUOTE_LINK) {
            innerQuoted = true;
        } else if (link.type() == UNQUOTE_LINK) {
            innerQuoted = false;
        } else if (!quoted && FreeVariables.isScope(link)) {
            innerShadowed = new HashSet<>(shadowed);
            innerShadowed.addAll(FreeVariables.declared(link.outgoing(0)));
        }

        List<Atom> rewritten = new ArrayList<>(link.arity());
        boolean changed = false;
        for (Atom child : link.outgoing()) {
            Atom replaced = substitute(child, mapping, innerShadowed, innerQuoted);
            changed |= replaced != child;
            rewritten.add(replaced);
        }
        return changed ? Link.of(link.type(), rewritten) : link;
    }
}
