/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.substitution;

import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.vaticle.hypergraph.graph.AtomType.JOIN_LINK;
import static com.vaticle.hypergraph.graph.AtomType.MEET_LINK;
import static com.vaticle.hypergraph.graph.AtomType.QUOTE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.SCOPE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.TYPED_VARIABLE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.UNQUOTE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.VARIABLE_LIST;
import static com.vaticle.hypergraph.graph.AtomType.VARIABLE_NODE;

/**
 * Extracts the variables of a term that are not bound by a nested scope and not hidden by a quote.
 */
public class FreeVariables {

    private FreeVariables() {}

    /**
     * @return the free variables of {@code term}, in order of first occurrence
     */
    public static Set<Node> of(Atom term) {
        Set<Node> free = new LinkedHashSet<>();
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame(term, new HashSet<>(), false));
        while (!frames.isEmpty()) {
            Frame frame = frames.pop();
            Atom atom = frame.atom;
            if (atom.type() == VARIABLE_NODE) {
                if (!frame.quoted && !frame.bound.contains(atom)) free.add(atom.asNode());
            } else if (atom.isLink()) {
                boolean quoted = frame.quoted;
                Set<Node> bound = frame.bound;
                List<Atom> children = atom.asLink().outgoing();
                int first = 0;
                if (atom.type() == QUOTE_LINK) quoted = true;
                else if (atom.type() == UNQUOTE_LINK) quoted = false;
                else if (!quoted && isScope(atom)) {
                    bound = new HashSet<>(bound);
                    bound.addAll(declared(children.get(0)));
                    first = 1;
                }
                // reversed, so children are visited left to right
                for (int i = children.size() - 1; i >= first; i--) {
                    frames.push(new Frame(children.get(i), bound, quoted));
                }
            }
        }
        return free;
    }

    public static boolean isClosed(Atom term) {
        return of(term).isEmpty();
    }

    /**
     * @return true for the links whose first element declares variables bound in the rest
     */
    static boolean isScope(Atom atom) {
        return (atom.isA(SCOPE_LINK) || atom.isA(JOIN_LINK) || atom.isA(MEET_LINK)) && atom.asLink().arity() > 0;
    }

    /**
     * @return the variables introduced by the declaration part of a scope
     */
    static Set<Node> declared(Atom declaration) {
        Set<Node> variables = new HashSet<>();
        if (declaration.type() == VARIABLE_NODE) {
            variables.add(declaration.asNode());
        } else if (declaration.type() == TYPED_VARIABLE_LINK) {
            Atom variable = declaration.asLink().outgoing(0);
            if (variable.type() == VARIABLE_NODE) variables.add(variable.asNode());
        } else if (declaration.type() == VARIABLE_LIST) {
            for (Atom decl : declaration.asLink().outgoing()) variables.addAll(declared(decl));
        }
        return variables;
    }

    private static class Frame {

        private final Atom atom;
        private final Set<Node> bound;
        private final boolean quoted;

        private Frame(Atom atom, Set<Node> bound, boolean quoted) {
            this.atom = atom;
            this.bound = bound;
            this.quoted = quoted;
        }
    }
}
