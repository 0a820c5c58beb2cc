/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.join;

import com.vaticle.hypergraph.common.exception.HypergraphException;
import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.AtomType;
import com.vaticle.hypergraph.pattern.Clause;
import com.vaticle.hypergraph.pattern.Variables;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.UNSUPPORTED_CLAUSE;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Syntax.REPLACEMENT_ARITY;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Syntax.REPLACEMENT_UNDECLARED;
import static com.vaticle.hypergraph.graph.AtomType.EVALUATABLE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.PRESENT_LINK;
import static com.vaticle.hypergraph.graph.AtomType.REPLACEMENT_LINK;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_NODE;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_OUTPUT_LINK;

public class ClauseClassifier {

    private ClauseClassifier() {}

    public static List<Clause> classify(Variables variables, List<Atom> body) {
        List<Clause> clauses = new ArrayList<>(body.size());
        for (Atom atom : body) clauses.add(classify(variables, atom));
        return clauses;
    }

    public static Clause classify(Variables variables, Atom atom) {
        if (atom.type() == REPLACEMENT_LINK) {
            if (atom.asLink().arity() != 2) throw HypergraphException.of(REPLACEMENT_ARITY, atom);
            if (!variables.contains(atom.asLink().outgoing(0))) throw HypergraphException.of(REPLACEMENT_UNDECLARED, atom);
            return new Clause.Replacement(atom.asLink());
        } else if (atom.type() == PRESENT_LINK) {
            return new Clause.Presence(atom.asLink());
        } else if (atom.isA(EVALUATABLE_LINK)) {
            return new Clause.Evaluatable(atom);
        } else if (atom.isA(TYPE_NODE) || atom.isA(TYPE_LINK) || atom.isA(TYPE_OUTPUT_LINK)) {
            validateTypeNames(atom);
            return new Clause.TypeDirective(atom);
        } else {
            throw HypergraphException.of(UNSUPPORTED_CLAUSE, atom);
        }
    }

    private static void validateTypeNames(Atom directive) {
        Deque<Atom> pending = new ArrayDeque<>();
        pending.push(directive);
        while (!pending.isEmpty()) {
            Atom next = pending.pop();
            if (next.isA(TYPE_NODE)) AtomType.of(next.asNode().name());
            else if (next.isLink()) next.asLink().outgoing().forEach(pending::push);
        }
    }
}
