/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.join;

import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.Link;
import com.vaticle.hypergraph.graph.Node;
import com.vaticle.hypergraph.pattern.Clause;
import com.vaticle.hypergraph.pattern.Variables;
import com.vaticle.hypergraph.substitution.FreeVariables;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.vaticle.hypergraph.graph.AtomType.AND_LINK;
import static com.vaticle.hypergraph.graph.AtomType.MEET_LINK;
import static com.vaticle.hypergraph.graph.AtomType.PRESENT_LINK;
import static com.vaticle.hypergraph.graph.AtomType.VARIABLE_LIST;

/**
 * Builds the {@code MeetLink} that grounds the variables of a join.
 *
 * The query conjoins every constraint clause. A variable that no constraint clause mentions gets a
 * synthesized {@code PresentLink} of its own, so that each declared variable is bound.
 */
public class QueryBuilder {

    private QueryBuilder() {}

    public static Optional<Link> meet(Variables variables, List<Clause> clauses) {
        if (variables.isEmpty()) return Optional.empty();

        List<Atom> body = new ArrayList<>();
        Set<Node> mentioned = new HashSet<>();
        for (Clause clause : clauses) {
            if (!clause.isConstraint()) continue;
            body.add(clause.atom());
            mentioned.addAll(FreeVariables.of(clause.atom()));
        }
        for (Node variable : variables.sequence()) {
            if (!mentioned.contains(variable)) body.add(Link.of(PRESENT_LINK, variable));
        }

        List<Atom> declarations = new ArrayList<>(variables.size());
        for (Node variable : variables.sequence()) declarations.add(variables.declaration(variable));
        return Optional.of(Link.of(MEET_LINK, Link.of(VARIABLE_LIST, declarations), Link.of(AND_LINK, body)));
    }

    /**
     * @return the constraint clauses that mention no variable, as written
     */
    public static Set<Atom> constantTerms(List<Clause> clauses) {
        Set<Atom> constants = new LinkedHashSet<>();
        for (Clause clause : clauses) {
            if (clause.isConstraint() && FreeVariables.isClosed(clause.atom())) constants.add(clause.atom());
        }
        return constants;
    }
}
