/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.join;

import com.vaticle.hypergraph.common.parameters.Options;
import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.AtomSpace;
import com.vaticle.hypergraph.graph.Link;
import com.vaticle.hypergraph.match.GroundingOracle;
import com.vaticle.hypergraph.pattern.Variables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Finds the principal elements of a join: its constant terms, plus every grounding of its variables.
 *
 * The backing query is added to a transient overlay of the space and grounded there, so that the
 * query terms never become visible in the space itself.
 */
class GroundingSearch {

    private static final Logger LOG = LoggerFactory.getLogger(GroundingSearch.class);

    private final GroundingOracle oracle;

    GroundingSearch(GroundingOracle oracle) {
        this.oracle = oracle;
    }

    Set<Atom> principals(JoinLink join, AtomSpace space, Options.Join options, Traverse traverse) {
        Set<Atom> principals = new LinkedHashSet<>(join.constants());
        if (!join.meet().isPresent()) return principals;

        Set<Atom> groundings;
        try (AtomSpace overlay = space.overlay(true)) {
            Link meet = overlay.add(join.meet().get()).asLink();
            groundings = oracle.ground(meet, overlay, options);
        }
        LOG.trace("Query {} grounded to {}", join.meet().get(), groundings);

        Variables variables = join.variables();
        for (Atom grounding : groundings) {
            if (variables.size() == 1) {
                principals.add(grounding);
                traverse.ground(0, grounding, variables.get(0));
            } else {
                Link tuple = grounding.asLink();
                assert tuple.arity() == variables.size();
                for (int i = 0; i < variables.size(); i++) {
                    principals.add(tuple.outgoing(i));
                    traverse.ground(i, tuple.outgoing(i), variables.get(i));
                }
            }
        }
        return principals;
    }
}
