/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.match;

import com.vaticle.hypergraph.common.parameters.Options;
import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.AtomSpace;
import com.vaticle.hypergraph.graph.Link;

import java.util.Set;

/**
 * Finds every grounding of the variables of a {@code MeetLink} query in an atom space.
 *
 * A query declaring one variable grounds to the bound atoms themselves; a query declaring several
 * grounds to {@code ListLink} tuples holding one value per variable, in declaration order.
 */
public interface GroundingOracle {

    Set<Atom> ground(Link meet, AtomSpace space, Options.Join options);
}
