/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.join;

import com.vaticle.hypergraph.common.exception.HypergraphException;
import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.pattern.Clause;
import com.vaticle.hypergraph.pattern.Variables;
import com.vaticle.hypergraph.substitution.ScopedSubstitution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.AMBIGUOUS_REPLACEMENT;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Syntax.REPLACEMENT_UNDECLARED;

class Substitutor {

    private static final Logger LOG = LoggerFactory.getLogger(Substitutor.class);

    private Substitutor() {}

    /**
     * Retargets the grounding currently resolving to each replacement's variable. The variable must
     * resolve through exactly one grounded atom: none at all is a syntax error, several distinct
     * atoms cannot be given a single replacement.
     */
    static void fixupReplacements(Variables variables, List<Clause.Replacement> replacements, Traverse traverse) {
        for (Clause.Replacement replacement : replacements) {
            if (!variables.contains(replacement.from())) {
                throw HypergraphException.of(REPLACEMENT_UNDECLARED, replacement.atom());
            }
            List<Atom> resolved = new ArrayList<>();
            for (Map.Entry<Atom, Atom> entry : traverse.replaceMap().entrySet()) {
                if (entry.getValue().equals(replacement.from())) resolved.add(entry.getKey());
            }
            if (resolved.isEmpty()) {
                throw HypergraphException.of(REPLACEMENT_UNDECLARED, replacement.atom());
            } else if (resolved.size() > 1) {
                throw HypergraphException.of(AMBIGUOUS_REPLACEMENT, replacement.atom(), resolved.size());
            }
            LOG.debug("Replacement {} retargets {}", replacement.atom(), resolved.get(0));
            traverse.override(resolved.get(0), replacement.to());
        }
    }

    static Set<Atom> replace(Set<Atom> containers, Traverse traverse) {
        Map<Atom, Atom> replacements = traverse.replacements();
        if (replacements.isEmpty()) return containers;
        Set<Atom> replaced = new LinkedHashSet<>();
        for (Atom container : containers) replaced.add(ScopedSubstitution.substitute(container, replacements));
        return replaced;
    }
}
