/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.join;

import com.vaticle.hypergraph.common.parameters.Options;
import com.vaticle.hypergraph.common.producer.ResultQueue;
import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.AtomSpace;
import com.vaticle.hypergraph.match.GroundingOracle;
import com.vaticle.hypergraph.match.PatternMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Runs a join against an atom space.
 *
 * {@link #container(AtomSpace)} computes the result set without touching the space.
 * {@link #execute(AtomSpace)} computes the full set first and only then adds the results to the
 * space, so a failed execution leaves the space unchanged.
 */
public class JoinExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(JoinExecutor.class);

    private final JoinLink join;
    private final GroundingSearch search;
    private final Options.Join options;

    public JoinExecutor(JoinLink join) {
        this(join, new PatternMatcher(), new Options.Join());
    }

    public JoinExecutor(JoinLink join, GroundingOracle oracle, Options.Join options) {
        this.join = join;
        this.search = new GroundingSearch(oracle);
        this.options = options;
    }

    public Set<Atom> container(AtomSpace space) {
        options.parent(space.options());
        trace("Executing {}", join);
        if (join.variables().isEmpty()) {
            Set<Atom> constants = Constrainer.constrain(join.constants(), join.typeDirectives());
            trace("Join declares no variables, returning constant terms {}", constants);
            return constants;
        }

        Traverse traverse = new Traverse(join.variables().size());
        FilterEngine filter = new FilterEngine(space);
        Set<Atom> principals = search.principals(join, space, options, traverse);
        trace("Principal elements: {}", principals);

        Set<Atom> upperSet = filter.upperSet(principals, traverse);
        trace("Upper set: {}", upperSet);
        Set<Atom> containers = filter.supremum(upperSet);
        trace("Supremum: {}", containers);
        if (join.isMaximal()) {
            containers = filter.findTop(containers);
            trace("Tops: {}", containers);
        }

        containers = Constrainer.constrain(containers, join.typeDirectives());
        Substitutor.fixupReplacements(join.variables(), join.replacements(), traverse);
        Set<Atom> replaced = Substitutor.replace(containers, traverse);
        trace("Containers after replacement: {}", replaced);
        return replaced;
    }

    public ResultQueue<Atom> execute(AtomSpace space) {
        Set<Atom> containers = container(space);
        ResultQueue<Atom> results = new ResultQueue<>();
        for (Atom container : containers) results.put(space.add(container));
        results.done();
        LOG.debug("Join produced {} results", containers.size());
        return results;
    }

    private void trace(String format, Object... arguments) {
        if (options.traceJoin()) LOG.info(format, arguments);
        else LOG.debug(format, arguments);
    }
}
