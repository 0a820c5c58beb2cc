/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.match;

import com.vaticle.hypergraph.common.exception.HypergraphException;
import com.vaticle.hypergraph.common.iterator.FunctionalIterator;
import com.vaticle.hypergraph.common.parameters.Options;
import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.AtomSpace;
import com.vaticle.hypergraph.graph.Link;
import com.vaticle.hypergraph.graph.Node;
import com.vaticle.hypergraph.pattern.Variables;
import com.vaticle.hypergraph.substitution.FreeVariables;
import com.vaticle.hypergraph.substitution.ScopedSubstitution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.vaticle.hypergraph.common.collection.Collections.list;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Oracle.GROUNDING_LIMIT_EXCEEDED;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Oracle.NOT_A_QUERY;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Oracle.UNBOUND_EVALUATABLE;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Oracle.UNSUPPORTED_EVALUATABLE;
import static com.vaticle.hypergraph.graph.AtomType.AND_LINK;
import static com.vaticle.hypergraph.graph.AtomType.JOIN_LINK;
import static com.vaticle.hypergraph.graph.AtomType.LIST_LINK;
import static com.vaticle.hypergraph.graph.AtomType.MEET_LINK;
import static com.vaticle.hypergraph.graph.AtomType.PRESENT_LINK;

/**
 * A backtracking matcher over the {@code PresentLink} terms of a query.
 *
 * Presence terms are matched structurally against the atoms of the space, binding variables as they
 * go. Once every presence term is matched, the remaining evaluatable clauses are checked against
 * the complete binding. Declared variables that no presence term mentions range over every atom of
 * the space.
 *
 * Atoms that only exist because the query was added to the space are never a grounding: join and
 * meet links, terms containing a declared variable, and terms held by an overlay but not by the
 * space underneath it.
 */
public class PatternMatcher implements GroundingOracle {

    private static final Logger LOG = LoggerFactory.getLogger(PatternMatcher.class);

    @Override
    public Set<Atom> ground(Link meet, AtomSpace space, Options.Join options) {
        if (meet.type() != MEET_LINK || meet.arity() != 2) throw HypergraphException.of(NOT_A_QUERY, meet);
        Search search = new Search(meet, space, options.groundingLimit());
        LOG.trace("Grounding {} over {} presence terms", meet, search.terms.size());
        search.match(0, new HashMap<>());
        LOG.debug("Query {} produced {} groundings", meet, search.groundings.size());
        return search.groundings;
    }

    private static class Search {

        private final AtomSpace space;
        private final Variables variables;
        private final long limit;
        private final List<Atom> terms;
        private final List<Atom> evaluatables;
        private final Set<Atom> groundings;

        private Search(Link meet, AtomSpace space, long limit) {
            this.space = space;
            this.variables = Variables.of(meet.outgoing(0));
            this.limit = limit;
            this.evaluatables = new ArrayList<>();
            this.groundings = new LinkedHashSet<>();

            Atom body = meet.outgoing(1);
            List<Atom> clauses = body.type() == AND_LINK ? body.asLink().outgoing() : list(body);
            List<Atom> structural = new ArrayList<>();
            List<Atom> bare = new ArrayList<>();
            Set<Node> covered = new LinkedHashSet<>();
            for (Atom clause : clauses) {
                if (clause.type() == PRESENT_LINK) {
                    for (Atom term : clause.asLink().outgoing()) {
                        if (variables.contains(term)) bare.add(term);
                        else structural.add(term);
                        covered.addAll(FreeVariables.of(term));
                    }
                } else {
                    for (Node free : FreeVariables.of(clause)) {
                        if (!variables.contains(free)) throw HypergraphException.of(UNBOUND_EVALUATABLE, clause);
                    }
                    evaluatables.add(clause);
                }
            }
            for (Node variable : variables.sequence()) {
                if (!covered.contains(variable)) bare.add(variable);
            }
            // bare variables last, so that most of them are already bound when reached
            this.terms = new ArrayList<>(structural);
            this.terms.addAll(bare);
        }

        private void match(int index, Map<Node, Atom> bindings) {
            if (index == terms.size()) {
                if (evaluatables.stream().allMatch(clause -> evaluate(clause, bindings))) record(bindings);
                return;
            }
            Atom term = ScopedSubstitution.substitute(terms.get(index), bindings);
            if (!hasVariable(term)) {
                if (space.contains(term)) match(index + 1, bindings);
                return;
            }
            FunctionalIterator<Atom> candidates = variables.contains(term) ? space.atoms() : space.atoms(term.type(), false);
            while (candidates.hasNext()) {
                Atom candidate = candidates.next();
                Map<Node, Atom> extended = new HashMap<>(bindings);
                if (unify(term, candidate, extended)) match(index + 1, extended);
            }
        }

        private boolean unify(Atom pattern, Atom candidate, Map<Node, Atom> bindings) {
            if (variables.contains(pattern)) {
                Node variable = pattern.asNode();
                Atom bound = bindings.get(variable);
                if (bound != null) return bound.equals(candidate);
                if (!variables.accepts(variable, candidate) || isArtifact(candidate)) return false;
                bindings.put(variable, candidate);
                return true;
            } else if (pattern.isNode()) {
                return pattern.equals(candidate);
            } else {
                if (!candidate.isLink() || candidate.type() != pattern.type()) return false;
                Link patternLink = pattern.asLink(), candidateLink = candidate.asLink();
                if (patternLink.arity() != candidateLink.arity()) return false;
                for (int i = 0; i < patternLink.arity(); i++) {
                    if (!unify(patternLink.outgoing(i), candidateLink.outgoing(i), bindings)) return false;
                }
                return true;
            }
        }

        private boolean evaluate(Atom clause, Map<Node, Atom> bindings) {
            List<Atom> operands = clause.isLink() ? clause.asLink().outgoing() : list();
            switch (clause.type()) {
                case PRESENT_LINK:
                    return operands.stream().allMatch(term -> space.contains(ScopedSubstitution.substitute(term, bindings)));
                case ABSENT_LINK:
                    return operands.stream().noneMatch(term -> space.contains(ScopedSubstitution.substitute(term, bindings)));
                case EQUAL_LINK:
                    if (operands.isEmpty()) return true;
                    Atom first = ScopedSubstitution.substitute(operands.get(0), bindings);
                    return operands.stream().allMatch(term -> ScopedSubstitution.substitute(term, bindings).equals(first));
                case NOT_LINK:
                    if (operands.size() != 1) throw HypergraphException.of(UNSUPPORTED_EVALUATABLE, clause);
                    return !evaluate(operands.get(0), bindings);
                case AND_LINK:
                    return operands.stream().allMatch(operand -> evaluate(operand, bindings));
                case OR_LINK:
                    return operands.stream().anyMatch(operand -> evaluate(operand, bindings));
                default:
                    throw HypergraphException.of(UNSUPPORTED_EVALUATABLE, clause);
            }
        }

        private void record(Map<Node, Atom> bindings) {
            Atom grounding;
            if (variables.size() == 1) {
                grounding = bindings.get(variables.get(0));
            } else {
                List<Atom> tuple = new ArrayList<>(variables.size());
                for (Node variable : variables.sequence()) tuple.add(bindings.get(variable));
                grounding = Link.of(LIST_LINK, tuple);
            }
            if (groundings.add(grounding) && groundings.size() > limit) {
                throw HypergraphException.of(GROUNDING_LIMIT_EXCEEDED, limit);
            }
        }

        private boolean isArtifact(Atom candidate) {
            if (candidate.isA(MEET_LINK) || candidate.isA(JOIN_LINK) || hasVariable(candidate)) return true;
            return space.isOverlay() && space.containsLocally(candidate)
                    && space.parent().map(base -> !base.contains(candidate)).orElse(false);
        }

        private boolean hasVariable(Atom term) {
            Deque<Atom> pending = new ArrayDeque<>();
            pending.push(term);
            while (!pending.isEmpty()) {
                Atom atom = pending.pop();
                if (variables.contains(atom)) return true;
                if (atom.isLink()) atom.asLink().outgoing().forEach(pending::push);
            }
            return false;
        }
    }
}
