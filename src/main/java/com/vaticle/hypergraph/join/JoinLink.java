/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.join;

import com.vaticle.hypergraph.common.exception.HypergraphException;
import com.vaticle.hypergraph.common.producer.ResultQueue;
import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.AtomSpace;
import com.vaticle.hypergraph.graph.AtomType;
import com.vaticle.hypergraph.graph.Link;
import com.vaticle.hypergraph.pattern.Clause;
import com.vaticle.hypergraph.pattern.Variables;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.vaticle.hypergraph.common.collection.Collections.list;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.ABSTRACT_JOIN;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.MISSING_DECLARATIONS;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.NOT_A_JOIN;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.vaticle.hypergraph.graph.AtomType.JOIN_LINK;
import static com.vaticle.hypergraph.graph.AtomType.MAXIMAL_JOIN_LINK;
import static com.vaticle.hypergraph.graph.AtomType.MINIMAL_JOIN_LINK;

/**
 * A join operator: {@code (Join declarations clause...)}.
 *
 * Executing a join finds the smallest structures of an atom space that contain a grounding of every
 * declared variable at once, and rewrites the groundings named by replacement clauses. A maximal
 * join goes on to report the topmost structures above those. The term is validated when it is
 * created and is immutable afterwards.
 */
public class JoinLink extends Link {

    private final Variables variables;
    private final List<Clause> clauses;
    private final List<Clause.Replacement> replacements;
    private final List<Atom> typeDirectives;
    private final Set<Atom> constants;
    @Nullable
    private final Link meet;

    protected JoinLink(AtomType type, List<Atom> outgoing) {
        super(validateType(type), outgoing);
        if (outgoing.isEmpty() || !Variables.isDeclaration(outgoing.get(0))) {
            throw HypergraphException.of(MISSING_DECLARATIONS);
        }
        this.variables = Variables.of(outgoing.get(0));
        this.clauses = list(ClauseClassifier.classify(variables, outgoing.subList(1, outgoing.size())));
        List<Clause.Replacement> replacements = new ArrayList<>();
        List<Atom> typeDirectives = new ArrayList<>();
        for (Clause clause : clauses) {
            switch (clause.kind()) {
                case REPLACEMENT:
                    replacements.add(clause.asReplacement());
                    break;
                case TYPE_DIRECTIVE:
                    typeDirectives.add(clause.atom());
                    break;
                case PRESENCE:
                case EVALUATABLE:
                    break;
                default:
                    throw HypergraphException.of(ILLEGAL_STATE);
            }
        }
        this.replacements = list(replacements);
        this.typeDirectives = list(typeDirectives);
        this.constants = QueryBuilder.constantTerms(clauses);
        this.meet = QueryBuilder.meet(variables, clauses).orElse(null);
    }

    private static AtomType validateType(AtomType type) {
        if (!type.isA(JOIN_LINK)) throw HypergraphException.of(NOT_A_JOIN, type);
        if (type.isAbstract()) throw HypergraphException.of(ABSTRACT_JOIN);
        return type;
    }

    public static JoinLink create(AtomType type, List<Atom> outgoing) {
        return new JoinLink(type, outgoing);
    }

    public static JoinLink minimal(Atom... outgoing) {
        return new JoinLink(MINIMAL_JOIN_LINK, Arrays.asList(outgoing));
    }

    public static JoinLink maximal(Atom... outgoing) {
        return new JoinLink(MAXIMAL_JOIN_LINK, Arrays.asList(outgoing));
    }

    public boolean isMaximal() {
        return type() == MAXIMAL_JOIN_LINK;
    }

    public Variables variables() {
        return variables;
    }

    public List<Clause> clauses() {
        return clauses;
    }

    public Set<Atom> constants() {
        return constants;
    }

    /**
     * @return the query grounding the declared variables, empty when none are declared
     */
    public Optional<Link> meet() {
        return Optional.ofNullable(meet);
    }

    public List<Clause.Replacement> replacements() {
        return replacements;
    }

    public List<Atom> typeDirectives() {
        return typeDirectives;
    }

    public Set<Atom> container(AtomSpace space) {
        return new JoinExecutor(this).container(space);
    }

    public ResultQueue<Atom> execute(AtomSpace space) {
        return new JoinExecutor(this).execute(space);
    }
}
