/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.pattern;

import com.vaticle.hypergraph.common.exception.HypergraphException;
import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.AtomType;
import com.vaticle.hypergraph.graph.Link;
import com.vaticle.hypergraph.graph.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.vaticle.hypergraph.common.collection.Collections.list;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.DEEP_TYPE_CONSTRAINT;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.DUPLICATE_VARIABLE;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.MULTIPLE_TYPE_CONSTRAINTS;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.UNSUPPORTED_DECLARATION;
import static com.vaticle.hypergraph.graph.AtomType.SIGNATURE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.TYPED_VARIABLE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_CHOICE;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_INH_NODE;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_NODE;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_OUTPUT_LINK;
import static com.vaticle.hypergraph.graph.AtomType.VARIABLE_LIST;
import static com.vaticle.hypergraph.graph.AtomType.VARIABLE_NODE;

/**
 * The ordered variables declared by a scoped term, each with at most one type constraint.
 *
 * A declaration is a single {@code VariableNode}, a {@code TypedVariableLink}, or a
 * {@code VariableList} of either. A type constraint is a {@code TypeNode}, a {@code TypeInhNode},
 * or a {@code TypeChoice} holding exactly one of those; anything more elaborate is rejected.
 */
public class Variables {

    private final Atom declaration;
    private final List<Node> sequence;
    private final Map<Node, TypeConstraint> constraints;

    private Variables(Atom declaration, List<Node> sequence, Map<Node, TypeConstraint> constraints) {
        this.declaration = declaration;
        this.sequence = list(sequence);
        this.constraints = constraints;
    }

    public static boolean isDeclaration(Atom atom) {
        return atom.type() == VARIABLE_NODE || atom.type() == TYPED_VARIABLE_LINK || atom.type() == VARIABLE_LIST;
    }

    public static Variables of(Atom declaration) {
        List<Node> sequence = new ArrayList<>();
        Map<Node, TypeConstraint> constraints = new HashMap<>();
        if (declaration.type() == VARIABLE_LIST) {
            for (Atom decl : declaration.asLink().outgoing()) declare(decl, sequence, constraints);
        } else {
            declare(declaration, sequence, constraints);
        }
        return new Variables(declaration, sequence, constraints);
    }

    private static void declare(Atom decl, List<Node> sequence, Map<Node, TypeConstraint> constraints) {
        Node variable;
        if (decl.type() == VARIABLE_NODE) {
            variable = decl.asNode();
        } else if (decl.type() == TYPED_VARIABLE_LINK && decl.asLink().arity() == 2
                && decl.asLink().outgoing(0).type() == VARIABLE_NODE) {
            variable = decl.asLink().outgoing(0).asNode();
            constraints.put(variable, TypeConstraint.of(variable, decl.asLink().outgoing(1)));
        } else {
            throw HypergraphException.of(UNSUPPORTED_DECLARATION, decl);
        }
        if (sequence.contains(variable)) throw HypergraphException.of(DUPLICATE_VARIABLE, variable);
        sequence.add(variable);
    }

    public Atom declaration() {
        return declaration;
    }

    public List<Node> sequence() {
        return sequence;
    }

    public Node get(int index) {
        return sequence.get(index);
    }

    public int size() {
        return sequence.size();
    }

    public boolean isEmpty() {
        return sequence.isEmpty();
    }

    public boolean contains(Atom atom) {
        return atom.type() == VARIABLE_NODE && sequence.contains(atom.asNode());
    }

    public int indexOf(Atom variable) {
        return sequence.indexOf(variable);
    }

    public Optional<TypeConstraint> constraint(Node variable) {
        return Optional.ofNullable(constraints.get(variable));
    }

    /**
     * @return the declaration of a single variable, carrying its type constraint if it has one
     */
    public Atom declaration(Node variable) {
        assert sequence.contains(variable);
        TypeConstraint constraint = constraints.get(variable);
        if (constraint == null) return variable;
        else return Link.of(TYPED_VARIABLE_LINK, variable, constraint.source());
    }

    public boolean accepts(Node variable, Atom value) {
        TypeConstraint constraint = constraints.get(variable);
        return constraint == null || constraint.accepts(value);
    }

    @Override
    public String toString() {
        return declaration.toString();
    }

    public static class TypeConstraint {

        private final Atom source;
        private final AtomType type;
        private final boolean includeSubtypes;

        private TypeConstraint(Atom source, AtomType type, boolean includeSubtypes) {
            this.source = source;
            this.type = type;
            this.includeSubtypes = includeSubtypes;
        }

        static TypeConstraint of(Node variable, Atom source) {
            if (source.isA(TYPE_NODE)) {
                return new TypeConstraint(source, AtomType.of(source.asNode().name()), source.type() == TYPE_INH_NODE);
            } else if (source.type() == TYPE_CHOICE) {
                if (source.asLink().arity() != 1) {
                    throw HypergraphException.of(MULTIPLE_TYPE_CONSTRAINTS, variable, source);
                }
                Atom single = source.asLink().outgoing(0);
                if (single.isA(TYPE_NODE)) {
                    return new TypeConstraint(source, AtomType.of(single.asNode().name()), single.type() == TYPE_INH_NODE);
                } else if (single.type() == SIGNATURE_LINK || single.isA(TYPE_OUTPUT_LINK)) {
                    throw HypergraphException.of(DEEP_TYPE_CONSTRAINT, variable, source);
                }
            } else if (source.type() == SIGNATURE_LINK || source.isA(TYPE_OUTPUT_LINK)) {
                throw HypergraphException.of(DEEP_TYPE_CONSTRAINT, variable, source);
            }
            throw HypergraphException.of(UNSUPPORTED_DECLARATION, Link.of(TYPED_VARIABLE_LINK, variable, source));
        }

        public Atom source() {
            return source;
        }

        public AtomType type() {
            return type;
        }

        public boolean includeSubtypes() {
            return includeSubtypes;
        }

        public boolean accepts(Atom value) {
            return includeSubtypes ? value.isA(type) : value.type() == type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            TypeConstraint that = (TypeConstraint) o;
            return this.source.equals(that.source);
        }

        @Override
        public int hashCode() {
            return Objects.hash(source);
        }
    }
}
