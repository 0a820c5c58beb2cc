/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.graph;

import com.vaticle.hypergraph.common.exception.HypergraphException;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

import static com.vaticle.hypergraph.common.exception.ErrorMessage.Space.UNRECOGNISED_TYPE_NAME;

/**
 * The closed hierarchy of atom types. Each type has a single parent; abstract types only exist
 * to group their subtypes and cannot be instantiated.
 */
public enum AtomType {
    ATOM("Atom", null, true),
    NODE("Node", ATOM, true),
    LINK("Link", ATOM, true),

    CONCEPT_NODE("ConceptNode", NODE),
    PREDICATE_NODE("PredicateNode", NODE),
    VARIABLE_NODE("VariableNode", NODE),
    TYPE_NODE("TypeNode", NODE),
    TYPE_INH_NODE("TypeInhNode", TYPE_NODE),

    LIST_LINK("ListLink", LINK),
    MEMBER_LINK("MemberLink", LINK),
    INHERITANCE_LINK("InheritanceLink", LINK),
    EVALUATION_LINK("EvaluationLink", LINK),

    VARIABLE_LIST("VariableList", LINK),
    TYPED_VARIABLE_LINK("TypedVariableLink", LINK),

    TYPE_LINK("TypeLink", LINK, true),
    TYPE_CHOICE("TypeChoice", TYPE_LINK),
    SIGNATURE_LINK("SignatureLink", TYPE_LINK),
    TYPE_OUTPUT_LINK("TypeOutputLink", LINK, true),
    ARROW_LINK("ArrowLink", TYPE_OUTPUT_LINK),

    EVALUATABLE_LINK("EvaluatableLink", LINK, true),
    PRESENT_LINK("PresentLink", EVALUATABLE_LINK),
    ABSENT_LINK("AbsentLink", EVALUATABLE_LINK),
    EQUAL_LINK("EqualLink", EVALUATABLE_LINK),
    NOT_LINK("NotLink", EVALUATABLE_LINK),
    AND_LINK("AndLink", EVALUATABLE_LINK),
    OR_LINK("OrLink", EVALUATABLE_LINK),

    SCOPE_LINK("ScopeLink", LINK),
    LAMBDA_LINK("LambdaLink", SCOPE_LINK),
    QUOTE_LINK("QuoteLink", LINK),
    UNQUOTE_LINK("UnquoteLink", LINK),

    REPLACEMENT_LINK("ReplacementLink", LINK),
    MEET_LINK("MeetLink", LINK),
    JOIN_LINK("JoinLink", LINK, true),
    MINIMAL_JOIN_LINK("MinimalJoinLink", JOIN_LINK),
    MAXIMAL_JOIN_LINK("MaximalJoinLink", JOIN_LINK);

    private static final Map<String, AtomType> BY_NAME = new HashMap<>();

    static {
        for (AtomType type : values()) BY_NAME.put(type.name, type);
    }

    private final String name;
    @Nullable
    private final AtomType parent;
    private final boolean isAbstract;

    AtomType(String name, @Nullable AtomType parent) {
        this(name, parent, false);
    }

    AtomType(String name, @Nullable AtomType parent, boolean isAbstract) {
        this.name = name;
        this.parent = parent;
        this.isAbstract = isAbstract;
    }

    public static AtomType of(String name) {
        AtomType type = BY_NAME.get(name);
        if (type == null) throw HypergraphException.of(UNRECOGNISED_TYPE_NAME, name);
        return type;
    }

    public String typeName() {
        return name;
    }

    @Nullable
    public AtomType parent() {
        return parent;
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    public boolean isA(AtomType other) {
        for (AtomType type = this; type != null; type = type.parent) {
            if (type == other) return true;
        }
        return false;
    }

    public boolean isNode() {
        return isA(NODE);
    }

    public boolean isLink() {
        return isA(LINK);
    }

    @Override
    public String toString() {
        return name;
    }
}
