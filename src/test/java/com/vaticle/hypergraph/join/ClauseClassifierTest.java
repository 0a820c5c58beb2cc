/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.join;

import com.vaticle.hypergraph.common.exception.HypergraphException;
import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.Link;
import com.vaticle.hypergraph.graph.Node;
import com.vaticle.hypergraph.pattern.Clause;
import com.vaticle.hypergraph.pattern.Variables;
import org.junit.Test;

import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.UNSUPPORTED_CLAUSE;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Space.UNRECOGNISED_TYPE_NAME;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Syntax.REPLACEMENT_ARITY;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Syntax.REPLACEMENT_UNDECLARED;
import static com.vaticle.hypergraph.graph.AtomType.ABSENT_LINK;
import static com.vaticle.hypergraph.graph.AtomType.ARROW_LINK;
import static com.vaticle.hypergraph.graph.AtomType.CONCEPT_NODE;
import static com.vaticle.hypergraph.graph.AtomType.EQUAL_LINK;
import static com.vaticle.hypergraph.graph.AtomType.MEMBER_LINK;
import static com.vaticle.hypergraph.graph.AtomType.OR_LINK;
import static com.vaticle.hypergraph.graph.AtomType.REPLACEMENT_LINK;
import static com.vaticle.hypergraph.graph.AtomType.SIGNATURE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_CHOICE;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_NODE;
import static com.vaticle.hypergraph.test.Terms.concept;
import static com.vaticle.hypergraph.test.Terms.list;
import static com.vaticle.hypergraph.test.Terms.member;
import static com.vaticle.hypergraph.test.Terms.present;
import static com.vaticle.hypergraph.test.Terms.replacement;
import static com.vaticle.hypergraph.test.Terms.type;
import static com.vaticle.hypergraph.test.Terms.typeInh;
import static com.vaticle.hypergraph.test.Terms.variable;
import static com.vaticle.hypergraph.test.Terms.variables;
import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertFalse;
import static junit.framework.TestCase.assertTrue;
import static org.junit.Assert.fail;

public class ClauseClassifierTest {

    private final Variables variables = Variables.of(variables(variable("X"), variable("Y")));

    private Clause classify(Atom atom) {
        return ClauseClassifier.classify(variables, atom);
    }

    @Test
    public void test_constraint_clauses() {
        Clause presence = classify(present(member(variable("X"), variable("Y"))));
        assertTrue(presence.isPresence());
        assertTrue(presence.isConstraint());

        Clause absent = classify(Link.of(ABSENT_LINK, member(variable("X"), concept("sea"))));
        assertTrue(absent.isEvaluatable());
        assertTrue(absent.isConstraint());
        assertTrue(classify(Link.of(EQUAL_LINK, variable("X"), variable("Y"))).isEvaluatable());
        assertEquals(Clause.Kind.EVALUATABLE, classify(Link.of(OR_LINK)).kind());
    }

    @Test
    public void test_type_directives() {
        assertTrue(classify(type(MEMBER_LINK)).isTypeDirective());
        assertTrue(classify(typeInh(MEMBER_LINK)).isTypeDirective());
        assertTrue(classify(Link.of(TYPE_CHOICE, type(MEMBER_LINK))).isTypeDirective());
        assertTrue(classify(Link.of(SIGNATURE_LINK, member(type(CONCEPT_NODE), concept("beach")))).isTypeDirective());
        assertTrue(classify(Link.of(ARROW_LINK, type(CONCEPT_NODE), type(MEMBER_LINK))).isTypeDirective());
        assertFalse(classify(type(MEMBER_LINK)).isConstraint());
    }

    @Test
    public void test_replacements() {
        Clause clause = classify(replacement(variable("Y"), concept("shore")));
        assertTrue(clause.isReplacement());
        assertFalse(clause.isConstraint());
        assertEquals(variable("Y"), clause.asReplacement().from());
        assertEquals(concept("shore"), clause.asReplacement().to());
    }

    @Test
    public void test_unsupported_shapes_are_rejected() {
        assertFails(UNSUPPORTED_CLAUSE.code(), member(variable("X"), variable("Y")));
        assertFails(UNSUPPORTED_CLAUSE.code(), concept("sea"));
        assertFails(UNSUPPORTED_CLAUSE.code(), list(variable("X")));
        assertFails(REPLACEMENT_ARITY.code(), Link.of(REPLACEMENT_LINK, variable("X"), concept("a"), concept("b")));
        assertFails(REPLACEMENT_UNDECLARED.code(), replacement(variable("Z"), concept("shore")));
        assertFails(REPLACEMENT_UNDECLARED.code(), replacement(concept("sea"), concept("shore")));
    }

    @Test
    public void test_type_directives_naming_unknown_types_are_rejected_at_construction() {
        Node unknown = Node.of(TYPE_NODE, "Nope");
        assertFails(UNRECOGNISED_TYPE_NAME.code(), unknown);
        assertFails(UNRECOGNISED_TYPE_NAME.code(), Link.of(TYPE_CHOICE, type(CONCEPT_NODE), unknown));
        try {
            JoinLink.minimal(variables(variable("X")), present(member(variable("X"), concept("beach"))), unknown);
            fail();
        } catch (HypergraphException e) {
            assertEquals(UNRECOGNISED_TYPE_NAME.code(), e.errorMessage().code());
        }
    }

    @Test
    public void test_casting_to_the_wrong_kind_is_rejected() {
        try {
            classify(type(MEMBER_LINK)).asReplacement();
            fail();
        } catch (HypergraphException e) {
            assertEquals(ILLEGAL_CAST.code(), e.errorMessage().code());
        }
    }

    private void assertFails(String code, Atom clause) {
        try {
            classify(clause);
            fail();
        } catch (HypergraphException e) {
            assertEquals(code, e.errorMessage().code());
        }
    }
}
