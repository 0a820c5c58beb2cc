/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.pattern;

import com.vaticle.hypergraph.common.exception.HypergraphException;
import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.Link;
import org.junit.Test;

import static com.vaticle.hypergraph.common.collection.Collections.list;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.DEEP_TYPE_CONSTRAINT;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.DUPLICATE_VARIABLE;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.MULTIPLE_TYPE_CONSTRAINTS;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Construction.UNSUPPORTED_DECLARATION;
import static com.vaticle.hypergraph.graph.AtomType.ARROW_LINK;
import static com.vaticle.hypergraph.graph.AtomType.CONCEPT_NODE;
import static com.vaticle.hypergraph.graph.AtomType.LINK;
import static com.vaticle.hypergraph.graph.AtomType.MEMBER_LINK;
import static com.vaticle.hypergraph.graph.AtomType.NODE;
import static com.vaticle.hypergraph.graph.AtomType.SIGNATURE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_CHOICE;
import static com.vaticle.hypergraph.test.Terms.concept;
import static com.vaticle.hypergraph.test.Terms.member;
import static com.vaticle.hypergraph.test.Terms.type;
import static com.vaticle.hypergraph.test.Terms.typeInh;
import static com.vaticle.hypergraph.test.Terms.typed;
import static com.vaticle.hypergraph.test.Terms.variable;
import static com.vaticle.hypergraph.test.Terms.variables;
import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertFalse;
import static junit.framework.TestCase.assertTrue;
import static org.junit.Assert.fail;

public class VariablesTest {

    @Test
    public void test_variable_list_keeps_declaration_order() {
        Variables vars = Variables.of(variables(typed(variable("X"), type(CONCEPT_NODE)), variable("Y")));
        assertEquals(list(variable("X"), variable("Y")), vars.sequence());
        assertEquals(1, vars.indexOf(variable("Y")));
        assertTrue(vars.contains(variable("X")));
        assertFalse(vars.contains(variable("Z")));
        assertFalse(vars.contains(concept("X")));
        assertTrue(vars.constraint(variable("X")).isPresent());
        assertFalse(vars.constraint(variable("Y")).isPresent());
    }

    @Test
    public void test_single_declarations_and_empty_lists() {
        assertEquals(list(variable("X")), Variables.of(variable("X")).sequence());
        assertEquals(1, Variables.of(typed(variable("X"), type(CONCEPT_NODE))).size());
        assertTrue(Variables.of(variables()).isEmpty());
    }

    @Test
    public void test_exact_and_inherited_type_constraints() {
        Variables vars = Variables.of(variables(typed(variable("N"), typeInh(NODE)), typed(variable("C"), type(CONCEPT_NODE))));
        assertTrue(vars.accepts(variable("N"), concept("sea")));
        assertTrue(vars.accepts(variable("C"), concept("sea")));
        assertFalse(vars.accepts(variable("C"), member(concept("sea"), concept("beach"))));
        assertFalse(vars.accepts(variable("N"), member(concept("sea"), concept("beach"))));
        assertTrue(vars.accepts(variable("Unconstrained"), member(concept("sea"), concept("beach"))));
    }

    @Test
    public void test_single_member_type_choice_is_accepted() {
        Variables vars = Variables.of(typed(variable("X"), Link.of(TYPE_CHOICE, typeInh(LINK))));
        assertTrue(vars.accepts(variable("X"), member(concept("sea"), concept("beach"))));
        assertFalse(vars.accepts(variable("X"), concept("sea")));
    }

    @Test
    public void test_declaration_of_variable_carries_its_type() {
        Atom typedX = typed(variable("X"), type(CONCEPT_NODE));
        Variables vars = Variables.of(variables(typedX, variable("Y")));
        assertEquals(typedX, vars.declaration(variable("X")));
        assertEquals(variable("Y"), vars.declaration(variable("Y")));
    }

    @Test
    public void test_multiple_type_constraints_are_rejected() {
        assertFails(MULTIPLE_TYPE_CONSTRAINTS.code(), typed(variable("X"), Link.of(TYPE_CHOICE, type(CONCEPT_NODE), type(MEMBER_LINK))));
    }

    @Test
    public void test_deep_type_constraints_are_rejected() {
        assertFails(DEEP_TYPE_CONSTRAINT.code(), typed(variable("X"), Link.of(SIGNATURE_LINK, member(type(CONCEPT_NODE), concept("beach")))));
        assertFails(DEEP_TYPE_CONSTRAINT.code(), typed(variable("X"), Link.of(ARROW_LINK, type(CONCEPT_NODE), type(CONCEPT_NODE))));
    }

    @Test
    public void test_malformed_declarations_are_rejected() {
        assertFails(UNSUPPORTED_DECLARATION.code(), variables(concept("X")));
        assertFails(UNSUPPORTED_DECLARATION.code(), typed(variable("X"), concept("ConceptNode")));
        assertFails(DUPLICATE_VARIABLE.code(), variables(variable("X"), typed(variable("X"), type(CONCEPT_NODE))));
    }

    private static void assertFails(String code, Atom declaration) {
        try {
            Variables.of(declaration);
            fail();
        } catch (HypergraphException e) {
            assertEquals(code, e.errorMessage().code());
        }
    }
}
