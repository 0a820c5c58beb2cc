/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.join;

import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.Link;
import org.junit.Test;

import java.util.Set;

import static com.vaticle.hypergraph.common.collection.Collections.list;
import static com.vaticle.hypergraph.common.collection.Collections.set;
import static com.vaticle.hypergraph.graph.AtomType.ARROW_LINK;
import static com.vaticle.hypergraph.graph.AtomType.CONCEPT_NODE;
import static com.vaticle.hypergraph.graph.AtomType.LINK;
import static com.vaticle.hypergraph.graph.AtomType.LIST_LINK;
import static com.vaticle.hypergraph.graph.AtomType.MEMBER_LINK;
import static com.vaticle.hypergraph.graph.AtomType.NODE;
import static com.vaticle.hypergraph.graph.AtomType.SIGNATURE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_CHOICE;
import static com.vaticle.hypergraph.test.Terms.concept;
import static com.vaticle.hypergraph.test.Terms.member;
import static com.vaticle.hypergraph.test.Terms.type;
import static com.vaticle.hypergraph.test.Terms.typeInh;
import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertFalse;
import static junit.framework.TestCase.assertSame;
import static junit.framework.TestCase.assertTrue;

public class ConstrainerTest {

    private final Link seaBeach = member(concept("sea"), concept("beach"));

    @Test
    public void test_type_nodes_match_exactly_and_inherited_type_nodes_match_subtypes() {
        assertTrue(Constrainer.isOfType(seaBeach, type(MEMBER_LINK)));
        assertFalse(Constrainer.isOfType(seaBeach, type(LINK)));
        assertTrue(Constrainer.isOfType(seaBeach, typeInh(LINK)));
        assertFalse(Constrainer.isOfType(seaBeach, typeInh(NODE)));
    }

    @Test
    public void test_type_choice_matches_any_member() {
        assertTrue(Constrainer.isOfType(seaBeach, Link.of(TYPE_CHOICE, type(LIST_LINK), type(MEMBER_LINK))));
        assertFalse(Constrainer.isOfType(seaBeach, Link.of(TYPE_CHOICE, type(LIST_LINK), type(CONCEPT_NODE))));
        assertFalse(Constrainer.isOfType(seaBeach, Link.of(TYPE_CHOICE)));
    }

    @Test
    public void test_signature_matches_structurally() {
        assertTrue(Constrainer.isOfType(seaBeach, Link.of(SIGNATURE_LINK, member(type(CONCEPT_NODE), concept("beach")))));
        assertFalse(Constrainer.isOfType(seaBeach, Link.of(SIGNATURE_LINK, member(type(CONCEPT_NODE), concept("forest")))));
        assertFalse(Constrainer.isOfType(seaBeach, Link.of(SIGNATURE_LINK, Link.of(LIST_LINK, type(CONCEPT_NODE), concept("beach")))));
        assertTrue(Constrainer.isOfType(seaBeach, Link.of(SIGNATURE_LINK, member(
                Link.of(TYPE_CHOICE, type(MEMBER_LINK), type(CONCEPT_NODE)), typeInh(NODE)))));
    }

    @Test
    public void test_arrow_matches_its_output_type() {
        assertTrue(Constrainer.isOfType(seaBeach, Link.of(ARROW_LINK, type(CONCEPT_NODE), type(MEMBER_LINK))));
        assertFalse(Constrainer.isOfType(seaBeach, Link.of(ARROW_LINK, type(MEMBER_LINK), type(CONCEPT_NODE))));
    }

    @Test
    public void test_every_directive_must_hold() {
        Set<Atom> containers = set(seaBeach, concept("sea"));
        assertSame(containers, Constrainer.constrain(containers, list()));
        assertEquals(set(seaBeach), Constrainer.constrain(containers, list(typeInh(LINK))));
        assertEquals(set(seaBeach), Constrainer.constrain(containers, list(typeInh(LINK), type(MEMBER_LINK))));
        assertTrue(Constrainer.constrain(containers, list(typeInh(LINK), type(LIST_LINK))).isEmpty());
    }
}
