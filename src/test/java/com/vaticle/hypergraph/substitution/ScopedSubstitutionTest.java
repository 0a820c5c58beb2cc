/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.substitution;

import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.Link;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static com.vaticle.hypergraph.graph.AtomType.LAMBDA_LINK;
import static com.vaticle.hypergraph.graph.AtomType.QUOTE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.UNQUOTE_LINK;
import static com.vaticle.hypergraph.test.Terms.concept;
import static com.vaticle.hypergraph.test.Terms.list;
import static com.vaticle.hypergraph.test.Terms.member;
import static com.vaticle.hypergraph.test.Terms.variable;
import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertSame;

public class ScopedSubstitutionTest {

    @Test
    public void test_every_occurrence_is_rewritten() {
        Map<Atom, Atom> mapping = new HashMap<>();
        mapping.put(concept("sea"), concept("shore"));
        Link term = list(member(concept("sea"), concept("beach")), concept("sea"));
        assertEquals(list(member(concept("shore"), concept("beach")), concept("shore")), ScopedSubstitution.substitute(term, mapping));
    }

    @Test
    public void test_whole_subterms_can_be_rewritten() {
        Map<Atom, Atom> mapping = new HashMap<>();
        mapping.put(member(concept("sea"), concept("beach")), concept("coast"));
        assertEquals(list(concept("coast")), ScopedSubstitution.substitute(list(member(concept("sea"), concept("beach"))), mapping));
    }

    @Test
    public void test_unchanged_terms_are_returned_as_is() {
        Map<Atom, Atom> mapping = new HashMap<>();
        mapping.put(concept("sand"), concept("shore"));
        Link term = member(concept("sea"), concept("beach"));
        assertSame(term, ScopedSubstitution.substitute(term, mapping));
        assertSame(term, ScopedSubstitution.substitute(term, new HashMap<>()));
    }

    @Test
    public void test_variables_rebound_by_a_nested_scope_are_not_rewritten() {
        Map<Atom, Atom> mapping = new HashMap<>();
        mapping.put(variable("X"), concept("sea"));
        Link term = list(variable("X"), Link.of(LAMBDA_LINK, variable("X"), member(variable("X"), concept("beach"))));
        Link expected = list(concept("sea"), Link.of(LAMBDA_LINK, variable("X"), member(variable("X"), concept("beach"))));
        assertEquals(expected, ScopedSubstitution.substitute(term, mapping));
    }

    @Test
    public void test_quoted_regions_are_rewritten_only_where_unquoted() {
        Map<Atom, Atom> mapping = new HashMap<>();
        mapping.put(concept("sea"), concept("shore"));
        Link term = Link.of(QUOTE_LINK, member(concept("sea"), Link.of(UNQUOTE_LINK, concept("sea"))));
        Link expected = Link.of(QUOTE_LINK, member(concept("sea"), Link.of(UNQUOTE_LINK, concept("shore"))));
        assertEquals(expected, ScopedSubstitution.substitute(term, mapping));
    }
}
