/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.join;

import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.AtomType;
import com.vaticle.hypergraph.graph.Link;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.vaticle.hypergraph.graph.AtomType.ARROW_LINK;
import static com.vaticle.hypergraph.graph.AtomType.SIGNATURE_LINK;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_CHOICE;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_INH_NODE;
import static com.vaticle.hypergraph.graph.AtomType.TYPE_NODE;

/**
 * Keeps the containers that satisfy every type directive of a join.
 */
class Constrainer {

    private Constrainer() {}

    static Set<Atom> constrain(Set<Atom> containers, List<Atom> directives) {
        if (directives.isEmpty()) return containers;
        Set<Atom> accepted = new LinkedHashSet<>();
        for (Atom container : containers) {
            if (directives.stream().allMatch(directive -> isOfType(container, directive))) accepted.add(container);
        }
        return accepted;
    }

    /**
     * {@code TypeNode} matches the exact type and {@code TypeInhNode} the type or any subtype.
     * {@code TypeChoice} matches when any of its members does, {@code SignatureLink} matches its
     * body structurally, and {@code ArrowLink} matches its output type.
     */
    static boolean isOfType(Atom value, Atom typeSpec) {
        if (typeSpec.isA(TYPE_NODE)) {
            AtomType type = AtomType.of(typeSpec.asNode().name());
            return typeSpec.type() == TYPE_INH_NODE ? value.isA(type) : value.type() == type;
        } else if (typeSpec.type() == TYPE_CHOICE) {
            return typeSpec.asLink().outgoing().stream().anyMatch(member -> isOfType(value, member));
        } else if (typeSpec.type() == SIGNATURE_LINK) {
            Link signature = typeSpec.asLink();
            return signature.arity() == 1 && matchesSignature(value, signature.outgoing(0));
        } else if (typeSpec.type() == ARROW_LINK) {
            Link arrow = typeSpec.asLink();
            return arrow.arity() > 0 && isOfType(value, arrow.outgoing(arrow.arity() - 1));
        } else {
            return false;
        }
    }

    private static boolean matchesSignature(Atom value, Atom signature) {
        if (signature.isA(TYPE_NODE) || signature.type() == TYPE_CHOICE || signature.type() == SIGNATURE_LINK) {
            return isOfType(value, signature);
        } else if (signature.isNode()) {
            return signature.equals(value);
        } else {
            if (!value.isLink() || value.type() != signature.type()) return false;
            Link valueLink = value.asLink(), signatureLink = signature.asLink();
            if (valueLink.arity() != signatureLink.arity()) return false;
            for (int i = 0; i < valueLink.arity(); i++) {
                if (!matchesSignature(valueLink.outgoing(i), signatureLink.outgoing(i))) return false;
            }
            return true;
        }
    }
}
