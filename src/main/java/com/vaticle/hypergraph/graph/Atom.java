/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.graph;

import com.vaticle.hypergraph.common.exception.HypergraphException;

import static com.vaticle.hypergraph.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;

/**
 * An immutable element of the hypergraph: either a named {@link Node} or a {@link Link} over an
 * ordered sequence of child atoms. Atoms compare by value; the {@link AtomSpace} that holds an atom
 * decides its canonical instance and its incoming set.
 */
public abstract class Atom {

    final AtomType type;

    Atom(AtomType type) {
        this.type = type;
    }

    public AtomType type() {
        return type;
    }

    public boolean isA(AtomType other) {
        return type.isA(other);
    }

    public boolean isNode() {
        return false;
    }

    public boolean isLink() {
        return false;
    }

    public Node asNode() {
        throw HypergraphException.of(ILLEGAL_CAST, className(getClass()), className(Node.class));
    }

    public Link asLink() {
        throw HypergraphException.of(ILLEGAL_CAST, className(getClass()), className(Link.class));
    }

    static String className(Class<?> clazz) {
        return clazz.getSimpleName();
    }
}
