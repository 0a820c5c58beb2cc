/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.graph;

import com.vaticle.hypergraph.common.exception.HypergraphException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static com.vaticle.hypergraph.common.collection.Collections.list;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Space.ABSTRACT_TYPE_INSTANTIATED;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Space.ILLEGAL_LINK_TYPE;

public class Link extends Atom {

    private final List<Atom> outgoing;
    private final int hash;

    protected Link(AtomType type, List<Atom> outgoing) {
        super(type);
        if (!type.isLink()) throw HypergraphException.of(ILLEGAL_LINK_TYPE, type);
        if (type.isAbstract()) throw HypergraphException.of(ABSTRACT_TYPE_INSTANTIATED, type);
        this.outgoing = list(outgoing);
        this.hash = Objects.hash(type, this.outgoing);
    }

    public static Link of(AtomType type, List<Atom> outgoing) {
        return new Link(type, outgoing);
    }

    public static Link of(AtomType type, Atom... outgoing) {
        return new Link(type, Arrays.asList(outgoing));
    }

    public List<Atom> outgoing() {
        return outgoing;
    }

    public Atom outgoing(int index) {
        return outgoing.get(index);
    }

    public int arity() {
        return outgoing.size();
    }

    @Override
    public boolean isLink() {
        return true;
    }

    @Override
    public Link asLink() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Link)) return false;
        Link that = (Link) o;
        return this.hash == that.hash && this.type == that.type && this.outgoing.equals(that.outgoing);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("(").append(type);
        for (Atom atom : outgoing) builder.append(" ").append(atom);
        return builder.append(")").toString();
    }
}
