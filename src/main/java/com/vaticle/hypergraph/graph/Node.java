/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.graph;

import com.vaticle.hypergraph.common.exception.HypergraphException;

import java.util.Objects;

import static com.vaticle.hypergraph.common.exception.ErrorMessage.Space.ABSTRACT_TYPE_INSTANTIATED;
import static com.vaticle.hypergraph.common.exception.ErrorMessage.Space.ILLEGAL_NODE_TYPE;

public class Node extends Atom {

    private final String name;
    private final int hash;

    private Node(AtomType type, String name) {
        super(type);
        this.name = name;
        this.hash = Objects.hash(type, name);
    }

    public static Node of(AtomType type, String name) {
        if (!type.isNode()) throw HypergraphException.of(ILLEGAL_NODE_TYPE, type);
        if (type.isAbstract()) throw HypergraphException.of(ABSTRACT_TYPE_INSTANTIATED, type);
        return new Node(type, Objects.requireNonNull(name));
    }

    public String name() {
        return name;
    }

    @Override
    public boolean isNode() {
        return true;
    }

    @Override
    public Node asNode() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node that = (Node) o;
        return this.type == that.type && this.name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "(" + type + " \"" + name + "\")";
    }
}
