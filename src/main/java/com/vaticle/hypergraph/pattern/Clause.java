/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.pattern;

import com.vaticle.hypergraph.common.exception.HypergraphException;
import com.vaticle.hypergraph.graph.Atom;
import com.vaticle.hypergraph.graph.Link;

import java.util.Objects;

import static com.vaticle.hypergraph.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;

/**
 * One body clause of a join, tagged with the role it plays.
 *
 * The set of kinds is closed. Consumers dispatch on {@link Kind}, or test and cast with the
 * {@code isX()} and {@code asX()} pairs.
 */
public abstract class Clause {

    public enum Kind {PRESENCE, EVALUATABLE, REPLACEMENT, TYPE_DIRECTIVE}

    final Atom atom;
    private final int hash;

    Clause(Atom atom) {
        this.atom = atom;
        this.hash = Objects.hash(kind(), atom);
    }

    public abstract Kind kind();

    public Atom atom() {
        return atom;
    }

    /**
     * @return true for the clauses that constrain the grounding search
     */
    public boolean isConstraint() {
        return false;
    }

    public boolean isPresence() {
        return false;
    }

    public boolean isEvaluatable() {
        return false;
    }

    public boolean isReplacement() {
        return false;
    }

    public boolean isTypeDirective() {
        return false;
    }

    public Presence asPresence() {
        throw HypergraphException.of(ILLEGAL_CAST, getClass().getSimpleName(), Presence.class.getSimpleName());
    }

    public Evaluatable asEvaluatable() {
        throw HypergraphException.of(ILLEGAL_CAST, getClass().getSimpleName(), Evaluatable.class.getSimpleName());
    }

    public Replacement asReplacement() {
        throw HypergraphException.of(ILLEGAL_CAST, getClass().getSimpleName(), Replacement.class.getSimpleName());
    }

    public TypeDirective asTypeDirective() {
        throw HypergraphException.of(ILLEGAL_CAST, getClass().getSimpleName(), TypeDirective.class.getSimpleName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Clause that = (Clause) o;
        return this.atom.equals(that.atom);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return kind() + " " + atom;
    }

    public static class Presence extends Clause {

        public Presence(Link present) {
            super(present);
        }

        @Override
        public Kind kind() {
            return Kind.PRESENCE;
        }

        @Override
        public boolean isConstraint() {
            return true;
        }

        @Override
        public boolean isPresence() {
            return true;
        }

        @Override
        public Presence asPresence() {
            return this;
        }
    }

    public static class Evaluatable extends Clause {

        public Evaluatable(Atom evaluatable) {
            super(evaluatable);
        }

        @Override
        public Kind kind() {
            return Kind.EVALUATABLE;
        }

        @Override
        public boolean isConstraint() {
            return true;
        }

        @Override
        public boolean isEvaluatable() {
            return true;
        }

        @Override
        public Evaluatable asEvaluatable() {
            return this;
        }
    }

    public static class Replacement extends Clause {

        private final Atom from;
        private final Atom to;

        public Replacement(Link replacement) {
            super(replacement);
            assert replacement.arity() == 2;
            this.from = replacement.outgoing(0);
            this.to = replacement.outgoing(1);
        }

        @Override
        public Kind kind() {
            return Kind.REPLACEMENT;
        }

        public Atom from() {
            return from;
        }

        public Atom to() {
            return to;
        }

        @Override
        public boolean isReplacement() {
            return true;
        }

        @Override
        public Replacement asReplacement() {
            return this;
        }
    }

    public static class TypeDirective extends Clause {

        public TypeDirective(Atom typeSpec) {
            super(typeSpec);
        }

        @Override
        public Kind kind() {
            return Kind.TYPE_DIRECTIVE;
        }

        @Override
        public boolean isTypeDirective() {
            return true;
        }

        @Override
        public TypeDirective asTypeDirective() {
            return this;
        }
    }
}
