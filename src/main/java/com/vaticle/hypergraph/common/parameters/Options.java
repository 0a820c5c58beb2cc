/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.common.parameters;

public abstract class Options<PARENT extends Options<?, ?>, SELF extends Options<?, ?>> {

    public static final long DEFAULT_GROUNDING_LIMIT = Long.MAX_VALUE;
    public static final boolean DEFAULT_TRACE_JOIN = false;

    private PARENT parent;
    private Long groundingLimit = null;
    private Boolean traceJoin = null;

    abstract SELF getThis();

    public SELF parent(PARENT parent) {
        this.parent = parent;
        return getThis();
    }

    public long groundingLimit() {
        if (groundingLimit != null) return groundingLimit;
        else if (parent != null) return parent.groundingLimit();
        else return DEFAULT_GROUNDING_LIMIT;
    }

    public SELF groundingLimit(long groundingLimit) {
        assert groundingLimit > 0;
        this.groundingLimit = groundingLimit;
        return getThis();
    }

    public boolean traceJoin() {
        if (traceJoin != null) return traceJoin;
        else if (parent != null) return parent.traceJoin();
        else return DEFAULT_TRACE_JOIN;
    }

    public SELF traceJoin(boolean traceJoin) {
        this.traceJoin = traceJoin;
        return getThis();
    }

    public static class Space extends Options<Options<?, ?>, Space> {

        @Override
        Space getThis() {
            return this;
        }
    }

    public static class Join extends Options<Space, Join> {

        @Override
        Join getThis() {
            return this;
        }
    }
}
