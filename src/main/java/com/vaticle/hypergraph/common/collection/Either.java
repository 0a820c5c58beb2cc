/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.common.collection;

import com.vaticle.hypergraph.common.exception.HypergraphException;

import static com.vaticle.hypergraph.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;

public abstract class Either<FIRST, SECOND> {

    public static <T, U> Either<T, U> first(T first) {
        return new First<>(first);
    }

    public static <T, U> Either<T, U> second(U second) {
        return new Second<>(second);
    }

    public boolean isFirst() {
        return false;
    }

    public boolean isSecond() {
        return false;
    }

    public FIRST first() {
        throw HypergraphException.of(ILLEGAL_STATE);
    }

    public SECOND second() {
        throw HypergraphException.of(ILLEGAL_STATE);
    }

    private static class First<FIRST, SECOND> extends Either<FIRST, SECOND> {

        private final FIRST value;

        private First(FIRST value) {
            this.value = value;
        }

        @Override
        public boolean isFirst() {
            return true;
        }

        @Override
        public FIRST first() {
            return value;
        }
    }

    private static class Second<FIRST, SECOND> extends Either<FIRST, SECOND> {

        private final SECOND value;

        private Second(SECOND value) {
            this.value = value;
        }

        @Override
        public boolean isSecond() {
            return true;
        }

        @Override
        public SECOND second() {
            return value;
        }
    }
}
