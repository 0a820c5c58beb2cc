/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.common.exception;

import java.util.Objects;

public class HypergraphException extends RuntimeException {

    private final ErrorMessage error;

    private HypergraphException(ErrorMessage error, Throwable cause) {
        super(error.message(cause), cause);
        assert !getMessage().contains("%s");
        this.error = error;
    }

    private HypergraphException(ErrorMessage error, Object... parameters) {
        super(error.message(parameters));
        assert !getMessage().contains("%s");
        this.error = error;
    }

    public static HypergraphException of(ErrorMessage errorMessage, Throwable cause) {
        return new HypergraphException(errorMessage, cause);
    }

    public static HypergraphException of(ErrorMessage errorMessage, Object... parameters) {
        return new HypergraphException(errorMessage, parameters);
    }

    public ErrorMessage errorMessage() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HypergraphException that = (HypergraphException) o;
        return error.equals(that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(error);
    }
}
