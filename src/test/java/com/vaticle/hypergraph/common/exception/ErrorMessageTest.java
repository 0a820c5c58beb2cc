/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.common.exception;

import org.junit.Test;

import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertTrue;

public class ErrorMessageTest {

    @Test
    public void test_codes_are_prefixed_and_padded() {
        assertEquals("CNS1", ErrorMessage.Construction.NOT_A_JOIN.code().replaceAll("0", ""));
        assertTrue(ErrorMessage.Syntax.REPLACEMENT_ARITY.code().startsWith("SYN"));
        assertEquals(ErrorMessage.Oracle.NOT_A_QUERY.code().length(), ErrorMessage.Internal.ILLEGAL_CAST.code().length());
    }

    @Test
    public void test_internal_codes_are_contiguous() {
        assertEquals("INT1", ErrorMessage.Internal.ILLEGAL_STATE.code().replaceAll("0", ""));
        assertEquals("INT2", ErrorMessage.Internal.ILLEGAL_CAST.code().replaceAll("0", ""));
        assertEquals("INT3", ErrorMessage.Internal.UNEXPECTED_INTERRUPTION.code().replaceAll("0", ""));
    }

    @Test
    public void test_exception_message_carries_code_and_parameters() {
        HypergraphException exception = HypergraphException.of(ErrorMessage.Construction.DUPLICATE_VARIABLE, "(VariableNode \"X\")");
        assertTrue(exception.getMessage().startsWith("[" + ErrorMessage.Construction.DUPLICATE_VARIABLE.code() + "]"));
        assertTrue(exception.getMessage().contains("(VariableNode \"X\")"));
        assertEquals(ErrorMessage.Construction.DUPLICATE_VARIABLE, exception.errorMessage());
    }
}
