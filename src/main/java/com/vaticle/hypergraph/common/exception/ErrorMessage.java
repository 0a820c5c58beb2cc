/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.hypergraph.common.exception;

import java.util.HashMap;
import java.util.Map;

public abstract class ErrorMessage {

    private static final Map<String, Map<Integer, ErrorMessage>> errors = new HashMap<>();
    private static int maxCodeNumber = 0;
    private static int maxCodeDigits = 0;

    private final String codePrefix;
    private final int codeNumber;
    private final String messagePrefix;
    private final String messageBody;
    private String code = null;

    private ErrorMessage(String codePrefix, int codeNumber, String messagePrefix, String messageBody) {
        this.codePrefix = codePrefix;
        this.codeNumber = codeNumber;
        this.messagePrefix = messagePrefix;
        this.messageBody = messageBody;

        assert errors.get(codePrefix) == null || errors.get(codePrefix).get(codeNumber) == null;
        errors.computeIfAbsent(codePrefix, s -> new HashMap<>()).put(codeNumber, this);
        maxCodeNumber = Math.max(codeNumber, maxCodeNumber);
        maxCodeDigits = (int) Math.ceil(Math.log10(maxCodeNumber + 1));
    }

    public String code() {
        if (code != null) return code;

        StringBuilder zeros = new StringBuilder();
        for (int digits = (int) Math.ceil(Math.log10(codeNumber + 1)); digits < maxCodeDigits; digits++) {
            zeros.append("0");
        }
        code = codePrefix + zeros + codeNumber;
        return code;
    }

    public String message(Object... parameters) {
        return String.format("[%s] %s: %s", code(), messagePrefix, String.format(messageBody, parameters));
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", code(), messagePrefix, messageBody);
    }

    public static class Internal extends ErrorMessage {
        public static final Internal ILLEGAL_STATE =
                new Internal(1, "Illegal internal state!");
        public static final Internal ILLEGAL_CAST =
                new Internal(2, "Illegal casting operation from '%s' to '%s'.");
        public static final Internal UNEXPECTED_INTERRUPTION =
                new Internal(3, "Unexpected thread interruption!");

        private static final String codePrefix = "INT";
        private static final String messagePrefix = "Invalid Internal State";

        Internal(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Space extends ErrorMessage {
        public static final Space SPACE_CLOSED =
                new Space(1, "Attempted to use an atom space that has been closed.");
        public static final Space UNRECOGNISED_TYPE_NAME =
                new Space(2, "The atom type name '%s' was not recognised.");
        public static final Space ILLEGAL_NODE_TYPE =
                new Space(3, "The type '%s' is not a node type.");
        public static final Space ILLEGAL_LINK_TYPE =
                new Space(4, "The type '%s' is not a link type.");
        public static final Space ABSTRACT_TYPE_INSTANTIATED =
                new Space(5, "The type '%s' is abstract and cannot be instantiated.");
        public static final Space RESULT_CHANNEL_CLOSED =
                new Space(6, "Attempted to write to a result channel that has already been closed.");

        private static final String codePrefix = "SPC";
        private static final String messagePrefix = "Invalid Atom Space Operation";

        Space(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Construction extends ErrorMessage {
        public static final Construction NOT_A_JOIN =
                new Construction(1, "Expecting a join link type, got '%s'.");
        public static final Construction ABSTRACT_JOIN =
                new Construction(2, "JoinLinks are private and cannot be instantiated directly.");
        public static final Construction MISSING_DECLARATIONS =
                new Construction(3, "A join requires a variable declaration as its first element.");
        public static final Construction UNSUPPORTED_CLAUSE =
                new Construction(4, "Unsupported clause form '%s'.");
        public static final Construction UNSUPPORTED_DECLARATION =
                new Construction(5, "Unsupported variable declaration '%s'.");
        public static final Construction MULTIPLE_TYPE_CONSTRAINTS =
                new Construction(6, "The variable '%s' is declared with multiple type constraints '%s', which is not supported.");
        public static final Construction DEEP_TYPE_CONSTRAINT =
                new Construction(7, "The variable '%s' is declared with a structural type constraint '%s', which is not supported.");
        public static final Construction DUPLICATE_VARIABLE =
                new Construction(8, "The variable '%s' is declared more than once.");
        public static final Construction AMBIGUOUS_REPLACEMENT =
                new Construction(9, "The replacement '%s' is ambiguous: its variable has %s distinct groundings.");

        private static final String codePrefix = "CNS";
        private static final String messagePrefix = "Invalid Join Construction";

        Construction(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Syntax extends ErrorMessage {
        public static final Syntax REPLACEMENT_ARITY =
                new Syntax(1, "ReplacementLink expecting two arguments, got '%s'.");
        public static final Syntax REPLACEMENT_UNDECLARED =
                new Syntax(2, "No matching variable declaration for: '%s'.");

        private static final String codePrefix = "SYN";
        private static final String messagePrefix = "Invalid Join Syntax";

        Syntax(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Oracle extends ErrorMessage {
        public static final Oracle NOT_A_QUERY =
                new Oracle(1, "Expecting a MeetLink query, got '%s'.");
        public static final Oracle UNBOUND_EVALUATABLE =
                new Oracle(2, "The evaluatable clause '%s' refers to variables that no presence clause binds.");
        public static final Oracle UNSUPPORTED_EVALUATABLE =
                new Oracle(3, "The clause '%s' cannot be evaluated.");
        public static final Oracle GROUNDING_LIMIT_EXCEEDED =
                new Oracle(4, "The search produced more than the configured limit of '%s' groundings.");

        private static final String codePrefix = "ORC";
        private static final String messagePrefix = "Grounding Search Failure";

        Oracle(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }
}
