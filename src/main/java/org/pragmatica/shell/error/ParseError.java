package org.pragmatica.shell.error;

import org.pragmatica.shell.tree.SourceLocation;

/**
 * Hard parse failures. Malformed scripts are never errors; only resource limits are.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Block nesting went deeper than the configured limit.
     */
    record RecursionLimitExceeded(
    SourceLocation location,
    int limit) implements ParseError {
        @Override
        public String message() {
            return "Nesting deeper than " + limit + " levels at " + location;
        }
    }

    /**
     * Input longer than the configured limit.
     */
    record InputTooLarge(
    SourceLocation location,
    int length,
    int limit) implements ParseError {
        @Override
        public String message() {
            return "Input of " + length + " characters exceeds maximum size of " + limit + " characters";
        }
    }
}
