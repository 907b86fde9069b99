package org.pragmatica.shell.error;

/**
 * Thrown when parsing hits a resource limit.
 */
public final class ParseException extends RuntimeException {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
