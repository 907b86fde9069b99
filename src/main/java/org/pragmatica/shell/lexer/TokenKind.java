package org.pragmatica.shell.lexer;

/**
 * Token types produced by the shell tokenizer.
 */
public enum TokenKind {
    // Words
    COMMAND,
    STRING_LITERAL,
    OPTION,
    VARIABLE,
    COMMAND_SUBSTITUTION,
    // Operators
    PIPE,
    REDIRECT_OUTPUT,
    REDIRECT_APPEND,
    REDIRECT_INPUT,
    SEMICOLON;

    /**
     * Whether tokens of this kind carry word text (command names, arguments, redirect targets).
     */
    public boolean isWord() {
        return switch (this) {
            case COMMAND, STRING_LITERAL, OPTION, VARIABLE, COMMAND_SUBSTITUTION -> true;
            default -> false;
        };
    }

    public boolean isRedirect() {
        return this == REDIRECT_OUTPUT || this == REDIRECT_APPEND || this == REDIRECT_INPUT;
    }
}
