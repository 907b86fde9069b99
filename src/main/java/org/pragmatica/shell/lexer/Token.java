package org.pragmatica.shell.lexer;

import org.pragmatica.shell.tree.SourceSpan;

/**
 * A lexical token. {@code text} is the token literal (quoted strings without their quotes),
 * {@code span} covers the raw source, quotes included.
 */
public record Token(TokenKind kind, String text, SourceSpan span) {

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    /**
     * Keywords are only ever {@link TokenKind#COMMAND} tokens; a quoted {@code "fi"} is not a keyword.
     */
    public boolean isKeyword(String keyword) {
        return kind == TokenKind.COMMAND && text.equals(keyword);
    }

    /**
     * Whether {@code next} starts exactly where this token ends, with no whitespace between them.
     */
    public boolean touches(Token next) {
        return span.start().offset() + span.length() == next.span().start().offset();
    }

    @Override
    public String toString() {
        return kind + " '" + text + "' at " + span.start();
    }
}
