package org.pragmatica.shell.parser;

import org.pragmatica.shell.lexer.Token;
import org.pragmatica.shell.lexer.TokenKind;

import java.util.List;

/**
 * Cursor over a token list. Lookahead never consumes.
 */
final class TokenStream {
    private final List<Token> tokens;
    private int pos;

    private TokenStream(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    static TokenStream of(List<Token> tokens) {
        return new TokenStream(tokens);
    }

    boolean isAtEnd() {
        return pos >= tokens.size();
    }

    Token peek() {
        return tokens.get(pos);
    }

    Token advance() {
        return tokens.get(pos++);
    }

    Token previous() {
        return tokens.get(pos - 1);
    }

    boolean at(TokenKind kind) {
        return !isAtEnd() && peek().is(kind);
    }

    boolean atKeyword(String keyword) {
        return !isAtEnd() && peek().isKeyword(keyword);
    }

    boolean matchKeyword(String keyword) {
        if (atKeyword(keyword)) {
            pos++;
            return true;
        }
        return false;
    }

    /**
     * Whether the next token is a word that directly follows {@code previous} without whitespace.
     */
    boolean atTouchingWord(Token previous) {
        return !isAtEnd() && peek().kind().isWord() && previous.touches(peek());
    }

    void skip(int count) {
        pos = Math.min(pos + count, tokens.size());
    }

    int position() {
        return pos;
    }

    /**
     * Tokens not consumed yet, as a view.
     */
    List<Token> remaining() {
        return tokens.subList(pos, tokens.size());
    }

    /**
     * Tokens consumed since {@code start}, as a view.
     */
    List<Token> since(int start) {
        return tokens.subList(start, pos);
    }
}
