package org.pragmatica.shell.parser;

import org.pragmatica.shell.lexer.Token;
import org.pragmatica.shell.lexer.TokenKind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Splits a token list at the first terminator keyword that sits at the current nesting level.
 *
 * <p>Openers of nested blocks are tracked on a stack, so {@code fi} inside a nested {@code if}
 * does not end the enclosing then-branch. A closer that does not match the innermost open
 * block leaves the stack unchanged.
 */
public final class BlockExtractor {
    /**
     * Every block opener; the usual {@code nestedKeywords} argument.
     */
    public static final Set<String> OPENERS = Set.of("if", "for", "while", "until");

    private static final Set<String> STATEMENT_LEADERS = Set.of("then", "else", "do", "fi", "done");

    private BlockExtractor() {}

    /**
     * Result of an extraction. {@code remaining} starts at the terminator, or is empty when
     * no terminator was found at the outer level.
     */
    public record Extraction(List<Token> prefix, List<Token> remaining) {
        public boolean terminated() {
            return !remaining.isEmpty();
        }

        public Optional<Token> terminator() {
            return remaining.isEmpty()
                   ? Optional.empty()
                   : Optional.of(remaining.get(0));
        }
    }

    private enum Block {
        IF("if", "fi"),
        FOR("for", "done"),
        WHILE("while", "done"),
        UNTIL("until", "done");

        private final String opener;
        private final String closer;

        Block(String opener, String closer) {
            this.opener = opener;
            this.closer = closer;
        }

        static Optional<Block> openedBy(String word) {
            for (var block : values()) {
                if (block.opener.equals(word)) {
                    return Optional.of(block);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Scan {@code tokens} for the first of {@code endKeywords} outside any nested block.
     *
     * @param tokens         tokens to scan; the returned lists are views of it
     * @param endKeywords    keywords that terminate the extraction
     * @param nestedKeywords openers that start a nested block
     */
    public static Extraction extractUntil(List<Token> tokens, Set<String> endKeywords, Set<String> nestedKeywords) {
        Deque<Block> open = new ArrayDeque<>();
        for (int i = 0; i < tokens.size(); i++) {
            var token = tokens.get(i);
            if (!token.is(TokenKind.COMMAND)) {
                continue;
            }
            var word = token.text();
            if (open.isEmpty() && endKeywords.contains(word)) {
                return new Extraction(tokens.subList(0, i), tokens.subList(i, tokens.size()));
            }
            if (nestedKeywords.contains(word) && startsStatement(tokens, i)) {
                Block.openedBy(word)
                     .ifPresent(open::push);
            } else if (!open.isEmpty() && open.peek().closer.equals(word)) {
                open.pop();
            }
        }
        return new Extraction(tokens, List.of());
    }

    // An opener used as an argument ("echo for") must not open a block.
    private static boolean startsStatement(List<Token> tokens, int index) {
        if (index == 0) {
            return true;
        }
        var previous = tokens.get(index - 1);
        return previous.is(TokenKind.SEMICOLON) || previous.is(TokenKind.PIPE) || (previous.is(TokenKind.COMMAND) && STATEMENT_LEADERS.contains(previous.text()));
    }
}
