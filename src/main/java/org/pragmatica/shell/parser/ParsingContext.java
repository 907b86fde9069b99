package org.pragmatica.shell.parser;

import org.pragmatica.shell.error.ParseError;
import org.pragmatica.shell.error.ParseException;
import org.pragmatica.shell.lexer.Token;
import org.pragmatica.shell.lexer.TokenKind;
import org.pragmatica.shell.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Per-parse state: the source text spans are cut from, and the nesting limit.
 */
final class ParsingContext {
    private static final Logger log = LoggerFactory.getLogger(ParsingContext.class);

    private final String source;
    private final ParserConfig config;

    private ParsingContext(String source, ParserConfig config) {
        this.source = source;
        this.config = config;
    }

    static ParsingContext create(String source, ParserConfig config) {
        return new ParsingContext(source, config);
    }

    // === Spans ===

    SourceSpan span(Token first, Token last) {
        return SourceSpan.covering(source, first.span(), last.span());
    }

    /**
     * Span over {@code tokens} with leading and trailing separators trimmed, or
     * {@link SourceSpan#EMPTY} when nothing but separators remains.
     */
    SourceSpan span(List<Token> tokens) {
        int first = 0;
        int last = tokens.size() - 1;
        while (first <= last && tokens.get(first).is(TokenKind.SEMICOLON)) {
            first++;
        }
        while (last >= first && tokens.get(last).is(TokenKind.SEMICOLON)) {
            last--;
        }
        if (first > last) {
            return SourceSpan.EMPTY;
        }
        return span(tokens.get(first), tokens.get(last));
    }

    // === Limits ===

    /**
     * Called before parsing a block opened by {@code opener} at the given nesting depth.
     */
    void enterBlock(int depth, Token opener) {
        if (depth >= config.maxNestingDepth()) {
            log.warn("Block '{}' at {} nests deeper than {} levels", opener.text(), opener.span().start(), config.maxNestingDepth());
            throw new ParseException(new ParseError.RecursionLimitExceeded(opener.span().start(), config.maxNestingDepth()));
        }
    }
}
