package org.pragmatica.shell.parser;

import org.pragmatica.shell.lexer.Token;
import org.pragmatica.shell.tree.Node.Script;

import java.util.List;

/**
 * Parser interface - turns shell script text into a syntax tree without executing anything.
 *
 * <p>Neither method fails on malformed scripts; both throw
 * {@link org.pragmatica.shell.error.ParseException} only when a configured resource limit is hit.
 */
public interface Parser {

    /**
     * Split input into tokens. Intended for debugging and inspection.
     */
    List<Token> tokenize(String input);

    /**
     * Parse input into a best-effort tree. The root script's span holds the complete input.
     */
    Script parse(String input);
}
