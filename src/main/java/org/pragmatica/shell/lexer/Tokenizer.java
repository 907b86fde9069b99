package org.pragmatica.shell.lexer;

import org.pragmatica.shell.tree.SourceLocation;
import org.pragmatica.shell.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lexer for shell script text. Single left-to-right pass; whitespace carries no token.
 *
 * <p>Whether a bare word is a {@link TokenKind#COMMAND} or a {@link TokenKind#STRING_LITERAL}
 * depends only on the token emitted before it, see {@link #classify(String, Optional)}.
 */
public final class Tokenizer {
    private static final Logger log = LoggerFactory.getLogger(Tokenizer.class);

    public static final Set<String> KEYWORDS = Set.of("if",
                                                      "then",
                                                      "else",
                                                      "elif",
                                                      "fi",
                                                      "for",
                                                      "in",
                                                      "do",
                                                      "done",
                                                      "while",
                                                      "until");

    // Keywords after which the next word starts a command
    private static final Set<String> COMMAND_POSITION_KEYWORDS = Set.of("then", "else", "do", "if", "elif", "while", "until");

    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private final boolean newlineSeparators;
    private final List<Token> tokens;
    private int pos;
    private int line;
    private int column;

    private Tokenizer(String input, boolean newlineSeparators) {
        this.input = input;
        this.newlineSeparators = newlineSeparators;
        this.tokens = new ArrayList<>();
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<Token> tokenize(String input) {
        return tokenize(input, false);
    }

    /**
     * @param newlineSeparators when set, an unquoted newline ends a statement like {@code ;} does
     */
    public static List<Token> tokenize(String input, boolean newlineSeparators) {
        return new Tokenizer(input, newlineSeparators).tokenizeAll();
    }

    /**
     * Contextual word classification. Keywords are always commands; any other word is a command
     * at the start of input, after {@code |} or {@code ;}, or after a keyword that opens a command
     * position ({@code then}, {@code else}, {@code do}, {@code if}, {@code elif}, {@code while},
     * {@code until}). Everything else is a string.
     */
    static TokenKind classify(String word, Optional<Token> previous) {
        if (KEYWORDS.contains(word) || previous.isEmpty()) {
            return TokenKind.COMMAND;
        }
        var prev = previous.get();
        if (prev.is(TokenKind.PIPE) || prev.is(TokenKind.SEMICOLON)) {
            return TokenKind.COMMAND;
        }
        if (prev.is(TokenKind.COMMAND) && COMMAND_POSITION_KEYWORDS.contains(prev.text())) {
            return TokenKind.COMMAND;
        }
        return TokenKind.STRING_LITERAL;
    }

    private List<Token> tokenizeAll() {
        while (!isAtEnd()) {
            scanToken();
        }
        return List.copyOf(tokens);
    }

    private void scanToken() {
        var start = currentLocation();
        char c = peek();
        switch (c) {
            case '\n' -> {
                advance();
                if (newlineSeparators && separatorAllowed()) {
                    emit(TokenKind.SEMICOLON, "\n", start);
                }
            }
            case ' ', '\t', '\r' -> advance();
            case '|' -> {
                advance();
                emit(TokenKind.PIPE, "|", start);
            }
            case ';' -> {
                advance();
                emit(TokenKind.SEMICOLON, ";", start);
            }
            case '>' -> {
                advance();
                // >> must win over >
                if (!isAtEnd() && peek() == '>') {
                    advance();
                    emit(TokenKind.REDIRECT_APPEND, ">>", start);
                } else {
                    emit(TokenKind.REDIRECT_OUTPUT, ">", start);
                }
            }
            case '<' -> {
                advance();
                emit(TokenKind.REDIRECT_INPUT, "<", start);
            }
            case '"' -> scanDoubleQuoted(start);
            case '\'' -> scanSingleQuoted(start);
            default -> scanWordToken(start);
        }
    }

    private void scanWordToken(SourceLocation start) {
        char c = peek();
        if (c == '$' && peekNext() == '(') {
            var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
            scanCommandSubstitution(sb);
            emit(TokenKind.COMMAND_SUBSTITUTION, sb.toString(), start);
            return;
        }
        if (c == '$' && nextIsWordChar()) {
            emit(TokenKind.VARIABLE, scanWord(), start);
            return;
        }
        if (c == '-' && nextIsWordChar()) {
            emit(TokenKind.OPTION, scanWord(), start);
            return;
        }
        var word = scanWord();
        emit(classify(word, lastToken()), word, start);
    }

    private String scanWord() {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isWordChar(peek())) {
            if (peek() == '$' && peekNext() == '(') {
                scanCommandSubstitution(sb);
            } else {
                sb.append(advance());
            }
        }
        return sb.toString();
    }

    /**
     * Scan {@code $( ... )} into {@code sb}, tracking parenthesis depth. Quoted text inside the
     * substitution is copied as a unit so its parentheses and quote characters do not count.
     */
    private void scanCommandSubstitution(StringBuilder sb) {
        var start = currentLocation();
        sb.append(advance())
          .append(advance());
        int depth = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    sb.append(advance());
                    return;
                }
                depth--;
            } else if (c == '"' || c == '\'') {
                scanQuotedRaw(sb);
                continue;
            }
            sb.append(advance());
        }
        log.debug("Unterminated command substitution starting at {}", start);
    }

    private void scanQuotedRaw(StringBuilder sb) {
        char quote = advance();
        sb.append(quote);
        while (!isAtEnd() && peek() != quote) {
            if (quote == '"' && peek() == '\\' && pos + 1 < input.length()) {
                sb.append(advance());
            }
            sb.append(advance());
        }
        if (!isAtEnd()) {
            sb.append(advance());
        }
    }

    private void scanDoubleQuoted(SourceLocation start) {
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd()) {
            char c = peek();
            if (c == '"') {
                advance();
                emit(TokenKind.STRING_LITERAL, sb.toString(), start);
                return;
            }
            if (c == '\\' && pos + 1 < input.length()) {
                // escapes are recognised, not interpreted
                sb.append(advance());
                sb.append(advance());
            } else if (c == '$' && peekNext() == '(') {
                scanCommandSubstitution(sb);
            } else {
                sb.append(advance());
            }
        }
        log.debug("Unterminated double quote starting at {}", start);
        emit(TokenKind.STRING_LITERAL, sb.toString(), start);
    }

    private void scanSingleQuoted(SourceLocation start) {
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd()) {
            if (peek() == '\'') {
                advance();
                emit(TokenKind.STRING_LITERAL, sb.toString(), start);
                return;
            }
            sb.append(advance());
        }
        log.debug("Unterminated single quote starting at {}", start);
        emit(TokenKind.STRING_LITERAL, sb.toString(), start);
    }

    private void emit(TokenKind kind, String text, SourceLocation start) {
        tokens.add(new Token(kind, text, span(start)));
    }

    private Optional<Token> lastToken() {
        return tokens.isEmpty()
               ? Optional.empty()
               : Optional.of(tokens.get(tokens.size() - 1));
    }

    private boolean separatorAllowed() {
        return lastToken().map(token -> !token.is(TokenKind.PIPE) && !token.is(TokenKind.SEMICOLON))
                          .orElse(false);
    }

    private static boolean isWordChar(char c) {
        return switch (c) {
            case ' ', '\t', '\n', '\r', '|', ';', '<', '>', '"', '\'' -> false;
            default -> true;
        };
    }

    private boolean nextIsWordChar() {
        return pos + 1 < input.length() && isWordChar(input.charAt(pos + 1));
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < input.length()
               ? input.charAt(pos + 1)
               : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return new SourceSpan(input.substring(start.offset(), pos), start, currentLocation());
    }
}
