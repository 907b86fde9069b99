package org.pragmatica.shell.parser;

import org.pragmatica.shell.error.ParseError;
import org.pragmatica.shell.error.ParseException;
import org.pragmatica.shell.lexer.Token;
import org.pragmatica.shell.lexer.TokenKind;
import org.pragmatica.shell.lexer.Tokenizer;
import org.pragmatica.shell.tree.Node.Assignment;
import org.pragmatica.shell.tree.Node.Command;
import org.pragmatica.shell.tree.Node.Conditional;
import org.pragmatica.shell.tree.Node.Loop;
import org.pragmatica.shell.tree.Node.LoopCondition;
import org.pragmatica.shell.tree.Node.Pipeline;
import org.pragmatica.shell.tree.Node.Redirect;
import org.pragmatica.shell.tree.Node.Script;
import org.pragmatica.shell.tree.Node.Statement;
import org.pragmatica.shell.tree.SourceLocation;
import org.pragmatica.shell.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import static org.pragmatica.shell.parser.BlockExtractor.OPENERS;
import static org.pragmatica.shell.parser.BlockExtractor.extractUntil;

/**
 * Recursive-descent parser for shell scripts.
 *
 * <p>Block bodies are delimited with {@link BlockExtractor} and parsed recursively. Malformed
 * input never fails: missing terminators produce partial nodes and every statement consumes
 * at least one token. Only the limits in {@link ParserConfig} raise {@link ParseException}.
 */
public final class ScriptParser implements Parser {
    private static final Logger log = LoggerFactory.getLogger(ScriptParser.class);

    private static final Set<String> STRAY_KEYWORDS = Set.of("fi", "done", "then", "do", "else", "elif");
    private static final Set<String> ARGUMENT_STOPS = Set.of("then", "else", "elif", "fi", "do", "done", "in");

    private static final Set<String> THEN = Set.of("then");
    private static final Set<String> BRANCH_END = Set.of("else", "elif", "fi");
    private static final Set<String> FI = Set.of("fi");
    private static final Set<String> DO = Set.of("do");
    private static final Set<String> DONE = Set.of("done");

    private static final Pattern ASSIGNMENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*=.*", Pattern.DOTALL);

    private final ParserConfig config;

    private ScriptParser(ParserConfig config) {
        this.config = config;
    }

    public static ScriptParser create(ParserConfig config) {
        return new ScriptParser(config);
    }

    @Override
    public List<Token> tokenize(String input) {
        checkInputSize(input);
        return Tokenizer.tokenize(input, config.newlineSeparators());
    }

    @Override
    public Script parse(String input) {
        var tokens = tokenize(input);
        var context = ParsingContext.create(input, config);
        var statements = parseStatements(context, TokenStream.of(tokens), 0);
        return new Script(SourceSpan.of(input, 1, 1), statements);
    }

    private void checkInputSize(String input) {
        if (input.length() > config.maxInputLength()) {
            log.warn("Rejecting input of {} characters, limit is {}", input.length(), config.maxInputLength());
            throw new ParseException(new ParseError.InputTooLarge(SourceLocation.START,
                                                                  input.length(),
                                                                  config.maxInputLength()));
        }
    }

    // === Statements ===

    private List<Statement> parseStatements(ParsingContext context, TokenStream tokens, int depth) {
        var statements = new ArrayList<Statement>();

        while (!tokens.isAtEnd()) {
            var token = tokens.peek();

            if (token.is(TokenKind.SEMICOLON) || isStrayKeyword(token)) {
                tokens.advance();
                continue;
            }

            int before = tokens.position();
            var statement = parseStatement(context, tokens, depth);
            if (tokens.position() == before) {
                log.debug("Skipping unexpected {}", token);
                tokens.advance();
                continue;
            }
            statements.add(statement);
        }

        return statements;
    }

    private Statement parseStatement(ParsingContext context, TokenStream tokens, int depth) {
        var token = tokens.peek();

        if (token.isKeyword("if")) {
            return parseConditional(context, tokens, depth);
        }
        if (token.isKeyword("for")) {
            return parseForLoop(context, tokens, depth);
        }
        if (token.isKeyword("while")) {
            return parseTestLoop(context, tokens, depth, Loop.Kind.WHILE);
        }
        if (token.isKeyword("until")) {
            return parseTestLoop(context, tokens, depth, Loop.Kind.UNTIL);
        }
        if (isAssignment(token)) {
            return parseAssignment(context, tokens);
        }
        return parseCommandOrPipeline(context, tokens);
    }

    private Script parseBody(ParsingContext context, List<Token> tokens, int depth) {
        var statements = parseStatements(context, TokenStream.of(tokens), depth + 1);
        return new Script(context.span(tokens), statements);
    }

    // === Commands ===

    private Statement parseCommandOrPipeline(ParsingContext context, TokenStream tokens) {
        int start = tokens.position();
        var first = parseSimpleCommand(context, tokens);

        if (!tokens.at(TokenKind.PIPE)) {
            return first;
        }

        var commands = new ArrayList<Command>();
        commands.add(first);
        while (tokens.at(TokenKind.PIPE)) {
            tokens.advance();
            commands.add(parseSimpleCommand(context, tokens));
        }
        return new Pipeline(context.span(tokens.since(start)), commands);
    }

    private Command parseSimpleCommand(ParsingContext context, TokenStream tokens) {
        int start = tokens.position();
        var name = "";

        if (atWord(tokens)) {
            name = readWord(tokens).text();
        }

        var args = new ArrayList<String>();
        var redirects = new ArrayList<Redirect>();

        while (!tokens.isAtEnd()) {
            var token = tokens.peek();

            if (token.is(TokenKind.SEMICOLON) || token.is(TokenKind.PIPE) || isArgumentStop(token)) {
                break;
            }
            if (token.kind().isRedirect()) {
                parseRedirect(context, tokens).ifPresent(redirects::add);
            } else if (isBracketOpen(token)) {
                args.add(readBracketExpression(tokens));
            } else {
                args.add(readWord(tokens).text());
            }
        }

        return new Command(context.span(tokens.since(start)), name, args, redirects);
    }

    private Optional<Redirect> parseRedirect(ParsingContext context, TokenStream tokens) {
        var operator = tokens.advance();
        var kind = switch (operator.kind()) {
            case REDIRECT_INPUT -> Redirect.Kind.INPUT;
            case REDIRECT_OUTPUT -> Redirect.Kind.OUTPUT;
            case REDIRECT_APPEND -> Redirect.Kind.APPEND;
            default -> throw new IllegalStateException("Not a redirect operator: " + operator);
        };

        if (!atWord(tokens)) {
            log.debug("Dropping '{}' at {} without a target", operator.text(), operator.span().start());
            return Optional.empty();
        }

        var target = readWord(tokens);
        if (target.text().isEmpty()) {
            log.debug("Dropping '{}' at {} with an empty target", operator.text(), operator.span().start());
            return Optional.empty();
        }
        return Optional.of(new Redirect(context.span(operator, target.last()), kind, target.text()));
    }

    private Assignment parseAssignment(ParsingContext context, TokenStream tokens) {
        var word = readWord(tokens);
        var text = word.text();
        int equals = text.indexOf('=');
        return new Assignment(context.span(word.first(), word.last()),
                              text.substring(0, equals),
                              text.substring(equals + 1));
    }

    // === Conditionals ===

    /**
     * Parses {@code if ... fi}, or the tail of a chain starting at {@code elif}. An {@code elif}
     * becomes a nested conditional wrapped as the else-branch; it consumes the shared {@code fi}.
     * The nested conditional and its wrapper carry no span, so rendering them yields {@code if},
     * while their condition and branches keep theirs.
     */
    private Conditional parseConditional(ParsingContext context, TokenStream tokens, int depth) {
        int start = tokens.position();
        var opener = tokens.advance();
        context.enterBlock(depth, opener);

        var conditionPart = extractUntil(tokens.remaining(), THEN, OPENERS);
        var condition = buildCondition(context, conditionPart.prefix());
        tokens.skip(conditionPart.prefix().size());
        if (!tokens.matchKeyword("then")) {
            log.debug("'{}' at {} has no 'then'", opener.text(), opener.span().start());
        }

        var thenPart = extractUntil(tokens.remaining(), BRANCH_END, OPENERS);
        var thenBranch = parseBody(context, thenPart.prefix(), depth);
        tokens.skip(thenPart.prefix().size());

        Optional<Script> elseBranch = Optional.empty();

        if (tokens.atKeyword("elif")) {
            var nested = parseConditional(context, tokens, depth + 1);
            // the source text starts at 'elif', which does not stand alone as a statement
            var chained = new Conditional(SourceSpan.EMPTY, nested.condition(), nested.thenBranch(), nested.elseBranch());
            elseBranch = Optional.of(new Script(SourceSpan.EMPTY, List.of(chained)));
            return new Conditional(context.span(tokens.since(start)), condition, thenBranch, elseBranch);
        }

        if (tokens.matchKeyword("else")) {
            var elsePart = extractUntil(tokens.remaining(), FI, OPENERS);
            elseBranch = Optional.of(parseBody(context, elsePart.prefix(), depth));
            tokens.skip(elsePart.prefix().size());
        }

        if (!tokens.matchKeyword("fi")) {
            log.debug("'{}' at {} has no closing 'fi'", opener.text(), opener.span().start());
        }
        return new Conditional(context.span(tokens.since(start)), condition, thenBranch, elseBranch);
    }

    /**
     * Flattens condition tokens into a synthetic {@code test} command. Separators are dropped,
     * a leading {@code test} is not repeated, and nothing yields the null command.
     */
    private Command buildCondition(ParsingContext context, List<Token> tokens) {
        var words = new ArrayList<String>();
        var stream = TokenStream.of(tokens);

        while (!stream.isAtEnd()) {
            var token = stream.peek();
            if (token.is(TokenKind.SEMICOLON)) {
                stream.advance();
            } else if (token.kind().isWord()) {
                words.add(readWord(stream).text());
            } else {
                words.add(stream.advance().text());
            }
        }

        if (words.isEmpty()) {
            return Command.empty();
        }
        if (words.get(0).equals("test")) {
            words.remove(0);
        }
        return new Command(context.span(tokens), "test", words, List.of());
    }

    // === Loops ===

    private Loop parseForLoop(ParsingContext context, TokenStream tokens, int depth) {
        int start = tokens.position();
        var opener = tokens.advance();
        context.enterBlock(depth, opener);

        var variable = "";
        if (atWord(tokens)) {
            variable = readWord(tokens).text();
        } else {
            log.debug("'for' at {} has no loop variable", opener.span().start());
        }
        tokens.matchKeyword("in");

        var itemsPart = extractUntil(tokens.remaining(), DO, OPENERS);
        var items = wordsOf(itemsPart.prefix());
        tokens.skip(itemsPart.prefix().size());
        if (!tokens.matchKeyword("do")) {
            log.debug("'for' at {} has no 'do'", opener.span().start());
        }

        var body = parseLoopBody(context, tokens, depth, opener);
        return new Loop(context.span(tokens.since(start)),
                        Loop.Kind.FOR,
                        new LoopCondition.ForEach(variable, items),
                        body);
    }

    /**
     * Parses {@code while}/{@code until} loops. Input redirects right after {@code done}
     * feed the whole loop and are moved onto the test command.
     */
    private Loop parseTestLoop(ParsingContext context, TokenStream tokens, int depth, Loop.Kind kind) {
        int start = tokens.position();
        var opener = tokens.advance();
        context.enterBlock(depth, opener);

        var testPart = extractUntil(tokens.remaining(), DO, OPENERS);
        var test = parseCommandOrPipeline(context, TokenStream.of(testPart.prefix()));
        tokens.skip(testPart.prefix().size());
        if (!tokens.matchKeyword("do")) {
            log.debug("'{}' at {} has no 'do'", opener.text(), opener.span().start());
        }

        var body = parseLoopBody(context, tokens, depth, opener);

        var hoisted = new ArrayList<Redirect>();
        if (tokens.previous().isKeyword("done")) {
            while (tokens.at(TokenKind.REDIRECT_INPUT)) {
                parseRedirect(context, tokens).ifPresent(hoisted::add);
            }
        }
        if (!hoisted.isEmpty()) {
            test = withInputRedirects(test, hoisted);
        }

        return new Loop(context.span(tokens.since(start)), kind, new LoopCondition.Test(test), body);
    }

    private Script parseLoopBody(ParsingContext context, TokenStream tokens, int depth, Token opener) {
        var bodyPart = extractUntil(tokens.remaining(), DONE, OPENERS);
        var body = parseBody(context, bodyPart.prefix(), depth);
        tokens.skip(bodyPart.prefix().size());
        if (!tokens.matchKeyword("done")) {
            log.debug("'{}' at {} has no closing 'done'", opener.text(), opener.span().start());
        }
        return body;
    }

    private static Statement withInputRedirects(Statement test, List<Redirect> redirects) {
        if (test instanceof Pipeline pipeline) {
            var commands = new ArrayList<>(pipeline.commands());
            commands.set(0, commands.get(0).withRedirects(redirects));
            return new Pipeline(pipeline.span(), commands);
        }
        return ((Command) test).withRedirects(redirects);
    }

    // === Words ===

    /**
     * A shell word: one or more word tokens with no whitespace between them.
     */
    private record Word(String text, Token first, Token last) {}

    private static Word readWord(TokenStream tokens) {
        var first = tokens.advance();
        var last = first;
        var text = new StringBuilder(first.text());

        while (tokens.atTouchingWord(last)) {
            last = tokens.advance();
            text.append(last.text());
        }
        return new Word(text.toString(), first, last);
    }

    private static List<String> wordsOf(List<Token> tokens) {
        var words = new ArrayList<String>();
        var stream = TokenStream.of(tokens);

        while (!stream.isAtEnd()) {
            if (stream.peek().kind().isWord()) {
                words.add(readWord(stream).text());
            } else {
                stream.advance();
            }
        }
        return words;
    }

    /**
     * {@code [ ... ]} and {@code [[ ... ]]} collapse into one argument: the raw token texts,
     * quotes included, joined by single spaces.
     */
    private static String readBracketExpression(TokenStream tokens) {
        var open = tokens.advance();
        var close = open.text().equals("[[") ? "]]" : "]";
        var parts = new ArrayList<String>();
        parts.add(open.text());

        while (!tokens.isAtEnd() && !tokens.at(TokenKind.SEMICOLON) && !tokens.at(TokenKind.PIPE)) {
            var token = tokens.advance();
            parts.add(token.span().text());
            if (token.kind().isWord() && token.text().equals(close)) {
                break;
            }
        }
        return String.join(" ", parts);
    }

    private static boolean atWord(TokenStream tokens) {
        return !tokens.isAtEnd() && tokens.peek().kind().isWord() && !isArgumentStop(tokens.peek());
    }

    private static boolean isArgumentStop(Token token) {
        return token.is(TokenKind.COMMAND) && ARGUMENT_STOPS.contains(token.text());
    }

    private static boolean isStrayKeyword(Token token) {
        return token.is(TokenKind.COMMAND) && STRAY_KEYWORDS.contains(token.text());
    }

    private static boolean isBracketOpen(Token token) {
        return isUnquoted(token) && (token.text().equals("[") || token.text().equals("[["));
    }

    private static boolean isAssignment(Token token) {
        return token.kind().isWord() && isUnquoted(token) && ASSIGNMENT.matcher(token.text()).matches();
    }

    private static boolean isUnquoted(Token token) {
        return token.span().text().equals(token.text());
    }
}
