package org.pragmatica.shell.writer;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import org.pragmatica.shell.tree.Node;
import org.pragmatica.shell.tree.Node.Assignment;
import org.pragmatica.shell.tree.Node.Command;
import org.pragmatica.shell.tree.Node.Conditional;
import org.pragmatica.shell.tree.Node.Loop;
import org.pragmatica.shell.tree.Node.LoopCondition;
import org.pragmatica.shell.tree.Node.Pipeline;
import org.pragmatica.shell.tree.Node.Redirect;
import org.pragmatica.shell.tree.Node.Script;
import org.pragmatica.shell.tree.Node.Statement;
import org.pragmatica.shell.tree.Node.Subshell;
import org.pragmatica.shell.tree.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a syntax tree back to shell text.
 *
 * <p>Two policies share one visitor:
 * <ul>
 *   <li>{@link #synthesize(Node)} rebuilds text from structure only, ignoring spans.</li>
 *   <li>{@link #roundTrip(Node)} emits a node's captured span text when it has one and
 *       synthesizes it otherwise, recursing with the same policy.</li>
 * </ul>
 * Synthesized text always parses back to a tree with the same statement shape.
 */
public final class ScriptWriter implements NodeVisitor<String> {
    private static final ScriptWriter SYNTHESIS = new ScriptWriter(false);
    private static final ScriptWriter ROUND_TRIP = new ScriptWriter(true);

    private static final String INDENT = "  ";
    private static final String TOP_LEVEL_SEPARATOR = "; ";
    private static final String BODY_SEPARATOR = "\n";

    private static final CharMatcher NEEDS_QUOTING = CharMatcher.whitespace()
                                                                .or(CharMatcher.anyOf(";|<>&'\"\\"));
    private static final Splitter LINES = Splitter.on('\n');
    private static final Joiner LINE_JOINER = Joiner.on('\n');

    private final boolean preferSpans;

    private ScriptWriter(boolean preferSpans) {
        this.preferSpans = preferSpans;
    }

    public static String synthesize(Node node) {
        return node.accept(SYNTHESIS);
    }

    public static String roundTrip(Node node) {
        return node.accept(ROUND_TRIP);
    }

    private boolean useSpan(Node node) {
        return preferSpans && !node.span().isEmpty();
    }

    // === Visitor ===

    @Override
    public String visitScript(Script script) {
        if (useSpan(script)) {
            return script.span().text();
        }
        return joinStatements(script.statements(), TOP_LEVEL_SEPARATOR);
    }

    @Override
    public String visitCommand(Command command) {
        if (useSpan(command)) {
            return command.span().text();
        }
        return renderCommand(command, command.redirects());
    }

    @Override
    public String visitPipeline(Pipeline pipeline) {
        if (useSpan(pipeline)) {
            return pipeline.span().text();
        }
        return pipeline.commands()
                       .stream()
                       .map(command -> command.accept(this))
                       .collect(Collectors.joining(" | "));
    }

    @Override
    public String visitRedirect(Redirect redirect) {
        if (useSpan(redirect)) {
            return redirect.span().text();
        }
        return redirect.kind().operator() + " " + quote(redirect.target());
    }

    @Override
    public String visitConditional(Conditional conditional) {
        if (useSpan(conditional)) {
            return conditional.span().text();
        }
        var header = "if " + renderCondition(conditional.condition());
        var thenText = body(conditional.thenBranch());
        var elseText = conditional.elseBranch()
                                  .map(this::body);

        if (isMultiLine(thenText) || elseText.map(ScriptWriter::isMultiLine).orElse(false)) {
            return header + "; then\n" + indent(thenText)
                   + elseText.map(text -> "\nelse\n" + indent(text)).orElse("")
                   + "\nfi";
        }
        return header + "; then " + thenText
               + elseText.map(text -> "; else " + text).orElse("")
               + "; fi";
    }

    @Override
    public String visitLoop(Loop loop) {
        if (useSpan(loop)) {
            return loop.span().text();
        }
        String header;
        var trailer = "";

        if (loop.condition() instanceof LoopCondition.ForEach forEach) {
            header = renderForHeader(forEach);
        } else {
            var test = ((LoopCondition.Test) loop.condition()).test();
            var trailing = trailingRedirects(test);
            header = loop.kind().keyword() + " " + renderTest(test, trailing);
            trailer = trailing.stream()
                              .map(redirect -> " " + redirect.accept(this))
                              .collect(Collectors.joining());
        }

        var bodyText = body(loop.body());
        if (isMultiLine(bodyText)) {
            return header + "; do\n" + indent(bodyText) + "\ndone" + trailer;
        }
        return header + "; do " + bodyText + "; done" + trailer;
    }

    @Override
    public String visitAssignment(Assignment assignment) {
        if (useSpan(assignment)) {
            return assignment.span().text();
        }
        var value = assignment.value().isEmpty()
                    ? ""
                    : quote(assignment.value());
        return assignment.name() + "=" + value;
    }

    @Override
    public String visitSubshell(Subshell subshell) {
        if (useSpan(subshell)) {
            return subshell.span().text();
        }
        return "(" + subshell.script().accept(this) + ")";
    }

    // === Blocks ===

    private String body(Script script) {
        if (useSpan(script)) {
            return script.span().text();
        }
        return joinStatements(script.statements(), BODY_SEPARATOR);
    }

    private String joinStatements(List<Statement> statements, String separator) {
        return statements.stream()
                         .map(statement -> statement.accept(this))
                         .collect(Collectors.joining(separator));
    }

    private static boolean isMultiLine(String text) {
        return text.indexOf('\n') >= 0;
    }

    private static String indent(String text) {
        var lines = new ArrayList<String>();
        for (var line : LINES.split(text)) {
            lines.add(line.isBlank() ? line : INDENT + line);
        }
        return LINE_JOINER.join(lines);
    }

    /**
     * {@code test a b}, the bare words of a bracket expression, or nothing for the null command.
     * A condition that is not a {@code test} command renders as that command.
     */
    private String renderCondition(Command condition) {
        if (useSpan(condition)) {
            return condition.span().text();
        }
        if (condition.isNull()) {
            return "";
        }
        var args = condition.args();
        if (condition.name().equals("test") && !args.isEmpty() && isBracketOpen(args.get(0))) {
            return args.stream()
                       .map(ScriptWriter::quote)
                       .collect(Collectors.joining(" "));
        }
        return renderCommand(condition, condition.redirects());
    }

    private String renderForHeader(LoopCondition.ForEach forEach) {
        var header = new StringBuilder("for ").append(forEach.variable());
        if (!forEach.items().isEmpty()) {
            header.append(" in");
            forEach.items()
                   .forEach(item -> header.append(' ').append(quote(item)));
        }
        return header.toString();
    }

    /**
     * Input redirects of the loop test that belong after {@code done}: those outside the
     * test's own source text, or all of them when the test has no span.
     */
    private static List<Redirect> trailingRedirects(Statement test) {
        var head = headCommand(test);
        return head.redirects()
                   .stream()
                   .filter(redirect -> redirect.kind() == Redirect.Kind.INPUT)
                   .filter(redirect -> test.span().isEmpty()
                                       || redirect.span().isEmpty()
                                       || redirect.span().start().offset() >= test.span().start().offset() + test.span().length())
                   .collect(Collectors.toList());
    }

    private String renderTest(Statement test, List<Redirect> trailing) {
        if (useSpan(test)) {
            return test.span().text();
        }
        var head = headCommand(test);
        var headText = useSpan(head)
                       ? head.span().text()
                       : renderCommand(head, withoutAll(head.redirects(), trailing));
        if (test instanceof Pipeline pipeline) {
            var parts = new ArrayList<String>();
            parts.add(headText);
            pipeline.commands()
                    .stream()
                    .skip(1)
                    .forEach(command -> parts.add(command.accept(this)));
            return String.join(" | ", parts);
        }
        return headText;
    }

    private static Command headCommand(Statement test) {
        return test instanceof Pipeline pipeline
               ? pipeline.commands().get(0)
               : (Command) test;
    }

    private static List<Redirect> withoutAll(List<Redirect> redirects, List<Redirect> excluded) {
        var kept = new ArrayList<Redirect>();
        for (var redirect : redirects) {
            if (excluded.stream().noneMatch(other -> other == redirect)) {
                kept.add(redirect);
            }
        }
        return kept;
    }

    private String renderCommand(Command command, List<Redirect> redirects) {
        var parts = new ArrayList<String>();
        if (!command.isNull()) {
            parts.add(quote(command.name()));
        }
        command.args()
               .forEach(arg -> parts.add(quote(arg)));
        redirects.forEach(redirect -> parts.add(redirect.accept(this)));
        return String.join(" ", parts);
    }

    // === Quoting ===

    /**
     * Quotes a word holding whitespace, {@code ; | < > &}, a quote character or a backslash.
     * Words without {@code '} or {@code $} go in single quotes, which the tokenizer reads back
     * literally; the rest go in double quotes with bare {@code "} and a trailing backslash escaped.
     * Well-formed double-quoted words, bracket expressions, command substitutions and the empty
     * word are handled apart.
     */
    static String quote(String word) {
        if (word.isEmpty()) {
            return "\"\"";
        }
        if (isDoubleQuoted(word) || isBracketExpression(word) || isCommandSubstitution(word)) {
            return word;
        }
        if (!NEEDS_QUOTING.matchesAnyOf(word)) {
            return word;
        }
        if (word.indexOf('\'') < 0 && word.indexOf('$') < 0) {
            return '\'' + word + '\'';
        }
        return '"' + escapeQuotes(word) + '"';
    }

    /**
     * Whether the word is one double-quoted string whose inner quotes are all escaped.
     */
    private static boolean isDoubleQuoted(String word) {
        if (word.length() < 2 || !word.startsWith("\"") || !word.endsWith("\"")) {
            return false;
        }
        for (int i = 1; i < word.length() - 1; i++) {
            char c = word.charAt(i);
            if (c == '\\') {
                // a backslash right before the closing quote escapes it
                if (i + 1 == word.length() - 1) {
                    return false;
                }
                i++;
            } else if (c == '"') {
                return false;
            }
        }
        return true;
    }

    private static boolean isBracketOpen(String word) {
        return word.equals("[") || word.equals("[[");
    }

    private static boolean isBracketExpression(String word) {
        return (word.startsWith("[ ") && word.endsWith(" ]")) || (word.startsWith("[[ ") && word.endsWith(" ]]"));
    }

    private static boolean isCommandSubstitution(String word) {
        return word.startsWith("$(") && word.endsWith(")");
    }

    private static String escapeQuotes(String word) {
        var sb = new StringBuilder(word.length() + 8);
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c == '\\' && i + 1 < word.length()) {
                sb.append(c).append(word.charAt(++i));
            } else if (c == '\\') {
                sb.append("\\\\");
            } else if (c == '"') {
                sb.append("\\\"");
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
