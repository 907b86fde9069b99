package org.pragmatica.shell.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Syntax tree node for a parsed shell script. The family is closed: a script, a redirect,
 * or one of the statement kinds. Nodes are immutable and never shared between parses.
 */
public sealed interface Node {
    /**
     * The source span this node was parsed from, or {@link SourceSpan#EMPTY} for synthesized nodes.
     */
    SourceSpan span();

    <R> R accept(NodeVisitor<R> visitor);

    /**
     * A node that can appear in a script's statement list.
     */
    sealed interface Statement extends Node {}

    /**
     * Ordered list of statements. May be empty.
     */
    record Script(SourceSpan span, List<Statement> statements) implements Node {
        public Script {
            checkNotNull(span, "span");
            statements = ImmutableList.copyOf(statements);
        }

        public static Script of(List<? extends Statement> statements) {
            return new Script(SourceSpan.EMPTY, ImmutableList.copyOf(statements));
        }

        public static Script empty() {
            return new Script(SourceSpan.EMPTY, List.of());
        }

        public boolean isEmpty() {
            return statements.isEmpty();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitScript(this);
        }
    }

    /**
     * Simple command. An empty name is the null-command sentinel produced for degraded input.
     */
    record Command(SourceSpan span, String name, List<String> args, List<Redirect> redirects) implements Statement {
        public Command {
            checkNotNull(span, "span");
            checkNotNull(name, "name");
            args = ImmutableList.copyOf(args);
            redirects = ImmutableList.copyOf(redirects);
        }

        public static Command of(String name, String... args) {
            return new Command(SourceSpan.EMPTY, name, List.of(args), List.of());
        }

        public static Command empty() {
            return new Command(SourceSpan.EMPTY, "", List.of(), List.of());
        }

        public boolean isNull() {
            return name.isEmpty();
        }

        public Command withRedirects(List<Redirect> extra) {
            return new Command(span,
                               name,
                               args,
                               ImmutableList.<Redirect>builder()
                                            .addAll(redirects)
                                            .addAll(extra)
                                            .build());
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitCommand(this);
        }
    }

    /**
     * Commands chained with {@code |}. A lone command is never wrapped in a pipeline.
     */
    record Pipeline(SourceSpan span, List<Command> commands) implements Statement {
        public Pipeline {
            checkNotNull(span, "span");
            checkArgument(commands.size() >= 2, "pipeline needs at least two commands, got %s", commands.size());
            commands = ImmutableList.copyOf(commands);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPipeline(this);
        }
    }

    /**
     * Input, output or append redirection.
     */
    record Redirect(SourceSpan span, Kind kind, String target) implements Node {
        public enum Kind {
            INPUT("<"),
            OUTPUT(">"),
            APPEND(">>");

            private final String operator;

            Kind(String operator) {
                this.operator = operator;
            }

            public String operator() {
                return operator;
            }
        }

        public Redirect {
            checkNotNull(span, "span");
            checkNotNull(kind, "kind");
            checkArgument(target != null && !target.isEmpty(), "redirect target must not be empty");
        }

        public static Redirect of(Kind kind, String target) {
            return new Redirect(SourceSpan.EMPTY, kind, target);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitRedirect(this);
        }
    }

    /**
     * {@code if} block. The condition is always a single synthetic {@code test} command holding the
     * flattened condition words; {@code &&}, {@code ||} and brackets are not modelled as nodes.
     */
    record Conditional(SourceSpan span,
                       Command condition,
                       Script thenBranch,
                       Optional<Script> elseBranch) implements Statement {
        public Conditional {
            checkNotNull(span, "span");
            checkNotNull(condition, "condition");
            checkNotNull(thenBranch, "thenBranch");
            checkNotNull(elseBranch, "elseBranch");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitConditional(this);
        }
    }

    /**
     * {@code for}, {@code while} or {@code until} loop.
     */
    record Loop(SourceSpan span, Kind kind, LoopCondition condition, Script body) implements Statement {
        public enum Kind {
            FOR("for"),
            WHILE("while"),
            UNTIL("until");

            private final String keyword;

            Kind(String keyword) {
                this.keyword = keyword;
            }

            public String keyword() {
                return keyword;
            }
        }

        public Loop {
            checkNotNull(span, "span");
            checkNotNull(body, "body");
            checkArgument((kind == Kind.FOR) == (condition instanceof LoopCondition.ForEach),
                          "%s loop cannot have condition %s", kind, condition);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitLoop(this);
        }
    }

    /**
     * Loop header: the iteration list of a {@code for} loop or the test of a {@code while}/{@code until} loop.
     */
    sealed interface LoopCondition {
        /**
         * Items keep their literal text, including unexpanded {@code $(...)}.
         */
        record ForEach(String variable, List<String> items) implements LoopCondition {
            public ForEach {
                checkNotNull(variable, "variable");
                items = ImmutableList.copyOf(items);
            }
        }

        /**
         * The test is a {@link Command} or, for piped tests, a {@link Pipeline}.
         */
        record Test(Statement test) implements LoopCondition {
            public Test {
                checkArgument(test instanceof Command || test instanceof Pipeline,
                              "loop test must be a command or pipeline, got %s", test);
            }
        }
    }

    /**
     * {@code NAME=value}.
     */
    record Assignment(SourceSpan span, String name, String value) implements Statement {
        public Assignment {
            checkNotNull(span, "span");
            checkArgument(name != null && !name.isEmpty(), "assignment needs a name");
            checkNotNull(value, "value");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAssignment(this);
        }
    }

    /**
     * {@code ( script )}.
     */
    record Subshell(SourceSpan span, Script script) implements Statement {
        public Subshell {
            checkNotNull(span, "span");
            checkNotNull(script, "script");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSubshell(this);
        }
    }
}
