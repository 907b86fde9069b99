package org.pragmatica.shell.tree;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.pragmatica.shell.tree.Node.Assignment;
import org.pragmatica.shell.tree.Node.Command;
import org.pragmatica.shell.tree.Node.Loop;
import org.pragmatica.shell.tree.Node.LoopCondition;
import org.pragmatica.shell.tree.Node.Pipeline;
import org.pragmatica.shell.tree.Node.Redirect;
import org.pragmatica.shell.tree.Node.Script;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeTest {

    @Test
    void pipeline_withSingleCommand_isRejected() {
        assertThatThrownBy(() -> new Pipeline(SourceSpan.EMPTY, List.of(Command.of("ls"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at least two");
    }

    @Test
    void redirect_withEmptyTarget_isRejected() {
        assertThatThrownBy(() -> Redirect.of(Redirect.Kind.OUTPUT, ""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loop_kindMustMatchCondition() {
        var body = Script.empty();

        assertThatThrownBy(() -> new Loop(SourceSpan.EMPTY,
                                          Loop.Kind.FOR,
                                          new LoopCondition.Test(Command.of("true")),
                                          body))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Loop(SourceSpan.EMPTY,
                                          Loop.Kind.WHILE,
                                          new LoopCondition.ForEach("f", List.of("a")),
                                          body))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loopTest_mustBeCommandOrPipeline() {
        assertThatThrownBy(() -> new LoopCondition.Test(new Assignment(SourceSpan.EMPTY, "x", "1")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void command_copiesArguments() {
        var args = new ArrayList<>(List.of("a"));
        var command = new Command(SourceSpan.EMPTY, "echo", args, List.of());

        args.add("b");

        assertThat(command.args()).containsExactly("a");
    }

    @Test
    void command_withRedirects_appendsAfterExisting() {
        var command = new Command(SourceSpan.EMPTY, "sort", List.of(), List.of(Redirect.of(Redirect.Kind.OUTPUT, "out")))
            .withRedirects(List.of(Redirect.of(Redirect.Kind.INPUT, "in")));

        assertThat(command.redirects()).extracting(Redirect::target)
                                       .containsExactly("out", "in");
    }

    @Test
    void script_of_keepsImmutableListAsIs() {
        var statements = ImmutableList.<Node.Statement>of(Command.of("ls"));

        assertThat(Script.of(statements).statements()).isSameAs(statements);
    }

    @Test
    void command_empty_isNullCommand() {
        assertThat(Command.empty().isNull()).isTrue();
        assertThat(Command.of("ls").isNull()).isFalse();
    }

    @Test
    void visitor_dispatchesOnNodeKind() {
        NodeVisitor<String> names = new NodeVisitor<>() {
            @Override
            public String visitScript(Script script) {
                return "script";
            }

            @Override
            public String visitCommand(Command command) {
                return "command " + command.name();
            }

            @Override
            public String visitPipeline(Pipeline pipeline) {
                return "pipeline";
            }

            @Override
            public String visitRedirect(Redirect redirect) {
                return "redirect";
            }

            @Override
            public String visitConditional(Node.Conditional conditional) {
                return "conditional";
            }

            @Override
            public String visitLoop(Loop loop) {
                return "loop " + loop.kind().keyword();
            }

            @Override
            public String visitAssignment(Assignment assignment) {
                return "assignment";
            }

            @Override
            public String visitSubshell(Node.Subshell subshell) {
                return "subshell";
            }
        };

        assertThat(Command.of("ls").accept(names)).isEqualTo("command ls");
        assertThat(new Loop(SourceSpan.EMPTY, Loop.Kind.UNTIL, new LoopCondition.Test(Command.of("false")), Script.empty())
                       .accept(names)).isEqualTo("loop until");
        assertThat(Script.empty().accept(names)).isEqualTo("script");
    }
}
