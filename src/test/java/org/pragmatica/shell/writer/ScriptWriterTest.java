package org.pragmatica.shell.writer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.shell.parser.Parser;
import org.pragmatica.shell.parser.ParserConfig;
import org.pragmatica.shell.parser.ScriptParser;
import org.pragmatica.shell.tree.Node.Assignment;
import org.pragmatica.shell.tree.Node.Command;
import org.pragmatica.shell.tree.Node.Conditional;
import org.pragmatica.shell.tree.Node.Loop;
import org.pragmatica.shell.tree.Node.LoopCondition;
import org.pragmatica.shell.tree.Node.Redirect;
import org.pragmatica.shell.tree.Node.Script;
import org.pragmatica.shell.tree.Node.Statement;
import org.pragmatica.shell.tree.Node.Subshell;
import org.pragmatica.shell.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ScriptWriterTest {

    private final Parser parser = ScriptParser.create(ParserConfig.DEFAULT);

    private final Parser lineParser = ScriptParser.create(new ParserConfig(128, 1_000_000, true));

    // === Round trip ===

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "ls -la | grep .ex",
        "  cat <in.txt   >out.txt ;",
        "for f in a.txt b.txt; do echo $f; done",
        "if [ -f x ]; then\n  echo 'a|b'\nelse echo \"q\\\"q\"\nfi\n",
        "while read line; do echo $line; done < input.txt",
        "echo \"unterminated"
    })
    void roundTrip_parsedScript_reproducesInput(String input) {
        assertEquals(input, ScriptWriter.roundTrip(parser.parse(input)));
    }

    @Test
    void roundTrip_parsedStatement_usesItsOwnSpan() {
        var script = lineParser.parse("echo   a\nif x;  then\n  y\nfi");

        assertEquals("echo   a", ScriptWriter.roundTrip(script.statements().get(0)));
        assertEquals("if x;  then\n  y\nfi", ScriptWriter.roundTrip(script.statements().get(1)));
    }

    @Test
    void roundTrip_rebuiltElifChain_rendersParseableIf() {
        var parsed = (Conditional) parser.parse("if a; then b; elif c; then d; fi").statements().get(0);
        var rebuilt = new Conditional(SourceSpan.EMPTY, parsed.condition(), parsed.thenBranch(), parsed.elseBranch());

        var text = ScriptWriter.roundTrip(rebuilt);

        assertEquals("if a; then b; else if c; then d; fi; fi", text);
        assertThat(parser.parse(text).statements()).hasSize(1)
                                                   .first()
                                                   .isInstanceOf(Conditional.class);
    }

    @Test
    void roundTrip_mixedTree_synthesizesOnlyMissingSpans() {
        var parsed = parser.parse("echo   hi").statements().get(0);
        var script = Script.of(List.of(parsed, Command.of("ls", "-l")));

        assertEquals("echo   hi; ls -l", ScriptWriter.roundTrip(script));
    }

    // === Synthesis ===

    @Test
    void synthesize_pipeline_joinsWithBars() {
        assertEquals("ls -la | grep .ex", ScriptWriter.synthesize(parser.parse("ls   -la|grep .ex")));
    }

    @Test
    void synthesize_topLevel_joinsWithSemicolons() {
        assertEquals("echo a; echo b", ScriptWriter.synthesize(lineParser.parse("echo a\n\necho b\n")));
    }

    @Test
    void synthesize_redirects_followArguments() {
        var script = parser.parse("sort  <in.txt -r >>out.txt");

        assertEquals("sort -r < in.txt >> out.txt", ScriptWriter.synthesize(script));
    }

    @Test
    void synthesize_singleStatementBodies_stayOnOneLine() {
        var script = parser.parse("if [ -f x ]; then echo y; else echo z; fi; for f in a b; do cat $f; done");

        assertEquals("if [ -f x ]; then echo y; else echo z; fi; for f in a b; do cat $f; done",
                     ScriptWriter.synthesize(script));
    }

    @Test
    void synthesize_multiStatementBody_indentsLines() {
        var conditional = new Conditional(SourceSpan.EMPTY,
                                          Command.of("test", "-n", "$x"),
                                          Script.of(List.of(Command.of("echo", "a"), Command.of("echo", "b"))),
                                          Optional.of(Script.of(List.of(Command.of("echo", "c")))));

        assertEquals("if test -n $x; then\n  echo a\n  echo b\nelse\n  echo c\nfi",
                     ScriptWriter.synthesize(conditional));
    }

    @Test
    void synthesize_nestedBlocks_indentEachLevel() {
        var inner = new Loop(SourceSpan.EMPTY,
                             Loop.Kind.FOR,
                             new LoopCondition.ForEach("f", List.of("a", "b")),
                             Script.of(List.of(Command.of("echo", "$f"), Command.of("wc", "-l", "$f"))));
        var outer = new Loop(SourceSpan.EMPTY,
                             Loop.Kind.UNTIL,
                             new LoopCondition.Test(Command.of("false")),
                             Script.of(List.of(inner)));

        assertEquals("until false; do\n  for f in a b; do\n    echo $f\n    wc -l $f\n  done\ndone",
                     ScriptWriter.synthesize(outer));
    }

    @Test
    void synthesize_whileTest_putsInputRedirectAfterDone() {
        var script = parser.parse("while read line; do echo $line; done < input.txt");

        assertEquals("while read line; do echo $line; done < input.txt", ScriptWriter.synthesize(script));
    }

    @Test
    void synthesize_whileTestOwnRedirect_staysInTest() {
        var script = parser.parse("while read x < fifo; do echo $x; done");

        assertEquals("while read x < fifo; do echo $x; done", ScriptWriter.synthesize(script));
    }

    @Test
    void synthesize_builtWhileLoop_hoistsInputRedirect() {
        var test = Command.of("read", "line")
                          .withRedirects(List.of(Redirect.of(Redirect.Kind.INPUT, "data file")));
        var loop = new Loop(SourceSpan.EMPTY,
                            Loop.Kind.WHILE,
                            new LoopCondition.Test(test),
                            Script.of(List.of(Command.of("echo", "$line"))));

        assertEquals("while read line; do echo $line; done < \"data file\"", ScriptWriter.synthesize(loop));
    }

    @Test
    void synthesize_forWithoutItems_omitsIn() {
        var loop = new Loop(SourceSpan.EMPTY,
                            Loop.Kind.FOR,
                            new LoopCondition.ForEach("arg", List.of()),
                            Script.of(List.of(Command.of("echo", "$arg"))));

        assertEquals("for arg; do echo $arg; done", ScriptWriter.synthesize(loop));
    }

    @Test
    void synthesize_emptyCondition_rendersNothing() {
        var conditional = new Conditional(SourceSpan.EMPTY, Command.empty(), Script.of(List.of(Command.of("b"))), Optional.empty());

        assertEquals("if ; then b; fi", ScriptWriter.synthesize(conditional));
    }

    @Test
    void synthesize_assignmentAndSubshell() {
        assertEquals("x=\"a b\"", ScriptWriter.synthesize(new Assignment(SourceSpan.EMPTY, "x", "a b")));
        assertEquals("x=", ScriptWriter.synthesize(new Assignment(SourceSpan.EMPTY, "x", "")));
        assertEquals("(cd /tmp; ls)",
                     ScriptWriter.synthesize(new Subshell(SourceSpan.EMPTY,
                                                          Script.of(List.of(Command.of("cd", "/tmp"), Command.of("ls"))))));
    }

    @Test
    void synthesize_emptyScript_isEmpty() {
        assertEquals("", ScriptWriter.synthesize(Script.empty()));
        assertEquals("", ScriptWriter.roundTrip(Script.empty()));
    }

    // === Quoting ===

    @Test
    void synthesize_arguments_areQuotedWhenNeeded() {
        var command = Command.of("echo", "hello world", "a;b", "x&y", "$x", "$(date +%s)", "plain", "say \"hi\"", "");

        assertEquals("echo \"hello world\" \"a;b\" \"x&y\" $x $(date +%s) plain 'say \"hi\"' \"\"",
                     ScriptWriter.synthesize(command));
    }

    @Test
    void quote_alreadyQuotedOrBracket_isUnchanged() {
        assertEquals("\"a b\"", ScriptWriter.quote("\"a b\""));
        assertEquals("[ -f \"a b\" ]", ScriptWriter.quote("[ -f \"a b\" ]"));
        assertEquals("'a \\\"b\\\" c'", ScriptWriter.quote("a \\\"b\\\" c"));
    }

    @Test
    void quote_quoteCharacters_areWrappedInTheOtherQuote() {
        assertEquals("\"a'b\"", ScriptWriter.quote("a'b"));
        assertEquals("'a\"b'", ScriptWriter.quote("a\"b"));
        assertEquals("'a b\\'", ScriptWriter.quote("a b\\"));
    }

    @Test
    void quote_wordWithVariable_keepsDoubleQuotes() {
        assertEquals("\"$x \\\"y\\\"\"", ScriptWriter.quote("$x \"y\""));
        assertEquals("\"it's $HOME\\\\\"", ScriptWriter.quote("it's $HOME\\"));
    }

    @Test
    void quote_doubleQuotedWordWithEscapedClosingQuote_isRequoted() {
        assertEquals("'\"a b\\\"'", ScriptWriter.quote("\"a b\\\""));
    }

    // === Re-parse ===

    @ParameterizedTest
    @ValueSource(strings = {
        "ls -la | grep .ex",
        "x=1; echo $x",
        "name=\"a b\"; echo \"$name\" 'c|d'",
        "for f in a b; do echo $f; done; while true; do sleep 1; done",
        "if a; then b; elif c; then d; else e; fi",
        "if [ -f x ]; then if y; then z; w; fi; fi",
        "cat < in.txt > out.txt >> log.txt",
        "until false; do sleep 1; echo tick; done < ticks",
        "run --name=\"a b\" \"$dir\"/bin",
        "echo \"a'b\"; ls",
        "echo 'a\"b'; ls",
        "echo 'a b\\'; ls",
        "x=\"a'b\"; ls",
        "echo \"it's $HOME\" 'say \"hi\"'; ls"
    })
    void synthesize_thenParse_keepsStatementShape(String input) {
        var original = parser.parse(input);

        var synthesized = ScriptWriter.synthesize(original);

        assertThat(kinds(parser.parse(synthesized).statements())).isEqualTo(kinds(original.statements()));
        // multi-line bodies only keep their statement boundaries when newlines separate
        assertEquals(synthesized, ScriptWriter.synthesize(lineParser.parse(synthesized)));
    }

    private static List<String> kinds(List<Statement> statements) {
        return statements.stream()
                         .map(statement -> statement.getClass().getSimpleName())
                         .toList();
    }
}
