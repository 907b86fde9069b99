package org.pragmatica.shell;

import org.pragmatica.shell.lexer.Token;
import org.pragmatica.shell.parser.Parser;
import org.pragmatica.shell.parser.ParserConfig;
import org.pragmatica.shell.parser.ScriptParser;
import org.pragmatica.shell.tree.Node;
import org.pragmatica.shell.tree.Node.Script;
import org.pragmatica.shell.writer.ScriptWriter;

import java.util.List;

/**
 * Entry point for parsing and rendering shell scripts.
 *
 * <p>Example usage:
 * <pre>{@code
 * var script = ShellParser.parse("for f in *.txt; do wc -l $f; done");
 *
 * ShellParser.roundTrip(script);   // original text
 * ShellParser.serialize(script);   // rebuilt from the tree
 * }</pre>
 */
public final class ShellParser {
    private static final Parser DEFAULT_PARSER = ScriptParser.create(ParserConfig.DEFAULT);

    private ShellParser() {}

    /**
     * Split text into tokens. Intended for debugging and inspection.
     */
    public static List<Token> tokenize(String text) {
        return DEFAULT_PARSER.tokenize(text);
    }

    /**
     * Parse text with the default configuration.
     *
     * @throws org.pragmatica.shell.error.ParseException if the input exceeds a resource limit
     */
    public static Script parse(String text) {
        return DEFAULT_PARSER.parse(text);
    }

    /**
     * Parse text with custom configuration.
     */
    public static Script parse(String text, ParserConfig config) {
        return create(config).parse(text);
    }

    /**
     * Create a reusable parser with custom configuration.
     */
    public static Parser create(ParserConfig config) {
        return ScriptParser.create(config);
    }

    /**
     * Rebuild shell text from the tree structure alone, ignoring captured spans.
     */
    public static String serialize(Node tree) {
        return ScriptWriter.synthesize(tree);
    }

    /**
     * Reproduce shell text preferring captured spans, synthesizing nodes that have none.
     */
    public static String roundTrip(Node tree) {
        return ScriptWriter.roundTrip(tree);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxNestingDepth = ParserConfig.DEFAULT.maxNestingDepth();
        private int maxInputLength = ParserConfig.DEFAULT.maxInputLength();
        private boolean newlineSeparators = ParserConfig.DEFAULT.newlineSeparators();

        private Builder() {}

        public Builder maxNestingDepth(int depth) {
            this.maxNestingDepth = depth;
            return this;
        }

        public Builder maxInputLength(int length) {
            this.maxInputLength = length;
            return this;
        }

        public Builder newlineSeparators(boolean enabled) {
            this.newlineSeparators = enabled;
            return this;
        }

        public Parser build() {
            return create(new ParserConfig(maxNestingDepth, maxInputLength, newlineSeparators));
        }
    }
}
