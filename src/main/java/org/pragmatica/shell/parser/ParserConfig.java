package org.pragmatica.shell.parser;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Parser configuration options.
 *
 * @param maxNestingDepth   deepest allowed nesting of {@code if}/{@code for}/{@code while}/{@code until} blocks
 * @param maxInputLength    longest accepted input, in characters
 * @param newlineSeparators whether an unquoted newline ends a statement like {@code ;} does
 */
public record ParserConfig(
    int maxNestingDepth,
    int maxInputLength,
    boolean newlineSeparators
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        128,
        1_000_000,
        false
    );

    public ParserConfig {
        checkArgument(maxNestingDepth > 0, "maxNestingDepth must be positive, got %s", maxNestingDepth);
        checkArgument(maxInputLength >= 0, "maxInputLength must not be negative, got %s", maxInputLength);
    }
}
