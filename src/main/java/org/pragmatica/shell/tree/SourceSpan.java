package org.pragmatica.shell.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Captured source text together with the range it came from. Spans built by {@link #of} and by
 * the tokenizer end just past the text; {@link #fromRange} ends on its last character.
 * Offsets and lengths never depend on the end position. An empty span marks a node that was
 * synthesized rather than parsed.
 */
public record SourceSpan(String text, SourceLocation start, SourceLocation end) {

    public static final SourceSpan EMPTY = new SourceSpan("", SourceLocation.START, SourceLocation.START);

    public SourceSpan {
        checkNotNull(text, "text");
        checkArgument(end.line() >= start.line(), "span ends before it starts: %s-%s", start, end);
        checkArgument(end.line() > start.line() || end.column() >= start.column(),
                      "span ends before it starts: %s-%s", start, end);
    }

    /**
     * Span for {@code text} placed at the given position. The end position is derived from the
     * newlines embedded in the text. Offsets are counted from the start of {@code text}.
     */
    public static SourceSpan of(String text, int line, int column) {
        return of(text, SourceLocation.at(line, column, 0));
    }

    public static SourceSpan of(String text, SourceLocation start) {
        return new SourceSpan(text, start, start.advance(text));
    }

    /**
     * Span for {@code original[start, end)}. The start is the first character's position; the
     * end is the position of the last character, or the start of the next line when that
     * character is a newline. An empty range ends where it starts.
     */
    public static SourceSpan fromRange(String original, int start, int end) {
        checkArgument(0 <= start && start <= end && end <= original.length(),
                      "range [%s, %s) outside of input of length %s", start, end, original.length());
        var from = SourceLocation.locate(original, start);
        var text = original.substring(start, end);
        if (start == end) {
            return new SourceSpan(text, from, from);
        }
        var last = SourceLocation.locate(original, end - 1);
        var to = original.charAt(end - 1) == '\n'
                 ? SourceLocation.at(last.line() + 1, 1, end)
                 : last;
        return new SourceSpan(text, from, to);
    }

    /**
     * Span running from the start of {@code first} to the end of {@code last}, both taken from {@code source}.
     */
    public static SourceSpan covering(String source, SourceSpan first, SourceSpan last) {
        return new SourceSpan(source.substring(first.start.offset(), last.start.offset() + last.length()), first.start, last.end);
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public int line() {
        return start.line();
    }

    public int column() {
        return start.column();
    }

    public int endLine() {
        return end.line();
    }

    public int endColumn() {
        return end.column();
    }

    public int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
