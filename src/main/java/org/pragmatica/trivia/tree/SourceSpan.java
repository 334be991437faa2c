package org.pragmatica.trivia.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    /**
     * Span of trivia and tokens that were created by a rewrite rather than read from source.
     */
    public static final SourceSpan DETACHED = new SourceSpan(SourceLocation.START, SourceLocation.START);

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    /**
     * Span covering {@code text} when it starts at {@code start}.
     */
    public static SourceSpan covering(SourceLocation start, String text) {
        return new SourceSpan(start, start.advance(text));
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isDetached() {
        return this == DETACHED;
    }

    @Override
    public String toString() {
        return isDetached() ? "<detached>" : start + "-" + end;
    }
}
