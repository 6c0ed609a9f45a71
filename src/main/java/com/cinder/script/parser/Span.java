package com.cinder.script.parser;

/**
 * Source extent of a token or AST node: a half-open character range {@code [start, end)}
 * plus the 1-based line/column of {@code start}.
 */
public final class Span {
    public final int start;
    public final int end;
    public final int line;
    public final int col;

    public Span(int start, int end, int line, int col) {
        this.start = start;
        this.end = end;
        this.line = line;
        this.col = col;
    }

    /** Union of two spans, positioned at the first one. */
    public static Span from(Span first, Span last) {
        return new Span(first.start, last.end, first.line, first.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span s = (Span) o;
        return start == s.start && end == s.end && line == s.line && col == s.col;
    }

    @Override
    public int hashCode() {
        int h = start;
        h = 31 * h + end;
        h = 31 * h + line;
        return 31 * h + col;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ") " + line + ":" + col;
    }
}
