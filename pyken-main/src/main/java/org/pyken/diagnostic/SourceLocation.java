package org.pyken.diagnostic;

/**
 * One-based line and column of a construct in its source file.
 */
public record SourceLocation(int line, int column) implements Comparable<SourceLocation> {

    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0);

    @Override
    public int compareTo(SourceLocation other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
