package org.pyken.emitter;

/**
 * Accumulates Aiken source text with two-space indentation and {@code \n} line ends.
 */
public final class SourceWriter {

    private static final String INDENT = "  ";

    private final StringBuilder buf = new StringBuilder();
    private int level;
    private boolean lineStart = true;

    public SourceWriter indent() {
        level++;
        return this;
    }

    public SourceWriter unindent() {
        if (level == 0) {
            throw new IllegalStateException("Indentation is already at column 0");
        }
        level--;
        return this;
    }

    public SourceWriter print(String text) {
        if (text.isEmpty()) {
            return this;
        }
        if (lineStart) {
            buf.append(INDENT.repeat(level));
            lineStart = false;
        }
        buf.append(text);
        return this;
    }

    public SourceWriter println(String text) {
        print(text);
        return println();
    }

    public SourceWriter println() {
        buf.append('\n');
        lineStart = true;
        return this;
    }

    /** Whether nothing has been printed on the current line yet. */
    public boolean atLineStart() {
        return lineStart;
    }

    public String getSource() {
        return buf.toString();
    }

    @Override
    public String toString() {
        return getSource();
    }
}
