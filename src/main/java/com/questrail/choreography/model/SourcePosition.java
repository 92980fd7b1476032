package com.questrail.choreography.model;

/**
 * Location of a token or syntax element in protocol source text.
 *
 * @param line   1-based line number
 * @param column 1-based column number
 * @param offset 0-based character offset from the start of the text
 */
public record SourcePosition(int line, int column, int offset)
{
    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0, -1);

    public SourcePosition {
        if (offset >= 0 && (line < 1 || column < 1)) {
            throw new IllegalArgumentException("line and column are 1-based");
        }
    }

    public static SourcePosition of(int line, int column, int offset) {
        return new SourcePosition(line, column, offset);
    }

    public boolean isKnown() {
        return offset >= 0;
    }

    @Override
    public String toString() {
        return isKnown() ? "line " + line + ", column " + column : "unknown position";
    }
}
