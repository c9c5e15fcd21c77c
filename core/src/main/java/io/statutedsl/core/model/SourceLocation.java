package io.statutedsl.core.model;

/**
 * Position in DSL source text. Lines and columns are 1-based and columns count characters; the
 * byte offset counts UTF-8 bytes from the start of the source.
 *
 * @param line       1-based line number
 * @param column     1-based column number
 * @param byteOffset 0-based UTF-8 byte offset from the start of the source
 */
public record SourceLocation(int line, int column, int byteOffset) {

    /** Location of the first character of a source text. */
    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public SourceLocation {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("line and column are 1-based, got: " + line + ":" + column);
        }
        if (byteOffset < 0) {
            throw new IllegalArgumentException("byteOffset must not be negative, got: " + byteOffset);
        }
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
