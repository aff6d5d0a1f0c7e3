package com.solparser.ast;

/**
 * Byte range {@code [start, end)} inside a named source. An end of -1 marks a
 * location that is still being built.
 */
public record SourceLocation(int start, int end, String sourceName) {

    public static SourceLocation empty(String sourceName) {
        return new SourceLocation(-1, -1, sourceName);
    }

    public boolean isValid() {
        return sourceName != null && start >= 0 && end >= start;
    }

    public boolean hasText() {
        return isValid() && end > start;
    }

    public int length() {
        return end - start;
    }

    public boolean contains(SourceLocation other) {
        return isValid() && other.isValid()
            && sourceName.equals(other.sourceName)
            && start <= other.start && other.end <= end;
    }

    public SourceLocation withEnd(int newEnd) {
        return new SourceLocation(start, newEnd, sourceName);
    }

    @Override
    public String toString() {
        return sourceName + "[" + start + "," + end + ")";
    }
}
