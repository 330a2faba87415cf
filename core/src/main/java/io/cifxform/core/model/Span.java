package io.cifxform.core.model;

/**
 * Half-open character range {@code [start, end)} into the decoded text of a {@link Document}.
 *
 * @param start first offset covered by the span
 * @param end   offset just past the last character covered
 */
public record Span(int start, int end) implements Comparable<Span> {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /** Creates a zero-width span at the given offset. */
    public static Span at(int offset) {
        return new Span(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /** Returns {@code true} if both spans share at least one character. */
    public boolean overlaps(Span other) {
        return start < other.end && other.start < end;
    }

    /** Returns {@code true} if {@code other} lies entirely inside this span. */
    public boolean encloses(Span other) {
        return start <= other.start && other.end <= end;
    }

    /** Returns the text this span covers. */
    public String of(String text) {
        return text.substring(start, end);
    }

    @Override
    public int compareTo(Span other) {
        int byStart = Integer.compare(start, other.start);
        return byStart != 0 ? byStart : Integer.compare(end, other.end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
