package com.jsanalyzer.analyze.syntax;

import com.jsanalyzer.ast.Node;

/**
 * A half-open range of source offsets.
 */
public record TextRange(int start, int end) {
    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
    }

    public static TextRange of(Node node) {
        return new TextRange(node.start(), node.end());
    }

    public int length() {
        return end - start;
    }

    public boolean contains(TextRange other) {
        return start <= other.start && other.end <= end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
