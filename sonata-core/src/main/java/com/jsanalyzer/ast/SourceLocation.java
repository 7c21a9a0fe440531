package com.jsanalyzer.ast;

/**
 * Line/column span of a node. Lines are 1-based, columns 0-based (ESTree convention).
 */
public record SourceLocation(Position start, Position end) {

    public record Position(int line, int column) {}
}
