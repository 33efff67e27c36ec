package com.bsa.analyzer.ast;

/**
 * 1-based line and column of a source offset.
 */
public record SourceLocation(int line, int column) {

    @Override
    public String toString() {
        return "line " + line + ", col " + column;
    }
}
