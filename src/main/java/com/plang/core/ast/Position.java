package com.plang.core.ast;

/**
 * 1-based source location of a node or token.
 */
public record Position(int line, int column) {

    public static final Position UNKNOWN = new Position(0, 0);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
