package com.plang.core.grammar;

import com.plang.core.ast.Position;

/**
 * A structured compiler diagnostic: where it happened, what was expected and what was found.
 *
 * @param position source location (1-based line and column)
 * @param expected what the grammar expected at this point (nullable for semantic diagnostics)
 * @param found    what was actually there
 * @param message  human-readable summary
 */
public record Diagnostic(Position position, String expected, String found, String message) {

    public static Diagnostic syntax(Position position, String expected, String found) {
        return new Diagnostic(position, expected, found,
                "expected " + expected + " but found " + found);
    }

    public static Diagnostic semantic(Position position, String message) {
        return new Diagnostic(position, null, null, message);
    }

    public String format() {
        return position.line() + ":" + position.column() + ": " + message;
    }
}
