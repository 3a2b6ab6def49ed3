package com.plang.core.grammar;

/**
 * Thrown when PLang source text does not conform to the grammar.
 */
public class ParseException extends RuntimeException {

    private final Diagnostic diagnostic;

    public ParseException(Diagnostic diagnostic) {
        super(diagnostic.format());
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
