package com.plang.core.engine;

import com.plang.core.grammar.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a program parses but is semantically invalid, e.g. two declarations
 * share a name or an import cannot be resolved.
 */
public class CompilationException extends RuntimeException {

    private final List<Diagnostic> diagnostics;

    public CompilationException(String unit, List<Diagnostic> diagnostics) {
        super("Compilation of " + unit + " failed:\n" + diagnostics.stream()
                .map(Diagnostic::format)
                .collect(Collectors.joining("\n")));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
