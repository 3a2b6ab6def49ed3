package com.plang.core.visitor;

import com.plang.core.grammar.Diagnostic;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of {@link RuleExtractor}: declarations in source order plus imports,
 * rule references and semantic diagnostics.
 */
public final class SymbolTable {

    private final Map<String, SymbolInfo> symbols;
    private final List<String> imports;
    private final List<String> ruleRefs;
    private final List<Diagnostic> diagnostics;

    SymbolTable(Map<String, SymbolInfo> symbols, List<String> imports,
                List<String> ruleRefs, List<Diagnostic> diagnostics) {
        this.symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
        this.imports = List.copyOf(imports);
        this.ruleRefs = List.copyOf(ruleRefs);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public Optional<SymbolInfo> lookup(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    public Collection<SymbolInfo> symbols() {
        return symbols.values();
    }

    public Set<String> names() {
        return symbols.keySet();
    }

    public List<String> imports() {
        return imports;
    }

    public List<String> ruleRefs() {
        return ruleRefs;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    public int size() {
        return symbols.size();
    }
}
