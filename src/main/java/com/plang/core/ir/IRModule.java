package com.plang.core.ir;

import com.plang.core.visitor.PrettyPrinter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named set of IR functions in declaration order. Function names are unique.
 */
public final class IRModule {

    private final String name;
    private final Map<String, IRFunction> functions = new LinkedHashMap<>();

    public IRModule(String name) {
        this.name = name;
    }

    /**
     * @throws IllegalArgumentException if a function with the same name is already present
     */
    public IRModule addFunction(IRFunction function) {
        if (functions.containsKey(function.name())) {
            throw new IllegalArgumentException("Duplicate IR function: " + function.name());
        }
        functions.put(function.name(), function);
        return this;
    }

    public String name() {
        return name;
    }

    public Optional<IRFunction> function(String functionName) {
        return Optional.ofNullable(functions.get(functionName));
    }

    public boolean contains(String functionName) {
        return functions.containsKey(functionName);
    }

    public Collection<IRFunction> functions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    public int size() {
        return functions.size();
    }

    /**
     * Human-readable listing used by {@code plang compile --ir}.
     */
    public String dump() {
        var sb = new StringBuilder("module ").append(name).append('\n');
        for (IRFunction fn : functions.values()) {
            sb.append("  fn ").append(fn.name())
                    .append(" [").append(fn.kind())
                    .append(", ").append(fn.governance().category())
                    .append(", priority=").append(fn.governance().priority());
            if (fn.parentPolicy() != null) {
                sb.append(", parent=").append(fn.parentPolicy());
            }
            sb.append("]\n");
            for (IRBlock block : fn.blocks()) {
                sb.append("    ").append(block.label()).append(":\n");
                for (IRInstruction instruction : block.instructions()) {
                    sb.append("      ").append(describe(instruction)).append('\n');
                }
            }
        }
        return sb.toString();
    }

    private static String describe(IRInstruction instruction) {
        if (instruction instanceof IRCondition c) {
            return "cond " + PrettyPrinter.print(c.expression());
        }
        IRAction a = (IRAction) instruction;
        var sb = new StringBuilder("emit ").append(a.kind());
        if (a.target() != null) sb.append(" -> ").append(a.target());
        if (a.reason() != null) sb.append(" \"").append(a.reason()).append('"');
        return sb.toString();
    }
}
