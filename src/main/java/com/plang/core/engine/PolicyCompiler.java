package com.plang.core.engine;

import com.plang.core.ast.Import;
import com.plang.core.ast.Node;
import com.plang.core.ast.Program;
import com.plang.core.dag.DagSorter;
import com.plang.core.dag.ExecutionPlan;
import com.plang.core.grammar.Diagnostic;
import com.plang.core.grammar.Parser;
import com.plang.core.ir.IRModule;
import com.plang.core.ir.IrLowering;
import com.plang.core.metrics.PlangMetrics;
import com.plang.core.visitor.RuleExtractor;
import com.plang.core.visitor.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Front end and planner: parse, merge imports, extract symbols, lower to IR and plan.
 */
@Service
public class PolicyCompiler {

    private static final Logger log = LoggerFactory.getLogger(PolicyCompiler.class);

    private final IrLowering lowering;
    private final DagSorter sorter;
    private final PlangMetrics metrics;

    @Autowired
    public PolicyCompiler(IrLowering lowering, DagSorter sorter, PlangMetrics metrics) {
        this.lowering = lowering;
        this.sorter = sorter;
        this.metrics = metrics;
    }

    public PolicyCompiler(IrLowering lowering, DagSorter sorter) {
        this(lowering, sorter, null);
    }

    /**
     * Compiles source whose imports are recorded but not resolved.
     *
     * @throws com.plang.core.grammar.ParseException        on a syntax error
     * @throws CompilationException                          on semantic errors
     * @throws com.plang.core.dag.CyclicDependencyException if the policies cannot be ordered
     */
    public CompiledPolicySet compile(String source, String name) {
        return compile(source, name, null, null);
    }

    /**
     * @param resolver supplies imported units; null leaves imports unresolved
     * @param origin   id of {@code source} as the resolver knows it, or null
     */
    public CompiledPolicySet compile(String source, String name, ImportResolver resolver, String origin) {
        long start = System.currentTimeMillis();
        Program program = Parser.parse(source);

        if (resolver != null) {
            var visited = new HashSet<String>();
            if (origin != null) {
                visited.add(origin);
            }
            var diagnostics = new ArrayList<Diagnostic>();
            program = merge(program, origin, resolver, visited, diagnostics);
            if (!diagnostics.isEmpty()) {
                throw new CompilationException(name, diagnostics);
            }
        }

        SymbolTable symbols = RuleExtractor.extract(program);
        if (symbols.hasErrors()) {
            throw new CompilationException(name, symbols.diagnostics());
        }

        IRModule module = lowering.lower(symbols, name);
        ExecutionPlan plan = sorter.plan(module);
        long elapsed = System.currentTimeMillis() - start;

        if (metrics != null) {
            metrics.recordCompilation(module.size(), elapsed);
            if (plan.fallbackApplied()) {
                metrics.recordCycleFallback();
            }
        }
        log.info("Compiled {}: {} functions, {} stages ({} parallel) in {}ms",
                name, module.size(), plan.stageCount(), plan.parallelStages(), elapsed);
        return new CompiledPolicySet(name, program, symbols, module, plan);
    }

    /**
     * Compiles a file, resolving imports relative to it. The unit name is the file
     * name without extension.
     */
    public CompiledPolicySet compileFile(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        String source;
        try {
            source = Files.readString(absolute);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + absolute, e);
        }
        String fileName = absolute.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String name = dot > 0 ? fileName.substring(0, dot) : fileName;
        Path parent = absolute.getParent() != null ? absolute.getParent() : Path.of(".");
        return compile(source, name, new FileImportResolver(parent), absolute.toString());
    }

    // Imported declarations are placed before the importing unit's own statements.
    private Program merge(Program program, String origin, ImportResolver resolver,
                          Set<String> visited, List<Diagnostic> diagnostics) {
        var imported = new ArrayList<Node>();
        for (Node statement : program.statements()) {
            if (!(statement instanceof Import imp)) {
                continue;
            }
            Optional<ImportResolver.ResolvedImport> unit = resolver.resolve(imp.path(), origin);
            if (unit.isEmpty()) {
                diagnostics.add(Diagnostic.semantic(imp.position(), "cannot resolve import '" + imp.path() + "'"));
                continue;
            }
            if (!visited.add(unit.get().id())) {
                log.debug("Import {} already merged", unit.get().id());
                continue;
            }
            Program child = Parser.parse(unit.get().source());
            imported.addAll(merge(child, unit.get().id(), resolver, visited, diagnostics).statements());
        }
        if (imported.isEmpty()) {
            return program;
        }
        imported.addAll(program.statements());
        return new Program(imported, program.position());
    }
}
