package com.plang.dispatch.cli;

import com.plang.core.dag.CyclicDependencyException;
import com.plang.core.dag.DagSorter;
import com.plang.core.dag.ExecutionDag;
import com.plang.core.engine.CompilationException;
import com.plang.core.engine.CompiledPolicySet;
import com.plang.core.engine.PolicyCompiler;
import com.plang.core.grammar.ParseException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: plang plan &lt;file&gt;
 * <p>
 * Shows the dependency graph of a policy file and the stages it is executed in.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Show the execution plan of a policy file")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "PLang source file")
    private Path file;

    private final PolicyCompiler compiler;
    private final DagSorter sorter;

    public PlanCommand(PolicyCompiler compiler, DagSorter sorter) {
        this.compiler = compiler;
        this.sorter = sorter;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        CompiledPolicySet compiled;
        try {
            compiled = compiler.compileFile(file);
        } catch (ParseException | CompilationException | CyclicDependencyException | UncheckedIOException e) {
            return ConsoleOutput.failure(e);
        }

        ExecutionDag dag = sorter.build(compiled.module());
        System.out.print(sorter.visualize(dag, compiled.plan()));
        if (compiled.plan().fallbackApplied()) {
            ConsoleOutput.error("Cycle detected: last stage is a best-effort fallback");
        }
        return 0;
    }
}
