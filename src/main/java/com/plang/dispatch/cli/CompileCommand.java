package com.plang.dispatch.cli;

import com.plang.core.dag.CyclicDependencyException;
import com.plang.core.engine.CompilationException;
import com.plang.core.engine.CompiledPolicySet;
import com.plang.core.engine.PolicyCompiler;
import com.plang.core.grammar.ParseException;
import com.plang.core.visitor.CategoryCollector;
import com.plang.core.visitor.PrettyPrinter;
import com.plang.core.visitor.SymbolInfo;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: plang compile &lt;file&gt;
 * <p>
 * Parses and checks a policy file and lists its declarations. Optional flags print the
 * canonical source, the governance categories and the lowered IR.
 */
@Command(name = "compile", mixinStandardHelpOptions = true, description = "Compile a policy file")
@Component
public class CompileCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "PLang source file")
    private Path file;

    @Option(names = "--ir", description = "Print the lowered IR module")
    private boolean ir;

    @Option(names = "--categories", description = "Print the governance category of every declaration")
    private boolean categories;

    @Option(names = "--print", description = "Print the program as canonical PLang source")
    private boolean print;

    private final PolicyCompiler compiler;

    public CompileCommand(PolicyCompiler compiler) {
        this.compiler = compiler;
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

        ConsoleOutput.success("Compiled " + compiled.name() + ": " + compiled.module().size() + " functions, "
                + compiled.plan().stageCount() + " stages");
        for (SymbolInfo symbol : compiled.symbols().symbols()) {
            ConsoleOutput.info(String.format("%-6s %s [%s, priority=%d, %d condition(s)]",
                    symbol.type(), symbol.name(), symbol.category(), symbol.priority(), symbol.conditions().size()));
        }

        if (print) {
            System.out.println();
            System.out.println(PrettyPrinter.print(compiled.program()));
        }
        if (categories) {
            System.out.println();
            CategoryCollector.collect(compiled.program()).byDeclaration()
                    .forEach((name, category) -> System.out.println("  " + name + ": " + category));
        }
        if (ir) {
            System.out.println();
            System.out.print(compiled.module().dump());
        }
        return 0;
    }
}
