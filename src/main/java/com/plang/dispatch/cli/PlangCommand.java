package com.plang.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for PLang.
 * Routes to subcommands: compile, plan, eval, arbitrate.
 */
@Command(
        name = "plang",
        mixinStandardHelpOptions = true,
        version = "PLang 0.1.0",
        description = "Policy DSL compiler, scheduler and runtime",
        subcommands = {
                CompileCommand.class,
                PlanCommand.class,
                EvalCommand.class,
                ArbitrateCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PlangCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
