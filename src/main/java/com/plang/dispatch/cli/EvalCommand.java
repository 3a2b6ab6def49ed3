package com.plang.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plang.config.PlangProperties;
import com.plang.core.dag.CyclicDependencyException;
import com.plang.core.engine.CompilationException;
import com.plang.core.engine.CompiledPolicySet;
import com.plang.core.engine.PolicyEngine;
import com.plang.core.grammar.ParseException;
import com.plang.core.runtime.EvaluationContext;
import com.plang.core.runtime.ExecutionTrace;
import com.plang.core.runtime.StageResult;
import com.plang.core.runtime.TerminalState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

/**
 * CLI command: plang eval &lt;file&gt; [--var k=v]...
 * <p>
 * Compiles a policy file and evaluates it against the given variables. Exit code 0 means
 * the run reached a decision; 3 means it ran out of steps or was cancelled.
 */
@Command(name = "eval", mixinStandardHelpOptions = true, description = "Evaluate a policy file")
@Component
public class EvalCommand implements Callable<Integer> {

    static final int EXIT_INCOMPLETE = 3;

    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+([eE][-+]?\\d+)?");

    @Parameters(index = "0", description = "PLang source file")
    private Path file;

    @Option(names = "--var", description = "Context variable as name=value (repeatable)")
    private Map<String, String> vars = new LinkedHashMap<>();

    @Option(names = "--vars-file", description = "JSON object of context variables")
    private Path varsFile;

    @Option(names = "--tenant", description = "Tenant id")
    private String tenant;

    @Option(names = "--max-steps", description = "Step budget (default: plang.runtime.max-steps)")
    private Long maxSteps;

    @Option(names = "--json", description = "Print the trace record as JSON")
    private boolean json;

    private final PolicyEngine engine;
    private final PlangProperties properties;
    private final ObjectMapper objectMapper;

    public EvalCommand(PolicyEngine engine, PlangProperties properties, ObjectMapper objectMapper) {
        this.engine = engine;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        if (!json) {
            ConsoleOutput.printBanner();
        }

        CompiledPolicySet compiled;
        EvaluationContext context;
        try {
            compiled = engine.compileFile(file);
            context = engine.newContext(tenant, variables(),
                    maxSteps != null ? maxSteps : properties.getMaxSteps());
        } catch (ParseException | CompilationException | CyclicDependencyException
                 | UncheckedIOException | IllegalArgumentException e) {
            return ConsoleOutput.failure(e);
        }

        ExecutionTrace trace = engine.evaluate(compiled, context);

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(trace.toRecord()));
            } catch (JsonProcessingException e) {
                return ConsoleOutput.failure(new IllegalStateException("Cannot render trace: " + e.getMessage(), e));
            }
        } else {
            for (StageResult stage : trace.stages()) {
                ConsoleOutput.stage(stage);
            }
            ConsoleOutput.decision(trace);
        }

        return trace.terminalState() == TerminalState.BUDGET_EXHAUSTED
                || trace.terminalState() == TerminalState.CANCELLED ? EXIT_INCOMPLETE : 0;
    }

    private Map<String, Object> variables() {
        var result = new LinkedHashMap<String, Object>();
        if (varsFile != null) {
            try {
                result.putAll(objectMapper.readValue(varsFile.toFile(), new TypeReference<Map<String, Object>>() {}));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read variables from " + varsFile, e);
            }
        }
        vars.forEach((name, value) -> result.put(name, parseScalar(value)));
        return result;
    }

    /**
     * Command-line values are typed like PLang literals: booleans, null, integers,
     * decimals, otherwise strings.
     */
    static Object parseScalar(String raw) {
        if (raw == null) return null;
        String value = raw.trim();
        if ("true".equalsIgnoreCase(value)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(value)) return Boolean.FALSE;
        if ("null".equalsIgnoreCase(value)) return null;
        if (INTEGER.matcher(value).matches()) return Long.parseLong(value);
        if (DECIMAL.matcher(value).matches()) return Double.parseDouble(value);
        return raw;
    }
}
