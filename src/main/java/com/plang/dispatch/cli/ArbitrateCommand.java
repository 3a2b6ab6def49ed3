package com.plang.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plang.core.arbitration.ArbitrationResult;
import com.plang.core.arbitration.PolicyPrecedence;
import com.plang.core.arbitration.PrecedenceStore;
import com.plang.core.engine.PolicyEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: plang arbitrate &lt;json-file&gt; --tenant &lt;id&gt;
 * <p>
 * Stores the precedence records from the file for the tenant, then arbitrates the
 * listed policies' contributions.
 */
@Command(name = "arbitrate", mixinStandardHelpOptions = true,
        description = "Resolve conflicting limits and breach actions across policies")
@Component
public class ArbitrateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "JSON file with policies, precedence and contributions")
    private Path file;

    @Option(names = "--tenant", required = true, description = "Tenant id")
    private String tenant;

    @Option(names = "--json", description = "Print the result record as JSON")
    private boolean json;

    private final PolicyEngine engine;
    private final PrecedenceStore store;
    private final ObjectMapper objectMapper;

    public ArbitrateCommand(PolicyEngine engine, PrecedenceStore store, ObjectMapper objectMapper) {
        this.engine = engine;
        this.store = store;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        if (!json) {
            ConsoleOutput.printBanner();
        }

        ArbitrationFile request;
        try {
            request = objectMapper.readValue(file.toFile(), ArbitrationFile.class);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 1;
        }

        for (ArbitrationFile.Precedence p : request.precedence()) {
            store.save(new PolicyPrecedence(p.policyId(), tenant, p.precedence(), p.strategy()));
        }

        ArbitrationResult result;
        try {
            result = engine.arbitrate(request.policies(), tenant, request.toInput());
        } catch (IllegalArgumentException e) {
            return ConsoleOutput.failure(e);
        }

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result.toRecord()));
            } catch (JsonProcessingException e) {
                return ConsoleOutput.failure(new IllegalStateException("Cannot render result: " + e.getMessage(), e));
            }
            return 0;
        }

        ConsoleOutput.success("Arbitrated " + result.policyIds().size() + " policies for tenant " + tenant
                + " (" + result.strategy() + ")");
        ConsoleOutput.info("Precedence order: " + String.join(", ", result.policyIds()));
        ConsoleOutput.info("Token limit:     " + result.effectiveTokenLimit());
        ConsoleOutput.info("Cost limit:      " + result.effectiveCostLimit());
        ConsoleOutput.info("Burn-rate limit: " + result.effectiveBurnRateLimit());
        ConsoleOutput.info("Breach action:   " + result.effectiveBreachAction().value());
        ConsoleOutput.info("Conflicts resolved: " + result.conflictsResolved());
        ConsoleOutput.info("Snapshot: " + result.snapshotHash());
        return 0;
    }
}
