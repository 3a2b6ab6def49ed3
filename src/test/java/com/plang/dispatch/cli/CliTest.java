package com.plang.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plang.config.PlangProperties;
import com.plang.core.arbitration.InMemoryPrecedenceStore;
import com.plang.core.arbitration.PolicyArbitrator;
import com.plang.core.arbitration.SnapshotHasher;
import com.plang.core.dag.DagSorter;
import com.plang.core.engine.PolicyCompiler;
import com.plang.core.engine.PolicyEngine;
import com.plang.core.events.EventBus;
import com.plang.core.ir.IrLowering;
import com.plang.core.metrics.PlangMetrics;
import com.plang.core.runtime.DagExecutor;
import com.plang.core.runtime.FactResolver;
import com.plang.core.runtime.PolicyEvaluator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the PLang CLI command structure.
 * These tests exercise picocli directly without a Spring context, with the commands
 * wired to real compiler, executor and arbitrator instances.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path dir;

    private ExecutorService pool;
    private PolicyCompiler compiler;
    private DagSorter sorter;
    private PolicyEngine engine;
    private PlangProperties properties;
    private InMemoryPrecedenceStore store;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        properties = new PlangProperties();
        var metrics = new PlangMetrics(new SimpleMeterRegistry());
        var bus = new EventBus();
        sorter = new DagSorter(properties);
        compiler = new PolicyCompiler(new IrLowering(), sorter, metrics);
        store = new InMemoryPrecedenceStore();
        var executor = new DagExecutor(sorter, new PolicyEvaluator(FactResolver.NONE), pool, bus, metrics);
        var arbitrator = new PolicyArbitrator(store, properties, new SnapshotHasher(), Clock.systemUTC());
        engine = new PolicyEngine(compiler, executor, arbitrator, bus, properties, metrics);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == CompileCommand.class) {
                    return (K) new CompileCommand(compiler);
                }
                if (cls == PlanCommand.class) {
                    return (K) new PlanCommand(compiler, sorter);
                }
                if (cls == EvalCommand.class) {
                    return (K) new EvalCommand(engine, properties, objectMapper);
                }
                if (cls == ArbitrateCommand.class) {
                    return (K) new ArbitrateCommand(engine, store, objectMapper);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(capture, true));
        try {
            var cmd = new CommandLine(new PlangCommand(), factory());
            cmd.setOut(new PrintWriter(System.out, true));
            cmd.setErr(new PrintWriter(System.out, true));
            int exitCode = cmd.execute(args);
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
        }
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private static final String POLICIES = """
            policy toxic : safety {
              priority 10
              when score > 0.9 then DENY "toxic content"
            }
            policy spam : safety {
              priority 20
              when score > 0.7 then ESCALATE
            }
            policy review : routing {
              when score > 0.5 then ROUTE to human
            }
            """;

    @Nested
    @DisplayName("Command structure")
    class Structure {

        @Test
        @DisplayName("no subcommand prints banner and usage")
        void noArgs() {
            var result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("PLANG v0.1.0"));
            assertTrue(result.output().contains("compile"));
            assertTrue(result.output().contains("arbitrate"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            var result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("PLang 0.1.0"));
        }

        @Test
        @DisplayName("unknown subcommand is a usage error")
        void unknown() {
            assertEquals(2, execute("deploy").exitCode());
        }
    }

    @Nested
    @DisplayName("compile")
    class Compile {

        @Test
        @DisplayName("lists declarations and optional views")
        void compileWithViews() throws IOException {
            Path file = write("content.plang", POLICIES);
            var result = execute("compile", file.toString(), "--ir", "--categories", "--print");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Compiled content: 3 functions, 2 stages"));
            assertTrue(result.output().contains("module content"));
            assertTrue(result.output().contains("review: ROUTING"));
            assertTrue(result.output().contains("policy toxic : SAFETY {"));
        }

        @Test
        @DisplayName("syntax errors print a located diagnostic and exit 1")
        void syntaxError() throws IOException {
            Path file = write("broken.plang", "policy p {\n  when then DENY\n}");
            var result = execute("compile", file.toString());
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Syntax error"));
            assertTrue(result.output().contains("2:8:"));
        }

        @Test
        @DisplayName("missing file exits 1")
        void missingFile() {
            assertEquals(1, execute("compile", dir.resolve("none.plang").toString()).exitCode());
        }
    }

    @Test
    @DisplayName("plan prints the graph and stages")
    void plan() throws IOException {
        Path file = write("content.plang", POLICIES);
        var result = execute("plan", file.toString());
        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("stage 0 [SAFETY] (parallel): toxic, spam"));
        assertTrue(result.output().contains("stage 1 [ROUTING]: review"));
    }

    @Nested
    @DisplayName("eval")
    class Eval {

        @Test
        @DisplayName("prints stages and the decision")
        void decision() throws IOException {
            Path file = write("content.plang", POLICIES);
            var result = execute("eval", file.toString(), "--var", "score=0.8", "--tenant", "t1");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[STAGE 0] SAFETY net=ESCALATE"));
            assertTrue(result.output().contains("ESCALATE (COMPLETED, 2/2 stages"));
        }

        @Test
        @DisplayName("--json prints the trace record")
        void json() throws IOException {
            Path file = write("content.plang", POLICIES);
            var result = execute("eval", file.toString(), "--var", "score=0.95", "--json");
            assertEquals(0, result.exitCode());
            Map<?, ?> record = objectMapper.readValue(result.output(), Map.class);
            assertEquals("DENY", record.get("final_action"));
            assertEquals("DENIED", record.get("terminal_state"));
        }

        @Test
        @DisplayName("variables can come from a JSON file")
        void varsFile() throws IOException {
            Path file = write("content.plang", POLICIES);
            Path vars = write("vars.json", "{\"score\": 0.6}");
            var result = execute("eval", file.toString(), "--vars-file", vars.toString(), "--json");
            Map<?, ?> record = objectMapper.readValue(result.output(), Map.class);
            assertEquals("ROUTE", record.get("final_action"));
        }

        @Test
        @DisplayName("running out of steps exits 3")
        void budget() throws IOException {
            Path file = write("content.plang", POLICIES);
            var result = execute("eval", file.toString(), "--var", "score=0.1", "--max-steps", "2");
            assertEquals(EvalCommand.EXIT_INCOMPLETE, result.exitCode());
            assertTrue(result.output().contains("BUDGET_EXHAUSTED"));
        }

        @Test
        @DisplayName("command-line values are typed like literals")
        void scalars() {
            assertEquals(42L, EvalCommand.parseScalar("42"));
            assertEquals(0.5, EvalCommand.parseScalar("0.5"));
            assertEquals(Boolean.TRUE, EvalCommand.parseScalar("TRUE"));
            assertNull(EvalCommand.parseScalar("null"));
            assertEquals("eu-west", EvalCommand.parseScalar("eu-west"));
            assertEquals("99999999999999999999", EvalCommand.parseScalar("99999999999999999999"));
        }
    }

    @Nested
    @DisplayName("arbitrate")
    class Arbitrate {

        private Path request() throws IOException {
            return write("limits.json", """
                    {
                      "policies": ["p1", "p2"],
                      "precedence": [
                        {"policy_id": "p1", "precedence": 1},
                        {"policy_id": "p2", "precedence": 5}
                      ],
                      "contributions": [
                        {"policy_id": "p1", "token_limit": 100, "breach_action": "pause"},
                        {"policy_id": "p2", "token_limit": 50, "breach_action": "kill"}
                      ]
                    }
                    """);
        }

        @Test
        @DisplayName("prints the effective limits")
        void human() throws IOException {
            var result = execute("arbitrate", request().toString(), "--tenant", "acme");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Precedence order: p1, p2"));
            assertTrue(result.output().contains("Token limit:     50"));
            assertTrue(result.output().contains("Breach action:   kill"));
            assertTrue(store.find("p1", "acme").isPresent());
        }

        @Test
        @DisplayName("--json prints the result record")
        void json() throws IOException {
            var result = execute("arbitrate", request().toString(), "--tenant", "acme", "--json");
            Map<?, ?> record = objectMapper.readValue(result.output(), Map.class);
            assertEquals(2, record.get("conflicts_resolved"));
            assertEquals("kill", record.get("breach_action"));
        }

        @Test
        @DisplayName("tenant is required")
        void tenantRequired() throws IOException {
            assertEquals(2, execute("arbitrate", request().toString()).exitCode());
        }

        @Test
        @DisplayName("unreadable input exits 1")
        void badJson() throws IOException {
            Path file = write("bad.json", "{ not json");
            assertEquals(1, execute("arbitrate", file.toString(), "--tenant", "acme").exitCode());
        }
    }
}
