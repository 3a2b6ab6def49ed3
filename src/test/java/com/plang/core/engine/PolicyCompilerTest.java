package com.plang.core.engine;

import com.plang.core.dag.CycleHandling;
import com.plang.core.dag.CyclicDependencyException;
import com.plang.core.dag.DagSorter;
import com.plang.core.grammar.ParseException;
import com.plang.core.ir.IrLowering;
import com.plang.core.metrics.PlangMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PolicyCompilerTest {

    private final PolicyCompiler compiler = new PolicyCompiler(new IrLowering(), new DagSorter(CycleHandling.FAIL));

    @Test
    @DisplayName("compiles source into symbols, IR and a plan")
    void compile() {
        var set = compiler.compile("""
                policy pii : privacy { when contains(text, "@") then DENY }
                policy toxic : safety { when score > 0.9 then DENY }
                """, "gateway");

        assertEquals("gateway", set.name());
        assertEquals(2, set.symbols().size());
        assertEquals("gateway", set.module().name());
        assertEquals(List.of("toxic", "pii"), set.plan().executionOrder());
    }

    @Test
    @DisplayName("syntax errors surface as ParseException")
    void syntaxError() {
        assertThrows(ParseException.class, () -> compiler.compile("policy {", "bad"));
    }

    @Test
    @DisplayName("semantic errors surface as CompilationException with diagnostics")
    void semanticError() {
        var ex = assertThrows(CompilationException.class,
                () -> compiler.compile("policy a { }\npolicy a { }", "dup"));
        assertEquals(1, ex.getDiagnostics().size());
        assertTrue(ex.getMessage().contains("2:1: duplicate declaration 'a'"));
    }

    @Test
    @DisplayName("cycles fail compilation under FAIL handling")
    void cycle() {
        assertThrows(CyclicDependencyException.class, () -> compiler.compile("""
                policy a { when true then ROUTE to b }
                policy b { when true then ROUTE to a }
                """, "loop"));
    }

    @Test
    @DisplayName("cycle fallback is counted")
    void cycleFallbackMetric() {
        var registry = new SimpleMeterRegistry();
        var fallback = new PolicyCompiler(new IrLowering(), new DagSorter(CycleHandling.FALLBACK),
                new PlangMetrics(registry));
        var set = fallback.compile("""
                policy a { when true then ROUTE to b }
                policy b { when true then ROUTE to a }
                """, "loop");

        assertTrue(set.plan().fallbackApplied());
        assertEquals(1.0, registry.get("plang.dag.cycle_fallbacks").counter().count());
        assertEquals(1, registry.get("plang.compile.duration").timer().count());
    }

    @Nested
    @DisplayName("Imports")
    class Imports {

        private final Map<String, String> units = Map.of(
                "base.plang", "import \"shared.plang\"\nrule base_rule : safety { when true then ALLOW }",
                "shared.plang", "rule shared_rule { when true then ALLOW }",
                "other.plang", "import \"shared.plang\"\npolicy other { use shared_rule }");

        private final ImportResolver resolver = (path, importer) ->
                Optional.ofNullable(units.get(path)).map(src -> new ImportResolver.ResolvedImport(path, src));

        @Test
        @DisplayName("imported declarations precede the importer's and each unit merges once")
        void mergesOnce() {
            var set = compiler.compile("""
                    import "base.plang"
                    import "other.plang"
                    policy main { use base_rule }
                    """, "main", resolver, "main.plang");

            assertEquals(List.of("shared_rule", "base_rule", "other", "main"), List.copyOf(set.symbols().names()));
        }

        @Test
        @DisplayName("unresolvable imports are compilation errors")
        void missingImport() {
            var ex = assertThrows(CompilationException.class,
                    () -> compiler.compile("import \"nowhere.plang\"\npolicy p { }", "p", resolver, null));
            assertTrue(ex.getDiagnostics().get(0).message().contains("cannot resolve import 'nowhere.plang'"));
        }

        @Test
        @DisplayName("without a resolver imports are only recorded")
        void recordedOnly() {
            var set = compiler.compile("import \"nowhere.plang\"\npolicy p { }", "p");
            assertEquals(List.of("nowhere.plang"), set.symbols().imports());
        }

        @Test
        @DisplayName("files resolve imports relative to the importing file")
        void fromFiles(@TempDir Path dir) throws IOException {
            Files.createDirectories(dir.resolve("lib"));
            Files.writeString(dir.resolve("lib/limits.plang"), "rule limit { when usage > 10 then ESCALATE }");
            Files.writeString(dir.resolve("gateway.plang"), """
                    import "lib/limits.plang"
                    policy gate : operational { use limit }
                    """);

            var set = compiler.compileFile(dir.resolve("gateway.plang"));

            assertEquals("gateway", set.name());
            assertTrue(set.module().contains("limit"));
            assertTrue(set.module().contains("gate"));
        }
    }
}
