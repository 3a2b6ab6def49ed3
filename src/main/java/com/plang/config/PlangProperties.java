package com.plang.config;

import com.plang.core.dag.CycleHandling;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "plang")
public class PlangProperties {

    private Runtime runtime = new Runtime();
    private Dag dag = new Dag();
    private Arbitration arbitration = new Arbitration();

    // -- flat accessors (delegate to nested) --
    public long getMaxSteps() { return runtime.maxSteps; }
    public int getMaxVariables() { return runtime.maxVariables; }
    public int getParallelism() { return runtime.parallelism; }
    public CycleHandling getCycleHandling() { return dag.cycleHandling; }
    public int getDefaultPrecedence() { return arbitration.defaultPrecedence; }

    public Runtime getRuntime() { return runtime; }
    public void setRuntime(Runtime runtime) { this.runtime = runtime; }
    public Dag getDag() { return dag; }
    public void setDag(Dag dag) { this.dag = dag; }
    public Arbitration getArbitration() { return arbitration; }
    public void setArbitration(Arbitration arbitration) { this.arbitration = arbitration; }

    public static class Runtime {
        private long maxSteps = 10_000;
        private int maxVariables = 1024;
        private int parallelism = 4;

        public long getMaxSteps() { return maxSteps; }
        public void setMaxSteps(long maxSteps) { this.maxSteps = maxSteps; }
        public int getMaxVariables() { return maxVariables; }
        public void setMaxVariables(int maxVariables) { this.maxVariables = maxVariables; }
        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
    }

    public static class Dag {
        /** What the sorter does when the graph cannot be fully ordered. */
        private CycleHandling cycleHandling = CycleHandling.FAIL;

        public CycleHandling getCycleHandling() { return cycleHandling; }
        public void setCycleHandling(CycleHandling cycleHandling) { this.cycleHandling = cycleHandling; }
    }

    public static class Arbitration {
        /** Precedence assumed for policies with no stored precedence record. */
        private int defaultPrecedence = 100;

        public int getDefaultPrecedence() { return defaultPrecedence; }
        public void setDefaultPrecedence(int defaultPrecedence) { this.defaultPrecedence = defaultPrecedence; }
    }
}
