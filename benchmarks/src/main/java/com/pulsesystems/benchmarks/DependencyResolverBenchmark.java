package com.pulsesystems.benchmarks;

import com.pulsesystems.resolver.DependencyNode;
import com.pulsesystems.resolver.DependencyResolver;
import com.pulsesystems.resolver.ResolutionFailure;
import com.pulsesystems.resolver.ResolvedDependency;
import com.pulsesystems.Result;
import org.openjdk.jmh.annotations.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Measures resolution of random layered dependency graphs.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
@Fork(1)
public class DependencyResolverBenchmark {

    @Param({"100", "1000", "10000"})
    private int nodeCount;

    private final DependencyResolver resolver = new DependencyResolver();
    private List<DependencyNode> nodes;

    @Setup(Level.Trial)
    public void setup() {
        Random random = new Random(7);
        nodes = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            List<String> deps = new ArrayList<>();
            // Up to three edges to earlier nodes keeps the graph acyclic
            for (int d = 0; d < 3 && i > 0; d++) {
                deps.add("unit-" + random.nextInt(i));
            }
            nodes.add(new DependencyNode("unit-" + i, deps));
        }
    }

    @Benchmark
    public Result<List<ResolvedDependency>, ResolutionFailure> resolve() {
        return resolver.resolve(nodes);
    }

    @Benchmark
    public List<String> transitiveDependenciesOfNewest() {
        return resolver.transitiveDependencies("unit-" + (nodeCount - 1), nodes);
    }
}
