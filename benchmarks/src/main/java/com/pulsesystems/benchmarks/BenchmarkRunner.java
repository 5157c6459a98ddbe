package com.pulsesystems.benchmarks;

import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

/**
 * Entry point for running the kernel benchmarks from the IDE or the module classpath.
 *
 * Usage:
 *
 * # Run everything
 * mvn -pl benchmarks -am package && java -cp "benchmarks/target/classes:$(cat cp.txt)" \
 *     com.pulsesystems.benchmarks.BenchmarkRunner
 *
 * # Run only router benchmarks
 * ... com.pulsesystems.benchmarks.BenchmarkRunner ".*EventRouter.*"
 */
public class BenchmarkRunner {

    public static void main(String[] args) throws RunnerException {
        String pattern = args.length > 0 ? args[0] : ".*Benchmark.*";

        Options opt = new OptionsBuilder()
                .include(pattern)
                .build();

        System.out.println("Running benchmarks with pattern: " + pattern);
        new Runner(opt).run();
    }
}
