package io.exoticst.benchmarks;

import io.exoticst.automaton.Automaton;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Benchmark for automaton construction and scored traversal.
 * Patterns and text are drawn from a small alphabet so matches are dense.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class AutomatonBenchmark {

    @Param({"100", "1000", "10000"})
    public int patternCount;

    @Param({"10000"})
    public int textLength;

    private List<String> patterns;
    private long[] scores;
    private Automaton automaton;
    private String text;

    @Setup(Level.Trial)
    public void setup() {
        Random random = new Random(42);
        patterns = new ArrayList<>(patternCount);
        scores = new long[patternCount];
        for (int i = 0; i < patternCount; i++) {
            patterns.add(randomString(random, 2 + random.nextInt(6)));
            scores[i] = 1 + random.nextInt(100);
        }
        automaton = Automaton.build(patterns, scores);
        text = randomString(random, textLength);
    }

    private static String randomString(Random random, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append((char) ('a' + random.nextInt(6)));
        }
        return sb.toString();
    }

    @Benchmark
    public void build(Blackhole blackhole) {
        blackhole.consume(Automaton.build(patterns, scores));
    }

    @Benchmark
    public void traverse_fullRange(Blackhole blackhole) {
        blackhole.consume(automaton.traverse(text, 0, patternCount - 1));
    }

    @Benchmark
    public void traverse_firstTenth(Blackhole blackhole) {
        // Same scan cost, fewer entries pass the ordinal filter
        blackhole.consume(automaton.traverse(text, 0, patternCount / 10));
    }
}
