package org.pyken.benchmark;

import java.util.concurrent.TimeUnit;

import org.pyken.FileTranslation;
import org.pyken.PyKen;
import org.openjdk.jmh.annotations.*;

/**
 * Measures the cost of translating one source file, from parsing to emitted
 * Aiken text. Nothing is written to disk.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = "-Dlogback.configurationFile=logback-benchmark.xml")
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TranspileCostBenchmark {

    @State(Scope.Thread)
    public static class TranspileState {

        final PyKen pyken = new PyKen();
    }

    @Benchmark
    public FileTranslation translateHelper(TranspileState state) {
        return state.pyken.translate("helper.py", Sources.HELPER);
    }

    @Benchmark
    public FileTranslation translateSpendValidator(TranspileState state) {
        return state.pyken.translate("vesting.py", Sources.VESTING);
    }

    @Benchmark
    public FileTranslation translateValidatorClass(TranspileState state) {
        return state.pyken.translate("policy.py", Sources.POLICY);
    }
}
