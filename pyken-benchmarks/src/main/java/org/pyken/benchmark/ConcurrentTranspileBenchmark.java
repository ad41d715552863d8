package org.pyken.benchmark;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.pyken.FileTranslation;
import org.pyken.PyKen;
import org.openjdk.jmh.annotations.*;

/**
 * Two threads translating different sources through one shared {@link PyKen}.
 * Gives a contention baseline for the worker pool.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = "-Dlogback.configurationFile=logback-benchmark.xml")
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentTranspileBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        final PyKen pyken = new PyKen();

        final String[] sources = {
                Sources.VESTING,
                Sources.POLICY
        };
    }

    @State(Scope.Thread)
    public static class ThreadState {

        private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
        int threadIndex;

        @Setup(Level.Trial)
        public void init() {
            threadIndex = THREAD_COUNTER.getAndIncrement() % 2;
        }
    }

    @Benchmark
    public FileTranslation concurrentTranslateDifferentSources(SharedState shared, ThreadState local) {
        return shared.pyken.translate("source" + local.threadIndex + ".py", shared.sources[local.threadIndex]);
    }
}
