package org.pyken;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Settings of one transpile run. Defaults come from the {@code pyken.output},
 * {@code pyken.strict} and {@code pyken.jobs} system properties; anything set on
 * the builder wins.
 */
public final class TranspilerOptions {

    public static final String OUTPUT_PROPERTY = "pyken.output";
    public static final String STRICT_PROPERTY = "pyken.strict";
    public static final String JOBS_PROPERTY = "pyken.jobs";

    public static final String DEFAULT_OUTPUT = "build/aiken";

    private final Path output;
    private final boolean strict;
    private final int parallelism;

    private TranspilerOptions(Builder builder) {
        this.output = builder.output;
        this.strict = builder.strict;
        this.parallelism = builder.parallelism;
    }

    public static TranspilerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().output(output).strict(strict).parallelism(parallelism);
    }

    /** Directory the {@code .ak} artifacts are written to. */
    public Path output() {
        return output;
    }

    /** Whether warnings are promoted to fatal diagnostics. */
    public boolean strict() {
        return strict;
    }

    /** Number of worker threads. */
    public int parallelism() {
        return parallelism;
    }

    @Override
    public String toString() {
        return "TranspilerOptions{output=" + output + ", strict=" + strict + ", parallelism=" + parallelism + '}';
    }

    public static final class Builder {

        private Path output = Paths.get(System.getProperty(OUTPUT_PROPERTY, DEFAULT_OUTPUT));
        private boolean strict = Boolean.getBoolean(STRICT_PROPERTY);
        private int parallelism = jobsProperty();

        private Builder() {
        }

        public Builder output(Path output) {
            this.output = Objects.requireNonNull(output, "output");
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("Parallelism must be at least 1, got " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public TranspilerOptions build() {
            return new TranspilerOptions(this);
        }

        private static int jobsProperty() {
            String value = System.getProperty(JOBS_PROPERTY);
            if (value == null || value.isBlank()) {
                return Runtime.getRuntime().availableProcessors();
            }
            try {
                int jobs = Integer.parseInt(value.trim());
                if (jobs < 1) {
                    throw new IllegalArgumentException(JOBS_PROPERTY + " must be at least 1, got " + value);
                }
                return jobs;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(JOBS_PROPERTY + " is not a number: " + value, e);
            }
        }
    }
}
