package org.pyken;

import org.pyken.diagnostic.Diagnostic;
import org.pyken.diagnostic.DiagnosticKind;
import org.pyken.diagnostic.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One invocation over a file or directory: discovery, per-file translation on a
 * worker pool, artifact writing and the merged report.
 * <p>
 * Every file is handled by exactly one worker, which owns that file's
 * diagnostics. Diagnostics are merged and sorted only after all workers finish.
 */
final class TranspileRun {

    private static final Logger log = LoggerFactory.getLogger(TranspileRun.class);

    private final PyKen pyken;
    private final TranspilerOptions options;

    TranspileRun(PyKen pyken) {
        this.pyken = pyken;
        this.options = pyken.options();
    }

    TranspileReport execute(Path input) {
        if (!Files.exists(input)) {
            throw new IllegalArgumentException("Input path does not exist: " + input);
        }
        Path output = options.output();
        try {
            Files.createDirectories(output);
        } catch (IOException e) {
            throw new ArtifactWriteException(output, e);
        }
        if (!Files.isWritable(output)) {
            throw new ArtifactWriteException(output, new IOException("Output directory is not writable"));
        }

        Path root = Files.isDirectory(input) ? input : input.toAbsolutePath().getParent();
        List<Path> sources = discover(input);
        List<String> names = new ArrayList<>(sources.size());
        for (Path source : sources) {
            names.add(Files.isDirectory(input) ? relativeName(root, source) : source.getFileName().toString());
        }
        Map<String, String> artifacts = OutputPaths.assign(names);
        log.info("Translating {} file(s) from {} into {} with {} worker(s)",
                 sources.size(), input, output, options.parallelism());

        List<FileTranslation> results = new ArrayList<>(sources.size());
        ExecutorService pool = Executors.newFixedThreadPool(options.parallelism(), new WorkerThreadFactory());
        try {
            List<Future<FileTranslation>> futures = new ArrayList<>(sources.size());
            for (int i = 0; i < sources.size(); i++) {
                Path source = sources.get(i);
                String name = names.get(i);
                Path target = output.resolve(artifacts.get(name));
                futures.add(pool.submit(() -> process(source, name, target)));
            }
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), names.get(i)));
            }
        } finally {
            pool.shutdownNow();
        }

        TranspileReport report = TranspileReport.of(results, artifacts);
        log.info("Done: {} file(s), {} artifact(s), {} function(s) emitted, {} excluded, {} fatal, {} warning(s)",
                 report.filesProcessed(), report.artifactsWritten(), report.functionsEmitted(),
                 report.functionsExcluded(), report.fatalCount(), report.warningCount());
        return report;
    }

    private FileTranslation process(Path source, String name, Path target) {
        String text;
        try {
            byte[] bytes = Files.readAllBytes(source);
            text = StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            return withoutArtifact(target, ioError(name, "Source is not valid UTF-8"));
        } catch (IOException e) {
            log.warn("Cannot read {}", source, e);
            return withoutArtifact(target, ioError(name, "Cannot read source: " + e.getMessage()));
        }

        FileTranslation translation = pyken.translate(name, text);
        if (!translation.hasOutput()) {
            return withoutArtifact(target, translation);
        }
        try {
            ArtifactWriter.write(target, translation.output());
            log.debug("Wrote {}", target);
        } catch (ArtifactWriteException e) {
            log.error("Cannot write artifact for {}", name, e);
            return translation.withDiagnostic(Diagnostic.of(DiagnosticKind.IO_ERROR, name, SourceLocation.UNKNOWN,
                                                            null, e.getMessage()));
        }
        return translation;
    }

    /**
     * A file that yields no output must not leave the artifact of an earlier run behind.
     */
    private static FileTranslation withoutArtifact(Path target, FileTranslation translation) {
        try {
            if (ArtifactWriter.remove(target)) {
                log.info("Removed stale artifact {}", target);
            }
        } catch (ArtifactWriteException e) {
            log.error("Cannot remove stale artifact for {}", translation.fileName(), e);
            return translation.withDiagnostic(Diagnostic.of(DiagnosticKind.IO_ERROR, translation.fileName(),
                                                            SourceLocation.UNKNOWN, null, e.getMessage()));
        }
        return translation;
    }

    private static FileTranslation await(Future<FileTranslation> future, String name) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PyKenException("Interrupted while translating " + name, e);
        } catch (ExecutionException e) {
            log.error("Translation of {} failed", name, e.getCause());
            return ioError(name, "Translation failed: " + e.getCause());
        }
    }

    private static FileTranslation ioError(String name, String message) {
        return FileTranslation.failed(name, Diagnostic.of(DiagnosticKind.IO_ERROR, name, SourceLocation.UNKNOWN,
                                                          null, message));
    }

    /**
     * Python sources under {@code input}, sorted by relative path. Hidden
     * directories and {@code __pycache__} are skipped.
     */
    static List<Path> discover(Path input) {
        if (!Files.isDirectory(input)) {
            return List.of(input);
        }
        List<Path> found = new ArrayList<>();
        try {
            Files.walkFileTree(input, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    String name = dir.getFileName() == null ? "" : dir.getFileName().toString();
                    if (!dir.equals(input) && (name.startsWith(".") || name.equals("__pycache__"))) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && file.getFileName().toString().endsWith(".py")) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new PyKenException("Cannot scan " + input, e);
        }
        found.sort((a, b) -> relativeName(input, a).compareTo(relativeName(input, b)));
        return found;
    }

    static String relativeName(Path root, Path source) {
        return root.relativize(source).toString().replace('\\', '/');
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pyken-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
