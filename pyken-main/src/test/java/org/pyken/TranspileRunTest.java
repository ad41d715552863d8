package org.pyken;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pyken.diagnostic.Diagnostic;
import org.pyken.diagnostic.DiagnosticKind;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranspileRunTest {

    private static final String ALWAYS_SUCCEED = """
            @spend
            def always_succeed(datum, redeemer, context) -> bool:
                return True
            """;

    private static final String HELPER = """
            def double(x: int) -> int:
                return x * 2
            """;

    @TempDir
    Path temp;

    private Path source(String relative, String content) throws IOException {
        Path file = temp.resolve("src").resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private PyKen pyken(int jobs) {
        return new PyKen(TranspilerOptions.builder().output(temp.resolve("out")).parallelism(jobs).build());
    }

    // ── Discovery ────────────────────────────────────────────────────────

    @Test
    void discoverySkipsHiddenAndCacheDirectories() throws IOException {
        source("b.py", HELPER);
        source("PyModule 102/Always-Succeed.py", ALWAYS_SUCCEED);
        source(".venv/lib.py", HELPER);
        source("__pycache__/cached.py", HELPER);
        source("notes.txt", "not python");

        List<Path> found = TranspileRun.discover(temp.resolve("src"));

        assertThat(found).extracting(p -> TranspileRun.relativeName(temp.resolve("src"), p))
                         .containsExactly("PyModule 102/Always-Succeed.py", "b.py");
    }

    // ── Runs ─────────────────────────────────────────────────────────────

    @Test
    void directoryRunWritesOneArtifactPerFile() throws IOException {
        source("b.py", HELPER);
        source("PyModule 102/Always-Succeed.py", ALWAYS_SUCCEED);

        TranspileReport report = pyken(2).run(temp.resolve("src"));

        assertThat(report.files()).extracting(TranspileReport.FileResult::artifact)
                                  .containsExactly("pymodule_102/always_succeed.ak", "b.ak");
        assertThat(report.exitCode()).isZero();
        assertThat(report.functionsEmitted()).isEqualTo(2);

        String written = Files.readString(temp.resolve("out/pymodule_102/always_succeed.ak"));
        assertThat(written).startsWith("// Generated by pyken from PyModule 102/Always-Succeed.py. Do not edit.\n")
                           .contains("validator always_succeed {");
        assertThat(Files.readString(temp.resolve("out/b.ak"))).contains("fn double(x: Int) -> Int {");
    }

    @Test
    void collidingArtifactNamesAreSuffixed() throws IOException {
        source("A-b.py", HELPER);
        source("a_b.py", HELPER);

        TranspileReport report = pyken(1).run(temp.resolve("src"));

        assertThat(report.files()).extracting(TranspileReport.FileResult::file)
                                  .containsExactly("A-b.py", "a_b.py");
        assertThat(report.files()).extracting(TranspileReport.FileResult::artifact)
                                  .containsExactly("a_b.ak", "a_b_1.ak");
        assertThat(temp.resolve("out/a_b.ak")).exists();
        assertThat(temp.resolve("out/a_b_1.ak")).exists();
    }

    @Test
    void singleFileInput() throws IOException {
        Path file = source("nested/Lock.py", ALWAYS_SUCCEED);

        TranspileReport report = pyken(1).run(file);

        assertThat(report.files()).singleElement().satisfies(f -> {
            assertThat(f.file()).isEqualTo("Lock.py");
            assertThat(f.artifact()).isEqualTo("lock.ak");
            assertThat(f.emitted()).containsExactly("always_succeed");
        });
        assertThat(temp.resolve("out/lock.ak")).exists();
    }

    @Test
    void noTemporaryFilesAreLeftBehind() throws IOException {
        source("a.py", HELPER);
        source("sub/c.py", HELPER);

        pyken(4).run(temp.resolve("src"));

        try (Stream<Path> files = Files.walk(temp.resolve("out"))) {
            assertThat(files.filter(Files::isRegularFile).map(p -> p.getFileName().toString()))
                    .containsExactlyInAnyOrder("a.ak", "c.ak");
        }
    }

    @Test
    void fatalDiagnosticsSetExitCodeAndAreSorted() throws IOException {
        source("z.py", "def broken(:\n");
        source("a.py", """
                def ok() -> int:
                    return 1


                def bad(xs: list) -> int:
                    for x in xs:
                        return x
                    return 0
                """);

        TranspileReport report = pyken(2).run(temp.resolve("src"));

        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.diagnostics()).extracting(Diagnostic::file).containsExactly("a.py", "z.py");
        assertThat(report.diagnostics()).extracting(Diagnostic::kind)
                                        .containsExactly(DiagnosticKind.UNSUPPORTED_CONSTRUCT,
                                                         DiagnosticKind.PARSE_ERROR);
        assertThat(report.files()).extracting(TranspileReport.FileResult::artifact).containsExactly("a.ak", null);
        assertThat(temp.resolve("out/z.ak")).doesNotExist();
    }

    @Test
    void fileWithoutOutputRemovesTheArtifactOfAnEarlierRun() throws IOException {
        source("v.py", """
                def ok(a: int) -> bool:
                    return a > 0
                """);
        pyken(1).run(temp.resolve("src"));
        assertThat(temp.resolve("out/v.ak")).exists();

        source("v.py", """
                def ok(xs: list) -> bool:
                    for x in xs:
                        return True
                    return False
                """);
        TranspileReport report = pyken(1).run(temp.resolve("src"));

        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.artifactsWritten()).isZero();
        assertThat(temp.resolve("out/v.ak")).doesNotExist();
    }

    @Test
    void invalidUtf8IsAnIoError() throws IOException {
        Path file = temp.resolve("src/latin.py");
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[] {'x', ' ', '=', ' ', '"', (byte) 0xE9, '"', '\n'});

        TranspileReport report = pyken(1).run(temp.resolve("src"));

        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.IO_ERROR);
            assertThat(d.file()).isEqualTo("latin.py");
            assertThat(d.message()).isEqualTo("Source is not valid UTF-8");
        });
        assertThat(temp.resolve("out/latin.ak")).doesNotExist();
    }

    @Test
    void missingInputIsRejected() {
        assertThatThrownBy(() -> pyken(1).run(temp.resolve("missing")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void reportSerialisesToJson() throws IOException {
        source("a.py", HELPER);

        TranspileReport report = pyken(1).run(temp.resolve("src"));
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        assertThat(json.path("summary").path("files").asInt()).isEqualTo(1);
        assertThat(json.path("summary").path("exitCode").asInt()).isZero();
        assertThat(json.path("files").get(0).path("artifact").asText()).isEqualTo("a.ak");
        assertThat(json.path("files").get(0).path("emitted").get(0).asText()).isEqualTo("double");
        assertThat(json.path("diagnostics").size()).isZero();
    }
}
