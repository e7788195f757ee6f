package im.arun.copybook.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.copybook.config.CopybookConfig;
import im.arun.copybook.config.OutputFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CopybookCLITest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new CopybookCLI());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path copybook(String name, String text) throws IOException {
        return Files.writeString(tempDir.resolve(name), text);
    }

    @Test
    void testPrintsSchemaToStdout() throws IOException {
        Path file = copybook("rec.cpy", "01 REC.\n   05 A PIC X(4).\n");

        int exitCode = run("--free-format", "--no-timestamp", file.toString());

        assertThat(exitCode).isZero();
        JsonNode json = mapper.readTree(out.toString());
        assertThat(json.has("timestamp")).isFalse();
        assertThat(json.get("nodes").get(1).get("A").get("length").asInt()).isEqualTo(4);
    }

    @Test
    void testFixedFormatByDefault() throws IOException {
        Path file = copybook("rec.cpy", "000100 01  REC.\n000200     05  A PIC 9(3).\n");

        assertThat(run(file.toString())).isZero();
        assertThat(mapper.readTree(out.toString()).get("nodes")).hasSize(2);
    }

    @Test
    void testWritesOutputFile() throws IOException {
        Path file = copybook("rec.cpy", "01 REC PIC X.");
        Path target = tempDir.resolve("rec.out.json");

        int exitCode = run("--free-format", "--output", target.toString(), file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEmpty();
        assertThat(mapper.readTree(target.toFile()).get("nodes").get(0).has("REC")).isTrue();
        assertThat(err.toString()).contains("Output written to");
    }

    @Test
    void testWritesOneSchemaPerInputToDirectory() throws IOException {
        Path first = copybook("first.cpy", "01 FIRST PIC X.");
        Path second = copybook("second.cpy", "01 SECOND PIC 9.");
        Path outDir = tempDir.resolve("schemas");

        int exitCode = run("--free-format", "--yaml", "--nested", "--output-dir", outDir.toString(),
            first.toString(), second.toString());

        assertThat(exitCode).isZero();
        assertThat(outDir.resolve("first.yaml")).exists();
        assertThat(Files.readString(outDir.resolve("second.yaml"))).contains("SECOND").contains("Root");
    }

    @Test
    void testOutputRequiresSingleInput() throws IOException {
        Path first = copybook("first.cpy", "01 FIRST PIC X.");
        Path second = copybook("second.cpy", "01 SECOND PIC X.");

        int exitCode = run("--output", tempDir.resolve("out.json").toString(), first.toString(), second.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("--output-dir");
    }

    @Test
    void testMissingFile() {
        int exitCode = run(tempDir.resolve("absent.cpy").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("not found");
    }

    @Test
    void testParseErrorIsReported() throws IOException {
        Path file = copybook("bad.cpy", "01 REC PIC Q(3).");

        int exitCode = run("--free-format", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Parse Exception:").contains("PICTURE definition");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testConfigFileIsApplied() throws IOException {
        Path file = copybook("rec.cpy", "01 REC PIC X.");
        Path config = Files.writeString(tempDir.resolve("cfg.yaml"),
            "fixed_format: false\noutput_format: yaml\ninclude_timestamp: false\n");

        int exitCode = run("--config", config.toString(), file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("nodes:").doesNotContain("timestamp");
    }

    @Test
    void testSchemaFileName() {
        CopybookConfig config = new CopybookConfig();
        assertThat(CopybookCLI.schemaFileName(Path.of("dir", "cust.cpy"), config)).isEqualTo("cust.json");

        config.setOutputFormat(OutputFormat.YAML);
        assertThat(CopybookCLI.schemaFileName(Path.of("noext"), config)).isEqualTo("noext.yaml");
    }
}
