package im.arun.copybook.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testBundledDefaults() {
        CopybookConfig config = new ConfigLoader().load();

        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(config.isNested()).isFalse();
        assertThat(config.isFixedFormat()).isTrue();
        assertThat(config.getTextAreaEnd()).isEqualTo(72);
        assertThat(config.isIncludeTimestamp()).isTrue();
        assertThat(config.getLogDirectory()).isNull();
        assertThat(config.getMaxWorkers()).isZero();
    }

    @Test
    void testFileOverridesBundledDefaults() throws IOException {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, "output_format: yaml\nnested: true\ntext_area_end: 80\n");

        CopybookConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.YAML);
        assertThat(config.isNested()).isTrue();
        assertThat(config.getTextAreaEnd()).isEqualTo(80);
        assertThat(config.isFixedFormat()).isTrue();
    }

    @Test
    void testMissingFileFallsBackToDefaults() {
        CopybookConfig config = new ConfigLoader(tempDir.resolve("absent.yaml").toString()).load();

        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
    }

    @Test
    void testUserOptionsMerge() {
        ConfigLoader loader = new ConfigLoader();

        CopybookConfig config = loader.load(Map.of(
            "outputFormat", "yaml",
            "nested", "yes",
            "fixed_format", false,
            "textAreaEnd", 60,
            "include_timestamp", "no",
            "max_workers", 3,
            "unknown_key", 1));

        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.YAML);
        assertThat(config.isNested()).isTrue();
        assertThat(config.isFixedFormat()).isFalse();
        assertThat(config.getTextAreaEnd()).isEqualTo(60);
        assertThat(config.isIncludeTimestamp()).isFalse();
        assertThat(config.getMaxWorkers()).isEqualTo(3);

        // defaults are not touched by a previous merge
        assertThat(loader.load().isNested()).isFalse();
    }

    @Test
    void testInvalidFormatIsIgnored() {
        CopybookConfig config = new ConfigLoader().load(Map.of("output_format", "xml"));

        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
    }
}
