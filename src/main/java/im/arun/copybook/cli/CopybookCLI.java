package im.arun.copybook.cli;

import im.arun.copybook.config.ConfigLoader;
import im.arun.copybook.config.CopybookConfig;
import im.arun.copybook.config.OutputFormat;
import im.arun.copybook.exception.CopybookException;
import im.arun.copybook.service.CopybookService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for converting copybooks using Picocli.
 */
@Command(
    name = "copybook",
    description = "Convert COBOL copybooks into JSON or YAML record schemas",
    mixinStandardHelpOptions = true,
    version = "copybook 1.0"
)
public class CopybookCLI implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Copybook file(s) to convert")
    private List<Path> files;

    @Option(names = {"--output"}, description = "Output file path (single input only)")
    private Path outputPath;

    @Option(names = {"--output-dir"}, description = "Directory receiving one schema per input")
    private Path outputDir;

    @Option(names = {"--yaml"}, description = "Output YAML instead of JSON")
    private boolean yaml;

    @Option(names = {"--nested"}, description = "Output entries as nested objects instead of a flat list")
    private boolean nested;

    @Option(names = {"--free-format"}, description = "Do not strip fixed-format sequence and indicator columns")
    private boolean freeFormat;

    @Option(names = {"--no-timestamp"}, description = "Omit the generation timestamp")
    private boolean noTimestamp;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (outputPath != null && files.size() > 1) {
            err.println("Error: --output accepts a single input file, use --output-dir for several");
            return 1;
        }
        for (Path file : files) {
            if (!Files.exists(file)) {
                err.println("Error: copybook file not found: " + file);
                return 1;
            }
        }

        CopybookService service = new CopybookService(buildConfig());

        try {
            Map<Path, String> results = files.size() == 1
                ? Map.of(files.get(0), service.processFile(files.get(0)))
                : service.processFiles(files);

            for (Map.Entry<Path, String> result : results.entrySet()) {
                if (outputPath != null) {
                    Files.writeString(outputPath, result.getValue());
                    err.println("Output written to: " + outputPath);
                } else if (outputDir != null) {
                    Path target = outputDir.resolve(schemaFileName(result.getKey(), service.getConfig()));
                    Files.createDirectories(outputDir);
                    Files.writeString(target, result.getValue());
                    err.println("Output written to: " + target);
                } else {
                    out.println(result.getValue());
                }
            }
        } catch (CopybookException e) {
            err.println("Parse Exception: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        out.flush();
        return 0;
    }

    private CopybookConfig buildConfig() {
        Map<String, Object> options = new HashMap<>();
        if (yaml) {
            options.put("output_format", OutputFormat.YAML);
        }
        if (nested) {
            options.put("nested", true);
        }
        if (freeFormat) {
            options.put("fixed_format", false);
        }
        if (noTimestamp) {
            options.put("include_timestamp", false);
        }
        return new ConfigLoader(configPath).load(options);
    }

    static String schemaFileName(Path copybook, CopybookConfig config) {
        String filename = copybook.getFileName().toString();
        int dotIndex = filename.lastIndexOf('.');
        if (dotIndex > 0) {
            filename = filename.substring(0, dotIndex);
        }
        return filename + config.getOutputFormat().getExtension();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CopybookCLI()).execute(args);
        System.exit(exitCode);
    }
}
