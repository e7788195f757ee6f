package im.arun.copybook.service;

import im.arun.copybook.config.CopybookConfig;
import im.arun.copybook.exception.CopybookException;
import im.arun.copybook.model.Node;
import im.arun.copybook.model.NodeTree;
import im.arun.copybook.model.SchemaDocument;
import im.arun.copybook.output.SchemaWriter;
import im.arun.copybook.parser.CopybookParser;
import im.arun.copybook.picture.Picture;
import im.arun.copybook.picture.PictureDecoder;
import im.arun.copybook.source.CopybookLoader;
import im.arun.copybook.tree.TreeBuilder;
import im.arun.copybook.util.JsonLogger;
import im.arun.copybook.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for copybook conversion: load, parse, build the hierarchy and render.
 */
public class CopybookService {
    private static final Logger logger = LoggerFactory.getLogger(CopybookService.class);

    private final CopybookConfig config;
    private final CopybookLoader loader;
    private final CopybookParser parser;
    private final PictureDecoder pictureDecoder;
    private final TreeBuilder treeBuilder;
    private final SchemaWriter schemaWriter;

    public CopybookService(CopybookConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    public CopybookService(CopybookConfig config, Clock clock) {
        this.config = config;
        this.loader = new CopybookLoader(config.isFixedFormat(), config.getTextAreaEnd());
        this.pictureDecoder = new PictureDecoder();
        this.parser = new CopybookParser();
        this.treeBuilder = new TreeBuilder();
        this.schemaWriter = new SchemaWriter(clock, config.isIncludeTimestamp());
    }

    /**
     * Parse copybook text into its entries, in declaration order.
     */
    public List<Node> parseCopybook(String text) {
        return parser.parse(text);
    }

    /**
     * Arrange entries into their record hierarchy.
     */
    public NodeTree buildTree(List<Node> nodes) {
        return treeBuilder.build(nodes);
    }

    public Optional<Picture> decodePicture(String text) {
        return pictureDecoder.decode(text);
    }

    /**
     * Convert copybook text to a schema document, flat or nested per configuration.
     */
    public SchemaDocument convert(String text, String source) {
        JsonLogger jsonLogger = newJsonLogger(source);
        jsonLogger.info("Starting copybook conversion", sourceDetails(source));

        try {
            List<Node> nodes = parseCopybook(text);
            jsonLogger.info("Parsed copybook", Map.of("entries", nodes.size()));

            SchemaDocument document;
            if (config.isNested()) {
                NodeTree tree = buildTree(nodes);
                jsonLogger.info("Built tree", Map.of("depth", TreeUtils.depth(tree)));
                document = schemaWriter.nested(tree, source);
            } else {
                document = schemaWriter.flat(nodes, source);
            }

            jsonLogger.info("Copybook conversion complete");
            return document;
        } catch (CopybookException e) {
            jsonLogger.error("Copybook conversion failed", Map.of("error", e.getMessage()));
            logger.warn("Failed to convert {}: {}", source, e.getMessage());
            throw e;
        }
    }

    /**
     * Load a copybook file and render its schema in the configured format.
     */
    public String processFile(Path path) throws IOException {
        String text = loader.load(path);
        SchemaDocument document = convert(text, path.toString());
        return schemaWriter.write(document, config.getOutputFormat());
    }

    /**
     * Convert several independent copybooks concurrently on a pool sized for this batch:
     * one worker per file, at most {@link #workerLimit()}. The pool is shut down on return.
     *
     * @return rendered schema per input path, in input order
     * @throws IOException if any file cannot be read
     * @throws CopybookException if any copybook fails to convert
     */
    public Map<Path, String> processFiles(List<Path> paths) throws IOException {
        if (paths.isEmpty()) {
            return Map.of();
        }
        int workers = Math.min(paths.size(), workerLimit());
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        logger.debug("Converting {} copybooks on {} workers", paths.size(), workers);
        try {
            return processFiles(paths, executor);
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Convert several independent copybooks on a caller-supplied executor.
     */
    public Map<Path, String> processFiles(List<Path> paths, Executor executor) throws IOException {
        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (Path path : paths) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return processFile(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }, executor));
        }

        Map<Path, String> results = new LinkedHashMap<>();
        for (int i = 0; i < paths.size(); i++) {
            try {
                results.put(paths.get(i), futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof UncheckedIOException) {
                    throw ((UncheckedIOException) cause).getCause();
                }
                if (cause instanceof CopybookException) {
                    throw (CopybookException) cause;
                }
                throw e;
            }
        }

        logger.info("Converted {} copybooks", results.size());
        return results;
    }

    public String render(SchemaDocument document) {
        return schemaWriter.write(document, config.getOutputFormat());
    }

    public CopybookConfig getConfig() {
        return config;
    }

    /**
     * Upper bound on concurrent conversions; a non-positive {@code max_workers} means one per processor.
     */
    int workerLimit() {
        int configured = config.getMaxWorkers();
        return configured > 0 ? configured : Runtime.getRuntime().availableProcessors();
    }

    private JsonLogger newJsonLogger(String source) {
        Path logDirectory = config.getLogDirectory() != null ? Paths.get(config.getLogDirectory()) : null;
        return new JsonLogger(source, logDirectory);
    }

    private static Map<String, Object> sourceDetails(String source) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", source != null ? source : "(text)");
        return details;
    }

    /**
     * Daemon workers named {@code copybook-worker-N}.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "copybook-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
