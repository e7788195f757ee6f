package im.arun.copybook.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates structured processing events for one copybook.
 * When a log directory is given the events are also written there as a JSON array,
 * one file per copybook named {@code <copybook>_<yyyyMMdd_HHmmss>.json}.
 */
public class JsonLogger {
    private static final Logger systemLogger = LoggerFactory.getLogger(JsonLogger.class);

    private final Path logPath;
    private final List<Map<String, Object>> logData = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public JsonLogger(String documentPath) {
        this(documentPath, null);
    }

    public JsonLogger(String documentPath, Path logDirectory) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        if (logDirectory == null) {
            this.logPath = null;
            return;
        }

        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        String logFileName = String.format("%s_%s.json", extractDocumentName(documentPath), timestamp);

        Path resolved = null;
        try {
            Files.createDirectories(logDirectory);
            resolved = logDirectory.resolve(logFileName);
        } catch (IOException e) {
            systemLogger.error("Failed to create log directory {}", logDirectory, e);
        }
        this.logPath = resolved;
    }

    private String extractDocumentName(String documentPath) {
        if (documentPath == null) {
            return "Untitled";
        }

        String filename = Path.of(documentPath).getFileName().toString();

        // Remove extension
        int dotIndex = filename.lastIndexOf('.');
        if (dotIndex > 0) {
            filename = filename.substring(0, dotIndex);
        }
        return filename.replaceAll("[/\\\\]", "-");
    }

    public void info(String message) {
        log("INFO", message, Map.of());
    }

    public void info(String message, Map<String, ?> details) {
        log("INFO", message, details);
    }

    public void error(String message, Map<String, ?> details) {
        log("ERROR", message, details);
    }

    private synchronized void log(String level, String message, Map<String, ?> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level);
        entry.put("message", message);
        entry.putAll(details);
        logData.add(entry);

        if (logPath != null) {
            writeToFile();
        }
    }

    private void writeToFile() {
        try {
            objectMapper.writeValue(logPath.toFile(), logData);
        } catch (IOException e) {
            systemLogger.error("Failed to write log file: {}", logPath, e);
        }
    }

    public synchronized List<Map<String, Object>> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(logData));
    }

    /**
     * Path of the log file, or null when events are only kept in memory.
     */
    public Path getLogPath() {
        return logPath;
    }
}
