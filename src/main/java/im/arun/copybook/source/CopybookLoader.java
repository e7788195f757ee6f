package im.arun.copybook.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads copybook sources and strips the fixed-format reference areas.
 *
 * <p>In fixed format, columns 1-6 hold sequence numbers, column 7 is the indicator
 * area and columns 73-80 are ignored. Lines with {@code *} or {@code /} in column 7
 * are comments and become blank lines, so line numbers in later diagnostics still
 * match the file. Other lines keep columns 8-72, preceded by 7 blanks.
 */
public class CopybookLoader {
    private static final Logger logger = LoggerFactory.getLogger(CopybookLoader.class);

    static final int INDICATOR_COLUMN = 7;
    private static final String AREA_A_PADDING = " ".repeat(INDICATOR_COLUMN);

    private final boolean fixedFormat;
    private final int textAreaEnd;

    public CopybookLoader() {
        this(true, 72);
    }

    /**
     * @param fixedFormat strip reference areas; when false the text is used as-is
     * @param textAreaEnd last column of the program text area (normally 72)
     */
    public CopybookLoader(boolean fixedFormat, int textAreaEnd) {
        if (textAreaEnd < INDICATOR_COLUMN) {
            throw new IllegalArgumentException("Text area must end at or after column " + INDICATOR_COLUMN);
        }
        this.fixedFormat = fixedFormat;
        this.textAreaEnd = textAreaEnd;
    }

    /**
     * Load a copybook file.
     *
     * @param path copybook file
     * @return source text ready for parsing
     * @throws IOException if the file cannot be read
     */
    public String load(Path path) throws IOException {
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        String text = preprocess(raw);
        logger.info("Loaded {} ({} lines)", path, text.lines().count());
        return text;
    }

    public String load(InputStream inputStream) throws IOException {
        return preprocess(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8));
    }

    /**
     * Apply column stripping to already loaded text.
     */
    public String preprocess(String raw) {
        if (!fixedFormat) {
            return raw;
        }

        StringBuilder text = new StringBuilder(raw.length());
        for (String line : raw.split("\\r?\\n", -1)) {
            text.append(stripLine(line)).append('\n');
        }

        // split keeps a trailing empty element for a final newline
        if (raw.endsWith("\n")) {
            text.setLength(text.length() - 1);
        }
        return text.toString();
    }

    String stripLine(String line) {
        if (line.length() < INDICATOR_COLUMN) {
            return "";
        }
        char indicator = line.charAt(INDICATOR_COLUMN - 1);
        if (indicator == '*' || indicator == '/') {
            return "";
        }
        String programText = line.substring(INDICATOR_COLUMN, Math.min(line.length(), textAreaEnd));
        return (AREA_A_PADDING + programText).stripTrailing();
    }
}
