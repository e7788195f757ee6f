package im.arun.copybook.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps absolute character offsets to line and column numbers.
 */
public class LineIndex {
    private final int[] lineStarts;
    private final int length;

    public LineIndex(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        this.length = text.length();
    }

    /**
     * Get line and column for the specified offset.
     * Offsets past the end of the text map to the position after the last character.
     */
    public Position positionOf(int offset) {
        int pos = Math.max(0, Math.min(offset, length));

        // Find the last line starting at or before pos
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= pos) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return new Position(low + 1, pos - lineStarts[low] + 1);
    }

    public int getLineCount() {
        return lineStarts.length;
    }
}
