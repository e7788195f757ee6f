package im.arun.copybook.exception;

import lombok.Getter;

/**
 * Raised by the copybook parser when a token is not legal in the current state.
 */
@Getter
public class GrammarException extends CopybookException {
    private final String expected;
    private final String actual;
    private final int line;
    private final int column;

    public GrammarException(String expected, String actual, int line, int column) {
        super(String.format("Expected %s, found '%s' at (%d:%d)", expected, actual, line, column));
        this.expected = expected;
        this.actual = actual;
        this.line = line;
        this.column = column;
    }
}
