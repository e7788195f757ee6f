package im.arun.copybook.exception;

import lombok.Getter;

/**
 * Raised when no lexer rule matches the input at some position.
 */
@Getter
public class TokenizationException extends CopybookException {
    private final int line;
    private final int column;
    private final String preview;

    public TokenizationException(int line, int column, String preview) {
        super(String.format("String at (%d:%d) did not match any rules, token starts with \"%s\"",
            line, column, preview));
        this.line = line;
        this.column = column;
        this.preview = preview;
    }

    public TokenizationException(String message, int line, int column, String preview) {
        super(String.format("%s at (%d:%d), token starts with \"%s\"", message, line, column, preview));
        this.line = line;
        this.column = column;
        this.preview = preview;
    }
}
