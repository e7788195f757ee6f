package im.arun.copybook.lexer;

import lombok.Value;

/**
 * A lexical token with its 1-based source position.
 *
 * @param <K> token kind enumeration
 */
@Value
public class Token<K extends Enum<K>> {
    K kind;
    String text;
    int line;
    int column;

    public boolean is(K other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return String.format("(%d:%d) kind=%s, text='%s'", line, column, kind, text);
    }
}
