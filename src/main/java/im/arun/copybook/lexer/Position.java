package im.arun.copybook.lexer;

import lombok.Value;

/**
 * 1-based line and column of a character in the source text.
 */
@Value
public class Position {
    int line;
    int column;
}
