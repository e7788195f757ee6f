package im.arun.copybook.parser;

import im.arun.copybook.exception.TokenizationException;
import im.arun.copybook.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits copybook text into words, periods and a final EOF token.
 *
 * <p>A word is a maximal run of characters that are neither whitespace nor a period.
 * A word starting with a single or double quote runs to the matching closing quote,
 * so quoted literals may contain blanks and periods.
 */
public class CopybookTokenizer {
    static final String EOF_TEXT = "(eof)";

    public List<Token<CopybookTokenType>> tokenize(String text) {
        List<Token<CopybookTokenType>> tokens = new ArrayList<>();
        int line = 1;
        int col = 1;
        int pos = 0;

        while (pos < text.length()) {
            char c = text.charAt(pos);

            if (c == '\n') {
                line++;
                col = 1;
                pos++;
            } else if (Character.isWhitespace(c)) {
                col++;
                pos++;
            } else if (c == '.') {
                tokens.add(new Token<>(CopybookTokenType.PERIOD, ".", line, col));
                col++;
                pos++;
            } else {
                int start = pos;
                if (isQuote(c)) {
                    int close = text.indexOf(c, pos + 1);
                    int lineEnd = text.indexOf('\n', pos + 1);
                    if (close < 0 || (lineEnd >= 0 && lineEnd < close)) {
                        String preview = text.substring(pos, Math.min(pos + 10, text.length()));
                        throw new TokenizationException("Unterminated literal", line, col, preview);
                    }
                    pos = close + 1;
                }
                while (pos < text.length() && !isDelimiter(text.charAt(pos))) {
                    pos++;
                }
                tokens.add(new Token<>(CopybookTokenType.TEXT, text.substring(start, pos), line, col));
                col += pos - start;
            }
        }

        tokens.add(new Token<>(CopybookTokenType.EOF, EOF_TEXT, line, col));
        return tokens;
    }

    static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    private static boolean isDelimiter(char c) {
        return c == '.' || Character.isWhitespace(c);
    }
}
