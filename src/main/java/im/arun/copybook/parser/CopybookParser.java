package im.arun.copybook.parser;

import im.arun.copybook.exception.CopybookException;
import im.arun.copybook.exception.GrammarException;
import im.arun.copybook.lexer.Token;
import im.arun.copybook.model.Node;
import im.arun.copybook.model.UsageType;
import im.arun.copybook.picture.Picture;
import im.arun.copybook.picture.PictureDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses copybook text into the flat list of entries it declares, in source order.
 *
 * <p>The grammar is driven by an explicit {@link ParseState} machine. Every entry is a
 * level number, a name, any number of clauses and a terminating period:
 * <pre>
 *   01 CUSTOMER-REC.
 *      05 CUST-ID      PIC 9(8) USAGE COMP-3.
 *      05 CUST-STATUS  PIC X.
 *         88 ACTIVE    VALUE 'A' 'R'.
 * </pre>
 *
 * <p>Parsers hold no state between calls and may be shared between threads.
 */
public class CopybookParser {
    private static final Logger logger = LoggerFactory.getLogger(CopybookParser.class);

    private static final Pattern INTEGER = Pattern.compile("\\d+");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_\\-]+");

    private static final int MIN_LEVEL = 1;
    private static final int MAX_LEVEL = 99;

    private final CopybookTokenizer tokenizer;
    private final PictureDecoder pictureDecoder;

    public CopybookParser() {
        this(new CopybookTokenizer(), new PictureDecoder());
    }

    public CopybookParser(CopybookTokenizer tokenizer, PictureDecoder pictureDecoder) {
        this.tokenizer = tokenizer;
        this.pictureDecoder = pictureDecoder;
    }

    /**
     * Parse copybook text.
     *
     * @param text copybook source with sequence and indicator areas already blanked
     * @return unmodifiable list of entries in declaration order
     * @throws CopybookException on the first tokenization or grammar error
     */
    public List<Node> parse(String text) {
        ParseContext ctx = new ParseContext(tokenizer.tokenize(text));

        while (ctx.hasMore()) {
            Token<CopybookTokenType> token = ctx.token();
            String upper = token.getText().toUpperCase(Locale.ROOT);

            switch (ctx.state) {
                case START:
                    if (token.is(CopybookTokenType.EOF)) {
                        return Collections.unmodifiableList(ctx.getOutput());
                    }
                    if ("EJECT".equals(upper)) {
                        break;
                    }
                    ctx.level = parseLevel(token);
                    ctx.state = ParseState.SENTENCE;
                    break;

                case SENTENCE:
                    if (!token.is(CopybookTokenType.TEXT) || !IDENTIFIER.matcher(token.getText()).matches()) {
                        throw error("identifier", token);
                    }
                    ctx.startNode(token.getText());
                    ctx.state = ParseState.CLAUSE;
                    break;

                case CLAUSE:
                    ctx.state = clause(ctx, token, upper);
                    break;

                case REDEFINES:
                    requireText("REDEFINES target", token);
                    ctx.redefines = token.getText();
                    ctx.state = ParseState.CLAUSE;
                    break;

                case OCCURS:
                    if (!isInteger(token)) {
                        throw error("occurs count", token);
                    }
                    ctx.occurs = Integer.parseInt(token.getText());
                    if (ctx.occurs < 1) {
                        throw error("occurs count of at least 1", token);
                    }
                    if ("TIMES".equalsIgnoreCase(ctx.peek().getText())) {
                        ctx.advance();
                    }
                    ctx.state = ParseState.CLAUSE;
                    break;

                case PICTURE:
                    if ("IS".equals(upper)) {
                        break;
                    }
                    requireText("PICTURE definition", token);
                    Optional<Picture> picture = pictureDecoder.decode(upper);
                    if (picture.isEmpty()) {
                        throw error("PICTURE definition", token);
                    }
                    ctx.picture = picture.get();
                    ctx.state = ParseState.CLAUSE;
                    break;

                case VALUE:
                    if ("IS".equals(upper) || "ARE".equals(upper)) {
                        break;
                    }
                    ctx.state = value(ctx, token);
                    break;

                case USAGE:
                    if ("IS".equals(upper)) {
                        break;
                    }
                    ctx.usage = UsageType.fromKeyword(upper)
                        .orElseThrow(() -> error("USAGE type", token));
                    ctx.state = ParseState.CLAUSE;
                    break;

                case ENUM:
                    requireText("condition value", token);
                    ctx.values.add(literal(token));
                    ctx.state = nextAfterLiteral(ctx);
                    break;

                case INDEXED:
                    if ("BY".equals(upper)) {
                        break;
                    }
                    requireText("index name", token);
                    ctx.indexedBy = token.getText();
                    ctx.state = ParseState.CLAUSE;
                    break;

                default:
                    throw new CopybookException("Unhandled state: " + ctx.state);
            }
            ctx.advance();
        }

        return Collections.unmodifiableList(ctx.getOutput());
    }

    private ParseState clause(ParseContext ctx, Token<CopybookTokenType> token, String upper) {
        if (token.is(CopybookTokenType.PERIOD)) {
            Node node = ctx.finishNode();
            logger.debug("Parsed {}", node);
            return ParseState.START;
        }
        if (!token.is(CopybookTokenType.TEXT)) {
            throw error("clause or period", token);
        }

        switch (upper) {
            case "REDEFINES":
                return ParseState.REDEFINES;
            case "OCCURS":
                return ParseState.OCCURS;
            case "PIC":
            case "PICTURE":
                return ParseState.PICTURE;
            case "VALUE":
            case "VALUES":
                return ParseState.VALUE;
            case "USAGE":
                return ParseState.USAGE;
            case "INDEXED":
                return ParseState.INDEXED;
            default:
                Optional<UsageType> usage = UsageType.fromKeyword(upper);
                if (usage.isPresent()) {
                    ctx.usage = usage.get();
                    return ParseState.CLAUSE;
                }
                throw error("clause", token);
        }
    }

    private ParseState value(ParseContext ctx, Token<CopybookTokenType> token) {
        requireText("literal", token);
        String literal = literal(token);

        if (ctx.picture != null) {
            ctx.picture = ctx.picture.withDefaultValue(literal);
            return ParseState.CLAUSE;
        }
        if (ctx.level != Node.CONDITION_LEVEL) {
            throw new GrammarException("PICTURE before VALUE", token.getText(), token.getLine(), token.getColumn());
        }
        ctx.values.clear();
        ctx.values.add(literal);
        return nextAfterLiteral(ctx);
    }

    /**
     * Condition values continue until the next token is the terminating period.
     */
    private ParseState nextAfterLiteral(ParseContext ctx) {
        return ctx.peek().is(CopybookTokenType.PERIOD) ? ParseState.CLAUSE : ParseState.ENUM;
    }

    private int parseLevel(Token<CopybookTokenType> token) {
        if (!isInteger(token)) {
            throw error("level number", token);
        }
        int level = Integer.parseInt(token.getText());
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw error("level number between 01 and 99", token);
        }
        return level;
    }

    private static boolean isInteger(Token<CopybookTokenType> token) {
        return token.is(CopybookTokenType.TEXT)
            && token.getText().length() <= 9
            && INTEGER.matcher(token.getText()).matches();
    }

    private static void requireText(String expected, Token<CopybookTokenType> token) {
        if (!token.is(CopybookTokenType.TEXT)) {
            throw error(expected, token);
        }
    }

    /**
     * Strip the quotes of a quoted literal; anything else is returned as written.
     */
    static String literal(Token<CopybookTokenType> token) {
        String text = token.getText();
        if (text.length() >= 2 && CopybookTokenizer.isQuote(text.charAt(0))
            && text.charAt(text.length() - 1) == text.charAt(0)) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    private static GrammarException error(String expected, Token<CopybookTokenType> token) {
        return new GrammarException(expected, token.getText(), token.getLine(), token.getColumn());
    }
}
