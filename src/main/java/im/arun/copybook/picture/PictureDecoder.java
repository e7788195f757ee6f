package im.arun.copybook.picture;

import im.arun.copybook.exception.TokenizationException;
import im.arun.copybook.lexer.Lexer;
import im.arun.copybook.lexer.Rule;
import im.arun.copybook.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Finite-state decoder for the PICTURE micro-syntax, e.g. {@code X(20)},
 * {@code S9(5)V99} or {@code V9(02)}.
 *
 * <p>Instances are stateless and may be shared between threads.
 */
public class PictureDecoder {
    private static final Logger logger = LoggerFactory.getLogger(PictureDecoder.class);

    enum PictureToken {
        X_RUN,
        NINE_RUN,
        POINT,
        SIGN,
        COUNT,
        EOL
    }

    enum State {
        BEGIN,
        SINGLE_X,
        MULTI_X,
        SINGLE_9,
        MULTI_9,
        WAIT_FIXED_POINT,
        WAIT_EOL
    }

    private static final Lexer<PictureToken> LEXER = Lexer.<PictureToken>builder()
        .addRule(Rule.ofIgnoreCase(PictureToken.X_RUN, "X+"))
        .addRule(Rule.of(PictureToken.NINE_RUN, "9+"))
        .addRule(Rule.ofIgnoreCase(PictureToken.POINT, "V"))
        .addRule(Rule.ofIgnoreCase(PictureToken.SIGN, "S"))
        // at most 9 digits, so a count always fits an int and two counts never overflow one
        .addRule(Rule.of(PictureToken.COUNT, "\\((\\d{1,9})\\)", 1))
        .addRule(Rule.endMarker(PictureToken.EOL))
        .build();

    /**
     * Decode a picture string.
     *
     * @param text picture text without the PIC keyword
     * @return the decoded picture, or empty if the text is not a supported picture
     */
    public Optional<Picture> decode(String text) {
        List<Token<PictureToken>> tokens;
        try {
            tokens = LEXER.tokenize(text);
        } catch (TokenizationException e) {
            logger.debug("Picture '{}' rejected: {}", text, e.getMessage());
            return Optional.empty();
        }

        DecodeState ds = new DecodeState();
        State state = State.BEGIN;

        for (int i = 0; i < tokens.size(); i++) {
            Token<PictureToken> token = tokens.get(i);
            int runLength = token.getText().length();

            switch (state) {
                case BEGIN:
                    if (token.is(PictureToken.X_RUN)) {
                        if (!ds.fixType(PictureType.STRING)) {
                            return reject(text, state, token);
                        }
                        if (runLength == 1) {
                            state = State.SINGLE_X;
                        } else {
                            ds.length = runLength;
                            state = State.WAIT_EOL;
                        }
                    } else if (token.is(PictureToken.NINE_RUN)) {
                        if (!ds.fixType(PictureType.NUMERIC)) {
                            return reject(text, state, token);
                        }
                        if (runLength == 1) {
                            state = State.SINGLE_9;
                        } else {
                            ds.length = runLength;
                            state = State.WAIT_FIXED_POINT;
                        }
                    } else if (token.is(PictureToken.SIGN)) {
                        if (ds.signed || !ds.fixType(PictureType.NUMERIC)) {
                            return reject(text, state, token);
                        }
                        ds.signed = true;
                    } else if (token.is(PictureToken.POINT)) {
                        if (!ds.fixType(PictureType.NUMERIC)) {
                            return reject(text, state, token);
                        }
                        ds.length = 0;
                        ds.pointSeen = true;
                        state = State.WAIT_FIXED_POINT;
                    } else {
                        return reject(text, state, token);
                    }
                    break;

                case SINGLE_X:
                    if (token.is(PictureToken.COUNT)) {
                        ds.length = Integer.parseInt(token.getText());
                        state = State.WAIT_EOL;
                    } else if (token.is(PictureToken.EOL)) {
                        ds.length = 1;
                    } else {
                        return reject(text, state, token);
                    }
                    break;

                case SINGLE_9:
                    if (token.is(PictureToken.COUNT)) {
                        ds.length = Integer.parseInt(token.getText());
                        state = State.WAIT_FIXED_POINT;
                    } else if (token.is(PictureToken.POINT)) {
                        ds.length = 1;
                        ds.pointSeen = true;
                        state = State.WAIT_FIXED_POINT;
                    } else if (token.is(PictureToken.EOL)) {
                        ds.length = 1;
                    } else {
                        return reject(text, state, token);
                    }
                    break;

                case WAIT_FIXED_POINT:
                    if (token.is(PictureToken.POINT) && !ds.pointSeen) {
                        ds.pointSeen = true;
                    } else if (token.is(PictureToken.NINE_RUN)) {
                        Token<PictureToken> next = tokens.get(i + 1);
                        if (runLength == 1 && next.is(PictureToken.COUNT)) {
                            // 9(n) fused into one run
                            ds.scale = Integer.parseInt(next.getText());
                            i++;
                        } else {
                            ds.scale = runLength;
                        }
                        try {
                            ds.length = Math.addExact(ds.length, ds.scale);
                        } catch (ArithmeticException e) {
                            return reject(text, state, token);
                        }
                        state = State.WAIT_EOL;
                    } else if (!token.is(PictureToken.EOL)) {
                        return reject(text, state, token);
                    }
                    break;

                case WAIT_EOL:
                    if (!token.is(PictureToken.EOL)) {
                        return reject(text, state, token);
                    }
                    break;

                default:
                    return reject(text, state, token);
            }
        }

        // BEGIN at end of input means nothing but signs were seen
        if (state == State.BEGIN) {
            logger.debug("Picture '{}' has no data characters", text);
            return Optional.empty();
        }

        return Optional.of(Picture.builder()
            .type(ds.type)
            .length(ds.length)
            .scale(ds.scale)
            .signed(ds.signed)
            .build());
    }

    private Optional<Picture> reject(String text, State state, Token<PictureToken> token) {
        logger.debug("Picture '{}' rejected in state {} at {}", text, state, token);
        return Optional.empty();
    }

    /**
     * Mutable accumulator for a single decode call.
     */
    private static class DecodeState {
        PictureType type;
        int length;
        int scale;
        boolean signed;
        boolean pointSeen;

        boolean fixType(PictureType candidate) {
            if (type == null) {
                type = candidate;
                return true;
            }
            return type == candidate;
        }
    }
}
