package im.arun.copybook.lexer;

import im.arun.copybook.exception.TokenizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Generic longest-match tokenizer driven by an ordered list of {@link Rule}s.
 *
 * <p>At each offset every rule is tried against the remaining input and the longest
 * match wins. Equal-length matches are resolved by registration order, the first
 * registered rule winning. That tie-break is an implementation detail of this engine
 * rather than a property grammars should rely on.
 *
 * <p>A built lexer is immutable and may be shared between threads.
 *
 * @param <K> token kind enumeration
 */
public class Lexer<K extends Enum<K>> {
    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    static final String END_TEXT = "<EOF>";
    private static final int PREVIEW_LENGTH = 10;
    private static final int TRACE_LENGTH = 10;

    private final List<Rule<K>> rules;
    private final Rule<K> endRule;

    private Lexer(List<Rule<K>> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        Rule<K> end = null;
        for (Rule<K> rule : rules) {
            if (rule.isEndMarker()) {
                end = rule;
            }
        }
        this.endRule = end;
    }

    public static <K extends Enum<K>> Builder<K> builder() {
        return new Builder<>();
    }

    public List<Rule<K>> getRules() {
        return rules;
    }

    /**
     * Split text into tokens.
     *
     * @param text input to tokenize
     * @return tokens in source order, followed by the end marker token if one is registered
     * @throws TokenizationException if no rule matches at some position
     */
    public List<Token<K>> tokenize(String text) {
        LineIndex lineIndex = new LineIndex(text);
        List<Token<K>> tokens = new ArrayList<>();
        int pos = 0;

        while (pos < text.length()) {
            Rule<K> bestRule = null;
            Matcher bestMatch = null;
            int bestLength = 0;

            for (Rule<K> rule : rules) {
                if (rule.getPattern() == null) {
                    continue;
                }
                Matcher matcher = rule.getPattern().matcher(text);
                matcher.region(pos, text.length());
                if (matcher.lookingAt()) {
                    int matchLength = matcher.end() - pos;
                    // strictly greater keeps the earlier rule on ties
                    if (matchLength > bestLength) {
                        bestRule = rule;
                        bestMatch = matcher;
                        bestLength = matchLength;
                    }
                }
            }

            Position position = lineIndex.positionOf(pos);
            if (bestRule == null) {
                traceTokens(tokens);
                String preview = text.substring(pos, Math.min(pos + PREVIEW_LENGTH, text.length()));
                throw new TokenizationException(position.getLine(), position.getColumn(), preview);
            }

            if (!bestRule.isSkipped()) {
                tokens.add(new Token<>(bestRule.getKind(), bestMatch.group(bestRule.getGroup()),
                    position.getLine(), position.getColumn()));
            }
            pos += bestLength;
        }

        if (endRule != null) {
            Position position = lineIndex.positionOf(text.length());
            tokens.add(new Token<>(endRule.getKind(), END_TEXT, position.getLine(), position.getColumn()));
        }
        return tokens;
    }

    private void traceTokens(List<Token<K>> tokens) {
        if (!logger.isDebugEnabled() || tokens.isEmpty()) {
            return;
        }
        logger.debug("Token trace (last {} tokens)", TRACE_LENGTH);
        for (int i = tokens.size() - 1; i >= Math.max(0, tokens.size() - TRACE_LENGTH); i--) {
            logger.debug("  {}", tokens.get(i));
        }
    }

    /**
     * Collects rules in registration order.
     */
    public static class Builder<K extends Enum<K>> {
        private final List<Rule<K>> rules = new ArrayList<>();

        public Builder<K> addRule(Rule<K> rule) {
            rules.add(rule);
            return this;
        }

        public Lexer<K> build() {
            return new Lexer<>(rules);
        }
    }
}
