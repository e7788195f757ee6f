package im.arun.copybook.lexer;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * A single lexer rule: a regular expression bound to a token kind.
 * Whitespace and comment rules consume input without producing tokens.
 * An end-marker rule has no pattern; it contributes one terminal token.
 *
 * @param <K> token kind enumeration
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Rule<K extends Enum<K>> {
    private final K kind;
    private final Pattern pattern;
    private final int group;
    private final boolean whitespace;
    private final boolean comment;
    private final boolean endMarker;

    public static <K extends Enum<K>> Rule<K> of(K kind, String regex) {
        return of(kind, regex, 0);
    }

    /**
     * Rule whose emitted token text is the given capture group instead of the whole match.
     */
    public static <K extends Enum<K>> Rule<K> of(K kind, String regex, int group) {
        return new Rule<>(kind, Pattern.compile(regex), group, false, false, false);
    }

    public static <K extends Enum<K>> Rule<K> ofIgnoreCase(K kind, String regex) {
        return new Rule<>(kind, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), 0, false, false, false);
    }

    public static <K extends Enum<K>> Rule<K> whitespace(K kind, String regex) {
        return new Rule<>(kind, Pattern.compile(regex), 0, true, false, false);
    }

    public static <K extends Enum<K>> Rule<K> comment(K kind, String regex) {
        return new Rule<>(kind, Pattern.compile(regex), 0, false, true, false);
    }

    public static <K extends Enum<K>> Rule<K> endMarker(K kind) {
        return new Rule<>(kind, null, 0, false, false, true);
    }

    /**
     * True when matches of this rule are consumed silently.
     */
    public boolean isSkipped() {
        return whitespace || comment;
    }

    @Override
    public String toString() {
        return "Rule(" + kind + (pattern != null ? ", /" + pattern.pattern() + "/" : ", <end>") + ")";
    }
}
