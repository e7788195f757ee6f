package im.arun.copybook.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Storage encoding declared with USAGE.
 */
public enum UsageType {
    NONE("none"),
    DISPLAY("display"),
    BINARY("binary"),
    PACKED_DECIMAL("packed");

    private static final Map<String, UsageType> KEYWORDS = Map.of(
        "DISPLAY", DISPLAY,
        "BINARY", BINARY,
        "COMP", BINARY,
        "COMPUTATIONAL", BINARY,
        "COMP-4", BINARY,
        "COMPUTATIONAL-4", BINARY,
        "COMP-3", PACKED_DECIMAL,
        "COMPUTATIONAL-3", PACKED_DECIMAL,
        "PACKED-DECIMAL", PACKED_DECIMAL
    );

    private final String tag;

    UsageType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Look up a USAGE keyword such as {@code COMP-3}. Case-insensitive.
     */
    public static Optional<UsageType> fromKeyword(String keyword) {
        return Optional.ofNullable(KEYWORDS.get(keyword.toUpperCase(Locale.ROOT)));
    }

    public static Optional<UsageType> fromTag(String tag) {
        for (UsageType usage : values()) {
            if (usage.tag.equals(tag)) {
                return Optional.of(usage);
            }
        }
        return Optional.empty();
    }
}
