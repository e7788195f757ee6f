package im.arun.copybook.picture;

import lombok.Builder;
import lombok.Value;

/**
 * Decoded PICTURE clause: data category, total digit/character count,
 * implied decimal places and sign.
 */
@Value
@Builder(toBuilder = true)
public class Picture {
    PictureType type;
    int length;
    int scale;
    boolean signed;

    /** Literal from a VALUE clause on the same item, or null. */
    String defaultValue;

    public Picture withDefaultValue(String value) {
        return toBuilder().defaultValue(value).build();
    }

    public boolean isNumeric() {
        return type == PictureType.NUMERIC;
    }
}
