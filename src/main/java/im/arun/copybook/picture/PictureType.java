package im.arun.copybook.picture;

/**
 * Data category described by a PICTURE clause.
 */
public enum PictureType {
    STRING("string"),
    NUMERIC("numeric");

    private final String tag;

    PictureType(String tag) {
        this.tag = tag;
    }

    /**
     * Name used in emitted schemas.
     */
    public String getTag() {
        return tag;
    }

    public static PictureType fromTag(String tag) {
        for (PictureType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown picture type: " + tag);
    }
}
