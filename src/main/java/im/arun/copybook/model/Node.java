package im.arun.copybook.model;

import im.arun.copybook.picture.Picture;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * A single copybook entry, in the order it was declared.
 */
@Value
@Builder(toBuilder = true)
public class Node {
    public static final int CONDITION_LEVEL = 88;

    @NonNull
    String name;

    int level;

    @NonNull
    NodeType type;

    Picture picture;

    /** Name of the item this one redefines; not resolved. */
    String redefines;

    @Builder.Default
    int occurs = 1;

    @Builder.Default
    @NonNull
    UsageType usage = UsageType.NONE;

    @Singular
    List<String> values;

    String indexedBy;

    public Optional<Picture> getPictureOptional() {
        return Optional.ofNullable(picture);
    }

    public boolean isCondition() {
        return level == CONDITION_LEVEL;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Node: level=").append(level).append(", name=").append(name).append(", type=").append(type);
        if (picture != null) {
            sb.append(", picture=").append(picture);
        }
        if (usage != UsageType.NONE) {
            sb.append(", usage=").append(usage);
        }
        if (!values.isEmpty()) {
            sb.append(", values=").append(values);
        }
        return sb.toString();
    }
}
