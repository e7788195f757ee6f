package im.arun.copybook.model;

/**
 * Kind of copybook entry.
 */
public enum NodeType {
    /** Group item: no PICTURE, may own children. */
    RECORD,
    /** Elementary item with a PICTURE clause. */
    FIELD,
    /** Level-88 condition name with its values. */
    ENUMERATION
}
