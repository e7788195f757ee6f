package im.arun.copybook.exception;

/**
 * Raised when the level numbers of a node list cannot be arranged into a tree.
 */
public class StructureException extends CopybookException {

    public StructureException(String message) {
        super(message);
    }
}
