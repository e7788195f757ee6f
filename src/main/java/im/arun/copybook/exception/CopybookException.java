package im.arun.copybook.exception;

/**
 * Base class for every failure raised while converting a copybook.
 * All failures are fatal to the current conversion; no partial output is kept.
 */
public class CopybookException extends RuntimeException {

    public CopybookException(String message) {
        super(message);
    }

    public CopybookException(String message, Throwable cause) {
        super(message, cause);
    }
}
