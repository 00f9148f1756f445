package dev.fumaz.augment.exception;

/**
 * Base unchecked exception for failures raised by the decoration engine itself.
 * <p>
 * Exceptions thrown by user code reached through dispatch are never wrapped in this type.
 */
public class AugmentException extends RuntimeException {

    public AugmentException(String message) {
        super(message);
    }

    public AugmentException(String message, Throwable cause) {
        super(message, cause);
    }

    public AugmentException(Throwable cause) {
        super(cause);
    }
}
