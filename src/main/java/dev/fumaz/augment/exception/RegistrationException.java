package dev.fumaz.augment.exception;

/**
 * Indicates a type that cannot be decorated, detected while building its member registry.
 */
public class RegistrationException extends AugmentException {

    public RegistrationException(String message) {
        super(message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }

    public RegistrationException(Throwable cause) {
        super(cause);
    }
}
