package dev.fumaz.augment.reflection;

import dev.fumaz.augment.exception.AugmentException;

public class ReflectionException extends AugmentException {

    public ReflectionException(String message) {
        super(message);
    }

    public ReflectionException(String message, Throwable cause) {
        super(message, cause);
    }

}
