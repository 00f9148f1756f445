package dev.fumaz.augment.exception;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Type;

/**
 * Raised by a lookup service when it has no service, or more than one candidate service, for a key.
 */
public class UnknownServiceException extends AugmentException {

    private final @NotNull Type key;

    public UnknownServiceException(@NotNull Type key, @NotNull String message) {
        super(message);
        this.key = key;
    }

    public @NotNull Type getKey() {
        return key;
    }
}
