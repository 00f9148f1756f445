package dev.fumaz.augment.exception;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Type;

/**
 * Signals that the lookup service could not supply the value of an injection point.
 */
public class UnresolvedDependencyException extends AugmentException {

    private final @NotNull String point;
    private final @NotNull Type key;

    public UnresolvedDependencyException(@NotNull String point, @NotNull Type key, Throwable cause) {
        super("Could not resolve injection point '" + point + "' using service key " + key.getTypeName()
                + (cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage()), cause);
        this.point = point;
        this.key = key;
    }

    public @NotNull String getPoint() {
        return point;
    }

    public @NotNull Type getKey() {
        return key;
    }
}
