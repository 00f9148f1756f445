package dev.fumaz.augment.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Signals access to a property that is neither declared, nor held by the extension bag, nor handled by a hook.
 */
public class UnknownPropertyException extends AugmentException {

    private final @NotNull String property;
    private final @NotNull Class<?> type;

    public UnknownPropertyException(@NotNull String property, @NotNull Class<?> type) {
        super("Could not find property '" + property + "' on " + type.getName());
        this.property = property;
        this.type = type;
    }

    public @NotNull String getProperty() {
        return property;
    }

    public @NotNull Class<?> getType() {
        return type;
    }
}
