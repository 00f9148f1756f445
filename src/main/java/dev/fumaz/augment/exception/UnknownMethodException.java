package dev.fumaz.augment.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Signals a call to a method that the decorated type does not declare and that no missing-method hook handled.
 */
public class UnknownMethodException extends AugmentException {

    private final @NotNull String method;
    private final int arity;
    private final @NotNull Class<?> type;

    public UnknownMethodException(@NotNull String method, int arity, @NotNull Class<?> type) {
        super("Could not find method " + method + "() taking " + arity + (arity == 1 ? " argument" : " arguments")
                + " on " + type.getName());
        this.method = method;
        this.arity = arity;
        this.type = type;
    }

    public @NotNull String getMethod() {
        return method;
    }

    public int getArity() {
        return arity;
    }

    public @NotNull Class<?> getType() {
        return type;
    }
}
