package dev.fumaz.augment.instance;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Entry point for decorating types.
 */
public final class Decorator {

    private Decorator() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static <T> @NotNull DecoratedTypeFactory<T> decorate(@NotNull Class<T> type) {
        return decorate(type, DecorationOptions.defaults());
    }

    /**
     * Reflects {@code type} eagerly, so that misplaced injection markers surface here rather than on first use.
     *
     * @throws dev.fumaz.augment.exception.RegistrationException if the type's members are declared inconsistently
     */
    public static <T> @NotNull DecoratedTypeFactory<T> decorate(@NotNull Class<T> type,
                                                               @NotNull DecorationOptions options) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(options, "options");
        return new DecoratedTypeFactory<>(type, options);
    }
}
