package dev.fumaz.augment.service;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Supplier;

/**
 * A {@link Provider} supplies the instance registered for a service type.
 *
 * @param <T> the type of the service
 */
@FunctionalInterface
public interface Provider<T> {

    static <T> @NotNull Provider<T> instance(@NotNull T instance) {
        return lookup -> instance;
    }

    static <T> @NotNull Provider<T> singleton(@NotNull Supplier<T> factory) {
        return new SingletonProvider<>(factory);
    }

    @Nullable T provide(@NotNull ServiceLookup lookup);

}
