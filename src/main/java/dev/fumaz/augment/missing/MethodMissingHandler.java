package dev.fumaz.augment.missing;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Handles calls to methods that a decorated type does not declare.
 */
@FunctionalInterface
public interface MethodMissingHandler {

    @Nullable Object methodMissing(@NotNull String name, @NotNull Object[] arguments);

}
