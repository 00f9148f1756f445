package dev.fumaz.augment.missing;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Handles writes to properties that a decorated type does not declare.
 */
@FunctionalInterface
public interface PropertySetMissingHandler {

    void propertyMissing(@NotNull String name, @Nullable Object value);

}
