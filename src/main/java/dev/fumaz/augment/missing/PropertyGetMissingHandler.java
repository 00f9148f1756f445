package dev.fumaz.augment.missing;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Handles reads of properties that a decorated type does not declare.
 */
@FunctionalInterface
public interface PropertyGetMissingHandler {

    @Nullable Object propertyMissing(@NotNull String name);

}
