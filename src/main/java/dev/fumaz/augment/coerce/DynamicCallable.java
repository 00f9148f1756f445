package dev.fumaz.augment.coerce;

import org.jetbrains.annotations.Nullable;

/**
 * A bare callable: a block of code taking any arguments. Passed where a method declares a capability object,
 * it is adapted to that capability by {@link CallbackCoercion}.
 */
@FunctionalInterface
public interface DynamicCallable {

    @Nullable Object call(Object... arguments);

}
