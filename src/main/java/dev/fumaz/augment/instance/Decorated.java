package dev.fumaz.augment.instance;

import dev.fumaz.augment.missing.MethodMissingHandler;
import dev.fumaz.augment.missing.PropertyGetMissingHandler;
import dev.fumaz.augment.missing.PropertySetMissingHandler;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A decorated instance: the typed object together with the dispatch surface that routes calls on it through
 * overload resolution, callback coercion, injection and the missing-member protocol.
 *
 * @param <T> the decorated type
 */
public interface Decorated<T> extends DynamicObject {

    /**
     * The typed object, an instance of a generated subclass of the decorated type whose calls go through this
     * dispatch surface.
     */
    @NotNull T getTarget();

    @NotNull Class<T> getType();

    void setOnMethodMissing(@Nullable MethodMissingHandler handler);

    void setOnPropertyMissingGet(@Nullable PropertyGetMissingHandler handler);

    void setOnPropertyMissingSet(@Nullable PropertySetMissingHandler handler);

}
