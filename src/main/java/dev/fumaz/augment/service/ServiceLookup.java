package dev.fumaz.augment.service;

import dev.fumaz.augment.exception.UnknownServiceException;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Type;

/**
 * Supplies the values of injection points.
 */
@FunctionalInterface
public interface ServiceLookup {

    static @NotNull ServiceLookup empty() {
        return key -> {
            throw new UnknownServiceException(key, "No service of type " + key.getTypeName() + " available");
        };
    }

    /**
     * Looks up the service registered for {@code serviceType}.
     *
     * @throws UnknownServiceException if no service, or more than one candidate service, matches the key
     */
    @NotNull Object get(@NotNull Type serviceType) throws UnknownServiceException;

}
