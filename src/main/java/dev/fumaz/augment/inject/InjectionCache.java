package dev.fumaz.augment.inject;

import dev.fumaz.augment.exception.UnknownServiceException;
import dev.fumaz.augment.exception.UnresolvedDependencyException;
import dev.fumaz.augment.reflection.Reflections;
import dev.fumaz.augment.registry.InjectionPoint;
import dev.fumaz.augment.registry.RegistryEntry;
import dev.fumaz.augment.service.ServiceLookup;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Holds the injected values of one instance. Each point is looked up at most once: settled slots are read without
 * locking, and only the transition out of {@link ResolvedValue.State#UNRESOLVED} happens under that slot's lock, so
 * lookups for different points of one instance never wait on each other.
 */
public final class InjectionCache {

    private static final Logger LOGGER = Logger.getLogger(InjectionCache.class.getName());
    private static final VarHandle SLOTS = MethodHandles.arrayElementVarHandle(ResolvedValue[].class);

    private final @NotNull RegistryEntry entry;
    private final @NotNull ServiceLookup lookup;
    private final ResolvedValue[] slots;
    private final Object[] locks;

    public InjectionCache(@NotNull RegistryEntry entry, @NotNull ServiceLookup lookup) {
        this.entry = Objects.requireNonNull(entry, "entry");
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.slots = new ResolvedValue[entry.getInjectionPoints().size()];
        this.locks = new Object[slots.length];
        Arrays.fill(slots, ResolvedValue.UNRESOLVED);
        Arrays.setAll(locks, index -> new Object());
    }

    public @Nullable Object getInjected(@NotNull InjectionPoint point) {
        int index = indexOf(point);
        ResolvedValue slot = slot(index);

        if (slot.isSettled()) {
            return slot.getValue();
        }

        synchronized (locks[index]) {
            slot = slot(index);

            if (slot.isSettled()) {
                return slot.getValue();
            }

            Object value;

            try {
                value = lookup.get(point.getKey());
            } catch (UnknownServiceException e) {
                throw new UnresolvedDependencyException(point.getPropertyName(), point.getKey(), e);
            }

            if (value == null) {
                throw new UnresolvedDependencyException(point.getPropertyName(), point.getKey(), null);
            }

            SLOTS.setRelease(slots, index, ResolvedValue.resolved(value));
            LOGGER.fine(() -> "Resolved " + point + " of " + entry.getType().getName());

            return value;
        }
    }

    /**
     * Assigns an injection point explicitly. The assigned value wins over any earlier or later lookup.
     */
    public void setInjected(@NotNull InjectionPoint point, @Nullable Object value) {
        int index = indexOf(point);

        if (!point.hasSetter()) {
            throw new IllegalArgumentException("Cannot assign " + point + " of " + entry.getType().getName()
                    + ": it declares no setter");
        }

        Class<?> accepted = Reflections.wrapperType(point.getSetter().getParameterTypes().get(0));

        if (value != null && !accepted.isInstance(value)) {
            throw new IllegalArgumentException("Cannot assign value of type " + value.getClass().getName() + " to "
                    + point + " of " + entry.getType().getName());
        }

        synchronized (locks[index]) {
            SLOTS.setRelease(slots, index, ResolvedValue.explicit(value));
        }
    }

    public @NotNull ResolvedValue getState(@NotNull InjectionPoint point) {
        return slot(indexOf(point));
    }

    private ResolvedValue slot(int index) {
        return (ResolvedValue) SLOTS.getAcquire(slots, index);
    }

    private int indexOf(InjectionPoint point) {
        int index = point.getIndex();

        if (index >= slots.length || entry.getInjectionPoints().get(index) != point) {
            throw new IllegalArgumentException(point + " does not belong to " + entry.getType().getName());
        }

        return index;
    }
}
