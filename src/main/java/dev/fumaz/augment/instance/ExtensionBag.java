package dev.fumaz.augment.instance;

import dev.fumaz.augment.exception.UnknownPropertyException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ad-hoc properties attached to one extensible instance, in insertion order.
 */
public final class ExtensionBag {

    private final @NotNull Class<?> owner;
    private final Map<String, Object> values = new LinkedHashMap<>();

    ExtensionBag(@NotNull Class<?> owner) {
        this.owner = owner;
    }

    public synchronized boolean has(@NotNull String name) {
        return values.containsKey(name);
    }

    public synchronized @Nullable Object get(@NotNull String name) {
        if (!values.containsKey(name)) {
            throw new UnknownPropertyException(name, owner);
        }

        return values.get(name);
    }

    public synchronized void set(@NotNull String name, @Nullable Object value) {
        values.put(name, value);
    }

    public synchronized @NotNull Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public synchronized String toString() {
        return "ExtensionBag" + values.keySet();
    }
}
