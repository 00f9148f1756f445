package dev.fumaz.augment.service;

import dev.fumaz.augment.exception.UnknownServiceException;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * A {@link ServiceLookup} backed by explicitly registered services.
 * <p>
 * A key is matched against the exact registered type first, then against every registered type assignable to it.
 * More than one assignable candidate is reported as ambiguous.
 */
public final class DefaultServiceRegistry implements ServiceLookup {

    private final Map<Class<?>, Provider<?>> byType = new ConcurrentHashMap<>();
    private final List<Class<?>> insertionOrder = new CopyOnWriteArrayList<>();

    public <T> @NotNull DefaultServiceRegistry add(@NotNull Class<T> type, @NotNull T instance) {
        Objects.requireNonNull(instance, "instance");
        return addProvider(type, Provider.instance(instance));
    }

    public <T> @NotNull DefaultServiceRegistry addProvider(@NotNull Class<T> type, @NotNull Provider<? extends T> provider) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(provider, "provider");

        if (byType.putIfAbsent(type, provider) != null) {
            throw new IllegalArgumentException("A service of type " + type.getName() + " is already registered");
        }

        insertionOrder.add(type);
        return this;
    }

    @Override
    public @NotNull Object get(@NotNull Type serviceType) {
        Class<?> raw = rawType(serviceType);
        Provider<?> exact = byType.get(raw);

        if (exact != null) {
            return provide(serviceType, exact);
        }

        List<Class<?>> candidates = new ArrayList<>();

        for (Class<?> registered : insertionOrder) {
            if (raw.isAssignableFrom(registered)) {
                candidates.add(registered);
            }
        }

        if (candidates.isEmpty()) {
            throw new UnknownServiceException(serviceType, "No service of type " + serviceType.getTypeName()
                    + " available");
        }

        if (candidates.size() > 1) {
            throw new UnknownServiceException(serviceType, "Multiple services of type " + serviceType.getTypeName()
                    + " available: " + candidates.stream().map(Class::getName).collect(Collectors.joining(", ")));
        }

        return provide(serviceType, byType.get(candidates.get(0)));
    }

    private Object provide(Type serviceType, Provider<?> provider) {
        Object value = provider.provide(this);

        if (value == null) {
            throw new UnknownServiceException(serviceType, "Provider for " + serviceType.getTypeName()
                    + " produced null");
        }

        return value;
    }

    private static Class<?> rawType(Type type) {
        if (type instanceof Class<?>) {
            return (Class<?>) type;
        }

        if (type instanceof ParameterizedType) {
            return rawType(((ParameterizedType) type).getRawType());
        }

        throw new IllegalArgumentException("Cannot look up services of type " + type.getTypeName());
    }
}
