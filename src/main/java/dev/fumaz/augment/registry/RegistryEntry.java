package dev.fumaz.augment.registry;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The reflected view of one type: its methods grouped by name, its properties and its injection points.
 * Built once per type by {@link MemberRegistry} and never mutated afterwards.
 */
public final class RegistryEntry {

    private final @NotNull Class<?> type;
    private final @NotNull Map<String, List<MemberDescriptor>> methods;
    private final @NotNull Map<String, PropertyDescriptor> properties;
    private final @NotNull List<InjectionPoint> injectionPoints;
    private final @NotNull Map<String, InjectionPoint> injectionPointsByProperty;
    private final @NotNull Map<String, InjectionPoint> injectionPointsByGetter;
    private final @NotNull Map<String, InjectionPoint> injectionPointsBySetter;
    private final boolean nonExtensible;
    private final @Nullable MemberDescriptor servicesAccessor;
    private final @Nullable MemberDescriptor methodMissing;
    private final @Nullable MemberDescriptor propertyMissingGet;
    private final @Nullable MemberDescriptor propertyMissingSet;

    RegistryEntry(@NotNull Class<?> type,
                  @NotNull Map<String, List<MemberDescriptor>> methods,
                  @NotNull Map<String, PropertyDescriptor> properties,
                  @NotNull List<InjectionPoint> injectionPoints,
                  boolean nonExtensible,
                  @Nullable MemberDescriptor servicesAccessor,
                  @Nullable MemberDescriptor methodMissing,
                  @Nullable MemberDescriptor propertyMissingGet,
                  @Nullable MemberDescriptor propertyMissingSet) {
        this.type = type;
        this.methods = Collections.unmodifiableMap(methods);
        this.properties = Collections.unmodifiableMap(properties);
        this.injectionPoints = List.copyOf(injectionPoints);
        this.nonExtensible = nonExtensible;
        this.servicesAccessor = servicesAccessor;
        this.methodMissing = methodMissing;
        this.propertyMissingGet = propertyMissingGet;
        this.propertyMissingSet = propertyMissingSet;

        Map<String, InjectionPoint> byProperty = new HashMap<>();
        Map<String, InjectionPoint> byGetter = new HashMap<>();
        Map<String, InjectionPoint> bySetter = new HashMap<>();

        for (InjectionPoint point : injectionPoints) {
            byProperty.put(point.getPropertyName(), point);
            byGetter.put(point.getGetter().getName(), point);

            if (point.getSetter() != null) {
                bySetter.put(point.getSetter().getName(), point);
            }
        }

        this.injectionPointsByProperty = Collections.unmodifiableMap(byProperty);
        this.injectionPointsByGetter = Collections.unmodifiableMap(byGetter);
        this.injectionPointsBySetter = Collections.unmodifiableMap(bySetter);
    }

    public @NotNull Class<?> getType() {
        return type;
    }

    public @NotNull List<MemberDescriptor> getMethods(@NotNull String name) {
        return methods.getOrDefault(name, Collections.emptyList());
    }

    public @NotNull Map<String, List<MemberDescriptor>> getMethods() {
        return methods;
    }

    public @Nullable PropertyDescriptor getProperty(@NotNull String name) {
        return properties.get(name);
    }

    public @NotNull Map<String, PropertyDescriptor> getProperties() {
        return properties;
    }

    public @NotNull List<InjectionPoint> getInjectionPoints() {
        return injectionPoints;
    }

    public @Nullable InjectionPoint getInjectionPoint(@NotNull String propertyName) {
        return injectionPointsByProperty.get(propertyName);
    }

    public @Nullable InjectionPoint findInjectionGetter(@NotNull String methodName) {
        return injectionPointsByGetter.get(methodName);
    }

    public @Nullable InjectionPoint findInjectionSetter(@NotNull String methodName) {
        return injectionPointsBySetter.get(methodName);
    }

    public boolean isNonExtensible() {
        return nonExtensible;
    }

    public @Nullable MemberDescriptor getServicesAccessor() {
        return servicesAccessor;
    }

    public @Nullable MemberDescriptor getMethodMissing() {
        return methodMissing;
    }

    public @Nullable MemberDescriptor getPropertyMissingGet() {
        return propertyMissingGet;
    }

    public @Nullable MemberDescriptor getPropertyMissingSet() {
        return propertyMissingSet;
    }
}
