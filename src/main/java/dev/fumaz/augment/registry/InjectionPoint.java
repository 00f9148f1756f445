package dev.fumaz.augment.registry;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;
import java.lang.reflect.Type;

/**
 * A getter whose value is supplied by a service lookup, with its optional paired setter.
 */
public final class InjectionPoint {

    private final int index;
    private final @NotNull String propertyName;
    private final @NotNull MemberDescriptor getter;
    private final @Nullable MemberDescriptor setter;
    private final @NotNull Type key;
    private final @NotNull Class<? extends Annotation> marker;

    InjectionPoint(int index,
                   @NotNull String propertyName,
                   @NotNull MemberDescriptor getter,
                   @Nullable MemberDescriptor setter,
                   @NotNull Type key,
                   @NotNull Class<? extends Annotation> marker) {
        this.index = index;
        this.propertyName = propertyName;
        this.getter = getter;
        this.setter = setter;
        this.key = key;
        this.marker = marker;
    }

    /**
     * Slot index of this point within its registry entry.
     */
    public int getIndex() {
        return index;
    }

    public @NotNull String getPropertyName() {
        return propertyName;
    }

    public @NotNull MemberDescriptor getGetter() {
        return getter;
    }

    public @Nullable MemberDescriptor getSetter() {
        return setter;
    }

    public boolean hasSetter() {
        return setter != null;
    }

    public @NotNull Type getKey() {
        return key;
    }

    public @NotNull Class<? extends Annotation> getMarker() {
        return marker;
    }

    @Override
    public String toString() {
        return "injection point '" + propertyName + "' (" + key.getTypeName() + ")";
    }
}
