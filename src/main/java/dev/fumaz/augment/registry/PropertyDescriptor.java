package dev.fumaz.augment.registry;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A property of a registered type, backed by a getter, one or more setters and/or a declared field.
 */
public final class PropertyDescriptor {

    private final @NotNull String name;
    private final @Nullable MemberDescriptor getter;
    private final @NotNull List<MemberDescriptor> setters;
    private final @Nullable MemberDescriptor field;

    PropertyDescriptor(@NotNull String name,
                       @Nullable MemberDescriptor getter,
                       @NotNull List<MemberDescriptor> setters,
                       @Nullable MemberDescriptor field) {
        this.name = name;
        this.getter = getter;
        this.setters = List.copyOf(setters);
        this.field = field;
    }

    public @NotNull String getName() {
        return name;
    }

    public @Nullable MemberDescriptor getGetter() {
        return getter;
    }

    public @NotNull List<MemberDescriptor> getSetters() {
        return setters;
    }

    public @Nullable MemberDescriptor getField() {
        return field;
    }

    public boolean isReadable() {
        return getter != null || field != null;
    }

    public boolean isWritable() {
        return !setters.isEmpty() || (field != null && !field.isFinal());
    }

    /**
     * Whether the property is only declared through abstract accessors, so its value has to be held elsewhere.
     */
    public boolean isManaged() {
        return field == null && getter != null && getter.isAbstract()
                && setters.stream().allMatch(MemberDescriptor::isAbstract);
    }

    public @NotNull Class<?> getType() {
        if (getter != null) {
            return getter.getValueType();
        }

        if (field != null) {
            return field.getValueType();
        }

        return setters.get(0).getParameterTypes().get(0);
    }
}
