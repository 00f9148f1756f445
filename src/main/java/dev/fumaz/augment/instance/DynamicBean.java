package dev.fumaz.augment.instance;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Optional base class for decorated types that route their own calls through dynamic dispatch.
 * <p>
 * A bean attaches to its dispatcher while its constructor runs, so it can only be created through
 * {@link DecoratedTypeFactory#instantiate(Object...)}. Calls made from the constructor see declared members only.
 */
public abstract class DynamicBean implements DynamicObject {

    private final transient DecoratedInstance<?> dynamicObject;

    protected DynamicBean() {
        this.dynamicObject = ConstructionWindow.claim(this);
    }

    public final @NotNull DynamicObject asDynamicObject() {
        return dynamicObject;
    }

    @Override
    public @Nullable Object invokeMethod(@NotNull String name, Object... arguments) {
        return dynamicObject.invokeMethod(name, arguments);
    }

    @Override
    public @Nullable Object getProperty(@NotNull String name) {
        return dynamicObject.getProperty(name);
    }

    @Override
    public void setProperty(@NotNull String name, @Nullable Object value) {
        dynamicObject.setProperty(name, value);
    }

    @Override
    public boolean hasProperty(@NotNull String name) {
        return dynamicObject.hasProperty(name);
    }
}
