package dev.fumaz.augment.instance;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A single dispatch surface for method calls and property access by name.
 */
public interface DynamicObject {

    /**
     * Name of the property that exposes the extension bag of extensible objects.
     */
    String EXTENSIONS_PROPERTY = "ext";

    @Nullable Object invokeMethod(@NotNull String name, Object... arguments);

    @Nullable Object getProperty(@NotNull String name);

    void setProperty(@NotNull String name, @Nullable Object value);

    boolean hasProperty(@NotNull String name);

}
