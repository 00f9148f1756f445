package dev.fumaz.augment.coerce;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Proxy;
import java.util.Objects;

/**
 * Adapts bare callables to the single-method capability types that methods declare.
 */
public final class CallbackCoercion {

    private CallbackCoercion() {
    }

    /**
     * Whether passing {@code argument} to a parameter of {@code parameterType} requires wrapping it first.
     */
    public static boolean needsCoercion(@NotNull Class<?> parameterType, @Nullable Object argument) {
        return argument instanceof DynamicCallable
                && !parameterType.isInstance(argument)
                && Capabilities.isCapabilityType(parameterType);
    }

    @SuppressWarnings("unchecked")
    public static <T> @NotNull T coerce(@NotNull Class<T> capabilityType, @NotNull DynamicCallable callable) {
        Objects.requireNonNull(capabilityType, "capabilityType");
        Objects.requireNonNull(callable, "callable");

        if (!Capabilities.isCapabilityType(capabilityType)) {
            throw new IllegalArgumentException(capabilityType.getName() + " is not a single-method interface");
        }

        ClassLoader loader = capabilityType.getClassLoader();
        return (T) Proxy.newProxyInstance(loader, new Class<?>[]{capabilityType},
                new CallbackWrapper(capabilityType, callable));
    }
}
