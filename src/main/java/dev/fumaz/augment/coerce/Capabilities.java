package dev.fumaz.augment.coerce;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Optional;

/**
 * Detects capability types: interfaces declaring exactly one abstract method.
 */
public final class Capabilities {

    private static final ClassValue<Optional<Method>> SINGLE_ABSTRACT_METHODS = new ClassValue<>() {
        @Override
        protected Optional<Method> computeValue(Class<?> type) {
            return Optional.ofNullable(findSingleAbstractMethod(type));
        }
    };

    private Capabilities() {
    }

    public static boolean isCapabilityType(@NotNull Class<?> type) {
        return type.isInterface() && type != DynamicCallable.class && SINGLE_ABSTRACT_METHODS.get(type).isPresent();
    }

    public static @NotNull Method getCapabilityMethod(@NotNull Class<?> type) {
        return SINGLE_ABSTRACT_METHODS.get(type)
                .orElseThrow(() -> new IllegalArgumentException(type.getName() + " is not a capability type"));
    }

    private static @Nullable Method findSingleAbstractMethod(Class<?> type) {
        if (!type.isInterface() || type.isAnnotation()) {
            return null;
        }

        Method found = null;

        for (Method method : type.getMethods()) {
            if (!Modifier.isAbstract(method.getModifiers()) || isObjectMethod(method)) {
                continue;
            }

            if (found != null && !sameSignature(found, method)) {
                return null;
            }

            found = found == null ? method : found;
        }

        return found;
    }

    private static boolean isObjectMethod(Method method) {
        try {
            Object.class.getMethod(method.getName(), method.getParameterTypes());
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    private static boolean sameSignature(Method first, Method second) {
        return first.getName().equals(second.getName())
                && java.util.Arrays.equals(first.getParameterTypes(), second.getParameterTypes());
    }
}
