package dev.fumaz.augment.coerce;

import dev.fumaz.augment.reflection.NumberConversions;
import dev.fumaz.augment.reflection.Reflections;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Converts dynamically supplied values to the types declared by the members they are passed to.
 */
public final class ArgumentCoercion {

    private ArgumentCoercion() {
    }

    public static boolean isEnumCoercible(@NotNull Class<?> parameterType, @Nullable Object value) {
        return parameterType.isEnum() && value instanceof CharSequence;
    }

    public static boolean isStringCoercible(@NotNull Class<?> parameterType, @Nullable Object value) {
        return parameterType == String.class && value instanceof CharSequence && !(value instanceof String);
    }

    /**
     * Converts an argument chosen by overload resolution to the parameter's declared type. Only enum names, character
     * sequences for {@code String} parameters, numeric widening and (when {@code callbacks} is set) bare callables are
     * converted; anything else is passed through.
     */
    public static @Nullable Object convertArgument(@Nullable Object value, @NotNull Class<?> parameterType,
                                                   boolean callbacks) {
        if (value == null) {
            return null;
        }

        if (callbacks && CallbackCoercion.needsCoercion(parameterType, value)) {
            return CallbackCoercion.coerce(parameterType, (DynamicCallable) value);
        }

        if (isEnumCoercible(parameterType, value)) {
            return toEnum(parameterType, value.toString());
        }

        if (isStringCoercible(parameterType, value)) {
            return value.toString();
        }

        if (NumberConversions.canWiden(value.getClass(), parameterType)) {
            return NumberConversions.convert(value, parameterType);
        }

        return value;
    }

    /**
     * Converts the result of a callable to the declared return type of the capability method it implements.
     * Numbers are only widened; a result that would lose precision is rejected.
     */
    public static @Nullable Object convertReturnValue(@Nullable Object result, @NotNull Class<?> returnType) {
        if (returnType == void.class) {
            return null;
        }

        if (result == null) {
            return Reflections.defaultValue(returnType);
        }

        Class<?> target = Reflections.wrapperType(returnType);

        if (target.isInstance(result)) {
            return result;
        }

        if (NumberConversions.canWiden(result.getClass(), target)) {
            return NumberConversions.convert(result, target);
        }

        if (isEnumCoercible(target, result)) {
            return toEnum(target, result.toString());
        }

        if (isStringCoercible(target, result)) {
            return result.toString();
        }

        throw new ClassCastException("Cannot convert callback result of type " + result.getClass().getName()
                + " to " + returnType.getName());
    }

    public static @NotNull Object toEnum(@NotNull Class<?> enumType, @NotNull String name) {
        Object[] constants = enumType.getEnumConstants();

        for (Object constant : constants) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(name)) {
                return constant;
            }
        }

        throw new IllegalArgumentException("Cannot convert string value '" + name + "' to an enum value of type "
                + enumType.getName());
    }
}
