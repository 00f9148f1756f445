package dev.fumaz.augment.reflection;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Widening conversions between the boxed numeric types.
 */
public final class NumberConversions {

    private static final List<Class<?>> WIDENING_ORDER = List.of(
            Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class
    );

    private NumberConversions() {
    }

    /**
     * Whether a value of type {@code from} can be widened to {@code to} without loss of magnitude.
     * Both types may be primitive or boxed; identical types are not considered a widening.
     */
    public static boolean canWiden(@NotNull Class<?> from, @NotNull Class<?> to) {
        Class<?> source = Reflections.wrapperType(from);
        Class<?> target = Reflections.wrapperType(to);

        if (source == Character.class) {
            return WIDENING_ORDER.indexOf(target) >= WIDENING_ORDER.indexOf(Integer.class);
        }

        int sourceIndex = WIDENING_ORDER.indexOf(source);
        int targetIndex = WIDENING_ORDER.indexOf(target);

        return sourceIndex >= 0 && targetIndex > sourceIndex;
    }

    public static @NotNull Object convert(@NotNull Object value, @NotNull Class<?> type) {
        Class<?> target = Reflections.wrapperType(type);

        if (target.isInstance(value)) {
            return value;
        }

        Number number = value instanceof Character ? (int) (Character) value : (Number) value;

        if (target == Byte.class) {
            return number.byteValue();
        }

        if (target == Short.class) {
            return number.shortValue();
        }

        if (target == Integer.class) {
            return number.intValue();
        }

        if (target == Long.class) {
            return number.longValue();
        }

        if (target == Float.class) {
            return number.floatValue();
        }

        if (target == Double.class) {
            return number.doubleValue();
        }

        throw new IllegalArgumentException("Cannot convert " + value.getClass().getName() + " to " + type.getName());
    }
}
