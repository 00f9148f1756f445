package dev.fumaz.augment.reflection;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.invoke.VarHandle;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class Reflections {

    private static final MethodHandles.Lookup ROOT_LOOKUP = MethodHandles.lookup();
    private static final ConcurrentMap<Class<?>, MethodHandles.Lookup> PRIVATE_LOOKUPS = new ConcurrentHashMap<>();
    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            char.class, Character.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class,
            void.class, Void.class
    );

    private Reflections() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static MethodHandles.Lookup lookupFor(@NotNull Class<?> type) {
        return PRIVATE_LOOKUPS.computeIfAbsent(type, Reflections::createLookupFor);
    }

    private static MethodHandles.Lookup createLookupFor(Class<?> type) {
        try {
            return MethodHandles.privateLookupIn(type, ROOT_LOOKUP);
        } catch (IllegalAccessException | RuntimeException e) {
            return ROOT_LOOKUP;
        }
    }

    /**
     * Adapts a method to the shape {@code (Object receiver, Object[] arguments)Object}.
     * Static methods ignore the receiver, {@code void} methods return {@code null}.
     */
    public static @Nullable MethodHandle spreadInvoker(@NotNull Method method) {
        boolean isStatic = Modifier.isStatic(method.getModifiers());

        try {
            MethodHandle base = unreflect(method);
            MethodHandle spread = base.asSpreader(Object[].class, method.getParameterCount());

            if (isStatic) {
                spread = MethodHandles.dropArguments(spread, 0, Object.class);
            }

            return spread.asType(MethodType.methodType(Object.class, Object.class, Object[].class));
        } catch (IllegalAccessException | RuntimeException e) {
            return null;
        }
    }

    /**
     * Adapts a constructor to the shape {@code (Object[] arguments)Object}.
     */
    public static @NotNull MethodHandle spreadInvoker(@NotNull Constructor<?> constructor) {
        MethodHandle handle = unreflectConstructor(constructor);
        handle = handle.asSpreader(Object[].class, constructor.getParameterCount());
        return handle.asType(MethodType.methodType(Object.class, Object[].class));
    }

    public static @Nullable VarHandle varHandle(@NotNull Field field) {
        try {
            return lookupFor(field.getDeclaringClass()).unreflectVarHandle(field);
        } catch (IllegalAccessException | RuntimeException e) {
            return null;
        }
    }

    private static MethodHandle unreflect(Method method) throws IllegalAccessException {
        try {
            return lookupFor(method.getDeclaringClass()).unreflect(method);
        } catch (IllegalAccessException firstFailure) {
            method.setAccessible(true);
            return ROOT_LOOKUP.unreflect(method);
        }
    }

    private static MethodHandle unreflectConstructor(Constructor<?> constructor) {
        try {
            return lookupFor(constructor.getDeclaringClass()).unreflectConstructor(constructor);
        } catch (IllegalAccessException firstFailure) {
            try {
                constructor.setAccessible(true);
                return ROOT_LOOKUP.unreflectConstructor(constructor);
            } catch (IllegalAccessException | RuntimeException secondFailure) {
                ReflectionException exception = new ReflectionException(
                        "Unable to access constructor handle for " + constructor, secondFailure);
                exception.addSuppressed(firstFailure);
                throw exception;
            }
        }
    }

    /**
     * Invokes a method reflectively, rethrowing whatever the method itself threw.
     */
    public static Object invoke(@NotNull Method method, @Nullable Object receiver, Object[] arguments) throws Throwable {
        try {
            method.setAccessible(true);
            return method.invoke(Modifier.isStatic(method.getModifiers()) ? null : receiver, arguments);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        } catch (IllegalAccessException e) {
            throw new ReflectionException("Exception whilst invoking the method " + method, e);
        }
    }

    public static Object getFieldValue(@NotNull Field field, @Nullable VarHandle handle, @NotNull Object target) {
        boolean isStatic = Modifier.isStatic(field.getModifiers());

        if (handle != null) {
            return isStatic ? handle.get() : handle.get(target);
        }

        try {
            field.setAccessible(true);
            return field.get(isStatic ? null : target);
        } catch (IllegalAccessException e) {
            throw new ReflectionException("Exception whilst getting the field's value", e);
        }
    }

    public static void setFieldValue(@NotNull Field field, @Nullable VarHandle handle, @NotNull Object target,
                                     @Nullable Object value) {
        boolean isStatic = Modifier.isStatic(field.getModifiers());

        if (handle != null) {
            if (isStatic) {
                handle.set(value);
            } else {
                handle.set(target, value);
            }

            return;
        }

        try {
            field.setAccessible(true);
            field.set(isStatic ? null : target, value);
        } catch (IllegalAccessException e) {
            throw new ReflectionException("Exception whilst setting the value of the field", e);
        }
    }

    public static @NotNull Class<?> wrapperType(@NotNull Class<?> type) {
        return type.isPrimitive() ? WRAPPERS.get(type) : type;
    }

    public static @Nullable Object defaultValue(@NotNull Class<?> type) {
        if (!type.isPrimitive() || type == void.class) {
            return null;
        }

        if (type == boolean.class) {
            return false;
        }

        if (type == char.class) {
            return '\0';
        }

        return NumberConversions.convert(0, type);
    }

    /**
     * Strips reflection wrappers so that callers observe the exception the invoked code threw.
     */
    public static @NotNull Throwable unwrap(@NotNull Throwable throwable) {
        Throwable current = throwable;

        while (true) {
            if (current instanceof InvocationTargetException && current.getCause() != null) {
                current = current.getCause();
            } else if (current instanceof UndeclaredThrowableException && current.getCause() != null) {
                current = current.getCause();
            } else {
                return current;
            }
        }
    }

    /**
     * Rethrows any throwable, checked or not, without wrapping it. The return type lets call sites write
     * {@code throw Reflections.rethrow(e)}.
     */
    public static RuntimeException rethrow(@NotNull Throwable throwable) {
        throw Reflections.<RuntimeException>sneakyThrow(unwrap(throwable));
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> E sneakyThrow(Throwable throwable) throws E {
        throw (E) throwable;
    }

}
