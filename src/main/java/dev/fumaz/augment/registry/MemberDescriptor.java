package dev.fumaz.augment.registry;

import dev.fumaz.augment.reflection.Reflections;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.VarHandle;
import java.lang.reflect.Field;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A declared method or field of a registered type. Instances are immutable and shared by every decorated
 * instance of that type.
 */
public final class MemberDescriptor {

    private final @NotNull String name;
    private final @NotNull MemberKind kind;
    private final @NotNull List<Class<?>> parameterTypes;
    private final @NotNull Class<?> valueType;
    private final @NotNull Class<?> declaringType;
    private final int order;
    private final @NotNull Member member;
    private final @Nullable MethodHandle invoker;
    private final @Nullable VarHandle varHandle;

    private MemberDescriptor(@NotNull String name,
                             @NotNull MemberKind kind,
                             @NotNull Class<?>[] parameterTypes,
                             @NotNull Class<?> valueType,
                             @NotNull Class<?> declaringType,
                             int order,
                             @NotNull Member member,
                             @Nullable MethodHandle invoker,
                             @Nullable VarHandle varHandle) {
        this.name = name;
        this.kind = kind;
        this.parameterTypes = Collections.unmodifiableList(Arrays.asList(parameterTypes.clone()));
        this.valueType = valueType;
        this.declaringType = declaringType;
        this.order = order;
        this.member = member;
        this.invoker = invoker;
        this.varHandle = varHandle;
    }

    static @NotNull MemberDescriptor method(@NotNull Method method, int order) {
        MethodHandle invoker = Modifier.isAbstract(method.getModifiers()) ? null : Reflections.spreadInvoker(method);

        return new MemberDescriptor(method.getName(), MemberKind.METHOD, method.getParameterTypes(),
                method.getReturnType(), method.getDeclaringClass(), order, method, invoker, null);
    }

    static @NotNull MemberDescriptor field(@NotNull Field field, int order) {
        return new MemberDescriptor(field.getName(), MemberKind.FIELD, new Class<?>[0], field.getType(),
                field.getDeclaringClass(), order, field, null, Reflections.varHandle(field));
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull MemberKind getKind() {
        return kind;
    }

    public @NotNull List<Class<?>> getParameterTypes() {
        return parameterTypes;
    }

    public int getArity() {
        return parameterTypes.size();
    }

    /**
     * The return type of a method, or the declared type of a field.
     */
    public @NotNull Class<?> getValueType() {
        return valueType;
    }

    public @NotNull Class<?> getDeclaringType() {
        return declaringType;
    }

    /**
     * Position of this member in the registry's declaration order, used to break overload ties.
     */
    public int getOrder() {
        return order;
    }

    public @NotNull Member getMember() {
        return member;
    }

    public @NotNull Method getMethod() {
        if (kind != MemberKind.METHOD) {
            throw new IllegalStateException(name + " is not a method");
        }

        return (Method) member;
    }

    public boolean isAbstract() {
        return Modifier.isAbstract(member.getModifiers());
    }

    public boolean isFinal() {
        return Modifier.isFinal(member.getModifiers());
    }

    /**
     * Invokes this method on {@code target}. Whatever the method throws propagates unchanged.
     */
    public Object invoke(@NotNull Object target, @NotNull Object[] arguments) throws Throwable {
        if (kind != MemberKind.METHOD) {
            throw new IllegalStateException(name + " is not a method");
        }

        if (invoker != null) {
            return invoker.invoke(target, arguments);
        }

        return Reflections.invoke((Method) member, target, arguments);
    }

    public Object get(@NotNull Object target) {
        if (kind != MemberKind.FIELD) {
            throw new IllegalStateException(name + " is not a field");
        }

        return Reflections.getFieldValue((Field) member, varHandle, target);
    }

    public void set(@NotNull Object target, @Nullable Object value) {
        if (kind != MemberKind.FIELD) {
            throw new IllegalStateException(name + " is not a field");
        }

        Reflections.setFieldValue((Field) member, varHandle, target, value);
    }

    public @NotNull String describe() {
        if (kind == MemberKind.FIELD) {
            return "field " + declaringType.getSimpleName() + "." + name;
        }

        return declaringType.getSimpleName() + "." + name + parameterTypes.stream()
                .map(Class::getSimpleName)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String toString() {
        return describe();
    }
}
