package dev.fumaz.augment.instance;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracks the decorated instances whose base constructors are running on the current thread, so that a
 * {@link DynamicBean} can attach to its dispatcher before the dispatcher is initialised, and so that calls made by a
 * base constructor reach the dispatcher before the generated class knows it.
 */
final class ConstructionWindow {

    private static final ThreadLocal<Deque<DecoratedInstance<?>>> PENDING = ThreadLocal.withInitial(ArrayDeque::new);

    private ConstructionWindow() {
    }

    static void enter(@NotNull DecoratedInstance<?> instance) {
        PENDING.get().push(instance);
    }

    static void exit(@NotNull DecoratedInstance<?> instance) {
        Deque<DecoratedInstance<?>> pending = PENDING.get();

        if (pending.peek() != instance) {
            throw new IllegalStateException("Construction window mismatch for " + instance.getType().getName());
        }

        pending.pop();

        if (pending.isEmpty()) {
            PENDING.remove();
        }
    }

    /**
     * The instance under construction on this thread, if {@code bean} is the object its constructor is building.
     */
    static @Nullable DecoratedInstance<?> pendingFor(@NotNull Object bean) {
        DecoratedInstance<?> pending = peek();
        return pending != null && pending.owns(bean) ? pending : null;
    }

    static @NotNull DecoratedInstance<?> claim(@NotNull Object bean) {
        DecoratedInstance<?> pending = peek();

        if (pending == null || pending.getType() != bean.getClass().getSuperclass() || pending.isBound()) {
            throw new IllegalStateException(bean.getClass().getName()
                    + " must be instantiated through a DecoratedTypeFactory");
        }

        pending.bind(bean);
        return pending;
    }

    private static DecoratedInstance<?> peek() {
        Deque<DecoratedInstance<?>> stack = PENDING.get();
        DecoratedInstance<?> pending = stack.peek();

        if (stack.isEmpty()) {
            PENDING.remove();
        }

        return pending;
    }
}
