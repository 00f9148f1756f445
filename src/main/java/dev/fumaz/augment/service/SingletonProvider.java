package dev.fumaz.augment.service;

import org.jetbrains.annotations.NotNull;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A {@link SingletonProvider} is a {@link Provider} that creates its instance on first use and then keeps it.
 *
 * @param <T> the type of the service
 */
public final class SingletonProvider<T> implements Provider<T> {

    private static final VarHandle INSTANCE_HANDLE;

    static {
        try {
            INSTANCE_HANDLE = MethodHandles.lookup().findVarHandle(SingletonProvider.class, "instance", Object.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final @NotNull Supplier<T> factory;
    private T instance;
    private final Object lock = new Object();

    SingletonProvider(@NotNull Supplier<T> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public @NotNull T provide(@NotNull ServiceLookup lookup) {
        T local = getInitializedInstance();

        if (local != null) {
            return local;
        }

        synchronized (lock) {
            local = getInitializedInstance();

            if (local == null) {
                local = factory.get();

                if (local == null) {
                    throw new IllegalStateException("Singleton service factory produced null");
                }

                INSTANCE_HANDLE.setRelease(this, local);
            }

            return local;
        }
    }

    @SuppressWarnings("unchecked")
    private T getInitializedInstance() {
        return (T) INSTANCE_HANDLE.getAcquire(this);
    }

}
