package dev.fumaz.augment.missing;

import dev.fumaz.augment.exception.UnknownMethodException;
import dev.fumaz.augment.exception.UnknownPropertyException;
import dev.fumaz.augment.reflection.Reflections;
import dev.fumaz.augment.registry.MemberDescriptor;
import dev.fumaz.augment.registry.RegistryEntry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * The fallback chain for members that dispatch could not find. Handlers are consulted in order: the instance's
 * own hooks, then the type-level hooks, then {@code methodMissing}/{@code propertyMissing} methods declared by
 * the type itself. When none applies a typed {@link UnknownMethodException} or {@link UnknownPropertyException}
 * is raised. Whatever a handler throws propagates unchanged.
 */
public final class MissingMemberProtocol {

    private static final Logger LOGGER = Logger.getLogger(MissingMemberProtocol.class.getName());

    private final @NotNull RegistryEntry entry;
    private final @NotNull MissingMemberHooks instanceHooks;
    private final @NotNull MissingMemberHooks typeHooks;

    public MissingMemberProtocol(@NotNull RegistryEntry entry,
                                 @NotNull MissingMemberHooks instanceHooks,
                                 @NotNull MissingMemberHooks typeHooks) {
        this.entry = Objects.requireNonNull(entry, "entry");
        this.instanceHooks = Objects.requireNonNull(instanceHooks, "instanceHooks");
        this.typeHooks = Objects.requireNonNull(typeHooks, "typeHooks");
    }

    public @Nullable Object methodMissing(@NotNull Object target, @NotNull String name, @NotNull Object[] arguments) {
        MethodMissingHandler handler = first(instanceHooks.getOnMethodMissing(), typeHooks.getOnMethodMissing());

        if (handler != null) {
            LOGGER.fine(() -> "Routing missing method " + name + " of " + entry.getType().getName() + " to hook");
            return handler.methodMissing(name, arguments);
        }

        MemberDescriptor declared = entry.getMethodMissing();

        if (declared != null) {
            return invokeDeclared(declared, target, name, arguments);
        }

        throw new UnknownMethodException(name, arguments.length, entry.getType());
    }

    public @Nullable Object propertyMissingGet(@NotNull Object target, @NotNull String name) {
        PropertyGetMissingHandler handler = first(instanceHooks.getOnPropertyMissingGet(),
                typeHooks.getOnPropertyMissingGet());

        if (handler != null) {
            LOGGER.fine(() -> "Routing missing property get " + name + " of " + entry.getType().getName()
                    + " to hook");
            return handler.propertyMissing(name);
        }

        MemberDescriptor declared = entry.getPropertyMissingGet();

        if (declared != null) {
            return invokeDeclared(declared, target, name);
        }

        throw new UnknownPropertyException(name, entry.getType());
    }

    public void propertyMissingSet(@NotNull Object target, @NotNull String name, @Nullable Object value) {
        PropertySetMissingHandler handler = first(instanceHooks.getOnPropertyMissingSet(),
                typeHooks.getOnPropertyMissingSet());

        if (handler != null) {
            LOGGER.fine(() -> "Routing missing property set " + name + " of " + entry.getType().getName()
                    + " to hook");
            handler.propertyMissing(name, value);
            return;
        }

        MemberDescriptor declared = entry.getPropertyMissingSet();

        if (declared != null) {
            invokeDeclared(declared, target, name, value);
            return;
        }

        throw new UnknownPropertyException(name, entry.getType());
    }

    private static <H> H first(@Nullable H preferred, @Nullable H fallback) {
        return preferred != null ? preferred : fallback;
    }

    private static Object invokeDeclared(MemberDescriptor declared, Object target, Object... arguments) {
        try {
            return declared.invoke(target, arguments);
        } catch (Throwable throwable) {
            throw Reflections.rethrow(throwable);
        }
    }
}
