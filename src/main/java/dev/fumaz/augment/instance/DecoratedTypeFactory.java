package dev.fumaz.augment.instance;

import dev.fumaz.augment.coerce.ArgumentCoercion;
import dev.fumaz.augment.dispatch.OverloadResolver;
import dev.fumaz.augment.missing.MissingMemberHooks;
import dev.fumaz.augment.reflection.ReflectionException;
import dev.fumaz.augment.reflection.Reflections;
import dev.fumaz.augment.registry.MemberRegistry;
import dev.fumaz.augment.registry.RegistryEntry;
import org.jetbrains.annotations.NotNull;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.VarHandle;
import java.lang.reflect.Constructor;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Creates decorated instances of one type. The type's registry entry and its generated implementation class are
 * built when the factory is created and shared by every instance it produces.
 *
 * @param <T> the decorated type
 */
public final class DecoratedTypeFactory<T> {

    private static final Logger LOGGER = Logger.getLogger(DecoratedTypeFactory.class.getName());

    private final @NotNull Class<T> type;
    private final @NotNull DecorationOptions options;
    private final @NotNull RegistryEntry entry;
    private final @NotNull MissingMemberHooks typeHooks;
    private final @NotNull Class<? extends T> implementation;
    private final @NotNull VarHandle dispatcher;
    private final @NotNull List<Constructor<?>> constructors;
    private final ConcurrentMap<Constructor<?>, MethodHandle> constructorInvokers = new ConcurrentHashMap<>();

    DecoratedTypeFactory(@NotNull Class<T> type, @NotNull DecorationOptions options) {
        this.type = type;
        this.options = options;
        this.entry = MemberRegistry.forMarkers(options.getInjectionMarkers(), options.getNonExtensibleMarkers())
                .build(type);
        this.typeHooks = options.createTypeHooks();
        this.implementation = DecoratedClassGenerator.subclassOf(type);
        this.dispatcher = DecoratedClassGenerator.dispatcherHandle(implementation);
        this.constructors = sortedConstructors(implementation);
    }

    public @NotNull Class<T> getType() {
        return type;
    }

    /**
     * The generated class every instance of this factory is created from.
     */
    public @NotNull Class<? extends T> getImplementationType() {
        return implementation;
    }

    public @NotNull RegistryEntry getEntry() {
        return entry;
    }

    /**
     * The hooks consulted by every instance of this factory that has no hook of its own.
     */
    public @NotNull MissingMemberHooks getTypeHooks() {
        return typeHooks;
    }

    /**
     * Creates a new decorated instance. Classes are constructed through the non-private constructor that best fits
     * {@code arguments}, abstract ones included; interfaces take no arguments.
     */
    public @NotNull Decorated<T> instantiate(Object... arguments) {
        Object[] args = arguments == null ? new Object[0] : arguments;
        DecoratedInstance<T> instance = new DecoratedInstance<>(type, entry, options.getLookupService(), typeHooks);

        if (type.isInterface() && args.length != 0) {
            throw new IllegalArgumentException("Interface " + type.getName() + " takes no constructor arguments");
        }

        Constructor<?> constructor = OverloadResolver.select(constructors,
                candidate -> Arrays.asList(candidate.getParameterTypes()), args);

        if (constructor == null) {
            throw new ReflectionException("No constructor of " + type.getName() + " accepts ("
                    + Arrays.stream(args)
                    .map(arg -> arg == null ? "null" : arg.getClass().getSimpleName())
                    .collect(Collectors.joining(", ")) + ")");
        }

        Object[] converted = convertArguments(constructor, args);
        Object created;

        ConstructionWindow.enter(instance);

        try {
            created = instantiateConstructor(constructor, converted);
        } finally {
            ConstructionWindow.exit(instance);
        }

        instance.bind(created);
        dispatcher.setRelease(created, instance);
        instance.initialize();

        LOGGER.fine(() -> "Instantiated decorated " + type.getName() + " via " + constructor.toGenericString());
        return instance;
    }

    private Object instantiateConstructor(Constructor<?> constructor, Object[] arguments) {
        MethodHandle invoker = constructorInvokers.computeIfAbsent(constructor, Reflections::spreadInvoker);

        try {
            return invoker.invoke(arguments);
        } catch (Throwable throwable) {
            throw Reflections.rethrow(throwable);
        }
    }

    private static Object[] convertArguments(Constructor<?> constructor, Object[] arguments) {
        Class<?>[] parameterTypes = constructor.getParameterTypes();
        Object[] converted = new Object[arguments.length];

        for (int i = 0; i < arguments.length; i++) {
            converted[i] = ArgumentCoercion.convertArgument(arguments[i], parameterTypes[i],
                    i == arguments.length - 1);
        }

        return converted;
    }

    private static List<Constructor<?>> sortedConstructors(Class<?> type) {
        Constructor<?>[] declared = type.getDeclaredConstructors();
        Arrays.sort(declared, (first, second) -> {
            int byArity = Integer.compare(first.getParameterCount(), second.getParameterCount());

            if (byArity != 0) {
                return byArity;
            }

            return Arrays.toString(first.getParameterTypes()).compareTo(Arrays.toString(second.getParameterTypes()));
        });

        return List.of(declared);
    }

    @Override
    public String toString() {
        return "DecoratedTypeFactory[" + Objects.toString(type.getName()) + "]";
    }
}
