package dev.fumaz.augment.instance;

import dev.fumaz.augment.coerce.ArgumentCoercion;
import dev.fumaz.augment.coerce.DynamicCallable;
import dev.fumaz.augment.dispatch.OverloadResolver;
import dev.fumaz.augment.exception.UnknownMethodException;
import dev.fumaz.augment.exception.UnknownPropertyException;
import dev.fumaz.augment.inject.InjectionCache;
import dev.fumaz.augment.missing.MethodMissingHandler;
import dev.fumaz.augment.missing.MissingMemberHooks;
import dev.fumaz.augment.missing.MissingMemberProtocol;
import dev.fumaz.augment.missing.PropertyGetMissingHandler;
import dev.fumaz.augment.missing.PropertySetMissingHandler;
import dev.fumaz.augment.reflection.Reflections;
import dev.fumaz.augment.registry.InjectionPoint;
import dev.fumaz.augment.registry.MemberDescriptor;
import dev.fumaz.augment.registry.PropertyDescriptor;
import dev.fumaz.augment.registry.RegistryEntry;
import dev.fumaz.augment.service.ServiceLookup;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * The dispatcher behind one decorated instance.
 * <p>
 * Until {@link #initialize()} runs, that is while the base type's constructor is still executing, every call falls
 * back to plain declared-member dispatch: no injection cache, extension bag or missing-member hook is consulted.
 * Calls made through the decorated type itself arrive here from {@link DecoratedMethodInterceptor}.
 */
final class DecoratedInstance<T> implements Decorated<T> {

    private static final Object[] NO_ARGUMENTS = new Object[0];

    private final @NotNull Class<T> type;
    private final @NotNull RegistryEntry entry;
    private final @NotNull ServiceLookup lookupService;
    private final @NotNull MissingMemberHooks typeHooks;
    private final @NotNull MissingMemberHooks hooks = new MissingMemberHooks();
    private final Map<String, Object> managedValues = new HashMap<>();
    private final Object lock = new Object();

    private volatile T target;
    private volatile boolean initialized;
    private InjectionCache injections;
    private MissingMemberProtocol missing;
    private volatile ExtensionBag extensions;

    DecoratedInstance(@NotNull Class<T> type,
                      @NotNull RegistryEntry entry,
                      @NotNull ServiceLookup lookupService,
                      @NotNull MissingMemberHooks typeHooks) {
        this.type = type;
        this.entry = entry;
        this.lookupService = lookupService;
        this.typeHooks = typeHooks;
    }

    void bind(@NotNull Object instance) {
        if (target != null) {
            if (target != instance) {
                throw new IllegalStateException("Decorated " + type.getName() + " is already bound");
            }

            return;
        }

        target = type.cast(instance);
    }

    boolean isBound() {
        return target != null;
    }

    void initialize() {
        T self = requireTarget();
        ServiceLookup lookup = entry.getServicesAccessor() == null
                ? lookupService
                : key -> instanceServices(self).get(key);

        this.injections = new InjectionCache(entry, lookup);
        this.missing = new MissingMemberProtocol(entry, hooks, typeHooks);
        this.initialized = true;
    }

    @Override
    public @NotNull T getTarget() {
        return requireTarget();
    }

    @Override
    public @NotNull Class<T> getType() {
        return type;
    }

    @Override
    public void setOnMethodMissing(@Nullable MethodMissingHandler handler) {
        hooks.setOnMethodMissing(handler);
    }

    @Override
    public void setOnPropertyMissingGet(@Nullable PropertyGetMissingHandler handler) {
        hooks.setOnPropertyMissingGet(handler);
    }

    @Override
    public void setOnPropertyMissingSet(@Nullable PropertySetMissingHandler handler) {
        hooks.setOnPropertyMissingSet(handler);
    }

    @Override
    public @Nullable Object invokeMethod(@NotNull String name, Object... arguments) {
        Objects.requireNonNull(name, "name");
        Object[] args = arguments == null ? NO_ARGUMENTS : arguments;
        T self = requireTarget();

        if (!initialized) {
            MemberDescriptor method = OverloadResolver.resolve(entry, name, args);

            if (method == null || method.isAbstract()) {
                throw new UnknownMethodException(name, args.length, type);
            }

            return invokeMember(self, method, args);
        }

        InjectionPoint point = args.length == 0 ? entry.findInjectionGetter(name) : null;

        if (point != null) {
            return injections.getInjected(point);
        }

        point = args.length == 1 ? entry.findInjectionSetter(name) : null;

        if (point != null) {
            injections.setInjected(point, convertSetterValue(point.getSetter(), args[0]));
            return null;
        }

        MemberDescriptor method = OverloadResolver.resolve(entry, name, args);

        if (method != null) {
            return invokeMember(self, method, args);
        }

        PropertyDescriptor property = entry.getProperty(name);

        if (args.length == 1 && property != null && property.isWritable()) {
            setProperty(name, args[0]);
            return null;
        }

        ExtensionBag bag = extensions;

        if (bag != null && bag.has(name) && bag.get(name) instanceof DynamicCallable) {
            return ((DynamicCallable) bag.get(name)).call(args);
        }

        return missing.methodMissing(self, name, args);
    }

    @Override
    public @Nullable Object getProperty(@NotNull String name) {
        Objects.requireNonNull(name, "name");
        T self = requireTarget();
        PropertyDescriptor property = entry.getProperty(name);

        if (!initialized) {
            if (property == null || !property.isReadable()) {
                throw new UnknownPropertyException(name, type);
            }

            return readProperty(self, property);
        }

        InjectionPoint point = entry.getInjectionPoint(name);

        if (point != null) {
            return injections.getInjected(point);
        }

        if (property != null && property.isReadable()) {
            return readProperty(self, property);
        }

        if (EXTENSIONS_PROPERTY.equals(name) && !entry.isNonExtensible()) {
            return extensions();
        }

        ExtensionBag bag = extensions;

        if (bag != null && bag.has(name)) {
            return bag.get(name);
        }

        return missing.propertyMissingGet(self, name);
    }

    @Override
    public void setProperty(@NotNull String name, @Nullable Object value) {
        Objects.requireNonNull(name, "name");
        T self = requireTarget();
        PropertyDescriptor property = entry.getProperty(name);

        if (!initialized) {
            if (property == null || !property.isWritable()) {
                throw new UnknownPropertyException(name, type);
            }

            writeProperty(self, property, value);
            return;
        }

        InjectionPoint point = entry.getInjectionPoint(name);

        if (point != null && point.hasSetter()) {
            injections.setInjected(point, convertSetterValue(point.getSetter(), value));
            return;
        }

        if (point == null && property != null && property.isWritable()) {
            writeProperty(self, property, value);
            return;
        }

        ExtensionBag bag = extensions;

        if (bag != null && bag.has(name)) {
            bag.set(name, value);
            return;
        }

        missing.propertyMissingSet(self, name, value);
    }

    @Override
    public boolean hasProperty(@NotNull String name) {
        if (entry.getProperty(name) != null || entry.getInjectionPoint(name) != null) {
            return true;
        }

        if (!initialized || entry.isNonExtensible()) {
            return false;
        }

        if (EXTENSIONS_PROPERTY.equals(name)) {
            return true;
        }

        ExtensionBag bag = extensions;
        return bag != null && bag.has(name);
    }

    /**
     * Handles a call made through the generated class. Once the instance is initialised, injected accessors are
     * served from the injection cache. Abstract methods are backed by managed properties or handed to the
     * missing-member protocol. Everything else runs the inherited implementation.
     */
    Object invokeTyped(@NotNull Object self, @NotNull Method method, Object[] arguments,
                       @Nullable Callable<?> superCall) throws Exception {
        MemberDescriptor declared = findDeclared(method);

        if (initialized && declared != null) {
            InjectionPoint point = arguments.length == 0 ? entry.findInjectionGetter(declared.getName()) : null;

            if (point != null) {
                return ArgumentCoercion.convertReturnValue(injections.getInjected(point), method.getReturnType());
            }

            point = arguments.length == 1 ? entry.findInjectionSetter(declared.getName()) : null;

            if (point != null && point.getSetter() == declared) {
                injections.setInjected(point, arguments[0]);
                return null;
            }
        }

        if (superCall != null) {
            return superCall.call();
        }

        if (declared == null) {
            throw new UnknownMethodException(method.getName(), arguments.length, type);
        }

        Object result = invokeAbstract(type.cast(self), declared, arguments);
        return ArgumentCoercion.convertReturnValue(result, method.getReturnType());
    }

    boolean owns(@NotNull Object candidate) {
        T local = target;
        return local == null ? type.isInstance(candidate) : local == candidate;
    }

    private MemberDescriptor findDeclared(Method method) {
        for (MemberDescriptor candidate : entry.getMethods(method.getName())) {
            Method reflected = candidate.getMethod();

            if (Arrays.equals(reflected.getParameterTypes(), method.getParameterTypes())) {
                return candidate;
            }
        }

        return null;
    }

    /**
     * Invokes a declared method after converting the arguments to its parameter types. Abstract methods are served
     * from managed property storage or handed to the missing-member protocol.
     */
    private Object invokeMember(T self, MemberDescriptor method, Object[] arguments) {
        List<Class<?>> parameterTypes = method.getParameterTypes();
        Object[] converted = new Object[arguments.length];

        for (int i = 0; i < arguments.length; i++) {
            converted[i] = ArgumentCoercion.convertArgument(arguments[i], parameterTypes.get(i),
                    i == arguments.length - 1);
        }

        if (method.isAbstract()) {
            return invokeAbstract(self, method, converted);
        }

        try {
            return method.invoke(self, converted);
        } catch (Throwable throwable) {
            throw Reflections.rethrow(throwable);
        }
    }

    private Object invokeAbstract(T self, MemberDescriptor method, Object[] arguments) {
        PropertyDescriptor property = managedPropertyFor(method);

        if (property != null && arguments.length == 0) {
            synchronized (managedValues) {
                Object value = managedValues.get(property.getName());
                return value == null ? Reflections.defaultValue(method.getValueType()) : value;
            }
        }

        if (property != null) {
            synchronized (managedValues) {
                managedValues.put(property.getName(), arguments[0]);
            }

            return null;
        }

        if (!initialized) {
            throw new UnknownMethodException(method.getName(), arguments.length, type);
        }

        return missing.methodMissing(self, method.getName(), arguments);
    }

    private PropertyDescriptor managedPropertyFor(MemberDescriptor method) {
        for (PropertyDescriptor property : entry.getProperties().values()) {
            if (!property.isManaged()) {
                continue;
            }

            if (property.getGetter() == method || property.getSetters().contains(method)) {
                return property;
            }
        }

        return null;
    }

    private Object readProperty(T self, PropertyDescriptor property) {
        MemberDescriptor getter = property.getGetter();

        if (getter != null) {
            return invokeMember(self, getter, NO_ARGUMENTS);
        }

        return Objects.requireNonNull(property.getField()).get(self);
    }

    private void writeProperty(T self, PropertyDescriptor property, Object value) {
        Object[] arguments = {value};
        MemberDescriptor setter = OverloadResolver.select(property.getSetters(), MemberDescriptor::getParameterTypes,
                arguments);

        if (setter != null) {
            invokeMember(self, setter, arguments);
            return;
        }

        MemberDescriptor field = property.getField();

        if (field != null && !field.isFinal() && OverloadResolver.rank(field.getValueType(), value, false) != null) {
            field.set(self, ArgumentCoercion.convertArgument(value, field.getValueType(), false));
            return;
        }

        throw new IllegalArgumentException("Cannot set property '" + property.getName() + "' of type "
                + property.getType().getName() + " on " + type.getName() + " using a value of type "
                + (value == null ? "null" : value.getClass().getName()));
    }

    private Object convertSetterValue(MemberDescriptor setter, Object value) {
        return ArgumentCoercion.convertArgument(value, setter.getParameterTypes().get(0), true);
    }

    private ExtensionBag extensions() {
        ExtensionBag local = extensions;

        if (local != null) {
            return local;
        }

        synchronized (lock) {
            if (extensions == null) {
                extensions = new ExtensionBag(type);
            }

            return extensions;
        }
    }

    private ServiceLookup instanceServices(T self) {
        MemberDescriptor accessor = Objects.requireNonNull(entry.getServicesAccessor());
        Object services = invokeMember(self, accessor, NO_ARGUMENTS);

        if (services == null) {
            throw new IllegalStateException(accessor.describe() + " returned null");
        }

        return (ServiceLookup) services;
    }

    private T requireTarget() {
        T local = target;

        if (local == null) {
            throw new IllegalStateException("Decorated " + type.getName() + " has no instance yet");
        }

        return local;
    }

    @Override
    public String toString() {
        return "Decorated[" + type.getName() + "]";
    }
}
