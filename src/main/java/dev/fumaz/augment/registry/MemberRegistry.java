package dev.fumaz.augment.registry;

import dev.fumaz.augment.annotation.Inject;
import dev.fumaz.augment.exception.RegistrationException;
import dev.fumaz.augment.instance.DynamicBean;
import dev.fumaz.augment.instance.DynamicObject;
import dev.fumaz.augment.reflection.Reflections;
import dev.fumaz.augment.service.ServiceLookup;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Reflects types into {@link RegistryEntry registry entries}. Each registry is bound to one set of injection and
 * non-extensible markers; entries are computed on first request and cached per type.
 */
public final class MemberRegistry {

    private static final Logger LOGGER = Logger.getLogger(MemberRegistry.class.getName());
    private static final ConcurrentMap<Markers, MemberRegistry> REGISTRIES = new ConcurrentHashMap<>();
    private static final Comparator<Method> CANONICAL_METHOD_ORDER = Comparator
            .comparing(Method::getName)
            .thenComparingInt(Method::getParameterCount)
            .thenComparing(method -> Arrays.stream(method.getParameterTypes())
                    .map(Class::getName)
                    .collect(Collectors.joining(",")));

    private final @NotNull Set<Class<? extends Annotation>> injectionMarkers;
    private final @NotNull Set<Class<? extends Annotation>> nonExtensibleMarkers;
    private final ClassValue<RegistryEntry> entries = new ClassValue<>() {
        @Override
        protected RegistryEntry computeValue(Class<?> type) {
            return new EntryBuilder(type).build();
        }
    };

    private MemberRegistry(@NotNull Set<Class<? extends Annotation>> injectionMarkers,
                           @NotNull Set<Class<? extends Annotation>> nonExtensibleMarkers) {
        this.injectionMarkers = injectionMarkers;
        this.nonExtensibleMarkers = nonExtensibleMarkers;
    }

    /**
     * Returns the shared registry for the given marker sets, so that types registered under identical markers
     * are reflected only once.
     */
    public static @NotNull MemberRegistry forMarkers(@NotNull Set<Class<? extends Annotation>> injectionMarkers,
                                                     @NotNull Set<Class<? extends Annotation>> nonExtensibleMarkers) {
        Markers markers = new Markers(Set.copyOf(injectionMarkers), Set.copyOf(nonExtensibleMarkers));
        return REGISTRIES.computeIfAbsent(markers,
                key -> new MemberRegistry(key.injection, key.nonExtensible));
    }

    public @NotNull RegistryEntry build(@NotNull Class<?> type) {
        Objects.requireNonNull(type, "type");

        if (type.isPrimitive() || type.isArray() || type.isAnnotation() || type.isEnum()) {
            throw new RegistrationException("Cannot decorate " + type.getTypeName());
        }

        return entries.get(type);
    }

    public @NotNull Set<Class<? extends Annotation>> getInjectionMarkers() {
        return injectionMarkers;
    }

    public @NotNull Set<Class<? extends Annotation>> getNonExtensibleMarkers() {
        return nonExtensibleMarkers;
    }

    static @NotNull String propertyNameOf(@NotNull String methodName) {
        String stripped;

        if ((methodName.startsWith("get") || methodName.startsWith("set")) && methodName.length() > 3) {
            stripped = methodName.substring(3);
        } else if (methodName.startsWith("is") && methodName.length() > 2) {
            stripped = methodName.substring(2);
        } else {
            return methodName;
        }

        if (stripped.length() > 1 && Character.isUpperCase(stripped.charAt(0))
                && Character.isUpperCase(stripped.charAt(1))) {
            return stripped;
        }

        return Character.toLowerCase(stripped.charAt(0)) + stripped.substring(1);
    }

    static boolean isGetter(@NotNull Method method) {
        if (method.getParameterCount() != 0 || Modifier.isStatic(method.getModifiers())) {
            return false;
        }

        String name = method.getName();

        if (name.startsWith("get") && name.length() > 3) {
            return method.getReturnType() != void.class;
        }

        return name.startsWith("is") && name.length() > 2
                && (method.getReturnType() == boolean.class || method.getReturnType() == Boolean.class);
    }

    static boolean isSetter(@NotNull Method method) {
        return method.getParameterCount() == 1
                && !Modifier.isStatic(method.getModifiers())
                && method.getName().startsWith("set")
                && method.getName().length() > 3;
    }

    private static boolean isWalked(@Nullable Class<?> type) {
        return type != null && type != Object.class && type != DynamicBean.class;
    }

    private static boolean isDispatchSurface(@NotNull Class<?> type) {
        return type == DynamicBean.class || type == DynamicObject.class;
    }

    private final class EntryBuilder {

        private final Class<?> type;
        private final List<MemberDescriptor> methods = new ArrayList<>();
        private final Map<String, MemberDescriptor> fields = new LinkedHashMap<>();
        private int order;

        private EntryBuilder(Class<?> type) {
            this.type = type;
        }

        private RegistryEntry build() {
            collectMethods();
            collectFields();

            Map<String, List<MemberDescriptor>> methodsByName = new LinkedHashMap<>();
            for (MemberDescriptor method : methods) {
                methodsByName.computeIfAbsent(method.getName(), ignored -> new ArrayList<>()).add(method);
            }

            for (Map.Entry<String, List<MemberDescriptor>> group : methodsByName.entrySet()) {
                group.setValue(List.copyOf(group.getValue()));
            }

            Map<String, PropertyDescriptor> properties = collectProperties();
            List<InjectionPoint> injectionPoints = collectInjectionPoints(properties);

            RegistryEntry entry = new RegistryEntry(type, methodsByName, properties, injectionPoints,
                    isNonExtensible(), findServicesAccessor(injectionPoints),
                    findMethod("methodMissing", String.class, Object[].class),
                    findMethod("propertyMissing", String.class),
                    findMethod("propertyMissing", String.class, Object.class));

            LOGGER.fine(() -> "Registered " + type.getName() + ": " + methods.size() + " methods, "
                    + properties.size() + " properties, " + injectionPoints.size() + " injection points");

            return entry;
        }

        private void collectMethods() {
            Set<String> seen = new HashSet<>();

            if (!type.isInterface()) {
                for (Class<?> current = type; isWalked(current); current = current.getSuperclass()) {
                    Method[] declared = current.getDeclaredMethods();
                    Arrays.sort(declared, CANONICAL_METHOD_ORDER);

                    for (Method method : declared) {
                        addMethod(method, seen);
                    }
                }
            }

            Method[] inherited = type.getMethods();
            Arrays.sort(inherited, CANONICAL_METHOD_ORDER);

            for (Method method : inherited) {
                if (type.isInterface() && Modifier.isStatic(method.getModifiers())) {
                    continue;
                }

                addMethod(method, seen);
            }

            if (type.isInterface()) {
                Method[] objectMethods = Object.class.getMethods();
                Arrays.sort(objectMethods, CANONICAL_METHOD_ORDER);

                for (Method method : objectMethods) {
                    addMethod(method, seen);
                }
            }
        }

        private void addMethod(Method method, Set<String> seen) {
            if (method.isSynthetic() || method.isBridge() || isDispatchSurface(method.getDeclaringClass())) {
                return;
            }

            if (!seen.add(signatureOf(method))) {
                return;
            }

            methods.add(MemberDescriptor.method(method, order++));
        }

        private void collectFields() {
            for (Class<?> current = type; isWalked(current); current = current.getSuperclass()) {
                Field[] declared = current.getDeclaredFields();
                Arrays.sort(declared, Comparator.comparing(Field::getName));

                for (Field field : declared) {
                    if (field.isSynthetic() || Modifier.isStatic(field.getModifiers())) {
                        continue;
                    }

                    fields.putIfAbsent(field.getName(), MemberDescriptor.field(field, order++));
                }
            }
        }

        private Map<String, PropertyDescriptor> collectProperties() {
            Map<String, MemberDescriptor> getters = new LinkedHashMap<>();
            Map<String, List<MemberDescriptor>> setters = new LinkedHashMap<>();
            Set<String> names = new LinkedHashSet<>();

            for (MemberDescriptor method : methods) {
                Method reflected = method.getMethod();

                if (isGetter(reflected)) {
                    String property = propertyNameOf(reflected.getName());
                    getters.putIfAbsent(property, method);
                    names.add(property);
                } else if (isSetter(reflected)) {
                    String property = propertyNameOf(reflected.getName());
                    setters.computeIfAbsent(property, ignored -> new ArrayList<>()).add(method);
                    names.add(property);
                }
            }

            names.addAll(fields.keySet());

            Map<String, PropertyDescriptor> properties = new LinkedHashMap<>();

            for (String name : names) {
                properties.put(name, new PropertyDescriptor(name, getters.get(name),
                        setters.getOrDefault(name, List.of()), fields.get(name)));
            }

            return properties;
        }

        private List<InjectionPoint> collectInjectionPoints(Map<String, PropertyDescriptor> properties) {
            List<InjectionPoint> points = new ArrayList<>();

            for (MemberDescriptor method : methods) {
                Method reflected = method.getMethod();
                List<Annotation> markers = findMarkers(reflected);

                if (markers.isEmpty()) {
                    continue;
                }

                if (markers.size() > 1) {
                    throw new RegistrationException("Cannot use " + describeMarkers(markers) + " together on "
                            + method.describe() + " of " + type.getName());
                }

                if (!isGetter(reflected)) {
                    throw new RegistrationException("Cannot use @" + markers.get(0).annotationType().getSimpleName()
                            + " on " + method.describe() + " of " + type.getName()
                            + ": injection is only supported on getter methods");
                }

                String propertyName = propertyNameOf(reflected.getName());
                PropertyDescriptor property = properties.get(propertyName);
                MemberDescriptor setter = pairSetter(method, property);
                Type key = keyOf(reflected, markers.get(0));

                points.add(new InjectionPoint(points.size(), propertyName, method, setter, key,
                        markers.get(0).annotationType()));
            }

            return points;
        }

        private MemberDescriptor pairSetter(MemberDescriptor getter, PropertyDescriptor property) {
            if (property == null || property.getSetters().isEmpty()) {
                return null;
            }

            Class<?> valueType = Reflections.wrapperType(getter.getValueType());

            for (MemberDescriptor setter : property.getSetters()) {
                Class<?> parameterType = Reflections.wrapperType(setter.getParameterTypes().get(0));

                if (valueType.isAssignableFrom(parameterType)) {
                    return setter;
                }
            }

            throw new RegistrationException("Cannot pair " + property.getSetters().get(0).describe()
                    + " with injected " + getter.describe() + " of " + type.getName()
                    + ": the setter does not accept values of type " + getter.getValueType().getName());
        }

        private Type keyOf(Method getter, Annotation marker) {
            if (marker instanceof Inject && ((Inject) marker).service() != void.class) {
                return ((Inject) marker).service();
            }

            Type generic = getter.getGenericReturnType();

            if (generic instanceof Class<?>) {
                return Reflections.wrapperType((Class<?>) generic);
            }

            return generic;
        }

        /**
         * Collects the injection markers on a method or on any declaration it overrides.
         */
        private List<Annotation> findMarkers(Method method) {
            Map<Class<? extends Annotation>, Annotation> found = new LinkedHashMap<>();
            Deque<Class<?>> pending = new ArrayDeque<>();
            Set<Class<?>> visited = new HashSet<>();
            pending.add(type);

            while (!pending.isEmpty()) {
                Class<?> current = pending.poll();

                if (!visited.add(current) || current == Object.class) {
                    continue;
                }

                Method declared = declaredMethod(current, method);

                if (declared != null) {
                    for (Class<? extends Annotation> marker : injectionMarkers) {
                        Annotation annotation = declared.getAnnotation(marker);

                        if (annotation != null) {
                            found.putIfAbsent(marker, annotation);
                        }
                    }
                }

                if (current.getSuperclass() != null) {
                    pending.add(current.getSuperclass());
                }

                pending.addAll(Arrays.asList(current.getInterfaces()));
            }

            return new ArrayList<>(found.values());
        }

        private Method declaredMethod(Class<?> owner, Method method) {
            try {
                return owner.getDeclaredMethod(method.getName(), method.getParameterTypes());
            } catch (NoSuchMethodException e) {
                return null;
            }
        }

        private boolean isNonExtensible() {
            Deque<Class<?>> pending = new ArrayDeque<>();
            Set<Class<?>> visited = new HashSet<>();
            pending.add(type);

            while (!pending.isEmpty()) {
                Class<?> current = pending.poll();

                if (!visited.add(current)) {
                    continue;
                }

                for (Class<? extends Annotation> marker : nonExtensibleMarkers) {
                    if (current.isAnnotationPresent(marker)) {
                        return true;
                    }
                }

                if (current.getSuperclass() != null) {
                    pending.add(current.getSuperclass());
                }

                pending.addAll(Arrays.asList(current.getInterfaces()));
            }

            return false;
        }

        private MemberDescriptor findServicesAccessor(List<InjectionPoint> injectionPoints) {
            for (MemberDescriptor method : methods) {
                if (!method.getName().equals("getServices") || method.getArity() != 0) {
                    continue;
                }

                if (!ServiceLookup.class.isAssignableFrom(method.getValueType()) || method.isAbstract()) {
                    continue;
                }

                boolean injected = injectionPoints.stream().anyMatch(point -> point.getGetter() == method);
                return injected ? null : method;
            }

            return null;
        }

        private MemberDescriptor findMethod(String name, Class<?>... parameterTypes) {
            for (MemberDescriptor method : methods) {
                if (method.getName().equals(name) && method.getParameterTypes().equals(Arrays.asList(parameterTypes))) {
                    return method;
                }
            }

            return null;
        }

        private String describeMarkers(List<Annotation> markers) {
            return markers.stream()
                    .map(annotation -> "@" + annotation.annotationType().getName())
                    .collect(Collectors.joining(" and "));
        }

        private String signatureOf(Method method) {
            return method.getName() + Arrays.stream(method.getParameterTypes())
                    .map(Class::getName)
                    .collect(Collectors.joining(",", "(", ")"));
        }
    }

    private static final class Markers {
        private final Set<Class<? extends Annotation>> injection;
        private final Set<Class<? extends Annotation>> nonExtensible;

        private Markers(Set<Class<? extends Annotation>> injection, Set<Class<? extends Annotation>> nonExtensible) {
            this.injection = injection;
            this.nonExtensible = nonExtensible;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }

            if (!(o instanceof Markers)) {
                return false;
            }

            Markers that = (Markers) o;
            return injection.equals(that.injection) && nonExtensible.equals(that.nonExtensible);
        }

        @Override
        public int hashCode() {
            return 31 * injection.hashCode() + nonExtensible.hashCode();
        }
    }
}
