package dev.fumaz.augment.instance;

import dev.fumaz.augment.exception.RegistrationException;
import dev.fumaz.augment.reflection.Reflections;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.description.modifier.FieldManifestation;
import net.bytebuddy.description.modifier.Visibility;
import net.bytebuddy.dynamic.DynamicType;
import net.bytebuddy.dynamic.loading.ClassLoadingStrategy;
import net.bytebuddy.dynamic.scaffold.subclass.ConstructorStrategy;
import net.bytebuddy.implementation.MethodDelegation;
import net.bytebuddy.matcher.ElementMatcher;
import net.bytebuddy.matcher.ElementMatchers;
import org.jetbrains.annotations.NotNull;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.lang.reflect.Modifier;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import static net.bytebuddy.matcher.ElementMatchers.not;

/**
 * Generates the class that backs every decorated instance of a type: a subclass for classes, an {@code Object}
 * subclass implementing the type for interfaces. Every overridable method of the generated class hands the call to
 * {@link DecoratedMethodInterceptor}, which finds the instance's dispatcher through a generated field.
 * <p>
 * Generated classes are defined in the package and class loader of their base type, so package-private types can be
 * decorated as well. Final and private types cannot.
 */
final class DecoratedClassGenerator {

    static final String DISPATCHER_FIELD = "augment$dispatcher";

    private static final Logger LOGGER = Logger.getLogger(DecoratedClassGenerator.class.getName());
    private static final AtomicInteger SEQUENCE = new AtomicInteger();
    private static final ClassValue<Class<?>> GENERATED = new ClassValue<>() {
        @Override
        protected Class<?> computeValue(Class<?> type) {
            return generate(type);
        }
    };

    private DecoratedClassGenerator() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    @SuppressWarnings("unchecked")
    static <T> @NotNull Class<? extends T> subclassOf(@NotNull Class<T> type) {
        return (Class<? extends T>) GENERATED.get(type);
    }

    /**
     * The handle of the field holding an instance's dispatcher in a class returned by {@link #subclassOf(Class)}.
     */
    static @NotNull VarHandle dispatcherHandle(@NotNull Class<?> generated) {
        try {
            return Reflections.lookupFor(generated).findVarHandle(generated, DISPATCHER_FIELD, Object.class);
        } catch (NoSuchFieldException | IllegalAccessException e) {
            throw new RegistrationException("Cannot access the dispatcher of " + generated.getName(), e);
        }
    }

    private static Class<?> generate(Class<?> type) {
        int modifiers = type.getModifiers();

        if (type.isPrimitive() || type.isArray() || Modifier.isFinal(modifiers)) {
            throw new RegistrationException("Cannot decorate final type " + type.getName());
        }

        if (Modifier.isPrivate(modifiers)) {
            throw new RegistrationException("Cannot decorate private type " + type.getName());
        }

        MethodHandles.Lookup lookup = Reflections.lookupFor(type);

        if (lookup.lookupClass() != type) {
            throw new RegistrationException("Cannot define classes in the package of " + type.getName());
        }

        DynamicType.Builder<?> builder = type.isInterface()
                ? new ByteBuddy().subclass(Object.class, ConstructorStrategy.Default.DEFAULT_CONSTRUCTOR).implement(type)
                : new ByteBuddy().subclass(type, ConstructorStrategy.Default.IMITATE_SUPER_CLASS);

        Class<?> generated = builder.name(type.getName() + "$Decorated$" + SEQUENCE.incrementAndGet())
                .defineField(DISPATCHER_FIELD, Object.class, Visibility.PRIVATE, FieldManifestation.VOLATILE)
                .method(dispatchedMethods())
                .intercept(MethodDelegation.to(DecoratedMethodInterceptor.class))
                .make()
                .load(type.getClassLoader(), ClassLoadingStrategy.UsingLookup.of(lookup))
                .getLoaded();

        LOGGER.fine(() -> "Generated " + generated.getName() + " for " + type.getName());
        return generated;
    }

    /**
     * Everything but the methods of {@code Object} and the dynamic dispatch surface, which keep their own bodies.
     */
    private static ElementMatcher.Junction<MethodDescription> dispatchedMethods() {
        ElementMatcher.Junction<MethodDescription> surface = ElementMatchers.isDeclaredBy(Object.class);
        surface = surface.or(ElementMatchers.isDeclaredBy(DynamicBean.class));
        surface = surface.or(ElementMatchers.isDeclaredBy(DynamicObject.class));

        return not(surface).and(not(ElementMatchers.<MethodDescription>isFinal()));
    }
}
