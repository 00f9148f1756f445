package dev.fumaz.augment.instance;

import dev.fumaz.augment.annotation.Inject;
import dev.fumaz.augment.annotation.NonExtensible;
import dev.fumaz.augment.coerce.Action;
import dev.fumaz.augment.coerce.DynamicCallable;
import dev.fumaz.augment.exception.UnknownMethodException;
import dev.fumaz.augment.exception.UnknownPropertyException;
import dev.fumaz.augment.service.DefaultServiceRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InterfaceDecorationTest {

    interface Clock {
    }

    static class SystemClock implements Clock {
    }

    interface Profile {
        String getName();

        void setName(String name);

        int getAge();

        void setAge(int age);

        @Inject
        Clock getClock();

        void setClock(Clock clock);

        String shout(String text);

        default String describe() {
            return getName() + " (" + getAge() + ")";
        }

        default String visit(Action<List<String>> action) {
            List<String> visited = new ArrayList<>();
            action.execute(visited);
            return String.join(",", visited);
        }
    }

    @NonExtensible
    interface Locked {
        String getCode();
    }

    @Test
    void shouldStoreManagedPropertiesThroughTypedCalls() {
        Decorated<Profile> decorated = Decorator.decorate(Profile.class).instantiate();
        Profile profile = decorated.getTarget();

        assertNull(profile.getName());
        assertEquals(0, profile.getAge());

        profile.setName("Ada");
        profile.setAge(36);

        assertEquals("Ada", profile.getName());
        assertEquals(36, profile.getAge());
        assertEquals("Ada", decorated.getProperty("name"));
    }

    @Test
    void shouldShareManagedPropertiesWithDynamicAccess() {
        Decorated<Profile> decorated = Decorator.decorate(Profile.class).instantiate();

        decorated.setProperty("name", "Grace");
        decorated.invokeMethod("setAge", 85);

        assertEquals("Grace (85)", decorated.getTarget().describe());
        assertEquals("Grace (85)", decorated.invokeMethod("describe"));
        assertTrue(decorated.hasProperty("age"));
    }

    @Test
    void shouldInjectThroughTypedGetter() {
        SystemClock clock = new SystemClock();
        DecorationOptions options = DecorationOptions.builder()
                .lookupService(new DefaultServiceRegistry().add(Clock.class, clock))
                .build();
        Profile profile = Decorator.decorate(Profile.class, options).instantiate().getTarget();

        assertSame(clock, profile.getClock());

        Clock replacement = new SystemClock();
        profile.setClock(replacement);

        assertSame(replacement, profile.getClock());
    }

    @Test
    void shouldRouteAbstractMethodsToMissingHandler() {
        Decorated<Profile> decorated = Decorator.decorate(Profile.class).instantiate();

        assertThrows(UnknownMethodException.class, () -> decorated.getTarget().shout("hi"));

        decorated.setOnMethodMissing((name, arguments) -> ((String) arguments[0]).toUpperCase());

        assertEquals("HI", decorated.getTarget().shout("hi"));
        assertEquals("HO", decorated.invokeMethod("shout", "ho"));
    }

    @Test
    void shouldCoerceCallablesForDefaultMethods() {
        Decorated<Profile> decorated = Decorator.decorate(Profile.class).instantiate();

        Object visited = decorated.invokeMethod("visit", (DynamicCallable) arguments -> {
            @SuppressWarnings("unchecked")
            List<String> list = (List<String>) arguments[0];
            list.add("a");
            list.add("b");
            return null;
        });

        assertEquals("a,b", visited);
    }

    @Test
    void shouldUseIdentityObjectMethods() {
        DecoratedTypeFactory<Profile> factory = Decorator.decorate(Profile.class);
        Profile first = factory.instantiate().getTarget();
        Profile second = factory.instantiate().getTarget();

        assertEquals(first, first);
        assertNotEquals(first, second);
        assertEquals(System.identityHashCode(first), first.hashCode());
        assertTrue(first.toString().startsWith(Profile.class.getName()));
    }

    @Test
    void shouldRejectConstructorArguments() {
        assertThrows(IllegalArgumentException.class, () -> Decorator.decorate(Profile.class).instantiate("x"));
    }

    @Test
    void shouldRespectNonExtensibleInterfaces() {
        Decorated<Locked> locked = Decorator.decorate(Locked.class).instantiate();

        assertThrows(UnknownPropertyException.class, () -> locked.getProperty("ext"));
        assertFalse(locked.hasProperty("ext"));
        assertNull(locked.getTarget().getCode());
    }
}
