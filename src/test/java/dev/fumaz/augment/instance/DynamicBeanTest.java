package dev.fumaz.augment.instance;

import dev.fumaz.augment.annotation.Inject;
import dev.fumaz.augment.exception.UnknownMethodException;
import dev.fumaz.augment.exception.UnknownPropertyException;
import dev.fumaz.augment.service.DefaultServiceRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DynamicBeanTest {

    interface Clock {
    }

    static class SystemClock implements Clock {
    }

    static class Classifier extends DynamicBean {
        public String classify(Object value) {
            return (String) invokeMethod("describe", value);
        }

        private String describe(Integer value) {
            return "integer";
        }

        private String describe(Number value) {
            return "number";
        }

        private String describe(String value) {
            return "string";
        }

        private String describe(Object value) {
            return "object";
        }

        private String upperCase(String value) {
            return value.toUpperCase();
        }
    }

    static class ConstructionRecorder extends DynamicBean {
        final List<String> log = new ArrayList<>();
        UnknownMethodException missingDuringConstruction;
        UnknownPropertyException extensionsDuringConstruction;
        Object clockDuringConstruction;

        ConstructionRecorder() {
            invokeMethod("record", "constructing");

            try {
                invokeMethod("undeclared");
            } catch (UnknownMethodException e) {
                missingDuringConstruction = e;
            }

            try {
                getProperty("ext");
            } catch (UnknownPropertyException e) {
                extensionsDuringConstruction = e;
            }

            clockDuringConstruction = getProperty("clock");
        }

        private void record(String message) {
            log.add(message);
        }

        @Inject
        public Clock getClock() {
            return null;
        }
    }

    static class Orphan extends DynamicBean {
    }

    @Test
    void shouldSelectPrivateOverloadsByRuntimeType() {
        Classifier classifier = Decorator.decorate(Classifier.class).instantiate().getTarget();

        assertEquals("integer", classifier.classify(1));
        assertEquals("number", classifier.classify(1L));
        assertEquals("string", classifier.classify("1"));
        assertEquals("object", classifier.classify(new Object()));
    }

    @Test
    void shouldPassCharacterSequencesToPrivateStringOverloads() {
        Classifier classifier = Decorator.decorate(Classifier.class).instantiate().getTarget();

        assertEquals("string", classifier.classify(new StringBuilder("1")));
        assertEquals("SHOUT", classifier.invokeMethod("upperCase", new StringBuilder("shout")));
    }

    @Test
    void shouldUsePlainDispatchDuringConstruction() {
        SystemClock clock = new SystemClock();
        DecorationOptions options = DecorationOptions.builder()
                .lookupService(new DefaultServiceRegistry().add(Clock.class, clock))
                .onMethodMissing((name, arguments) -> "hooked " + name)
                .build();

        ConstructionRecorder recorder = Decorator.decorate(ConstructionRecorder.class, options)
                .instantiate()
                .getTarget();

        assertEquals(List.of("constructing"), recorder.log);
        assertNotNull(recorder.missingDuringConstruction);
        assertEquals("undeclared", recorder.missingDuringConstruction.getMethod());
        assertNotNull(recorder.extensionsDuringConstruction);
        assertNull(recorder.clockDuringConstruction);

        assertEquals("hooked undeclared", recorder.invokeMethod("undeclared"));
        assertSame(clock, recorder.getProperty("clock"));
        assertTrue(recorder.hasProperty("ext"));
    }

    @Test
    void shouldExposeDispatcher() {
        Decorated<ConstructionRecorder> decorated = Decorator.decorate(ConstructionRecorder.class).instantiate();

        assertSame(decorated, decorated.getTarget().asDynamicObject());
    }

    @Test
    void shouldRejectBeansCreatedOutsideFactory() {
        IllegalStateException exception = assertThrows(IllegalStateException.class, Orphan::new);

        assertTrue(exception.getMessage().contains(Orphan.class.getName()));
    }

    @Test
    void shouldRejectBeansOfAnotherTypeDuringConstruction() {
        assertThrows(IllegalStateException.class, () -> Decorator.decorate(Nested.class).instantiate());
    }

    static class Nested extends DynamicBean {
        final Orphan inner = new Orphan();
    }
}
