package dev.fumaz.augment.dispatch;

import dev.fumaz.augment.annotation.Inject;
import dev.fumaz.augment.annotation.NonExtensible;
import dev.fumaz.augment.coerce.Action;
import dev.fumaz.augment.coerce.DynamicCallable;
import dev.fumaz.augment.registry.MemberDescriptor;
import dev.fumaz.augment.registry.MemberRegistry;
import dev.fumaz.augment.registry.RegistryEntry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class OverloadResolverTest {

    enum Color {
        RED,
        GREEN
    }

    static class Configurable {
        public String configure(Integer value, Action<String> action) {
            return "integer";
        }

        public String configure(String value, Action<String> action) {
            return "string";
        }

        public String configure(Object value, Action<String> action) {
            return "object";
        }
    }

    static class Numbers {
        private String accept(Integer value) {
            return "integer";
        }

        private String accept(Number value) {
            return "number";
        }

        private String accept(String value) {
            return "string";
        }

        private String accept(Object value) {
            return "object";
        }
    }

    static class Paint {
        public String paint(Color color) {
            return "enum";
        }

        public String paint(String color) {
            return "string";
        }

        public String tint(Color color) {
            return "enum";
        }

        public String widen(long value) {
            return "long";
        }
    }

    static class Tied {
        public String pick(CharSequence value) {
            return "charSequence";
        }

        public String pick(Comparable<?> value) {
            return "comparable";
        }
    }

    private final MemberRegistry registry = MemberRegistry.forMarkers(Set.of(Inject.class), Set.of(NonExtensible.class));

    private String resolvedTypeOf(Class<?> type, String name, Object... arguments) {
        RegistryEntry entry = registry.build(type);
        MemberDescriptor descriptor = OverloadResolver.resolve(entry, name, arguments);
        return descriptor == null ? null : descriptor.getParameterTypes().get(0).getSimpleName();
    }

    @Test
    void shouldPreferExactTypeWithTrailingCallable() {
        DynamicCallable callable = arguments -> null;

        assertEquals("String", resolvedTypeOf(Configurable.class, "configure", "value", callable));
        assertEquals("Integer", resolvedTypeOf(Configurable.class, "configure", 5, callable));
        assertEquals("Object", resolvedTypeOf(Configurable.class, "configure", List.of(), callable));
    }

    @Test
    void shouldAcceptCapabilityObjectInTrailingPosition() {
        Action<String> action = value -> {
        };

        assertEquals("String", resolvedTypeOf(Configurable.class, "configure", "value", action));
    }

    @Test
    void shouldRankNumericSupertypeBetweenExactAndObject() {
        assertEquals("Integer", resolvedTypeOf(Numbers.class, "accept", 1));
        assertEquals("Number", resolvedTypeOf(Numbers.class, "accept", 1L));
        assertEquals("String", resolvedTypeOf(Numbers.class, "accept", "1"));
        assertEquals("Object", resolvedTypeOf(Numbers.class, "accept", new Object()));
    }

    @Test
    void shouldPreferStringOverEnumCoercion() {
        assertEquals("String", resolvedTypeOf(Paint.class, "paint", "red"));
        assertEquals("Color", resolvedTypeOf(Paint.class, "paint", Color.RED));
        assertEquals("Color", resolvedTypeOf(Paint.class, "tint", "green"));
    }

    @Test
    void shouldWidenNumericArguments() {
        assertEquals("long", resolvedTypeOf(Paint.class, "widen", 3));
        assertNull(resolvedTypeOf(Paint.class, "widen", 3.0d));
    }

    @Test
    void shouldBreakTiesByDeclarationOrder() {
        assertEquals("CharSequence", resolvedTypeOf(Tied.class, "pick", "value"));
    }

    @Test
    void shouldReportNoMatch() {
        assertNull(resolvedTypeOf(Numbers.class, "accept", 1, 2));
        assertNull(resolvedTypeOf(Numbers.class, "unknown"));
        assertNull(resolvedTypeOf(Paint.class, "widen", (Object) null));
    }

    @Test
    void shouldRankArgumentsAgainstParameters() {
        assertEquals(MatchTier.EXACT, OverloadResolver.rank(int.class, 1, false));
        assertEquals(MatchTier.NUMERIC, OverloadResolver.rank(Number.class, 1, false));
        assertEquals(MatchTier.SUPERTYPE, OverloadResolver.rank(CharSequence.class, "value", false));
        assertEquals(MatchTier.OBJECT, OverloadResolver.rank(Object.class, "value", false));
        assertEquals(MatchTier.ENUM, OverloadResolver.rank(Color.class, "red", false));
        assertEquals(MatchTier.STRING, OverloadResolver.rank(String.class, new StringBuilder("value"), false));
        assertEquals(MatchTier.SUPERTYPE, OverloadResolver.rank(CharSequence.class, new StringBuilder("value"), false));
        assertNull(OverloadResolver.rank(Runnable.class, (DynamicCallable) arguments -> null, false));
        assertEquals(MatchTier.EXACT, OverloadResolver.rank(Runnable.class, (DynamicCallable) arguments -> null, true));
    }

    @Test
    void shouldSelectAmongArbitraryCandidates() {
        List<List<Class<?>>> candidates = List.of(List.of(Object.class), List.of(String.class));

        assertEquals(List.of(String.class), OverloadResolver.select(candidates, candidate -> candidate,
                new Object[]{"value"}));
    }
}
