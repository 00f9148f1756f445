package dev.fumaz.augment.inject;

import dev.fumaz.augment.annotation.Inject;
import dev.fumaz.augment.annotation.NonExtensible;
import dev.fumaz.augment.exception.UnknownServiceException;
import dev.fumaz.augment.exception.UnresolvedDependencyException;
import dev.fumaz.augment.registry.InjectionPoint;
import dev.fumaz.augment.registry.MemberRegistry;
import dev.fumaz.augment.registry.RegistryEntry;
import dev.fumaz.augment.service.ServiceLookup;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InjectionCacheTest {

    interface Clock {
    }

    static class SystemClock implements Clock {
    }

    static class Service {
        @Inject
        public Clock getClock() {
            return null;
        }

        public void setClock(Clock clock) {
        }

        @Inject
        public Integer getLimit() {
            return null;
        }
    }

    static class CountingLookup implements ServiceLookup {
        private final Object value;
        private final AtomicInteger calls = new AtomicInteger();

        CountingLookup(Object value) {
            this.value = value;
        }

        @Override
        public Object get(Type serviceType) {
            calls.incrementAndGet();

            if (value == null) {
                throw new UnknownServiceException(serviceType, "nothing registered");
            }

            return value;
        }

        int getCalls() {
            return calls.get();
        }
    }

    private final RegistryEntry entry = MemberRegistry.forMarkers(Set.of(Inject.class), Set.of(NonExtensible.class))
            .build(Service.class);
    private final InjectionPoint clock = entry.getInjectionPoint("clock");
    private final InjectionPoint limit = entry.getInjectionPoint("limit");

    @Test
    void shouldQueryLookupAtMostOnce() {
        SystemClock systemClock = new SystemClock();
        CountingLookup lookup = new CountingLookup(systemClock);
        InjectionCache cache = new InjectionCache(entry, lookup);

        assertSame(systemClock, cache.getInjected(clock));
        assertSame(systemClock, cache.getInjected(clock));
        assertEquals(1, lookup.getCalls());
        assertEquals(ResolvedValue.State.RESOLVED, cache.getState(clock).getState());
    }

    @Test
    void shouldNeverQueryAfterExplicitAssignment() {
        CountingLookup lookup = new CountingLookup(new SystemClock());
        InjectionCache cache = new InjectionCache(entry, lookup);
        Clock explicit = new SystemClock();

        cache.setInjected(clock, explicit);

        assertSame(explicit, cache.getInjected(clock));
        assertSame(explicit, cache.getInjected(clock));
        assertEquals(0, lookup.getCalls());
        assertEquals(ResolvedValue.State.EXPLICIT, cache.getState(clock).getState());
    }

    @Test
    void shouldOverwriteResolvedValueWithExplicitAssignment() {
        CountingLookup lookup = new CountingLookup(new SystemClock());
        InjectionCache cache = new InjectionCache(entry, lookup);

        cache.getInjected(clock);
        cache.setInjected(clock, null);

        assertNull(cache.getInjected(clock));
        assertEquals(1, lookup.getCalls());
    }

    @Test
    void shouldRejectAssignmentWithoutSetter() {
        InjectionCache cache = new InjectionCache(entry, new CountingLookup(5));

        assertThrows(IllegalArgumentException.class, () -> cache.setInjected(limit, 3));
    }

    @Test
    void shouldRejectValuesOfTheWrongType() {
        InjectionCache cache = new InjectionCache(entry, new CountingLookup(null));

        assertThrows(IllegalArgumentException.class, () -> cache.setInjected(clock, "not a clock"));
    }

    @Test
    void shouldNamePointAndKeyWhenLookupFails() {
        CountingLookup lookup = new CountingLookup(null);
        InjectionCache cache = new InjectionCache(entry, lookup);

        UnresolvedDependencyException exception = assertThrows(UnresolvedDependencyException.class,
                () -> cache.getInjected(clock));

        assertEquals("clock", exception.getPoint());
        assertEquals(Clock.class, exception.getKey());
        assertTrue(exception.getCause() instanceof UnknownServiceException);
        assertTrue(exception.getMessage().contains("clock"));
        assertTrue(exception.getMessage().contains(Clock.class.getTypeName()));
        assertEquals(ResolvedValue.State.UNRESOLVED, cache.getState(clock).getState());
    }

    @Test
    void shouldPropagateOtherLookupErrorsUnchanged() {
        IllegalStateException failure = new IllegalStateException("lookup offline");
        InjectionCache cache = new InjectionCache(entry, key -> {
            throw failure;
        });

        assertSame(failure, assertThrows(IllegalStateException.class, () -> cache.getInjected(clock)));
    }

    @Test
    void shouldUseBoxedKeyForPrimitiveGetters() {
        InjectionCache cache = new InjectionCache(entry, key -> key == Integer.class ? 42 : null);

        assertEquals(42, cache.getInjected(limit));
    }

    @Test
    void shouldResolveOnceUnderConcurrentReads() throws Exception {
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        SystemClock systemClock = new SystemClock();
        InjectionCache cache = new InjectionCache(entry, key -> {
            calls.incrementAndGet();
            return systemClock;
        });

        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            List<Future<Object>> results = new ArrayList<>();

            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return cache.getInjected(clock);
                }));
            }

            start.countDown();

            for (Future<Object> result : results) {
                assertSame(systemClock, result.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, calls.get());
    }

    @Test
    void shouldResolveDifferentPointsIndependently() {
        SystemClock systemClock = new SystemClock();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        InjectionCache[] cache = new InjectionCache[1];

        cache[0] = new InjectionCache(entry, key -> {
            if (!Clock.class.equals(key)) {
                return 3;
            }

            Future<Object> other = executor.submit(() -> cache[0].getInjected(limit));

            try {
                assertEquals(3, other.get(10, TimeUnit.SECONDS));
            } catch (Exception e) {
                throw new IllegalStateException("limit was not resolved while clock was being looked up", e);
            }

            return systemClock;
        });

        try {
            assertSame(systemClock, cache[0].getInjected(clock));
            assertEquals(3, cache[0].getInjected(limit));
        } finally {
            executor.shutdownNow();
        }
    }
}
