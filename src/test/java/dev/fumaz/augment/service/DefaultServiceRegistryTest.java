package dev.fumaz.augment.service;

import dev.fumaz.augment.exception.UnknownServiceException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultServiceRegistryTest {

    interface Repository {
    }

    static class MemoryRepository implements Repository {
    }

    static class FileRepository implements Repository {
    }

    @Test
    void shouldResolveExactType() {
        MemoryRepository repository = new MemoryRepository();
        DefaultServiceRegistry registry = new DefaultServiceRegistry().add(MemoryRepository.class, repository);

        assertSame(repository, registry.get(MemoryRepository.class));
    }

    @Test
    void shouldResolveAssignableType() {
        MemoryRepository repository = new MemoryRepository();
        DefaultServiceRegistry registry = new DefaultServiceRegistry().add(MemoryRepository.class, repository);

        assertSame(repository, registry.get(Repository.class));
    }

    @Test
    void shouldPreferExactRegistrationOverAssignable() {
        MemoryRepository memory = new MemoryRepository();
        Repository exact = new FileRepository();
        DefaultServiceRegistry registry = new DefaultServiceRegistry()
                .add(MemoryRepository.class, memory)
                .add(Repository.class, exact);

        assertSame(exact, registry.get(Repository.class));
    }

    @Test
    void shouldReportAmbiguousLookups() {
        DefaultServiceRegistry registry = new DefaultServiceRegistry()
                .add(MemoryRepository.class, new MemoryRepository())
                .add(FileRepository.class, new FileRepository());

        UnknownServiceException exception = assertThrows(UnknownServiceException.class,
                () -> registry.get(Repository.class));

        assertEquals(Repository.class, exception.getKey());
        assertTrue(exception.getMessage().contains("Multiple"));
    }

    @Test
    void shouldReportMissingServices() {
        assertThrows(UnknownServiceException.class, () -> new DefaultServiceRegistry().get(Repository.class));
        assertThrows(UnknownServiceException.class, () -> ServiceLookup.empty().get(Repository.class));
    }

    @Test
    void shouldRejectDuplicateRegistrations() {
        DefaultServiceRegistry registry = new DefaultServiceRegistry().add(Repository.class, new MemoryRepository());

        assertThrows(IllegalArgumentException.class, () -> registry.add(Repository.class, new FileRepository()));
    }

    @Test
    void shouldCreateSingletonOnce() {
        AtomicInteger created = new AtomicInteger();
        DefaultServiceRegistry registry = new DefaultServiceRegistry()
                .addProvider(Repository.class, Provider.singleton(() -> {
                    created.incrementAndGet();
                    return new MemoryRepository();
                }));

        Object first = registry.get(Repository.class);
        Object second = registry.get(Repository.class);

        assertSame(first, second);
        assertEquals(1, created.get());
    }

    @Test
    void shouldReportProvidersReturningNull() {
        DefaultServiceRegistry registry = new DefaultServiceRegistry()
                .addProvider(Repository.class, lookup -> null);

        assertThrows(UnknownServiceException.class, () -> registry.get(Repository.class));
    }
}
