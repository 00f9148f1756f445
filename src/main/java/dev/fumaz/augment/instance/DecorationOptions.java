package dev.fumaz.augment.instance;

import dev.fumaz.augment.annotation.Inject;
import dev.fumaz.augment.annotation.NonExtensible;
import dev.fumaz.augment.missing.MethodMissingHandler;
import dev.fumaz.augment.missing.MissingMemberHooks;
import dev.fumaz.augment.missing.PropertyGetMissingHandler;
import dev.fumaz.augment.missing.PropertySetMissingHandler;
import dev.fumaz.augment.service.ServiceLookup;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration object controlling how {@link Decorator#decorate(Class, DecorationOptions)} reflects a type and
 * how its instances resolve injected services and missing members.
 */
public final class DecorationOptions {

    private final Set<Class<? extends Annotation>> injectionMarkers;
    private final Set<Class<? extends Annotation>> nonExtensibleMarkers;
    private final ServiceLookup lookupService;
    private final MethodMissingHandler onMethodMissing;
    private final PropertyGetMissingHandler onPropertyMissingGet;
    private final PropertySetMissingHandler onPropertyMissingSet;

    private DecorationOptions(Builder builder) {
        this.injectionMarkers = Set.copyOf(builder.injectionMarkers);
        this.nonExtensibleMarkers = Set.copyOf(builder.nonExtensibleMarkers);
        this.lookupService = builder.lookupService;
        this.onMethodMissing = builder.onMethodMissing;
        this.onPropertyMissingGet = builder.onPropertyMissingGet;
        this.onPropertyMissingSet = builder.onPropertyMissingSet;
    }

    public @NotNull Set<Class<? extends Annotation>> getInjectionMarkers() {
        return injectionMarkers;
    }

    public @NotNull Set<Class<? extends Annotation>> getNonExtensibleMarkers() {
        return nonExtensibleMarkers;
    }

    public @NotNull ServiceLookup getLookupService() {
        return lookupService;
    }

    /**
     * Creates a fresh set of type-level hooks from the configured handlers.
     */
    public @NotNull MissingMemberHooks createTypeHooks() {
        return new MissingMemberHooks(onMethodMissing, onPropertyMissingGet, onPropertyMissingSet);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DecorationOptions defaults() {
        return builder().build();
    }

    public static final class Builder {
        private Set<Class<? extends Annotation>> injectionMarkers = Set.of(Inject.class, jakarta.inject.Inject.class);
        private Set<Class<? extends Annotation>> nonExtensibleMarkers = Set.of(NonExtensible.class);
        private ServiceLookup lookupService = ServiceLookup.empty();
        private MethodMissingHandler onMethodMissing;
        private PropertyGetMissingHandler onPropertyMissingGet;
        private PropertySetMissingHandler onPropertyMissingSet;

        public Builder injectionMarkers(@NotNull Set<Class<? extends Annotation>> markers) {
            this.injectionMarkers = Set.copyOf(Objects.requireNonNull(markers, "markers"));
            return this;
        }

        public Builder nonExtensibleMarkers(@NotNull Set<Class<? extends Annotation>> markers) {
            this.nonExtensibleMarkers = Set.copyOf(Objects.requireNonNull(markers, "markers"));
            return this;
        }

        public Builder lookupService(@NotNull ServiceLookup lookupService) {
            this.lookupService = Objects.requireNonNull(lookupService, "lookupService");
            return this;
        }

        public Builder onMethodMissing(@Nullable MethodMissingHandler handler) {
            this.onMethodMissing = handler;
            return this;
        }

        public Builder onPropertyMissingGet(@Nullable PropertyGetMissingHandler handler) {
            this.onPropertyMissingGet = handler;
            return this;
        }

        public Builder onPropertyMissingSet(@Nullable PropertySetMissingHandler handler) {
            this.onPropertyMissingSet = handler;
            return this;
        }

        public DecorationOptions build() {
            return new DecorationOptions(this);
        }
    }
}
