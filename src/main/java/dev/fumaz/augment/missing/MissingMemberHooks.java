package dev.fumaz.augment.missing;

import org.jetbrains.annotations.Nullable;

/**
 * The three optional missing-member handlers. An unset handler means no fallback is configured.
 */
public final class MissingMemberHooks {

    private volatile @Nullable MethodMissingHandler onMethodMissing;
    private volatile @Nullable PropertyGetMissingHandler onPropertyMissingGet;
    private volatile @Nullable PropertySetMissingHandler onPropertyMissingSet;

    public MissingMemberHooks() {
    }

    public MissingMemberHooks(@Nullable MethodMissingHandler onMethodMissing,
                              @Nullable PropertyGetMissingHandler onPropertyMissingGet,
                              @Nullable PropertySetMissingHandler onPropertyMissingSet) {
        this.onMethodMissing = onMethodMissing;
        this.onPropertyMissingGet = onPropertyMissingGet;
        this.onPropertyMissingSet = onPropertyMissingSet;
    }

    public @Nullable MethodMissingHandler getOnMethodMissing() {
        return onMethodMissing;
    }

    public void setOnMethodMissing(@Nullable MethodMissingHandler onMethodMissing) {
        this.onMethodMissing = onMethodMissing;
    }

    public @Nullable PropertyGetMissingHandler getOnPropertyMissingGet() {
        return onPropertyMissingGet;
    }

    public void setOnPropertyMissingGet(@Nullable PropertyGetMissingHandler onPropertyMissingGet) {
        this.onPropertyMissingGet = onPropertyMissingGet;
    }

    public @Nullable PropertySetMissingHandler getOnPropertyMissingSet() {
        return onPropertyMissingSet;
    }

    public void setOnPropertyMissingSet(@Nullable PropertySetMissingHandler onPropertyMissingSet) {
        this.onPropertyMissingSet = onPropertyMissingSet;
    }
}
