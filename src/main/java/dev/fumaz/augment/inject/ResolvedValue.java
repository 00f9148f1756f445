package dev.fumaz.augment.inject;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The state of one injection point on one instance.
 */
public final class ResolvedValue {

    public enum State {
        UNRESOLVED,
        RESOLVED,
        EXPLICIT
    }

    static final ResolvedValue UNRESOLVED = new ResolvedValue(State.UNRESOLVED, null);

    private final @NotNull State state;
    private final @Nullable Object value;

    private ResolvedValue(@NotNull State state, @Nullable Object value) {
        this.state = state;
        this.value = value;
    }

    static @NotNull ResolvedValue resolved(@NotNull Object value) {
        return new ResolvedValue(State.RESOLVED, value);
    }

    static @NotNull ResolvedValue explicit(@Nullable Object value) {
        return new ResolvedValue(State.EXPLICIT, value);
    }

    public @NotNull State getState() {
        return state;
    }

    public @Nullable Object getValue() {
        return value;
    }

    public boolean isSettled() {
        return state != State.UNRESOLVED;
    }

    @Override
    public String toString() {
        return state == State.UNRESOLVED ? "unresolved" : state.name().toLowerCase() + "(" + value + ")";
    }
}
