package dev.fumaz.augment.dispatch;

/**
 * How well a runtime argument fits a declared parameter, most specific first.
 */
public enum MatchTier {

    /**
     * The parameter type is the argument's runtime type, or a bare callable is bridged to a capability parameter.
     */
    EXACT(0),
    /**
     * The parameter is a numeric supertype of the argument, or a numeric widening applies.
     */
    NUMERIC(1),
    /**
     * The parameter is some other supertype of the argument. {@code null} arguments match here.
     */
    SUPERTYPE(2),
    /**
     * A character sequence other than a {@code String} converted for a {@code String} parameter.
     */
    STRING(3),
    /**
     * A string argument converted to the parameter's enum type.
     */
    ENUM(4),
    /**
     * The parameter is {@code Object}.
     */
    OBJECT(5);

    private final int distance;

    MatchTier(int distance) {
        this.distance = distance;
    }

    public int getDistance() {
        return distance;
    }

}
