package dev.fumaz.augment.dispatch;

import dev.fumaz.augment.coerce.ArgumentCoercion;
import dev.fumaz.augment.coerce.CallbackCoercion;
import dev.fumaz.augment.coerce.DynamicCallable;
import dev.fumaz.augment.reflection.NumberConversions;
import dev.fumaz.augment.reflection.Reflections;
import dev.fumaz.augment.registry.MemberDescriptor;
import dev.fumaz.augment.registry.RegistryEntry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Selects the overload that best fits a list of runtime arguments.
 * <p>
 * Candidates must have the same arity as the argument list. Each argument is ranked against its parameter by
 * {@link MatchTier}; the candidate with the lowest total distance wins, then the one needing fewer conversions,
 * then the one declared first.
 */
public final class OverloadResolver {

    private static final Logger LOGGER = Logger.getLogger(OverloadResolver.class.getName());

    private OverloadResolver() {
    }

    public static @Nullable MemberDescriptor resolve(@NotNull RegistryEntry entry, @NotNull String name,
                                                     @NotNull Object[] arguments) {
        List<MemberDescriptor> candidates = entry.getMethods(name);

        if (candidates.isEmpty()) {
            return null;
        }

        MemberDescriptor selected = select(candidates, MemberDescriptor::getParameterTypes, arguments);

        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Resolved " + entry.getType().getSimpleName() + "." + name + " with " + arguments.length
                    + " arguments to " + (selected == null ? "no match" : selected.describe()));
        }

        return selected;
    }

    /**
     * Picks the best candidate of a list whose order is the declaration order, or {@code null} if none accepts the
     * arguments.
     */
    public static <C> @Nullable C select(@NotNull List<C> candidates,
                                         @NotNull Function<C, List<Class<?>>> parameterTypes,
                                         @NotNull Object[] arguments) {
        C best = null;
        int bestDistance = Integer.MAX_VALUE;
        int bestConversions = Integer.MAX_VALUE;

        for (C candidate : candidates) {
            List<Class<?>> parameters = parameterTypes.apply(candidate);

            if (parameters.size() != arguments.length) {
                continue;
            }

            int distance = 0;
            int conversions = 0;
            boolean applicable = true;

            for (int i = 0; i < arguments.length; i++) {
                boolean last = i == arguments.length - 1;
                MatchTier tier = rank(parameters.get(i), arguments[i], last);

                if (tier == null) {
                    applicable = false;
                    break;
                }

                distance += tier.getDistance();

                if (needsConversion(parameters.get(i), arguments[i], last)) {
                    conversions++;
                }
            }

            if (!applicable) {
                continue;
            }

            if (distance < bestDistance || (distance == bestDistance && conversions < bestConversions)) {
                best = candidate;
                bestDistance = distance;
                bestConversions = conversions;
            }
        }

        return best;
    }

    /**
     * Ranks one argument against one parameter, or returns {@code null} if the argument cannot be passed at all.
     * Bare callables are only bridged to a capability type in the last parameter position.
     */
    public static @Nullable MatchTier rank(@NotNull Class<?> parameterType, @Nullable Object argument, boolean last) {
        if (argument == null) {
            if (parameterType.isPrimitive()) {
                return null;
            }

            return parameterType == Object.class ? MatchTier.OBJECT : MatchTier.SUPERTYPE;
        }

        Class<?> parameter = Reflections.wrapperType(parameterType);
        Class<?> argumentType = argument.getClass();

        if (parameter == argumentType) {
            return MatchTier.EXACT;
        }

        if (parameter == DynamicCallable.class && argument instanceof DynamicCallable) {
            return MatchTier.EXACT;
        }

        if (last && CallbackCoercion.needsCoercion(parameter, argument)) {
            return MatchTier.EXACT;
        }

        if (parameter == Object.class) {
            return MatchTier.OBJECT;
        }

        if (parameter.isAssignableFrom(argumentType)) {
            boolean numeric = argument instanceof Number && Number.class.isAssignableFrom(parameter);
            return numeric ? MatchTier.NUMERIC : MatchTier.SUPERTYPE;
        }

        if (NumberConversions.canWiden(argumentType, parameter)) {
            return MatchTier.NUMERIC;
        }

        if (ArgumentCoercion.isStringCoercible(parameter, argument)) {
            return MatchTier.STRING;
        }

        if (ArgumentCoercion.isEnumCoercible(parameter, argument)) {
            return MatchTier.ENUM;
        }

        return null;
    }

    private static boolean needsConversion(Class<?> parameterType, Object argument, boolean last) {
        if (argument == null) {
            return false;
        }

        if (last && CallbackCoercion.needsCoercion(parameterType, argument)) {
            return true;
        }

        return ArgumentCoercion.isEnumCoercible(parameterType, argument)
                || ArgumentCoercion.isStringCoercible(parameterType, argument)
                || NumberConversions.canWiden(argument.getClass(), parameterType);
    }
}
