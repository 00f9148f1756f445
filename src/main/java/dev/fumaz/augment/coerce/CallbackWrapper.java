package dev.fumaz.augment.coerce;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;

/**
 * Invocation handler behind a coerced capability object. Forwards the capability's single method to the wrapped
 * callable and converts the result to the method's declared return type.
 */
public final class CallbackWrapper implements InvocationHandler {

    private static final Object[] NO_ARGUMENTS = new Object[0];

    private final @NotNull Class<?> capabilityType;
    private final @NotNull Method capabilityMethod;
    private final @NotNull DynamicCallable callable;

    CallbackWrapper(@NotNull Class<?> capabilityType, @NotNull DynamicCallable callable) {
        this.capabilityType = capabilityType;
        this.capabilityMethod = Capabilities.getCapabilityMethod(capabilityType);
        this.callable = callable;
    }

    public @NotNull Class<?> getCapabilityType() {
        return capabilityType;
    }

    public @NotNull DynamicCallable getCallable() {
        return callable;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            switch (method.getName()) {
                case "equals":
                    return proxy == args[0];
                case "hashCode":
                    return System.identityHashCode(proxy);
                default:
                    return "CallbackWrapper[" + capabilityType.getName() + "]";
            }
        }

        if (method.isDefault()) {
            return InvocationHandler.invokeDefault(proxy, method, args);
        }

        if (!method.getName().equals(capabilityMethod.getName())
                || method.getParameterCount() != capabilityMethod.getParameterCount()) {
            throw new UnsupportedOperationException(method + " is not the capability method of "
                    + capabilityType.getName());
        }

        Object result = callable.call(args == null ? NO_ARGUMENTS : args);
        return ArgumentCoercion.convertReturnValue(result, method.getReturnType());
    }

    /**
     * Returns the wrapper behind a coerced capability object, or {@code null} if {@code candidate} was not produced
     * by {@link CallbackCoercion}.
     */
    public static CallbackWrapper of(Object candidate) {
        if (candidate == null || !Proxy.isProxyClass(candidate.getClass())) {
            return null;
        }

        InvocationHandler handler = Proxy.getInvocationHandler(candidate);
        return handler instanceof CallbackWrapper ? (CallbackWrapper) handler : null;
    }
}
