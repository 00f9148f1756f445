package dev.fumaz.augment.instance;

import dev.fumaz.augment.exception.UnknownMethodException;
import net.bytebuddy.implementation.bind.annotation.AllArguments;
import net.bytebuddy.implementation.bind.annotation.FieldValue;
import net.bytebuddy.implementation.bind.annotation.Origin;
import net.bytebuddy.implementation.bind.annotation.RuntimeType;
import net.bytebuddy.implementation.bind.annotation.SuperCall;
import net.bytebuddy.implementation.bind.annotation.This;

import java.lang.reflect.Method;
import java.util.concurrent.Callable;

/**
 * Receives every call made on a generated decorated class. Only generated code should call it.
 */
public final class DecoratedMethodInterceptor {

    private DecoratedMethodInterceptor() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    /**
     * Routes a call to the instance's dispatcher. While the base constructor runs the dispatcher field is still
     * empty, so the instance under construction on this thread is used instead; failing that the inherited body
     * runs.
     *
     * @param superCall the inherited or default implementation, or {@code null} for abstract methods
     */
    @RuntimeType
    public static Object intercept(@This Object self,
                                   @Origin Method method,
                                   @AllArguments Object[] arguments,
                                   @FieldValue(DecoratedClassGenerator.DISPATCHER_FIELD) Object dispatcher,
                                   @SuperCall(nullIfImpossible = true) Callable<?> superCall) throws Exception {
        DecoratedInstance<?> instance = dispatcher == null
                ? ConstructionWindow.pendingFor(self)
                : (DecoratedInstance<?>) dispatcher;

        if (instance != null) {
            return instance.invokeTyped(self, method, arguments, superCall);
        }

        if (superCall != null) {
            return superCall.call();
        }

        throw new UnknownMethodException(method.getName(), arguments.length, method.getDeclaringClass());
    }
}
