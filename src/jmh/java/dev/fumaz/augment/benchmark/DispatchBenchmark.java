package dev.fumaz.augment.benchmark;

import dev.fumaz.augment.annotation.Inject;
import dev.fumaz.augment.coerce.Action;
import dev.fumaz.augment.coerce.DynamicCallable;
import dev.fumaz.augment.instance.Decorated;
import dev.fumaz.augment.instance.DecoratedTypeFactory;
import dev.fumaz.augment.instance.DecorationOptions;
import dev.fumaz.augment.instance.Decorator;
import dev.fumaz.augment.service.DefaultServiceRegistry;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class DispatchBenchmark {

    @State(Scope.Benchmark)
    public static class DispatchState {

        DecoratedTypeFactory<Worker> factory;
        Decorated<Worker> worker;
        DynamicCallable callable;

        @Setup(Level.Trial)
        public void setUp() {
            DecorationOptions options = DecorationOptions.builder()
                    .lookupService(new DefaultServiceRegistry().add(Clock.class, new Clock()))
                    .onMethodMissing((name, arguments) -> name)
                    .build();

            factory = Decorator.decorate(Worker.class, options);
            worker = factory.instantiate();
            callable = arguments -> arguments[0];
            worker.getProperty("clock");
        }
    }

    @Benchmark
    public Object invokeOverloadedMethod(DispatchState state) {
        return state.worker.invokeMethod("process", 42);
    }

    @Benchmark
    public Object invokeWithCoercedCallback(DispatchState state) {
        return state.worker.invokeMethod("each", "value", state.callable);
    }

    @Benchmark
    public Object readCachedInjection(DispatchState state) {
        return state.worker.getProperty("clock");
    }

    @Benchmark
    public Object instantiate(DispatchState state) {
        return state.factory.instantiate();
    }

    @Benchmark
    public void missingMethodFallback(DispatchState state, Blackhole blackhole) {
        blackhole.consume(state.worker.invokeMethod("undeclared"));
    }

    public static class Clock {
    }

    public static class Worker {
        public String process(Integer value) {
            return "integer";
        }

        public String process(Number value) {
            return "number";
        }

        public String process(Object value) {
            return "object";
        }

        public String each(String value, Action<String> action) {
            action.execute(value);
            return value;
        }

        @Inject
        public Clock getClock() {
            return null;
        }
    }
}
