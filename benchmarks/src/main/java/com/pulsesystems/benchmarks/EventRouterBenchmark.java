package com.pulsesystems.benchmarks;

import com.pulsesystems.config.EventRouterConfig;
import com.pulsesystems.config.WorkerPoolConfig;
import com.pulsesystems.event.Event;
import com.pulsesystems.event.EventPriority;
import com.pulsesystems.event.EventRouter;
import com.pulsesystems.event.EventTypes;
import com.pulsesystems.event.PooledEventDrainer;
import com.pulsesystems.event.SourceType;
import org.openjdk.jmh.annotations.*;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Measures emit plus drain throughput for batches of mixed-priority events.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
@Fork(1)
public class EventRouterBenchmark {

    private static final EventPriority[] PRIORITIES = EventPriority.values();

    @Param({"1000"})
    private int batchSize;

    @Param({"1", "4"})
    private int handlersPerEvent;

    private volatile Event sink;

    private EventRouter router;
    private PooledEventDrainer pooledDrainer;

    @Setup(Level.Trial)
    public void setup() {
        router = new EventRouter(new EventRouterConfig().setQueueCapacity(batchSize * 2));
        for (int i = 0; i < handlersPerEvent; i++) {
            router.register(EventTypes.ALL, event -> sink = event, i);
        }
        pooledDrainer = new PooledEventDrainer(router, new WorkerPoolConfig().setWorkers(4));
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        pooledDrainer.close();
    }

    private void fill() {
        for (int i = 0; i < batchSize; i++) {
            Event event = router.createEvent(EventTypes.TASK_CREATE, "bench", SourceType.SYSTEM,
                    Map.of(), PRIORITIES[i % PRIORITIES.length]);
            router.emit(event);
        }
    }

    /**
     * Single-loop drain with direct handler calls
     */
    @Benchmark
    @OperationsPerInvocation(1000)
    public int emitAndDrainSequential() {
        fill();
        return router.drain();
    }

    /**
     * Worker-pool drain with per-handler timeouts
     */
    @Benchmark
    @OperationsPerInvocation(1000)
    public int emitAndDrainPooled() {
        fill();
        return pooledDrainer.drain();
    }

    /**
     * Admission only, then discard
     */
    @Benchmark
    @OperationsPerInvocation(1000)
    public void emitAndClear() {
        fill();
        router.clearQueue();
    }
}
