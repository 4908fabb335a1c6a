package io.tacoq.worker.sdk.autoconfigure;

import io.tacoq.worker.sdk.runtime.WorkerEngine;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the {@link WorkerEngine} on its own thread once the application context is ready and drains
 * it when the context closes.
 */
public final class WorkerEngineLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerEngineLifecycle.class);

    private final WorkerEngine engine;
    private final Duration shutdownTimeout;
    private volatile boolean running;

    public WorkerEngineLifecycle(WorkerEngine engine, Duration shutdownTimeout) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.shutdownTimeout = shutdownTimeout == null ? Duration.ofSeconds(30) : shutdownTimeout;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        Thread thread = new Thread(this::runEngine, "tacoq-engine-" + engine.name());
        running = true;
        thread.start();
        if (log.isInfoEnabled()) {
            log.info("Worker engine lifecycle started (worker={}, kinds={})", engine.name(), engine.taskKinds());
        }
    }

    private void runEngine() {
        try {
            engine.run();
        } catch (RuntimeException ex) {
            log.error("Worker engine {} stopped with an error", engine.name(), ex);
        } finally {
            running = false;
        }
    }

    @Override
    public void stop() {
        engine.shutdown();
        try {
            if (!engine.awaitTermination(shutdownTimeout)) {
                log.warn("Worker engine {} did not terminate within {}", engine.name(), shutdownTimeout);
            } else if (log.isInfoEnabled()) {
                log.info("Worker engine lifecycle stopped (worker={})", engine.name());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for worker engine {} to terminate", engine.name());
        }
        running = false;
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public int getPhase() {
        return SmartLifecycle.DEFAULT_PHASE;
    }
}
