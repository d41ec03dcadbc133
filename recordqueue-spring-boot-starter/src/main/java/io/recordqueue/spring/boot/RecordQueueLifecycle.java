package io.recordqueue.spring.boot;

import io.recordqueue.RecordQueue;
import org.springframework.context.SmartLifecycle;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts the {@link RecordQueue} workers once the context is refreshed and shuts them
 * down when the context stops.
 *
 * <p>Runs in the last phase, so the workers start after every other bean and stop
 * before them. Stopping is asynchronous: the context is notified once the workers have
 * exited and the remaining jobs have been dropped.
 */
public class RecordQueueLifecycle implements SmartLifecycle {
    private static final Logger logger = Logger.getLogger(RecordQueueLifecycle.class.getName());

    private final RecordQueue recordQueue;
    private final boolean autoStartup;
    private volatile boolean running;

    public RecordQueueLifecycle(RecordQueue recordQueue, boolean autoStartup) {
        this.recordQueue = recordQueue;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        recordQueue.start();
        running = true;
    }

    @Override
    public void stop() {
        recordQueue.close();
        running = false;
    }

    @Override
    public void stop(Runnable callback) {
        running = false;
        recordQueue.shutdown().whenComplete((ignored, error) -> {
            if (error != null) {
                logger.log(Level.WARNING, "Record queue shutdown completed with an error", error);
            }
            callback.run();
        });
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
