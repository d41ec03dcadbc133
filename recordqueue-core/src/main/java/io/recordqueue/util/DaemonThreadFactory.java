package io.recordqueue.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates daemon threads named {@code <prefix>1}, {@code <prefix>2}, ...
 *
 * <p>Uncaught exceptions are logged instead of going to {@code System.err}.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private final String prefix;
  private final AtomicInteger sequence = new AtomicInteger(1);

  public DaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, prefix + sequence.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
    return thread;
  }
}
