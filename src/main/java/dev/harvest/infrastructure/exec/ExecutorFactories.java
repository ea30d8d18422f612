package dev.harvest.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the executors that run stage work.
 *
 * @since 0.1.0
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool for stage workers. The scheduler never submits more tasks than
   * {@code size}, so the queue only absorbs the hand-off between a finishing and a new task.
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix; defaults to {@code harvest-stage}
   * @param handler uncaught exception handler; defaults to logging the error
   * @return configured executor service
   */
  public static ExecutorService newStagePool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = prefix == null || prefix.isBlank() ? "harvest-stage" : prefix;
    UncaughtExceptionHandler effective = Objects.requireNonNullElse(
        handler, (thread, ex) -> log.error("Uncaught exception on {}", thread.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory = runnable -> {
      Thread thread = new Thread(runnable, threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effective);
      return thread;
    };
    return new ThreadPoolExecutor(
        size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Pool factory bound to the default stage-worker naming, as consumed by the build use case.
   *
   * @return factory taking the worker count
   */
  public static IntFunction<ExecutorService> stagePools() {
    return size -> newStagePool(size, "harvest-stage", null);
  }
}
