package ca.gc.cra.lattice.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named threads the lattice client runs queries, transport pollers and
 * event delivery on.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught exception on thread {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds the pool that runs asynchronous queries. Idle threads time out so a client with no
   * traffic holds no threads.
   *
   * @param maxConcurrent maximum number of queries collecting at once
   * @param prefix thread-name prefix
   * @return configured executor service
   */
  public static ExecutorService newQueryPool(int maxConcurrent, String prefix) {
    if (maxConcurrent <= 0) {
      throw new IllegalArgumentException("maxConcurrent must be positive");
    }
    ThreadPoolExecutor executor = new ThreadPoolExecutor(
        maxConcurrent,
        maxConcurrent,
        30L,
        TimeUnit.SECONDS,
        new LinkedBlockingQueue<>(),
        daemonFactory(prefix == null || prefix.isBlank() ? "lattice-query" : prefix, LOGGING_HANDLER),
        new ThreadPoolExecutor.AbortPolicy());
    executor.allowCoreThreadTimeOut(true);
    return executor;
  }

  /**
   * Starts a single named daemon thread, used for transport pollers and event delivery loops.
   *
   * @param name thread name
   * @param task loop body
   * @return started thread
   */
  public static Thread startDaemon(String name, Runnable task) {
    Objects.requireNonNull(task, "task");
    Thread thread = new Thread(task, Objects.requireNonNull(name, "name"));
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
    thread.start();
    return thread;
  }

  static ThreadFactory daemonFactory(String prefix, UncaughtExceptionHandler handler) {
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(handler);
      return thread;
    };
  }
}
