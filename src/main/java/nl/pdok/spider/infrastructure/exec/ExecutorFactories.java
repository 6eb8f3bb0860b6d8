package nl.pdok.spider.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import nl.pdok.spider.validation.Numbers;

/**
 * Thread pools for catalogue and capabilities fetch batches.
 */
public final class ExecutorFactories {
  private static final String DEFAULT_PREFIX = "spider-fetch";

  private ExecutorFactories() {
    // Utility
  }

  /**
   * Builds a pool of exactly {@code workers} threads named {@code prefix-n}.
   *
   * <p>Workers are daemon threads so an HTTP call stuck past its timeout cannot keep the CLI alive after the
   * document was written. There is no task queue: each submitted worker drains the batch queue itself, so a
   * batch submits at most {@code workers} tasks.</p>
   *
   * @param workers number of worker threads, 1 to 64
   * @param prefix thread-name prefix; blank selects {@code spider-fetch}
   * @param handler uncaught exception handler installed on every worker
   * @return executor service
   * @throws IllegalArgumentException if {@code workers} lies outside 1 to 64
   */
  public static ExecutorService newWorkerPool(int workers, String prefix, UncaughtExceptionHandler handler) {
    int size = (int) Numbers.requireRange("workers", workers, 1, 64);
    String threadPrefix = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix.trim();
    UncaughtExceptionHandler onFailure = Objects.requireNonNull(handler, "handler");
    AtomicInteger sequence = new AtomicInteger(1);
    ThreadFactory threads = runnable -> {
      Thread thread = new Thread(runnable, threadPrefix + "-" + sequence.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(onFailure);
      return thread;
    };
    return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS, new SynchronousQueue<>(), threads);
  }
}
