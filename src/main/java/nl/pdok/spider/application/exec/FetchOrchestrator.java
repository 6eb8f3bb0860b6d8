package nl.pdok.spider.application.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.BiFunction;
import nl.pdok.spider.infrastructure.exec.ExecutorFactories;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Bounded-concurrency map over a list of network-bound tasks.
 * <p><strong>Why:</strong> Catalogue queries, capability retrieval, and dataset lookups all fan out to many slow
 * upstream endpoints; a fixed ceiling protects both sides.</p>
 * <p><strong>Role:</strong> Application-layer executor shared by the catalogue client and the harvest use case.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run at most {@code min(ceiling, n)} tasks at a time.</li>
 *   <li>Return exactly one result per input, in input order.</li>
 *   <li>Convert task exceptions, and errors such as {@link AssertionError}, into {@link ItemResult.Failure} values
 *   without cancelling siblings.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances are stateless between batches and may be shared; each
 * {@code map} call creates and tears down its own worker pool.</p>
 * <p><strong>Observability:</strong> Logs batch size and failures at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class FetchOrchestrator {
  /** Default ceiling on concurrent fetches. */
  public static final int DEFAULT_CONCURRENCY = 10;

  private final int ceiling;
  private final String threadPrefix;
  private final Logger log;

  /**
   * Creates an orchestrator.
   *
   * @param ceiling maximum number of concurrent tasks; must be positive
   * @param threadPrefix worker thread name prefix
   * @param log logger receiving batch diagnostics
   */
  public FetchOrchestrator(int ceiling, String threadPrefix, Logger log) {
    if (ceiling <= 0) {
      throw new IllegalArgumentException("ceiling must be positive");
    }
    this.ceiling = ceiling;
    this.threadPrefix = Objects.requireNonNull(threadPrefix, "threadPrefix");
    this.log = Objects.requireNonNull(log, "log");
  }

  /** @return configured concurrency ceiling */
  public int ceiling() {
    return ceiling;
  }

  /**
   * Applies {@code task} to every input using a bounded worker pool.
   *
   * @param inputs items to process; order is preserved in the result
   * @param task function applied to each item; may throw
   * @param <I> input type
   * @param <O> output type
   * @return one {@link ItemResult} per input, index aligned with {@code inputs}
   * @throws InterruptedException when the calling thread is interrupted while waiting; workers are cancelled
   */
  public <I, O> List<ItemResult<O>> map(List<? extends I> inputs, Task<? super I, ? extends O> task)
      throws InterruptedException {
    Objects.requireNonNull(inputs, "inputs");
    Objects.requireNonNull(task, "task");
    int n = inputs.size();
    if (n == 0) {
      return List.of();
    }
    int workers = Math.min(ceiling, n);
    log.debug("Fetching {} item(s) with {} worker(s)", n, workers);

    BlockingQueue<Integer> queue = new LinkedBlockingQueue<>(n);
    for (int i = 0; i < n; i++) {
      queue.add(i);
    }
    AtomicReferenceArray<ItemResult<O>> results = new AtomicReferenceArray<>(n);
    CountDownLatch done = new CountDownLatch(n);

    ExecutorService pool = ExecutorFactories.newWorkerPool(workers, threadPrefix,
        (thread, ex) -> log.error("Fetch worker {} terminated unexpectedly", thread.getName(), ex));
    try {
      for (int w = 0; w < workers; w++) {
        pool.execute(() -> drain(queue, inputs, task, results, done));
      }
      done.await();
    } catch (InterruptedException ex) {
      pool.shutdownNow();
      throw ex;
    } finally {
      pool.shutdown();
    }

    List<ItemResult<O>> ordered = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      ItemResult<O> result = results.get(i);
      if (result == null) {
        result = new ItemResult.Failure<>(new IllegalStateException("worker terminated before item " + i));
      }
      ordered.add(result);
    }
    return ordered;
  }

  /**
   * Applies {@code task} to every input and replaces failures using {@code fallback}.
   *
   * @param inputs items to process
   * @param task function applied to each item
   * @param fallback maps an input and its failure to a replacement value
   * @param <I> input type
   * @param <O> output type
   * @return one value per input, in input order
   * @throws InterruptedException when the calling thread is interrupted while waiting
   */
  public <I, O> List<O> map(
      List<? extends I> inputs,
      Task<? super I, ? extends O> task,
      BiFunction<? super I, Exception, ? extends O> fallback) throws InterruptedException {
    Objects.requireNonNull(fallback, "fallback");
    List<ItemResult<O>> results = map(inputs, task);
    List<O> values = new ArrayList<>(results.size());
    for (int i = 0; i < results.size(); i++) {
      I input = inputs.get(i);
      values.add(results.get(i).orElseGet(error -> fallback.apply(input, error)));
    }
    return values;
  }

  private <I, O> void drain(
      BlockingQueue<Integer> queue,
      List<? extends I> inputs,
      Task<? super I, ? extends O> task,
      AtomicReferenceArray<ItemResult<O>> results,
      CountDownLatch done) {
    Integer index;
    while ((index = queue.poll()) != null) {
      try {
        if (Thread.currentThread().isInterrupted()) {
          results.set(index, new ItemResult.Failure<>(new InterruptedException("batch cancelled")));
          continue;
        }
        O value = task.apply(inputs.get(index));
        results.set(index, new ItemResult.Success<>(value));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        results.set(index, new ItemResult.Failure<>(ex));
      } catch (Exception ex) {
        log.debug("Fetch task {} failed: {}", index, ex.toString());
        results.set(index, new ItemResult.Failure<>(ex));
      } catch (Error err) {
        // The worker keeps draining so every remaining index is still counted down.
        log.warn("Fetch task {} raised {}", index, err.toString());
        results.set(index, new ItemResult.Failure<>(new ExecutionException("task raised " + err, err)));
      } finally {
        done.countDown();
      }
    }
  }

  /**
   * Unit of work applied to one input.
   *
   * @param <I> input type
   * @param <O> output type
   */
  @FunctionalInterface
  public interface Task<I, O> {
    /**
     * Processes one input.
     *
     * @param input item to process
     * @return produced value
     * @throws Exception any failure; it is captured as an {@link ItemResult.Failure}
     */
    O apply(I input) throws Exception;
  }
}
