package nl.pdok.spider.application.exec;

import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Fixed-backoff retry of a single capabilities read, backed by a resilience4j {@link Retry}.
 * <p><strong>Why:</strong> Capability endpoints fail transiently; one item is retried in place without involving
 * the orchestrator that scheduled it.</p>
 * <p><strong>Semantics:</strong> every {@link Exception} except {@link InterruptedException} is retried; errors
 * and interruption propagate at once. Each wait is logged at WARN with the interval resilience4j applies.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across fetch workers. Each call gets its own
 * {@link Retry} instance named after the action, so events never mix between items.</p>
 *
 * @since 0.1.0
 */
public final class RetryPolicy {
  /** Default number of attempts. */
  public static final int DEFAULT_ATTEMPTS = 3;
  /** Default wait between attempts. */
  public static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(5);

  private final int maxAttempts;
  private final Duration backoff;
  private final RetryConfig config;
  private final Logger log;

  /**
   * Creates a retry policy.
   *
   * @param maxAttempts total attempts including the first; must be positive
   * @param backoff wait between attempts; must not be negative
   * @param log logger receiving per-attempt warnings
   * @throws IllegalArgumentException when an argument is out of range
   * @since 0.1.0
   */
  public RetryPolicy(int maxAttempts, Duration backoff, Logger log) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be positive");
    }
    Objects.requireNonNull(backoff, "backoff");
    if (backoff.isNegative()) {
      throw new IllegalArgumentException("backoff must not be negative");
    }
    this.maxAttempts = maxAttempts;
    this.backoff = backoff;
    this.log = Objects.requireNonNull(log, "log");
    long waitMillis = backoff.toMillis();
    this.config = RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .intervalFunction(attempt -> waitMillis)
        .retryOnException(ex -> ex instanceof Exception && !(ex instanceof InterruptedException))
        .build();
  }

  /**
   * Creates the policy used when no overrides are configured: {@value #DEFAULT_ATTEMPTS} attempts, 5 s apart.
   *
   * @param log logger receiving per-attempt warnings
   * @return default policy
   */
  public static RetryPolicy defaults(Logger log) {
    return new RetryPolicy(DEFAULT_ATTEMPTS, DEFAULT_BACKOFF, log);
  }

  /** @return total attempts including the first */
  public int maxAttempts() {
    return maxAttempts;
  }

  /** @return wait between attempts */
  public Duration backoff() {
    return backoff;
  }

  /**
   * Runs {@code action} until it succeeds or the attempts are used up.
   *
   * @param description short description of the action, used as retry name and in logs
   * @param action action to run
   * @param <T> result type
   * @return result of the first successful attempt
   * @throws RetryExhaustedException when every attempt failed; the cause is the last failure
   * @throws InterruptedException when interrupted during an attempt or while waiting
   */
  public <T> T execute(String description, Callable<T> action)
      throws RetryExhaustedException, InterruptedException {
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(action, "action");
    Retry retry = Retry.of(description, config);
    retry.getEventPublisher().onRetry(event -> log.warn("Attempt {}/{} for {} failed: {}; retrying in {} ms",
        event.getNumberOfRetryAttempts(), maxAttempts, description, String.valueOf(event.getLastThrowable()),
        event.getWaitInterval().toMillis()));

    AtomicInteger attempts = new AtomicInteger();
    CheckedSupplier<T> guarded = Retry.decorateCheckedSupplier(retry, () -> {
      attempts.incrementAndGet();
      return action.call();
    });
    try {
      return guarded.get();
    } catch (InterruptedException ex) {
      throw ex;
    } catch (Exception ex) {
      if (Thread.interrupted()) {
        InterruptedException interrupted = new InterruptedException(description + " interrupted between attempts");
        interrupted.initCause(ex);
        throw interrupted;
      }
      throw new RetryExhaustedException(description, attempts.get(), ex);
    } catch (Error err) {
      throw err;
    } catch (Throwable other) {
      throw new IllegalStateException(description + " raised " + other, other);
    }
  }
}
