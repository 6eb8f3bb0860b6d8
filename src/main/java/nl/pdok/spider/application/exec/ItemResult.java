package nl.pdok.spider.application.exec;

import java.util.Objects;
import java.util.function.Function;

/**
 * Per-item outcome of a {@link FetchOrchestrator} batch.
 *
 * @param <O> type of a successful result
 * @since 0.1.0
 */
public sealed interface ItemResult<O> permits ItemResult.Success, ItemResult.Failure {

  /** @return {@code true} when the item produced a value */
  boolean succeeded();

  /**
   * Returns the value, or maps the failure to a replacement value.
   *
   * @param fallback function applied to the failure cause
   * @return the successful value or the fallback result
   */
  O orElseGet(Function<Exception, O> fallback);

  /**
   * Successful item.
   *
   * @param value produced value; may be {@code null} when the task returned {@code null}
   */
  record Success<O>(O value) implements ItemResult<O> {
    @Override
    public boolean succeeded() {
      return true;
    }

    @Override
    public O orElseGet(Function<Exception, O> fallback) {
      return value;
    }
  }

  /**
   * Failed item.
   *
   * @param error exception raised by the task
   */
  record Failure<O>(Exception error) implements ItemResult<O> {
    public Failure {
      Objects.requireNonNull(error, "error");
    }

    @Override
    public boolean succeeded() {
      return false;
    }

    @Override
    public O orElseGet(Function<Exception, O> fallback) {
      return fallback.apply(error);
    }
  }
}
