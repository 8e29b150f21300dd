package com.spotify.retrier;

import javax.annotation.Nullable;

/**
 * Terminal result of {@link RetryExecutor#execute}.
 *
 * <p>Both fields may be set, for instance when the last response is returned together with one of
 * the errors in {@link Exceptions}.
 *
 * @param response the last response received, or null
 * @param error the terminal error, or null if the call succeeded
 */
public record ExecutionOutcome<R>(@Nullable R response, @Nullable Exception error) {

  static <R> ExecutionOutcome<R> of(@Nullable R response, @Nullable Exception error) {
    return new ExecutionOutcome<>(response, error);
  }

  static <R> ExecutionOutcome<R> failure(Exception error) {
    return new ExecutionOutcome<>(null, error);
  }

  public boolean hasError() {
    return error != null;
  }

  /**
   * Returns the response, or throws if the call ended with an error.
   *
   * @throws Exceptions.RetryFailedException wrapping {@link #error()}
   */
  public R getOrThrow() {
    if (error != null) {
      throw new Exceptions.RetryFailedException(error);
    }
    return response;
  }
}
