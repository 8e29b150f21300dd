package com.spotify.retrier;

import static com.google.common.base.Preconditions.checkArgument;

import javax.annotation.Nullable;

/**
 * Outcome of one completed attempt, handed to the retry policy.
 *
 * @param response the response of the attempt, or null if it failed before one was received
 * @param error the failure of the attempt, or null
 * @param attemptNumber one-based attempt number
 */
public record AttemptContext<R extends Response>(
    @Nullable R response, @Nullable Exception error, int attemptNumber) {

  public AttemptContext {
    checkArgument(attemptNumber >= 1, "attemptNumber must be at least 1, was %s", attemptNumber);
  }
}
