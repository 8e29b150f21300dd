package com.spotify.retrier;

import java.util.Optional;

/**
 * A request that can be reissued by a {@link RetryExecutor}.
 *
 * <p>Requests without a binary payload and without request-specific retry behavior need not
 * override anything.
 */
public interface RetryableRequest {

  /**
   * The binary payload sent with the request, if any. The executor rewinds it before every attempt
   * and closes it once the call completes.
   */
  default Optional<SeekableBody> binaryRequestBody() {
    return Optional.empty();
  }

  /** Retry policy overriding the executor's default for this request. */
  default Optional<RetryPolicy> retryPolicy() {
    return Optional.empty();
  }

  /** Retry token chosen by the caller. Takes precedence over one generated by the executor. */
  default Optional<String> retryToken() {
    return Optional.empty();
  }
}
