package com.spotify.retrier;

import javax.annotation.Nullable;

/** An error returned by the service itself, as opposed to a transport failure. */
public interface ServiceError {

  int httpStatusCode();

  /** Symbolic error code, e.g. {@code TooManyRequests}. */
  String code();

  String message();

  /** Request id the service assigned to the failed call, if it sent one. */
  @Nullable
  String requestId();
}
