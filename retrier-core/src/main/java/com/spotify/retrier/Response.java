package com.spotify.retrier;

/** The result of a single service call, as seen by a retry policy. */
public interface Response {

  /** HTTP status code the service answered with. */
  int httpStatusCode();

  default boolean isSuccessful() {
    final int status = httpStatusCode();
    return status >= 200 && status < 300;
  }
}
