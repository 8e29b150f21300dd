package com.spotify.retrier;

import com.google.common.base.Throwables;
import java.time.Duration;
import javax.annotation.Nullable;

public class Exceptions {

  /**
   * A retry was warranted but the request's binary body cannot be rewound, so it was not resent.
   * The cause is the error of the last attempt, or the I/O failure hit while rewinding.
   */
  public static class NonSeekableRetryFailure extends Exception {
    public NonSeekableRetryFailure(@Nullable Throwable cause) {
      super(
          "unable to perform retry: request body is not seekable"
              + (cause == null ? "" : ", last error: " + cause.getMessage()),
          cause);
    }
  }

  /** The next backoff would end after the context deadline. */
  public static class DeadlineExceededByBackoff extends Exception {
    private final Duration backoff;

    public DeadlineExceededByBackoff(Duration backoff) {
      super("now() + (" + backoff + " backoff) exceeds the context deadline");
      this.backoff = backoff;
    }

    public Duration backoff() {
      return backoff;
    }
  }

  /** An unexpected fault escaped an attempt; the retry loop was stopped. */
  public static class RecoveredFault extends Exception {
    private final String executionTrace;

    public RecoveredFault(Throwable fault) {
      super("unexpected fault while retrying operation: " + fault, fault);
      this.executionTrace = Throwables.getStackTraceAsString(fault);
    }

    public String executionTrace() {
      return executionTrace;
    }
  }

  /** The caller's context was cancelled before the retry loop produced a result. */
  public static class OperationCancelled extends Exception {
    public OperationCancelled(@Nullable Throwable cause) {
      super("operation cancelled" + (cause == null ? "" : ": " + cause.getMessage()), cause);
    }
  }

  public static class RetryFailedException extends RuntimeException {
    public RetryFailedException(Exception cause) {
      super(cause.getMessage(), cause);
    }
  }
}
