package com.spotify.retrier;

import io.grpc.Context;
import io.grpc.Deadline;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The attempt loop of one {@link RetryExecutor#execute} call. Runs once, on a worker thread. */
class RetryLoop<Q extends RetryableRequest, R extends Response> {
  private static final Logger logger = LoggerFactory.getLogger(RetryLoop.class);

  private final Context context;
  private final Q request;
  private final Operation<? super Q, R> operation;
  private final RetryPolicy policy;
  private final Sleeper sleeper;
  private final Map<String, String> extraHeaders;
  private volatile boolean abandoned = false;

  RetryLoop(
      Context context,
      Q request,
      Operation<? super Q, R> operation,
      RetryPolicy policy,
      Sleeper sleeper,
      Map<String, String> extraHeaders) {
    this.context = context;
    this.request = request;
    this.operation = operation;
    this.policy = policy;
    this.sleeper = sleeper;
    this.extraHeaders = extraHeaders;
  }

  /** No attempt is started after this is called. An attempt in flight runs to completion. */
  void abandon() {
    abandoned = true;
  }

  /**
   * Runs the loop. Anything other than an operation {@link Exception} escapes as thrown and is
   * turned into {@link Exceptions.RecoveredFault} by the executor.
   */
  ExecutionOutcome<R> run() {
    SeekableBody body = null;
    try {
      body = request.binaryRequestBody().orElse(null);
      return attempt(body);
    } finally {
      if (body != null) {
        close(body);
      }
    }
  }

  private ExecutionOutcome<R> attempt(@Nullable SeekableBody body) {
    final boolean binary = body != null;
    boolean seekable = false;
    long startOffset = 0;
    if (binary && policy.maxAttempts() != 1 && body.isSeekable()) {
      try {
        startOffset = body.position();
        seekable = true;
      } catch (IOException e) {
        logger.warn("Unable to read the position of the request body, it will not be resent", e);
      }
    }

    R response = null;
    Exception error = null;
    for (int attemptNumber = 1; policy.allowsAttempt(attemptNumber); attemptNumber++) {
      if (abandoned || context.isCancelled()) {
        logger.debug("Retry loop abandoned after {} attempt(s)", attemptNumber - 1);
        return ExecutionOutcome.of(
            response, new Exceptions.OperationCancelled(context.cancellationCause()));
      }
      logger.debug("Operation attempt #{}", attemptNumber);
      if (seekable) {
        try {
          body.seek(startOffset, SeekOrigin.START);
        } catch (IOException e) {
          return ExecutionOutcome.of(response, new Exceptions.NonSeekableRetryFailure(e));
        }
      }

      try {
        response = operation.call(context, request, body, extraHeaders);
        error = null;
      } catch (Exception e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
        }
        response = null;
        error = e;
      }

      final AttemptContext<R> attempt = new AttemptContext<>(response, error, attemptNumber);
      if (!policy.shouldRetry(attempt)) {
        return ExecutionOutcome.of(response, error);
      }
      if (binary && !seekable) {
        return ExecutionOutcome.of(response, new Exceptions.NonSeekableRetryFailure(error));
      }

      final Duration delay = policy.nextDelay(attempt);
      final Deadline deadline = context.getDeadline();
      if (deadline != null
          && TimeUnit.NANOSECONDS.convert(delay) > deadline.timeRemaining(TimeUnit.NANOSECONDS)) {
        return ExecutionOutcome.of(response, new Exceptions.DeadlineExceededByBackoff(delay));
      }
      if (!policy.allowsAttempt(attemptNumber + 1)) {
        break;
      }
      logger.debug(
          "Attempt #{} failed ({}), waiting {} before retrying", attemptNumber, error, delay);
      try {
        sleeper.sleep(delay, context);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return ExecutionOutcome.of(response, new Exceptions.OperationCancelled(e));
      }
    }

    logger.debug("Giving up after {} attempts", policy.maxAttempts());
    return ExecutionOutcome.of(response, error);
  }

  private static void close(SeekableBody body) {
    try {
      body.close();
    } catch (IOException e) {
      logger.warn("Failed to close request body", e);
    }
  }
}
