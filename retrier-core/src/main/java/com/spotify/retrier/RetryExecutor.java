package com.spotify.retrier;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.grpc.Context;
import java.io.Closeable;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues an {@link Operation} one or more times according to a {@link RetryPolicy}.
 *
 * <p>Each execution runs its attempt loop on a worker thread, with the caller's {@link Context}
 * attached, while the calling thread waits for whichever comes first: the loop's result or the
 * cancellation of the context. Attempts are strictly sequential. Errors, including unexpected
 * faults inside the loop, are reported through {@link ExecutionOutcome#error()}; {@code execute}
 * does not throw them.
 *
 * <p>Instances are thread-safe and meant to be shared.
 */
public class RetryExecutor implements Closeable {
  private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

  private final RetryExecutorOptions options;
  private final ExecutorService workers;
  private final boolean ownsWorkers;

  public RetryExecutor() {
    this(RetryExecutorOptions.defaults());
  }

  public RetryExecutor(RetryExecutorOptions options) {
    this.options = checkNotNull(options, "options");
    if (options.getExecutorService().isPresent()) {
      this.workers = options.getExecutorService().get();
      this.ownsWorkers = false;
    } else {
      this.workers =
          Executors.newCachedThreadPool(
              new ThreadFactoryBuilder().setNameFormat("retrier-%d").setDaemon(true).build());
      this.ownsWorkers = true;
    }
  }

  /** Executes with {@link Context#current()} as the cancellation context. */
  public <Q extends RetryableRequest, R extends Response> ExecutionOutcome<R> execute(
      Q request, Operation<? super Q, R> operation, RetryPolicy policy) {
    return execute(Context.current(), request, operation, policy);
  }

  /**
   * Executes with the request's own policy, falling back to {@link
   * RetryExecutorOptions#getDefaultPolicy()}.
   */
  public <Q extends RetryableRequest, R extends Response> ExecutionOutcome<R> execute(
      Context context, Q request, Operation<? super Q, R> operation) {
    checkNotNull(request, "request");
    return execute(
        context, request, operation, request.retryPolicy().orElse(options.getDefaultPolicy()));
  }

  /**
   * Executes {@code operation} until {@code policy} stops retrying or runs out of attempts.
   *
   * @param context cancellation context; its deadline also bounds the backoff between attempts
   * @param request the request, whose binary body is rewound before every attempt
   * @param operation the call to perform
   * @param policy decides whether and when to retry
   * @return the last response and error, or one of the errors in {@link Exceptions}
   * @throws IllegalStateException if this executor has been closed
   */
  public <Q extends RetryableRequest, R extends Response> ExecutionOutcome<R> execute(
      Context context, Q request, Operation<? super Q, R> operation, RetryPolicy policy) {
    checkNotNull(context, "context");
    checkNotNull(request, "request");
    checkNotNull(operation, "operation");
    checkNotNull(policy, "policy");

    final RetryLoop<Q, R> loop =
        new RetryLoop<>(
            context,
            request,
            operation,
            policy,
            options.getSleeper(),
            extraHeaders(request, policy));
    final CompletableFuture<ExecutionOutcome<R>> result = new CompletableFuture<>();
    final Context.CancellationListener onCancel =
        cancelled -> {
          loop.abandon();
          if (result.complete(
              ExecutionOutcome.failure(
                  new Exceptions.OperationCancelled(cancelled.cancellationCause())))) {
            logger.debug("Context cancelled before the retry loop completed");
          }
        };

    context.addListener(onCancel, MoreExecutors.directExecutor());
    try {
      try {
        workers.execute(
            context.wrap(
                () -> {
                  try {
                    result.complete(loop.run());
                  } catch (Throwable t) {
                    logger.error("Unexpected fault while retrying operation, giving up", t);
                    result.completeExceptionally(t);
                  }
                }));
      } catch (RejectedExecutionException e) {
        throw new IllegalStateException("RetryExecutor is closed", e);
      }
      try {
        return result.get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        loop.abandon();
        return ExecutionOutcome.failure(new Exceptions.OperationCancelled(e));
      } catch (ExecutionException e) {
        return ExecutionOutcome.failure(new Exceptions.RecoveredFault(e.getCause()));
      }
    } finally {
      context.removeListener(onCancel);
    }
  }

  private Map<String, String> extraHeaders(RetryableRequest request, RetryPolicy policy) {
    if (options.getRetryTokenHeader().isEmpty() || policy.maxAttempts() == 1) {
      return ImmutableMap.of();
    }
    final String token = request.retryToken().orElseGet(options.getRetryTokenSupplier());
    return ImmutableMap.of(options.getRetryTokenHeader().get(), token);
  }

  /**
   * Stops accepting executions. Loops already running complete; an owned worker pool is shut down,
   * one supplied through {@link RetryExecutorOptions#withExecutorService} is left alone.
   */
  @Override
  public void close() {
    if (ownsWorkers) {
      workers.shutdown();
    }
  }
}
