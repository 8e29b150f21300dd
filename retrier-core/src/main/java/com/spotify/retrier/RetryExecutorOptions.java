package com.spotify.retrier;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * Configuration of a {@link RetryExecutor}.
 *
 * <p>Instances are immutable; the {@code with...} methods return modified copies.
 */
public class RetryExecutorOptions {

  private final RetryPolicy defaultPolicy;
  @Nullable private final String retryTokenHeader;
  private final Supplier<String> retryTokenSupplier;
  @Nullable private final ExecutorService executorService;
  private final Sleeper sleeper;

  private RetryExecutorOptions(
      RetryPolicy defaultPolicy,
      @Nullable String retryTokenHeader,
      Supplier<String> retryTokenSupplier,
      @Nullable ExecutorService executorService,
      Sleeper sleeper) {
    this.defaultPolicy = checkNotNull(defaultPolicy, "defaultPolicy");
    this.retryTokenHeader = Strings.emptyToNull(retryTokenHeader);
    this.retryTokenSupplier = checkNotNull(retryTokenSupplier, "retryTokenSupplier");
    this.executorService = executorService;
    this.sleeper = checkNotNull(sleeper, "sleeper");
  }

  /**
   * Default options: {@link RetryPolicy#defaultPolicy()} for requests without their own policy, no
   * retry token header, a cancellable sleeper and an executor-owned thread pool.
   */
  public static RetryExecutorOptions defaults() {
    return new RetryExecutorOptions(
        RetryPolicy.defaultPolicy(), null, RetryTokens::newToken, null, Sleeper.cancellable());
  }

  /** Policy used for requests that do not carry one. */
  public RetryExecutorOptions withDefaultPolicy(RetryPolicy defaultPolicy) {
    return new RetryExecutorOptions(
        defaultPolicy, retryTokenHeader, retryTokenSupplier, executorService, sleeper);
  }

  /**
   * Header the retry token is sent in. When set, every execution that may retry sends the same
   * token with all of its attempts.
   */
  public RetryExecutorOptions withRetryTokenHeader(@Nullable String retryTokenHeader) {
    return new RetryExecutorOptions(
        defaultPolicy, retryTokenHeader, retryTokenSupplier, executorService, sleeper);
  }

  public RetryExecutorOptions withRetryTokenSupplier(Supplier<String> retryTokenSupplier) {
    return new RetryExecutorOptions(
        defaultPolicy, retryTokenHeader, retryTokenSupplier, executorService, sleeper);
  }

  /** Runs retry loops on the given executor, which {@link RetryExecutor#close()} leaves running. */
  public RetryExecutorOptions withExecutorService(@Nullable ExecutorService executorService) {
    return new RetryExecutorOptions(
        defaultPolicy, retryTokenHeader, retryTokenSupplier, executorService, sleeper);
  }

  public RetryExecutorOptions withSleeper(Sleeper sleeper) {
    return new RetryExecutorOptions(
        defaultPolicy, retryTokenHeader, retryTokenSupplier, executorService, sleeper);
  }

  public RetryPolicy getDefaultPolicy() {
    return defaultPolicy;
  }

  public Optional<String> getRetryTokenHeader() {
    return Optional.ofNullable(retryTokenHeader);
  }

  public Supplier<String> getRetryTokenSupplier() {
    return retryTokenSupplier;
  }

  public Optional<ExecutorService> getExecutorService() {
    return Optional.ofNullable(executorService);
  }

  public Sleeper getSleeper() {
    return sleeper;
  }

  @Override
  public String toString() {
    return "RetryExecutorOptions{"
        + "defaultPolicy="
        + defaultPolicy
        + ", retryTokenHeader="
        + retryTokenHeader
        + ", executorService="
        + (executorService == null ? "owned" : executorService)
        + '}';
  }
}
