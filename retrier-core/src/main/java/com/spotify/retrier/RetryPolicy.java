package com.spotify.retrier;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.time.Duration;
import java.util.Random;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Decides how often an operation is attempted and how long to wait between attempts.
 *
 * <p>Policies are immutable and may be shared by any number of concurrent executions, provided the
 * functions they hold are thread-safe. The ones built by {@link #defaultPolicy()} are.
 */
public final class RetryPolicy {

  /** Value of {@link #maxAttempts()} meaning the operation is attempted until the policy stops. */
  public static final int UNLIMITED_ATTEMPTS = 0;

  public static final int DEFAULT_MAX_ATTEMPTS = 8;

  private static final RetryPolicy NO_RETRY =
      new RetryPolicy(1, attempt -> false, attempt -> Duration.ZERO);

  private final int maxAttempts;
  private final Predicate<AttemptContext<?>> shouldRetry;
  private final Function<AttemptContext<?>, Duration> nextDelay;

  private RetryPolicy(
      int maxAttempts,
      Predicate<AttemptContext<?>> shouldRetry,
      Function<AttemptContext<?>, Duration> nextDelay) {
    checkArgument(maxAttempts >= 0, "maxAttempts must not be negative, was %s", maxAttempts);
    this.maxAttempts = maxAttempts;
    this.shouldRetry = checkNotNull(shouldRetry, "shouldRetry");
    this.nextDelay = checkNotNull(nextDelay, "nextDelay");
  }

  /**
   * Creates a policy from its parts.
   *
   * @param maxAttempts maximum number of attempts, {@link #UNLIMITED_ATTEMPTS} for no limit
   * @param shouldRetry inspects a completed attempt and returns true if it should be retried
   * @param nextDelay computes the pause before the next attempt
   */
  public static RetryPolicy of(
      int maxAttempts,
      Predicate<AttemptContext<?>> shouldRetry,
      Function<AttemptContext<?>, Duration> nextDelay) {
    return new RetryPolicy(maxAttempts, shouldRetry, nextDelay);
  }

  /** The operation is performed exactly once. */
  public static RetryPolicy noRetry() {
    return NO_RETRY;
  }

  /**
   * Retries network errors, (409, IncorrectState), (429, TooManyRequests) and 5xx service errors
   * except (501, MethodNotImplemented), up to {@value #DEFAULT_MAX_ATTEMPTS} attempts, using
   * exponential backoff with jitter capped at 30 seconds.
   */
  public static RetryPolicy defaultPolicy() {
    return defaultPolicy(DefaultErrorClassifier.INSTANCE, new Random());
  }

  public static RetryPolicy defaultPolicy(Random random) {
    return defaultPolicy(DefaultErrorClassifier.INSTANCE, random);
  }

  public static RetryPolicy defaultPolicy(ErrorClassifier classifier, Random random) {
    return new RetryPolicy(
        DEFAULT_MAX_ATTEMPTS,
        new DefaultRetryCondition(classifier),
        new ExponentialBackoffWithJitter(random));
  }

  public RetryPolicy withMaxAttempts(int maxAttempts) {
    return new RetryPolicy(maxAttempts, shouldRetry, nextDelay);
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public boolean isUnlimited() {
    return maxAttempts == UNLIMITED_ATTEMPTS;
  }

  /** Whether the given one-based attempt is within this policy's budget. */
  public boolean allowsAttempt(int attemptNumber) {
    return isUnlimited() || attemptNumber <= maxAttempts;
  }

  public boolean shouldRetry(AttemptContext<?> attempt) {
    return shouldRetry.test(attempt);
  }

  public Duration nextDelay(AttemptContext<?> attempt) {
    final Duration delay = checkNotNull(nextDelay.apply(attempt), "nextDelay returned null");
    return delay.isNegative() ? Duration.ZERO : delay;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("maxAttempts", isUnlimited() ? "unlimited" : maxAttempts)
        .add("shouldRetry", shouldRetry)
        .add("nextDelay", nextDelay)
        .toString();
  }
}
