package com.spotify.retrier;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.math.LongMath;
import java.time.Duration;
import java.util.Random;
import java.util.function.Function;

/**
 * Backoff of {@link RetryPolicy#defaultPolicy()}: {@code min(base * 2^(attempt-1), cap) +
 * uniform[0, jitter)}.
 */
public final class ExponentialBackoffWithJitter implements Function<AttemptContext<?>, Duration> {

  public static final Duration DEFAULT_BASE = Duration.ofSeconds(1);
  public static final Duration DEFAULT_CAP = Duration.ofSeconds(30);
  public static final Duration DEFAULT_JITTER = Duration.ofSeconds(1);

  private final Duration base;
  private final Duration cap;
  private final Duration jitter;
  private final Random random;

  /**
   * Creates a backoff function.
   *
   * @param base delay before the first retry, without jitter
   * @param cap upper bound of the exponential part
   * @param jitter upper bound (exclusive) of the random amount added to every delay
   * @param random jitter source; {@link Random} is safe to share between threads
   */
  public ExponentialBackoffWithJitter(
      Duration base, Duration cap, Duration jitter, Random random) {
    checkArgument(!base.isNegative(), "base must not be negative");
    checkArgument(cap.compareTo(base) >= 0, "cap must not be smaller than base");
    checkArgument(!jitter.isNegative(), "jitter must not be negative");
    this.base = base;
    this.cap = cap;
    this.jitter = jitter;
    this.random = checkNotNull(random, "random");
  }

  public ExponentialBackoffWithJitter(Random random) {
    this(DEFAULT_BASE, DEFAULT_CAP, DEFAULT_JITTER, random);
  }

  @Override
  public Duration apply(AttemptContext<?> attempt) {
    return Duration.ofNanos(
        LongMath.saturatedAdd(exponentialNanos(attempt.attemptNumber()), jitterNanos()));
  }

  private long exponentialNanos(int attemptNumber) {
    final int exponent = Math.min(attemptNumber - 1, 62);
    final long nanos = LongMath.saturatedMultiply(base.toNanos(), 1L << exponent);
    return Math.min(nanos, cap.toNanos());
  }

  private long jitterNanos() {
    return (long) (random.nextDouble() * jitter.toNanos());
  }

  @Override
  public String toString() {
    return "ExponentialBackoffWithJitter{base="
        + base
        + ", cap="
        + cap
        + ", jitter="
        + jitter
        + '}';
  }
}
