package com.spotify.retrier;

import com.google.common.util.concurrent.MoreExecutors;
import io.grpc.Context;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Pauses the retry loop between attempts. */
@FunctionalInterface
public interface Sleeper {

  /**
   * Waits for {@code delay}. Implementations may return early once {@code context} is cancelled;
   * the loop checks for cancellation before the next attempt either way.
   */
  void sleep(Duration delay, Context context) throws InterruptedException;

  /** Waits for the delay or until the context is cancelled, whichever comes first. */
  static Sleeper cancellable() {
    return (delay, context) -> {
      final CountDownLatch cancelled = new CountDownLatch(1);
      final Context.CancellationListener listener = ignored -> cancelled.countDown();
      context.addListener(listener, MoreExecutors.directExecutor());
      try {
        cancelled.await(TimeUnit.NANOSECONDS.convert(delay), TimeUnit.NANOSECONDS);
      } finally {
        context.removeListener(listener);
      }
    };
  }
}
