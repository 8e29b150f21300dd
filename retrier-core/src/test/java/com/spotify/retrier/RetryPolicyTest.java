package com.spotify.retrier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  private static final AttemptContext<FakeResponse> FAILED_ATTEMPT =
      new AttemptContext<>(null, new IOException("down"), 1);

  @Test
  void testNoRetryAllowsExactlyOneAttempt() {
    final RetryPolicy policy = RetryPolicy.noRetry();

    assertThat(policy.maxAttempts()).isEqualTo(1);
    assertThat(policy.allowsAttempt(1)).isTrue();
    assertThat(policy.allowsAttempt(2)).isFalse();
    assertThat(policy.shouldRetry(FAILED_ATTEMPT)).isFalse();
    assertThat(policy.nextDelay(FAILED_ATTEMPT)).isEqualTo(Duration.ZERO);
  }

  @Test
  void testDefaultPolicyAllowsEightAttempts() {
    final RetryPolicy policy = RetryPolicy.defaultPolicy();

    assertThat(policy.maxAttempts()).isEqualTo(8);
    assertThat(policy.allowsAttempt(8)).isTrue();
    assertThat(policy.allowsAttempt(9)).isFalse();
    assertThat(policy.shouldRetry(FAILED_ATTEMPT)).isTrue();
  }

  @Test
  void testZeroMaxAttemptsIsUnlimited() {
    final RetryPolicy policy =
        RetryPolicy.of(RetryPolicy.UNLIMITED_ATTEMPTS, attempt -> true, attempt -> Duration.ZERO);

    assertThat(policy.isUnlimited()).isTrue();
    assertThat(policy.allowsAttempt(1_000_000)).isTrue();
    assertThat(policy.toString()).contains("unlimited");
  }

  @Test
  void testNegativeMaxAttemptsIsRejected() {
    assertThatThrownBy(() -> RetryPolicy.of(-1, attempt -> true, attempt -> Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testMissingFunctionsAreRejected() {
    assertThatThrownBy(() -> RetryPolicy.of(3, null, attempt -> Duration.ZERO))
        .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> RetryPolicy.of(3, attempt -> true, null))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void testNegativeDelayIsTreatedAsZero() {
    final RetryPolicy policy =
        RetryPolicy.of(2, attempt -> true, attempt -> Duration.ofSeconds(-3));

    assertThat(policy.nextDelay(FAILED_ATTEMPT)).isEqualTo(Duration.ZERO);
  }

  @Test
  void testWithMaxAttemptsKeepsFunctions() {
    final RetryPolicy policy =
        RetryPolicy.of(2, attempt -> true, attempt -> Duration.ofMillis(50)).withMaxAttempts(5);

    assertThat(policy.maxAttempts()).isEqualTo(5);
    assertThat(policy.shouldRetry(FAILED_ATTEMPT)).isTrue();
    assertThat(policy.nextDelay(FAILED_ATTEMPT)).isEqualTo(Duration.ofMillis(50));
  }

  @Test
  void testAttemptNumbersStartAtOne() {
    assertThatThrownBy(() -> new AttemptContext<FakeResponse>(new FakeResponse(200), null, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
