package com.spotify.retrier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;

class RetryExecutorOptionsTest {

  @Test
  void testDefaults() {
    final RetryExecutorOptions options = RetryExecutorOptions.defaults();

    assertThat(options.getDefaultPolicy().maxAttempts())
        .isEqualTo(RetryPolicy.DEFAULT_MAX_ATTEMPTS);
    assertThat(options.getRetryTokenHeader()).isEmpty();
    assertThat(options.getExecutorService()).isEmpty();
    assertThat(options.getRetryTokenSupplier().get()).hasSize(RetryTokens.DEFAULT_LENGTH);
  }

  @Test
  void testWithMethodsReturnModifiedCopies() {
    final RetryExecutorOptions defaults = RetryExecutorOptions.defaults();
    final ExecutorService workers = Executors.newSingleThreadExecutor();
    try {
      final RetryExecutorOptions options =
          defaults
              .withDefaultPolicy(RetryPolicy.noRetry())
              .withRetryTokenHeader("retry-token")
              .withExecutorService(workers)
              .withRetryTokenSupplier(() -> "fixed");

      assertThat(options.getDefaultPolicy()).isSameAs(RetryPolicy.noRetry());
      assertThat(options.getRetryTokenHeader()).hasValue("retry-token");
      assertThat(options.getExecutorService()).hasValue(workers);
      assertThat(options.getRetryTokenSupplier().get()).isEqualTo("fixed");
      assertThat(defaults.getRetryTokenHeader()).isEmpty();
      assertThat(options.toString()).contains("retry-token");
    } finally {
      workers.shutdownNow();
    }
  }

  @Test
  void testEmptyRetryTokenHeaderMeansNone() {
    assertThat(RetryExecutorOptions.defaults().withRetryTokenHeader("").getRetryTokenHeader())
        .isEmpty();
  }

  @Test
  void testNullPolicyIsRejected() {
    assertThatThrownBy(() -> RetryExecutorOptions.defaults().withDefaultPolicy(null))
        .isInstanceOf(NullPointerException.class);
  }
}
