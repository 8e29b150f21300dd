package com.spotify.retrier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RetryTokensTest {

  @Test
  void testDefaultTokenIsThirtyTwoAlphanumerics() {
    final String token = RetryTokens.newToken();

    assertThat(token).hasSize(32).matches("[a-zA-Z0-9]+");
  }

  @Test
  void testCustomLength() {
    assertThat(new RetryTokens(new Random()).generate(7)).hasSize(7).matches("[a-zA-Z0-9]+");
  }

  @Test
  void testNonPositiveLengthIsRejected() {
    assertThatThrownBy(() -> new RetryTokens(new Random()).generate(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testSeededGeneratorsAgree() {
    assertThat(new RetryTokens(new Random(3)).generate())
        .isEqualTo(new RetryTokens(new Random(3)).generate());
  }

  @Test
  void testTokensDoNotRepeat() {
    final Set<String> tokens = new HashSet<>();
    for (int i = 0; i < 1000; i++) {
      tokens.add(RetryTokens.newToken());
    }
    assertThat(tokens).hasSize(1000);
  }

  @Test
  void testEveryCharacterComesFromTheAlphabet() {
    final String token = new RetryTokens(new Random(11)).generate(10_000);

    for (char c : token.toCharArray()) {
      assertThat(RetryTokens.ALPHABET.indexOf(c)).isNotNegative();
    }
  }
}
