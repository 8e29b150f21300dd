package com.spotify.retrier;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates retry tokens, sent with mutating requests so the service can recognize a resent call.
 * Tokens are not secrets.
 */
public final class RetryTokens {

  public static final int DEFAULT_LENGTH = 32;

  static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";

  private final Random random;

  public RetryTokens(Random random) {
    this.random = checkNotNull(random, "random");
  }

  /** A {@value #DEFAULT_LENGTH} character token drawn from the thread-local random source. */
  public static String newToken() {
    return generate(ThreadLocalRandom.current(), DEFAULT_LENGTH);
  }

  public String generate() {
    return generate(DEFAULT_LENGTH);
  }

  public String generate(int length) {
    return generate(random, length);
  }

  private static String generate(Random random, int length) {
    checkArgument(length > 0, "length must be positive, was %s", length);
    final char[] token = new char[length];
    for (int i = 0; i < length; i++) {
      token[i] = ALPHABET.charAt(random.nextInt(ALPHABET.length()));
    }
    return new String(token);
  }
}
