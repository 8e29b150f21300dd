package com.spotify.retrier;

/** Reference point of {@link SeekableBody#seek}. */
public enum SeekOrigin {
  START,
  CURRENT,
  END
}
