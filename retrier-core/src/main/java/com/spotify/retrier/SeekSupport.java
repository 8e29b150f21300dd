package com.spotify.retrier;

import java.io.IOException;

final class SeekSupport {

  private SeekSupport() {}

  static long resolve(long offset, SeekOrigin origin, long current, long size) throws IOException {
    final long target;
    switch (origin) {
      case START:
        target = offset;
        break;
      case CURRENT:
        target = current + offset;
        break;
      case END:
        target = size + offset;
        break;
      default:
        throw new IllegalArgumentException("unknown origin " + origin);
    }
    if (target < 0) {
      throw new IOException("negative position " + target);
    }
    return target;
  }
}
