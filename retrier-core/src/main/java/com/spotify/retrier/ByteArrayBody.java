package com.spotify.retrier;

import java.io.IOException;
import java.io.InputStream;

class ByteArrayBody implements SeekableBody {
  private final byte[] payload;
  private final InputStream stream = new PositionedStream();
  private int position;

  ByteArrayBody(byte[] payload) {
    this.payload = payload;
  }

  @Override
  public InputStream stream() {
    return stream;
  }

  @Override
  public boolean isSeekable() {
    return true;
  }

  @Override
  public synchronized long position() {
    return position;
  }

  @Override
  public synchronized long seek(long offset, SeekOrigin origin) throws IOException {
    final long target = SeekSupport.resolve(offset, origin, position, payload.length);
    if (target > payload.length) {
      throw new IOException(
          "offset " + target + " is past the end of a " + payload.length + " byte body");
    }
    position = (int) target;
    return position;
  }

  @Override
  public void close() {}

  private class PositionedStream extends InputStream {
    @Override
    public int read() {
      synchronized (ByteArrayBody.this) {
        return position < payload.length ? payload[position++] & 0xff : -1;
      }
    }

    @Override
    public int read(byte[] buffer, int offset, int length) {
      synchronized (ByteArrayBody.this) {
        if (length == 0) {
          return 0;
        }
        final int available = payload.length - position;
        if (available <= 0) {
          return -1;
        }
        final int count = Math.min(length, available);
        System.arraycopy(payload, position, buffer, offset, count);
        position += count;
        return count;
      }
    }

    @Override
    public int available() {
      synchronized (ByteArrayBody.this) {
        return payload.length - position;
      }
    }
  }
}
