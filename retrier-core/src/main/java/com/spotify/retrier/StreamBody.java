package com.spotify.retrier;

import com.google.common.io.CountingInputStream;
import java.io.IOException;
import java.io.InputStream;

class StreamBody implements SeekableBody {
  private final CountingInputStream stream;

  StreamBody(InputStream stream) {
    this.stream = new CountingInputStream(stream);
  }

  @Override
  public InputStream stream() {
    return stream;
  }

  @Override
  public boolean isSeekable() {
    return false;
  }

  @Override
  public long position() {
    return stream.getCount();
  }

  @Override
  public long seek(long offset, SeekOrigin origin) throws IOException {
    throw new IOException("body is not seekable");
  }

  @Override
  public void close() throws IOException {
    stream.close();
  }
}
