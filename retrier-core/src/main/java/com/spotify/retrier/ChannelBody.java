package com.spotify.retrier;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;

class ChannelBody implements SeekableBody {
  private final SeekableByteChannel channel;
  private final InputStream stream;

  ChannelBody(SeekableByteChannel channel) {
    this.channel = channel;
    this.stream = Channels.newInputStream(channel);
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
  public long position() throws IOException {
    return channel.position();
  }

  @Override
  public long seek(long offset, SeekOrigin origin) throws IOException {
    final long target = SeekSupport.resolve(offset, origin, channel.position(), channel.size());
    channel.position(target);
    return target;
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }
}
