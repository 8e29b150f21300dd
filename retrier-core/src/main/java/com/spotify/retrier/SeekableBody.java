package com.spotify.retrier;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.SeekableByteChannel;

/**
 * Binary payload of a request.
 *
 * <p>A retried attempt has to resend the payload from where the first attempt started reading it.
 * Bodies that cannot be rewound make a warranted retry fail with {@link
 * Exceptions.NonSeekableRetryFailure} instead.
 */
public interface SeekableBody extends Closeable {

  /** The stream operations read the payload from. Reads advance {@link #position()}. */
  InputStream stream();

  boolean isSeekable();

  /** Current read offset from the start of the payload. */
  long position() throws IOException;

  /**
   * Moves the read offset.
   *
   * @return the new offset from the start of the payload
   * @throws IOException if the body is not seekable or the resulting offset is invalid
   */
  long seek(long offset, SeekOrigin origin) throws IOException;

  static SeekableBody ofBytes(byte[] payload) {
    return new ByteArrayBody(checkNotNull(payload, "payload"));
  }

  static SeekableBody ofChannel(SeekableByteChannel channel) {
    return new ChannelBody(checkNotNull(channel, "channel"));
  }

  /** Wraps a plain stream. The result is not seekable. */
  static SeekableBody ofStream(InputStream stream) {
    return new StreamBody(checkNotNull(stream, "stream"));
  }
}
