// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.util.Objects;

import static io.github.simbo1905.bincodec.Binary.LOGGER;

/// Sink and source helpers shared by the codec and by custom hooks.
public final class Wire {

  /// Largest buffer a strict read allocates before its bytes have arrived
  static final int CHUNK = 64 * 1024;

  private Wire() {
  }

  /// Write all remaining bytes of the buffer in one request.
  /// @throws ShortWriteException if the sink accepted fewer bytes than were remaining
  public static void writeFully(@NotNull WritableByteChannel sink, @NotNull ByteBuffer bytes) throws IOException {
    final int requested = bytes.remaining();
    if (requested == 0) {
      return;
    }
    final int written = sink.write(bytes);
    if (written < requested) {
      throw new ShortWriteException(requested, written);
    }
  }

  /// Read `count` bytes big-endian, zero filling whatever the source could not supply.
  public static ByteBuffer readFully(@NotNull ReadableByteChannel source, int count) throws IOException {
    return readFully(source, count, ByteOrder.BIG_ENDIAN, false);
  }

  /// Keep reading until `count` bytes arrived or the source reports that no more are available.
  /// When the source runs dry early the remainder of the returned buffer is zero, unless `strict`.
  /// @return a buffer positioned at zero with its limit at `count`
  /// @throws TruncatedInputException when `strict` and the source ended early
  public static ByteBuffer readFully(@NotNull ReadableByteChannel source, int count, @NotNull ByteOrder order,
                                     boolean strict) throws IOException {
    Objects.requireNonNull(source, "source must not be null");
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative: " + count);
    }
    if (strict && count > CHUNK) {
      return readChunked(source, count, order);
    }
    final ByteBuffer buffer = ByteBuffer.allocate(count).order(order);
    while (buffer.hasRemaining()) {
      if (source.read(buffer) <= 0) {
        break;
      }
    }
    final int available = buffer.position();
    if (available < count) {
      if (strict) {
        throw new TruncatedInputException(count, available);
      }
      LOGGER.finer(() -> "Source ended after " + available + " of " + count + " bytes, zero filling the remainder");
    }
    buffer.clear();
    return buffer;
  }

  /// Strict reads of large counts grow with the data that actually arrives so a corrupt length
  /// prefix fails as truncated input rather than allocating its full size up front
  private static ByteBuffer readChunked(ReadableByteChannel source, int count, ByteOrder order) throws IOException {
    final var received = new ByteArrayOutputStream(CHUNK);
    final ByteBuffer chunk = ByteBuffer.allocate(CHUNK);
    while (received.size() < count) {
      chunk.clear().limit(Math.min(CHUNK, count - received.size()));
      while (chunk.hasRemaining()) {
        if (source.read(chunk) <= 0) {
          break;
        }
      }
      received.write(chunk.array(), 0, chunk.position());
      if (chunk.hasRemaining()) {
        throw new TruncatedInputException(count, received.size());
      }
    }
    return ByteBuffer.wrap(received.toByteArray()).order(order);
  }

  /// Sink decorator counting the bytes that actually went through, hooks included
  static final class CountingSink implements WritableByteChannel {
    private final WritableByteChannel delegate;
    private long count;

    CountingSink(WritableByteChannel delegate) {
      this.delegate = Objects.requireNonNull(delegate, "sink must not be null");
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
      final int written = delegate.write(src);
      if (written > 0) {
        count += written;
      }
      return written;
    }

    long count() {
      return count;
    }

    @Override
    public boolean isOpen() {
      return delegate.isOpen();
    }

    @Override
    public void close() throws IOException {
      delegate.close();
    }
  }

  /// Source decorator counting the bytes that were actually delivered, hooks included
  static final class CountingSource implements ReadableByteChannel {
    private final ReadableByteChannel delegate;
    private long count;

    CountingSource(ReadableByteChannel delegate) {
      this.delegate = Objects.requireNonNull(delegate, "source must not be null");
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
      final int read = delegate.read(dst);
      if (read > 0) {
        count += read;
      }
      return read;
    }

    long count() {
      return count;
    }

    @Override
    public boolean isOpen() {
      return delegate.isOpen();
    }

    @Override
    public void close() throws IOException {
      delegate.close();
    }
  }
}
