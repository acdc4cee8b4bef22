// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.util.Objects;

import static io.github.simbo1905.bincodec.Binary.LOGGER;

/// A decoding session reading from one source. Not thread safe: create one per call chain.
///
/// Unless the session is strict, input that ends early is read as if the missing bytes were zero.
/// Compare [#decode]'s result with the input length to detect truncation in that mode.
public final class Decoder implements Binary {

  /// Largest length prefix accepted, the largest array the JVM reliably allocates
  static final int MAX_LENGTH = Integer.MAX_VALUE - 8;

  private final Wire.CountingSource source;
  private final CodecConfig config;

  public Decoder(@NotNull ReadableByteChannel source) {
    this(source, CodecConfig.DEFAULT);
  }

  public Decoder(@NotNull ReadableByteChannel source, @NotNull CodecConfig config) {
    this.source = new Wire.CountingSource(source);
    this.config = Objects.requireNonNull(config, "config must not be null");
  }

  public Decoder(@NotNull InputStream in) {
    this(Channels.newChannel(Objects.requireNonNull(in, "in must not be null")), CodecConfig.DEFAULT);
  }

  public Decoder(@NotNull InputStream in, @NotNull CodecConfig config) {
    this(Channels.newChannel(Objects.requireNonNull(in, "in must not be null")), config);
  }

  @Override
  public CodecConfig config() {
    return config;
  }

  /// Bytes this session has consumed so far, hook input included
  public long bytesRead() {
    return source.count();
  }

  /// Decode into a target.
  ///
  /// - `null` is a no-op consuming nothing.
  /// - A [BinaryUnmarshaler] decodes itself, unless the registry has a handler for its type.
  /// - A [Ref] receives a newly decoded value. Records already held by the ref supply the
  ///   components that are not on the wire. On failure the ref is left unchanged.
  ///
  /// @return the number of bytes consumed from the source
  /// @throws NotAPointerException if the target is anything else
  /// @throws IllegalArgumentException if the target is a [BinaryUnmarshaler] with a registered handler
  /// @throws UnsupportedKindException if the target type is or contains a forbidden kind
  /// @throws TruncatedInputException if the session is strict and the source ended early
  /// @throws IllegalStateException if the bytes cannot be a value of the type
  public long decode(Object target) throws IOException {
    if (target == null) {
      LOGGER.finer(() -> "Null target consumes zero bytes");
      return 0;
    }
    final var forbidden = ForbiddenKind.concrete(target.getClass());
    if (forbidden.isPresent()) {
      throw new UnsupportedKindException(forbidden.get(), target.getClass());
    }
    final long start = source.count();
    if (target instanceof BinaryUnmarshaler && config.registry().handlerFor(target.getClass()).isPresent()) {
      // the handler owns the wire format and builds a new value so it cannot fill this instance
      throw new IllegalArgumentException(target.getClass().getName() +
          " has a registered handler so must be decoded through a Ref rather than into an instance");
    }
    if (target instanceof BinaryUnmarshaler unmarshaler) {
      unmarshalInto(unmarshaler);
    } else if (target instanceof Ref<?> ref) {
      decodeInto(ref);
    } else {
      throw new NotAPointerException(target);
    }
    final long consumed = source.count() - start;
    LOGGER.fine(() -> "Decoded " + target.getClass().getSimpleName() + " from " + consumed + " bytes");
    return consumed;
  }

  @SuppressWarnings("unchecked")
  private <T> void decodeInto(Ref<T> ref) throws IOException {
    final TypeExpr typeExpr = config.registry().prepare(ref.type(), ref.fixed());
    final Object value = config.registry().readerFor(typeExpr).read(this, ref.get());
    ref.set((T) value);
  }

  Object readScalar(TypeExpr.ScalarType scalarType) throws IOException {
    return scalarType.get(readBuffer(scalarType.width()));
  }

  /// Read a length prefix
  /// @throws IllegalStateException if it is larger than a Java array can hold
  int readLength() throws IOException {
    final long length = readBuffer(Long.BYTES).getLong();
    if (length < 0 || length > MAX_LENGTH) {
      throw new IllegalStateException("Length prefix " + Long.toUnsignedString(length) +
          " at position " + (source.count() - Long.BYTES) + " is larger than " + MAX_LENGTH);
    }
    return (int) length;
  }

  byte readByte() throws IOException {
    return readBuffer(1).get();
  }

  byte[] readBytes(int count) throws IOException {
    return readBuffer(count).array();
  }

  ByteBuffer readBuffer(int count) throws IOException {
    return Wire.readFully(source, count, config.byteOrder(), config.strict());
  }

  Object readHandler(CodecHandler.HookReader<?> hook) throws IOException {
    return hook.read(source);
  }

  /// Let a hook read straight from the source, checking its reported count when strict
  void unmarshalInto(BinaryUnmarshaler target) throws IOException {
    final long start = source.count();
    final int reported = target.unmarshalBinary(source);
    final long actual = source.count() - start;
    if (reported != actual) {
      final String message = "Hook for " + target.getClass().getName() + " reported " + reported +
          " bytes read but read " + actual;
      if (config.strict()) {
        throw new IllegalStateException(message);
      }
      LOGGER.warning(() -> message);
    }
  }
}
