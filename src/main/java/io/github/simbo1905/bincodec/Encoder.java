// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.reflect.Type;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.util.Objects;

import static io.github.simbo1905.bincodec.Binary.LOGGER;

/// An encoding session writing to one sink. Not thread safe: create one per call chain.
/// Bytes go straight to the sink so a failure part way through leaves the prefix written so far.
public final class Encoder implements Binary {

  private final Wire.CountingSink sink;
  private final CodecConfig config;

  public Encoder(@NotNull WritableByteChannel sink) {
    this(sink, CodecConfig.DEFAULT);
  }

  public Encoder(@NotNull WritableByteChannel sink, @NotNull CodecConfig config) {
    this.sink = new Wire.CountingSink(sink);
    this.config = Objects.requireNonNull(config, "config must not be null");
  }

  public Encoder(@NotNull OutputStream out) {
    this(Channels.newChannel(Objects.requireNonNull(out, "out must not be null")), CodecConfig.DEFAULT);
  }

  public Encoder(@NotNull OutputStream out, @NotNull CodecConfig config) {
    this(Channels.newChannel(Objects.requireNonNull(out, "out must not be null")), config);
  }

  @Override
  public CodecConfig config() {
    return config;
  }

  /// Bytes this session has written so far, hook output included
  public long bytesWritten() {
    return sink.count();
  }

  /// Encode a value as its runtime class. A [Ref] is encoded as its declared type and fixed length.
  /// A null value writes nothing.
  /// @return the number of bytes written
  /// @throws UnsupportedKindException if the type is or contains a forbidden kind
  /// @throws IllegalArgumentException if the type is not supported or a fixed size array has the wrong length
  /// @throws ShortWriteException if the sink did not accept all bytes
  public long encode(Object value) throws IOException {
    if (value == null) {
      LOGGER.finer(() -> "Null value encodes to zero bytes");
      return 0;
    }
    if (value instanceof Ref<?> ref) {
      return encode(ref.get(), ref.type(), ref.fixed());
    }
    return encode(value, Ref.runtimeType(value), TypeExpr.VARIABLE);
  }

  /// Encode a value as the given static type which is checked even when the value is null.
  public long encode(Object value, @NotNull Type type) throws IOException {
    Objects.requireNonNull(type, "type must not be null");
    return encode(value, type, TypeExpr.VARIABLE);
  }

  private long encode(Object value, Type type, int fixedLength) throws IOException {
    final TypeExpr typeExpr = config.registry().prepare(type, fixedLength);
    if (Companion.isAbsent(value)) {
      LOGGER.finer(() -> "Absent " + typeExpr.toTreeString() + " encodes to zero bytes");
      return 0;
    }
    final Class<?> rawType = TypeExpr.rawClass(type);
    if (!boxed(rawType).isInstance(value)) {
      throw new IllegalArgumentException("Expected " + type.getTypeName() + " but got " + value.getClass().getName());
    }
    final long start = sink.count();
    config.registry().writerFor(typeExpr).write(this, value);
    final long written = sink.count() - start;
    LOGGER.fine(() -> "Encoded " + typeExpr.toTreeString() + " in " + written + " bytes");
    return written;
  }

  private static Class<?> boxed(Class<?> type) {
    if (!type.isPrimitive()) {
      return type;
    }
    return java.lang.invoke.MethodType.methodType(type).wrap().returnType();
  }

  ByteBuffer allocate(int size) {
    return ByteBuffer.allocate(size).order(config.byteOrder());
  }

  void writeScalar(TypeExpr.ScalarType scalarType, Object value) throws IOException {
    final ByteBuffer buffer = allocate(scalarType.width());
    scalarType.put(buffer, value);
    writeBuffer(buffer.flip());
  }

  /// Length prefixes are unsigned 64-bit in the session byte order
  void writeLength(long length) throws IOException {
    writeBuffer(allocate(Long.BYTES).putLong(length).flip());
  }

  void writeByte(byte value) throws IOException {
    writeBuffer(ByteBuffer.allocate(1).put(value).flip());
  }

  void writeRaw(byte[] bytes) throws IOException {
    writeBuffer(ByteBuffer.wrap(bytes));
  }

  void writeBuffer(ByteBuffer buffer) throws IOException {
    Wire.writeFully(sink, buffer);
  }

  /// Let a hook write straight to the sink. Its reported count is checked against what went through
  /// when the session is strict and otherwise only logged.
  void writeHook(CodecHandler.HookWriter<Object> hook, Object value) throws IOException {
    final long start = sink.count();
    final int reported = hook.write(sink, value);
    final long actual = sink.count() - start;
    if (reported != actual) {
      final String message = "Hook for " + value.getClass().getName() + " reported " + reported +
          " bytes written but wrote " + actual;
      if (config.strict()) {
        throw new IllegalStateException(message);
      }
      LOGGER.warning(() -> message);
    }
  }

  /// Encode into a separate buffer with the same settings, used to order map entries by key bytes
  byte[] detached(Writer writer, Object value) throws IOException {
    final var out = new ByteArrayOutputStream(32);
    final var child = new Encoder(Channels.newChannel(out), config);
    writer.write(child, value);
    return out.toByteArray();
  }
}
