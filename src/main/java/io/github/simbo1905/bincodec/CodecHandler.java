// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import java.io.IOException;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.util.Objects;

/// Custom codec for a type that cannot implement [BinaryMarshaler] itself, such as a JDK value type.
/// Handlers are registered with a [CodecRegistry] and take precedence over every other rule
/// for their type, including hooks the type implements.
///
/// ```java
/// var uuids = new CodecHandler<>(UUID.class,
///     (sink, uuid) -> {
///       Wire.writeFully(sink, ByteBuffer.allocate(16)
///           .putLong(uuid.getMostSignificantBits())
///           .putLong(uuid.getLeastSignificantBits())
///           .flip());
///       return 16;
///     },
///     source -> {
///       final var buffer = Wire.readFully(source, 16);
///       return new UUID(buffer.getLong(), buffer.getLong());
///     });
/// ```
public record CodecHandler<T>(Class<T> type, HookWriter<T> writer, HookReader<T> reader) {

  public CodecHandler {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(writer, "writer must not be null");
    Objects.requireNonNull(reader, "reader must not be null");
    if (type.isPrimitive() || type.isArray()) {
      throw new IllegalArgumentException("Custom handlers must be for a reference type that is not an array: " + type);
    }
  }

  @FunctionalInterface
  public interface HookWriter<T> {
    /// @return the number of bytes written, informational unless the session is strict
    int write(WritableByteChannel sink, T value) throws IOException;
  }

  @FunctionalInterface
  public interface HookReader<T> {
    T read(ReadableByteChannel source) throws IOException;
  }
}
