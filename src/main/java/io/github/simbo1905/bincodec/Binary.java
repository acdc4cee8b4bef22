// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Type;
import java.nio.ByteOrder;
import java.nio.channels.Channels;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point of the binary codec. An [Encoder] walks a value guided by its static type and writes
/// a compact, schema-less byte stream. A [Decoder] walks the same type and reads it back.
/// There are no field names, type tags or version markers on the wire: both sides must agree on
/// the type and the [CodecConfig].
///
/// ```java
/// record Point(int x, int y) {}
/// byte[] bytes = Binary.marshal(new Point(1, 2));
/// Ref<Point> point = Ref.to(Point.class);
/// Binary.unmarshal(bytes, point);
/// ```
public sealed interface Binary permits Encoder, Decoder {

  Logger LOGGER = Logger.getLogger(Binary.class.getName());

  /// The tag key consulted by [Tag] annotations when no key is given
  String DEFAULT_TAG = "bin";

  /// Tag value that excludes a component when only tagged components are serialized
  String EXCLUDE = "-";

  ByteOrder DEFAULT_BYTE_ORDER = ByteOrder.BIG_ENDIAN;

  CodecConfig config();

  /// Encode a value into a new byte array with the default settings.
  /// Strings are written as UTF-8 so an unpaired surrogate character comes back as `?`.
  /// @throws UnsupportedKindException if the value's type is or contains a forbidden kind
  static byte[] marshal(Object value) {
    return marshal(value, CodecConfig.DEFAULT);
  }

  static byte[] marshal(Object value, @NotNull CodecConfig config) {
    Objects.requireNonNull(config, "config must not be null");
    final var out = new ByteArrayOutputStream(128);
    final var encoder = new Encoder(Channels.newChannel(out), config);
    try {
      encoder.encode(value);
    } catch (IOException e) {
      // only hooks can fail against an in-memory sink
      throw new UncheckedIOException(e);
    }
    return out.toByteArray();
  }

  /// Encode a value as the given static type rather than its runtime class.
  /// Needed for generic containers as erasure hides their element types.
  static byte[] marshal(Object value, @NotNull Type type) {
    return marshal(value, type, CodecConfig.DEFAULT);
  }

  static byte[] marshal(Object value, @NotNull Type type, @NotNull CodecConfig config) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(config, "config must not be null");
    final var out = new ByteArrayOutputStream(128);
    final var encoder = new Encoder(Channels.newChannel(out), config);
    try {
      encoder.encode(value, type);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toByteArray();
  }

  /// Encode only the record components tagged with a non-empty value under `tag`
  static byte[] marshalOnly(Object value, @NotNull String tag) {
    return marshal(value, CodecConfig.DEFAULT.onlyTagged(tag));
  }

  /// Decode bytes into the target, which must be a [Ref] or a [BinaryUnmarshaler].
  /// @return the number of bytes consumed
  static long unmarshal(byte @NotNull [] bytes, Object target) {
    return unmarshal(bytes, target, CodecConfig.DEFAULT);
  }

  static long unmarshal(byte @NotNull [] bytes, Object target, @NotNull CodecConfig config) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    Objects.requireNonNull(config, "config must not be null");
    final var decoder = new Decoder(Channels.newChannel(new ByteArrayInputStream(bytes)), config);
    try {
      return decoder.decode(target);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  static long unmarshalOnly(byte @NotNull [] bytes, Object target, @NotNull String tag) {
    return unmarshal(bytes, target, CodecConfig.DEFAULT.onlyTagged(tag));
  }

  /// Decode a fresh value of a non-generic type
  static <T> T unmarshalAs(byte @NotNull [] bytes, @NotNull Class<T> type) {
    final Ref<T> ref = Ref.to(type);
    unmarshal(bytes, ref);
    return ref.get();
  }
}
