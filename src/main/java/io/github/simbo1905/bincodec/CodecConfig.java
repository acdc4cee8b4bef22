// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteOrder;
import java.util.Objects;
import java.util.Properties;

import static io.github.simbo1905.bincodec.Binary.LOGGER;

/// Immutable session settings shared by an [Encoder] and the [Decoder] that reads its output.
/// Both ends must use equal settings or the bytes will not line up.
///
/// @param byteOrder       order of every multi-byte value, length prefixes included
/// @param tag             the [Tag] key consulted when `onlyTagged` is set
/// @param onlyTagged      skip record components without a non-empty, non-excluded tag value
/// @param strict          fail on truncated input and on hooks that misreport their byte count
/// @param presenceMarkers write a one byte marker before every nullable slot inside a composite
/// @param sortedMaps      write map entries in the order of their encoded key bytes
/// @param registry        custom type handlers
public record CodecConfig(@NotNull ByteOrder byteOrder,
                          @NotNull String tag,
                          boolean onlyTagged,
                          boolean strict,
                          boolean presenceMarkers,
                          boolean sortedMaps,
                          @NotNull CodecRegistry registry) {

  static final String PREFIX = "no.framework.bincodec.";

  public static final CodecConfig DEFAULT = new CodecConfig(
      Binary.DEFAULT_BYTE_ORDER, Binary.DEFAULT_TAG, false, false, false, false, CodecRegistry.BUILT_IN);

  public CodecConfig {
    Objects.requireNonNull(byteOrder, "byteOrder must not be null");
    Objects.requireNonNull(tag, "tag must not be null");
    Objects.requireNonNull(registry, "registry must not be null");
    if (tag.isEmpty()) {
      throw new IllegalArgumentException("tag must not be empty");
    }
  }

  public CodecConfig withByteOrder(@NotNull ByteOrder byteOrder) {
    return new CodecConfig(byteOrder, tag, onlyTagged, strict, presenceMarkers, sortedMaps, registry);
  }

  public CodecConfig withTag(@NotNull String tag) {
    return new CodecConfig(byteOrder, tag, onlyTagged, strict, presenceMarkers, sortedMaps, registry);
  }

  public CodecConfig withOnlyTagged(boolean onlyTagged) {
    return new CodecConfig(byteOrder, tag, onlyTagged, strict, presenceMarkers, sortedMaps, registry);
  }

  /// Shorthand for selecting the components tagged under `tag`
  public CodecConfig onlyTagged(@NotNull String tag) {
    return withTag(tag).withOnlyTagged(true);
  }

  public CodecConfig withStrict(boolean strict) {
    return new CodecConfig(byteOrder, tag, onlyTagged, strict, presenceMarkers, sortedMaps, registry);
  }

  public CodecConfig withPresenceMarkers(boolean presenceMarkers) {
    return new CodecConfig(byteOrder, tag, onlyTagged, strict, presenceMarkers, sortedMaps, registry);
  }

  public CodecConfig withSortedMaps(boolean sortedMaps) {
    return new CodecConfig(byteOrder, tag, onlyTagged, strict, presenceMarkers, sortedMaps, registry);
  }

  public CodecConfig withRegistry(@NotNull CodecRegistry registry) {
    return new CodecConfig(byteOrder, tag, onlyTagged, strict, presenceMarkers, sortedMaps, registry);
  }

  /// Settings from the `no.framework.bincodec.*` system properties, falling back to [#DEFAULT]
  public static CodecConfig fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  /// Read settings from properties with the keys `no.framework.bincodec.byteOrder`, `tag`,
  /// `onlyTagged`, `strict`, `presenceMarkers` and `sortedMaps`. Missing keys keep their default.
  /// Custom handlers cannot be configured this way.
  /// @throws IllegalArgumentException naming the legal values when a property is malformed
  public static CodecConfig fromProperties(@NotNull Properties properties) {
    Objects.requireNonNull(properties, "properties must not be null");
    final var config = new CodecConfig(
        byteOrder(properties.getProperty(PREFIX + "byteOrder")),
        properties.getProperty(PREFIX + "tag", Binary.DEFAULT_TAG),
        flag(properties, "onlyTagged"),
        flag(properties, "strict"),
        flag(properties, "presenceMarkers"),
        flag(properties, "sortedMaps"),
        CodecRegistry.BUILT_IN);
    LOGGER.fine(() -> "Loaded codec configuration " + config);
    return config;
  }

  private static ByteOrder byteOrder(String value) {
    if (value == null) {
      return Binary.DEFAULT_BYTE_ORDER;
    }
    return switch (value.trim().toUpperCase()) {
      case "BIG_ENDIAN" -> ByteOrder.BIG_ENDIAN;
      case "LITTLE_ENDIAN" -> ByteOrder.LITTLE_ENDIAN;
      case "NATIVE" -> ByteOrder.nativeOrder();
      default -> throw new IllegalArgumentException("Invalid " + PREFIX + "byteOrder value: '" + value +
          "'. Valid values are: BIG_ENDIAN, LITTLE_ENDIAN, NATIVE");
    };
  }

  private static boolean flag(Properties properties, String name) {
    final String value = properties.getProperty(PREFIX + name);
    if (value == null) {
      return false;
    }
    return switch (value.trim().toLowerCase()) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException("Invalid " + PREFIX + name + " value: '" + value +
          "'. Valid values are: true, false");
    };
  }
}
