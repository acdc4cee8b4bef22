// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;
import java.util.HexFormat;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CodecConfigTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @AfterEach
  void clearSystemProperties() {
    System.clearProperty("no.framework.bincodec.byteOrder");
    System.clearProperty("no.framework.bincodec.strict");
  }

  @Test
  void testDefaults() {
    final var config = CodecConfig.DEFAULT;
    assertThat(config.byteOrder()).isEqualTo(ByteOrder.BIG_ENDIAN);
    assertThat(config.tag()).isEqualTo("bin");
    assertThat(config.onlyTagged()).isFalse();
    assertThat(config.strict()).isFalse();
    assertThat(config.presenceMarkers()).isFalse();
    assertThat(config.sortedMaps()).isFalse();
    assertThat(config.registry()).isSameAs(CodecRegistry.BUILT_IN);
  }

  @Test
  void testCopiesLeaveTheOriginalUnchanged() {
    final var config = CodecConfig.DEFAULT.onlyTagged("api").withStrict(true).withSortedMaps(true);
    assertThat(config.tag()).isEqualTo("api");
    assertThat(config.onlyTagged()).isTrue();
    assertThat(config.strict()).isTrue();
    assertThat(config.sortedMaps()).isTrue();
    assertThat(CodecConfig.DEFAULT.tag()).isEqualTo(Binary.DEFAULT_TAG);
    assertThat(CodecConfig.DEFAULT.onlyTagged()).isFalse();
  }

  @Test
  void testEmptyTagIsRejected() {
    assertThatThrownBy(() -> CodecConfig.DEFAULT.withTag(""))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testFromProperties() {
    final var properties = new Properties();
    properties.setProperty("no.framework.bincodec.byteOrder", "little_endian");
    properties.setProperty("no.framework.bincodec.tag", "db");
    properties.setProperty("no.framework.bincodec.onlyTagged", "true");
    properties.setProperty("no.framework.bincodec.presenceMarkers", "TRUE");
    final var config = CodecConfig.fromProperties(properties);
    assertThat(config.byteOrder()).isEqualTo(ByteOrder.LITTLE_ENDIAN);
    assertThat(config.tag()).isEqualTo("db");
    assertThat(config.onlyTagged()).isTrue();
    assertThat(config.presenceMarkers()).isTrue();
    assertThat(config.strict()).isFalse();
    assertThat(config.sortedMaps()).isFalse();
  }

  @Test
  void testEmptyPropertiesGiveTheDefaults() {
    assertThat(CodecConfig.fromProperties(new Properties())).isEqualTo(CodecConfig.DEFAULT);
  }

  @Test
  void testInvalidValuesListTheLegalOnes() {
    final var badOrder = new Properties();
    badOrder.setProperty("no.framework.bincodec.byteOrder", "middle");
    assertThatThrownBy(() -> CodecConfig.fromProperties(badOrder))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("BIG_ENDIAN, LITTLE_ENDIAN, NATIVE");

    final var badFlag = new Properties();
    badFlag.setProperty("no.framework.bincodec.strict", "yes");
    assertThatThrownBy(() -> CodecConfig.fromProperties(badFlag))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("no.framework.bincodec.strict")
        .hasMessageContaining("true, false");
  }

  public record Badge(@Tag(key = "api", value = "id") int id, String secret) {
  }

  @Test
  void testTypedEncodeUsesTheGivenSettings() {
    final var littleEndian = CodecConfig.DEFAULT.withByteOrder(ByteOrder.LITTLE_ENDIAN);
    final var numbers = new Ref<List<Integer>>() {
    };
    final byte[] bytes = Binary.marshal(List.of(1), numbers.type(), littleEndian);
    assertThat(HexFormat.of().formatHex(bytes)).isEqualTo("0100000000000000" + "01000000");
    assertThat(Binary.unmarshal(bytes, numbers, littleEndian)).isEqualTo(bytes.length);
    assertThat(numbers.get()).containsExactly(1);

    final byte[] tagged = Binary.marshal(new Badge(2, "hidden"), Badge.class, CodecConfig.DEFAULT.onlyTagged("api"));
    assertThat(HexFormat.of().formatHex(tagged)).isEqualTo("00000002");
  }

  @Test
  void testFromSystemProperties() {
    System.setProperty("no.framework.bincodec.byteOrder", "LITTLE_ENDIAN");
    System.setProperty("no.framework.bincodec.strict", "true");
    final var config = CodecConfig.fromSystemProperties();
    assertThat(config.byteOrder()).isEqualTo(ByteOrder.LITTLE_ENDIAN);
    assertThat(config.strict()).isTrue();
    assertThat(Binary.marshal(1, config)).containsExactly((byte) 1, (byte) 0, (byte) 0, (byte) 0);
  }
}
