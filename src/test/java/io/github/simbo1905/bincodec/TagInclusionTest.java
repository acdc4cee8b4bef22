// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TagInclusionTest {

  static final HexFormat HEX = HexFormat.of();

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public record Tagged(@Tag(key = "test", value = "fieldA") int a,
                       @Tag(key = "test", value = "-") int b,
                       int c) {
  }

  public record DefaultKey(@Tag("id") long id, @Tag("") String blank, String untagged) {
  }

  public record MultiTagged(@Tag(key = "api", value = "name") @Tag(key = "db", value = "-") String name,
                            @Tag(key = "db", value = "secret") String secret) {
  }

  public record DuplicateTag(@Tag(key = "k", value = "a") @Tag(key = "k", value = "b") int x) {
  }

  public record Outer(@Tag(key = "test", value = "inner") Tagged inner, @Tag(key = "test", value = "-") String note) {
  }

  @Test
  void testAllComponentsIncludedWhenNotOnlyTagged() {
    final byte[] bytes = Binary.marshal(new Tagged(1, 2, 3));
    // the excluded value "-" has no effect outside only-tagged mode
    assertThat(HEX.formatHex(bytes)).isEqualTo("00000001" + "00000002" + "00000003");
  }

  @Test
  void testOnlyTaggedSkipsExcludedAndUntagged() {
    final byte[] bytes = Binary.marshalOnly(new Tagged(1, 2, 3), "test");
    assertThat(HEX.formatHex(bytes)).isEqualTo("00000001");
  }

  @Test
  void testUnmarshalOnlyKeepsComponentsOfExistingRecord() {
    final Ref<Tagged> target = Ref.to(Tagged.class, new Tagged(7, 8, 9));
    final long consumed = Binary.unmarshalOnly(HEX.parseHex("00000005"), target, "test");
    assertThat(consumed).isEqualTo(4);
    assertThat(target.get()).isEqualTo(new Tagged(5, 8, 9));
  }

  @Test
  void testUnmarshalOnlyDefaultsComponentsOfNewRecord() {
    final Ref<Tagged> target = Ref.to(Tagged.class);
    Binary.unmarshalOnly(HEX.parseHex("00000005"), target, "test");
    assertThat(target.get()).isEqualTo(new Tagged(5, 0, 0));
  }

  @Test
  void testDefaultTagKeyAndEmptyValue() {
    final var config = CodecConfig.DEFAULT.withOnlyTagged(true);
    final var original = new DefaultKey(42L, "blank", "untagged");
    final byte[] bytes = Binary.marshal(original, config);
    assertThat(HEX.formatHex(bytes)).isEqualTo("000000000000002a");
    final Ref<DefaultKey> target = Ref.to(DefaultKey.class);
    Binary.unmarshal(bytes, target, config);
    assertThat(target.get()).isEqualTo(new DefaultKey(42L, null, null));
  }

  @Test
  void testEachTagNameSelectsItsOwnComponents() {
    final var original = new MultiTagged("ann", "hunter2");
    assertThat(Binary.unmarshalAs(Binary.marshal(original), MultiTagged.class)).isEqualTo(original);

    final Ref<MultiTagged> api = Ref.to(MultiTagged.class);
    Binary.unmarshalOnly(Binary.marshalOnly(original, "api"), api, "api");
    assertThat(api.get()).isEqualTo(new MultiTagged("ann", null));

    final Ref<MultiTagged> db = Ref.to(MultiTagged.class);
    Binary.unmarshalOnly(Binary.marshalOnly(original, "db"), db, "db");
    assertThat(db.get()).isEqualTo(new MultiTagged(null, "hunter2"));
  }

  @Test
  void testNestedRecordsUseTheSameRule() {
    final var original = new Outer(new Tagged(1, 2, 3), "note");
    final byte[] bytes = Binary.marshalOnly(original, "test");
    assertThat(HEX.formatHex(bytes)).isEqualTo("00000001");
    final Ref<Outer> target = Ref.to(Outer.class, new Outer(new Tagged(0, 20, 30), "kept"));
    Binary.unmarshalOnly(bytes, target, "test");
    assertThat(target.get()).isEqualTo(new Outer(new Tagged(1, 20, 30), "kept"));
  }

  @Test
  void testDuplicateTagKeyIsRejected() {
    assertThatThrownBy(() -> Binary.marshal(new DuplicateTag(1)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Duplicate tag 'k'");
  }
}
