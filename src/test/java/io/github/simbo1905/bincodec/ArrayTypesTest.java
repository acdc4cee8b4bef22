// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ArrayTypesTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public record ArrayHolder(byte[] bytes, int[] ints, double[] doubles, boolean[] flags, String[] names,
                       int[][] grid, @Fixed(3) long[] triple, WireFormatTest.Point[] points) {
  }

  public record Bags(List<String> names, Set<Integer> ids, SortedSet<String> sorted, Collection<Long> any) {
  }

  public record BadFixed(@Fixed(2) String notAnArray) {
  }

  @Test
  void testArraysRoundTrip() {
    final var original = new ArrayHolder(
        new byte[]{1, -1, 127},
        new int[]{Integer.MIN_VALUE, 0, Integer.MAX_VALUE},
        new double[]{0.5, -0.25},
        new boolean[]{true, false, true},
        new String[]{"a", "bc", ""},
        new int[][]{{1}, {}, {2, 3}},
        new long[]{7, 8, 9},
        new WireFormatTest.Point[]{new WireFormatTest.Point(1, 2), new WireFormatTest.Point(3, 4)});
    final var decoded = Binary.unmarshalAs(Binary.marshal(original), ArrayHolder.class);
    assertThat(decoded).usingRecursiveComparison().isEqualTo(original);
  }

  @Test
  void testEmptyArrays() {
    final byte[] bytes = Binary.marshal(new String[0]);
    assertThat(bytes).hasSize(8);
    assertThat(Binary.unmarshalAs(bytes, String[].class)).isEmpty();
  }

  @Test
  void testFixedLengthMismatchFails() {
    final var wrong = new ArrayHolder(new byte[0], new int[0], new double[0], new boolean[0], new String[0],
        new int[0][], new long[]{1, 2}, new WireFormatTest.Point[0]);
    assertThatThrownBy(() -> Binary.marshal(wrong))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must have 3 elements but has 2");
  }

  @Test
  void testFixedRefDecodesExactlyThatManyElements() {
    final byte[] bytes = Binary.marshal(Ref.fixed(new short[]{10, 20, 30}));
    assertThat(bytes).hasSize(6);
    final Ref<short[]> shorts = Ref.fixed(short[].class, 3);
    assertThat(Binary.unmarshal(bytes, shorts)).isEqualTo(6);
    assertThat(shorts.get()).containsExactly((short) 10, (short) 20, (short) 30);
    assertThat(shorts.fixedLength()).hasValue(3);
  }

  @Test
  void testFixedOnlyAppliesToArrays() {
    assertThatThrownBy(() -> Binary.marshal(new BadFixed("x")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("@Fixed");
    assertThatThrownBy(() -> Ref.fixed(String.class, 2))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testCollectionsRoundTrip() {
    final var original = new Bags(List.of("x", "y"), new LinkedHashSet<>(List.of(3, 1, 2)),
        new TreeSet<>(List.of("b", "a")), List.of(5L));
    final var decoded = Binary.unmarshalAs(Binary.marshal(original), Bags.class);
    assertThat(decoded).isEqualTo(original);
    assertThat(decoded.ids()).containsExactly(3, 1, 2);
    assertThat(decoded.sorted()).isInstanceOf(TreeSet.class);
  }

  @Test
  void testConcreteCollectionClass() {
    final var deque = new Ref<ArrayDeque<String>>(new ArrayDeque<>(List.of("head", "tail"))) {
    };
    final byte[] bytes = Binary.marshal(deque);
    final var decoded = new Ref<ArrayDeque<String>>() {
    };
    Binary.unmarshal(bytes, decoded);
    assertThat(decoded.get()).isInstanceOf(ArrayDeque.class).containsExactly("head", "tail");
  }

  @Test
  void testUnknownCollectionInterfaceIsDynamic() {
    final var queue = new Ref<Queue<String>>(new ArrayDeque<>()) {
    };
    assertThatThrownBy(() -> Binary.marshal(queue))
        .isInstanceOfSatisfying(UnsupportedKindException.class,
            e -> assertThat(e.kind()).isEqualTo(ForbiddenKind.DYNAMIC));
  }

  @Test
  void testListOfRecords() {
    final var points = new Ref<List<WireFormatTest.Point>>(List.of(new WireFormatTest.Point(5, 6))) {
    };
    final byte[] bytes = Binary.marshal(points);
    assertThat(bytes).hasSize(8 + 8);
    final var decoded = new Ref<List<WireFormatTest.Point>>() {
    };
    Binary.unmarshal(bytes, decoded);
    assertThat(decoded.get()).containsExactly(new WireFormatTest.Point(5, 6));
  }
}
