// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.lang.ref.WeakReference;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ForbiddenKindsTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public record WithCallback(int id, Runnable callback) {
  }

  public record WithAnything(String name, Object payload) {
  }

  public record Holder(int id, WithCallback nested) {
  }

  public record Box<T>(T content) {
  }

  static void assertKind(Object value, ForbiddenKind kind) {
    assertThatThrownBy(() -> Binary.marshal(value))
        .isInstanceOfSatisfying(UnsupportedKindException.class, e -> assertThat(e.kind()).isEqualTo(kind));
  }

  @Test
  void testCallables() {
    final Runnable lambda = () -> {
    };
    assertKind(lambda, ForbiddenKind.CALLABLE);
    assertKind((Function<String, String>) String::trim, ForbiddenKind.CALLABLE);
    assertKind(new Thread(), ForbiddenKind.CALLABLE);
  }

  @Test
  void testChannels() {
    assertKind(new ArrayBlockingQueue<String>(1), ForbiddenKind.CHANNEL);
    assertKind(new CompletableFuture<String>(), ForbiddenKind.CHANNEL);
  }

  @Test
  void testAddresses() {
    assertKind(ByteBuffer.allocate(4), ForbiddenKind.ADDRESS);
    assertKind(new WeakReference<>("x"), ForbiddenKind.ADDRESS);
  }

  @Test
  void testDynamicValues() {
    assertKind(new Object(), ForbiddenKind.DYNAMIC);
    assertKind(new WithAnything("n", 1), ForbiddenKind.DYNAMIC);
    assertKind(new Box<>("generic"), ForbiddenKind.DYNAMIC);
    assertThatThrownBy(() -> Binary.marshal(new Ref<List<?>>(List.of()) {
    })).isInstanceOfSatisfying(UnsupportedKindException.class,
        e -> assertThat(e.kind()).isEqualTo(ForbiddenKind.DYNAMIC));
  }

  @Test
  void testNoType() {
    assertThatThrownBy(() -> Binary.marshal(Ref.to(Void.class)))
        .isInstanceOfSatisfying(UnsupportedKindException.class,
            e -> assertThat(e.kind()).isEqualTo(ForbiddenKind.NO_TYPE));
  }

  @Test
  void testNestedForbiddenFailsEvenWhenNull() {
    // the component type is checked whatever the value
    assertKind(new WithCallback(1, null), ForbiddenKind.CALLABLE);
  }

  @Test
  void testNothingWrittenBeforeNestedFailure() {
    final var out = new ByteArrayOutputStream();
    final var encoder = new Encoder(out);
    assertThatThrownBy(() -> encoder.encode(new Holder(7, new WithCallback(1, null))))
        .isInstanceOf(UnsupportedKindException.class)
        .hasMessageContaining("callable")
        .hasMessageContaining("Runnable");
    assertThat(out.toByteArray()).isEmpty();
    assertThat(encoder.bytesWritten()).isZero();
  }

  @Test
  void testDecodeRejectsForbiddenTypes() {
    final byte[] bytes = new byte[16];
    assertThatThrownBy(() -> Binary.unmarshal(bytes, Ref.to(WithCallback.class)))
        .isInstanceOfSatisfying(UnsupportedKindException.class,
            e -> assertThat(e.kind()).isEqualTo(ForbiddenKind.CALLABLE));
    assertThatThrownBy(() -> Binary.unmarshal(bytes, new Ref<List<Object>>() {
    })).isInstanceOfSatisfying(UnsupportedKindException.class,
        e -> assertThat(e.kind()).isEqualTo(ForbiddenKind.DYNAMIC));
  }

  @Test
  void testDecodeRejectsForbiddenTargets() {
    final byte[] bytes = new byte[8];
    final Runnable lambda = () -> {
    };
    assertThatThrownBy(() -> Binary.unmarshal(bytes, lambda))
        .isInstanceOfSatisfying(UnsupportedKindException.class,
            e -> assertThat(e.kind()).isEqualTo(ForbiddenKind.CALLABLE));
    assertThatThrownBy(() -> Binary.unmarshal(bytes, new ArrayBlockingQueue<String>(1)))
        .isInstanceOfSatisfying(UnsupportedKindException.class,
            e -> assertThat(e.kind()).isEqualTo(ForbiddenKind.CHANNEL));
  }

  @Test
  void testUnsupportedConcreteClassIsNotAForbiddenKind() {
    assertThatThrownBy(() -> Binary.marshal(new StringBuilder("x")))
        .isInstanceOf(IllegalArgumentException.class)
        .isNotInstanceOf(UnsupportedKindException.class)
        .hasMessageContaining("Unsupported type");
  }
}
