// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Objects;
import java.util.OptionalInt;

/// A mutable slot with a static type, the decode target of a [Decoder].
/// Generic types are captured with an anonymous subclass:
///
/// ```java
/// var names = new Ref<Map<String, List<Integer>>>() {};
/// Binary.unmarshal(bytes, names);
/// ```
///
/// A ref that already holds a value has it updated in place where the type allows, so record
/// components excluded from the wire keep their current values.
public class Ref<T> {

  private final Type type;
  private final int fixed;
  private T value;

  /// Capture the type argument of an anonymous subclass
  protected Ref() {
    this((T) null);
  }

  protected Ref(T initial) {
    final Type superclass = getClass().getGenericSuperclass();
    if (!(superclass instanceof ParameterizedType parameterized)) {
      throw new IllegalArgumentException("Ref must be created as an anonymous subclass with a type argument " +
          "such as new Ref<List<String>>() {} or with Ref.to(Class)");
    }
    this.type = parameterized.getActualTypeArguments()[0];
    this.fixed = TypeExpr.VARIABLE;
    this.value = initial;
  }

  private Ref(@NotNull Type type, int fixed, T initial) {
    this.type = Objects.requireNonNull(type, "type must not be null");
    this.fixed = fixed;
    this.value = initial;
  }

  public static <T> Ref<T> to(@NotNull Class<T> type) {
    return new Ref<>(type, TypeExpr.VARIABLE, null);
  }

  public static <T> Ref<T> to(@NotNull Class<T> type, T initial) {
    return new Ref<>(type, TypeExpr.VARIABLE, initial);
  }

  /// A ref typed by the runtime class of the value. Enum constants use their declaring class.
  public static <T> Ref<T> of(@NotNull T value) {
    Objects.requireNonNull(value, "value must not be null, use Ref.to(Class) for an empty ref");
    return new Ref<>(runtimeType(value), TypeExpr.VARIABLE, value);
  }

  /// A ref to an array of exactly `length` elements written without a length prefix
  public static <T> Ref<T> fixed(@NotNull Class<T> arrayType, int length) {
    requireFixedArray(arrayType, length);
    return new Ref<>(arrayType, length, null);
  }

  /// A ref to an existing array written as a fixed-size array of its current length
  public static <T> Ref<T> fixed(@NotNull T array) {
    Objects.requireNonNull(array, "array must not be null");
    final Class<?> arrayType = array.getClass();
    final int length = java.lang.reflect.Array.getLength(array);
    requireFixedArray(arrayType, length);
    return new Ref<>(arrayType, length, array);
  }

  private static void requireFixedArray(Class<?> arrayType, int length) {
    Objects.requireNonNull(arrayType, "arrayType must not be null");
    if (!arrayType.isArray()) {
      throw new IllegalArgumentException("Only arrays can have a fixed length: " + arrayType.getName());
    }
    if (length < 0) {
      throw new IllegalArgumentException("Fixed array length must not be negative: " + length);
    }
  }

  static Class<?> runtimeType(Object value) {
    if (value instanceof Enum<?> e) {
      return e.getDeclaringClass();
    }
    return value.getClass();
  }

  public T get() {
    return value;
  }

  public void set(T value) {
    this.value = value;
  }

  public boolean isEmpty() {
    return value == null;
  }

  public Type type() {
    return type;
  }

  public OptionalInt fixedLength() {
    return fixed == TypeExpr.VARIABLE ? OptionalInt.empty() : OptionalInt.of(fixed);
  }

  int fixed() {
    return fixed;
  }

  @Override
  public String toString() {
    return "Ref<" + type.getTypeName() + (fixed == TypeExpr.VARIABLE ? "" : "[" + fixed + "]") + ">(" + value + ")";
  }
}
