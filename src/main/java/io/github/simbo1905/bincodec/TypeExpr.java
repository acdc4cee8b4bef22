// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;

/// Type expression tree describing how a static Java type is laid out on the wire.
/// Nodes are immutable and derived only from type metadata so they are cached per type.
sealed interface TypeExpr permits
    TypeExpr.ScalarNode, TypeExpr.StringNode, TypeExpr.EnumNode, TypeExpr.ArrayNode,
    TypeExpr.CollectionNode, TypeExpr.MapNode, TypeExpr.OptionalNode, TypeExpr.RecordNode,
    TypeExpr.CustomNode {

  /// Fixed length value meaning "variable size sequence, write a length prefix"
  int VARIABLE = -1;

  /// Collection interfaces we know how to materialise on decode
  List<Class<?>> COLLECTION_INTERFACES = List.of(
      Collection.class, List.class, Set.class, SortedSet.class, NavigableSet.class);

  List<Class<?>> MAP_INTERFACES = List.of(Map.class, SortedMap.class, NavigableMap.class);

  /// Recursive descent classifier for Java types.
  /// @param fixedLength [#VARIABLE] or the exact element count of a fixed-size array
  /// @param hooks       when false, hooks the type implements itself are ignored. Used to find the
  ///                    built-in layout for the direction a type does not supply a hook for.
  /// @throws UnsupportedKindException if the type or anything nested in it is a [ForbiddenKind]
  /// @throws IllegalArgumentException if the type is a concrete class the codec cannot represent
  static TypeExpr analyzeType(Type type, int fixedLength, CodecRegistry registry, boolean hooks) {
    Objects.requireNonNull(type, "type must not be null");
    if (type instanceof Class<?> clazz) {
      return analyzeClass(clazz, fixedLength, registry, hooks);
    }
    if (type instanceof ParameterizedType parameterized) {
      return analyzeParameterized(parameterized, fixedLength, registry);
    }
    if (type instanceof GenericArrayType genericArray) {
      final Type component = genericArray.getGenericComponentType();
      final TypeExpr element = analyzeType(component, VARIABLE, registry, true);
      return new ArrayNode(element, rawClass(component), fixedLength);
    }
    if (type instanceof TypeVariable<?> || type instanceof WildcardType) {
      throw new UnsupportedKindException(ForbiddenKind.DYNAMIC, type);
    }
    throw new IllegalArgumentException("Unsupported type: " + type + " of class " + type.getClass());
  }

  private static @NotNull TypeExpr analyzeClass(Class<?> clazz, int fixedLength, CodecRegistry registry, boolean hooks) {
    final var forbidden = ForbiddenKind.concrete(clazz);
    if (forbidden.isPresent()) {
      throw new UnsupportedKindException(forbidden.get(), clazz);
    }
    final var handler = registry.handlerFor(clazz);
    if (handler.isPresent()) {
      requireVariable(clazz, fixedLength);
      return new CustomNode(clazz, handler.get(), false, false);
    }
    if (ForbiddenKind.isDynamic(clazz) || isContainer(clazz)) {
      // raw containers say nothing about their elements
      throw new UnsupportedKindException(ForbiddenKind.DYNAMIC, clazz);
    }
    if (hooks) {
      final boolean marshals = BinaryMarshaler.class.isAssignableFrom(clazz);
      final boolean unmarshals = BinaryUnmarshaler.class.isAssignableFrom(clazz);
      if (marshals || unmarshals) {
        requireVariable(clazz, fixedLength);
        return new CustomNode(clazz, null, marshals, unmarshals);
      }
    }
    if (clazz.isArray()) {
      final Class<?> componentType = clazz.getComponentType();
      return new ArrayNode(analyzeType(componentType, VARIABLE, registry, true), componentType, fixedLength);
    }
    requireVariable(clazz, fixedLength);
    final var scalar = ScalarType.of(clazz);
    if (scalar.isPresent()) {
      return new ScalarNode(scalar.get(), clazz);
    }
    if (clazz == String.class) {
      return new StringNode();
    }
    if (clazz.isEnum()) {
      return new EnumNode(clazz);
    }
    if (clazz.isRecord()) {
      return new RecordNode(clazz);
    }
    throw new IllegalArgumentException("Unsupported type " + clazz.getName() +
        ": not a scalar, string, enum, record, array, container or hook-bearing type");
  }

  private static @NotNull TypeExpr analyzeParameterized(ParameterizedType type, int fixedLength, CodecRegistry registry) {
    final Class<?> raw = (Class<?>) type.getRawType();
    final var forbidden = ForbiddenKind.concrete(raw);
    if (forbidden.isPresent()) {
      throw new UnsupportedKindException(forbidden.get(), type);
    }
    final var handler = registry.handlerFor(raw);
    if (handler.isPresent()) {
      requireVariable(type, fixedLength);
      return new CustomNode(raw, handler.get(), false, false);
    }
    requireVariable(type, fixedLength);
    final Type[] typeArgs = type.getActualTypeArguments();
    if (Optional.class.equals(raw)) {
      return new OptionalNode(analyzeType(typeArgs[0], VARIABLE, registry, true));
    }
    if (Collection.class.isAssignableFrom(raw)) {
      if (!instantiable(raw, COLLECTION_INTERFACES)) {
        throw new UnsupportedKindException(ForbiddenKind.DYNAMIC, type);
      }
      final Type elementType = typeArgumentOf(type, Collection.class, 0);
      return new CollectionNode(analyzeType(elementType, VARIABLE, registry, true), raw);
    }
    if (Map.class.isAssignableFrom(raw)) {
      if (!instantiable(raw, MAP_INTERFACES)) {
        throw new UnsupportedKindException(ForbiddenKind.DYNAMIC, type);
      }
      // both sides are classified before any entry is touched
      final TypeExpr key = analyzeType(typeArgumentOf(type, Map.class, 0), VARIABLE, registry, true);
      final TypeExpr value = analyzeType(typeArgumentOf(type, Map.class, 1), VARIABLE, registry, true);
      return new MapNode(key, value, raw);
    }
    if (ForbiddenKind.isDynamic(raw)) {
      throw new UnsupportedKindException(ForbiddenKind.DYNAMIC, type);
    }
    if (raw.isRecord()) {
      // generic records have type variable components which the layout rejects
      return new RecordNode(raw);
    }
    throw new IllegalArgumentException("Unsupported generic type: " + type.getTypeName());
  }

  /// Find the actual type argument bound to a container interface parameter. Subclasses such as
  /// `class Names extends ArrayList<String>` are not parameterized so only the direct form is handled.
  private static Type typeArgumentOf(ParameterizedType type, Class<?> container, int index) {
    final Type[] typeArgs = type.getActualTypeArguments();
    final Class<?> raw = (Class<?>) type.getRawType();
    final int expected = container == Map.class ? 2 : 1;
    if (typeArgs.length != expected) {
      throw new IllegalArgumentException(raw.getSimpleName() + " must have exactly " + expected +
          " type argument(s) to be used as a " + container.getSimpleName() + ": " + type.getTypeName());
    }
    return typeArgs[index];
  }

  private static boolean isContainer(Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz) || Map.class.isAssignableFrom(clazz) || Optional.class.equals(clazz);
  }

  private static boolean instantiable(Class<?> raw, List<Class<?>> knownInterfaces) {
    if (knownInterfaces.contains(raw)) {
      return true;
    }
    return !raw.isInterface() && !Modifier.isAbstract(raw.getModifiers());
  }

  private static void requireVariable(Type type, int fixedLength) {
    if (fixedLength != VARIABLE) {
      throw new IllegalArgumentException("A fixed length only applies to arrays but was given for " + type.getTypeName());
    }
  }

  static Class<?> rawClass(Type type) {
    if (type instanceof Class<?> cls) {
      return cls;
    }
    if (type instanceof ParameterizedType pt) {
      return (Class<?>) pt.getRawType();
    }
    if (type instanceof GenericArrayType gat) {
      final Class<?> componentRawClass = rawClass(gat.getGenericComponentType());
      return java.lang.reflect.Array.newInstance(componentRawClass, 0).getClass();
    }
    throw new UnsupportedKindException(ForbiddenKind.DYNAMIC, type);
  }

  /// Helper method to get a string representation for debugging
  /// Example: LIST(String) or MAP(String,short)
  String toTreeString();

  /// Whether a slot of this type can hold `null` (or an empty [Optional])
  boolean nilable();

  /// Leaf node for fixed width values
  record ScalarNode(ScalarType scalar, Class<?> javaType) implements TypeExpr {
    public ScalarNode {
      Objects.requireNonNull(scalar, "Scalar type cannot be null");
      Objects.requireNonNull(javaType, "Java type cannot be null");
    }

    @Override
    public String toTreeString() {
      return javaType.getSimpleName();
    }

    @Override
    public boolean nilable() {
      return !javaType.isPrimitive();
    }
  }

  record StringNode() implements TypeExpr {
    @Override
    public String toTreeString() {
      return "String";
    }

    @Override
    public boolean nilable() {
      return true;
    }
  }

  /// Enums are written as their 32-bit ordinal
  record EnumNode(Class<?> enumType) implements TypeExpr {
    public EnumNode {
      Objects.requireNonNull(enumType, "Enum type cannot be null");
    }

    @Override
    public String toTreeString() {
      return "ENUM(" + enumType.getSimpleName() + ")";
    }

    @Override
    public boolean nilable() {
      return true;
    }
  }

  /// Container node for arrays - has one child (element type)
  record ArrayNode(TypeExpr element, Class<?> componentType, int fixedLength) implements TypeExpr {
    public ArrayNode {
      Objects.requireNonNull(element, "Array element type cannot be null");
      Objects.requireNonNull(componentType, "Array component type cannot be null");
      if (fixedLength < VARIABLE) {
        throw new IllegalArgumentException("Fixed array length must not be negative: " + fixedLength);
      }
    }

    boolean fixed() {
      return fixedLength != VARIABLE;
    }

    @Override
    public String toTreeString() {
      return (fixed() ? "ARRAY[" + fixedLength + "](" : "ARRAY(") + element.toTreeString() + ")";
    }

    @Override
    public boolean nilable() {
      return true;
    }
  }

  /// Container node for lists and sets - has one child (element type)
  record CollectionNode(TypeExpr element, Class<?> rawType) implements TypeExpr {
    public CollectionNode {
      Objects.requireNonNull(element, "Collection element type cannot be null");
      Objects.requireNonNull(rawType, "Collection type cannot be null");
    }

    @Override
    public String toTreeString() {
      return (List.class.isAssignableFrom(rawType) ? "LIST(" : "COLLECTION(") + element.toTreeString() + ")";
    }

    @Override
    public boolean nilable() {
      return true;
    }
  }

  /// Container node for maps - has two children (key type, value type)
  record MapNode(TypeExpr key, TypeExpr value, Class<?> rawType) implements TypeExpr {
    public MapNode {
      Objects.requireNonNull(key, "Map key type cannot be null");
      Objects.requireNonNull(value, "Map value type cannot be null");
      Objects.requireNonNull(rawType, "Map type cannot be null");
    }

    @Override
    public String toTreeString() {
      return "MAP(" + key.toTreeString() + "," + value.toTreeString() + ")";
    }

    @Override
    public boolean nilable() {
      return true;
    }
  }

  /// Container node for optionals - has one child (wrapped type)
  record OptionalNode(TypeExpr wrapped) implements TypeExpr {
    public OptionalNode {
      Objects.requireNonNull(wrapped, "Optional wrapped type cannot be null");
    }

    @Override
    public String toTreeString() {
      return "OPTIONAL(" + wrapped.toTreeString() + ")";
    }

    @Override
    public boolean nilable() {
      return true;
    }
  }

  /// Records are resolved to their [RecordLayout] lazily so that recursive records terminate
  record RecordNode(Class<?> recordType) implements TypeExpr {
    public RecordNode {
      Objects.requireNonNull(recordType, "Record type cannot be null");
    }

    @Override
    public String toTreeString() {
      return recordType.getSimpleName();
    }

    @Override
    public boolean nilable() {
      return true;
    }
  }

  /// A type with a registered [CodecHandler] or implementing one or both hook interfaces
  record CustomNode(Class<?> javaType, CodecHandler<?> handler, boolean marshaler, boolean unmarshaler)
      implements TypeExpr {
    public CustomNode {
      Objects.requireNonNull(javaType, "Java type cannot be null");
      if (handler == null && !marshaler && !unmarshaler) {
        throw new IllegalArgumentException("A custom node needs a handler or a hook: " + javaType);
      }
    }

    @Override
    public String toTreeString() {
      return "CUSTOM(" + javaType.getSimpleName() + ")";
    }

    @Override
    public boolean nilable() {
      return true;
    }
  }

  /// The fixed width wire representations. Multi-byte values follow the buffer's byte order.
  enum ScalarType {
    INT8(Byte.BYTES),
    INT16(Short.BYTES),
    UINT16(Character.BYTES),
    INT32(Integer.BYTES),
    INT64(Long.BYTES),
    FLOAT32(Float.BYTES),
    FLOAT64(Double.BYTES),
    COMPLEX64(2 * Float.BYTES),
    COMPLEX128(2 * Double.BYTES),
    BOOLEAN(1);

    private final int width;

    ScalarType(int width) {
      this.width = width;
    }

    int width() {
      return width;
    }

    static Optional<ScalarType> of(Class<?> clazz) {
      if (clazz == byte.class || clazz == Byte.class) {
        return Optional.of(INT8);
      }
      if (clazz == short.class || clazz == Short.class) {
        return Optional.of(INT16);
      }
      if (clazz == char.class || clazz == Character.class) {
        return Optional.of(UINT16);
      }
      if (clazz == int.class || clazz == Integer.class) {
        return Optional.of(INT32);
      }
      if (clazz == long.class || clazz == Long.class) {
        return Optional.of(INT64);
      }
      if (clazz == float.class || clazz == Float.class) {
        return Optional.of(FLOAT32);
      }
      if (clazz == double.class || clazz == Double.class) {
        return Optional.of(FLOAT64);
      }
      if (clazz == boolean.class || clazz == Boolean.class) {
        return Optional.of(BOOLEAN);
      }
      if (clazz == Complex64.class) {
        return Optional.of(COMPLEX64);
      }
      if (clazz == Complex128.class) {
        return Optional.of(COMPLEX128);
      }
      return Optional.empty();
    }

    void put(ByteBuffer buffer, Object value) {
      switch (this) {
        case INT8 -> buffer.put((Byte) value);
        case INT16 -> buffer.putShort((Short) value);
        case UINT16 -> buffer.putChar((Character) value);
        case INT32 -> buffer.putInt((Integer) value);
        case INT64 -> buffer.putLong((Long) value);
        case FLOAT32 -> buffer.putFloat((Float) value);
        case FLOAT64 -> buffer.putDouble((Double) value);
        case COMPLEX64 -> {
          final Complex64 complex = (Complex64) value;
          buffer.putFloat(complex.real());
          buffer.putFloat(complex.imag());
        }
        case COMPLEX128 -> {
          final Complex128 complex = (Complex128) value;
          buffer.putDouble(complex.real());
          buffer.putDouble(complex.imag());
        }
        case BOOLEAN -> buffer.put((byte) ((Boolean) value ? 1 : 0));
      }
    }

    Object get(ByteBuffer buffer) {
      return switch (this) {
        case INT8 -> buffer.get();
        case INT16 -> buffer.getShort();
        case UINT16 -> buffer.getChar();
        case INT32 -> buffer.getInt();
        case INT64 -> buffer.getLong();
        case FLOAT32 -> buffer.getFloat();
        case FLOAT64 -> buffer.getDouble();
        case COMPLEX64 -> new Complex64(buffer.getFloat(), buffer.getFloat());
        case COMPLEX128 -> new Complex128(buffer.getDouble(), buffer.getDouble());
        case BOOLEAN -> buffer.get() != 0;
      };
    }
  }
}
