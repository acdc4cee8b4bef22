// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import static io.github.simbo1905.bincodec.Binary.LOGGER;

/// This is the static helpers of the codec
sealed interface Companion permits Companion.Nothing {

  record Nothing() implements Companion {
  }

  /// Presence markers, only written when the session enables them
  byte ABSENT = 0;
  byte PRESENT = 1;

  /// Order of map entries when sorted maps are on
  Comparator<byte[]> UNSIGNED_BYTES = Arrays::compareUnsigned;

  /// Containers are presized up to this many elements then grow as needed
  int MAX_INITIAL_CAPACITY = 1024;

  /// Build the writer chain for a non-null value of the given type
  static @NotNull Writer buildWriter(TypeExpr typeExpr, CodecRegistry registry) {
    LOGGER.finer(() -> "Building writer for " + typeExpr.toTreeString());
    if (typeExpr instanceof TypeExpr.ScalarNode scalar) {
      final TypeExpr.ScalarType scalarType = scalar.scalar();
      return (encoder, value) -> encoder.writeScalar(scalarType, value);
    }
    if (typeExpr instanceof TypeExpr.StringNode) {
      return (encoder, value) -> {
        // a lone surrogate has no UTF-8 form and is written as '?'
        final byte[] bytes = ((String) value).getBytes(StandardCharsets.UTF_8);
        encoder.writeLength(bytes.length);
        encoder.writeRaw(bytes);
      };
    }
    if (typeExpr instanceof TypeExpr.EnumNode) {
      return (encoder, value) -> encoder.writeScalar(TypeExpr.ScalarType.INT32, ((Enum<?>) value).ordinal());
    }
    if (typeExpr instanceof TypeExpr.ArrayNode array) {
      return buildArrayWriter(array, registry);
    }
    if (typeExpr instanceof TypeExpr.CollectionNode collection) {
      final Writer elementWriter = slotWriter(collection.element(), registry);
      return (encoder, value) -> {
        final Collection<?> items = (Collection<?>) value;
        encoder.writeLength(items.size());
        for (Object item : items) {
          elementWriter.write(encoder, item);
        }
      };
    }
    if (typeExpr instanceof TypeExpr.MapNode map) {
      return buildMapWriter(map, registry);
    }
    if (typeExpr instanceof TypeExpr.OptionalNode optional) {
      final Writer wrappedWriter = registry.writerFor(optional.wrapped());
      return (encoder, value) -> wrappedWriter.write(encoder, ((Optional<?>) value).orElseThrow());
    }
    if (typeExpr instanceof TypeExpr.RecordNode record) {
      // resolved on first use so that records may refer to themselves
      final Class<?> recordType = record.recordType();
      return (encoder, value) -> registry.layout(recordType).write(encoder, value);
    }
    if (typeExpr instanceof TypeExpr.CustomNode custom) {
      return buildCustomWriter(custom, registry);
    }
    throw new AssertionError("Unexpected type expression: " + typeExpr);
  }

  /// Build the reader chain for the given type
  static @NotNull Reader buildReader(TypeExpr typeExpr, CodecRegistry registry) {
    LOGGER.finer(() -> "Building reader for " + typeExpr.toTreeString());
    if (typeExpr instanceof TypeExpr.ScalarNode scalar) {
      final TypeExpr.ScalarType scalarType = scalar.scalar();
      return (decoder, existing) -> decoder.readScalar(scalarType);
    }
    if (typeExpr instanceof TypeExpr.StringNode) {
      return (decoder, existing) -> {
        final int length = decoder.readLength();
        return new String(decoder.readBytes(length), StandardCharsets.UTF_8);
      };
    }
    if (typeExpr instanceof TypeExpr.EnumNode enumNode) {
      final Object[] constants = enumNode.enumType().getEnumConstants();
      return (decoder, existing) -> {
        final int ordinal = (Integer) decoder.readScalar(TypeExpr.ScalarType.INT32);
        if (ordinal < 0 || ordinal >= constants.length) {
          throw new IllegalStateException("Invalid ordinal " + ordinal + " for enum " +
              enumNode.enumType().getSimpleName() + " with " + constants.length + " constants");
        }
        return constants[ordinal];
      };
    }
    if (typeExpr instanceof TypeExpr.ArrayNode array) {
      return buildArrayReader(array, registry);
    }
    if (typeExpr instanceof TypeExpr.CollectionNode collection) {
      final Reader elementReader = slotReader(collection.element(), registry);
      final Class<?> rawType = collection.rawType();
      return (decoder, existing) -> {
        final int size = decoder.readLength();
        final Collection<Object> items = newCollection(rawType, size);
        for (int i = 0; i < size; i++) {
          items.add(elementReader.read(decoder, null));
        }
        return items;
      };
    }
    if (typeExpr instanceof TypeExpr.MapNode map) {
      final Reader keyReader = slotReader(map.key(), registry);
      final Reader valueReader = slotReader(map.value(), registry);
      final Class<?> rawType = map.rawType();
      return (decoder, existing) -> {
        final int size = decoder.readLength();
        final Map<Object, Object> entries = newMap(rawType, size);
        for (int i = 0; i < size; i++) {
          final Object key = keyReader.read(decoder, null);
          entries.put(key, valueReader.read(decoder, null));
        }
        return entries;
      };
    }
    if (typeExpr instanceof TypeExpr.OptionalNode optional) {
      final Reader wrappedReader = registry.readerFor(optional.wrapped());
      // an optional slot is always materialised
      return (decoder, existing) -> {
        final Object current = existing instanceof Optional<?> o ? o.orElse(null) : null;
        return Optional.of(wrappedReader.read(decoder, current));
      };
    }
    if (typeExpr instanceof TypeExpr.RecordNode record) {
      final Class<?> recordType = record.recordType();
      return (decoder, existing) -> registry.layout(recordType).read(decoder, existing);
    }
    if (typeExpr instanceof TypeExpr.CustomNode custom) {
      return buildCustomReader(custom, registry);
    }
    throw new AssertionError("Unexpected type expression: " + typeExpr);
  }

  /// Wrap the writer for a slot inside a composite: record component, element, key or value.
  /// An absent value writes nothing, or a single [#ABSENT] byte when presence markers are on.
  static Writer slotWriter(TypeExpr typeExpr, CodecRegistry registry) {
    final Writer delegate = registry.writerFor(typeExpr);
    if (!typeExpr.nilable()) {
      return delegate;
    }
    return (encoder, value) -> {
      final boolean markers = encoder.config().presenceMarkers();
      if (isAbsent(value)) {
        LOGGER.finer(() -> "Absent " + typeExpr.toTreeString() + " at position " + encoder.bytesWritten());
        if (markers) {
          encoder.writeByte(ABSENT);
        }
        return;
      }
      if (markers) {
        encoder.writeByte(PRESENT);
      }
      delegate.write(encoder, value);
    };
  }

  /// Mirror of [#slotWriter]. Without presence markers the slot is always decoded.
  static Reader slotReader(TypeExpr typeExpr, CodecRegistry registry) {
    final Reader delegate = registry.readerFor(typeExpr);
    if (!typeExpr.nilable()) {
      return delegate;
    }
    final Object absent = typeExpr instanceof TypeExpr.OptionalNode ? Optional.empty() : null;
    return (decoder, existing) -> {
      if (decoder.config().presenceMarkers()) {
        final byte marker = decoder.readByte();
        if (marker == ABSENT) {
          return absent;
        }
        if (marker != PRESENT) {
          throw new IllegalStateException("Invalid presence marker " + marker + " for " + typeExpr.toTreeString());
        }
      }
      return delegate.read(decoder, existing);
    };
  }

  static boolean isAbsent(Object value) {
    return value == null || (value instanceof Optional<?> optional && optional.isEmpty());
  }

  static @NotNull Writer buildArrayWriter(TypeExpr.ArrayNode array, CodecRegistry registry) {
    final int fixedLength = array.fixedLength();
    final Class<?> componentType = array.componentType();
    final Writer lengthWriter = (encoder, value) -> {
      final int length = Array.getLength(value);
      if (array.fixed()) {
        if (length != fixedLength) {
          throw new IllegalArgumentException("Fixed size array of " + componentType.getSimpleName() +
              " must have " + fixedLength + " elements but has " + length);
        }
      } else {
        encoder.writeLength(length);
      }
    };
    if (componentType == byte.class) {
      return (encoder, value) -> {
        lengthWriter.write(encoder, value);
        encoder.writeRaw((byte[]) value);
      };
    }
    if (componentType.isPrimitive()) {
      // one buffer for the whole array
      final TypeExpr.ScalarType scalarType = ((TypeExpr.ScalarNode) array.element()).scalar();
      return (encoder, value) -> {
        lengthWriter.write(encoder, value);
        final int length = Array.getLength(value);
        final ByteBuffer buffer = encoder.allocate(byteCount(length, scalarType));
        for (int i = 0; i < length; i++) {
          scalarType.put(buffer, Array.get(value, i));
        }
        encoder.writeBuffer(buffer.flip());
      };
    }
    final Writer elementWriter = slotWriter(array.element(), registry);
    return (encoder, value) -> {
      lengthWriter.write(encoder, value);
      final Object[] elements = (Object[]) value;
      for (Object element : elements) {
        elementWriter.write(encoder, element);
      }
    };
  }

  static @NotNull Reader buildArrayReader(TypeExpr.ArrayNode array, CodecRegistry registry) {
    final Class<?> componentType = array.componentType();
    final boolean fixed = array.fixed();
    final int fixedLength = array.fixedLength();
    if (componentType == byte.class) {
      return (decoder, existing) -> decoder.readBytes(fixed ? fixedLength : decoder.readLength());
    }
    if (componentType.isPrimitive()) {
      final TypeExpr.ScalarType scalarType = ((TypeExpr.ScalarNode) array.element()).scalar();
      return (decoder, existing) -> {
        final int length = fixed ? fixedLength : decoder.readLength();
        final ByteBuffer buffer = decoder.readBuffer(byteCount(length, scalarType));
        final Object result = Array.newInstance(componentType, length);
        for (int i = 0; i < length; i++) {
          Array.set(result, i, scalarType.get(buffer));
        }
        return result;
      };
    }
    final Reader elementReader = slotReader(array.element(), registry);
    return (decoder, existing) -> {
      final int length = fixed ? fixedLength : decoder.readLength();
      final Object[] current = existing instanceof Object[] objects ? objects : new Object[0];
      // grown as elements arrive as the length prefix is not trusted until then
      final List<Object> elements = new ArrayList<>(initialCapacity(length));
      for (int i = 0; i < length; i++) {
        final int index = i;
        LOGGER.finer(() -> "Reading array element " + index + " at position " + decoder.bytesRead());
        elements.add(elementReader.read(decoder, i < current.length ? current[i] : null));
      }
      return elements.toArray((Object[]) Array.newInstance(componentType, length));
    };
  }

  /// Initial capacity for a container whose decoded length has not been backed by data yet
  static int initialCapacity(int length) {
    return Math.min(length, MAX_INITIAL_CAPACITY);
  }

  private static int byteCount(int length, TypeExpr.ScalarType scalarType) {
    final long bytes = (long) length * scalarType.width();
    if (bytes > Decoder.MAX_LENGTH) {
      throw new IllegalStateException("Array of " + length + " " + scalarType + " values is too large");
    }
    return (int) bytes;
  }

  static @NotNull Writer buildMapWriter(TypeExpr.MapNode map, CodecRegistry registry) {
    final Writer keyWriter = slotWriter(map.key(), registry);
    final Writer valueWriter = slotWriter(map.value(), registry);
    return (encoder, value) -> {
      final Map<?, ?> entries = (Map<?, ?>) value;
      encoder.writeLength(entries.size());
      if (!encoder.config().sortedMaps()) {
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
          keyWriter.write(encoder, entry.getKey());
          valueWriter.write(encoder, entry.getValue());
        }
        return;
      }
      final List<EncodedEntry> sorted = new ArrayList<>(entries.size());
      for (Map.Entry<?, ?> entry : entries.entrySet()) {
        sorted.add(new EncodedEntry(encoder.detached(keyWriter, entry.getKey()), entry.getValue()));
      }
      sorted.sort(Comparator.comparing(EncodedEntry::key, UNSIGNED_BYTES));
      for (EncodedEntry entry : sorted) {
        encoder.writeRaw(entry.key());
        valueWriter.write(encoder, entry.value());
      }
    };
  }

  /// A map entry whose key has already been encoded
  record EncodedEntry(byte[] key, Object value) {
  }

  static @NotNull Writer buildCustomWriter(TypeExpr.CustomNode custom, CodecRegistry registry) {
    if (custom.handler() != null) {
      @SuppressWarnings("unchecked") final var hook = (CodecHandler.HookWriter<Object>) custom.handler().writer();
      return (encoder, value) -> encoder.writeHook(hook, value);
    }
    if (custom.marshaler()) {
      return (encoder, value) -> encoder.writeHook((sink, self) -> ((BinaryMarshaler) self).marshalBinary(sink), value);
    }
    // only the decode side is custom; resolved lazily as the built-in layout may not exist
    final Class<?> javaType = custom.javaType();
    return (encoder, value) -> registry.writerFor(registry.analyze(javaType, TypeExpr.VARIABLE, false))
        .write(encoder, value);
  }

  static @NotNull Reader buildCustomReader(TypeExpr.CustomNode custom, CodecRegistry registry) {
    if (custom.handler() != null) {
      final CodecHandler.HookReader<?> hook = custom.handler().reader();
      return (decoder, existing) -> decoder.readHandler(hook);
    }
    final Class<?> javaType = custom.javaType();
    if (custom.unmarshaler()) {
      return (decoder, existing) -> {
        final BinaryUnmarshaler target = existing instanceof BinaryUnmarshaler current && javaType.isInstance(current)
            ? current
            : (BinaryUnmarshaler) newInstance(javaType);
        decoder.unmarshalInto(target);
        return target;
      };
    }
    return (decoder, existing) -> registry.readerFor(registry.analyze(javaType, TypeExpr.VARIABLE, false))
        .read(decoder, existing);
  }

  /// Fresh container for a decoded collection of the given static raw type
  @SuppressWarnings("unchecked")
  static Collection<Object> newCollection(Class<?> rawType, int size) {
    if (rawType == Collection.class || rawType == List.class) {
      return new ArrayList<>(initialCapacity(size));
    }
    if (rawType == Set.class) {
      return new LinkedHashSet<>(Math.max(16, (int) (initialCapacity(size) / .75f) + 1));
    }
    if (rawType == SortedSet.class || rawType == NavigableSet.class) {
      return new TreeSet<>();
    }
    return (Collection<Object>) newInstance(rawType);
  }

  @SuppressWarnings("unchecked")
  static Map<Object, Object> newMap(Class<?> rawType, int size) {
    if (rawType == Map.class) {
      return new LinkedHashMap<>(Math.max(16, (int) (initialCapacity(size) / .75f) + 1));
    }
    if (rawType == SortedMap.class || rawType == NavigableMap.class) {
      return new TreeMap<>();
    }
    return (Map<Object, Object>) newInstance(rawType);
  }

  /// Instantiate through the no-argument constructor
  /// @throws IllegalArgumentException if there is no usable no-argument constructor
  static Object newInstance(Class<?> type) {
    final Constructor<?> constructor;
    try {
      constructor = type.getDeclaredConstructor();
    } catch (NoSuchMethodException e) {
      throw new IllegalArgumentException(type.getName() + " must have a no-argument constructor to be decoded", e);
    }
    if (!constructor.trySetAccessible()) {
      throw new IllegalArgumentException("The no-argument constructor of " + type.getName() + " is not accessible");
    }
    try {
      return constructor.newInstance();
    } catch (InvocationTargetException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Failed to create " + type.getName(), e.getCause());
    } catch (ReflectiveOperationException e) {
      throw new IllegalArgumentException("Failed to create " + type.getName(), e);
    }
  }

  /// The value an excluded component takes when there is no existing record to copy it from
  static Object defaultValue(Class<?> type) {
    if (!type.isPrimitive()) {
      return null;
    }
    if (type == boolean.class) {
      return false;
    }
    if (type == byte.class) {
      return (byte) 0;
    }
    if (type == short.class) {
      return (short) 0;
    }
    if (type == char.class) {
      return (char) 0;
    }
    if (type == int.class) {
      return 0;
    }
    if (type == long.class) {
      return 0L;
    }
    if (type == float.class) {
      return 0f;
    }
    if (type == double.class) {
      return 0d;
    }
    throw new IllegalArgumentException("No default value for " + type);
  }
}
