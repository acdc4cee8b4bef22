// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import java.io.IOException;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.IntStream;

import static io.github.simbo1905.bincodec.Binary.LOGGER;

/// Method handles and reader/writer chains for one record type. Components are written back to back
/// in declaration order with no count, no names and no markers.
final class RecordLayout {
  final Class<?> recordType;
  final MethodHandle constructor;
  final FieldDescriptor[] fields;
  final Writer[] writers;
  final Reader[] readers;

  private RecordLayout(Class<?> recordType, MethodHandle constructor, FieldDescriptor[] fields,
                       Writer[] writers, Reader[] readers) {
    this.recordType = recordType;
    this.constructor = constructor;
    this.fields = fields;
    this.writers = writers;
    this.readers = readers;
  }

  /// Analyse every component of the record. Component types are classified eagerly so that a
  /// forbidden type anywhere in the record fails here. Nested records are resolved lazily.
  static RecordLayout of(Class<?> recordType, CodecRegistry registry) {
    Objects.requireNonNull(recordType, "recordType must not be null");
    if (!recordType.isRecord()) {
      throw new IllegalArgumentException("Not a record: " + recordType.getName());
    }
    final RecordComponent[] components = recordType.getRecordComponents();
    final MethodHandle constructor = canonicalConstructor(recordType, components);

    final FieldDescriptor[] fields = IntStream.range(0, components.length)
        .mapToObj(i -> describe(components[i], i, registry))
        .toArray(FieldDescriptor[]::new);
    final Writer[] writers = Arrays.stream(fields)
        .map(field -> Companion.slotWriter(field.type(), registry))
        .toArray(Writer[]::new);
    final Reader[] readers = Arrays.stream(fields)
        .map(field -> Companion.slotReader(field.type(), registry))
        .toArray(Reader[]::new);

    LOGGER.fine(() -> "Layout of " + recordType.getSimpleName() + ": " + Arrays.stream(fields)
        .map(field -> field.name() + ":" + field.type().toTreeString())
        .toList());
    return new RecordLayout(recordType, constructor, fields, writers, readers);
  }

  private static FieldDescriptor describe(RecordComponent component, int index, CodecRegistry registry) {
    final Fixed fixed = component.getAnnotation(Fixed.class);
    final int fixedLength = fixed == null ? TypeExpr.VARIABLE : fixed.value();
    if (fixed != null && (!component.getType().isArray() || fixedLength < 0)) {
      throw new IllegalArgumentException("@Fixed needs an array component and a length of at least zero: " +
          component.getDeclaringRecord().getSimpleName() + "." + component.getName());
    }
    final TypeExpr type = registry.analyze(component.getGenericType(), fixedLength);
    final Method accessor = component.getAccessor();
    accessor.trySetAccessible();
    try {
      return new FieldDescriptor(component.getName(), index, TagResolver.tagsOf(component), type,
          component.getType(), MethodHandles.lookup().unreflect(accessor));
    } catch (IllegalAccessException e) {
      throw new IllegalArgumentException("Failed to create accessor for " + component.getName(), e);
    }
  }

  private static MethodHandle canonicalConstructor(Class<?> recordType, RecordComponent[] components) {
    try {
      final Class<?>[] parameterTypes = Arrays.stream(components)
          .map(RecordComponent::getType)
          .toArray(Class<?>[]::new);
      final Constructor<?> constructor = recordType.getDeclaredConstructor(parameterTypes);
      constructor.trySetAccessible();
      return MethodHandles.lookup().unreflectConstructor(constructor);
    } catch (NoSuchMethodException | IllegalAccessException e) {
      throw new IllegalArgumentException("Failed to create constructor handle for " + recordType, e);
    }
  }

  FieldDescriptor[] fields() {
    return fields;
  }

  void write(Encoder encoder, Object record) throws IOException {
    final CodecConfig config = encoder.config();
    for (int i = 0; i < fields.length; i++) {
      final FieldDescriptor field = fields[i];
      if (!TagResolver.included(field, config)) {
        LOGGER.finer(() -> "Skipping " + recordType.getSimpleName() + "." + field.name());
        continue;
      }
      final long position = encoder.bytesWritten();
      LOGGER.finer(() -> "Writing " + recordType.getSimpleName() + "." + field.name() + " at position " + position);
      writers[i].write(encoder, component(field, record));
    }
  }

  /// Read the included components and construct a new record. Components not on the wire come from
  /// `existing` when it is a record of this type, else they take their default value.
  Object read(Decoder decoder, Object existing) throws IOException {
    final CodecConfig config = decoder.config();
    final Object current = recordType.isInstance(existing) ? existing : null;
    final Object[] args = new Object[fields.length];
    for (int i = 0; i < fields.length; i++) {
      final FieldDescriptor field = fields[i];
      final Object currentValue = current == null ? null : component(field, current);
      if (TagResolver.included(field, config)) {
        final long position = decoder.bytesRead();
        LOGGER.finer(() -> "Reading " + recordType.getSimpleName() + "." + field.name() + " at position " + position);
        args[i] = readers[i].read(decoder, currentValue);
      } else {
        args[i] = current == null ? Companion.defaultValue(field.javaType()) : currentValue;
      }
    }
    try {
      return constructor.invokeWithArguments(args);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new IllegalStateException("Failed to construct " + recordType.getSimpleName(), t);
    }
  }

  private static Object component(FieldDescriptor field, Object record) {
    try {
      return field.accessor().invoke(record);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new IllegalStateException("Failed to read component " + field.name(), t);
    }
  }
}
