// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static io.github.simbo1905.bincodec.Binary.LOGGER;

/// Custom handlers plus the caches of everything derived from static types: type expressions,
/// writer and reader chains and record layouts. Everything cached is immutable so one registry may
/// be shared between threads while each session stays on its own thread.
public final class CodecRegistry {

  /// The registry without custom handlers used by [CodecConfig#DEFAULT]
  public static final CodecRegistry BUILT_IN = new CodecRegistry(Map.of());

  private record TypeKey(Type type, int fixedLength, boolean hooks) {
  }

  private final Map<Class<?>, CodecHandler<?>> handlers;
  private final Map<TypeKey, TypeExpr> analysed = new ConcurrentHashMap<>();
  private final Map<TypeExpr, Writer> writers = new ConcurrentHashMap<>();
  private final Map<TypeExpr, Reader> readers = new ConcurrentHashMap<>();
  private final Map<Class<?>, RecordLayout> layouts = new ConcurrentHashMap<>();
  private final Map<TypeExpr, Boolean> prepared = new ConcurrentHashMap<>();

  private CodecRegistry(Map<Class<?>, CodecHandler<?>> handlers) {
    this.handlers = handlers;
  }

  /// Create a registry with the given handlers.
  /// @throws IllegalArgumentException if two handlers are for the same type
  public static CodecRegistry of(@NotNull CodecHandler<?>... handlers) {
    Objects.requireNonNull(handlers, "handlers must not be null");
    final Map<Class<?>, CodecHandler<?>> byType = new LinkedHashMap<>();
    Arrays.stream(handlers).forEach(handler -> {
      Objects.requireNonNull(handler, "handler must not be null");
      if (byType.putIfAbsent(handler.type(), handler) != null) {
        throw new IllegalArgumentException("Duplicate handler for " + handler.type().getName());
      }
    });
    LOGGER.fine(() -> "Created registry with handlers for " + byType.keySet());
    return new CodecRegistry(Collections.unmodifiableMap(byType));
  }

  /// The handler for exactly this type, else the first registered handler for a supertype
  Optional<CodecHandler<?>> handlerFor(Class<?> type) {
    final CodecHandler<?> exact = handlers.get(type);
    if (exact != null) {
      return Optional.of(exact);
    }
    return handlers.values().stream()
        .filter(handler -> handler.type().isAssignableFrom(type))
        .findFirst();
  }

  TypeExpr analyze(Type type, int fixedLength) {
    return analyze(type, fixedLength, true);
  }

  TypeExpr analyze(Type type, int fixedLength, boolean hooks) {
    final var key = new TypeKey(type, fixedLength, hooks);
    final TypeExpr cached = analysed.get(key);
    if (cached != null) {
      return cached;
    }
    final TypeExpr fresh = TypeExpr.analyzeType(type, fixedLength, this, hooks);
    LOGGER.finer(() -> "Analyzed " + type.getTypeName() + " as " + fresh.toTreeString());
    final TypeExpr raced = analysed.putIfAbsent(key, fresh);
    return raced != null ? raced : fresh;
  }

  /// Resolve the layout of every record reachable from the type so that a forbidden or unsupported
  /// component anywhere fails before the first byte moves
  TypeExpr prepare(Type type, int fixedLength) {
    final TypeExpr typeExpr = analyze(type, fixedLength);
    if (prepared.containsKey(typeExpr)) {
      return typeExpr;
    }
    visit(typeExpr, new HashSet<>());
    prepared.put(typeExpr, Boolean.TRUE);
    return typeExpr;
  }

  private void visit(TypeExpr typeExpr, Set<Class<?>> seen) {
    if (typeExpr instanceof TypeExpr.ArrayNode array) {
      visit(array.element(), seen);
    } else if (typeExpr instanceof TypeExpr.CollectionNode collection) {
      visit(collection.element(), seen);
    } else if (typeExpr instanceof TypeExpr.MapNode map) {
      visit(map.key(), seen);
      visit(map.value(), seen);
    } else if (typeExpr instanceof TypeExpr.OptionalNode optional) {
      visit(optional.wrapped(), seen);
    } else if (typeExpr instanceof TypeExpr.RecordNode record && seen.add(record.recordType())) {
      Arrays.stream(layout(record.recordType()).fields()).forEach(field -> visit(field.type(), seen));
    }
  }

  Writer writerFor(TypeExpr typeExpr) {
    final Writer cached = writers.get(typeExpr);
    if (cached != null) {
      return cached;
    }
    // chains for records resolve their layouts lazily so building never recurses into this map
    final Writer fresh = Companion.buildWriter(typeExpr, this);
    final Writer raced = writers.putIfAbsent(typeExpr, fresh);
    return raced != null ? raced : fresh;
  }

  Reader readerFor(TypeExpr typeExpr) {
    final Reader cached = readers.get(typeExpr);
    if (cached != null) {
      return cached;
    }
    final Reader fresh = Companion.buildReader(typeExpr, this);
    final Reader raced = readers.putIfAbsent(typeExpr, fresh);
    return raced != null ? raced : fresh;
  }

  RecordLayout layout(Class<?> recordType) {
    final RecordLayout cached = layouts.get(recordType);
    if (cached != null) {
      return cached;
    }
    final RecordLayout fresh = RecordLayout.of(recordType, this);
    final RecordLayout raced = layouts.putIfAbsent(recordType, fresh);
    return raced != null ? raced : fresh;
  }

  @Override
  public String toString() {
    return "CodecRegistry" + handlers.keySet();
  }
}
