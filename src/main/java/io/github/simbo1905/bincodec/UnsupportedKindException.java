// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import java.lang.reflect.Type;
import java.util.Objects;

/// Thrown when a value, or a nested element, key, value or record component, belongs to a
/// [ForbiddenKind]. The whole encode or decode is aborted; nothing is written or consumed
/// for the offending subtree.
public final class UnsupportedKindException extends IllegalArgumentException {
  private final ForbiddenKind kind;
  private final transient Type type;

  public UnsupportedKindException(ForbiddenKind kind, Type type) {
    super("can't handle " + Objects.requireNonNull(kind).description() + ": " + describe(type));
    this.kind = kind;
    this.type = type;
  }

  public ForbiddenKind kind() {
    return kind;
  }

  /// The offending type, or `null` when it was lost to serialization of this exception
  public Type type() {
    return type;
  }

  private static String describe(Type type) {
    return type == null ? "<none>" : type.getTypeName();
  }
}
