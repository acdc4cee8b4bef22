// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import java.lang.invoke.MethodHandle;
import java.util.Map;
import java.util.Objects;

/// One record component as the codec sees it. The index is the declaration position which is
/// also the position on the wire.
record FieldDescriptor(String name,
                       int index,
                       Map<String, String> tags,
                       TypeExpr type,
                       Class<?> javaType,
                       MethodHandle accessor) {

  FieldDescriptor {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(tags, "tags must not be null");
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(javaType, "javaType must not be null");
    Objects.requireNonNull(accessor, "accessor must not be null");
  }
}
