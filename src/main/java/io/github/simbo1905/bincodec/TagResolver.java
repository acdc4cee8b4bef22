// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Decides which record components take part in a session. Used identically by both directions.
final class TagResolver {

  private TagResolver() {
  }

  /// The tag values of a component keyed by tag name
  /// @throws IllegalArgumentException if a tag name is given twice
  static Map<String, String> tagsOf(RecordComponent component) {
    final Map<String, String> tags = new LinkedHashMap<>();
    Arrays.stream(component.getAnnotationsByType(Tag.class)).forEach(tag -> {
      if (tags.putIfAbsent(tag.key(), tag.value()) != null) {
        throw new IllegalArgumentException("Duplicate tag '" + tag.key() + "' on component " +
            component.getDeclaringRecord().getSimpleName() + "." + component.getName());
      }
    });
    return Collections.unmodifiableMap(tags);
  }

  static Optional<String> resolve(FieldDescriptor field, String tag) {
    return Optional.ofNullable(field.tags().get(tag));
  }

  /// Every component is included unless only tagged components are wanted. Then a component needs a
  /// non-empty tag value under the session tag that is not [Binary#EXCLUDE].
  static boolean included(FieldDescriptor field, CodecConfig config) {
    if (!config.onlyTagged()) {
      return true;
    }
    return resolve(field, config.tag())
        .filter(value -> !value.isEmpty())
        .filter(value -> !Binary.EXCLUDE.equals(value))
        .isPresent();
  }
}
