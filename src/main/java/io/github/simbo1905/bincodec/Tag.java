// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Tags a record component for a tag name. Tags only gate whether a component is written
/// and read when a session runs in only-tagged mode; they never reach the wire.
///
/// ```java
/// record Account(@Tag(key = "api", value = "id") long id,
///                @Tag(key = "api", value = "-") String secret) {}
/// ```
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
@Repeatable(Tag.Tags.class)
public @interface Tag {

  /// The tag name this value is looked up under
  String key() default Binary.DEFAULT_TAG;

  /// The tag value. [Binary#EXCLUDE] excludes the component in only-tagged mode.
  String value();

  @Retention(RetentionPolicy.RUNTIME)
  @Target(ElementType.RECORD_COMPONENT)
  @interface Tags {
    Tag[] value();
  }
}
