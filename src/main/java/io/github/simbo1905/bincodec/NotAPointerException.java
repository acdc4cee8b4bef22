// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

/// Thrown when a decode target is not something the decoder can store into.
/// Legal targets are a [Ref], an instance implementing [BinaryUnmarshaler], or `null`.
public final class NotAPointerException extends IllegalArgumentException {
  public NotAPointerException(Object target) {
    super("can only decode into a Ref or a BinaryUnmarshaler but got " + target.getClass().getName());
  }
}
