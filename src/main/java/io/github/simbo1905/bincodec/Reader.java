// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import java.io.IOException;

/// A step in a reader chain, the mirror of [Writer].
@FunctionalInterface
interface Reader {

  /// Read a value from the decoder's source.
  /// @param existing the value currently held by the slot being decoded into, or null. Records use it
  ///                 to keep the components that are not on the wire.
  Object read(Decoder decoder, Object existing) throws IOException;
}
