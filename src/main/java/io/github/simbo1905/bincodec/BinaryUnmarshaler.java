// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import java.io.IOException;
import java.nio.channels.ReadableByteChannel;

/// Implemented by a mutable type that reads its own representation. The decoder creates an
/// instance through the accessible no-argument constructor, or reuses the existing instance
/// when decoding in place, and then calls [#unmarshalBinary].
public interface BinaryUnmarshaler {

  /// Read this value from the source.
  /// @param source the session source; [Wire#readFully] gives the same retry loop the codec uses
  /// @return the number of bytes consumed. Informational unless the session is strict.
  int unmarshalBinary(ReadableByteChannel source) throws IOException;
}
