// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import java.io.IOException;
import java.nio.channels.WritableByteChannel;

/// Implemented by a type that writes its own representation. When the static type of a value
/// implements this it is used for encoding ahead of every built-in rule.
public interface BinaryMarshaler {

  /// Write this value to the sink.
  /// @param sink the session sink; [Wire#writeFully] gives the same short write checks the codec uses
  /// @return the number of bytes written. Informational unless the session is strict.
  int marshalBinary(WritableByteChannel sink) throws IOException;
}
