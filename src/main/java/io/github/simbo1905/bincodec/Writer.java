// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import java.io.IOException;

/// A step in a writer chain. Chains are built once per type and shared by every session,
/// so all session state comes from the encoder.
@FunctionalInterface
interface Writer {

  /// Write a non-null value to the encoder's sink
  void write(Encoder encoder, Object value) throws IOException;
}
