// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import java.io.IOException;

/// The sink accepted fewer bytes than were requested. The sink holds whatever prefix was
/// written up to that point.
public final class ShortWriteException extends IOException {
  private final int requested;
  private final int written;

  public ShortWriteException(int requested, int written) {
    super("only " + written + " bytes of " + requested + " written");
    this.requested = requested;
    this.written = written;
  }

  public int requested() {
    return requested;
  }

  public int written() {
    return written;
  }
}
