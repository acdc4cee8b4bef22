// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

import java.io.EOFException;

/// The source ran dry before a read was satisfied. Only raised when [CodecConfig#strict()]
/// is set; otherwise the missing bytes read as zero.
public final class TruncatedInputException extends EOFException {
  private final int requested;
  private final int available;

  public TruncatedInputException(int requested, int available) {
    super("needed " + requested + " bytes but the source ended after " + available);
    this.requested = requested;
    this.available = available;
  }

  public int requested() {
    return requested;
  }

  public int available() {
    return available;
  }
}
