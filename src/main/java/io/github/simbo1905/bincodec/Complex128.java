// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

/// A complex number made of two binary64 floats, written as real then imaginary.
public record Complex128(double real, double imag) {

  public static Complex128 of(double real) {
    return new Complex128(real, 0.0);
  }

  @Override
  public String toString() {
    return "(" + real + (imag < 0 ? "" : "+") + imag + "i)";
  }
}
