// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bincodec;

/// A complex number made of two binary32 floats, written as real then imaginary.
public record Complex64(float real, float imag) {

  public static Complex64 of(float real) {
    return new Complex64(real, 0.0f);
  }

  @Override
  public String toString() {
    return "(" + real + (imag < 0 ? "" : "+") + imag + "i)";
  }
}
