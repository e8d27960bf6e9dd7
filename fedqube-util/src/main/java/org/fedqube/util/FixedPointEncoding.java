/**
 * fedqube: Federated Preprocessing Base.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of fedqube.
 *
 * fedqube is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.fedqube.util;

import com.google.common.math.LongMath;

/**
 * Encodes floating point values into the ring of 64 bit integers and back.
 * 
 * <p>
 * A value is multiplied by 10^fractionPrecision and rounded, which keeps fractionPrecision decimal digits after the
 * dot. Sums of encoded values may overflow silently (the arithmetic of long wraps around modulo 2^64), which is exactly
 * what masking schemes rely on: As long as the true sum fits into a long, the wrapped sum of masked values decodes to
 * the correct result.
 *
 * @author Bastian Gloeckle
 */
public class FixedPointEncoding {
  /** Largest supported precision, 10^18 still fits into a long. */
  public static final int MAX_FRACTION_PRECISION = 18;

  private final int fractionPrecision;
  private final long factor;

  /**
   * @param fractionPrecision
   *          Number of decimal digits after the dot to keep, 0..{@link #MAX_FRACTION_PRECISION}.
   * @throws IllegalArgumentException
   *           if the precision is out of range.
   */
  public FixedPointEncoding(int fractionPrecision) throws IllegalArgumentException {
    if (fractionPrecision < 0 || fractionPrecision > MAX_FRACTION_PRECISION)
      throw new IllegalArgumentException(
          "Fraction precision must be in [0, " + MAX_FRACTION_PRECISION + "], but was " + fractionPrecision);
    this.fractionPrecision = fractionPrecision;
    this.factor = LongMath.pow(10, fractionPrecision);
  }

  public int getFractionPrecision() {
    return fractionPrecision;
  }

  /**
   * @throws IllegalArgumentException
   *           if the value is not finite or exceeds the range of long after encoding.
   */
  public long encode(double value) throws IllegalArgumentException {
    if (Double.isNaN(value) || Double.isInfinite(value))
      throw new IllegalArgumentException("Cannot encode non-finite value " + value);

    double scaled = value * factor;
    // Long.MAX_VALUE is not exactly representable as double, (double) Long.MAX_VALUE == 2^63.
    if (scaled >= 0x1p63 || scaled < -0x1p63)
      throw new IllegalArgumentException("Value " + value + " exceeds the range of long after encoding with precision "
          + fractionPrecision + ".");
    return Math.round(scaled);
  }

  public long[] encode(double[] values) throws IllegalArgumentException {
    long[] res = new long[values.length];
    for (int i = 0; i < values.length; i++)
      res[i] = encode(values[i]);
    return res;
  }

  public double decode(long encoded) {
    return (double) encoded / factor;
  }

  public double[] decode(long[] encoded) {
    double[] res = new double[encoded.length];
    for (int i = 0; i < encoded.length; i++)
      res[i] = decode(encoded[i]);
    return res;
  }

  @Override
  public String toString() {
    return this.getClass().getSimpleName() + "[fractionPrecision=" + fractionPrecision + "]";
  }
}
