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
package org.fedqube.function.compare;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Map;
import java.util.Map.Entry;

import org.fedqube.data.PartyId;
import org.fedqube.function.ComparisonException;
import org.fedqube.function.PartyComparator;

/**
 * {@link PartyComparator} that compares the values of the parties in the clear.
 *
 * @author Bastian Gloeckle
 */
public class PlaintextComparator implements PartyComparator {

  @Override
  public double min(Map<PartyId, Double> partials) throws ComparisonException {
    validate(partials);
    double res = Double.POSITIVE_INFINITY;
    for (Entry<PartyId, Double> e : partials.entrySet())
      res = Math.min(res, validValue(e.getKey(), e.getValue()));
    return res;
  }

  @Override
  public double max(Map<PartyId, Double> partials) throws ComparisonException {
    validate(partials);
    double res = Double.NEGATIVE_INFINITY;
    for (Entry<PartyId, Double> e : partials.entrySet())
      res = Math.max(res, validValue(e.getKey(), e.getValue()));
    return res;
  }

  @Override
  public int[] sortIndices(Map<PartyId, double[]> partials) throws ComparisonException {
    validate(partials);
    int size = 0;
    for (Entry<PartyId, double[]> e : partials.entrySet()) {
      if (e.getValue() == null)
        throw new ComparisonException("Party " + e.getKey() + " did not provide values.");
      size += e.getValue().length;
    }

    double[] all = new double[size];
    int pos = 0;
    for (Entry<PartyId, double[]> e : partials.entrySet())
      for (double v : e.getValue())
        all[pos++] = validValue(e.getKey(), v);

    // boxed sort is stable.
    Integer[] indices = new Integer[size];
    for (int i = 0; i < size; i++)
      indices[i] = i;
    Arrays.sort(indices, Comparator.comparingDouble(i -> all[i]));
    return Arrays.stream(indices).mapToInt(Integer::intValue).toArray();
  }

  private void validate(Map<PartyId, ?> partials) throws ComparisonException {
    if (partials == null || partials.isEmpty())
      throw new ComparisonException("No party provided any data.");
  }

  private double validValue(PartyId party, Double value) throws ComparisonException {
    if (value == null || Double.isNaN(value))
      throw new ComparisonException("Party " + party + " provided an invalid value: " + value);
    return value;
  }
}
