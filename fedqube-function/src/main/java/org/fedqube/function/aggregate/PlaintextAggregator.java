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
package org.fedqube.function.aggregate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.fedqube.data.PartyId;
import org.fedqube.function.AggregationException;
import org.fedqube.function.PartyAggregator;

import com.google.common.collect.ImmutableSortedMap;

/**
 * {@link PartyAggregator} that combines the partial results in the clear.
 * 
 * <p>
 * Numeric reductions visit the parties ordered by their id, so the floating point result does not depend on the order
 * of the input map.
 *
 * @author Bastian Gloeckle
 */
public class PlaintextAggregator implements PartyAggregator {

  @Override
  public double[] sum(Map<PartyId, double[]> partials) throws AggregationException {
    int length = Partials.validateVectors(partials);
    double[] res = new double[length];
    for (double[] partial : ImmutableSortedMap.copyOf(partials).values())
      for (int i = 0; i < length; i++)
        res[i] += partial[i];
    return res;
  }

  @Override
  public long count(Map<PartyId, Long> partials) throws AggregationException {
    Partials.validateNotEmpty(partials);
    long res = 0;
    for (long partial : partials.values())
      res += partial;
    return res;
  }

  @Override
  public double[] average(Map<PartyId, double[]> partials, Map<PartyId, Double> weights)
      throws AggregationException {
    int length = Partials.validateVectors(partials);
    if (weights == null) {
      double[] res = sum(partials);
      for (int i = 0; i < length; i++)
        res[i] /= partials.size();
      return res;
    }

    double weightSum = Partials.validateWeights(partials, weights);
    double[] res = new double[length];
    ImmutableSortedMap<PartyId, double[]> sorted = ImmutableSortedMap.copyOf(partials);
    for (PartyId party : sorted.keySet()) {
      double w = weights.get(party);
      double[] partial = sorted.get(party);
      for (int i = 0; i < length; i++)
        res[i] += w * partial[i];
    }
    for (int i = 0; i < length; i++)
      res[i] /= weightSum;
    return res;
  }

  @Override
  public <T> List<T> union(Map<PartyId, List<T>> partials) throws AggregationException {
    Partials.validateNotEmpty(partials);
    Set<T> res = new LinkedHashSet<>();
    for (List<T> partial : partials.values())
      res.addAll(partial);
    return new ArrayList<>(res);
  }
}
