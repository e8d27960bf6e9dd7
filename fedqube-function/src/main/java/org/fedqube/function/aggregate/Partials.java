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

import java.util.Map;
import java.util.Map.Entry;

import org.fedqube.data.PartyId;
import org.fedqube.function.AggregationException;

/**
 * Validation of the inputs of {@link org.fedqube.function.PartyAggregator}s.
 *
 * @author Bastian Gloeckle
 */
/* package */ final class Partials {
  private Partials() {
  }

  /**
   * @return The common length of all vectors.
   */
  /* package */ static int validateVectors(Map<PartyId, double[]> partials) throws AggregationException {
    validateNotEmpty(partials);
    int length = -1;
    for (Entry<PartyId, double[]> e : partials.entrySet()) {
      if (e.getValue() == null)
        throw new AggregationException("Party " + e.getKey() + " did not provide a value.");
      if (length == -1)
        length = e.getValue().length;
      else if (length != e.getValue().length)
        throw new AggregationException(
            "Parties provided vectors of different lengths (" + length + " vs " + e.getValue().length + ").");
    }
    return length;
  }

  /* package */ static void validateNotEmpty(Map<PartyId, ?> partials) throws AggregationException {
    if (partials == null || partials.isEmpty())
      throw new AggregationException("No party provided any data.");
    for (Entry<PartyId, ?> e : partials.entrySet())
      if (e.getValue() == null)
        throw new AggregationException("Party " + e.getKey() + " did not provide a value.");
  }

  /**
   * @return Sum of the weights.
   */
  /* package */ static double validateWeights(Map<PartyId, ?> partials, Map<PartyId, Double> weights)
      throws AggregationException {
    double sum = 0.;
    for (PartyId party : partials.keySet()) {
      Double w = weights.get(party);
      if (w == null || Double.isNaN(w) || Double.isInfinite(w))
        throw new AggregationException("No valid weight for party " + party + ": " + w);
      sum += w;
    }
    if (sum == 0.)
      throw new AggregationException("Weights sum up to 0.");
    return sum;
  }
}
