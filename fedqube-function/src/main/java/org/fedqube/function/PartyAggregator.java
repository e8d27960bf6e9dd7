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
package org.fedqube.function;

import java.util.List;
import java.util.Map;

import org.fedqube.data.PartyId;

/**
 * Combines partial results that have been computed by each party locally into one global result.
 * 
 * <p>
 * All reductions are independent of the order in which the parties provide their partial results, apart from
 * {@link #union(Map)} which orders its result by first appearance.
 * 
 * <p>
 * Implementations may hide the individual partial results from the aggregating side (see
 * {@link org.fedqube.function.aggregate.SecureAggregator}).
 *
 * @author Bastian Gloeckle
 */
public interface PartyAggregator {
  /**
   * Element-wise sum of the vectors of all parties. Scalars are vectors of length 1.
   * 
   * @throws AggregationException
   *           if there is no input, a vector is <code>null</code> or the vectors have different lengths.
   */
  public double[] sum(Map<PartyId, double[]> partials) throws AggregationException;

  /**
   * @return Sum of the counts of all parties.
   * @throws AggregationException
   *           if there is no input or a count is <code>null</code>.
   */
  public long count(Map<PartyId, Long> partials) throws AggregationException;

  /**
   * Element-wise weighted mean <code>sum(w_p * v_p) / sum(w_p)</code>.
   * 
   * @param weights
   *          Weight per party or <code>null</code> to weigh all parties equally, in which case the result is the sum
   *          divided by the number of parties.
   * @throws AggregationException
   *           if the input is invalid (see {@link #sum(Map)}), a weight is missing or the weights sum up to 0.
   */
  public double[] average(Map<PartyId, double[]> partials, Map<PartyId, Double> weights) throws AggregationException;

  /**
   * Set-union of the values of all parties.
   * 
   * @return Distinct values ordered by first appearance: parties are visited in the iteration order of the given map,
   *         the values of a party in list order.
   * @throws AggregationException
   *           if there is no input or a list is <code>null</code>.
   */
  public <T> List<T> union(Map<PartyId, List<T>> partials) throws AggregationException;
}
