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

import java.util.Map;

import org.fedqube.data.PartyId;

/**
 * Finds extremes and orderings across values that are held by different parties.
 * 
 * <p>
 * Secure comparison protocols implement this interface as well, this project ships the plaintext variant only.
 *
 * @author Bastian Gloeckle
 */
public interface PartyComparator {
  /**
   * @throws ComparisonException
   *           if there is no input or a value is <code>null</code> or NaN.
   */
  public double min(Map<PartyId, Double> partials) throws ComparisonException;

  /**
   * @throws ComparisonException
   *           if there is no input or a value is <code>null</code> or NaN.
   */
  public double max(Map<PartyId, Double> partials) throws ComparisonException;

  /**
   * Sorts the concatenation of the values of all parties (concatenated in the iteration order of the map).
   * 
   * @return The permutation of indices into the concatenation that orders the values ascending. Equal values keep their
   *         relative order.
   * @throws ComparisonException
   *           if there is no input or a value is <code>null</code> or NaN.
   */
  public int[] sortIndices(Map<PartyId, double[]> partials) throws ComparisonException;
}
