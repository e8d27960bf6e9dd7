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
package org.fedqube.transform.scale;

import java.util.List;
import java.util.Map;

import org.fedqube.data.UnknownColumnException;
import org.fedqube.transform.TransformerState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Global minimum and maximum per column.
 *
 * @author Bastian Gloeckle
 */
public class MinMaxScalerState implements TransformerState {
  private final ImmutableMap<String, Double> dataMin;
  private final ImmutableMap<String, Double> dataMax;

  /* package */ MinMaxScalerState(Map<String, Double> dataMin, Map<String, Double> dataMax) {
    this.dataMin = ImmutableMap.copyOf(dataMin);
    this.dataMax = ImmutableMap.copyOf(dataMax);
  }

  @Override
  public List<String> getColumns() {
    return ImmutableList.copyOf(dataMin.keySet());
  }

  /**
   * @throws UnknownColumnException
   *           if the column has not been fitted.
   */
  public double getDataMin(String column) throws UnknownColumnException {
    return get(dataMin, column);
  }

  /**
   * @throws UnknownColumnException
   *           if the column has not been fitted.
   */
  public double getDataMax(String column) throws UnknownColumnException {
    return get(dataMax, column);
  }

  private double get(Map<String, Double> values, String column) throws UnknownColumnException {
    Double res = values.get(column);
    if (res == null)
      throw new UnknownColumnException(column, "Column '" + column + "' has not been fitted.");
    return res;
  }

  @Override
  public String toString() {
    return this.getClass().getSimpleName() + "[columns=" + getColumns() + "]";
  }
}
