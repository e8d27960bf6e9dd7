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
package org.fedqube.transform.fill;

import java.util.List;
import java.util.Map;

import org.fedqube.transform.TransformerState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Fill value per column, each converted to the type of its column.
 *
 * @author Bastian Gloeckle
 */
public class FillNaState implements TransformerState {
  private final ImmutableMap<String, Object> fillValues;

  /* package */ FillNaState(Map<String, Object> fillValues) {
    this.fillValues = ImmutableMap.copyOf(fillValues);
  }

  @Override
  public List<String> getColumns() {
    return ImmutableList.copyOf(fillValues.keySet());
  }

  public Map<String, Object> getFillValues() {
    return fillValues;
  }

  /**
   * @return The fill value or <code>null</code> if the column was not fitted.
   */
  public Object getFillValue(String column) {
    return fillValues.get(column);
  }

  @Override
  public String toString() {
    return this.getClass().getSimpleName() + fillValues;
  }
}
