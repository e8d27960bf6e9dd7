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
package org.fedqube.transform.encode;

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.fedqube.data.Column;
import org.fedqube.data.UnknownColumnException;
import org.fedqube.transform.TransformerState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Global categories per column, ordered by first appearance.
 *
 * @author Bastian Gloeckle
 */
public class CategoryState implements TransformerState {
  private final ImmutableMap<String, ImmutableList<Object>> categories;
  /** column -> category -> index */
  private final ImmutableMap<String, ImmutableMap<Object, Long>> codes;

  /* package */ CategoryState(Map<String, List<Object>> categories) {
    ImmutableMap.Builder<String, ImmutableList<Object>> categoriesBuilder = ImmutableMap.builder();
    ImmutableMap.Builder<String, ImmutableMap<Object, Long>> codesBuilder = ImmutableMap.builder();
    for (Entry<String, List<Object>> e : categories.entrySet()) {
      ImmutableList<Object> columnCategories = ImmutableList.copyOf(e.getValue());
      ImmutableMap.Builder<Object, Long> columnCodes = ImmutableMap.builder();
      for (int i = 0; i < columnCategories.size(); i++)
        columnCodes.put(columnCategories.get(i), (long) i);
      categoriesBuilder.put(e.getKey(), columnCategories);
      codesBuilder.put(e.getKey(), columnCodes.build());
    }
    this.categories = categoriesBuilder.build();
    this.codes = codesBuilder.build();
  }

  @Override
  public List<String> getColumns() {
    return ImmutableList.copyOf(categories.keySet());
  }

  /**
   * @throws UnknownColumnException
   *           if the column has not been fitted.
   */
  public List<Object> getCategories(String column) throws UnknownColumnException {
    List<Object> res = categories.get(column);
    if (res == null)
      throw new UnknownColumnException(column, "Column '" + column + "' has not been fitted.");
    return res;
  }

  /**
   * @return The index of the value in the categories of the column or <code>null</code> if it is not a category.
   * @throws UnknownColumnException
   *           if the column has not been fitted.
   */
  public Long getCode(String column, Object value) throws UnknownColumnException {
    getCategories(column);
    return codes.get(column).get(Column.asCategory(value));
  }

  @Override
  public String toString() {
    return this.getClass().getSimpleName() + "[columns=" + getColumns() + "]";
  }
}
