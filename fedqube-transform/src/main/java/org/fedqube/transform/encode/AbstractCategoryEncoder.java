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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.fedqube.data.PartitionedTable;
import org.fedqube.data.UnknownColumnException;
import org.fedqube.execution.PreprocessingOrchestrator;
import org.fedqube.function.AggregationException;
import org.fedqube.transform.AbstractTransformer;
import org.fedqube.transform.NotFittedException;

/**
 * Base of encoders that learn the global categories of columns.
 * 
 * <p>
 * The categories of a column are its distinct non-missing values, ordered by their first appearance when visiting the
 * partitions in table order and the rows in row order.
 *
 * @author Bastian Gloeckle
 */
public abstract class AbstractCategoryEncoder extends AbstractTransformer<CategoryState> {
  protected final UnseenCategoryPolicy unseenCategoryPolicy;

  protected AbstractCategoryEncoder(PreprocessingOrchestrator orchestrator,
      UnseenCategoryPolicy unseenCategoryPolicy) {
    super(orchestrator);
    this.unseenCategoryPolicy = unseenCategoryPolicy;
  }

  public UnseenCategoryPolicy getUnseenCategoryPolicy() {
    return unseenCategoryPolicy;
  }

  /**
   * @throws NotFittedException
   *           if not fitted.
   * @throws UnknownColumnException
   *           if the column was not fitted.
   */
  public List<Object> getCategories(String column) throws NotFittedException, UnknownColumnException {
    return requireState().getCategories(column);
  }

  @Override
  protected List<String> defaultColumns(PartitionedTable table) {
    return table.columns();
  }

  /**
   * @throws AggregationException
   *           if a column does not contain any value.
   */
  @Override
  protected CategoryState doFit(PartitionedTable table, List<String> columns) throws AggregationException {
    Map<String, List<Object>> categories = new LinkedHashMap<>();
    for (String column : columns) {
      List<Object> columnCategories = orchestrator.globalCategories(table, column);
      if (columnCategories.isEmpty())
        throw new AggregationException("Column '" + column + "' does not contain any values.");
      categories.put(column, columnCategories);
    }
    return new CategoryState(categories);
  }
}
