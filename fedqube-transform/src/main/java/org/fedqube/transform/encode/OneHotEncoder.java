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

import java.util.ArrayList;
import java.util.List;

import org.fedqube.data.Column;
import org.fedqube.data.ColumnType;
import org.fedqube.data.PartitionedTable;
import org.fedqube.execution.PreprocessingOrchestrator;

/**
 * Replaces each fitted column by one {@link ColumnType#LONG} indicator column per category.
 * 
 * <p>
 * The indicator column of category <code>c</code> of column <code>col</code> is named <code>col_c</code> and contains 1
 * in rows where the value is <code>c</code>, 0 otherwise. The indicator columns are appended to the end of the partition
 * that held the source column, in category order. Missing cells lead to 0 in all indicator columns, as do unseen
 * values under {@link UnseenCategoryPolicy#IGNORE} (the default).
 *
 * @author Bastian Gloeckle
 */
public class OneHotEncoder extends AbstractCategoryEncoder {

  public OneHotEncoder(PreprocessingOrchestrator orchestrator) {
    this(orchestrator, UnseenCategoryPolicy.IGNORE);
  }

  public OneHotEncoder(PreprocessingOrchestrator orchestrator, UnseenCategoryPolicy unseenCategoryPolicy) {
    super(orchestrator, unseenCategoryPolicy);
  }

  /**
   * @return Name of the indicator column of the given category.
   */
  public static String indicatorColumnName(String column, Object category) {
    return column + "_" + category;
  }

  @Override
  protected PartitionedTable doTransform(PartitionedTable table, CategoryState state) {
    PartitionedTable res = table;
    for (String column : state.getColumns()) {
      List<Object> categories = state.getCategories(column);
      res = orchestrator.broadcastExpansion(res, column, sourceColumn -> {
        if (unseenCategoryPolicy == UnseenCategoryPolicy.ERROR)
          for (int row = 0; row < sourceColumn.size(); row++)
            if (!sourceColumn.isMissing(row) && state.getCode(column, sourceColumn.getValue(row)) == null)
              throw new UnseenCategoryException(column, sourceColumn.getValue(row));

        List<Column> indicators = new ArrayList<>();
        for (int i = 0; i < categories.size(); i++) {
          Long code = (long) i;
          indicators.add(sourceColumn.map(indicatorColumnName(column, categories.get(i)), ColumnType.LONG,
              value -> code.equals(state.getCode(column, value)) ? 1L : 0L));
        }
        return indicators;
      });
    }
    return res;
  }
}
