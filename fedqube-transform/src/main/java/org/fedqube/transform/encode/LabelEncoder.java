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

import org.fedqube.data.ColumnType;
import org.fedqube.data.PartitionedTable;
import org.fedqube.data.UnknownColumnException;
import org.fedqube.execution.PreprocessingOrchestrator;
import org.fedqube.transform.NotFittedException;

/**
 * Replaces the values of each fitted column by the 0-based index of the value in the categories of the column.
 * 
 * <p>
 * Result columns are of type {@link ColumnType#LONG} and keep name and position. Missing cells stay missing. Unseen
 * values fail the transformation under {@link UnseenCategoryPolicy#ERROR} (the default) and become missing under
 * {@link UnseenCategoryPolicy#IGNORE}.
 *
 * @author Bastian Gloeckle
 */
public class LabelEncoder extends AbstractCategoryEncoder {

  public LabelEncoder(PreprocessingOrchestrator orchestrator) {
    this(orchestrator, UnseenCategoryPolicy.ERROR);
  }

  public LabelEncoder(PreprocessingOrchestrator orchestrator, UnseenCategoryPolicy unseenCategoryPolicy) {
    super(orchestrator, unseenCategoryPolicy);
  }

  /**
   * @return The code of the given value.
   * @throws NotFittedException
   *           if not fitted.
   * @throws UnknownColumnException
   *           if the column was not fitted.
   * @throws UnseenCategoryException
   *           if the value is no category of the column.
   */
  public long getCode(String column, Object value)
      throws NotFittedException, UnknownColumnException, UnseenCategoryException {
    Long res = requireState().getCode(column, value);
    if (res == null)
      throw new UnseenCategoryException(column, value);
    return res;
  }

  @Override
  protected PartitionedTable doTransform(PartitionedTable table, CategoryState state) {
    PartitionedTable res = table;
    for (String column : state.getColumns()) {
      res = orchestrator.broadcastElementwise(res, column, ColumnType.LONG, value -> {
        if (value == null)
          return null;
        Long code = state.getCode(column, value);
        if (code == null && unseenCategoryPolicy == UnseenCategoryPolicy.ERROR)
          throw new UnseenCategoryException(column, value);
        return code;
      });
    }
    return res;
  }
}
