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
package org.fedqube.transform;

import org.fedqube.data.PartitionedTable;
import org.fedqube.data.UnknownColumnException;

/**
 * A preprocessing step that learns global parameters from a {@link PartitionedTable} and applies them to each partition.
 * 
 * <p>
 * Both {@link #fit(PartitionedTable, String...)} and {@link #transform(PartitionedTable)} produce the same result for a
 * row-split and a column-split table that contain the same logical data.
 *
 * @author Bastian Gloeckle
 */
public interface Transformer {
  /**
   * Learns the parameters of this transformer from the given columns of the table.
   * 
   * <p>
   * The new state is only committed after all computations succeeded, a failing fit keeps the previous state.
   * 
   * @param columns
   *          The columns to fit on. If none are given, each transformer chooses a default set of columns.
   * @throws UnknownColumnException
   *           if a column does not exist.
   */
  public void fit(PartitionedTable table, String... columns) throws UnknownColumnException;

  /**
   * Applies the fitted parameters to the table. The input table is not changed.
   * 
   * @throws NotFittedException
   *           if the transformer needs to be fitted first.
   * @throws UnknownColumnException
   *           if a fitted column does not exist in the table.
   */
  public PartitionedTable transform(PartitionedTable table) throws NotFittedException, UnknownColumnException;

  /**
   * {@link #fit(PartitionedTable, String...)} and then {@link #transform(PartitionedTable)} the same table.
   */
  public PartitionedTable fitTransform(PartitionedTable table, String... columns) throws UnknownColumnException;

  public boolean isFitted();

  /**
   * @return The current state or <code>null</code> if not fitted.
   */
  public TransformerState getState();
}
