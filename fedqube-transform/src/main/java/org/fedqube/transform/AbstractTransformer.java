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

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

import org.fedqube.data.PartitionedTable;
import org.fedqube.data.UnknownColumnException;
import org.fedqube.execution.PreprocessingOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * Abstract base class of {@link Transformer}s that keep their fitted parameters in a {@link TransformerState}.
 * 
 * <p>
 * Subclasses compute a new state in {@link #doFit(PartitionedTable, List)} using the orchestrator, this class commits
 * it only when the computation returned.
 *
 * @author Bastian Gloeckle
 */
public abstract class AbstractTransformer<S extends TransformerState> implements Transformer {
  private static final Logger logger = LoggerFactory.getLogger(AbstractTransformer.class);

  protected final PreprocessingOrchestrator orchestrator;

  private volatile S state;

  protected AbstractTransformer(PreprocessingOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @Override
  public synchronized void fit(PartitionedTable table, String... columns) throws UnknownColumnException {
    List<String> fitColumns = (columns == null || columns.length == 0) ? defaultColumns(table)
        : ImmutableList.copyOf(new LinkedHashSet<>(Arrays.asList(columns)));
    for (String column : fitColumns)
      if (!table.hasColumn(column))
        throw new UnknownColumnException(column);

    logger.debug("Fitting {} on columns {} of a {} table", this.getClass().getSimpleName(), fitColumns,
        table.getKind());
    S newState = doFit(table, fitColumns);
    state = newState;
    logger.debug("{} fitted on columns {}", this.getClass().getSimpleName(), fitColumns);
  }

  @Override
  public PartitionedTable transform(PartitionedTable table) throws NotFittedException, UnknownColumnException {
    S curState = requireState();
    logger.debug("Transforming columns {} using {}", curState.getColumns(), this.getClass().getSimpleName());
    return doTransform(table, curState);
  }

  @Override
  public synchronized PartitionedTable fitTransform(PartitionedTable table, String... columns)
      throws UnknownColumnException {
    fit(table, columns);
    return transform(table);
  }

  @Override
  public boolean isFitted() {
    return state != null;
  }

  @Override
  public S getState() {
    return state;
  }

  /**
   * @throws NotFittedException
   *           if there is no state.
   */
  protected S requireState() throws NotFittedException {
    S res = state;
    if (res == null)
      throw new NotFittedException(this.getClass().getSimpleName() + " needs to be fitted first.");
    return res;
  }

  /**
   * @return The columns to fit on if the user did not specify any.
   */
  protected abstract List<String> defaultColumns(PartitionedTable table);

  /**
   * Computes the new state. Must not have any side effects on this object.
   * 
   * @param columns
   *          Existing columns of the table.
   */
  protected abstract S doFit(PartitionedTable table, List<String> columns);

  protected abstract PartitionedTable doTransform(PartitionedTable table, S state);
}
