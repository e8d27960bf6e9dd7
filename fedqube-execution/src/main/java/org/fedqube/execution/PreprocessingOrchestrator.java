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
package org.fedqube.execution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

import org.fedqube.data.Column;
import org.fedqube.data.ColumnType;
import org.fedqube.data.ColumnTypeException;
import org.fedqube.data.PartitionedTable;
import org.fedqube.data.PartyId;
import org.fedqube.data.UnknownColumnException;
import org.fedqube.function.AggregationException;
import org.fedqube.function.ComparisonException;
import org.fedqube.function.PartyAggregator;
import org.fedqube.function.PartyComparator;
import org.fedqube.threads.ExecutorManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequences party-local computations and the global reductions over their partial results.
 * 
 * <p>
 * Each call runs one task per party that holds the requested column, on a thread pool that lives for the duration of
 * the call only, and waits for all of them. Which parties hold a column is decided by
 * {@link PartitionedTable#columnLocalValues(String)}, so the orchestrator itself works the same for row-split and
 * column-split tables.
 * 
 * <p>
 * If any party task fails, the others are cancelled and the whole call fails. Instances do not hold any state apart
 * from their collaborators.
 *
 * @author Bastian Gloeckle
 */
public class PreprocessingOrchestrator {
  private static final Logger logger = LoggerFactory.getLogger(PreprocessingOrchestrator.class);

  private final ExecutorManager executorManager;
  private final PartyAggregator aggregator;
  private final PartyComparator comparator;

  public PreprocessingOrchestrator(ExecutorManager executorManager, PartyAggregator aggregator,
      PartyComparator comparator) {
    this.executorManager = executorManager;
    this.aggregator = aggregator;
    this.comparator = comparator;
  }

  public PartyAggregator getAggregator() {
    return aggregator;
  }

  public PartyComparator getComparator() {
    return comparator;
  }

  /**
   * Executes a function on the local part of a column at each party holding that column.
   * 
   * @return party -> result of the local function, in partition order.
   * @throws UnknownColumnException
   *           if the column does not exist.
   * @throws LocalComputationException
   *           if a local function failed with a checked exception or the calling thread was interrupted. Runtime
   *           exceptions thrown by a local function are rethrown as-is.
   */
  public <R> Map<PartyId, R> computeLocal(PartitionedTable table, String column, Function<Column, R> localFunction)
      throws UnknownColumnException, LocalComputationException {
    return runPerParty("compute", table.columnLocalValues(column), localFunction);
  }

  /**
   * @return Number of non-missing cells of the column over all parties.
   */
  public long globalCount(PartitionedTable table, String column)
      throws UnknownColumnException, AggregationException, LocalComputationException {
    Map<PartyId, Long> counts = computeLocal(table, column, col -> (long) col.countNonMissing());
    return aggregator.count(counts);
  }

  /**
   * @return Sum of the non-missing cells of a numeric column over all parties.
   * @throws ColumnTypeException
   *           if the column is not numeric.
   */
  public double globalSum(PartitionedTable table, String column) throws UnknownColumnException, ColumnTypeException,
      AggregationException, LocalComputationException {
    validateNumeric(table, column);
    Map<PartyId, double[]> sums = computeLocal(table, column, col -> new double[] { localSum(col) });
    return aggregator.sum(sums)[0];
  }

  /**
   * @return Mean of the non-missing cells of a numeric column over all parties.
   * @throws ColumnTypeException
   *           if the column is not numeric.
   * @throws AggregationException
   *           if the column does not contain any non-missing cell.
   */
  public double globalMean(PartitionedTable table, String column) throws UnknownColumnException, ColumnTypeException,
      AggregationException, LocalComputationException {
    double sum = globalSum(table, column);
    long count = globalCount(table, column);
    if (count == 0)
      throw new AggregationException("Cannot compute mean of column '" + column + "', it has no values.");
    return sum / count;
  }

  /**
   * @return Minimum of the non-missing cells of a numeric column over all parties.
   * @throws ColumnTypeException
   *           if the column is not numeric.
   * @throws ComparisonException
   *           if the column does not contain any non-missing cell.
   */
  public double globalMin(PartitionedTable table, String column) throws UnknownColumnException, ColumnTypeException,
      ComparisonException, LocalComputationException {
    return globalExtreme(table, column, true);
  }

  /**
   * @return Maximum of the non-missing cells of a numeric column over all parties.
   * @throws ColumnTypeException
   *           if the column is not numeric.
   * @throws ComparisonException
   *           if the column does not contain any non-missing cell.
   */
  public double globalMax(PartitionedTable table, String column) throws UnknownColumnException, ColumnTypeException,
      ComparisonException, LocalComputationException {
    return globalExtreme(table, column, false);
  }

  /**
   * @return The distinct non-missing values of the column, ordered by first appearance: partitions in table order, rows
   *         in row order. -0.0 is reported as 0.0.
   */
  public List<Object> globalCategories(PartitionedTable table, String column)
      throws UnknownColumnException, AggregationException, LocalComputationException {
    Map<PartyId, List<Object>> local = computeLocal(table, column, col -> {
      Set<Object> res = new LinkedHashSet<>();
      for (int row = 0; row < col.size(); row++)
        if (!col.isMissing(row))
          res.add(Column.asCategory(col.getValue(row)));
      return new ArrayList<>(res);
    });
    return aggregator.union(local);
  }

  /**
   * Applies a function to each cell of a column at each party holding the column.
   * 
   * @param cellFunction
   *          Receives the cell value (<code>null</code> for missing cells) and returns the new value (<code>null</code>
   *          for missing).
   * @return The new table, the column keeps its name and position but has the given type.
   */
  public PartitionedTable broadcastElementwise(PartitionedTable table, String column, ColumnType outputType,
      Function<Object, Object> cellFunction) throws UnknownColumnException, LocalComputationException {
    Map<PartyId, Column> newColumns =
        runPerParty("transform", table.columnLocalValues(column), col -> col.map(column, outputType, cellFunction));
    return table.applyElementwise(column, newColumns);
  }

  /**
   * Replaces a column by a list of new columns at each party holding the column. The new columns are appended to the
   * end of the partition.
   */
  public PartitionedTable broadcastExpansion(PartitionedTable table, String column,
      Function<Column, List<Column>> expansion) throws UnknownColumnException, LocalComputationException {
    Map<PartyId, List<Column>> newColumns = runPerParty("expand", table.columnLocalValues(column), expansion);
    return table.expandColumn(column, newColumns);
  }

  private double globalExtreme(PartitionedTable table, String column, boolean min)
      throws UnknownColumnException, ColumnTypeException, ComparisonException, LocalComputationException {
    validateNumeric(table, column);
    Map<PartyId, Double> local = computeLocal(table, column, col -> {
      Double res = null;
      for (int row = 0; row < col.size(); row++) {
        if (col.isMissing(row))
          continue;
        double v = col.getDouble(row);
        if (res == null || (min ? v < res : v > res))
          res = v;
      }
      return res;
    });
    // parties without any value do not take part in the comparison.
    local.values().removeIf(v -> v == null);
    if (local.isEmpty())
      throw new ComparisonException("Column '" + column + "' does not contain any values.");
    return min ? comparator.min(local) : comparator.max(local);
  }

  private static double localSum(Column col) {
    double res = 0.;
    for (int row = 0; row < col.size(); row++)
      if (!col.isMissing(row))
        res += col.getDouble(row);
    return res;
  }

  private void validateNumeric(PartitionedTable table, String column)
      throws UnknownColumnException, ColumnTypeException {
    ColumnType type = table.getColumnType(column);
    if (!type.isNumeric())
      throw new ColumnTypeException("Column '" + column + "' is of type " + type + ", but a numeric one is needed.");
  }

  /**
   * Runs the given function on each of the inputs on a separate thread and waits for all of them.
   * 
   * @return party -> result, in the order of the input map.
   */
  private <I, R> Map<PartyId, R> runPerParty(String callName, Map<PartyId, I> inputs, Function<I, R> localFunction)
      throws LocalComputationException {
    ExecutorService executor = executorManager.newPartyFixedThreadPool(callName, inputs.size());
    try {
      CompletionService<PartyResult<R>> completionService = new ExecutorCompletionService<>(executor);
      List<Future<PartyResult<R>>> futures = new ArrayList<>();
      for (Entry<PartyId, I> e : inputs.entrySet()) {
        futures.add(completionService.submit(() -> {
          logger.trace("Executing local {} at party {}", callName, e.getKey());
          R res = localFunction.apply(e.getValue());
          logger.trace("Local {} at party {} done", callName, e.getKey());
          return new PartyResult<>(e.getKey(), res);
        }));
      }

      Map<PartyId, R> results = new LinkedHashMap<>();
      try {
        for (int i = 0; i < futures.size(); i++) {
          PartyResult<R> partyResult = completionService.take().get();
          results.put(partyResult.party, partyResult.result);
        }
      } catch (ExecutionException e) {
        futures.forEach(f -> f.cancel(true));
        Throwable cause = e.getCause();
        logger.debug("Local {} failed at a party, cancelled the remaining ones: {}", callName, cause.toString());
        if (cause instanceof RuntimeException)
          throw (RuntimeException) cause;
        if (cause instanceof Error)
          throw (Error) cause;
        throw new LocalComputationException("Local " + callName + " failed at a party.", cause);
      } catch (InterruptedException e) {
        futures.forEach(f -> f.cancel(true));
        Thread.currentThread().interrupt();
        throw new LocalComputationException("Interrupted while waiting for local " + callName + ".", e);
      }

      // restore the order of the input.
      Map<PartyId, R> res = new LinkedHashMap<>();
      for (PartyId party : inputs.keySet())
        res.put(party, results.get(party));
      return res;
    } finally {
      executor.shutdownNow();
    }
  }

  private static class PartyResult<R> {
    private final PartyId party;
    private final R result;

    PartyResult(PartyId party, R result) {
      this.party = party;
      this.result = result;
    }
  }
}
