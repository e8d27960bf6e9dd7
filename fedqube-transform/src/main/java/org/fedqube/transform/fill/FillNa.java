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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.stream.Collectors;

import org.fedqube.data.ColumnType;
import org.fedqube.data.ColumnTypeException;
import org.fedqube.data.PartitionedTable;
import org.fedqube.data.UnknownColumnException;
import org.fedqube.execution.PreprocessingOrchestrator;
import org.fedqube.transform.AbstractTransformer;
import org.fedqube.transform.NotFittedException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Replaces missing cells with a fill value per column.
 * 
 * <p>
 * Fill values are either constants given on construction, in which case this transformer can be used without being
 * fitted, or computed as a global statistic of each column on {@link #fit(PartitionedTable, String...)} (see
 * {@link #withStrategy(PreprocessingOrchestrator, FillStrategy)}).
 * 
 * <p>
 * Fill values are converted to the type of the column they are used in. Statistics of {@link ColumnType#LONG} columns
 * are rounded to the nearest integer.
 *
 * @author Bastian Gloeckle
 */
public class FillNa extends AbstractTransformer<FillNaState> {
  private final ImmutableMap<String, Object> fillMap;
  private final FillStrategy strategy;

  /**
   * @param fillMap
   *          column name -> constant fill value.
   * @throws IllegalArgumentException
   *           if a fill value is <code>null</code>.
   */
  public FillNa(PreprocessingOrchestrator orchestrator, Map<String, ?> fillMap) throws IllegalArgumentException {
    super(orchestrator);
    this.fillMap = validFillMap(fillMap);
    this.strategy = null;
  }

  private FillNa(PreprocessingOrchestrator orchestrator, FillStrategy strategy) {
    super(orchestrator);
    this.fillMap = ImmutableMap.of();
    this.strategy = strategy;
  }

  /**
   * @return A {@link FillNa} that fills each fitted numeric column with the given global statistic of that column.
   */
  public static FillNa withStrategy(PreprocessingOrchestrator orchestrator, FillStrategy strategy) {
    return new FillNa(orchestrator, strategy);
  }

  /**
   * @return The strategy or <code>null</code> if constant fill values are used.
   */
  public FillStrategy getStrategy() {
    return strategy;
  }

  /**
   * Replaces the missing cells using the fitted fill values. An instance with constant fill values that has not been
   * fitted uses all of its constants.
   * 
   * @throws NotFittedException
   *           if a {@link FillStrategy} is used and the instance has not been fitted yet.
   * @throws ColumnTypeException
   *           if a fill value cannot be converted to the type of its column.
   */
  @Override
  public PartitionedTable transform(PartitionedTable table)
      throws NotFittedException, UnknownColumnException, ColumnTypeException {
    if (strategy == null && !isFitted())
      return transform(table, fillMap);
    return super.transform(table);
  }

  /**
   * Replaces the missing cells of the columns of the given fill map, independent of the state of this instance.
   * 
   * @throws UnknownColumnException
   *           if a column of the map does not exist.
   * @throws ColumnTypeException
   *           if a fill value cannot be converted to the type of its column.
   */
  public PartitionedTable transform(PartitionedTable table, Map<String, ?> fillValues)
      throws UnknownColumnException, ColumnTypeException {
    PartitionedTable res = table;
    for (Entry<String, Object> e : convert(table, validFillMap(fillValues)).entrySet()) {
      Object fill = e.getValue();
      res = orchestrator.broadcastElementwise(res, e.getKey(), table.getColumnType(e.getKey()),
          value -> value == null ? fill : value);
    }
    return res;
  }

  @Override
  protected List<String> defaultColumns(PartitionedTable table) {
    if (strategy == null)
      return ImmutableList.copyOf(fillMap.keySet());
    return table.columns().stream().filter(col -> table.getColumnType(col).isNumeric()).collect(Collectors.toList());
  }

  @Override
  protected FillNaState doFit(PartitionedTable table, List<String> columns) {
    Map<String, Object> values = new LinkedHashMap<>();
    if (strategy == null) {
      for (String column : columns)
        if (fillMap.containsKey(column))
          values.put(column, fillMap.get(column));
      // validate conversion of all constants, the table must contain the columns of the whole fill map.
      convert(table, fillMap);
    } else {
      for (String column : columns) {
        double statistic;
        switch (strategy) {
        case MEAN:
          statistic = orchestrator.globalMean(table, column);
          break;
        case MIN:
          statistic = orchestrator.globalMin(table, column);
          break;
        default:
          statistic = orchestrator.globalMax(table, column);
        }
        values.put(column,
            (table.getColumnType(column) == ColumnType.LONG) ? (Object) Math.round(statistic) : (Object) statistic);
      }
    }
    return new FillNaState(convert(table, values));
  }

  @Override
  protected PartitionedTable doTransform(PartitionedTable table, FillNaState state) {
    return transform(table, state.getFillValues());
  }

  private Map<String, Object> convert(PartitionedTable table, Map<String, Object> values)
      throws UnknownColumnException, ColumnTypeException {
    Map<String, Object> res = new LinkedHashMap<>();
    for (Entry<String, Object> e : values.entrySet()) {
      ColumnType type = table.getColumnType(e.getKey());
      try {
        res.put(e.getKey(), type.convert(e.getValue()));
      } catch (ColumnTypeException ex) {
        throw new ColumnTypeException("Fill value of column '" + e.getKey() + "' does not fit: " + ex.getMessage(), ex);
      }
    }
    return res;
  }

  private static ImmutableMap<String, Object> validFillMap(Map<String, ?> fillMap) throws IllegalArgumentException {
    if (fillMap == null)
      throw new IllegalArgumentException("No fill values given.");
    for (Entry<String, ?> e : fillMap.entrySet())
      if (e.getValue() == null)
        throw new IllegalArgumentException("Fill value of column '" + e.getKey() + "' is null.");
    return ImmutableMap.copyOf(fillMap);
  }
}
