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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.fedqube.data.ColumnType;
import org.fedqube.data.ColumnTypeException;
import org.fedqube.data.PartitionedTable;
import org.fedqube.data.UnknownColumnException;
import org.fedqube.execution.PreprocessingOrchestrator;
import org.fedqube.function.ComparisonException;
import org.fedqube.transform.AbstractTransformer;
import org.fedqube.transform.NotFittedException;

/**
 * Scales numeric columns linearly into a feature range, which is [0, 1] by default.
 * 
 * <p>
 * The global minimum of a column is mapped to the lower bound of the range, the global maximum to the upper one. If
 * minimum and maximum are equal, all values are mapped to the lower bound. Output columns are of type
 * {@link ColumnType#DOUBLE}, missing cells stay missing.
 *
 * @author Bastian Gloeckle
 */
public class MinMaxScaler extends AbstractTransformer<MinMaxScalerState> {
  private final double rangeMin;
  private final double rangeMax;

  public MinMaxScaler(PreprocessingOrchestrator orchestrator) {
    this(orchestrator, 0., 1.);
  }

  /**
   * @throws IllegalArgumentException
   *           if the range is empty or not finite.
   */
  public MinMaxScaler(PreprocessingOrchestrator orchestrator, double rangeMin, double rangeMax)
      throws IllegalArgumentException {
    super(orchestrator);
    if (!(rangeMin < rangeMax) || Double.isInfinite(rangeMin) || Double.isInfinite(rangeMax))
      throw new IllegalArgumentException("Invalid feature range [" + rangeMin + ", " + rangeMax + "]");
    this.rangeMin = rangeMin;
    this.rangeMax = rangeMax;
  }

  /**
   * @throws NotFittedException
   *           if not fitted.
   * @throws UnknownColumnException
   *           if the column was not fitted.
   */
  public double getDataMin(String column) throws NotFittedException, UnknownColumnException {
    return requireState().getDataMin(column);
  }

  /**
   * @throws NotFittedException
   *           if not fitted.
   * @throws UnknownColumnException
   *           if the column was not fitted.
   */
  public double getDataMax(String column) throws NotFittedException, UnknownColumnException {
    return requireState().getDataMax(column);
  }

  /**
   * @throws ColumnTypeException
   *           if a column is not numeric.
   * @throws ComparisonException
   *           if a column does not contain any value.
   */
  @Override
  public void fit(PartitionedTable table, String... columns)
      throws UnknownColumnException, ColumnTypeException, ComparisonException {
    super.fit(table, columns);
  }

  @Override
  protected List<String> defaultColumns(PartitionedTable table) {
    return table.columns().stream().filter(col -> table.getColumnType(col).isNumeric()).collect(Collectors.toList());
  }

  @Override
  protected MinMaxScalerState doFit(PartitionedTable table, List<String> columns) {
    for (String column : columns)
      validateNumeric(table, column);

    Map<String, Double> dataMin = new LinkedHashMap<>();
    Map<String, Double> dataMax = new LinkedHashMap<>();
    for (String column : columns) {
      dataMin.put(column, orchestrator.globalMin(table, column));
      dataMax.put(column, orchestrator.globalMax(table, column));
    }
    return new MinMaxScalerState(dataMin, dataMax);
  }

  @Override
  protected PartitionedTable doTransform(PartitionedTable table, MinMaxScalerState state) {
    PartitionedTable res = table;
    for (String column : state.getColumns()) {
      validateNumeric(table, column);
      double min = state.getDataMin(column);
      double max = state.getDataMax(column);
      res = orchestrator.broadcastElementwise(res, column, ColumnType.DOUBLE, value -> {
        if (value == null)
          return null;
        double scaled = (max == min) ? 0. : (((Number) value).doubleValue() - min) / (max - min);
        return rangeMin + scaled * (rangeMax - rangeMin);
      });
    }
    return res;
  }

  private void validateNumeric(PartitionedTable table, String column) throws ColumnTypeException {
    ColumnType type = table.getColumnType(column);
    if (!type.isNumeric())
      throw new ColumnTypeException("Cannot scale column '" + column + "' of type " + type + ".");
  }
}
