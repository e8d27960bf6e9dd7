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
package org.fedqube.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * A named, typed and immutable vector of cells, the local data of one column in one {@link Partition}.
 * 
 * <p>
 * A cell is <i>missing</i> if it is <code>null</code> or, in {@link ColumnType#DOUBLE} columns, {@link Double#NaN}.
 *
 * @author Bastian Gloeckle
 */
public final class Column {
  private final String name;
  private final ColumnType type;
  private final Object[] values;

  /**
   * @param values
   *          The cells, <code>null</code> for missing cells. Values are converted to the java type of the column type
   *          (see {@link ColumnType#convert(Object)}), {@link Double#NaN} is stored as missing.
   * @throws ColumnTypeException
   *           if a value does not fit the type.
   */
  public Column(String name, ColumnType type, List<?> values) throws ColumnTypeException {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Column name must not be empty.");
    this.name = name;
    this.type = type;
    this.values = new Object[values.size()];
    for (int i = 0; i < this.values.length; i++) {
      try {
        Object v = type.convert(values.get(i));
        if (v instanceof Double && ((Double) v).isNaN())
          v = null;
        this.values[i] = v;
      } catch (ColumnTypeException e) {
        throw new ColumnTypeException("Invalid value in row " + i + " of column '" + name + "': " + e.getMessage(), e);
      }
    }
  }

  public static Column ofStrings(String name, String... values) {
    return new Column(name, ColumnType.STRING, Arrays.asList(values));
  }

  public static Column ofDoubles(String name, Double... values) {
    return new Column(name, ColumnType.DOUBLE, Arrays.asList(values));
  }

  public static Column ofLongs(String name, Long... values) {
    return new Column(name, ColumnType.LONG, Arrays.asList(values));
  }

  /**
   * @return The value as category of a column: Equal values are equal categories, where -0.0 and 0.0 count as equal and
   *         are both represented by 0.0.
   */
  public static Object asCategory(Object value) {
    if (value instanceof Double && (Double) value == 0.)
      return 0.;
    return value;
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  public int size() {
    return values.length;
  }

  /**
   * @return The value at the given row, <code>null</code> if missing.
   */
  public Object getValue(int row) {
    return values[row];
  }

  public boolean isMissing(int row) {
    return values[row] == null;
  }

  /**
   * @return The value at the given row of a numeric column as double, {@link Double#NaN} if missing.
   * @throws ColumnTypeException
   *           if this is not a numeric column.
   */
  public double getDouble(int row) throws ColumnTypeException {
    if (!type.isNumeric())
      throw new ColumnTypeException("Column '" + name + "' is of type " + type + ", which is not numeric.");
    if (isMissing(row))
      return Double.NaN;
    return ((Number) values[row]).doubleValue();
  }

  public int countNonMissing() {
    int res = 0;
    for (int i = 0; i < values.length; i++)
      if (!isMissing(i))
        res++;
    return res;
  }

  /**
   * @return Unmodifiable view of all values, missing cells are <code>null</code>.
   */
  public List<Object> getValues() {
    return Collections.unmodifiableList(Arrays.asList(values.clone()));
  }

  /**
   * Creates a new column by applying a function to each cell. Missing cells are passed to the function as
   * <code>null</code>, the function returns <code>null</code> to produce a missing cell.
   * 
   * @throws ColumnTypeException
   *           if a result of the function does not fit into the output type.
   */
  public Column map(String newName, ColumnType outputType, Function<Object, Object> cellFunction)
      throws ColumnTypeException {
    Object[] res = new Object[values.length];
    for (int i = 0; i < values.length; i++)
      res[i] = cellFunction.apply(getValue(i));
    return new Column(newName, outputType, Arrays.asList(res));
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Column))
      return false;
    Column o = (Column) obj;
    return name.equals(o.name) && type == o.type && Arrays.equals(values, o.values);
  }

  @Override
  public int hashCode() {
    return name.hashCode() ^ type.hashCode() ^ Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "Column[name=" + name + ",type=" + type + ",values=" + Arrays.toString(values) + "]";
  }
}
