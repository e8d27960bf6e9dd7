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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * One party's physical slice of a logical dataset: A block of named {@link Column}s that all have the same number of
 * rows, together with the identity of the owning party.
 * 
 * <p>
 * A partition is immutable. Transformations create new partitions, see {@link #withColumnReplaced(String, Column)} and
 * {@link #withColumnExpanded(String, List)}.
 *
 * @author Bastian Gloeckle
 */
public final class Partition {
  private final PartyId owner;
  private final ImmutableMap<String, Column> columns;
  private final int rowCount;

  /**
   * @throws PartitionShapeException
   *           if there are no columns, if column names are duplicated or if the columns have different lengths.
   */
  public Partition(PartyId owner, List<Column> columns) throws PartitionShapeException {
    if (owner == null)
      throw new IllegalArgumentException("Owner of a partition must be set.");
    if (columns.isEmpty())
      throw new PartitionShapeException("Partition of party " + owner + " has no columns.");

    Map<String, Column> colMap = new LinkedHashMap<>();
    int rows = columns.get(0).size();
    for (Column col : columns) {
      if (colMap.put(col.getName(), col) != null)
        throw new PartitionShapeException(
            "Partition of party " + owner + " contains column '" + col.getName() + "' multiple times.");
      if (col.size() != rows)
        throw new PartitionShapeException("Columns of partition of party " + owner + " have different lengths: '"
            + columns.get(0).getName() + "' has " + rows + " rows, '" + col.getName() + "' has " + col.size());
    }
    this.owner = owner;
    this.columns = ImmutableMap.copyOf(colMap);
    this.rowCount = rows;
  }

  public Partition(PartyId owner, Column... columns) throws PartitionShapeException {
    this(owner, Arrays.asList(columns));
  }

  public PartyId getOwner() {
    return owner;
  }

  public int getRowCount() {
    return rowCount;
  }

  /**
   * @return Column names in order.
   */
  public List<String> getColumnNames() {
    return columns.keySet().asList();
  }

  /**
   * @return Columns in order.
   */
  public List<Column> getColumns() {
    return columns.values().asList();
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  /**
   * @throws UnknownColumnException
   *           if there is no such column in this partition.
   */
  public Column getColumn(String name) throws UnknownColumnException {
    Column res = columns.get(name);
    if (res == null)
      throw new UnknownColumnException(name, "Column '" + name + "' does not exist in partition of party " + owner);
    return res;
  }

  /**
   * @return A new partition with the given column replacing the column of the given name at the same position.
   * @throws UnknownColumnException
   *           if there is no such column.
   * @throws PartitionShapeException
   *           if the new column does not fit.
   */
  public Partition withColumnReplaced(String name, Column newColumn)
      throws UnknownColumnException, PartitionShapeException {
    getColumn(name);
    List<Column> res = new ArrayList<>();
    for (Column col : columns.values())
      res.add(col.getName().equals(name) ? newColumn : col);
    return new Partition(owner, res);
  }

  /**
   * @return A new partition where the column of the given name is removed and the new columns are appended to the end.
   * @throws UnknownColumnException
   *           if there is no such column.
   * @throws PartitionShapeException
   *           if the new columns do not fit.
   */
  public Partition withColumnExpanded(String name, List<Column> newColumns)
      throws UnknownColumnException, PartitionShapeException {
    getColumn(name);
    List<Column> res = new ArrayList<>();
    for (Column col : columns.values())
      if (!col.getName().equals(name))
        res.add(col);
    res.addAll(newColumns);
    return new Partition(owner, res);
  }

  /**
   * @return A new partition containing only the given columns (in the order of this partition), <code>null</code> if
   *         none of the columns is available in this partition.
   */
  public Partition select(Collection<String> columnNames) {
    List<Column> res = new ArrayList<>();
    for (Column col : columns.values())
      if (columnNames.contains(col.getName()))
        res.add(col);
    if (res.isEmpty())
      return null;
    return new Partition(owner, res);
  }

  /**
   * @return Types of all columns in order.
   */
  public List<ColumnType> getColumnTypes() {
    return columns.values().stream().map(Column::getType).collect(ImmutableList.toImmutableList());
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Partition))
      return false;
    Partition o = (Partition) obj;
    return owner.equals(o.owner) && getColumns().equals(o.getColumns());
  }

  @Override
  public int hashCode() {
    return owner.hashCode() ^ columns.hashCode();
  }

  @Override
  public String toString() {
    return "Partition[owner=" + owner + ",rows=" + rowCount + ",columns=" + getColumnNames() + "]";
  }
}
