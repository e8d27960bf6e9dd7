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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The logical dataset: An ordered list of {@link Partition}s, one per party, plus the {@link PartitionKind} that
 * describes how the dataset is divided between the parties.
 * 
 * <p>
 * For {@link PartitionKind#ROW_SPLIT}, all partitions have the same columns (same names, order and types) and the
 * logical dataset is the concatenation of the rows of all partitions in partition order. For
 * {@link PartitionKind#COLUMN_SPLIT}, the column names of the partitions are disjoint and all partitions have the same
 * number of rows, which share the same implicit row index.
 * 
 * <p>
 * Instances are immutable, all operations that change data return new tables with the same kind and the same party
 * ownership.
 *
 * @author Bastian Gloeckle
 */
public final class PartitionedTable {
  private final PartitionKind kind;
  private final ImmutableList<Partition> partitions;
  private final ImmutableList<String> columns;

  /**
   * @throws PartitionShapeException
   *           if the partitions do not fit together for the given kind.
   */
  public PartitionedTable(PartitionKind kind, List<Partition> partitions) throws PartitionShapeException {
    if (kind == null)
      throw new IllegalArgumentException("Partition kind must be set.");
    if (partitions.isEmpty())
      throw new PartitionShapeException("A table needs at least one partition.");

    Set<PartyId> parties = new HashSet<>();
    for (Partition p : partitions)
      if (!parties.add(p.getOwner()))
        throw new PartitionShapeException("Party " + p.getOwner() + " contributes multiple partitions.");

    this.kind = kind;
    this.partitions = ImmutableList.copyOf(partitions);
    this.columns = (kind == PartitionKind.ROW_SPLIT) ? validateRowSplit() : validateColumnSplit();
  }

  public static PartitionedTable rowSplit(Partition... partitions) throws PartitionShapeException {
    return new PartitionedTable(PartitionKind.ROW_SPLIT, Arrays.asList(partitions));
  }

  public static PartitionedTable columnSplit(Partition... partitions) throws PartitionShapeException {
    return new PartitionedTable(PartitionKind.COLUMN_SPLIT, Arrays.asList(partitions));
  }

  private ImmutableList<String> validateRowSplit() throws PartitionShapeException {
    Partition first = partitions.get(0);
    for (Partition p : partitions.subList(1, partitions.size())) {
      if (!p.getColumnNames().equals(first.getColumnNames()))
        throw new PartitionShapeException("Row-split partitions need equal columns, but party " + first.getOwner()
            + " has " + first.getColumnNames() + " and party " + p.getOwner() + " has " + p.getColumnNames());
      if (!p.getColumnTypes().equals(first.getColumnTypes()))
        throw new PartitionShapeException("Row-split partitions need equal column types, but party " + first.getOwner()
            + " has " + first.getColumnTypes() + " and party " + p.getOwner() + " has " + p.getColumnTypes());
    }
    return ImmutableList.copyOf(first.getColumnNames());
  }

  private ImmutableList<String> validateColumnSplit() throws PartitionShapeException {
    Partition first = partitions.get(0);
    Set<String> allColumns = new LinkedHashSet<>();
    for (Partition p : partitions) {
      if (p.getRowCount() != first.getRowCount())
        throw new PartitionShapeException("Column-split partitions need equal row counts, but party "
            + first.getOwner() + " has " + first.getRowCount() + " rows and party " + p.getOwner() + " has "
            + p.getRowCount());
      for (String col : p.getColumnNames())
        if (!allColumns.add(col))
          throw new PartitionShapeException(
              "Column '" + col + "' is held by multiple parties of a column-split table.");
    }
    return ImmutableList.copyOf(allColumns);
  }

  public PartitionKind getKind() {
    return kind;
  }

  public List<Partition> getPartitions() {
    return partitions;
  }

  /**
   * @return The owners of all partitions in partition order.
   */
  public List<PartyId> getParties() {
    return partitions.stream().map(Partition::getOwner).collect(ImmutableList.toImmutableList());
  }

  /**
   * @throws IllegalArgumentException
   *           if the party does not hold a partition of this table.
   */
  public Partition getPartition(PartyId party) throws IllegalArgumentException {
    for (Partition p : partitions)
      if (p.getOwner().equals(party))
        return p;
    throw new IllegalArgumentException("Party " + party + " does not hold a partition of this table.");
  }

  /**
   * @return Ordered column names: The shared column list for {@link PartitionKind#ROW_SPLIT}, the union of the columns
   *         of all partitions in partition order for {@link PartitionKind#COLUMN_SPLIT}.
   */
  public List<String> columns() {
    return columns;
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  /**
   * @throws UnknownColumnException
   *           if the column does not exist.
   */
  public ColumnType getColumnType(String column) throws UnknownColumnException {
    return holdersOf(column).get(0).getColumn(column).getType();
  }

  /**
   * @return Number of rows of the logical dataset.
   */
  public long rowCount() {
    if (kind == PartitionKind.COLUMN_SPLIT)
      return partitions.get(0).getRowCount();
    return partitions.stream().mapToLong(Partition::getRowCount).sum();
  }

  /**
   * @return All partitions that hold the given column, in partition order: All partitions for
   *         {@link PartitionKind#ROW_SPLIT}, exactly one for {@link PartitionKind#COLUMN_SPLIT}.
   * @throws UnknownColumnException
   *           if the column does not exist.
   */
  public List<Partition> holdersOf(String column) throws UnknownColumnException {
    if (!hasColumn(column))
      throw new UnknownColumnException(column);
    return partitions.stream().filter(p -> p.hasColumn(column)).collect(ImmutableList.toImmutableList());
  }

  /**
   * The local values of a column for each party holding it.
   * 
   * <p>
   * This is meant for the party-local computation steps only: In a secure deployment, the local column of a party is
   * only ever read inside the boundary of that party.
   * 
   * @return Party to local column, in partition order.
   * @throws UnknownColumnException
   *           if the column does not exist.
   */
  public Map<PartyId, Column> columnLocalValues(String column) throws UnknownColumnException {
    ImmutableMap.Builder<PartyId, Column> res = ImmutableMap.builder();
    for (Partition p : holdersOf(column))
      res.put(p.getOwner(), p.getColumn(column));
    return res.build();
  }

  /**
   * @return A new table in which the partitions of the given parties are replaced. Partition order, kind and ownership
   *         stay the same.
   * @throws IllegalArgumentException
   *           if a replacement is owned by a different party than its key or the key is not a party of this table.
   * @throws PartitionShapeException
   *           if the resulting partitions do not fit together.
   */
  public PartitionedTable withPartitionsReplaced(Map<PartyId, Partition> replacements)
      throws IllegalArgumentException, PartitionShapeException {
    Set<PartyId> unknown = new HashSet<>(replacements.keySet());
    unknown.removeAll(getParties());
    if (!unknown.isEmpty())
      throw new IllegalArgumentException("Parties " + unknown + " do not hold partitions of this table.");

    List<Partition> res = new ArrayList<>();
    for (Partition p : partitions) {
      Partition replacement = replacements.get(p.getOwner());
      if (replacement == null)
        res.add(p);
      else {
        if (!replacement.getOwner().equals(p.getOwner()))
          throw new IllegalArgumentException(
              "Replacement for party " + p.getOwner() + " is owned by " + replacement.getOwner());
        res.add(replacement);
      }
    }
    return new PartitionedTable(kind, res);
  }

  /**
   * Replaces a column in every partition holding it by the column that the holding party computed locally. The column
   * keeps its position.
   * 
   * @param localColumns
   *          Holding party -> new column. Each new column has the name of the replaced one and the row count of its
   *          partition.
   * @return a new table.
   * @throws UnknownColumnException
   *           if the column does not exist.
   * @throws IllegalArgumentException
   *           if the parties are not exactly the holders of the column or a new column is named differently.
   * @throws PartitionShapeException
   *           if a new column does not fit its partition.
   */
  public PartitionedTable applyElementwise(String column, Map<PartyId, Column> localColumns)
      throws UnknownColumnException, IllegalArgumentException, PartitionShapeException {
    validateHolders(column, localColumns.keySet());
    Map<PartyId, Partition> replacements = new LinkedHashMap<>();
    for (Partition p : holdersOf(column)) {
      Column newColumn = localColumns.get(p.getOwner());
      if (!column.equals(newColumn.getName()))
        throw new IllegalArgumentException(
            "Replacement of column '" + column + "' at " + p.getOwner() + " is named '" + newColumn.getName() + "'");
      replacements.put(p.getOwner(), p.withColumnReplaced(column, newColumn));
    }
    return withPartitionsReplaced(replacements);
  }

  /**
   * Replaces a column in every partition holding it by the list of columns that the holding party computed locally.
   * The new columns are appended at the end of the partitions.
   * 
   * @param localColumns
   *          Holding party -> columns replacing the column.
   * @return a new table.
   * @throws UnknownColumnException
   *           if the column does not exist.
   * @throws IllegalArgumentException
   *           if the parties are not exactly the holders of the column.
   * @throws PartitionShapeException
   *           if the new columns do not fit their partitions.
   */
  public PartitionedTable expandColumn(String column, Map<PartyId, List<Column>> localColumns)
      throws UnknownColumnException, IllegalArgumentException, PartitionShapeException {
    validateHolders(column, localColumns.keySet());
    Map<PartyId, Partition> replacements = new LinkedHashMap<>();
    for (Partition p : holdersOf(column))
      replacements.put(p.getOwner(), p.withColumnExpanded(column, localColumns.get(p.getOwner())));
    return withPartitionsReplaced(replacements);
  }

  private void validateHolders(String column, Set<PartyId> parties)
      throws UnknownColumnException, IllegalArgumentException {
    Set<PartyId> holders = holdersOf(column).stream().map(Partition::getOwner).collect(Collectors.toSet());
    if (!holders.equals(parties))
      throw new IllegalArgumentException(
          "Column '" + column + "' is held by " + holders + ", but results were provided by " + parties);
  }

  /**
   * Column selection.
   * 
   * @return A new table that contains only the given columns. For {@link PartitionKind#COLUMN_SPLIT}, partitions that do
   *         not hold any of the columns are left out.
   * @throws UnknownColumnException
   *           if one of the columns does not exist.
   */
  public PartitionedTable select(Collection<String> columnNames) throws UnknownColumnException {
    for (String col : columnNames)
      if (!hasColumn(col))
        throw new UnknownColumnException(col);

    List<Partition> res = new ArrayList<>();
    for (Partition p : partitions) {
      Partition selected = p.select(columnNames);
      if (selected != null)
        res.add(selected);
    }
    return new PartitionedTable(kind, res);
  }

  public PartitionedTable select(String... columnNames) throws UnknownColumnException {
    return select(Arrays.asList(columnNames));
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof PartitionedTable))
      return false;
    PartitionedTable o = (PartitionedTable) obj;
    return kind == o.kind && partitions.equals(o.partitions);
  }

  @Override
  public int hashCode() {
    return kind.hashCode() ^ partitions.hashCode();
  }

  @Override
  public String toString() {
    return "PartitionedTable[kind=" + kind + ",partitions="
        + partitions.stream().map(Partition::toString).collect(Collectors.joining(",")) + "]";
  }
}
