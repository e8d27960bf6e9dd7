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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Tests {@link PartitionedTable}.
 *
 * @author Bastian Gloeckle
 */
public class PartitionedTableTest {
  private static final PartyId ALICE = PartyId.of("alice");
  private static final PartyId BOB = PartyId.of("bob");

  private PartitionedTable rowSplit() {
    return PartitionedTable.rowSplit( //
        new Partition(ALICE, Column.ofDoubles("x", 1.0, 2.0, 3.0), Column.ofStrings("s", "a", "b", "c")), //
        new Partition(BOB, Column.ofDoubles("x", 4.0, 5.0), Column.ofStrings("s", "d", "e")));
  }

  private PartitionedTable columnSplit() {
    return PartitionedTable.columnSplit( //
        new Partition(ALICE, Column.ofDoubles("x", 1.0, 2.0, 3.0, 4.0, 5.0)), //
        new Partition(BOB, Column.ofStrings("s", "a", "b", "c", "d", "e"), Column.ofLongs("l", 1L, 2L, 3L, 4L, 5L)));
  }

  @Test
  public void rowSplitShape() {
    PartitionedTable table = rowSplit();

    Assert.assertEquals(table.columns(), Arrays.asList("x", "s"));
    Assert.assertEquals(table.rowCount(), 5L);
    Assert.assertEquals(table.getParties(), Arrays.asList(ALICE, BOB));
    Assert.assertEquals(table.columnLocalValues("x").keySet(), ImmutableSet.of(ALICE, BOB));
  }

  @Test
  public void columnSplitShape() {
    PartitionedTable table = columnSplit();

    Assert.assertEquals(table.columns(), Arrays.asList("x", "s", "l"));
    Assert.assertEquals(table.rowCount(), 5L);
    Map<PartyId, Column> local = table.columnLocalValues("s");
    Assert.assertEquals(local.size(), 1, "Expected only one holder in a column-split table");
    Assert.assertTrue(local.containsKey(BOB));
    Assert.assertEquals(table.getColumnType("l"), ColumnType.LONG);
  }

  @Test
  public void localValuesAreInPartitionOrder() {
    PartitionedTable table = PartitionedTable.rowSplit( //
        new Partition(BOB, Column.ofLongs("a", 1L)), //
        new Partition(ALICE, Column.ofLongs("a", 2L)));

    Assert.assertEquals(table.columnLocalValues("a").keySet().iterator().next(), BOB);
  }

  @Test(expectedExceptions = PartitionShapeException.class)
  public void rowSplitWithDifferentColumnsFails() {
    PartitionedTable.rowSplit( //
        new Partition(ALICE, Column.ofLongs("a", 1L)), //
        new Partition(BOB, Column.ofLongs("b", 1L)));
  }

  @Test(expectedExceptions = PartitionShapeException.class)
  public void rowSplitWithDifferentTypesFails() {
    PartitionedTable.rowSplit( //
        new Partition(ALICE, Column.ofLongs("a", 1L)), //
        new Partition(BOB, Column.ofDoubles("a", 1.0)));
  }

  @Test(expectedExceptions = PartitionShapeException.class)
  public void columnSplitWithDifferentRowCountsFails() {
    PartitionedTable.columnSplit( //
        new Partition(ALICE, Column.ofLongs("a", 1L, 2L)), //
        new Partition(BOB, Column.ofLongs("b", 1L)));
  }

  @Test(expectedExceptions = PartitionShapeException.class)
  public void columnSplitWithSharedColumnFails() {
    PartitionedTable.columnSplit( //
        new Partition(ALICE, Column.ofLongs("a", 1L)), //
        new Partition(BOB, Column.ofLongs("a", 1L)));
  }

  @Test(expectedExceptions = PartitionShapeException.class)
  public void duplicatePartyFails() {
    PartitionedTable.rowSplit( //
        new Partition(ALICE, Column.ofLongs("a", 1L)), //
        new Partition(ALICE, Column.ofLongs("a", 1L)));
  }

  @Test(expectedExceptions = UnknownColumnException.class)
  public void unknownColumnFails() {
    rowSplit().columnLocalValues("nope");
  }

  @Test
  public void applyElementwiseKeepsKindAndOwnership() {
    for (PartitionedTable table : Arrays.asList(rowSplit(), columnSplit())) {
      // GIVEN
      Map<PartyId, Column> newColumns = new LinkedHashMap<>();
      for (Entry<PartyId, Column> e : table.columnLocalValues("x").entrySet())
        newColumns.put(e.getKey(), e.getValue().map("x", ColumnType.DOUBLE, v -> ((Double) v) * 10));

      // WHEN
      PartitionedTable res = table.applyElementwise("x", newColumns);

      // THEN
      Assert.assertEquals(res.getKind(), table.getKind());
      Assert.assertEquals(res.getParties(), table.getParties());
      Assert.assertEquals(res.columns(), table.columns());
      Assert.assertEquals(res.columnLocalValues("x").get(ALICE).getValue(0), 10.0);
      Assert.assertEquals(table.columnLocalValues("x").get(ALICE).getValue(0), 1.0, "Expected input unchanged");
    }
  }

  @Test
  public void expandColumnInColumnSplit() {
    // GIVEN
    PartitionedTable table = columnSplit();
    Column s = table.columnLocalValues("s").get(BOB);

    // WHEN
    PartitionedTable res = table.expandColumn("s",
        ImmutableMap.of(BOB, Arrays.asList(s.map("s_a", ColumnType.LONG, v -> "a".equals(v) ? 1L : 0L))));

    // THEN
    Assert.assertEquals(res.columns(), Arrays.asList("x", "l", "s_a"));
    Assert.assertEquals(res.getPartition(BOB).getColumnNames(), Arrays.asList("l", "s_a"));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void applyElementwiseWithMissingHolderFails() {
    // GIVEN
    PartitionedTable table = rowSplit();
    Column x = table.columnLocalValues("x").get(ALICE);

    // WHEN
    // bob holds rows of "x" as well, but does not provide a result.
    table.applyElementwise("x", ImmutableMap.of(ALICE, x));

    // THEN: exception
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void applyElementwiseFromNonHolderFails() {
    // GIVEN
    PartitionedTable table = columnSplit();
    Column x = table.columnLocalValues("x").get(ALICE);

    // WHEN
    table.applyElementwise("x", ImmutableMap.of(ALICE, x, BOB, x));

    // THEN: exception
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void applyElementwiseWithRenamedColumnFails() {
    // GIVEN
    PartitionedTable table = columnSplit();
    Column x = table.columnLocalValues("x").get(ALICE);

    // WHEN
    table.applyElementwise("x", ImmutableMap.of(ALICE, x.map("y", ColumnType.DOUBLE, v -> v)));

    // THEN: exception
  }

  @Test
  public void select() {
    // WHEN
    PartitionedTable res = columnSplit().select("l");

    // THEN
    List<Partition> partitions = res.getPartitions();
    Assert.assertEquals(partitions.size(), 1, "Expected partitions without selected columns to be removed");
    Assert.assertEquals(res.columns(), Arrays.asList("l"));
    Assert.assertEquals(rowSplit().select("s").columns(), Arrays.asList("s"));
  }
}
