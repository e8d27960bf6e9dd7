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

import static org.fedqube.transform.TestTables.ALICE;
import static org.fedqube.transform.TestTables.BOB;
import static org.fedqube.transform.TestTables.values;

import java.util.Arrays;
import java.util.List;

import org.fedqube.data.Column;
import org.fedqube.data.ColumnType;
import org.fedqube.data.ColumnTypeException;
import org.fedqube.data.Partition;
import org.fedqube.data.PartitionedTable;
import org.fedqube.execution.PreprocessingOrchestrator;
import org.fedqube.function.ComparisonException;
import org.fedqube.threads.ExecutorManager;
import org.fedqube.transform.NotFittedException;
import org.fedqube.transform.TestTables;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

/**
 * Tests {@link MinMaxScaler}.
 *
 * @author Bastian Gloeckle
 */
public class MinMaxScalerTest {
  private static final double DELTA = 1e-9;

  private ExecutorManager executorManager;
  private PreprocessingOrchestrator orchestrator;

  @BeforeMethod
  public void before() {
    executorManager = new ExecutorManager(4);
    orchestrator = TestTables.plaintextOrchestrator(executorManager);
  }

  @AfterMethod
  public void after() {
    executorManager.shutdownEverything();
  }

  @DataProvider(name = "tables")
  public Object[][] tables() {
    return new Object[][] { { TestTables.rowSplit() }, { TestTables.columnSplit() } };
  }

  @Test(dataProvider = "tables")
  public void scalesIntoUnitRange(PartitionedTable table) {
    // GIVEN
    MinMaxScaler scaler = new MinMaxScaler(orchestrator);

    // WHEN
    PartitionedTable res = scaler.fitTransform(table, "sepal_length");

    // THEN
    List<Object> scaled = values(res, "sepal_length");
    Assert.assertEquals(scaled.get(0), 1.0, "Expected max row to be 1");
    Assert.assertEquals(scaled.get(3), 0.0, "Expected min row to be 0");
    Assert.assertEquals((double) scaled.get(1), 0.6, DELTA);
    for (Object v : scaled)
      Assert.assertTrue((double) v >= 0. && (double) v <= 1., "Value out of range: " + v);
    Assert.assertEquals(scaler.getDataMin("sepal_length"), 4.6);
    Assert.assertEquals(scaler.getDataMax("sepal_length"), 5.1);
    Assert.assertEquals(res.getKind(), table.getKind());
    Assert.assertEquals(values(res, "sepal_width"), values(table, "sepal_width"), "Expected unfitted column unchanged");
  }

  @Test(dataProvider = "tables")
  public void missingStaysMissing(PartitionedTable table) {
    // WHEN
    PartitionedTable res = new MinMaxScaler(orchestrator).fitTransform(table, "sepal_width", "petals");

    // THEN
    List<Object> widths = values(res, "sepal_width");
    Assert.assertNull(widths.get(1));
    Assert.assertEquals(widths.get(4), 1.0);
    Assert.assertEquals(values(res, "petals"), Arrays.asList(0.0, 0.25, null, 0.75, 1.0));
    Assert.assertEquals(res.getColumnType("petals"), ColumnType.DOUBLE);
  }

  @Test
  public void sameResultForBothKinds() {
    // WHEN
    PartitionedTable rows = new MinMaxScaler(orchestrator).fitTransform(TestTables.rowSplit());
    PartitionedTable cols = new MinMaxScaler(orchestrator).fitTransform(TestTables.columnSplit());

    // THEN
    for (String column : rows.columns())
      TestTables.assertSameValues(values(rows, column), values(cols, column), "Different results for column " + column);
  }

  @Test
  public void featureRange() {
    // WHEN
    PartitionedTable res = new MinMaxScaler(orchestrator, -1., 1.).fitTransform(TestTables.rowSplit(), "petals");

    // THEN
    Assert.assertEquals(values(res, "petals"), Arrays.asList(-1.0, -0.5, null, 0.5, 1.0));
  }

  @Test
  public void constantColumnMapsToZero() {
    // GIVEN
    PartitionedTable table = PartitionedTable.rowSplit( //
        new Partition(ALICE, Column.ofDoubles("c", 2., 2.)), //
        new Partition(BOB, Column.ofDoubles("c", 2., null)));

    // WHEN
    PartitionedTable res = new MinMaxScaler(orchestrator).fitTransform(table, "c");

    // THEN
    Assert.assertEquals(values(res, "c"), Arrays.asList(0.0, 0.0, 0.0, null));
  }

  @Test
  public void transformIsIdempotent() {
    // GIVEN
    MinMaxScaler scaler = new MinMaxScaler(orchestrator);
    scaler.fit(TestTables.columnSplit(), "sepal_width");

    // WHEN / THEN
    Assert.assertEquals(scaler.transform(TestTables.columnSplit()), scaler.transform(TestTables.columnSplit()));
  }

  @Test(expectedExceptions = ColumnTypeException.class)
  public void stringColumnFails() {
    new MinMaxScaler(orchestrator).fit(TestTables.rowSplit(), "species");
  }

  @Test(expectedExceptions = ComparisonException.class)
  public void columnWithoutValuesFails() {
    PartitionedTable table = PartitionedTable.columnSplit( //
        new Partition(ALICE, Column.ofDoubles("a", (Double) null)), //
        new Partition(BOB, Column.ofDoubles("b", 1.)));

    new MinMaxScaler(orchestrator).fit(table, "a");
  }

  @Test(expectedExceptions = NotFittedException.class)
  public void dataMinBeforeFit() {
    new MinMaxScaler(orchestrator).getDataMin("sepal_length");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void emptyRangeFails() {
    new MinMaxScaler(orchestrator, 1., 1.);
  }
}
