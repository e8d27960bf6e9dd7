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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Arrays;

import org.fedqube.data.PartitionedTable;
import org.fedqube.data.UnknownColumnException;
import org.fedqube.execution.PreprocessingOrchestrator;
import org.fedqube.function.ComparisonException;
import org.fedqube.function.PartyComparator;
import org.fedqube.function.aggregate.PlaintextAggregator;
import org.fedqube.threads.ExecutorManager;
import org.fedqube.transform.scale.MinMaxScaler;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests the fit lifecycle that {@link AbstractTransformer} provides.
 *
 * @author Bastian Gloeckle
 */
public class AbstractTransformerTest {
  private ExecutorManager executorManager;

  @BeforeMethod
  public void before() {
    executorManager = new ExecutorManager(4);
  }

  @AfterMethod
  public void after() {
    executorManager.shutdownEverything();
  }

  @Test
  public void failedFitKeepsPreviousState() {
    // GIVEN
    PartyComparator comparator = mock(PartyComparator.class);
    when(comparator.min(any())).thenReturn(3.1);
    when(comparator.max(any())).thenReturn(3.6);
    MinMaxScaler scaler = new MinMaxScaler(
        new PreprocessingOrchestrator(executorManager, new PlaintextAggregator(), comparator));
    scaler.fit(TestTables.rowSplit(), "sepal_width");
    TransformerState before = scaler.getState();

    // WHEN
    when(comparator.max(any())).thenThrow(new ComparisonException("comparison failed"));
    try {
      scaler.fit(TestTables.rowSplit(), "sepal_length");
      Assert.fail("Expected fit to fail");
    } catch (ComparisonException e) {
      // expected
    }

    // THEN
    Assert.assertSame(scaler.getState(), before, "Expected previous state to be kept");
    Assert.assertEquals(scaler.getState().getColumns(), Arrays.asList("sepal_width"));
  }

  @Test
  public void unknownColumnFailsBeforeAnyReduction() {
    // GIVEN
    PartyComparator comparator = mock(PartyComparator.class);
    MinMaxScaler scaler = new MinMaxScaler(
        new PreprocessingOrchestrator(executorManager, new PlaintextAggregator(), comparator));

    // WHEN
    try {
      scaler.fit(TestTables.columnSplit(), "sepal_width", "nope");
      Assert.fail("Expected fit to fail");
    } catch (UnknownColumnException e) {
      // THEN
      Assert.assertEquals(e.getColumnName(), "nope");
    }
    Assert.assertFalse(scaler.isFitted());
    verifyNoInteractions(comparator);
  }

  @Test(expectedExceptions = NotFittedException.class)
  public void transformBeforeFit() {
    new MinMaxScaler(TestTables.plaintextOrchestrator(executorManager)).transform(TestTables.rowSplit());
  }

  @Test
  public void fitTransformEqualsFitThenTransform() {
    // GIVEN
    PartitionedTable table = TestTables.columnSplit();
    MinMaxScaler first = new MinMaxScaler(TestTables.plaintextOrchestrator(executorManager));
    MinMaxScaler second = new MinMaxScaler(TestTables.plaintextOrchestrator(executorManager));

    // WHEN
    PartitionedTable res = first.fitTransform(table, "sepal_length");
    second.fit(table, "sepal_length");

    // THEN
    Assert.assertEquals(res, second.transform(table));
  }
}
