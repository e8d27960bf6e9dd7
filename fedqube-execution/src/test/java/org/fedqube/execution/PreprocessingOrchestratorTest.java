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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.fedqube.data.Column;
import org.fedqube.data.ColumnType;
import org.fedqube.data.ColumnTypeException;
import org.fedqube.data.Partition;
import org.fedqube.data.PartitionedTable;
import org.fedqube.data.PartyId;
import org.fedqube.data.UnknownColumnException;
import org.fedqube.function.ComparisonException;
import org.fedqube.function.PartyAggregator;
import org.fedqube.function.PartyComparator;
import org.fedqube.function.aggregate.PlaintextAggregator;
import org.fedqube.function.compare.PlaintextComparator;
import org.fedqube.threads.ExecutorManager;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableSet;

/**
 * Tests {@link PreprocessingOrchestrator}.
 *
 * @author Bastian Gloeckle
 */
public class PreprocessingOrchestratorTest {
  private static final PartyId ALICE = PartyId.of("alice");
  private static final PartyId BOB = PartyId.of("bob");

  private ExecutorManager executorManager;
  private PreprocessingOrchestrator orchestrator;

  @BeforeMethod
  public void before() {
    executorManager = new ExecutorManager(4);
    orchestrator = new PreprocessingOrchestrator(executorManager, new PlaintextAggregator(), new PlaintextComparator());
  }

  @AfterMethod
  public void after() {
    executorManager.shutdownEverything();
  }

  private PartitionedTable rowSplit() {
    return PartitionedTable.rowSplit( //
        new Partition(ALICE, Column.ofDoubles("x", 3.5, null, 3.2), Column.ofStrings("s", "b", "a", "b")), //
        new Partition(BOB, Column.ofDoubles("x", 3.1, 3.6), Column.ofStrings("s", null, "c")));
  }

  private PartitionedTable columnSplit() {
    return PartitionedTable.columnSplit( //
        new Partition(ALICE, Column.ofDoubles("x", 3.5, null, 3.2, 3.1, 3.6)), //
        new Partition(BOB, Column.ofStrings("s", "b", "a", "b", null, "c")));
  }

  @Test
  public void reductionsForBothKinds() {
    for (PartitionedTable table : Arrays.asList(rowSplit(), columnSplit())) {
      Assert.assertEquals(orchestrator.globalCount(table, "x"), 4L, "Wrong count for " + table.getKind());
      Assert.assertEquals(orchestrator.globalSum(table, "x"), 13.4, 1e-9, "Wrong sum for " + table.getKind());
      Assert.assertEquals(orchestrator.globalMean(table, "x"), 3.35, 1e-9, "Wrong mean for " + table.getKind());
      Assert.assertEquals(orchestrator.globalMin(table, "x"), 3.1, "Wrong min for " + table.getKind());
      Assert.assertEquals(orchestrator.globalMax(table, "x"), 3.6, "Wrong max for " + table.getKind());
      Assert.assertEquals(orchestrator.globalCategories(table, "s"), Arrays.asList("b", "a", "c"),
          "Wrong categories for " + table.getKind());
    }
  }

  @Test
  public void computeLocalOnlyAtHolders() {
    // WHEN
    Map<PartyId, Integer> res = orchestrator.computeLocal(columnSplit(), "s", Column::size);

    // THEN
    Assert.assertEquals(res.keySet(), ImmutableSet.of(BOB));
    Assert.assertEquals((int) res.get(BOB), 5);
  }

  @Test
  public void computeLocalKeepsPartitionOrder() throws InterruptedException {
    // GIVEN: alice finishes after bob
    CountDownLatch bobDone = new CountDownLatch(1);

    // WHEN
    Map<PartyId, Integer> res = orchestrator.computeLocal(rowSplit(), "x", col -> {
      if (col.size() == 3) {
        try {
          bobDone.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          throw new IllegalStateException(e);
        }
      } else
        bobDone.countDown();
      return col.size();
    });

    // THEN
    Assert.assertEquals(res.keySet().iterator().next(), ALICE);
  }

  @Test
  public void reductionsUseCapabilities() {
    // GIVEN
    PartyAggregator aggregator = mock(PartyAggregator.class);
    PartyComparator comparator = mock(PartyComparator.class);
    when(aggregator.count(any())).thenReturn(4L);
    when(comparator.min(any())).thenReturn(3.1);
    PreprocessingOrchestrator mocked = new PreprocessingOrchestrator(executorManager, aggregator, comparator);

    // WHEN
    long count = mocked.globalCount(rowSplit(), "x");
    double min = mocked.globalMin(rowSplit(), "x");

    // THEN
    Assert.assertEquals(count, 4L);
    Assert.assertEquals(min, 3.1);
    verify(aggregator, times(1)).count(any());
    verify(comparator, times(1)).min(any());
    verify(comparator, never()).max(any());
  }

  @Test
  public void failureCancelsOtherParties() throws InterruptedException {
    // GIVEN
    AtomicBoolean interrupted = new AtomicBoolean(false);
    CountDownLatch aliceStarted = new CountDownLatch(1);
    CountDownLatch aliceFinished = new CountDownLatch(1);

    // WHEN
    try {
      orchestrator.computeLocal(rowSplit(), "x", col -> {
        if (col.size() == 3) {
          aliceStarted.countDown();
          try {
            Thread.sleep(10_000);
          } catch (InterruptedException e) {
            interrupted.set(true);
          } finally {
            aliceFinished.countDown();
          }
          return 0;
        }
        try {
          aliceStarted.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          throw new IllegalStateException(e);
        }
        throw new IllegalArgumentException("bob failed");
      });
      Assert.fail("Expected exception");
    } catch (IllegalArgumentException e) {
      // THEN
      Assert.assertEquals(e.getMessage(), "bob failed", "Expected original exception to be rethrown");
    }
    Assert.assertTrue(aliceFinished.await(5, TimeUnit.SECONDS), "Expected alice to be cancelled");
    Assert.assertTrue(interrupted.get(), "Expected alice to be interrupted");
  }

  @Test
  public void broadcastElementwise() {
    for (PartitionedTable table : Arrays.asList(rowSplit(), columnSplit())) {
      // WHEN
      PartitionedTable res =
          orchestrator.broadcastElementwise(table, "x", ColumnType.DOUBLE, v -> v == null ? 10. : v);

      // THEN
      Assert.assertEquals(res.getKind(), table.getKind());
      Assert.assertEquals(res.columns(), table.columns());
      Assert.assertEquals(orchestrator.globalCount(res, "x"), 5L, "Expected no missing values in " + table.getKind());
      Assert.assertEquals(res.columnLocalValues("s"), table.columnLocalValues("s"), "Expected s to be untouched");
    }
  }

  @Test
  public void broadcastExpansion() {
    // WHEN
    PartitionedTable res = orchestrator.broadcastExpansion(columnSplit(), "s", col -> Arrays.asList( //
        col.map("s_b", ColumnType.LONG, v -> "b".equals(v) ? 1L : 0L), //
        col.map("s_len", ColumnType.LONG, v -> v == null ? 0L : (long) ((String) v).length())));

    // THEN
    List<String> expected = Arrays.asList("x", "s_b", "s_len");
    Assert.assertEquals(res.columns(), expected);
    Assert.assertEquals(res.columnLocalValues("s_b").get(BOB), Column.ofLongs("s_b", 1L, 0L, 1L, 0L, 0L));
  }

  @Test(expectedExceptions = ColumnTypeException.class)
  public void sumOfStringColumnFails() {
    orchestrator.globalSum(rowSplit(), "s");
  }

  @Test(expectedExceptions = UnknownColumnException.class)
  public void unknownColumnFails() {
    orchestrator.globalMin(rowSplit(), "nope");
  }

  @Test
  public void negativeZeroIsOneCategory() {
    // GIVEN
    PartitionedTable table = PartitionedTable.rowSplit( //
        new Partition(ALICE, Column.ofDoubles("x", -0.0, 1.5)), //
        new Partition(BOB, Column.ofDoubles("x", 0.0)));

    // WHEN
    List<Object> res = orchestrator.globalCategories(table, "x");

    // THEN
    Assert.assertEquals(res, Arrays.asList(0.0, 1.5));
    Assert.assertEquals(Double.doubleToLongBits((Double) res.get(0)), Double.doubleToLongBits(0.0),
        "Expected positive zero");
  }

  @Test(expectedExceptions = ComparisonException.class)
  public void minOfEmptyColumnFails() {
    PartitionedTable table = PartitionedTable.rowSplit( //
        new Partition(ALICE, Column.ofDoubles("x", (Double) null)), //
        new Partition(BOB, Column.ofDoubles("x", (Double) null)));

    orchestrator.globalMin(table, "x");
  }

  @Test
  public void poolsAreShutDown() throws InterruptedException {
    // WHEN
    orchestrator.globalSum(rowSplit(), "x");

    // THEN
    for (int i = 0; i < 50 && executorManager.getNumberOfActiveExecutors() > 0; i++)
      Thread.sleep(20);
    Assert.assertEquals(executorManager.getNumberOfActiveExecutors(), 0, "Expected all pools to be terminated");
  }
}
