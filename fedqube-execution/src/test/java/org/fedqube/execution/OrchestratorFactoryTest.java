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

import java.util.Arrays;

import org.fedqube.context.Profiles;
import org.fedqube.data.Column;
import org.fedqube.data.Partition;
import org.fedqube.data.PartitionedTable;
import org.fedqube.data.PartyId;
import org.fedqube.function.aggregate.SecureAggregator;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests that {@link OrchestratorFactory} is wired by the context and creates working orchestrators.
 *
 * @author Bastian Gloeckle
 */
public class OrchestratorFactoryTest {
  private static final PartyId ALICE = PartyId.of("alice");
  private static final PartyId BOB = PartyId.of("bob");

  private AnnotationConfigApplicationContext context;

  @BeforeMethod
  public void before() {
    context = new AnnotationConfigApplicationContext();
    context.getEnvironment().setActiveProfiles(Profiles.ALL);
    context.scan("org.fedqube");
    context.refresh();
  }

  @AfterMethod
  public void after() {
    context.close();
  }

  private PartitionedTable table() {
    return PartitionedTable.columnSplit( //
        new Partition(ALICE, Column.ofDoubles("x", 1.5, 2.5)), //
        new Partition(BOB, Column.ofDoubles("y", 10., null)));
  }

  @Test
  public void plaintextOrchestrator() {
    // GIVEN
    OrchestratorFactory factory = context.getBean(OrchestratorFactory.class);

    // WHEN
    PreprocessingOrchestrator orchestrator = factory.createPlaintextOrchestrator();

    // THEN
    Assert.assertEquals(orchestrator.globalSum(table(), "x"), 4.);
    Assert.assertEquals(orchestrator.globalMean(table(), "y"), 10.);
  }

  @Test
  public void secureAggregationOrchestrator() {
    // GIVEN
    OrchestratorFactory factory = context.getBean(OrchestratorFactory.class);

    // WHEN
    PreprocessingOrchestrator orchestrator = factory.createSecureAggregationOrchestrator(Arrays.asList(ALICE, BOB));

    // THEN
    Assert.assertTrue(orchestrator.getAggregator() instanceof SecureAggregator);
    Assert.assertEquals(orchestrator.globalSum(table(), "x"), 4., 1e-6);
    Assert.assertEquals(orchestrator.globalCount(table(), "y"), 1L);
  }
}
