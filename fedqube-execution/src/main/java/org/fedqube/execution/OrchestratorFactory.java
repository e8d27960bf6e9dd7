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

import java.util.List;

import javax.inject.Inject;

import org.fedqube.context.AutoInstatiate;
import org.fedqube.data.PartyId;
import org.fedqube.function.AggregationException;
import org.fedqube.function.CapabilityFactory;
import org.fedqube.function.PartyAggregator;
import org.fedqube.function.PartyComparator;
import org.fedqube.threads.ExecutorManager;

/**
 * Factory for {@link PreprocessingOrchestrator}s.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class OrchestratorFactory {
  @Inject
  private ExecutorManager executorManager;

  @Inject
  private CapabilityFactory capabilityFactory;

  /** for context instantiation only, values are wired by the context. */
  public OrchestratorFactory() {
  }

  public OrchestratorFactory(ExecutorManager executorManager, CapabilityFactory capabilityFactory) {
    this.executorManager = executorManager;
    this.capabilityFactory = capabilityFactory;
  }

  /**
   * @return An orchestrator that aggregates and compares in the clear.
   */
  public PreprocessingOrchestrator createPlaintextOrchestrator() {
    return createOrchestrator(capabilityFactory.createPlaintextAggregator(),
        capabilityFactory.createPlaintextComparator());
  }

  /**
   * @return An orchestrator that aggregates using secure aggregation between the given participants. Comparisons are
   *         executed in the clear.
   * @throws AggregationException
   *           if the participants are invalid.
   */
  public PreprocessingOrchestrator createSecureAggregationOrchestrator(List<PartyId> participants)
      throws AggregationException {
    return createOrchestrator(capabilityFactory.createSecureAggregator(participants),
        capabilityFactory.createPlaintextComparator());
  }

  public PreprocessingOrchestrator createOrchestrator(PartyAggregator aggregator, PartyComparator comparator) {
    return new PreprocessingOrchestrator(executorManager, aggregator, comparator);
  }
}
