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
package org.fedqube.function;

import java.util.List;

import org.fedqube.config.Config;
import org.fedqube.config.ConfigKey;
import org.fedqube.context.AutoInstatiate;
import org.fedqube.data.PartyId;
import org.fedqube.function.aggregate.PlaintextAggregator;
import org.fedqube.function.aggregate.SecureAggregator;
import org.fedqube.function.compare.PlaintextComparator;

/**
 * Creates the {@link PartyAggregator}s and {@link PartyComparator}s the preprocessing runs on.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class CapabilityFactory {
  @Config(ConfigKey.SECURE_AGGREGATION_FRACTION_PRECISION)
  private int secureAggregationFractionPrecision;

  /** for context instantiation only, values are wired by the context. */
  public CapabilityFactory() {
  }

  public CapabilityFactory(int secureAggregationFractionPrecision) {
    this.secureAggregationFractionPrecision = secureAggregationFractionPrecision;
  }

  public PartyAggregator createPlaintextAggregator() {
    return new PlaintextAggregator();
  }

  /**
   * @param participants
   *          All parties that will provide partial results to the aggregator.
   * @throws AggregationException
   *           if the participants are invalid.
   */
  public PartyAggregator createSecureAggregator(List<PartyId> participants) throws AggregationException {
    return new SecureAggregator(participants, secureAggregationFractionPrecision);
  }

  public PartyComparator createPlaintextComparator() {
    return new PlaintextComparator();
  }
}
