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
package org.fedqube.config;

/**
 * Configuration keys which can be used to resolve configuration values.
 * 
 * <p>
 * It's easiest to use these constants with the {@link Config} annotation.
 *
 * @author Bastian Gloeckle
 */
public class ConfigKey {
  /**
   * The maximum number of party-local tasks that are executed concurrently for a single fit or transform call.
   * 
   * <p>
   * Each call to fit or transform starts one task per party that holds the column in question. These tasks are
   * independent of each other and all of them have to finish before the cross-party reduction takes place. If there are
   * more parties than threads, the remaining tasks are queued.
   */
  public static final String PARTY_THREADS_MAX = "partyThreadsMax";

  /**
   * Number of decimal digits after the dot that the secure aggregator keeps when it encodes floating point values into
   * the 64 bit integer ring before masking them.
   * 
   * <p>
   * Higher values are more precise, but reduce the range of values that can be aggregated: The absolute value of each
   * encoded value (value * 10^precision) must not exceed Long.MAX_VALUE / number of participants, so that the sum fits
   * into a signed 64 bit integer.
   */
  public static final String SECURE_AGGREGATION_FRACTION_PRECISION = "secureAggregationFractionPrecision";
}
