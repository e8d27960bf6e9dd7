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
package org.fedqube.function.aggregate;

import java.security.SecureRandom;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.bouncycastle.crypto.agreement.DHStandardGroups;
import org.bouncycastle.crypto.params.DHPublicKeyParameters;
import org.fedqube.data.PartyId;
import org.fedqube.function.AggregationException;
import org.fedqube.function.PartyAggregator;
import org.fedqube.util.FixedPointEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

/**
 * {@link PartyAggregator} that hides the partial result of each party from the aggregating side by pairwise masking.
 * 
 * <p>
 * On construction, a {@link Masker} is created for each participant and the participants exchange their public keys.
 * For each reduction, every participant then encodes its partial result into the ring of 64 bit integers (see
 * {@link FixedPointEncoding}) and masks it. Only the masked vectors are summed up, the masks cancel out in that sum.
 * 
 * <p>
 * Participants that did not provide a partial result for a reduction (e.g. because they do not hold the column in a
 * column-split table) contribute a masked zero vector, which keeps the mask streams of all pairs in sync.
 * 
 * <p>
 * {@link #union(Map)} reveals the values of each party, as the categories it combines are public in the result anyway.
 * 
 * <p>
 * Reductions of one instance are executed sequentially.
 *
 * @author Bastian Gloeckle
 */
public class SecureAggregator implements PartyAggregator {
  private static final Logger logger = LoggerFactory.getLogger(SecureAggregator.class);

  public static final int DEFAULT_FRACTION_PRECISION = 7;

  private final ImmutableMap<PartyId, Masker> maskers;
  private final FixedPointEncoding encoding;
  private final PlaintextAggregator plaintextAggregator = new PlaintextAggregator();

  public SecureAggregator(List<PartyId> participants) throws AggregationException {
    this(participants, DEFAULT_FRACTION_PRECISION);
  }

  /**
   * @param participants
   *          All parties that may provide partial results.
   * @param fractionPrecision
   *          Number of decimal digits after the dot that are kept of floating point values.
   * @throws AggregationException
   *           if there are no participants, duplicate participants or the precision is invalid.
   */
  public SecureAggregator(List<PartyId> participants, int fractionPrecision) throws AggregationException {
    if (participants == null || participants.isEmpty())
      throw new AggregationException("Secure aggregation needs at least one participant.");
    try {
      encoding = new FixedPointEncoding(fractionPrecision);
    } catch (IllegalArgumentException e) {
      throw new AggregationException("Invalid fraction precision.", e);
    }

    SecureRandom random = new SecureRandom();
    Map<PartyId, Masker> newMaskers = new LinkedHashMap<>();
    for (PartyId party : participants) {
      if (newMaskers.containsKey(party))
        throw new AggregationException("Participant " + party + " is listed multiple times.");
      newMaskers.put(party, new Masker(party, DHStandardGroups.rfc3526_2048, random));
    }

    Map<PartyId, DHPublicKeyParameters> publicKeys = new LinkedHashMap<>();
    for (Masker masker : newMaskers.values())
      publicKeys.put(masker.getParty(), masker.getPublicKey());
    for (Masker masker : newMaskers.values())
      masker.agree(publicKeys);

    maskers = ImmutableMap.copyOf(newMaskers);
    logger.debug("Secure aggregation set up for participants {} with {}", maskers.keySet(), encoding);
  }

  public Set<PartyId> getParticipants() {
    return maskers.keySet();
  }

  @Override
  public double[] sum(Map<PartyId, double[]> partials) throws AggregationException {
    int length = Partials.validateVectors(partials);
    validateParticipants(partials);

    Map<PartyId, long[]> encoded = new LinkedHashMap<>();
    for (Entry<PartyId, double[]> e : partials.entrySet())
      encoded.put(e.getKey(), encode(e.getValue()));
    return encoding.decode(maskedSum(encoded, length));
  }

  @Override
  public long count(Map<PartyId, Long> partials) throws AggregationException {
    Partials.validateNotEmpty(partials);
    validateParticipants(partials);

    Map<PartyId, long[]> encoded = new LinkedHashMap<>();
    for (Entry<PartyId, Long> e : partials.entrySet())
      encoded.put(e.getKey(), new long[] { e.getValue() });
    return maskedSum(encoded, 1)[0];
  }

  @Override
  public double[] average(Map<PartyId, double[]> partials, Map<PartyId, Double> weights)
      throws AggregationException {
    int length = Partials.validateVectors(partials);
    validateParticipants(partials);

    double weightSum;
    Map<PartyId, long[]> encoded = new LinkedHashMap<>();
    if (weights == null) {
      weightSum = partials.size();
      for (Entry<PartyId, double[]> e : partials.entrySet())
        encoded.put(e.getKey(), encode(e.getValue()));
    } else {
      weightSum = Partials.validateWeights(partials, weights);
      for (Entry<PartyId, double[]> e : partials.entrySet()) {
        double w = weights.get(e.getKey());
        double[] weighted = new double[length];
        for (int i = 0; i < length; i++)
          weighted[i] = w * e.getValue()[i];
        encoded.put(e.getKey(), encode(weighted));
      }
    }

    double[] res = encoding.decode(maskedSum(encoded, length));
    for (int i = 0; i < length; i++)
      res[i] /= weightSum;
    return res;
  }

  @Override
  public <T> List<T> union(Map<PartyId, List<T>> partials) throws AggregationException {
    Partials.validateNotEmpty(partials);
    validateParticipants(partials);
    return plaintextAggregator.union(partials);
  }

  /**
   * Let each participant mask its encoded values. Participants without values mask a zero vector.
   * 
   * @return participant -> masked vector, these are the only values the aggregating side sees.
   */
  /* package */ synchronized Map<PartyId, long[]> maskAll(Map<PartyId, long[]> encoded, int length) {
    Map<PartyId, long[]> res = new LinkedHashMap<>();
    for (Masker masker : maskers.values()) {
      long[] values = encoded.get(masker.getParty());
      if (values == null)
        values = new long[length];
      res.put(masker.getParty(), masker.mask(values));
    }
    logger.trace("Masked vectors of length {} of participants {}", length, res.keySet());
    return res;
  }

  /**
   * @throws AggregationException
   *           if an encoded value is so large that the sum over all participants could exceed the range of long.
   */
  private long[] maskedSum(Map<PartyId, long[]> encoded, int length) throws AggregationException {
    validateRange(encoded);
    long[] res = new long[length];
    for (long[] masked : maskAll(encoded, length).values())
      for (int i = 0; i < length; i++)
        res[i] += masked[i];
    return res;
  }

  /**
   * The sum of the masked values wraps around silently, so each encoded value must be small enough that the sum of the
   * values of all participants still fits into a long.
   */
  private void validateRange(Map<PartyId, long[]> encoded) throws AggregationException {
    long bound = Long.MAX_VALUE / maskers.size();
    for (Entry<PartyId, long[]> e : encoded.entrySet())
      for (long v : e.getValue())
        if (v > bound || v < -bound)
          throw new AggregationException("Value of party " + e.getKey()
              + " is too large for secure aggregation between " + maskers.size() + " participants with " + encoding
              + ".");
  }

  private long[] encode(double[] values) throws AggregationException {
    try {
      return encoding.encode(values);
    } catch (IllegalArgumentException e) {
      throw new AggregationException("Cannot encode values for secure aggregation: " + e.getMessage(), e);
    }
  }

  private void validateParticipants(Map<PartyId, ?> partials) throws AggregationException {
    for (PartyId party : partials.keySet())
      if (!maskers.containsKey(party))
        throw new AggregationException("Party " + party + " is not a participant of this secure aggregation.");
  }
}
