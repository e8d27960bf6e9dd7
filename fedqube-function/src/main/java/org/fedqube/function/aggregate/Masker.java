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

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.security.SecureRandom;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.agreement.DHBasicAgreement;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.DHKeyPairGenerator;
import org.bouncycastle.crypto.params.DHKeyGenerationParameters;
import org.bouncycastle.crypto.params.DHParameters;
import org.bouncycastle.crypto.params.DHPublicKeyParameters;
import org.bouncycastle.crypto.prng.DigestRandomGenerator;
import org.fedqube.data.PartyId;

/**
 * The part of the secure aggregation that runs at a single party: Holds the Diffie-Hellman key pair of the party and one
 * mask generator per peer.
 * 
 * <p>
 * Both parties of a pair seed their generator with the same shared secret, so they draw identical masks. The party with
 * the greater id adds the mask, the other one subtracts it, which makes all masks cancel out in the sum over all
 * parties. This only holds as long as every party masks exactly one vector of the same length per aggregation.
 *
 * @author Bastian Gloeckle
 */
public class Masker {
  private final PartyId party;
  private final DHParameters dhParameters;
  private final AsymmetricCipherKeyPair keyPair;
  private Map<PartyId, DigestRandomGenerator> maskGenerators;

  /* package */ Masker(PartyId party, DHParameters dhParameters, SecureRandom random) {
    this.party = party;
    this.dhParameters = dhParameters;
    DHKeyPairGenerator keyPairGenerator = new DHKeyPairGenerator();
    keyPairGenerator.init(new DHKeyGenerationParameters(random, dhParameters));
    keyPair = keyPairGenerator.generateKeyPair();
  }

  public PartyId getParty() {
    return party;
  }

  public DHPublicKeyParameters getPublicKey() {
    return (DHPublicKeyParameters) keyPair.getPublic();
  }

  /**
   * Derives the shared secrets with all peers and initializes the mask generators.
   * 
   * @param publicKeys
   *          Public keys of all participants. The entry of this party itself is ignored.
   * @throws IllegalArgumentException
   *           if a public key does not belong to the same Diffie-Hellman group.
   */
  /* package */ void agree(Map<PartyId, DHPublicKeyParameters> publicKeys) throws IllegalArgumentException {
    Map<PartyId, DigestRandomGenerator> generators = new LinkedHashMap<>();
    for (Entry<PartyId, DHPublicKeyParameters> e : publicKeys.entrySet()) {
      if (e.getKey().equals(party))
        continue;
      if (!dhParameters.equals(e.getValue().getParameters()))
        throw new IllegalArgumentException("Public key of " + e.getKey() + " uses a different group.");

      DHBasicAgreement agreement = new DHBasicAgreement();
      agreement.init(keyPair.getPrivate());
      BigInteger secret = agreement.calculateAgreement(e.getValue());

      DigestRandomGenerator generator = new DigestRandomGenerator(new SHA256Digest());
      generator.addSeedMaterial(secret.toByteArray());
      generators.put(e.getKey(), generator);
    }
    maskGenerators = generators;
  }

  /**
   * @return A masked copy of the given encoded values. Arithmetic wraps around modulo 2^64.
   * @throws IllegalStateException
   *           if {@link #agree(Map)} was not called.
   */
  /* package */ long[] mask(long[] values) throws IllegalStateException {
    if (maskGenerators == null)
      throw new IllegalStateException("Masker of " + party + " did not agree on keys with its peers yet.");

    long[] res = values.clone();
    byte[] buf = new byte[res.length * Long.BYTES];
    for (Entry<PartyId, DigestRandomGenerator> e : maskGenerators.entrySet()) {
      e.getValue().nextBytes(buf);
      ByteBuffer masks = ByteBuffer.wrap(buf);
      boolean add = party.compareTo(e.getKey()) > 0;
      for (int i = 0; i < res.length; i++) {
        long mask = masks.getLong();
        if (add)
          res[i] += mask;
        else
          res[i] -= mask;
      }
    }
    return res;
  }
}
