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

import java.util.Objects;

/**
 * Identifies a party, which is an independent data holder contributing one {@link Partition} to a
 * {@link PartitionedTable}.
 * 
 * <p>
 * Party IDs are ordered by their name, which gives every pair of parties a well-defined "lower" and "higher" side.
 *
 * @author Bastian Gloeckle
 */
public final class PartyId implements Comparable<PartyId> {
  private final String name;

  private PartyId(String name) {
    this.name = name;
  }

  /**
   * @throws IllegalArgumentException
   *           if the name is null or empty.
   */
  public static PartyId of(String name) throws IllegalArgumentException {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Party name must not be empty.");
    return new PartyId(name);
  }

  public String getName() {
    return name;
  }

  @Override
  public int compareTo(PartyId o) {
    return name.compareTo(o.name);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof PartyId))
      return false;
    return name.equals(((PartyId) obj).name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
