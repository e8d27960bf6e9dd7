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

/**
 * The partitions of a {@link PartitionedTable} do not fit together: Row-split partitions with differing columns,
 * column-split partitions with differing row counts, a party contributing twice or columns of different lengths.
 *
 * @author Bastian Gloeckle
 */
public class PartitionShapeException extends PreprocessingException {
  private static final long serialVersionUID = 1L;

  public PartitionShapeException(String msg) {
    super(msg);
  }
}
