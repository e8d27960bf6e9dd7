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

import org.fedqube.data.PreprocessingException;

/**
 * A party-local computation failed for a reason that is not a {@link RuntimeException} itself, or the wait for the
 * party-local computations was interrupted.
 *
 * @author Bastian Gloeckle
 */
public class LocalComputationException extends PreprocessingException {
  private static final long serialVersionUID = 1L;

  public LocalComputationException(String msg) {
    super(msg);
  }

  public LocalComputationException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
