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
 * Base class of all exceptions that fedqube reports while loading, reducing or transforming partitioned data.
 *
 * @author Bastian Gloeckle
 */
public class PreprocessingException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public PreprocessingException(String msg) {
    super(msg);
  }

  public PreprocessingException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
