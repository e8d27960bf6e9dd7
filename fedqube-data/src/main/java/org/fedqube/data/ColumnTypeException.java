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
 * A value does not fit into a column of a specific {@link ColumnType} or an operation is not supported on columns of
 * that type.
 *
 * @author Bastian Gloeckle
 */
public class ColumnTypeException extends PreprocessingException {
  private static final long serialVersionUID = 1L;

  public ColumnTypeException(String msg) {
    super(msg);
  }

  public ColumnTypeException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
