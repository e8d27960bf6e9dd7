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
package org.fedqube.transform.encode;

import org.fedqube.data.PreprocessingException;

/**
 * A value was found that is not a fitted category of its column.
 *
 * @author Bastian Gloeckle
 */
public class UnseenCategoryException extends PreprocessingException {
  private static final long serialVersionUID = 1L;

  private final String columnName;
  private final Object value;

  public UnseenCategoryException(String columnName, Object value) {
    super("Value '" + value + "' of column '" + columnName + "' is not a known category.");
    this.columnName = columnName;
    this.value = value;
  }

  public String getColumnName() {
    return columnName;
  }

  public Object getValue() {
    return value;
  }
}
