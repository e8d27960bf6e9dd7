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
 * Type of a column.
 * 
 * <p>
 * Identifies which java type the cells of a {@link Column} have: {@link String}, {@link Double} or {@link Long}.
 *
 * @author Bastian Gloeckle
 */
public enum ColumnType {
  STRING(String.class), DOUBLE(Double.class), LONG(Long.class);

  private final Class<?> valueClass;

  private ColumnType(Class<?> valueClass) {
    this.valueClass = valueClass;
  }

  public Class<?> getValueClass() {
    return valueClass;
  }

  public boolean isNumeric() {
    return this != STRING;
  }

  /**
   * Converts a value to the java type of this column type.
   * 
   * <p>
   * Numbers are converted between the numeric types; integral numbers are only accepted for {@link #LONG} if they do
   * not have a fractional part. Any value can be converted to {@link #STRING} using its string representation.
   * 
   * @return the converted value, <code>null</code> if value is <code>null</code>.
   * @throws ColumnTypeException
   *           if the value cannot be represented in this type.
   */
  public Object convert(Object value) throws ColumnTypeException {
    if (value == null)
      return null;

    switch (this) {
    case STRING:
      return value.toString();
    case DOUBLE:
      if (value instanceof Number)
        return ((Number) value).doubleValue();
      break;
    case LONG:
      if (value instanceof Long)
        return value;
      if (value instanceof Integer || value instanceof Short || value instanceof Byte)
        return ((Number) value).longValue();
      if (value instanceof Number) {
        double d = ((Number) value).doubleValue();
        if (d == Math.rint(d) && !Double.isInfinite(d))
          return (long) d;
      }
      break;
    }
    throw new ColumnTypeException(
        "Value '" + value + "' of type " + value.getClass().getSimpleName() + " cannot be converted to " + this);
  }
}
