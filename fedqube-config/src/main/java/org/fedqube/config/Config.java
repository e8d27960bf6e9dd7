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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotate a field of a bean with this in order to get the current configuration value of the given key wired.
 * 
 * <p>
 * Supported field types are int, long, double, boolean and String (and their boxed variants).
 *
 * @author Bastian Gloeckle
 */
@Target({ ElementType.FIELD })
@Retention(RetentionPolicy.RUNTIME)
public @interface Config {
  /**
   * @return The config key, see {@link ConfigKey}.
   */
  String value();
}
