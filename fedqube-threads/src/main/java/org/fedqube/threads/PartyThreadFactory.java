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
package org.fedqube.threads;

import java.util.concurrent.ThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ThreadFactory} that installs an uncaught exception handler for each created {@link Thread} that logs which
 * call the failing thread belonged to.
 *
 * <p>
 * Failures of party tasks are usually reported through their futures; this handler only catches errors thrown outside
 * of a task.
 *
 * @author Bastian Gloeckle
 */
public class PartyThreadFactory implements ThreadFactory {
  private static final Logger logger = LoggerFactory.getLogger(PartyThreadFactory.class);

  private ThreadFactory delegate;
  private String callName;

  public PartyThreadFactory(ThreadFactory delegate, String callName) {
    this.delegate = delegate;
    this.callName = callName;
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread res = delegate.newThread(r);
    res.setDaemon(true);
    res.setUncaughtExceptionHandler(
        (t, e) -> logger.error("Unhandled exception in thread {} of call {}", t.getName(), callName, e));
    return res;
  }
}
