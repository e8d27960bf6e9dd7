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

import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ThreadPoolExecutor} that executes the party-local tasks of a single fit or transform call.
 *
 * @author Bastian Gloeckle
 */
public class FedqubeFixedThreadPoolExecutor extends ThreadPoolExecutor {

  private static final Logger logger = LoggerFactory.getLogger(FedqubeFixedThreadPoolExecutor.class);

  private String callName;
  private int numberOfThreads;
  private Runnable terminationListener;

  /* package */ FedqubeFixedThreadPoolExecutor(int numberOfThreads, ThreadFactory threadFactory, String callName) {
    super(numberOfThreads, numberOfThreads, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<Runnable>(),
        threadFactory);
    this.numberOfThreads = numberOfThreads;
    this.callName = callName;
  }

  public String getCallName() {
    return callName;
  }

  /* package */ void setTerminationListener(Runnable terminationListener) {
    this.terminationListener = terminationListener;
  }

  @Override
  protected void terminated() {
    super.terminated();
    if (terminationListener != null)
      terminationListener.run();
  }

  @Override
  public List<Runnable> shutdownNow() {
    if (logger.isTraceEnabled() && this.getActiveCount() > 0)
      logger.trace("Interrupting {} active party tasks of call {}", getActiveCount(), callName);
    return super.shutdownNow();
  }

  @Override
  public String toString() {
    return this.getClass().getSimpleName() + "[threads=" + numberOfThreads + ",call=" + callName + "]";
  }
}
