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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

import javax.annotation.PreDestroy;

import org.fedqube.config.Config;
import org.fedqube.config.ConfigKey;
import org.fedqube.context.AutoInstatiate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Manages the {@link ExecutorService}s that execute party-local work.
 * 
 * <p>
 * Each fit or transform call gets its own fixed thread pool (see {@link #newPartyFixedThreadPool(String, int)}), which
 * the caller shuts down after the call. Pools that are still alive when the context shuts down are terminated.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class ExecutorManager {
  private static final Logger logger = LoggerFactory.getLogger(ExecutorManager.class);

  private final List<FedqubeFixedThreadPoolExecutor> activeExecutors = new ArrayList<>();

  @Config(ConfigKey.PARTY_THREADS_MAX)
  private int partyThreadsMax;

  /** for context instantiation only, values are wired by the context. */
  public ExecutorManager() {
  }

  public ExecutorManager(int partyThreadsMax) {
    this.partyThreadsMax = partyThreadsMax;
  }

  /**
   * Create a new thread pool with a fixed set of threads to run the party-local tasks of a single call.
   * 
   * @param callName
   *          Name of the call, used to name the threads ("fedqube-[callName]-party-%d").
   * @param numberOfParties
   *          Number of party tasks that will be submitted. The pool will have as many threads, but not more than
   *          {@link ConfigKey#PARTY_THREADS_MAX}.
   * @return The new thread pool. Call {@link ExecutorService#shutdown()} when done.
   */
  public ExecutorService newPartyFixedThreadPool(String callName, int numberOfParties) {
    int numberOfThreads = Math.max(1, Math.min(numberOfParties, Math.max(1, partyThreadsMax)));

    String nameFormat = "fedqube-" + callName + "-party-%d";
    ThreadFactoryBuilder baseThreadFactoryBuilder = new ThreadFactoryBuilder();
    baseThreadFactoryBuilder.setNameFormat(nameFormat);

    FedqubeFixedThreadPoolExecutor res = new FedqubeFixedThreadPoolExecutor(numberOfThreads,
        new PartyThreadFactory(baseThreadFactoryBuilder.build(), callName), callName);
    res.setTerminationListener(() -> {
      synchronized (activeExecutors) {
        activeExecutors.remove(res);
      }
    });
    synchronized (activeExecutors) {
      activeExecutors.add(res);
    }
    logger.trace("Created {}", res);
    return res;
  }

  /**
   * @return Number of thread pools that have not terminated yet.
   */
  public int getNumberOfActiveExecutors() {
    synchronized (activeExecutors) {
      return activeExecutors.size();
    }
  }

  /**
   * Calls {@link ExecutorService#shutdownNow()} on all thread pools that have been created and which are still active.
   */
  @PreDestroy
  public void shutdownEverything() {
    List<FedqubeFixedThreadPoolExecutor> executors;
    synchronized (activeExecutors) {
      executors = new ArrayList<>(activeExecutors);
    }
    if (!executors.isEmpty())
      logger.info("Shutting down {} active party executors: {}", executors.size(), executors);
    for (FedqubeFixedThreadPoolExecutor executor : executors)
      executor.shutdownNow();
  }
}
