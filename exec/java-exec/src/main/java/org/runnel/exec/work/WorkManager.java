/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.runnel.exec.work;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Tracks the synchronous flows a node is serving so that shutdown can stop admitting new ones and wait for the
 * running ones to drain.
 */
public class WorkManager {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(WorkManager.class);

  private final Set<UUID> runningSyncFlows = Sets.newHashSet();
  private boolean quiescing;
  private CountDownLatch exitLatch = null; // used to wait to exit when things are still running

  /**
   * @return false if the node is shutting down and the flow must not run
   */
  public synchronized boolean addSyncFlow(UUID flowId) {
    if (quiescing) {
      logger.info("Rejecting synchronous flow {}, node is shutting down", flowId);
      return false;
    }
    runningSyncFlows.add(flowId);
    return true;
  }

  public synchronized void retireSyncFlow(UUID flowId) {
    runningSyncFlows.remove(flowId);
    indicateIfSafeToExit();
  }

  /**
   * Stops admitting synchronous flows and waits for the running ones to finish.
   *
   * @param gracePeriod bound on the wait, {@code null} to wait until they finish
   * @return true if every synchronous flow finished
   */
  public boolean waitToExit(Duration gracePeriod) {
    final CountDownLatch latch;
    synchronized (this) {
      quiescing = true;
      if (runningSyncFlows.isEmpty()) {
        return true;
      }
      logger.info("Draining {} synchronous flows.", runningSyncFlows.size());
      if (exitLatch == null) {
        exitLatch = new CountDownLatch(1);
      }
      latch = exitLatch;
    }
    boolean interrupted = false;
    try {
      while (true) {
        try {
          if (gracePeriod == null) {
            latch.await();
            return true;
          }
          return latch.await(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void indicateIfSafeToExit() {
    if (exitLatch != null) {
      logger.info("Waiting for {} synchronous flows to complete before shutting down", runningSyncFlows.size());
      if (runningSyncFlows.isEmpty()) {
        exitLatch.countDown();
      }
    }
  }

  public synchronized Set<UUID> getRunningSyncFlows() {
    return ImmutableSet.copyOf(runningSyncFlows);
  }
}
