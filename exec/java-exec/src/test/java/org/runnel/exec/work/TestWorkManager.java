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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.Test;
import org.runnel.test.RunnelTest;

public class TestWorkManager extends RunnelTest {

  @Test
  public void exitsImmediatelyWhenIdle() {
    final WorkManager workManager = new WorkManager();
    assertTrue(workManager.waitToExit(Duration.ofMillis(1)));
    assertFalse(workManager.addSyncFlow(UUID.randomUUID()));
  }

  @Test
  public void gracePeriodBoundsTheWait() {
    final WorkManager workManager = new WorkManager();
    final UUID flowId = UUID.randomUUID();
    assertTrue(workManager.addSyncFlow(flowId));
    assertFalse(workManager.waitToExit(Duration.ofMillis(100)));
    assertEquals(1, workManager.getRunningSyncFlows().size());
  }

  @Test
  public void waitEndsWhenLastFlowRetires() throws Exception {
    final WorkManager workManager = new WorkManager();
    final UUID first = UUID.randomUUID();
    final UUID second = UUID.randomUUID();
    workManager.addSyncFlow(first);
    workManager.addSyncFlow(second);

    final ExecutorService waiter = Executors.newSingleThreadExecutor();
    try {
      final Future<Boolean> exited = waiter.submit(() -> workManager.waitToExit(null));
      Thread.sleep(50);
      workManager.retireSyncFlow(first);
      assertFalse(exited.isDone());
      workManager.retireSyncFlow(second);
      assertTrue(exited.get(5, TimeUnit.SECONDS));
    } finally {
      waiter.shutdownNow();
    }
    assertTrue(workManager.getRunningSyncFlows().isEmpty());
  }
}
