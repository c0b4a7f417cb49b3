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
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.runnel.common.config.RunnelConfig;
import org.runnel.exec.ExecConstants;
import org.runnel.exec.exception.FlowSetupException;
import org.runnel.exec.server.options.OptionValue;
import org.runnel.exec.server.options.SystemOptionManager;
import org.runnel.exec.work.flow.Flow;
import org.runnel.test.RunnelTest;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

public class TestFlowScheduler extends RunnelTest {
  private ExecutorService executor;
  private MetricRegistry metrics;
  private FlowScheduler scheduler;

  private final Map<Flow, CountDownLatch> completions = new ConcurrentHashMap<>();

  @Before
  public void setupScheduler() {
    executor = Executors.newCachedThreadPool();
    metrics = new MetricRegistry();
    final SystemOptionManager options = new SystemOptionManager(RunnelConfig.create());
    options.setOption(OptionValue.createLong(ExecConstants.MAX_RUNNING_FLOWS, 2, OptionValue.OptionScope.SYSTEM));
    scheduler = new FlowScheduler(executor, options, metrics);
  }

  @After
  public void shutdown() {
    for (CountDownLatch latch : completions.values()) {
      latch.countDown();
    }
    scheduler.close();
    executor.shutdownNow();
  }

  /**
   * A flow that runs until {@link #finish(Flow)} is called for it.
   */
  private Flow newFlow() throws Exception {
    final Flow flow = mock(Flow.class);
    final CountDownLatch completion = new CountDownLatch(1);
    when(flow.getId()).thenReturn(UUID.randomUUID());
    doAnswer(invocation -> {
      completion.await();
      return null;
    }).when(flow).awaitCompletionUninterruptibly();
    completions.put(flow, completion);
    return flow;
  }

  private void finish(Flow flow) {
    completions.get(flow).countDown();
  }

  @SuppressWarnings("unchecked")
  private int gauge(String name) {
    return ((Gauge<Integer>) metrics.getGauges().get(name)).getValue();
  }

  @Test
  public void flowsBeyondLimitAreQueued() throws Exception {
    scheduler.start();
    final Flow first = newFlow();
    final Flow second = newFlow();
    final Flow third = newFlow();
    scheduler.scheduleFlow(first);
    scheduler.scheduleFlow(second);
    scheduler.scheduleFlow(third);

    assertEquals(2, scheduler.getRunningCount());
    assertEquals(1, scheduler.getQueuedCount());
    assertEquals(2, gauge(FlowScheduler.RUNNING_FLOWS_GAUGE));
    assertEquals(1, gauge(FlowScheduler.QUEUED_FLOWS_GAUGE));
    verify(third, never()).start(any());

    finish(first);
    verify(third, timeout(5000)).start(any());
    verify(first).cleanup();
    assertEquals(2, scheduler.getRunningCount());
    assertEquals(0, scheduler.getQueuedCount());

    finish(second);
    finish(third);
    assertTrue(scheduler.awaitIdle(5, TimeUnit.SECONDS));
    verify(second, timeout(5000)).cleanup();
    verify(third, timeout(5000)).cleanup();
  }

  @Test
  public void flowsWaitUntilStarted() throws Exception {
    final Flow flow = newFlow();
    scheduler.scheduleFlow(flow);
    assertEquals(1, scheduler.getQueuedCount());
    verify(flow, never()).start(any());

    scheduler.start();
    verify(flow).start(any());
    assertEquals(1, scheduler.getRunningCount());
    finish(flow);
    assertTrue(scheduler.awaitIdle(5, TimeUnit.SECONDS));
  }

  @Test
  public void queuedFlowCanBeCancelled() throws Exception {
    scheduler.start();
    final Flow first = newFlow();
    final Flow second = newFlow();
    final Flow queued = newFlow();
    scheduler.scheduleFlow(first);
    scheduler.scheduleFlow(second);
    scheduler.scheduleFlow(queued);

    assertTrue(scheduler.cancelQueuedFlow(queued.getId()));
    assertFalse(scheduler.cancelQueuedFlow(queued.getId()));
    assertFalse(scheduler.cancelQueuedFlow(first.getId()));
    verify(queued).cleanup();
    assertEquals(0, scheduler.getQueuedCount());

    finish(first);
    finish(second);
    assertTrue(scheduler.awaitIdle(5, TimeUnit.SECONDS));
    verify(queued, never()).start(any());
  }

  @Test
  public void failedStartReleasesSlot() throws Exception {
    scheduler.start();
    final Flow broken = newFlow();
    doThrow(new FlowSetupException("no threads left")).when(broken).start(any());
    try {
      scheduler.scheduleFlow(broken);
      fail();
    } catch (FlowSetupException e) {
      assertEquals("no threads left", e.getMessage());
    }
    assertEquals(0, scheduler.getRunningCount());
    verify(broken, never()).cleanup();
  }

  @Test
  public void closeCleansUpQueuedFlows() throws Exception {
    final Flow queued = newFlow();
    scheduler.scheduleFlow(queued);
    scheduler.close();
    verify(queued).cleanup();

    try {
      scheduler.scheduleFlow(newFlow());
      fail();
    } catch (FlowSetupException e) {
      assertTrue(e.getMessage().contains("scheduler is closed"));
    }
  }
}
