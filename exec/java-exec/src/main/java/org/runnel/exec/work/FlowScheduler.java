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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.runnel.exec.ExecConstants;
import org.runnel.exec.exception.FlowSetupException;
import org.runnel.exec.metrics.RunnelMetrics;
import org.runnel.exec.server.options.OptionManager;
import org.runnel.exec.work.flow.Flow;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

/**
 * Runs asynchronous flows, at most {@link ExecConstants#MAX_RUNNING_FLOWS} of them at a time. Flows beyond the limit
 * wait in a queue and start, in order, as running flows complete.
 * <p>
 * A pooled task awaits each running flow and cleans it up before its slot is released, so callers hand over
 * ownership of the flow when {@link #scheduleFlow(Flow)} returns normally.
 */
public class FlowScheduler implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(FlowScheduler.class);

  public static final String RUNNING_FLOWS_GAUGE = "runnel.flows.running";
  public static final String QUEUED_FLOWS_GAUGE = "runnel.flows.queued";

  private final ExecutorService executor;
  private final OptionManager options;

  private final Deque<Flow> queue = new ArrayDeque<>();
  private int numRunning;
  private boolean started;
  private boolean closed;

  public FlowScheduler(ExecutorService executor, OptionManager options, MetricRegistry metrics) {
    this.executor = executor;
    this.options = options;
    RunnelMetrics.register(metrics, RUNNING_FLOWS_GAUGE, (Gauge<Integer>) this::getRunningCount);
    RunnelMetrics.register(metrics, QUEUED_FLOWS_GAUGE, (Gauge<Integer>) this::getQueuedCount);
  }

  /**
   * Begins admitting flows. Flows scheduled before this call stay queued until then.
   */
  public void start() {
    synchronized (this) {
      started = true;
    }
    admitQueued();
  }

  /**
   * Starts {@code flow} now if the limit allows, otherwise queues it.
   *
   * @throws FlowSetupException if the scheduler is closed or the flow failed to start; the caller still owns the
   *                            flow and must clean it up
   */
  public void scheduleFlow(Flow flow) throws FlowSetupException {
    synchronized (this) {
      if (closed) {
        throw new FlowSetupException(String.format("cannot schedule flow %s, scheduler is closed", flow.getId()));
      }
      if (!started || numRunning >= maxRunningFlows() || !queue.isEmpty()) {
        logger.debug("Queueing flow {}; {} running, {} queued", flow.getId(), numRunning, queue.size());
        queue.addLast(flow);
        return;
      }
      numRunning++;
    }
    try {
      runFlow(flow);
    } catch (FlowSetupException | RuntimeException e) {
      flowDone();
      throw e;
    }
  }

  private int maxRunningFlows() {
    return (int) options.getOption(ExecConstants.MAX_RUNNING_FLOWS_VALIDATOR);
  }

  private void runFlow(Flow flow) throws FlowSetupException {
    flow.start(null);
    try {
      executor.execute(() -> awaitAndCleanup(flow));
    } catch (RejectedExecutionException e) {
      logger.warn("Cannot hand flow {} to a waiter, cancelling it", flow.getId(), e);
      flow.cancel();
      awaitAndCleanup(flow);
    }
  }

  private void awaitAndCleanup(Flow flow) {
    try {
      flow.awaitCompletionUninterruptibly();
      cleanupQuietly(flow);
    } finally {
      flowDone();
    }
  }

  private void flowDone() {
    synchronized (this) {
      numRunning--;
      notifyAll();
    }
    admitQueued();
  }

  private void admitQueued() {
    final List<Flow> admitted = new ArrayList<>();
    synchronized (this) {
      if (!started || closed) {
        return;
      }
      final int max = maxRunningFlows();
      while (numRunning < max && !queue.isEmpty()) {
        admitted.add(queue.pollFirst());
        numRunning++;
      }
    }
    for (Flow flow : admitted) {
      try {
        runFlow(flow);
      } catch (FlowSetupException | RuntimeException e) {
        logger.error("Queued flow {} failed to start", flow.getId(), e);
        cleanupQuietly(flow);
        flowDone();
      }
    }
  }

  /**
   * Removes a flow that has not started yet and cleans it up.
   *
   * @return false if the flow is not queued
   */
  public boolean cancelQueuedFlow(UUID flowId) {
    Flow removed = null;
    synchronized (this) {
      for (Iterator<Flow> it = queue.iterator(); it.hasNext();) {
        final Flow flow = it.next();
        if (flow.getId().equals(flowId)) {
          it.remove();
          removed = flow;
          break;
        }
      }
    }
    if (removed == null) {
      return false;
    }
    logger.info("Cancelled queued flow {}", flowId);
    cleanupQuietly(removed);
    return true;
  }

  /**
   * Waits until no flow is running.
   *
   * @return false if flows were still running after {@code timeout}
   */
  public synchronized boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
    final long deadline = System.nanoTime() + unit.toNanos(timeout);
    while (numRunning > 0) {
      final long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return false;
      }
      TimeUnit.NANOSECONDS.timedWait(this, remaining);
    }
    return true;
  }

  public synchronized int getRunningCount() {
    return numRunning;
  }

  public synchronized int getQueuedCount() {
    return queue.size();
  }

  private void cleanupQuietly(Flow flow) {
    try {
      flow.cleanup();
    } catch (RuntimeException e) {
      logger.error("Error cleaning up flow {}", flow.getId(), e);
    }
  }

  /**
   * Stops admitting flows and cleans up the queued ones without running them. Running flows are not affected.
   */
  @Override
  public void close() {
    final List<Flow> dropped;
    synchronized (this) {
      closed = true;
      dropped = new ArrayList<>(queue);
      queue.clear();
    }
    if (!dropped.isEmpty()) {
      logger.info("Dropping {} queued flows", dropped.size());
    }
    for (Flow flow : dropped) {
      cleanupQuietly(flow);
    }
  }
}
