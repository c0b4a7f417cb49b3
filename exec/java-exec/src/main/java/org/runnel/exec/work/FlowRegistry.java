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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.runnel.common.exceptions.UserException;
import org.runnel.exec.coord.NodeIdContainer;
import org.runnel.exec.exception.FlowSetupException;
import org.runnel.exec.exception.InboundStreamTimeoutException;
import org.runnel.exec.record.ProducerMetadata;
import org.runnel.exec.record.RowReceiver;
import org.runnel.exec.rpc.NamedThreadFactory;
import org.runnel.exec.work.flow.Flow;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * Directory of the flows running on this node, used by producers on other nodes to attach to a flow's inbound
 * streams. Producers may arrive before the flow registers; they wait for it, up to a timeout.
 * <p>
 * Once registered, a flow gives its producers a bounded time to connect. Inbound streams still unconnected when the
 * timer fires are expired: their receiver gets an error and end-of-stream, so the flow does not wait forever for a
 * producer that never shows up.
 * <p>
 * All state is guarded by one lock. Receivers and flows are called outside of it.
 */
public class FlowRegistry implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(FlowRegistry.class);

  static final String NO_CONNECTION_MSG = "no inbound stream connection";

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition flowRegistered = lock.newCondition();
  private final Map<UUID, FlowEntry> flows = Maps.newHashMap();
  private final Cache<UUID, Boolean> recentlyFinished = CacheBuilder.newBuilder()
      .maximumSize(10000)
      .expireAfterWrite(10, TimeUnit.MINUTES)
      .build();
  private final ScheduledExecutorService timer =
      Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("runnel-flow-registry-"));
  private final NodeIdContainer nodeId;

  private static class InboundStreamInfo {
    final RowReceiver receiver;
    boolean connected;
    boolean finished;

    InboundStreamInfo(RowReceiver receiver) {
      this.receiver = receiver;
    }
  }

  private static class FlowEntry {
    Flow flow;
    Map<Integer, InboundStreamInfo> inboundStreams;
    int waiters;
    ScheduledFuture<?> expiry;
  }

  public FlowRegistry(NodeIdContainer nodeId) {
    this.nodeId = nodeId;
  }

  /**
   * Makes {@code flow} visible to producers and wakes those already waiting for it.
   *
   * @param inboundStreams receivers of the flow's inbound streams, by stream id
   * @param timeout how long producers have to connect before their streams are expired
   * @throws FlowSetupException if a flow with the same id is registered
   */
  public void registerFlow(UUID flowId, Flow flow, Map<Integer, RowReceiver> inboundStreams, Duration timeout)
      throws FlowSetupException {
    lock.lock();
    try {
      FlowEntry entry = flows.get(flowId);
      if (entry == null) {
        entry = new FlowEntry();
        flows.put(flowId, entry);
      } else if (entry.flow != null) {
        throw new FlowSetupException(String.format("flow %s is already registered", flowId));
      }
      entry.flow = flow;
      entry.inboundStreams = Maps.newHashMap();
      for (Map.Entry<Integer, RowReceiver> stream : inboundStreams.entrySet()) {
        entry.inboundStreams.put(stream.getKey(), new InboundStreamInfo(stream.getValue()));
      }
      if (!inboundStreams.isEmpty()) {
        final FlowEntry registered = entry;
        entry.expiry = timer.schedule(() -> expireInboundStreams(flowId, registered, false),
            timeout.toMillis(), TimeUnit.MILLISECONDS);
      }
      if (entry.waiters > 0) {
        logger.debug("Flow {} registered, waking {} waiting producers", flowId, entry.waiters);
      }
      flowRegistered.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Attaches a producer to an inbound stream, waiting up to {@code timeout} for the flow to register.
   *
   * @throws InboundStreamTimeoutException if the flow did not register in time
   * @throws FlowSetupException if the flow finished already, or the stream is unknown, connected or expired
   */
  public InboundStreamConnection connectInboundStream(UUID flowId, int streamId, Duration timeout)
      throws FlowSetupException {
    lock.lock();
    try {
      FlowEntry entry = flows.get(flowId);
      if (entry == null || entry.flow == null) {
        if (recentlyFinished.getIfPresent(flowId) != null) {
          throw new FlowSetupException(String.format("flow %s has already finished", flowId));
        }
        if (entry == null) {
          entry = new FlowEntry();
          flows.put(flowId, entry);
        }
        waitForFlow(flowId, streamId, entry, timeout);
      }

      final InboundStreamInfo info = entry.inboundStreams.get(streamId);
      if (info == null) {
        throw new FlowSetupException(String.format("flow %s has no inbound stream %d", flowId, streamId));
      }
      if (info.connected) {
        throw new FlowSetupException(String.format("stream %d of flow %s is already connected", streamId, flowId));
      }
      if (info.finished) {
        throw new FlowSetupException(String.format("stream %d of flow %s has expired", streamId, flowId));
      }
      info.connected = true;
      return new InboundStreamConnection(this, entry.flow, streamId, info.receiver);
    } finally {
      lock.unlock();
    }
  }

  private void waitForFlow(UUID flowId, int streamId, FlowEntry entry, Duration timeout)
      throws FlowSetupException {
    entry.waiters++;
    try {
      long nanos = timeout.toNanos();
      while (entry.flow == null) {
        if (nanos <= 0) {
          throw new InboundStreamTimeoutException(flowId, streamId, timeout);
        }
        nanos = flowRegistered.awaitNanos(nanos);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FlowSetupException(String.format("interrupted while waiting for flow %s", flowId), e);
    } finally {
      entry.waiters--;
      if (entry.flow == null && entry.waiters == 0) {
        flows.remove(flowId, entry);
      }
    }
  }

  void finishInboundStream(Flow flow, int streamId) {
    lock.lock();
    try {
      final FlowEntry entry = flows.get(flow.getId());
      if (entry != null && entry.flow == flow) {
        final InboundStreamInfo info = entry.inboundStreams.get(streamId);
        if (info != null) {
          info.finished = true;
        }
      }
    } finally {
      lock.unlock();
    }
    flow.inboundStreamDone();
  }

  private void expireInboundStreams(UUID flowId, FlowEntry entry, boolean cancelled) {
    final List<InboundStreamInfo> expired = new ArrayList<>();
    lock.lock();
    try {
      if (flows.get(flowId) != entry) {
        return;
      }
      for (InboundStreamInfo info : entry.inboundStreams.values()) {
        if (!info.connected && !info.finished) {
          info.finished = true;
          expired.add(info);
        }
      }
    } finally {
      lock.unlock();
    }
    if (expired.isEmpty()) {
      return;
    }
    final UserException error;
    if (cancelled) {
      error = UserException.executionError()
          .message("Flow %s was cancelled.", flowId)
          .addIdentity(nodeId.get())
          .build(logger);
    } else {
      logger.warn("Flow {}: {} inbound streams were never connected", flowId, expired.size());
      error = UserException.connectionError()
          .message(NO_CONNECTION_MSG)
          .addContext("Flow", flowId.toString())
          .addIdentity(nodeId.get())
          .build(logger);
    }
    for (InboundStreamInfo info : expired) {
      info.receiver.push(null, ProducerMetadata.forError(error, nodeId.get()));
      info.receiver.producerDone();
      entry.flow.inboundStreamDone();
    }
  }

  /**
   * Finishes the inbound streams of a cancelled flow that no producer connected to yet.
   */
  public void cancelPendingStreams(UUID flowId) {
    final FlowEntry entry;
    lock.lock();
    try {
      entry = flows.get(flowId);
    } finally {
      lock.unlock();
    }
    if (entry != null && entry.flow != null) {
      expireInboundStreams(flowId, entry, true);
    }
  }

  /**
   * Removes the flow and remembers it as finished, so that late producers fail instead of waiting.
   */
  public void unregisterFlow(UUID flowId) {
    lock.lock();
    try {
      final FlowEntry entry = flows.remove(flowId);
      if (entry != null && entry.expiry != null) {
        entry.expiry.cancel(false);
      }
      recentlyFinished.put(flowId, Boolean.TRUE);
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return the registered flow, {@code null} if there is none
   */
  public Flow lookupFlow(UUID flowId) {
    lock.lock();
    try {
      final FlowEntry entry = flows.get(flowId);
      return entry == null ? null : entry.flow;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return true if the flow was registered and is now cancelled
   */
  public boolean cancelFlow(UUID flowId) {
    final Flow flow = lookupFlow(flowId);
    if (flow == null) {
      return false;
    }
    flow.cancel();
    return true;
  }

  public void cancelAll() {
    final List<Flow> running = new ArrayList<>();
    lock.lock();
    try {
      for (FlowEntry entry : flows.values()) {
        if (entry.flow != null) {
          running.add(entry.flow);
        }
      }
    } finally {
      lock.unlock();
    }
    logger.info("Cancelling {} flows", running.size());
    for (Flow flow : running) {
      flow.cancel();
    }
  }

  public List<UUID> getRegisteredFlowIds() {
    lock.lock();
    try {
      final ImmutableList.Builder<UUID> ids = ImmutableList.builder();
      for (Map.Entry<UUID, FlowEntry> entry : flows.entrySet()) {
        if (entry.getValue().flow != null) {
          ids.add(entry.getKey());
        }
      }
      return ids.build();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    timer.shutdownNow();
  }
}
