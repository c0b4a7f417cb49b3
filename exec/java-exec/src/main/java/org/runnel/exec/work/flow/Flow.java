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
package org.runnel.exec.work.flow;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Phaser;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.runnel.common.DeferredException;
import org.runnel.common.exceptions.RunnelRuntimeException;
import org.runnel.common.exceptions.UserException;
import org.runnel.exec.exception.FlowSetupException;
import org.runnel.exec.message.FlowSpec;
import org.runnel.exec.message.InputSyncSpec;
import org.runnel.exec.message.OutputRouterSpec;
import org.runnel.exec.message.ProcessorSpec;
import org.runnel.exec.message.StreamEndpointSpec;
import org.runnel.exec.ops.FlowContext;
import org.runnel.exec.physical.impl.MirrorRouter;
import org.runnel.exec.physical.impl.ProcessorBase;
import org.runnel.exec.physical.impl.ProcessorFactory;
import org.runnel.exec.record.ProducerMetadata;
import org.runnel.exec.record.RowChannel;
import org.runnel.exec.record.RowReceiver;
import org.runnel.exec.record.RowSource;
import org.runnel.exec.rpc.data.Outbox;
import org.runnel.exec.work.FlowRegistry;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import io.opentelemetry.api.trace.Span;

/**
 * This node's part of a distributed query: processors wired together by local channels, outboxes sending to other
 * nodes, and inbound streams fed by them.
 * <p>
 * Lifecycle: {@link #setup(FlowSpec)} wires the DAG, {@link #start(Runnable)} registers the flow and runs every
 * processor and outbox on the executor, {@link #awaitCompletion()} blocks until they and all inbound streams are
 * done, and {@link #cleanup()} releases what the flow owns. Cleanup is the only teardown path and must run whatever
 * happened before, including a failed setup.
 * <p>
 * Completion is tracked by a {@link Phaser}: the flow itself holds one party until someone awaits it, and every
 * processor, outbox and inbound stream holds one party while it runs.
 */
public class Flow {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Flow.class);

  public enum State {
    CONSTRUCTED, SET_UP, STARTED, FINISHED, CLEANED_UP
  }

  private final FlowContext context;
  private final FlowRegistry registry;
  private final RowReceiver syncFlowConsumer;
  private final Span span;
  private final Duration streamTimeout;

  private final List<ProcessorBase> processors = new ArrayList<>();
  private final List<Outbox> outboxes = new ArrayList<>();
  private final List<RowChannel> channels = new ArrayList<>();
  private final Map<Integer, RowReceiver> inboundStreams = Maps.newHashMap();

  private final Phaser completion = new Phaser(1);
  private final AtomicBoolean awaited = new AtomicBoolean();
  private final AtomicBoolean doneCalled = new AtomicBoolean();
  private final Set<Thread> runningThreads = Sets.newHashSet();

  private volatile State state = State.CONSTRUCTED;
  private volatile boolean cancelled;
  private boolean registered;
  private boolean syncResponseProduced;
  private Runnable doneCallback;

  /**
   * @param syncFlowConsumer receives the output of a synchronous flow, {@code null} for flows whose results go to
   *                         other nodes
   * @param span the flow's span, ended by {@link #cleanup()}
   */
  public Flow(FlowContext context, FlowRegistry registry, RowReceiver syncFlowConsumer, Span span,
              Duration streamTimeout) {
    this.context = context;
    this.registry = registry;
    this.syncFlowConsumer = syncFlowConsumer;
    this.span = span;
    this.streamTimeout = streamTimeout;
    if (syncFlowConsumer instanceof RowChannel) {
      channels.add((RowChannel) syncFlowConsumer);
    }
  }

  /**
   * Creates the channels, processors and outboxes described by {@code spec}. Stream ids must be unique within the
   * flow. A local stream must have exactly one producer and one consumer.
   */
  public void setup(FlowSpec spec) throws FlowSetupException {
    Preconditions.checkState(state == State.CONSTRUCTED, "flow %s set up twice", getId());
    if (spec.getProcessors().isEmpty()) {
      throw new FlowSetupException(String.format("flow %s has no processors", getId()));
    }

    // inputs first, so that outputs can find the local streams they feed
    final Map<Integer, RowChannel> localStreams = Maps.newHashMap();
    final Set<Integer> inputStreamIds = Sets.newHashSet();
    final List<List<RowSource>> processorInputs = new ArrayList<>();
    for (ProcessorSpec processor : spec.getProcessors()) {
      final List<RowSource> inputs = new ArrayList<>();
      for (InputSyncSpec sync : processor.getInput()) {
        if (sync.getStreams().isEmpty()) {
          throw new FlowSetupException(String.format("processor %d has an input without streams",
              processor.getProcessorId()));
        }
        final RowChannel channel = new RowChannel(context.getRowChannelBuffer(), sync.getStreams().size());
        channels.add(channel);
        for (StreamEndpointSpec stream : sync.getStreams()) {
          if (!inputStreamIds.add(stream.getStreamId())) {
            throw new FlowSetupException(String.format("duplicate stream %d", stream.getStreamId()));
          }
          switch (stream.getType()) {
            case LOCAL:
              localStreams.put(stream.getStreamId(), channel);
              break;
            case REMOTE:
              inboundStreams.put(stream.getStreamId(), channel);
              break;
            default:
              throw new FlowSetupException(String.format("processor %d: %s stream %d cannot be an input",
                  processor.getProcessorId(), stream.getType(), stream.getStreamId()));
          }
        }
        inputs.add(channel);
      }
      processorInputs.add(inputs);
    }

    final Set<Integer> outputStreamIds = Sets.newHashSet();
    for (int i = 0; i < spec.getProcessors().size(); i++) {
      final ProcessorSpec processor = spec.getProcessors().get(i);
      if (processor.getOutput().size() != 1) {
        throw new FlowSetupException(String.format("processor %d must have exactly one output router, has %d",
            processor.getProcessorId(), processor.getOutput().size()));
      }
      final RowReceiver output = buildRouter(processor.getProcessorId(), processor.getOutput().get(0),
          localStreams, inputStreamIds, outputStreamIds);
      processors.add(ProcessorFactory.create(context, processor, processorInputs.get(i), output));
    }

    for (Integer streamId : localStreams.keySet()) {
      if (!outputStreamIds.contains(streamId)) {
        throw new FlowSetupException(String.format("local stream %d is consumed but never produced", streamId));
      }
    }
    state = State.SET_UP;
    logger.debug("Flow {} set up: {} processors, {} outboxes, {} inbound streams",
        getId(), processors.size(), outboxes.size(), inboundStreams.size());
  }

  private RowReceiver buildRouter(int processorId, OutputRouterSpec router, Map<Integer, RowChannel> localStreams,
                                  Set<Integer> inputStreamIds, Set<Integer> outputStreamIds)
      throws FlowSetupException {
    final List<RowReceiver> streams = new ArrayList<>();
    for (StreamEndpointSpec stream : router.getStreams()) {
      switch (stream.getType()) {
        case LOCAL: {
          final RowChannel channel = localStreams.get(stream.getStreamId());
          if (channel == null) {
            throw new FlowSetupException(String.format("local stream %d has no consumer", stream.getStreamId()));
          }
          checkUniqueOutput(stream, outputStreamIds);
          streams.add(channel);
          break;
        }
        case REMOTE: {
          if (inputStreamIds.contains(stream.getStreamId())) {
            throw new FlowSetupException(String.format("duplicate stream %d", stream.getStreamId()));
          }
          checkUniqueOutput(stream, outputStreamIds);
          if (stream.getTargetAddr() == null || context.getStreamDialer() == null) {
            throw new FlowSetupException(String.format("remote stream %d has no target", stream.getStreamId()));
          }
          final Outbox outbox = new Outbox(context.getStreamDialer(), stream.getTargetAddr(), getId(),
              stream.getStreamId(), context.getRowChannelBuffer(), context.getOutboxFlushRows());
          outboxes.add(outbox);
          channels.add(outbox);
          streams.add(outbox);
          break;
        }
        case SYNC_RESPONSE:
          if (syncFlowConsumer == null) {
            throw new FlowSetupException(String.format(
                "processor %d writes the synchronous response, but flow %s has no synchronous consumer",
                processorId, getId()));
          }
          // the response channel expects exactly one producer
          if (syncResponseProduced) {
            throw new FlowSetupException(String.format(
                "processor %d writes the synchronous response, which already has a producer", processorId));
          }
          syncResponseProduced = true;
          streams.add(syncFlowConsumer);
          break;
        default:
          throw new FlowSetupException("unknown stream type " + stream.getType());
      }
    }

    switch (router.getType()) {
      case PASS_THROUGH:
        if (streams.size() != 1) {
          throw new FlowSetupException(String.format(
              "pass-through router of processor %d needs exactly one stream, has %d", processorId, streams.size()));
        }
        return streams.get(0);
      case MIRROR:
        if (streams.isEmpty()) {
          throw new FlowSetupException(String.format("mirror router of processor %d has no streams", processorId));
        }
        return new MirrorRouter(streams);
      default:
        throw new FlowSetupException("unknown router type " + router.getType());
    }
  }

  private static void checkUniqueOutput(StreamEndpointSpec stream, Set<Integer> outputStreamIds)
      throws FlowSetupException {
    if (!outputStreamIds.add(stream.getStreamId())) {
      throw new FlowSetupException(String.format("stream %d has more than one producer", stream.getStreamId()));
    }
  }

  /**
   * Registers the flow so that producers on other nodes can connect, then runs the outboxes and processors.
   *
   * @param doneCallback run once, by whoever first observes completion in one of the await methods, unless this
   *                     method throws; may be null
   * @throws FlowSetupException if registration fails, in which case nothing was started, or if the executor
   *                            rejects the work, in which case the flow is cancelled and has completed
   */
  public void start(Runnable doneCallback) throws FlowSetupException {
    synchronized (this) {
      Preconditions.checkState(state == State.SET_UP, "flow %s cannot start in state %s", getId(), state);
      Preconditions.checkState(!awaited.get(), "flow %s awaited before it started", getId());
      this.doneCallback = doneCallback;
    }

    final List<Runnable> units = new ArrayList<>();
    units.addAll(outboxes);
    units.addAll(processors);
    completion.bulkRegister(units.size() + inboundStreams.size());
    try {
      registry.registerFlow(getId(), this, inboundStreams, streamTimeout);
    } catch (FlowSetupException | RuntimeException e) {
      for (int i = 0; i < units.size() + inboundStreams.size(); i++) {
        completion.arriveAndDeregister();
      }
      throw e;
    }
    synchronized (this) {
      registered = true;
      state = State.STARTED;
    }
    if (cancelled) {
      registry.cancelPendingStreams(getId());
    }

    int launched = 0;
    try {
      for (Runnable unit : units) {
        launch(unit.toString(), unit);
        launched++;
      }
    } catch (RejectedExecutionException e) {
      for (int i = launched; i < units.size(); i++) {
        completion.arriveAndDeregister();
      }
      logger.error("Flow {}: executor rejected its work", getId(), e);
      // the caller learns of the failure from the exception, not from the callback
      doneCalled.set(true);
      cancel();
      awaitCompletionUninterruptibly();
      throw new FlowSetupException(String.format("could not start flow %s", getId()), e);
    }
    logger.debug("Flow {} started", getId());
  }

  /**
   * Runs an additional unit of work as part of this started flow. The flow does not complete before the unit ends.
   */
  public void startUnit(String name, Runnable unit) throws FlowSetupException {
    Preconditions.checkState(state == State.STARTED && !awaited.get(),
        "flow %s cannot take more work in state %s", getId(), state);
    completion.register();
    try {
      launch(name, unit);
    } catch (RejectedExecutionException e) {
      completion.arriveAndDeregister();
      cancel();
      throw new FlowSetupException(String.format("could not start %s of flow %s", name, getId()), e);
    }
  }

  private void launch(String name, Runnable unit) {
    context.getExecutor().execute(() -> runUnit(name, unit));
  }

  private void runUnit(String name, Runnable unit) {
    final Thread myThread = Thread.currentThread();
    final String originalThreadName = myThread.getName();
    synchronized (runningThreads) {
      runningThreads.add(myThread);
    }
    myThread.setName(originalThreadName + ":" + getId() + ":" + name);
    try {
      unit.run();
    } catch (RuntimeException e) {
      logger.error("Flow {}: {} failed", getId(), name, e);
    } finally {
      // no longer allow this thread to be interrupted by cancel()
      synchronized (runningThreads) {
        runningThreads.remove(myThread);
        Thread.interrupted();
      }
      myThread.setName(originalThreadName);
      completion.arriveAndDeregister();
    }
  }

  /**
   * Called once per inbound stream when its producer is done, or when the stream expired without one.
   */
  public void inboundStreamDone() {
    completion.arriveAndDeregister();
  }

  private int arriveSelf() {
    if (awaited.compareAndSet(false, true)) {
      return completion.arriveAndDeregister();
    }
    return completion.getPhase();
  }

  /**
   * Blocks until every processor, outbox and inbound stream of the flow is done.
   */
  public void awaitCompletion() throws InterruptedException {
    completion.awaitAdvanceInterruptibly(arriveSelf());
    finished();
  }

  /**
   * @return false if the flow was still running after {@code timeout}
   */
  public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
    try {
      completion.awaitAdvanceInterruptibly(arriveSelf(), timeout, unit);
    } catch (TimeoutException e) {
      return false;
    }
    finished();
    return true;
  }

  public void awaitCompletionUninterruptibly() {
    completion.awaitAdvance(arriveSelf());
    finished();
  }

  private void finished() {
    synchronized (this) {
      if (state == State.STARTED) {
        state = State.FINISHED;
      }
    }
    if (doneCallback != null && doneCalled.compareAndSet(false, true)) {
      doneCallback.run();
    }
  }

  /**
   * Stops the flow: running processors and outboxes are interrupted and every channel ends with a cancellation
   * error. Safe to call from any thread in any state.
   */
  public void cancel() {
    cancelled = true;
    logger.info("Cancelling flow {}", getId());
    synchronized (runningThreads) {
      for (Thread thread : runningThreads) {
        thread.interrupt();
      }
    }
    final UserException error = UserException.executionError()
        .message("Flow %s was cancelled.", getId())
        .addIdentity(context.getNodeId())
        .build(logger);
    final ProducerMetadata meta = ProducerMetadata.forError(error, context.getNodeId());
    for (RowChannel channel : channels) {
      channel.cancel(meta);
    }
    final boolean isRegistered;
    synchronized (this) {
      isRegistered = registered;
    }
    if (isRegistered) {
      registry.cancelPendingStreams(getId());
    }
  }

  /**
   * Releases everything the flow owns: its registration, the processors' accounts, the flow account and monitor,
   * and the span. Later calls log a warning and return.
   *
   * @throws IllegalStateException if the flow started and has not completed
   * @throws RunnelRuntimeException if releasing failed, for example because memory leaked
   */
  public synchronized void cleanup() {
    if (state == State.CLEANED_UP) {
      logger.warn("Flow {} cleaned up more than once", getId());
      return;
    }
    Preconditions.checkState(state != State.STARTED, "flow %s cleaned up while running", getId());

    final DeferredException deferred = new DeferredException();
    if (registered) {
      registry.unregisterFlow(getId());
    }
    for (ProcessorBase processor : processors) {
      deferred.suppressingClose(processor);
    }
    deferred.suppressingClose(context.getEvalContext().getActiveAccount());
    deferred.suppressingClose(context.getEvalContext().getMonitor());
    span.end();
    state = State.CLEANED_UP;
    logger.debug("Flow {} cleaned up", getId());

    try {
      deferred.close();
    } catch (Exception e) {
      logger.error("Error cleaning up flow {}", getId(), e);
      throw new RunnelRuntimeException(String.format("error cleaning up flow %s", getId()), e);
    }
  }

  public UUID getId() {
    return context.getFlowId();
  }

  public FlowContext getContext() {
    return context;
  }

  public Span getSpan() {
    return span;
  }

  public State getState() {
    return state;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public List<ProcessorBase> getProcessors() {
    return ImmutableList.copyOf(processors);
  }

  public Set<Integer> getInboundStreamIds() {
    return ImmutableSet.copyOf(inboundStreams.keySet());
  }
}
