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
package org.runnel.exec.server;

import java.time.Duration;
import java.time.ZoneId;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.runnel.common.config.RunnelConfig;
import org.runnel.common.exceptions.RemoteError;
import org.runnel.common.exceptions.UserException;
import org.runnel.exec.ExecConstants;
import org.runnel.exec.coord.NodeIdContainer;
import org.runnel.exec.exception.FlowSetupException;
import org.runnel.exec.exception.VersionMismatchException;
import org.runnel.exec.memory.BoundAccount;
import org.runnel.exec.memory.MemoryMonitor;
import org.runnel.exec.message.ConsumerMessage;
import org.runnel.exec.message.EvalContextSpec;
import org.runnel.exec.message.ProducerMessage;
import org.runnel.exec.message.SetupFlowRequest;
import org.runnel.exec.message.SimpleResponse;
import org.runnel.exec.message.StreamHeader;
import org.runnel.exec.ops.EvalContext;
import org.runnel.exec.ops.FlowContext;
import org.runnel.exec.record.RowReceiver;
import org.runnel.exec.rpc.InboundStream;
import org.runnel.exec.rpc.NamedThreadFactory;
import org.runnel.exec.rpc.RpcException;
import org.runnel.exec.rpc.SyncFlowStream;
import org.runnel.exec.rpc.data.InboundStreamProcessor;
import org.runnel.exec.rpc.data.SyncFlowOutbox;
import org.runnel.exec.store.TempStorageIdGenerator;
import org.runnel.exec.util.RegexpCache;
import org.runnel.exec.util.TimeZones;
import org.runnel.exec.work.FlowRegistry;
import org.runnel.exec.work.FlowScheduler;
import org.runnel.exec.work.InboundStreamConnection;
import org.runnel.exec.work.WorkManager;
import org.runnel.exec.work.flow.Flow;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.google.common.annotations.VisibleForTesting;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.context.Scope;

/**
 * Entry point of flow execution on a node. Serves the three flow RPCs:
 * <ul>
 * <li>{@link #runSyncFlow(SyncFlowStream)}: set up a flow and stream its output back on the same call,</li>
 * <li>{@link #setupFlow(SetupFlowRequest)}: set up a flow and schedule it; its output goes to other nodes,</li>
 * <li>{@link #flowStream(InboundStream)}: attach a producer on another node to an inbound stream of a flow.</li>
 * </ul>
 * Every flow gets its own span, a child monitor of the server's {@code flows} monitor, and one account on it. The
 * flow owns them from then on and releases them in {@link Flow#cleanup()}.
 */
public class FlowServer implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(FlowServer.class);

  /** Protocol version of setup requests this node sends. */
  public static final int VERSION = 4;
  /** Oldest protocol version this node accepts. */
  public static final int MIN_ACCEPTED_VERSION = 4;

  public static final String FLOWS_MEMORY_CURRENT = "runnel.flows.memory.current";
  public static final String FLOW_MEMORY_MAX = "runnel.flows.memory.max";

  private final ServerConfig serverConfig;
  private final RunnelConfig config;
  private final ExecutorService executor;
  private final FlowRegistry registry;
  private final FlowScheduler scheduler;
  private final WorkManager workManager = new WorkManager();
  private final RegexpCache regexpCache;
  private final MemoryMonitor monitor;
  private final Histogram flowMaxBytes;
  private final Duration streamTimeout;

  public FlowServer(ServerConfig serverConfig) {
    this.serverConfig = serverConfig;
    this.config = serverConfig.getConfig();
    this.executor = Executors.newCachedThreadPool(new NamedThreadFactory("runnel-flow-"));
    this.registry = new FlowRegistry(serverConfig.getNodeId());
    this.scheduler = new FlowScheduler(executor, serverConfig.getOptions(), serverConfig.getMetrics());
    this.regexpCache = new RegexpCache(config.getInt(ExecConstants.REGEXP_CACHE_SIZE));
    this.streamTimeout = config.getDuration(ExecConstants.FLOW_STREAM_TIMEOUT);

    final Counter curBytes = serverConfig.getMetrics().counter(FLOWS_MEMORY_CURRENT);
    this.flowMaxBytes = serverConfig.getMetrics().histogram(FLOW_MEMORY_MAX);
    this.monitor = serverConfig.getParentMonitor().newChild("flows", MemoryMonitor.UNLIMITED,
        config.getBytes(ExecConstants.MEMORY_NOTEWORTHY_BYTES), curBytes, null);
  }

  /**
   * Begins running scheduled flows.
   */
  public void start() {
    scheduler.start();
    logger.info("Flow server started on node {}", serverConfig.getNodeId().get());
  }

  /**
   * Validates {@code request} and builds a flow from it, without starting it.
   *
   * @param parentSpan span of the caller; the flow's span is a new root linked to it, since the flow may outlive
   *                   the call. May be null.
   * @param syncFlowConsumer receives the output of a synchronous flow, null otherwise
   * @return a set-up flow; the caller must call {@link Flow#cleanup()} on it exactly once
   * @throws FlowSetupException if the request cannot be served; nothing allocated by this call remains open
   */
  public Flow setupFlow(Span parentSpan, SetupFlowRequest request, RowReceiver syncFlowConsumer)
      throws FlowSetupException {
    if (request.getVersion() < MIN_ACCEPTED_VERSION || request.getVersion() > VERSION) {
      final VersionMismatchException e =
          new VersionMismatchException(request.getVersion(), MIN_ACCEPTED_VERSION, VERSION);
      logger.warn(e.getMessage());
      throw e;
    }
    final int nodeId = serverConfig.getNodeId().get();
    if (nodeId == NodeIdContainer.UNRESOLVED) {
      throw new FlowSetupException("setupFlow called before the NodeID was resolved");
    }
    if (request.getFlow() == null || request.getFlow().getFlowId() == null) {
      throw new FlowSetupException("setup request carries no flow");
    }
    final UUID flowId = request.getFlow().getFlowId();
    final EvalContextSpec evalSpec = request.getEvalContext() != null
        ? request.getEvalContext()
        : new EvalContextSpec(null, null, null, 0, 0, null);

    final Span span = startFlowSpan(parentSpan, flowId);
    final ZoneId timeZone;
    try {
      timeZone = TimeZones.resolve(evalSpec.getLocation());
    } catch (UserException e) {
      span.recordException(e);
      span.end();
      throw new FlowSetupException(e.getMessage(), e);
    }

    final long flowLimit = serverConfig.getTestingKnobs().getFlowMemoryLimit() > 0
        ? serverConfig.getTestingKnobs().getFlowMemoryLimit()
        : MemoryMonitor.UNLIMITED;
    final MemoryMonitor flowMonitor = monitor.newChild("flow " + flowId.toString().substring(0, 8), flowLimit,
        config.getBytes(ExecConstants.MEMORY_NOTEWORTHY_BYTES), null, flowMaxBytes);
    final BoundAccount account = flowMonitor.makeBoundAccount();

    final EvalContext evalContext = new EvalContext(timeZone, evalSpec.getDatabase(), evalSpec.getSearchPath(),
        serverConfig.getClusterId(), nodeId, regexpCache, flowMonitor, account,
        evalSpec.getStmtTimestampNanos(), evalSpec.getTxnTimestampNanos(), evalSpec.getClusterTimestamp());
    final FlowContext flowContext = FlowContext.builder()
        .setFlowId(flowId)
        .setEvalContext(evalContext)
        .setTxn(request.getTxn())
        .setKvClient(serverConfig.getKvClient())
        .setBypassKvClient(serverConfig.getBypassKvClient())
        .setNodeId(nodeId)
        .setTempStorage(serverConfig.getTempStorage())
        .setTempStorageIdGenerator(serverConfig.getTempStorageIdGenerator())
        .setConfig(config)
        .setOptions(serverConfig.getOptions())
        .setTestingKnobs(serverConfig.getTestingKnobs())
        .setExecutor(executor)
        .setStreamDialer(serverConfig.getStreamDialer())
        .build();

    final Flow flow = new Flow(flowContext, registry, syncFlowConsumer, span, streamTimeout);
    try {
      flow.setup(request.getFlow());
    } catch (FlowSetupException | RuntimeException e) {
      logger.error("Error setting up flow {}", flowId, e);
      span.recordException(e);
      cleanupAfterFailure(flow, e);
      throw e;
    }
    return flow;
  }

  private Span startFlowSpan(Span parentSpan, UUID flowId) {
    final SpanBuilder builder = serverConfig.getTracer().spanBuilder("flow").setNoParent();
    if (parentSpan != null && parentSpan.getSpanContext().isValid()) {
      builder.addLink(parentSpan.getSpanContext());
    }
    return builder.setAttribute("flow.id", flowId.toString()).startSpan();
  }

  private static void cleanupAfterFailure(Flow flow, Throwable failure) {
    try {
      flow.cleanup();
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
    }
  }

  /**
   * Sets up a flow whose output goes to {@code output}. The flow is not started.
   */
  public Flow setupSyncFlow(Span parentSpan, SetupFlowRequest request, RowReceiver output)
      throws FlowSetupException {
    return setupFlow(parentSpan, request, output);
  }

  /**
   * Serves the synchronous flow RPC: reads the setup request, runs the flow and streams its output back until the
   * flow completes.
   *
   * @throws RpcException if the first message carries no setup request, the node is shutting down, or sending
   *                      the output failed
   */
  public void runSyncFlow(SyncFlowStream stream) throws RpcException, FlowSetupException {
    final ConsumerMessage first = stream.receive();
    if (first == null) {
      throw new RpcException("stream closed before the first message of RunSyncFlow");
    }
    if (first.getSetupFlowRequest() == null) {
      throw new RpcException("first message in RunSyncFlow doesn't contain SetupFlowRequest");
    }

    final SyncFlowOutbox outbox = new SyncFlowOutbox(stream, config.getInt(ExecConstants.ROW_CHANNEL_BUFFER),
        config.getInt(ExecConstants.OUTBOX_FLUSH_ROWS));
    final Flow flow = setupSyncFlow(Span.current(), first.getSetupFlowRequest(), outbox);
    if (!workManager.addSyncFlow(flow.getId())) {
      flow.cleanup();
      throw new RpcException(String.format("cannot run flow %s, node is shutting down", flow.getId()));
    }
    try {
      runStartedSyncFlow(flow, outbox);
    } finally {
      try {
        flow.cleanup();
      } finally {
        workManager.retireSyncFlow(flow.getId());
      }
    }
    if (outbox.getError() != null) {
      throw outbox.getError();
    }
  }

  private void runStartedSyncFlow(Flow flow, SyncFlowOutbox outbox) throws FlowSetupException {
    flow.start(null);
    try {
      flow.startUnit(outbox.toString(), outbox);
    } catch (FlowSetupException e) {
      flow.awaitCompletionUninterruptibly();
      throw e;
    }
    try {
      flow.awaitCompletion();
    } catch (InterruptedException e) {
      logger.info("Interrupted while running flow {}, cancelling it", flow.getId());
      flow.cancel();
      flow.awaitCompletionUninterruptibly();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Serves the unary setup RPC. Failures are reported inside the response.
   */
  public SimpleResponse setupFlow(SetupFlowRequest request) {
    final Flow flow;
    try {
      flow = setupFlow(Span.current(), request, null);
    } catch (FlowSetupException | RuntimeException e) {
      return SimpleResponse.error(toRemoteError(e));
    }
    try {
      scheduler.scheduleFlow(flow);
    } catch (FlowSetupException | RuntimeException e) {
      logger.error("Error scheduling flow {}", flow.getId(), e);
      cleanupAfterFailure(flow, e);
      return SimpleResponse.error(toRemoteError(e));
    }
    return SimpleResponse.ok();
  }

  private RemoteError toRemoteError(Exception e) {
    final int nodeId = serverConfig.getNodeId().get();
    if (e instanceof FlowSetupException) {
      return UserException.planError(e)
          .addIdentity(nodeId)
          .build(logger)
          .getOrCreateRemoteError(false);
    }
    return UserException.getOrCreateRemoteError(e, nodeId, false);
  }

  /**
   * Serves a stream opened by a producer on another node: connects it to the inbound stream named in its first
   * message and feeds the flow until the producer is done.
   */
  public void flowStream(InboundStream stream) throws RpcException, FlowSetupException {
    final ProducerMessage first = stream.receive();
    if (first == null) {
      throw new RpcException("missing header message");
    }
    final StreamHeader header = first.getHeader();
    if (header == null) {
      throw new RpcException("no header in first message");
    }
    try (InboundStreamConnection connection =
             registry.connectInboundStream(header.getFlowId(), header.getStreamId(), streamTimeout)) {
      try (Scope scope = connection.getFlow().getSpan().makeCurrent()) {
        InboundStreamProcessor.process(stream, first, connection.getReceiver(), serverConfig.getNodeId().get());
      }
    } catch (RpcException | FlowSetupException | RuntimeException e) {
      logger.error("Error on inbound stream {} of flow {}", header.getStreamId(), header.getFlowId(), e);
      throw e;
    }
  }

  /**
   * Cancels a running or queued flow.
   *
   * @return false if no such flow exists on this node
   */
  public boolean cancelFlow(UUID flowId) {
    return registry.cancelFlow(flowId) || scheduler.cancelQueuedFlow(flowId);
  }

  @VisibleForTesting
  public FlowRegistry getRegistry() {
    return registry;
  }

  @VisibleForTesting
  public FlowScheduler getScheduler() {
    return scheduler;
  }

  public MemoryMonitor getMonitor() {
    return monitor;
  }

  public TempStorageIdGenerator getTempStorageIdGenerator() {
    return serverConfig.getTempStorageIdGenerator();
  }

  @Override
  public void close() throws InterruptedException {
    close(false);
  }

  /**
   * Stops serving flows. Running flows are left to finish, or cancelled when {@code forceful}; the wait is bounded
   * by {@link ExecConstants#SHUTDOWN_GRACE_PERIOD} only when forceful.
   */
  public void close(boolean forceful) throws InterruptedException {
    logger.info("Shutting down flow server, forceful: {}", forceful);
    final Duration grace = config.getDuration(ExecConstants.SHUTDOWN_GRACE_PERIOD);
    if (forceful) {
      registry.cancelAll();
    }
    if (!workManager.waitToExit(forceful ? grace : null)) {
      logger.warn("Synchronous flows still running after {}: {}", grace, workManager.getRunningSyncFlows());
    }
    scheduler.close();
    final boolean idle = forceful
        ? scheduler.awaitIdle(grace.toMillis(), TimeUnit.MILLISECONDS)
        : scheduler.awaitIdle(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
    registry.close();
    executor.shutdown();
    if (idle && workManager.getRunningSyncFlows().isEmpty()) {
      monitor.stop();
    } else {
      logger.warn("Flows still running at shutdown, leaving the flows monitor open");
    }
  }
}
