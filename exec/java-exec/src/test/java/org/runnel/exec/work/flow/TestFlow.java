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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.runnel.common.config.RunnelConfig;
import org.runnel.common.exceptions.ErrorType;
import org.runnel.exec.ExecTest;
import org.runnel.exec.coord.NodeIdContainer;
import org.runnel.exec.exception.FlowSetupException;
import org.runnel.exec.memory.MemoryMonitor;
import org.runnel.exec.message.FlowSpec;
import org.runnel.exec.message.InputSyncSpec;
import org.runnel.exec.message.OutputRouterSpec;
import org.runnel.exec.message.ProcessorCoreSpec;
import org.runnel.exec.message.ProcessorSpec;
import org.runnel.exec.message.StreamEndpointSpec;
import org.runnel.exec.record.Row;
import org.runnel.exec.record.RowChannel;
import org.runnel.exec.record.RowOrMetadata;
import org.runnel.exec.server.options.SystemOptionManager;
import org.runnel.exec.work.FlowRegistry;

import com.google.common.collect.ImmutableList;

import io.opentelemetry.api.trace.Span;

public class TestFlow extends ExecTest {
  private static final List<Row> ROWS = ImmutableList.of(Row.of(2), Row.of(1));
  private static final StreamEndpointSpec SYNC = StreamEndpointSpec.syncResponse();

  private FlowRegistry registry;
  private MemoryMonitor monitor;
  private RowChannel consumer;

  @Before
  public void setupRegistry() {
    final NodeIdContainer nodeId = new NodeIdContainer();
    nodeId.set(1);
    registry = new FlowRegistry(nodeId);
    monitor = MemoryMonitor.newRoot("flow", MemoryMonitor.UNLIMITED, MemoryMonitor.UNLIMITED, true, null, null);
    consumer = new RowChannel(64, 1);
  }

  @After
  public void closeRegistry() {
    registry.close();
  }

  private Flow newFlow(RowChannel syncConsumer) {
    return new Flow(newFlowContext(monitor, null, new SystemOptionManager(RunnelConfig.create())),
        registry, syncConsumer, Span.getInvalid(), Duration.ofSeconds(10));
  }

  private void assertSetupFails(FlowSpec spec, String message) {
    final Flow flow = newFlow(consumer);
    try {
      flow.setup(spec);
      fail("setup should fail with " + message);
    } catch (FlowSetupException e) {
      assertThat(e.getMessage(), containsString(message));
    } finally {
      flow.cleanup();
    }
    assertTrue(monitor.isStopped());
    assertEquals(0, monitor.getUsed());
  }

  private static List<Row> drain(RowChannel channel) throws InterruptedException {
    final List<Row> rows = new ArrayList<>();
    RowOrMetadata next;
    while ((next = channel.next()) != null) {
      assertFalse("unexpected metadata " + next.getMeta(), next.isMetadata());
      rows.add(next.getRow());
    }
    return rows;
  }

  @Test
  public void rejectsEmptyFlow() {
    assertSetupFails(flow(), "has no processors");
  }

  @Test
  public void rejectsInputWithoutStreams() {
    assertSetupFails(flow(processor(1, ImmutableList.of(input()), sortOn(0), passThrough(SYNC))),
        "processor 1 has an input without streams");
  }

  @Test
  public void rejectsDuplicateInputStream() {
    assertSetupFails(flow(
        values(1, ROWS, StreamEndpointSpec.local(1)),
        processor(2, ImmutableList.of(input(StreamEndpointSpec.local(1), StreamEndpointSpec.local(1))),
            sortOn(0), passThrough(SYNC))),
        "duplicate stream 1");
  }

  @Test
  public void rejectsRemoteOutputReusingInputId() {
    assertSetupFails(flow(
        values(1, ROWS, StreamEndpointSpec.remote(3, "node2")),
        processor(2, ImmutableList.of(input(StreamEndpointSpec.remote(3, null))), sortOn(0), passThrough(SYNC))),
        "duplicate stream 3");
  }

  @Test
  public void rejectsSyncResponseAsInput() {
    assertSetupFails(flow(processor(1, ImmutableList.of(input(SYNC)), sortOn(0), passThrough(SYNC))),
        "cannot be an input");
  }

  @Test
  public void rejectsMultipleOutputRouters() {
    assertSetupFails(flow(new ProcessorSpec(1, ImmutableList.<InputSyncSpec>of(), new ProcessorCoreSpec.Values(ROWS),
        ImmutableList.of(passThrough(SYNC), passThrough(SYNC)))),
        "processor 1 must have exactly one output router, has 2");
  }

  @Test
  public void rejectsLocalStreamWithoutConsumer() {
    assertSetupFails(flow(values(1, ROWS, StreamEndpointSpec.local(5))), "local stream 5 has no consumer");
  }

  @Test
  public void rejectsLocalStreamWithTwoProducers() {
    assertSetupFails(flow(
        values(1, ROWS, StreamEndpointSpec.local(1)),
        values(2, ROWS, StreamEndpointSpec.local(1)),
        processor(3, ImmutableList.of(input(StreamEndpointSpec.local(1))), sortOn(0), passThrough(SYNC))),
        "stream 1 has more than one producer");
  }

  @Test
  public void rejectsSyncResponseWithTwoProducers() {
    assertSetupFails(flow(
        values(1, ROWS, SYNC),
        processor(2, ImmutableList.of(input(StreamEndpointSpec.remote(4, null))), sortOn(0), passThrough(SYNC))),
        "processor 2 writes the synchronous response, which already has a producer");
  }

  @Test
  public void rejectsMirrorWritingSyncResponseTwice() {
    assertSetupFails(flow(new ProcessorSpec(1, ImmutableList.<InputSyncSpec>of(), new ProcessorCoreSpec.Values(ROWS),
        ImmutableList.of(mirror(SYNC, SYNC)))),
        "processor 1 writes the synchronous response, which already has a producer");
  }

  @Test
  public void rejectsRemoteOutputWithoutDialer() {
    assertSetupFails(flow(values(1, ROWS, StreamEndpointSpec.remote(7, "node2"))), "remote stream 7 has no target");
  }

  @Test
  public void rejectsSyncResponseWithoutConsumer() throws Exception {
    final FlowSpec spec = flow(values(1, ROWS, SYNC));
    final Flow flow = newFlow(null);
    try {
      flow.setup(spec);
      fail();
    } catch (FlowSetupException e) {
      assertThat(e.getMessage(), containsString("has no synchronous consumer"));
    } finally {
      flow.cleanup();
    }
  }

  @Test
  public void rejectsPassThroughWithTwoStreams() {
    assertSetupFails(flow(
        processor(1, ImmutableList.<InputSyncSpec>of(), new ProcessorCoreSpec.Values(ROWS),
            new OutputRouterSpec(OutputRouterSpec.Type.PASS_THROUGH,
                ImmutableList.of(StreamEndpointSpec.local(1), SYNC))),
        processor(2, ImmutableList.of(input(StreamEndpointSpec.local(1))), sortOn(0), passThrough(SYNC))),
        "pass-through router of processor 1 needs exactly one stream, has 2");
  }

  @Test
  public void rejectsEmptyMirror() {
    assertSetupFails(flow(processor(1, ImmutableList.<InputSyncSpec>of(), new ProcessorCoreSpec.Values(ROWS),
        mirror())), "mirror router of processor 1 has no streams");
  }

  @Test
  public void rejectsLocalStreamThatIsNeverProduced() {
    assertSetupFails(flow(processor(1, ImmutableList.of(input(StreamEndpointSpec.local(1))), sortOn(0),
        passThrough(SYNC))), "local stream 1 is consumed but never produced");
  }

  @Test
  public void rejectsWrongInputCount() {
    assertSetupFails(flow(processor(1, ImmutableList.<InputSyncSpec>of(), sortOn(0), passThrough(SYNC))),
        "processor 1 expects 1 inputs, got 0");
  }

  @Test
  public void localFlowRunsToCompletion() throws Exception {
    final FlowSpec spec = flow(
        processor(1, ImmutableList.<InputSyncSpec>of(), new ProcessorCoreSpec.Values(ROWS),
            mirror(StreamEndpointSpec.local(1), StreamEndpointSpec.local(2))),
        processor(2, ImmutableList.of(input(StreamEndpointSpec.local(1), StreamEndpointSpec.local(2))),
            sortOn(0), passThrough(SYNC)));
    final Flow flow = newFlow(consumer);
    final AtomicInteger done = new AtomicInteger();
    flow.setup(spec);
    assertEquals(Flow.State.SET_UP, flow.getState());
    assertEquals(2, flow.getProcessors().size());

    flow.start(done::incrementAndGet);
    assertSame(flow, registry.lookupFlow(flow.getId()));
    assertTrue(flow.awaitCompletion(10, TimeUnit.SECONDS));
    flow.awaitCompletionUninterruptibly();
    assertEquals(1, done.get());
    assertEquals(Flow.State.FINISHED, flow.getState());
    assertEquals(ImmutableList.of(Row.of(1), Row.of(1), Row.of(2), Row.of(2)), drain(consumer));

    flow.cleanup();
    assertEquals(Flow.State.CLEANED_UP, flow.getState());
    assertNull(registry.lookupFlow(flow.getId()));
    assertTrue(monitor.isStopped());
  }

  @Test
  public void runningFlowCannotBeCleanedUp() throws Exception {
    final FlowSpec spec = flow(processor(1, ImmutableList.of(input(StreamEndpointSpec.remote(4, null))),
        sortOn(0), passThrough(SYNC)));
    final Flow flow = newFlow(consumer);
    flow.setup(spec);
    assertEquals(ImmutableList.of(4), ImmutableList.copyOf(flow.getInboundStreamIds()));
    flow.start(null);
    try {
      flow.cleanup();
      fail();
    } catch (IllegalStateException e) {
      assertThat(e.getMessage(), containsString("cleaned up while running"));
    }

    flow.cancel();
    assertTrue(flow.isCancelled());
    flow.awaitCompletion();
    final RowOrMetadata cancelled = consumer.next();
    assertEquals(ErrorType.EXECUTION_ERROR, cancelled.getMeta().getError().getErrorType());
    flow.cleanup();
    assertTrue(monitor.isStopped());
  }
}
