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

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import org.runnel.exec.record.RowReceiver;
import org.runnel.exec.work.flow.Flow;

/**
 * A producer stream attached to one inbound stream of a registered flow. Closing it tells the flow the stream is
 * finished; it must be closed once the producer's messages have been handed to {@link #getReceiver()}.
 */
public class InboundStreamConnection implements AutoCloseable {
  private final FlowRegistry registry;
  private final Flow flow;
  private final int streamId;
  private final RowReceiver receiver;
  private final AtomicBoolean closed = new AtomicBoolean();

  InboundStreamConnection(FlowRegistry registry, Flow flow, int streamId, RowReceiver receiver) {
    this.registry = registry;
    this.flow = flow;
    this.streamId = streamId;
    this.receiver = receiver;
  }

  public Flow getFlow() {
    return flow;
  }

  public UUID getFlowId() {
    return flow.getId();
  }

  public int getStreamId() {
    return streamId;
  }

  public RowReceiver getReceiver() {
    return receiver;
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      registry.finishInboundStream(flow, streamId);
    }
  }
}
