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
package org.runnel.exec.rpc.data;

import java.util.Collections;
import java.util.UUID;

import org.runnel.exec.message.ProducerMessage;
import org.runnel.exec.message.StreamHeader;
import org.runnel.exec.record.ProducerMetadata;
import org.runnel.exec.record.Row;
import org.runnel.exec.rpc.OutboundStream;
import org.runnel.exec.rpc.RpcException;
import org.runnel.exec.rpc.StreamDialer;

/**
 * Sends a processor's output to an inbound stream of a flow on another node. The header naming the target flow and
 * stream goes out as soon as the stream is dialed, so the consumer connects even if no rows follow.
 */
public class Outbox extends AbstractOutbox {
  private final StreamDialer dialer;
  private final String targetAddr;
  private final UUID flowId;
  private final int streamId;
  private OutboundStream stream;

  public Outbox(StreamDialer dialer, String targetAddr, UUID flowId, int streamId, int capacity, int flushRows) {
    super(capacity, flushRows);
    this.dialer = dialer;
    this.targetAddr = targetAddr;
    this.flowId = flowId;
    this.streamId = streamId;
  }

  @Override
  protected void open() throws RpcException {
    stream = dialer.dial(targetAddr);
    stream.send(new ProducerMessage(new StreamHeader(flowId, streamId),
        Collections.<Row>emptyList(), Collections.<ProducerMetadata>emptyList()));
  }

  @Override
  protected void send(ProducerMessage message) throws RpcException {
    stream.send(message);
  }

  @Override
  protected void finish() throws RpcException {
    if (stream != null) {
      stream.closeSend();
    }
  }

  public int getStreamId() {
    return streamId;
  }

  @Override
  public String toString() {
    return "Outbox[flow " + flowId + ", stream " + streamId + " to " + targetAddr + "]";
  }
}
