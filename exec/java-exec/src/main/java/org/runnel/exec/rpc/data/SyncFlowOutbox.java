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

import org.runnel.exec.message.ProducerMessage;
import org.runnel.exec.rpc.RpcException;
import org.runnel.exec.rpc.SyncFlowStream;

/**
 * Streams a flow's output back to the client of the synchronous flow RPC. The caller of the RPC closes the stream,
 * so finishing sends nothing.
 */
public class SyncFlowOutbox extends AbstractOutbox {
  private final SyncFlowStream stream;

  public SyncFlowOutbox(SyncFlowStream stream, int capacity, int flushRows) {
    super(capacity, flushRows);
    this.stream = stream;
  }

  @Override
  protected void open() {
  }

  @Override
  protected void send(ProducerMessage message) throws RpcException {
    stream.send(message);
  }

  @Override
  protected void finish() {
  }

  @Override
  public String toString() {
    return "SyncFlowOutbox";
  }
}
