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
package org.runnel.exec.rpc;

import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;

import org.runnel.exec.message.ProducerMessage;
import org.runnel.exec.server.FlowServer;

/**
 * In-process transport between flow servers. Dialing an address opens a pipe and serves its receiving end with
 * {@link FlowServer#flowStream(InboundStream)} on a transport thread, the way an RPC server would.
 */
public class LocalTransport implements StreamDialer, AutoCloseable {
  private final Map<String, FlowServer> nodes = new ConcurrentHashMap<>();
  private final ExecutorService executor = Executors.newCachedThreadPool(new NamedThreadFactory("local-transport-"));
  private final List<Exception> serverErrors = new CopyOnWriteArrayList<>();

  public void addNode(String address, FlowServer server) {
    nodes.put(address, server);
  }

  @Override
  public OutboundStream dial(String address) throws RpcException {
    final FlowServer server = nodes.get(address);
    if (server == null) {
      throw new RpcException("no node at " + address);
    }
    final Pipe pipe = new Pipe();
    executor.execute(() -> {
      try {
        server.flowStream(pipe);
      } catch (Exception e) {
        serverErrors.add(e);
      }
    });
    return pipe;
  }

  /**
   * @return the failures of the inbound stream handlers run so far
   */
  public List<Exception> getServerErrors() {
    return serverErrors;
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  public static class Pipe implements OutboundStream, InboundStream {
    private static final ProducerMessage EOF = new ProducerMessage(null, null, null);

    private final BlockingQueue<ProducerMessage> queue = new LinkedBlockingQueue<>();

    @Override
    public void send(ProducerMessage message) {
      queue.add(message);
    }

    @Override
    public void closeSend() {
      queue.add(EOF);
    }

    @Override
    public ProducerMessage receive() throws RpcException {
      try {
        final ProducerMessage message = queue.take();
        return message == EOF ? null : message;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RpcException("interrupted while receiving", e);
      }
    }
  }
}
