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
import org.runnel.exec.record.ConsumerStatus;
import org.runnel.exec.record.ProducerMetadata;
import org.runnel.exec.record.Row;
import org.runnel.exec.record.RowReceiver;
import org.runnel.exec.rpc.InboundStream;
import org.runnel.exec.rpc.RpcException;

/**
 * Feeds the messages of an inbound stream to the receiver the flow registered for it.
 */
public class InboundStreamProcessor {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(InboundStreamProcessor.class);

  private InboundStreamProcessor() {
  }

  /**
   * Pushes the rows and metadata of {@code firstMessage} and every following message, in order, until the stream
   * ends or the receiver needs no more rows. The receiver always gets {@link RowReceiver#producerDone()}.
   *
   * @throws RpcException if receiving fails; the receiver gets the error as metadata first
   */
  public static void process(InboundStream stream, ProducerMessage firstMessage, RowReceiver receiver, int nodeId)
      throws RpcException {
    try {
      ProducerMessage message = firstMessage;
      while (message != null) {
        if (!forward(message, receiver)) {
          logger.debug("Consumer closed, dropping the rest of the stream");
          return;
        }
        message = stream.receive();
      }
    } catch (RpcException e) {
      receiver.push(null, ProducerMetadata.forError(e, nodeId));
      throw e;
    } finally {
      receiver.producerDone();
    }
  }

  private static boolean forward(ProducerMessage message, RowReceiver receiver) {
    for (Row row : message.getRows()) {
      if (receiver.push(row, null) == ConsumerStatus.CONSUMER_CLOSED) {
        return false;
      }
    }
    for (ProducerMetadata meta : message.getMetadata()) {
      if (receiver.push(null, meta) == ConsumerStatus.CONSUMER_CLOSED) {
        return false;
      }
    }
    return true;
  }
}
