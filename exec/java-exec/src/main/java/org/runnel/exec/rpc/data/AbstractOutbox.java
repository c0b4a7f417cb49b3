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

import java.util.ArrayList;
import java.util.List;

import org.runnel.exec.message.ProducerMessage;
import org.runnel.exec.record.ProducerMetadata;
import org.runnel.exec.record.Row;
import org.runnel.exec.record.RowChannel;
import org.runnel.exec.record.RowOrMetadata;
import org.runnel.exec.rpc.RpcException;

/**
 * A single-producer channel whose consumer is a network stream. Rows are sent in batches of
 * {@code flushRows}; metadata is sent as soon as it arrives.
 * <p>
 * A failed send ends the outbox: the producer sees the consumer as closed and the failure is kept for
 * {@link #getError()}.
 */
public abstract class AbstractOutbox extends RowChannel implements Runnable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AbstractOutbox.class);

  private final int flushRows;
  private volatile RpcException error;

  protected AbstractOutbox(int capacity, int flushRows) {
    super(capacity, 1);
    this.flushRows = flushRows;
  }

  /**
   * Called on the outbox thread before the first message.
   */
  protected abstract void open() throws RpcException;

  protected abstract void send(ProducerMessage message) throws RpcException;

  /**
   * Called after the last message, including after a failure.
   */
  protected abstract void finish() throws RpcException;

  @Override
  public void run() {
    try {
      open();
      final List<Row> rows = new ArrayList<>();
      final List<ProducerMetadata> metadata = new ArrayList<>();
      RowOrMetadata next;
      while ((next = next()) != null) {
        if (next.isMetadata()) {
          metadata.add(next.getMeta());
        } else {
          rows.add(next.getRow());
        }
        if (rows.size() >= flushRows || !metadata.isEmpty()) {
          flush(rows, metadata);
        }
      }
      flush(rows, metadata);
    } catch (RpcException e) {
      logger.warn("{} failed to send", this, e);
      if (error == null) {
        error = e;
      }
      consumerClosed();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      consumerClosed();
    } finally {
      try {
        finish();
      } catch (RpcException e) {
        logger.warn("{} failed to close its stream", this, e);
        if (error == null) {
          error = e;
        }
      }
    }
  }

  private void flush(List<Row> rows, List<ProducerMetadata> metadata) throws RpcException {
    if (rows.isEmpty() && metadata.isEmpty()) {
      return;
    }
    send(new ProducerMessage(null, rows, metadata));
    rows.clear();
    metadata.clear();
  }

  /**
   * @return the first send failure, {@code null} if every message went out
   */
  public RpcException getError() {
    return error;
  }
}
