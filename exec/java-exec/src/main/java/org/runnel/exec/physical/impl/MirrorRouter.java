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
package org.runnel.exec.physical.impl;

import java.util.List;

import org.runnel.exec.record.ConsumerStatus;
import org.runnel.exec.record.ProducerMetadata;
import org.runnel.exec.record.Row;
import org.runnel.exec.record.RowReceiver;

import com.google.common.collect.ImmutableList;

/**
 * Sends every row and metadata record to all of its streams. Reports the consumer closed only once every stream is.
 */
public class MirrorRouter implements RowReceiver {
  private final List<RowReceiver> streams;
  private final boolean[] closed;

  public MirrorRouter(List<RowReceiver> streams) {
    this.streams = ImmutableList.copyOf(streams);
    this.closed = new boolean[streams.size()];
  }

  @Override
  public ConsumerStatus push(Row row, ProducerMetadata meta) {
    boolean anyOpen = false;
    for (int i = 0; i < streams.size(); i++) {
      if (!closed[i]) {
        closed[i] = streams.get(i).push(row, meta) == ConsumerStatus.CONSUMER_CLOSED;
        anyOpen |= !closed[i];
      }
    }
    return anyOpen ? ConsumerStatus.NEED_MORE_ROWS : ConsumerStatus.CONSUMER_CLOSED;
  }

  @Override
  public void producerDone() {
    for (RowReceiver stream : streams) {
      stream.producerDone();
    }
  }
}
