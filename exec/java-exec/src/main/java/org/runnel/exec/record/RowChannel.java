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
package org.runnel.exec.record;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.base.Preconditions;

/**
 * Bounded buffer connecting one or more producers to a single consumer. Rows block the producer while the buffer is
 * full; metadata is always accepted so that errors are never held back by a slow consumer.
 * <p>
 * The stream ends when every producer called {@link #producerDone()}, or when the channel is
 * {@link #cancel(ProducerMetadata) cancelled}.
 */
public class RowChannel implements RowReceiver, RowSource {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notFull = lock.newCondition();
  private final Condition notEmpty = lock.newCondition();

  private final Deque<RowOrMetadata> buffer = new ArrayDeque<>();
  private final int capacity;
  private int rowsBuffered;
  private int producersLeft;
  private boolean consumerClosed;
  private boolean cancelled;

  public RowChannel(int capacity, int numProducers) {
    Preconditions.checkArgument(capacity > 0, "capacity must be positive");
    Preconditions.checkArgument(numProducers >= 0, "negative number of producers");
    this.capacity = capacity;
    this.producersLeft = numProducers;
  }

  @Override
  public ConsumerStatus push(Row row, ProducerMetadata meta) {
    Preconditions.checkArgument((row == null) != (meta == null), "exactly one of row and meta must be set");
    lock.lock();
    try {
      if (meta != null) {
        if (consumerClosed || cancelled) {
          return ConsumerStatus.CONSUMER_CLOSED;
        }
        buffer.addLast(new RowOrMetadata(null, meta));
        notEmpty.signal();
        return ConsumerStatus.NEED_MORE_ROWS;
      }
      while (rowsBuffered >= capacity && !consumerClosed && !cancelled) {
        notFull.await();
      }
      if (consumerClosed || cancelled) {
        return ConsumerStatus.CONSUMER_CLOSED;
      }
      buffer.addLast(new RowOrMetadata(row, null));
      rowsBuffered++;
      notEmpty.signal();
      return ConsumerStatus.NEED_MORE_ROWS;
    } catch (InterruptedException e) {
      // the flow is being cancelled; the producer stops as if the consumer went away
      Thread.currentThread().interrupt();
      return ConsumerStatus.CONSUMER_CLOSED;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void producerDone() {
    lock.lock();
    try {
      if (producersLeft > 0) {
        producersLeft--;
      }
      if (producersLeft == 0) {
        notEmpty.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public RowOrMetadata next() throws InterruptedException {
    lock.lock();
    try {
      while (buffer.isEmpty() && producersLeft > 0 && !cancelled) {
        notEmpty.await();
      }
      final RowOrMetadata next = buffer.pollFirst();
      if (next != null && next.getRow() != null) {
        rowsBuffered--;
        notFull.signal();
      }
      return next;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void consumerClosed() {
    lock.lock();
    try {
      consumerClosed = true;
      buffer.clear();
      rowsBuffered = 0;
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drops buffered rows, hands {@code meta} to the consumer and ends the stream. Producers see the consumer as
   * closed from now on.
   */
  public void cancel(ProducerMetadata meta) {
    lock.lock();
    try {
      if (cancelled) {
        return;
      }
      cancelled = true;
      buffer.clear();
      rowsBuffered = 0;
      if (!consumerClosed) {
        buffer.addLast(new RowOrMetadata(null, meta));
      }
      notFull.signalAll();
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isCancelled() {
    lock.lock();
    try {
      return cancelled;
    } finally {
      lock.unlock();
    }
  }
}
