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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.After;
import org.junit.Test;
import org.runnel.common.exceptions.UserException;
import org.runnel.test.RunnelTest;

public class TestRowChannel extends RunnelTest {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TestRowChannel.class);

  private final ExecutorService producers = Executors.newCachedThreadPool();

  @After
  public void shutdown() {
    producers.shutdownNow();
  }

  private static ProducerMetadata error(String message) {
    return ProducerMetadata.forError(UserException.executionError().message(message).build(logger), 1);
  }

  @Test
  public void streamEndsWhenAllProducersAreDone() throws Exception {
    final RowChannel channel = new RowChannel(8, 2);
    channel.push(Row.of(1), null);
    channel.producerDone();
    channel.push(Row.of(2), null);

    assertEquals(Row.of(1), channel.next().getRow());
    assertEquals(Row.of(2), channel.next().getRow());
    final Future<RowOrMetadata> pending = producers.submit(channel::next);
    try {
      pending.get(100, TimeUnit.MILLISECONDS);
      throw new AssertionError("next() returned before the last producer finished");
    } catch (TimeoutException expected) {
      // still waiting for the second producer
    }
    channel.producerDone();
    assertNull(pending.get(5, TimeUnit.SECONDS));
  }

  @Test
  public void metadataIsNotBoundByCapacity() throws Exception {
    final RowChannel channel = new RowChannel(1, 1);
    assertEquals(ConsumerStatus.NEED_MORE_ROWS, channel.push(Row.of(1), null));
    final ProducerMetadata meta = error("boom");
    assertEquals(ConsumerStatus.NEED_MORE_ROWS, channel.push(null, meta));

    assertEquals(Row.of(1), channel.next().getRow());
    assertSame(meta, channel.next().getMeta());
  }

  @Test
  public void fullChannelBlocksProducerUntilConsumed() throws Exception {
    final RowChannel channel = new RowChannel(1, 1);
    channel.push(Row.of(1), null);
    final Future<ConsumerStatus> blocked = producers.submit(() -> channel.push(Row.of(2), null));
    Thread.sleep(100);
    assertFalse(blocked.isDone());

    assertEquals(Row.of(1), channel.next().getRow());
    assertEquals(ConsumerStatus.NEED_MORE_ROWS, blocked.get(5, TimeUnit.SECONDS));
    assertEquals(Row.of(2), channel.next().getRow());
  }

  @Test
  public void closedConsumerReleasesBlockedProducer() throws Exception {
    final RowChannel channel = new RowChannel(1, 1);
    channel.push(Row.of(1), null);
    final Future<ConsumerStatus> blocked = producers.submit(() -> channel.push(Row.of(2), null));
    Thread.sleep(50);

    channel.consumerClosed();
    assertEquals(ConsumerStatus.CONSUMER_CLOSED, blocked.get(5, TimeUnit.SECONDS));
    assertEquals(ConsumerStatus.CONSUMER_CLOSED, channel.push(null, error("late")));
  }

  @Test
  public void cancelReplacesBufferedRowsWithMetadata() throws Exception {
    final RowChannel channel = new RowChannel(4, 1);
    channel.push(Row.of(1), null);
    channel.push(Row.of(2), null);
    final ProducerMetadata cancelled = error("cancelled");

    channel.cancel(cancelled);
    channel.cancel(error("twice"));
    assertTrue(channel.isCancelled());
    assertEquals(ConsumerStatus.CONSUMER_CLOSED, channel.push(Row.of(3), null));

    assertSame(cancelled, channel.next().getMeta());
    assertNull(channel.next());
  }

  @Test
  public void interruptedProducerSeesClosedConsumer() throws Exception {
    final RowChannel channel = new RowChannel(1, 1);
    channel.push(Row.of(1), null);
    final Future<Boolean> result = producers.submit(() -> {
      Thread.currentThread().interrupt();
      final ConsumerStatus status = channel.push(Row.of(2), null);
      return status == ConsumerStatus.CONSUMER_CLOSED && Thread.interrupted();
    });
    assertTrue(result.get(5, TimeUnit.SECONDS));
  }
}
