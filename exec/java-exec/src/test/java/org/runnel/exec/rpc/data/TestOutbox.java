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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.runnel.exec.message.ProducerMessage;
import org.runnel.exec.record.ConsumerStatus;
import org.runnel.exec.record.ProducerMetadata;
import org.runnel.exec.record.Row;
import org.runnel.exec.rpc.OutboundStream;
import org.runnel.exec.rpc.RpcException;
import org.runnel.exec.rpc.StreamDialer;
import org.runnel.test.RunnelTest;

import com.google.common.collect.ImmutableList;

public class TestOutbox extends RunnelTest {
  private final UUID flowId = UUID.randomUUID();
  private StreamDialer dialer;
  private OutboundStream stream;

  @Before
  public void setupStream() throws Exception {
    dialer = mock(StreamDialer.class);
    stream = mock(OutboundStream.class);
    when(dialer.dial("node2")).thenReturn(stream);
  }

  private List<ProducerMessage> sent(int count) throws Exception {
    final ArgumentCaptor<ProducerMessage> captor = ArgumentCaptor.forClass(ProducerMessage.class);
    verify(stream, times(count)).send(captor.capture());
    return captor.getAllValues();
  }

  @Test
  public void headerGoesFirstThenRowsInBatches() throws Exception {
    final Outbox outbox = new Outbox(dialer, "node2", flowId, 4, 16, 2);
    for (int i = 0; i < 5; i++) {
      outbox.push(Row.of(i), null);
    }
    outbox.producerDone();
    outbox.run();

    final List<ProducerMessage> messages = sent(4);
    assertEquals(flowId, messages.get(0).getHeader().getFlowId());
    assertEquals(4, messages.get(0).getHeader().getStreamId());
    assertTrue(messages.get(0).getRows().isEmpty());
    assertEquals(ImmutableList.of(Row.of(0), Row.of(1)), messages.get(1).getRows());
    assertEquals(ImmutableList.of(Row.of(2), Row.of(3)), messages.get(2).getRows());
    assertEquals(ImmutableList.of(Row.of(4)), messages.get(3).getRows());
    assertNull(messages.get(3).getHeader());

    final InOrder order = inOrder(stream);
    order.verify(stream, times(4)).send(any(ProducerMessage.class));
    order.verify(stream).closeSend();
    assertNull(outbox.getError());
  }

  @Test
  public void metadataFlushesPendingRows() throws Exception {
    final Outbox outbox = new Outbox(dialer, "node2", flowId, 4, 16, 100);
    final ProducerMetadata meta = ProducerMetadata.forError(new IllegalStateException("bad row"), 2);
    outbox.push(Row.of(1), null);
    outbox.push(null, meta);
    outbox.producerDone();
    outbox.run();

    final List<ProducerMessage> messages = sent(2);
    assertEquals(ImmutableList.of(Row.of(1)), messages.get(1).getRows());
    assertSame(meta, messages.get(1).getMetadata().get(0));
  }

  @Test
  public void emptyStreamStillSendsHeader() throws Exception {
    final Outbox outbox = new Outbox(dialer, "node2", flowId, 4, 16, 2);
    outbox.producerDone();
    outbox.run();

    assertEquals(4, sent(1).get(0).getHeader().getStreamId());
    verify(stream).closeSend();
  }

  @Test
  public void failedSendClosesConsumer() throws Exception {
    final RpcException failure = new RpcException("connection reset");
    final Outbox outbox = new Outbox(dialer, "node2", flowId, 4, 16, 1);
    outbox.push(Row.of(1), null);
    doThrow(failure).when(stream).send(any(ProducerMessage.class));
    outbox.run();

    assertSame(failure, outbox.getError());
    assertEquals(ConsumerStatus.CONSUMER_CLOSED, outbox.push(Row.of(2), null));
    verify(stream).closeSend();
  }

  @Test
  public void failedDialIsReported() throws Exception {
    final RpcException failure = new RpcException("no route to node2");
    when(dialer.dial("node2")).thenThrow(failure);
    final Outbox outbox = new Outbox(dialer, "node2", flowId, 4, 16, 1);
    outbox.run();

    assertSame(failure, outbox.getError());
    verify(stream, never()).closeSend();
  }
}
