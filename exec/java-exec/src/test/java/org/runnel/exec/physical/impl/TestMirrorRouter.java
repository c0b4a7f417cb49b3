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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;
import org.runnel.exec.record.ConsumerStatus;
import org.runnel.exec.record.Row;
import org.runnel.exec.record.RowChannel;
import org.runnel.exec.record.RowReceiver;
import org.runnel.test.RunnelTest;

import com.google.common.collect.ImmutableList;

public class TestMirrorRouter extends RunnelTest {

  @Test
  public void everyStreamSeesEveryRow() throws Exception {
    final RowChannel left = new RowChannel(4, 1);
    final RowChannel right = new RowChannel(4, 1);
    final MirrorRouter router = new MirrorRouter(ImmutableList.<RowReceiver>of(left, right));

    router.push(Row.of(1), null);
    router.producerDone();

    assertEquals(Row.of(1), left.next().getRow());
    assertEquals(Row.of(1), right.next().getRow());
    assertNull(left.next());
    assertNull(right.next());
  }

  @Test
  public void closedOnlyWhenAllStreamsClose() {
    final RowChannel left = new RowChannel(4, 1);
    final RowChannel right = new RowChannel(4, 1);
    final MirrorRouter router = new MirrorRouter(ImmutableList.<RowReceiver>of(left, right));

    left.consumerClosed();
    assertEquals(ConsumerStatus.NEED_MORE_ROWS, router.push(Row.of(1), null));
    right.consumerClosed();
    assertEquals(ConsumerStatus.CONSUMER_CLOSED, router.push(Row.of(2), null));
  }
}
