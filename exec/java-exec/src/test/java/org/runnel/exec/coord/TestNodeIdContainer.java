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
package org.runnel.exec.coord;

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.runnel.test.RunnelTest;

public class TestNodeIdContainer extends RunnelTest {

  @Test
  public void startsUnresolvedAndIsSetOnce() {
    final NodeIdContainer nodeId = new NodeIdContainer();
    assertEquals(NodeIdContainer.UNRESOLVED, nodeId.get());
    nodeId.set(4);
    nodeId.set(4);
    assertEquals(4, nodeId.get());
  }

  @Test(expected = IllegalStateException.class)
  public void cannotChangeResolvedId() {
    final NodeIdContainer nodeId = new NodeIdContainer();
    nodeId.set(4);
    nodeId.set(5);
  }

  @Test(expected = IllegalArgumentException.class)
  public void zeroIsNotAnId() {
    new NodeIdContainer().set(NodeIdContainer.UNRESOLVED);
  }
}
