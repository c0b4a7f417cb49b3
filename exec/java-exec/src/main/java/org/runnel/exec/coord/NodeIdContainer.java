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

import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.base.Preconditions;

/**
 * Holds the node's cluster-assigned identity. Zero means the node has not joined the cluster yet.
 */
public class NodeIdContainer {
  public static final int UNRESOLVED = 0;

  private final AtomicInteger nodeId = new AtomicInteger(UNRESOLVED);

  public int get() {
    return nodeId.get();
  }

  /**
   * Resolves the identity. It can be set only once.
   */
  public void set(int id) {
    Preconditions.checkArgument(id != UNRESOLVED, "node id must not be zero");
    if (!nodeId.compareAndSet(UNRESOLVED, id) && nodeId.get() != id) {
      throw new IllegalStateException(String.format("node id already set to %d, cannot reset to %d",
          nodeId.get(), id));
    }
  }
}
