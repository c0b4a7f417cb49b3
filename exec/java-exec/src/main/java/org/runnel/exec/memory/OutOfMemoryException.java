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
package org.runnel.exec.memory;

import org.runnel.common.exceptions.RunnelRuntimeException;

/**
 * Thrown when a reservation would take a {@link MemoryMonitor}, or one of its ancestors, over its budget.
 * The account that asked for the memory is left unchanged.
 */
public class OutOfMemoryException extends RunnelRuntimeException {
  private static final long serialVersionUID = -6858052345185793382L;

  private final String monitorName;
  private final long requested;
  private final long used;
  private final long limit;

  public OutOfMemoryException(String monitorName, long requested, long used, long limit) {
    super(String.format("%s: memory budget exceeded: %d bytes requested, %d currently allocated, %d bytes in budget",
        monitorName, requested, used, limit));
    this.monitorName = monitorName;
    this.requested = requested;
    this.used = used;
    this.limit = limit;
  }

  public String getMonitorName() {
    return monitorName;
  }

  public long getRequested() {
    return requested;
  }

  public long getUsed() {
    return used;
  }

  public long getLimit() {
    return limit;
  }
}
