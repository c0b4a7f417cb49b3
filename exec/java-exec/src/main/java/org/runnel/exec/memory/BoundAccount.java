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

import com.google.common.base.Preconditions;

/**
 * A running byte count owned by a single component and backed by a {@link MemoryMonitor}. Not thread safe:
 * each account belongs to one processor or to one flow.
 */
public class BoundAccount implements AutoCloseable {
  private final MemoryMonitor monitor;
  private long used;
  private boolean closed;

  BoundAccount(MemoryMonitor monitor) {
    this.monitor = monitor;
  }

  /**
   * Adds bytes to the account.
   *
   * @throws OutOfMemoryException if the budget of the monitor or one of its ancestors would be exceeded; the
   *         account is left unchanged
   */
  public void grow(long bytes) {
    Preconditions.checkState(!closed, "account on %s is closed", monitor.getName());
    monitor.reserve(bytes);
    used += bytes;
  }

  public void shrink(long bytes) {
    Preconditions.checkArgument(bytes <= used, "%s: cannot shrink account by %s bytes, only %s in use",
        monitor.getName(), bytes, used);
    monitor.release(bytes);
    used -= bytes;
  }

  /**
   * Adjusts the account after an item changed size from {@code oldSize} to {@code newSize}.
   */
  public void resize(long oldSize, long newSize) {
    final long delta = newSize - oldSize;
    if (delta > 0) {
      grow(delta);
    } else if (delta < 0) {
      shrink(-delta);
    }
  }

  public void clear() {
    monitor.release(used);
    used = 0;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    clear();
    closed = true;
  }

  public long used() {
    return used;
  }

  public MemoryMonitor getMonitor() {
    return monitor;
  }
}
