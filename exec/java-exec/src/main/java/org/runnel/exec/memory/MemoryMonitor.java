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

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.google.common.base.Preconditions;

/**
 * Hierarchical byte accounting. A monitor has a budget and an optional parent; every reservation is first
 * taken from the parent chain and only then from this monitor, so the usage of a monitor always includes the
 * usage of its children. Usage is tracked with compare-and-set on an {@link AtomicLong}, so monitors may be
 * shared by any number of threads.
 * <p>
 * Memory is handed to code through {@link BoundAccount}s. A monitor is stopped exactly once, at which point any
 * remaining usage is reported as a leak and returned to the parent.
 */
public class MemoryMonitor implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(MemoryMonitor.class);

  public static final long UNLIMITED = Long.MAX_VALUE;

  static final String LEAK_ERROR = "%s: memory leaked while stopping the monitor, %d bytes still allocated.";

  private final String name;
  private final long limit;
  private final MemoryMonitor parent;
  private final long noteworthyBytes;
  private final boolean errorOnLeak;
  private final Counter curBytesCount;
  private final Histogram maxBytesHist;

  private final AtomicLong used = new AtomicLong();
  private final AtomicLong maxUsed = new AtomicLong();
  private final AtomicBoolean stopped = new AtomicBoolean();

  private MemoryMonitor(String name, long limit, MemoryMonitor parent, long noteworthyBytes, boolean errorOnLeak,
                        Counter curBytesCount, Histogram maxBytesHist) {
    Preconditions.checkArgument(limit >= 0, "Memory limit must be non-negative: %s", limit);
    this.name = name;
    this.limit = limit;
    this.parent = parent;
    this.noteworthyBytes = noteworthyBytes;
    this.errorOnLeak = errorOnLeak;
    this.curBytesCount = curBytesCount;
    this.maxBytesHist = maxBytesHist;
  }

  /**
   * Creates a monitor without a parent.
   *
   * @param noteworthyBytes usage above which new maxima are logged
   * @param curBytesCount optional counter tracking the current usage
   * @param maxBytesHist optional histogram receiving the maximum usage when the monitor stops
   */
  public static MemoryMonitor newRoot(String name, long limit, long noteworthyBytes, boolean errorOnLeak,
                                      Counter curBytesCount, Histogram maxBytesHist) {
    return new MemoryMonitor(name, limit, null, noteworthyBytes, errorOnLeak, curBytesCount, maxBytesHist);
  }

  public MemoryMonitor newChild(String childName, long childLimit) {
    return newChild(childName, childLimit, noteworthyBytes, null, null);
  }

  public MemoryMonitor newChild(String childName, long childLimit, long childNoteworthyBytes,
                                Counter childCurBytesCount, Histogram childMaxBytesHist) {
    Preconditions.checkState(!stopped.get(), "%s: cannot create a child of a stopped monitor", name);
    return new MemoryMonitor(childName, childLimit, this, childNoteworthyBytes, errorOnLeak,
        childCurBytesCount, childMaxBytesHist);
  }

  public BoundAccount makeBoundAccount() {
    Preconditions.checkState(!stopped.get(), "%s: cannot open an account on a stopped monitor", name);
    return new BoundAccount(this);
  }

  /**
   * Reserves bytes from the parent chain and then from this monitor.
   *
   * @throws OutOfMemoryException if this monitor or an ancestor would exceed its budget; nothing stays reserved
   */
  void reserve(long bytes) {
    Preconditions.checkArgument(bytes >= 0, "negative reservation: %s", bytes);
    Preconditions.checkState(!stopped.get(), "%s: reservation on a stopped monitor", name);
    if (bytes == 0) {
      return;
    }
    if (parent != null) {
      parent.reserve(bytes);
    }

    long current;
    long next;
    do {
      current = used.get();
      next = current + bytes;
      if (next > limit || next < 0) {
        if (parent != null) {
          parent.release(bytes);
        }
        throw new OutOfMemoryException(name, bytes, current, limit);
      }
    } while (!used.compareAndSet(current, next));

    if (curBytesCount != null) {
      curBytesCount.inc(bytes);
    }
    noteNewUsage(next, bytes);
  }

  private void noteNewUsage(long usage, long delta) {
    long max;
    do {
      max = maxUsed.get();
      if (usage <= max) {
        return;
      }
    } while (!maxUsed.compareAndSet(max, usage));

    if (usage > noteworthyBytes) {
      logger.info("{}: bytes usage increases to {} (+{})", name, usage, delta);
    }
  }

  void release(long bytes) {
    Preconditions.checkArgument(bytes >= 0, "negative release: %s", bytes);
    if (bytes == 0) {
      return;
    }
    long current;
    do {
      current = used.get();
      if (bytes > current) {
        throw new IllegalStateException(String.format(
            "%s: releasing %d bytes while only %d are allocated", name, bytes, current));
      }
    } while (!used.compareAndSet(current, current - bytes));

    if (curBytesCount != null) {
      curBytesCount.dec(bytes);
    }
    if (parent != null) {
      parent.release(bytes);
    }
  }

  /**
   * Stops the monitor. Bytes still allocated are a leak: they are logged, or thrown as an
   * {@link IllegalStateException} when the monitor was configured to fail on leaks, and in both cases
   * returned to the parent.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      logger.warn("{}: tried to stop a monitor that was already stopped", name);
      return;
    }
    if (maxBytesHist != null) {
      maxBytesHist.update(maxUsed.get());
    }

    final long leaked = used.getAndSet(0);
    if (leaked == 0) {
      logger.debug("{}: stopped, max usage {} bytes", name, maxUsed.get());
      return;
    }

    if (curBytesCount != null) {
      curBytesCount.dec(leaked);
    }
    if (parent != null) {
      parent.release(leaked);
    }
    final IllegalStateException e = new IllegalStateException(String.format(LEAK_ERROR, name, leaked));
    if (errorOnLeak) {
      throw e;
    }
    logger.error("Memory leaked.", e);
  }

  @Override
  public void close() {
    stop();
  }

  public String getName() {
    return name;
  }

  public long getLimit() {
    return limit;
  }

  public long getUsed() {
    return used.get();
  }

  public long getMaxUsed() {
    return maxUsed.get();
  }

  public boolean isStopped() {
    return stopped.get();
  }

  @Override
  public String toString() {
    return name + " [used=" + used.get() + ", limit=" + (limit == UNLIMITED ? "unlimited" : limit) + "]";
  }
}
