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
package org.runnel.exec.rpc;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ThreadFactory} naming its threads with a fixed prefix followed by a sequence number. Threads are daemons
 * so that a pool left open never keeps the process alive.
 * <p>
 * Concurrency: thread-safe, the only state is the atomic counter.
 * </p>
 */
public class NamedThreadFactory implements ThreadFactory {
  private final AtomicInteger nextThreadNumber = new AtomicInteger(1);
  private final String prefix;

  /**
   * @param prefix the prefix to use for thread names; will have sequential number appended
   */
  public NamedThreadFactory(String prefix) {
    this.prefix = prefix;
  }

  @Override
  public Thread newThread(Runnable r) {
    final Thread thread = new Thread(r, prefix + nextThreadNumber.getAndIncrement());
    thread.setDaemon(true);
    return thread;
  }
}
