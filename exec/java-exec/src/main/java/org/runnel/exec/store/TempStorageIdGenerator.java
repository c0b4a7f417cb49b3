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
package org.runnel.exec.store;

import java.util.concurrent.atomic.AtomicLong;

import com.google.common.primitives.Longs;

/**
 * Hands out identifiers that are unique for the lifetime of the process. Each identifier owns the temp-storage
 * key prefix returned by {@link #prefix(long)}.
 */
public class TempStorageIdGenerator {
  private final AtomicLong lastId = new AtomicLong();

  private static class GeneratorHolder {
    public static final TempStorageIdGenerator INSTANCE = new TempStorageIdGenerator();
  }

  /**
   * @return the generator shared by every server in this process
   */
  public static TempStorageIdGenerator getInstance() {
    return GeneratorHolder.INSTANCE;
  }

  public long newId() {
    return lastId.incrementAndGet();
  }

  /**
   * @return the 8-byte big-endian encoding of {@code id}
   */
  public static byte[] prefix(long id) {
    return Longs.toByteArray(id);
  }
}
