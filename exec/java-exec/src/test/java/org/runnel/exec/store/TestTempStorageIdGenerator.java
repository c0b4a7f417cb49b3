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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.Test;
import org.runnel.test.RunnelTest;

import com.google.common.primitives.UnsignedBytes;

public class TestTempStorageIdGenerator extends RunnelTest {

  @Test
  public void idsAreUniqueAcrossThreads() throws Exception {
    final TempStorageIdGenerator generator = new TempStorageIdGenerator();
    final Set<Long> ids = ConcurrentHashMap.newKeySet();
    final ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      final List<Callable<Void>> tasks = new ArrayList<>();
      for (int t = 0; t < 8; t++) {
        tasks.add(() -> {
          for (int i = 0; i < 1000; i++) {
            ids.add(generator.newId());
          }
          return null;
        });
      }
      for (Future<Void> future : pool.invokeAll(tasks)) {
        future.get();
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(8000, ids.size());
    for (long id = 1; id <= 8000; id++) {
      assertTrue("missing id " + id, ids.contains(id));
    }
  }

  @Test
  public void prefixesOrderLikeIds() {
    assertArrayEquals(new byte[] {0, 0, 0, 0, 0, 0, 1, 0}, TempStorageIdGenerator.prefix(256));
    assertTrue(UnsignedBytes.lexicographicalComparator()
        .compare(TempStorageIdGenerator.prefix(255), TempStorageIdGenerator.prefix(256)) < 0);
  }
}
