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

import java.io.IOException;
import java.util.Iterator;

/**
 * Node-local scratch engine that processors spill to when they run out of memory. Callers own disjoint key
 * prefixes handed out by {@link TempStorageIdGenerator}, so no two writers ever touch the same key.
 */
public interface TempStorage {

  void put(byte[] key, byte[] value) throws IOException;

  /**
   * @return the values of every key starting with {@code prefix}, in key order
   */
  Iterator<byte[]> scan(byte[] prefix) throws IOException;

  void clearPrefix(byte[] prefix) throws IOException;
}
