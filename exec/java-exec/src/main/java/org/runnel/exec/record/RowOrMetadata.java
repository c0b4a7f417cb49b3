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
package org.runnel.exec.record;

/**
 * One element read from a {@link RowSource}: a row or a metadata record.
 */
public final class RowOrMetadata {
  private final Row row;
  private final ProducerMetadata meta;

  RowOrMetadata(Row row, ProducerMetadata meta) {
    this.row = row;
    this.meta = meta;
  }

  public Row getRow() {
    return row;
  }

  public ProducerMetadata getMeta() {
    return meta;
  }

  public boolean isMetadata() {
    return meta != null;
  }
}
