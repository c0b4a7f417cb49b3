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
package org.runnel.exec.message;

import java.util.List;

import org.runnel.exec.record.ProducerMetadata;
import org.runnel.exec.record.Row;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * A batch of rows and metadata sent by a producer to a consumer on another node, or back to the client of a
 * synchronous flow.
 */
@JsonInclude(Include.NON_NULL)
public class ProducerMessage {
  private final StreamHeader header;
  private final List<Row> rows;
  private final List<ProducerMetadata> metadata;

  @JsonCreator
  public ProducerMessage(@JsonProperty("header") StreamHeader header,
                         @JsonProperty("rows") List<Row> rows,
                         @JsonProperty("metadata") List<ProducerMetadata> metadata) {
    this.header = header;
    this.rows = rows == null ? ImmutableList.<Row>of() : ImmutableList.copyOf(rows);
    this.metadata = metadata == null ? ImmutableList.<ProducerMetadata>of() : ImmutableList.copyOf(metadata);
  }

  @JsonProperty("header")
  public StreamHeader getHeader() {
    return header;
  }

  @JsonProperty("rows")
  public List<Row> getRows() {
    return rows;
  }

  @JsonProperty("metadata")
  public List<ProducerMetadata> getMetadata() {
    return metadata;
  }
}
