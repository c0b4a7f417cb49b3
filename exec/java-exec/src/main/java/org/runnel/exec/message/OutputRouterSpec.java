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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * Routes a processor's output to one or more streams.
 */
public class OutputRouterSpec {

  public enum Type {
    /** Exactly one stream receives every row. */
    PASS_THROUGH,
    /** Every stream receives every row. */
    MIRROR
  }

  private final Type type;
  private final List<StreamEndpointSpec> streams;

  @JsonCreator
  public OutputRouterSpec(@JsonProperty("type") Type type,
                          @JsonProperty("streams") List<StreamEndpointSpec> streams) {
    this.type = type == null ? Type.PASS_THROUGH : type;
    this.streams = streams == null ? ImmutableList.<StreamEndpointSpec>of() : ImmutableList.copyOf(streams);
  }

  @JsonProperty("type")
  public Type getType() {
    return type;
  }

  @JsonProperty("streams")
  public List<StreamEndpointSpec> getStreams() {
    return streams;
  }
}
