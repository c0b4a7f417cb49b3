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

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Names the flow and inbound stream a producer stream feeds. Sent on the first message only.
 */
public class StreamHeader {
  private final UUID flowId;
  private final int streamId;

  @JsonCreator
  public StreamHeader(@JsonProperty("flowId") UUID flowId,
                      @JsonProperty("streamId") int streamId) {
    this.flowId = flowId;
    this.streamId = streamId;
  }

  @JsonProperty("flowId")
  public UUID getFlowId() {
    return flowId;
  }

  @JsonProperty("streamId")
  public int getStreamId() {
    return streamId;
  }
}
