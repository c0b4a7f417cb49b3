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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

/**
 * One end of a stream between processors.
 */
@JsonInclude(Include.NON_NULL)
public class StreamEndpointSpec {

  public enum Type {
    /** Both ends live in the same flow. */
    LOCAL,
    /** The other end lives on another node; outputs name its address. */
    REMOTE,
    /** The flow's output, streamed back on the synchronous RPC. */
    SYNC_RESPONSE
  }

  private final Type type;
  private final int streamId;
  private final String targetAddr;

  @JsonCreator
  public StreamEndpointSpec(@JsonProperty("type") Type type,
                            @JsonProperty("streamId") int streamId,
                            @JsonProperty("targetAddr") String targetAddr) {
    this.type = type;
    this.streamId = streamId;
    this.targetAddr = targetAddr;
  }

  public static StreamEndpointSpec local(int streamId) {
    return new StreamEndpointSpec(Type.LOCAL, streamId, null);
  }

  public static StreamEndpointSpec remote(int streamId, String targetAddr) {
    return new StreamEndpointSpec(Type.REMOTE, streamId, targetAddr);
  }

  public static StreamEndpointSpec syncResponse() {
    return new StreamEndpointSpec(Type.SYNC_RESPONSE, 0, null);
  }

  @JsonProperty("type")
  public Type getType() {
    return type;
  }

  @JsonProperty("streamId")
  public int getStreamId() {
    return streamId;
  }

  @JsonProperty("targetAddr")
  public String getTargetAddr() {
    return targetAddr;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("type", type)
        .add("streamId", streamId)
        .add("targetAddr", targetAddr)
        .omitNullValues()
        .toString();
  }
}
