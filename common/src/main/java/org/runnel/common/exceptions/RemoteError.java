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
package org.runnel.common.exceptions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

/**
 * Serializable form of a {@link UserException}. It travels inside setup responses and inside stream
 * metadata, and is turned back into an exception on the receiving node by {@link UserRemoteException}.
 */
@JsonInclude(Include.NON_NULL)
public class RemoteError {

  private final ErrorType errorType;
  private final String errorId;
  private final int nodeId;
  private final String message;
  private final String exceptionClass;

  @JsonCreator
  public RemoteError(@JsonProperty("errorType") ErrorType errorType,
                     @JsonProperty("errorId") String errorId,
                     @JsonProperty("nodeId") int nodeId,
                     @JsonProperty("message") String message,
                     @JsonProperty("exceptionClass") String exceptionClass) {
    this.errorType = errorType == null ? ErrorType.SYSTEM : errorType;
    this.errorId = errorId;
    this.nodeId = nodeId;
    this.message = message;
    this.exceptionClass = exceptionClass;
  }

  @JsonProperty("errorType")
  public ErrorType getErrorType() {
    return errorType;
  }

  @JsonProperty("errorId")
  public String getErrorId() {
    return errorId;
  }

  @JsonProperty("nodeId")
  public int getNodeId() {
    return nodeId;
  }

  @JsonProperty("message")
  public String getMessage() {
    return message;
  }

  /**
   * Class name of the exception wrapped by the original user exception, or null.
   */
  @JsonProperty("exceptionClass")
  public String getExceptionClass() {
    return exceptionClass;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("errorType", errorType)
        .add("errorId", errorId)
        .add("nodeId", nodeId)
        .add("message", message)
        .toString();
  }
}
