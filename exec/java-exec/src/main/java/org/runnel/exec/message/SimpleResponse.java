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

import org.runnel.common.exceptions.RemoteError;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response to the unary setup call. Deployment failures travel inside the response, not as a transport error.
 */
@JsonInclude(Include.NON_NULL)
public class SimpleResponse {
  private static final SimpleResponse OK = new SimpleResponse(null);

  private final RemoteError error;

  @JsonCreator
  public SimpleResponse(@JsonProperty("error") RemoteError error) {
    this.error = error;
  }

  public static SimpleResponse ok() {
    return OK;
  }

  public static SimpleResponse error(RemoteError error) {
    return new SimpleResponse(error);
  }

  @JsonIgnore
  public boolean isOk() {
    return error == null;
  }

  @JsonProperty("error")
  public RemoteError getError() {
    return error;
  }
}
