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

import org.runnel.common.exceptions.RemoteError;
import org.runnel.common.exceptions.UserException;
import org.runnel.common.exceptions.UserRemoteException;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * Out-of-band record travelling alongside rows. Currently it only carries errors, which consumers forward
 * downstream until they reach the client.
 */
public class ProducerMetadata {
  private final RemoteError error;

  @JsonCreator
  public ProducerMetadata(@JsonProperty("error") RemoteError error) {
    this.error = Preconditions.checkNotNull(error);
  }

  public static ProducerMetadata forError(Throwable t, int nodeId) {
    return new ProducerMetadata(UserException.getOrCreateRemoteError(t, nodeId, false));
  }

  @JsonProperty("error")
  public RemoteError getError() {
    return error;
  }

  public UserException toException() {
    return new UserRemoteException(error);
  }

  @Override
  public String toString() {
    return "ProducerMetadata [" + error + "]";
  }
}
