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

/**
 * Wraps a {@link RemoteError} received from another node.
 */
public class UserRemoteException extends UserException {
  private static final long serialVersionUID = 5389128409208262434L;

  private final RemoteError error;

  public UserRemoteException(RemoteError error) {
    super(error.getErrorType(), "Remote error", null);
    this.error = error;
  }

  @Override
  public String getMessage() {
    return error.getMessage(); // we don't want to add any context information
  }

  @Override
  public String getVerboseMessage() {
    return error.getMessage();
  }

  @Override
  public RemoteError getOrCreateRemoteError(boolean verbose) {
    return error;
  }

  @Override
  public String getErrorId() {
    return error.getErrorId();
  }

  @Override
  public int getNodeId() {
    return error.getNodeId();
  }
}
