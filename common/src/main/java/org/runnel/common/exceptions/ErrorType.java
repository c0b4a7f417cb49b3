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
 * Category of a {@link UserException}, carried across nodes inside a {@link RemoteError}.
 */
public enum ErrorType {
  /** Problem with a connection between nodes or with the client. */
  CONNECTION,
  /** A request failed validation (bad version, bad time zone, unknown stream). */
  VALIDATION,
  /** The flow description could not be turned into a running flow. */
  PLAN,
  /** Resource exhaustion: memory budgets, temp storage, admission. */
  RESOURCE,
  /** The flow stopped before completing, for instance because it was cancelled. */
  EXECUTION_ERROR,
  /** Unexpected failure inside the node. */
  SYSTEM
}
