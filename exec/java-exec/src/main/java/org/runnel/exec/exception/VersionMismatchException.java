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
package org.runnel.exec.exception;

/**
 * The protocol version of a setup request lies outside the window this node accepts.
 */
public class VersionMismatchException extends FlowSetupException {
  private static final long serialVersionUID = 1L;

  private final int version;

  public VersionMismatchException(int version, int minAccepted, int current) {
    super(String.format("version mismatch in flow request: %d; this node accepts %d through %d",
        version, minAccepted, current));
    this.version = version;
  }

  public int getVersion() {
    return version;
  }
}
