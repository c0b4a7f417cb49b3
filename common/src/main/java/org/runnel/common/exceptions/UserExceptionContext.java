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

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Holds context information about a UserException. We can add structured context information that will be used
 * to generate the error message displayed to the client.
 */
public class UserExceptionContext {

  private final String errorId;
  private final List<String> contextList;

  // 0 means no node identity was attached
  private int nodeId;

  UserExceptionContext() {
    errorId = UUID.randomUUID().toString();
    contextList = new ArrayList<>();
  }

  /**
   * adds a context line to the bottom of the context list
   * @param context context line
   */
  public UserExceptionContext add(String context) {
    contextList.add(context);
    return this;
  }

  /**
   * sets the identity of the node that raised the error. The first identity set wins.
   */
  public UserExceptionContext addIdentity(int nodeId) {
    if (this.nodeId == 0) {
      this.nodeId = nodeId;
    }
    return this;
  }

  public UserExceptionContext add(String context, String value) {
    add(context + ": " + value);
    return this;
  }

  /**
   * adds a long to the bottom of the context list
   * @param context context prefix string
   * @param value long value
   */
  public UserExceptionContext add(String context, long value) {
    add(context + ": " + value);
    return this;
  }

  String getErrorId() {
    return errorId;
  }

  int getNodeId() {
    return nodeId;
  }

  List<String> getContextList() {
    return contextList;
  }

  /**
   * generate a context message
   * @return string containing all context information concatenated
   */
  String generateContextMessage(boolean includeErrorIdAndIdentity) {
    StringBuilder sb = new StringBuilder();

    for (String context : contextList) {
      sb.append(context).append("\n");
    }

    if (includeErrorIdAndIdentity) {
      sb.append("\n[Error Id: ").append(errorId).append(" ");
      if (nodeId != 0) {
        sb.append("on node ").append(nodeId);
      }
      sb.append("]");
    }

    return sb.toString();
  }
}
