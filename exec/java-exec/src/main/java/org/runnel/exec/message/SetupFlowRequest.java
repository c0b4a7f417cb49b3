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
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Asks a node to set up its part of a distributed query. Immutable once received.
 */
public class SetupFlowRequest {
  private final int version;
  private final TxnDescriptor txn;
  private final FlowSpec flow;
  private final EvalContextSpec evalContext;

  @JsonCreator
  public SetupFlowRequest(@JsonProperty("version") int version,
                          @JsonProperty("txn") TxnDescriptor txn,
                          @JsonProperty("flow") FlowSpec flow,
                          @JsonProperty("evalContext") EvalContextSpec evalContext) {
    this.version = version;
    this.txn = txn;
    this.flow = flow;
    this.evalContext = evalContext;
  }

  @JsonProperty("version")
  public int getVersion() {
    return version;
  }

  @JsonProperty("txn")
  public TxnDescriptor getTxn() {
    return txn;
  }

  @JsonProperty("flow")
  public FlowSpec getFlow() {
    return flow;
  }

  @JsonProperty("evalContext")
  public EvalContextSpec getEvalContext() {
    return evalContext;
  }
}
