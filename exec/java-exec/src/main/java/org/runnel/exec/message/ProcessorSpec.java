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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

public class ProcessorSpec {
  private final int processorId;
  private final List<InputSyncSpec> input;
  private final ProcessorCoreSpec core;
  private final List<OutputRouterSpec> output;

  @JsonCreator
  public ProcessorSpec(@JsonProperty("processorId") int processorId,
                       @JsonProperty("input") List<InputSyncSpec> input,
                       @JsonProperty("core") ProcessorCoreSpec core,
                       @JsonProperty("output") List<OutputRouterSpec> output) {
    this.processorId = processorId;
    this.input = input == null ? ImmutableList.<InputSyncSpec>of() : ImmutableList.copyOf(input);
    this.core = core;
    this.output = output == null ? ImmutableList.<OutputRouterSpec>of() : ImmutableList.copyOf(output);
  }

  @JsonProperty("processorId")
  public int getProcessorId() {
    return processorId;
  }

  @JsonProperty("input")
  public List<InputSyncSpec> getInput() {
    return input;
  }

  @JsonProperty("core")
  public ProcessorCoreSpec getCore() {
    return core;
  }

  @JsonProperty("output")
  public List<OutputRouterSpec> getOutput() {
    return output;
  }
}
