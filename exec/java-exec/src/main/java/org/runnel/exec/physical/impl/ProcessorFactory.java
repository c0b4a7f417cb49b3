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
package org.runnel.exec.physical.impl;

import java.util.List;

import org.runnel.exec.exception.FlowSetupException;
import org.runnel.exec.message.ProcessorCoreSpec;
import org.runnel.exec.message.ProcessorSpec;
import org.runnel.exec.ops.FlowContext;
import org.runnel.exec.record.RowReceiver;
import org.runnel.exec.record.RowSource;

/**
 * Creates processors from their specs.
 */
public class ProcessorFactory {

  private ProcessorFactory() {
  }

  public static ProcessorBase create(FlowContext context, ProcessorSpec spec, List<RowSource> inputs,
                                     RowReceiver output) throws FlowSetupException {
    final ProcessorCoreSpec core = spec.getCore();
    if (core == null) {
      throw new FlowSetupException(String.format("processor %d has no core", spec.getProcessorId()));
    }
    if (inputs.size() != core.getInputCount()) {
      throw new FlowSetupException(String.format("processor %d expects %d inputs, got %d",
          spec.getProcessorId(), core.getInputCount(), inputs.size()));
    }

    if (core instanceof ProcessorCoreSpec.Values) {
      return new ValuesProcessor(spec.getProcessorId(), context, ((ProcessorCoreSpec.Values) core).getRows(), output);
    } else if (core instanceof ProcessorCoreSpec.Noop) {
      return new NoopProcessor(spec.getProcessorId(), context, inputs.get(0), output);
    } else if (core instanceof ProcessorCoreSpec.Sorter) {
      return new SorterProcessor(spec.getProcessorId(), context,
          ((ProcessorCoreSpec.Sorter) core).getOrdering(), inputs.get(0), output);
    }
    throw new FlowSetupException(String.format("processor %d: unsupported core %s",
        spec.getProcessorId(), core.getClass().getSimpleName()));
  }
}
