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

import java.util.Collections;

import org.runnel.exec.ops.FlowContext;
import org.runnel.exec.record.RowOrMetadata;
import org.runnel.exec.record.RowReceiver;
import org.runnel.exec.record.RowSource;

/**
 * Forwards rows and metadata from its input unchanged. Used to merge streams through its input sync.
 */
public class NoopProcessor extends ProcessorBase {

  public NoopProcessor(int processorId, FlowContext context, RowSource input, RowReceiver output) {
    super(processorId, context, Collections.singletonList(input), output);
  }

  @Override
  protected void process() throws InterruptedException {
    final RowSource input = inputs.get(0);
    RowOrMetadata next;
    while ((next = input.next()) != null) {
      final boolean more = next.isMetadata() ? emitMetadata(next.getMeta()) : emitRow(next.getRow());
      if (!more) {
        return;
      }
    }
  }
}
