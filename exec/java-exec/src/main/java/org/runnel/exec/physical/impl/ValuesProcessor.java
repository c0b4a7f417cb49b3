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
import java.util.List;

import org.runnel.exec.ops.FlowContext;
import org.runnel.exec.record.Row;
import org.runnel.exec.record.RowReceiver;
import org.runnel.exec.record.RowSource;

import com.google.common.collect.ImmutableList;

/**
 * Emits a fixed list of rows.
 */
public class ValuesProcessor extends ProcessorBase {
  private final List<Row> rows;

  public ValuesProcessor(int processorId, FlowContext context, List<Row> rows, RowReceiver output) {
    super(processorId, context, Collections.<RowSource>emptyList(), output);
    this.rows = ImmutableList.copyOf(rows);
  }

  @Override
  protected void process() {
    for (Row row : rows) {
      if (!emitRow(row)) {
        return;
      }
    }
  }
}
