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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;

import org.runnel.exec.ExecConstants;
import org.runnel.exec.memory.OutOfMemoryException;
import org.runnel.exec.message.ProcessorCoreSpec.Ordering;
import org.runnel.exec.ops.FlowContext;
import org.runnel.exec.record.Row;
import org.runnel.exec.record.RowOrMetadata;
import org.runnel.exec.record.RowReceiver;
import org.runnel.exec.record.RowSource;
import org.runnel.exec.store.TempStorage;
import org.runnel.exec.store.TempStorageIdGenerator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.primitives.Bytes;
import com.google.common.primitives.Ints;

/**
 * Sorts its input. Rows are buffered against the processor's account; when the budget runs out the buffer is
 * sorted and written to temp storage as a run, if spilling is enabled, and the runs are merged at the end.
 * Otherwise the out-of-memory error ends the processor.
 * <p>
 * Spilled keys are the processor's temp-storage prefix followed by the run number and the row's position in the
 * run, both as big-endian ints, so a prefix scan returns a run in sorted order.
 */
public class SorterProcessor extends ProcessorBase {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SorterProcessor.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final RowComparator comparator;
  private final List<Row> buffer = new ArrayList<>();
  private byte[] spillPrefix;
  private int runs;

  public SorterProcessor(int processorId, FlowContext context, List<Ordering> ordering,
                         RowSource input, RowReceiver output) {
    super(processorId, context, Collections.singletonList(input), output);
    this.comparator = new RowComparator(ordering);
  }

  @Override
  protected void process() throws InterruptedException, IOException {
    final RowSource input = inputs.get(0);
    RowOrMetadata next;
    while ((next = input.next()) != null) {
      if (next.isMetadata()) {
        if (!emitMetadata(next.getMeta())) {
          return;
        }
      } else {
        buffer(next.getRow());
      }
    }

    if (runs == 0) {
      Collections.sort(buffer, comparator);
      for (Row row : buffer) {
        if (!emitRow(row)) {
          return;
        }
      }
    } else {
      if (!buffer.isEmpty()) {
        spill();
      }
      merge();
    }
  }

  private void buffer(Row row) throws IOException {
    final long size = row.estimatedSize();
    try {
      account.grow(size);
    } catch (OutOfMemoryException e) {
      if (!canSpill() || buffer.isEmpty()) {
        throw e;
      }
      logger.debug("Processor {} out of memory with {} rows buffered, spilling", processorId, buffer.size());
      spill();
      account.grow(size);
    }
    buffer.add(row);
  }

  private boolean canSpill() {
    return context.getTempStorage() != null
        && context.getOptions().getOption(ExecConstants.TEMP_STORAGE_ENABLED_VALIDATOR);
  }

  private void spill() throws IOException {
    if (spillPrefix == null) {
      spillPrefix = TempStorageIdGenerator.prefix(context.getTempStorageIdGenerator().newId());
    }
    Collections.sort(buffer, comparator);
    final TempStorage storage = context.getTempStorage();
    final byte[] runPrefix = runPrefix(runs);
    for (int i = 0; i < buffer.size(); i++) {
      storage.put(Bytes.concat(runPrefix, Ints.toByteArray(i)), MAPPER.writeValueAsBytes(buffer.get(i)));
    }
    runs++;
    buffer.clear();
    account.clear();
  }

  private byte[] runPrefix(int run) {
    return Bytes.concat(spillPrefix, Ints.toByteArray(run));
  }

  private void merge() throws IOException {
    final PriorityQueue<RunHead> heads = new PriorityQueue<>(Math.max(runs, 1));
    for (int run = 0; run < runs; run++) {
      final RunHead head = new RunHead(context.getTempStorage().scan(runPrefix(run)));
      if (head.advance()) {
        heads.add(head);
      }
    }
    while (!heads.isEmpty()) {
      final RunHead head = heads.poll();
      if (!emitRow(head.current)) {
        return;
      }
      if (head.advance()) {
        heads.add(head);
      }
    }
  }

  public int getSpilledRuns() {
    return runs;
  }

  @Override
  public void close() throws Exception {
    try {
      if (spillPrefix != null) {
        context.getTempStorage().clearPrefix(spillPrefix);
      }
    } finally {
      super.close();
    }
  }

  private class RunHead implements Comparable<RunHead> {
    private final Iterator<byte[]> values;
    private Row current;

    RunHead(Iterator<byte[]> values) {
      this.values = values;
    }

    boolean advance() throws IOException {
      if (!values.hasNext()) {
        return false;
      }
      current = MAPPER.readValue(values.next(), Row.class);
      return true;
    }

    @Override
    public int compareTo(RunHead o) {
      return comparator.compare(current, o.current);
    }
  }
}
