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

import org.runnel.common.exceptions.UserException;
import org.runnel.exec.memory.BoundAccount;
import org.runnel.exec.memory.OutOfMemoryException;
import org.runnel.exec.ops.FlowContext;
import org.runnel.exec.record.ConsumerStatus;
import org.runnel.exec.record.ProducerMetadata;
import org.runnel.exec.record.Row;
import org.runnel.exec.record.RowReceiver;
import org.runnel.exec.record.RowSource;

import com.google.common.collect.ImmutableList;

/**
 * Base of every processor: reads from zero or more inputs, writes to one output, and charges what it buffers to
 * its own account on the flow's monitor.
 * <p>
 * Failures never escape {@link #run()}. They travel downstream as error metadata, and the output is always
 * closed with {@link RowReceiver#producerDone()}.
 */
public abstract class ProcessorBase implements Runnable, AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ProcessorBase.class);

  protected final int processorId;
  protected final FlowContext context;
  protected final List<RowSource> inputs;
  protected final RowReceiver output;
  protected final BoundAccount account;

  protected ProcessorBase(int processorId, FlowContext context, List<RowSource> inputs, RowReceiver output) {
    this.processorId = processorId;
    this.context = context;
    this.inputs = ImmutableList.copyOf(inputs);
    this.output = output;
    this.account = context.getEvalContext().getMonitor().makeBoundAccount();
  }

  /**
   * Does the processor's work. Returns once the output needs no more rows or the inputs are exhausted.
   */
  protected abstract void process() throws Exception;

  @Override
  public void run() {
    try {
      process();
    } catch (OutOfMemoryException e) {
      final UserException uex = UserException.memoryError(e)
          .addContext("Processor", processorId)
          .addIdentity(context.getNodeId())
          .build(logger);
      output.push(null, ProducerMetadata.forError(uex, context.getNodeId()));
    } catch (InterruptedException e) {
      logger.debug("Processor {} of flow {} interrupted", processorId, context.getFlowId());
      Thread.currentThread().interrupt();
    } catch (Exception e) {
      logger.warn("Processor {} of flow {} failed", processorId, context.getFlowId(), e);
      output.push(null, ProducerMetadata.forError(e, context.getNodeId()));
    } finally {
      for (RowSource input : inputs) {
        input.consumerClosed();
      }
      output.producerDone();
    }
  }

  /**
   * @return false once the consumer needs no more rows
   */
  protected boolean emitRow(Row row) {
    return output.push(row, null) == ConsumerStatus.NEED_MORE_ROWS;
  }

  protected boolean emitMetadata(ProducerMetadata meta) {
    return output.push(null, meta) == ConsumerStatus.NEED_MORE_ROWS;
  }

  public int getProcessorId() {
    return processorId;
  }

  public BoundAccount getAccount() {
    return account;
  }

  @Override
  public void close() throws Exception {
    account.close();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + processorId + "]";
  }
}
