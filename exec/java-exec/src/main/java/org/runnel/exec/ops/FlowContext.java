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
package org.runnel.exec.ops;

import java.util.UUID;
import java.util.concurrent.ExecutorService;

import org.runnel.common.config.RunnelConfig;
import org.runnel.exec.ExecConstants;
import org.runnel.exec.message.TxnDescriptor;
import org.runnel.exec.rpc.StreamDialer;
import org.runnel.exec.server.options.OptionManager;
import org.runnel.exec.store.KvClient;
import org.runnel.exec.store.TempStorage;
import org.runnel.exec.store.TempStorageIdGenerator;
import org.runnel.exec.testing.TestingKnobs;

import com.google.common.base.Preconditions;

/**
 * Per-flow state shared by the processors and outboxes of one flow. Owned by the flow; nothing here outlives it
 * except the node-wide collaborators it points to.
 */
public class FlowContext {
  private final UUID flowId;
  private final EvalContext evalContext;
  private final TxnDescriptor txn;
  private final KvClient kvClient;
  private final KvClient bypassKvClient;
  private final int nodeId;
  private final TempStorage tempStorage;
  private final TempStorageIdGenerator tempStorageIdGenerator;
  private final RunnelConfig config;
  private final OptionManager options;
  private final TestingKnobs testingKnobs;
  private final ExecutorService executor;
  private final StreamDialer streamDialer;
  private final int rowChannelBuffer;
  private final int outboxFlushRows;

  private FlowContext(Builder builder) {
    this.flowId = Preconditions.checkNotNull(builder.flowId, "flow id");
    this.evalContext = Preconditions.checkNotNull(builder.evalContext, "eval context");
    this.txn = builder.txn;
    this.kvClient = builder.kvClient;
    this.bypassKvClient = builder.bypassKvClient;
    this.nodeId = builder.nodeId;
    this.tempStorage = builder.tempStorage;
    this.tempStorageIdGenerator = builder.tempStorageIdGenerator;
    this.config = Preconditions.checkNotNull(builder.config, "config");
    this.options = Preconditions.checkNotNull(builder.options, "options");
    this.testingKnobs = builder.testingKnobs == null ? TestingKnobs.DEFAULT : builder.testingKnobs;
    this.executor = Preconditions.checkNotNull(builder.executor, "executor");
    this.streamDialer = builder.streamDialer;
    this.rowChannelBuffer = config.getInt(ExecConstants.ROW_CHANNEL_BUFFER);
    this.outboxFlushRows = config.getInt(ExecConstants.OUTBOX_FLUSH_ROWS);
  }

  public static Builder builder() {
    return new Builder();
  }

  public UUID getFlowId() {
    return flowId;
  }

  public EvalContext getEvalContext() {
    return evalContext;
  }

  public TxnDescriptor getTxn() {
    return txn;
  }

  public KvClient getKvClient() {
    return kvClient;
  }

  /**
   * @return the client that reads and writes without going through the local transaction coordinator, for
   *         flow-internal state
   */
  public KvClient getBypassKvClient() {
    return bypassKvClient;
  }

  public int getNodeId() {
    return nodeId;
  }

  /**
   * @return the spill engine, {@code null} when the node has none
   */
  public TempStorage getTempStorage() {
    return tempStorage;
  }

  public TempStorageIdGenerator getTempStorageIdGenerator() {
    return tempStorageIdGenerator;
  }

  public RunnelConfig getConfig() {
    return config;
  }

  public OptionManager getOptions() {
    return options;
  }

  public TestingKnobs getTestingKnobs() {
    return testingKnobs;
  }

  public ExecutorService getExecutor() {
    return executor;
  }

  public StreamDialer getStreamDialer() {
    return streamDialer;
  }

  public int getRowChannelBuffer() {
    return rowChannelBuffer;
  }

  public int getOutboxFlushRows() {
    return outboxFlushRows;
  }

  public static class Builder {
    private UUID flowId;
    private EvalContext evalContext;
    private TxnDescriptor txn;
    private KvClient kvClient;
    private KvClient bypassKvClient;
    private int nodeId;
    private TempStorage tempStorage;
    private TempStorageIdGenerator tempStorageIdGenerator;
    private RunnelConfig config;
    private OptionManager options;
    private TestingKnobs testingKnobs;
    private ExecutorService executor;
    private StreamDialer streamDialer;

    private Builder() {
    }

    public Builder setFlowId(UUID flowId) {
      this.flowId = flowId;
      return this;
    }

    public Builder setEvalContext(EvalContext evalContext) {
      this.evalContext = evalContext;
      return this;
    }

    public Builder setTxn(TxnDescriptor txn) {
      this.txn = txn;
      return this;
    }

    public Builder setKvClient(KvClient kvClient) {
      this.kvClient = kvClient;
      return this;
    }

    public Builder setBypassKvClient(KvClient bypassKvClient) {
      this.bypassKvClient = bypassKvClient;
      return this;
    }

    public Builder setNodeId(int nodeId) {
      this.nodeId = nodeId;
      return this;
    }

    public Builder setTempStorage(TempStorage tempStorage) {
      this.tempStorage = tempStorage;
      return this;
    }

    public Builder setTempStorageIdGenerator(TempStorageIdGenerator tempStorageIdGenerator) {
      this.tempStorageIdGenerator = tempStorageIdGenerator;
      return this;
    }

    public Builder setConfig(RunnelConfig config) {
      this.config = config;
      return this;
    }

    public Builder setOptions(OptionManager options) {
      this.options = options;
      return this;
    }

    public Builder setTestingKnobs(TestingKnobs testingKnobs) {
      this.testingKnobs = testingKnobs;
      return this;
    }

    public Builder setExecutor(ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    public Builder setStreamDialer(StreamDialer streamDialer) {
      this.streamDialer = streamDialer;
      return this;
    }

    public FlowContext build() {
      return new FlowContext(this);
    }
  }
}
