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
package org.runnel.exec.server;

import java.util.UUID;

import org.runnel.common.config.RunnelConfig;
import org.runnel.exec.coord.NodeIdContainer;
import org.runnel.exec.memory.MemoryMonitor;
import org.runnel.exec.metrics.RunnelMetrics;
import org.runnel.exec.rpc.StreamDialer;
import org.runnel.exec.server.options.OptionManager;
import org.runnel.exec.store.KvClient;
import org.runnel.exec.store.TempStorage;
import org.runnel.exec.store.TempStorageIdGenerator;
import org.runnel.exec.testing.TestingKnobs;

import com.codahale.metrics.MetricRegistry;
import com.google.common.base.Preconditions;

import io.opentelemetry.api.trace.Tracer;

/**
 * Node-wide collaborators of a {@link FlowServer}.
 */
public class ServerConfig {
  private final RunnelConfig config;
  private final OptionManager options;
  private final NodeIdContainer nodeId;
  private final UUID clusterId;
  private final KvClient kvClient;
  private final KvClient bypassKvClient;
  private final TempStorage tempStorage;
  private final TempStorageIdGenerator tempStorageIdGenerator;
  private final Tracer tracer;
  private final MemoryMonitor parentMonitor;
  private final MetricRegistry metrics;
  private final StreamDialer streamDialer;
  private final TestingKnobs testingKnobs;

  private ServerConfig(Builder builder) {
    this.config = Preconditions.checkNotNull(builder.config, "config");
    this.options = Preconditions.checkNotNull(builder.options, "options");
    this.nodeId = Preconditions.checkNotNull(builder.nodeId, "node id container");
    this.clusterId = builder.clusterId;
    this.kvClient = builder.kvClient;
    this.bypassKvClient = builder.bypassKvClient;
    this.tempStorage = builder.tempStorage;
    this.tempStorageIdGenerator = builder.tempStorageIdGenerator == null
        ? TempStorageIdGenerator.getInstance() : builder.tempStorageIdGenerator;
    this.tracer = Preconditions.checkNotNull(builder.tracer, "tracer");
    this.parentMonitor = Preconditions.checkNotNull(builder.parentMonitor, "parent monitor");
    this.metrics = builder.metrics == null ? RunnelMetrics.getInstance() : builder.metrics;
    this.streamDialer = builder.streamDialer;
    this.testingKnobs = builder.testingKnobs == null ? TestingKnobs.DEFAULT : builder.testingKnobs;
  }

  public static Builder builder() {
    return new Builder();
  }

  public RunnelConfig getConfig() {
    return config;
  }

  public OptionManager getOptions() {
    return options;
  }

  public NodeIdContainer getNodeId() {
    return nodeId;
  }

  public UUID getClusterId() {
    return clusterId;
  }

  public KvClient getKvClient() {
    return kvClient;
  }

  public KvClient getBypassKvClient() {
    return bypassKvClient;
  }

  public TempStorage getTempStorage() {
    return tempStorage;
  }

  public TempStorageIdGenerator getTempStorageIdGenerator() {
    return tempStorageIdGenerator;
  }

  public Tracer getTracer() {
    return tracer;
  }

  public MemoryMonitor getParentMonitor() {
    return parentMonitor;
  }

  public MetricRegistry getMetrics() {
    return metrics;
  }

  public StreamDialer getStreamDialer() {
    return streamDialer;
  }

  public TestingKnobs getTestingKnobs() {
    return testingKnobs;
  }

  public static class Builder {
    private RunnelConfig config;
    private OptionManager options;
    private NodeIdContainer nodeId;
    private UUID clusterId;
    private KvClient kvClient;
    private KvClient bypassKvClient;
    private TempStorage tempStorage;
    private TempStorageIdGenerator tempStorageIdGenerator;
    private Tracer tracer;
    private MemoryMonitor parentMonitor;
    private MetricRegistry metrics;
    private StreamDialer streamDialer;
    private TestingKnobs testingKnobs;

    private Builder() {
    }

    public Builder setConfig(RunnelConfig config) {
      this.config = config;
      return this;
    }

    public Builder setOptions(OptionManager options) {
      this.options = options;
      return this;
    }

    public Builder setNodeId(NodeIdContainer nodeId) {
      this.nodeId = nodeId;
      return this;
    }

    public Builder setClusterId(UUID clusterId) {
      this.clusterId = clusterId;
      return this;
    }

    public Builder setKvClient(KvClient kvClient) {
      this.kvClient = kvClient;
      return this;
    }

    /**
     * Sets the client used for flow-internal reads and writes that must not go through the local transaction
     * coordinator.
     */
    public Builder setBypassKvClient(KvClient bypassKvClient) {
      this.bypassKvClient = bypassKvClient;
      return this;
    }

    public Builder setTempStorage(TempStorage tempStorage) {
      this.tempStorage = tempStorage;
      return this;
    }

    /**
     * Overrides the process-wide generator, {@link TempStorageIdGenerator#getInstance()} by default.
     */
    public Builder setTempStorageIdGenerator(TempStorageIdGenerator tempStorageIdGenerator) {
      this.tempStorageIdGenerator = tempStorageIdGenerator;
      return this;
    }

    public Builder setTracer(Tracer tracer) {
      this.tracer = tracer;
      return this;
    }

    public Builder setParentMonitor(MemoryMonitor parentMonitor) {
      this.parentMonitor = parentMonitor;
      return this;
    }

    public Builder setMetrics(MetricRegistry metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder setStreamDialer(StreamDialer streamDialer) {
      this.streamDialer = streamDialer;
      return this;
    }

    public Builder setTestingKnobs(TestingKnobs testingKnobs) {
      this.testingKnobs = testingKnobs;
      return this;
    }

    public ServerConfig build() {
      return new ServerConfig(this);
    }
  }
}
