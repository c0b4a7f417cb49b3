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

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

import org.runnel.exec.memory.BoundAccount;
import org.runnel.exec.memory.MemoryMonitor;
import org.runnel.exec.message.ClusterTimestamp;
import org.runnel.exec.util.RegexpCache;

import com.google.common.collect.ImmutableList;

/**
 * Everything expression evaluation in a flow depends on. Timestamps are fixed for the lifetime of the flow so that
 * every node evaluates {@code now()} identically.
 */
public class EvalContext {
  private final ZoneId timeZone;
  private final String database;
  private final List<String> searchPath;
  private final UUID clusterId;
  private final int nodeId;
  private final RegexpCache regexpCache;
  private final MemoryMonitor monitor;
  private final BoundAccount account;
  private final Instant stmtTimestamp;
  private final Instant txnTimestamp;
  private final ClusterTimestamp clusterTimestamp;

  public EvalContext(ZoneId timeZone, String database, List<String> searchPath, UUID clusterId, int nodeId,
                     RegexpCache regexpCache, MemoryMonitor monitor, BoundAccount account,
                     long stmtTimestampNanos, long txnTimestampNanos, ClusterTimestamp clusterTimestamp) {
    this.timeZone = timeZone;
    this.database = database;
    this.searchPath = ImmutableList.copyOf(searchPath);
    this.clusterId = clusterId;
    this.nodeId = nodeId;
    this.regexpCache = regexpCache;
    this.monitor = monitor;
    this.account = account;
    this.stmtTimestamp = fromNanos(stmtTimestampNanos);
    this.txnTimestamp = fromNanos(txnTimestampNanos);
    this.clusterTimestamp = clusterTimestamp;
  }

  private static Instant fromNanos(long nanos) {
    return Instant.ofEpochSecond(0, nanos);
  }

  public ZoneId getTimeZone() {
    return timeZone;
  }

  public String getDatabase() {
    return database;
  }

  public List<String> getSearchPath() {
    return searchPath;
  }

  public UUID getClusterId() {
    return clusterId;
  }

  public int getNodeId() {
    return nodeId;
  }

  public RegexpCache getRegexpCache() {
    return regexpCache;
  }

  /**
   * @return the flow's monitor; processors open their own accounts on it
   */
  public MemoryMonitor getMonitor() {
    return monitor;
  }

  public BoundAccount getActiveAccount() {
    return account;
  }

  public Instant getStmtTimestamp() {
    return stmtTimestamp;
  }

  public Instant getTxnTimestamp() {
    return txnTimestamp;
  }

  public ClusterTimestamp getClusterTimestamp() {
    return clusterTimestamp;
  }
}
