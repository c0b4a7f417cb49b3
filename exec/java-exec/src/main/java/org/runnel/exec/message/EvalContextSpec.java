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

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * Session state of the gateway node that every remote node evaluates expressions with.
 */
@JsonInclude(Include.NON_NULL)
public class EvalContextSpec {
  private final String location;
  private final String database;
  private final List<String> searchPath;
  private final long stmtTimestampNanos;
  private final long txnTimestampNanos;
  private final ClusterTimestamp clusterTimestamp;

  @JsonCreator
  public EvalContextSpec(@JsonProperty("location") String location,
                         @JsonProperty("database") String database,
                         @JsonProperty("searchPath") List<String> searchPath,
                         @JsonProperty("stmtTimestampNanos") long stmtTimestampNanos,
                         @JsonProperty("txnTimestampNanos") long txnTimestampNanos,
                         @JsonProperty("clusterTimestamp") ClusterTimestamp clusterTimestamp) {
    this.location = location == null ? "" : location;
    this.database = database;
    this.searchPath = searchPath == null ? Collections.<String>emptyList() : ImmutableList.copyOf(searchPath);
    this.stmtTimestampNanos = stmtTimestampNanos;
    this.txnTimestampNanos = txnTimestampNanos;
    this.clusterTimestamp = clusterTimestamp;
  }

  /**
   * @return the time zone name, empty for UTC
   */
  @JsonProperty("location")
  public String getLocation() {
    return location;
  }

  @JsonProperty("database")
  public String getDatabase() {
    return database;
  }

  @JsonProperty("searchPath")
  public List<String> getSearchPath() {
    return searchPath;
  }

  @JsonProperty("stmtTimestampNanos")
  public long getStmtTimestampNanos() {
    return stmtTimestampNanos;
  }

  @JsonProperty("txnTimestampNanos")
  public long getTxnTimestampNanos() {
    return txnTimestampNanos;
  }

  @JsonProperty("clusterTimestamp")
  public ClusterTimestamp getClusterTimestamp() {
    return clusterTimestamp;
  }
}
