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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hybrid logical clock reading: physical wall time in nanoseconds plus a logical counter ordering events that share
 * the same wall time.
 */
public class ClusterTimestamp implements Comparable<ClusterTimestamp> {
  private final long wallTime;
  private final int logical;

  @JsonCreator
  public ClusterTimestamp(@JsonProperty("wallTime") long wallTime,
                          @JsonProperty("logical") int logical) {
    this.wallTime = wallTime;
    this.logical = logical;
  }

  @JsonProperty("wallTime")
  public long getWallTime() {
    return wallTime;
  }

  @JsonProperty("logical")
  public int getLogical() {
    return logical;
  }

  @Override
  public int compareTo(ClusterTimestamp o) {
    final int cmp = Long.compare(wallTime, o.wallTime);
    return cmp != 0 ? cmp : Integer.compare(logical, o.logical);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ClusterTimestamp)) {
      return false;
    }
    final ClusterTimestamp other = (ClusterTimestamp) obj;
    return wallTime == other.wallTime && logical == other.logical;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(wallTime) + logical;
  }

  @Override
  public String toString() {
    return wallTime + "," + logical;
  }
}
