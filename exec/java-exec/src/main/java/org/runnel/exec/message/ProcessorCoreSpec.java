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

import java.util.List;

import org.runnel.exec.record.Row;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.collect.ImmutableList;

/**
 * The operation a processor performs. Serialized with a {@code type} property naming the core.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(ProcessorCoreSpec.Values.class),
    @JsonSubTypes.Type(ProcessorCoreSpec.Noop.class),
    @JsonSubTypes.Type(ProcessorCoreSpec.Sorter.class)
})
public abstract class ProcessorCoreSpec {

  /**
   * @return the number of input syncs the core reads from
   */
  @JsonIgnore
  public abstract int getInputCount();

  /**
   * Emits literal rows and then ends.
   */
  @JsonTypeName("values")
  public static class Values extends ProcessorCoreSpec {
    private final List<Row> rows;

    @JsonCreator
    public Values(@JsonProperty("rows") List<Row> rows) {
      this.rows = rows == null ? ImmutableList.<Row>of() : ImmutableList.copyOf(rows);
    }

    @JsonProperty("rows")
    public List<Row> getRows() {
      return rows;
    }

    @Override
    @JsonIgnore
    public int getInputCount() {
      return 0;
    }
  }

  /**
   * Forwards its single input unchanged.
   */
  @JsonTypeName("noop")
  public static class Noop extends ProcessorCoreSpec {
    @Override
    @JsonIgnore
    public int getInputCount() {
      return 1;
    }
  }

  @JsonTypeName("sorter")
  public static class Sorter extends ProcessorCoreSpec {
    private final List<Ordering> ordering;

    @JsonCreator
    public Sorter(@JsonProperty("ordering") List<Ordering> ordering) {
      this.ordering = ordering == null ? ImmutableList.<Ordering>of() : ImmutableList.copyOf(ordering);
    }

    @JsonProperty("ordering")
    public List<Ordering> getOrdering() {
      return ordering;
    }

    @Override
    @JsonIgnore
    public int getInputCount() {
      return 1;
    }
  }

  public static class Ordering {

    public enum Direction {
      ASC, DESC
    }

    private final int column;
    private final Direction direction;

    @JsonCreator
    public Ordering(@JsonProperty("column") int column,
                    @JsonProperty("direction") Direction direction) {
      this.column = column;
      this.direction = direction == null ? Direction.ASC : direction;
    }

    @JsonProperty("column")
    public int getColumn() {
      return column;
    }

    @JsonProperty("direction")
    public Direction getDirection() {
      return direction;
    }
  }
}
