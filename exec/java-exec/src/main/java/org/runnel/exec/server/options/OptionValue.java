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
package org.runnel.exec.server.options;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * Current value of a runtime option such as {@code exec.flow.max_running_flows}. The scope tells whether it is the
 * boot default or was set on the running node.
 */
@JsonInclude(Include.NON_NULL)
public class OptionValue {

  public enum Kind {
    BOOLEAN, LONG
  }

  public enum OptionScope {
    BOOT, SYSTEM
  }

  public final String name;
  public final Kind kind;
  public final Long num_val;
  public final Boolean bool_val;
  public final OptionScope scope;

  public static OptionValue createLong(String name, long val, OptionScope scope) {
    return new OptionValue(Kind.LONG, name, val, null, scope);
  }

  public static OptionValue createBoolean(String name, boolean bool, OptionScope scope) {
    return new OptionValue(Kind.BOOLEAN, name, null, bool, scope);
  }

  @JsonCreator
  private OptionValue(@JsonProperty("kind") Kind kind,
                      @JsonProperty("name") String name,
                      @JsonProperty("num_val") Long num_val,
                      @JsonProperty("bool_val") Boolean bool_val,
                      @JsonProperty("scope") OptionScope scope) {
    Preconditions.checkArgument(kind == Kind.BOOLEAN ? bool_val != null : num_val != null,
        "option %s has no %s value", name, kind);
    this.kind = kind;
    this.name = name;
    this.num_val = num_val;
    this.bool_val = bool_val;
    this.scope = scope;
  }

  public String getName() {
    return name;
  }

  @JsonIgnore
  public Object getValue() {
    return kind == Kind.BOOLEAN ? bool_val : num_val;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, num_val, bool_val);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof OptionValue)) {
      return false;
    }
    final OptionValue other = (OptionValue) obj;
    return kind == other.kind
        && Objects.equals(name, other.name)
        && Objects.equals(num_val, other.num_val)
        && Objects.equals(bool_val, other.bool_val);
  }

  @Override
  public String toString() {
    return name + "=" + getValue() + " (" + scope + ")";
  }
}
