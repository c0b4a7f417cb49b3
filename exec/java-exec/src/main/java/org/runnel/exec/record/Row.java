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
package org.runnel.exec.record;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * An immutable tuple of column values. Integral numbers are held as {@link Long} and floating point numbers as
 * {@link Double}, so rows compare equal after a JSON round trip. Serialized as a JSON array.
 */
public final class Row {
  private static final long ROW_OVERHEAD = 16;
  private static final long VALUE_OVERHEAD = 8;

  private final List<Object> values;

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public Row(List<Object> values) {
    final List<Object> normalized = new ArrayList<>(values.size());
    for (Object value : values) {
      normalized.add(normalize(value));
    }
    this.values = Collections.unmodifiableList(normalized);
  }

  public static Row of(Object... values) {
    return new Row(Arrays.asList(values));
  }

  private static Object normalize(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float) {
      return ((Float) value).doubleValue();
    }
    if (value == null || value instanceof Long || value instanceof Double
        || value instanceof String || value instanceof Boolean) {
      return value;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    throw new IllegalArgumentException("unsupported column value type " + value.getClass().getName());
  }

  @JsonValue
  public List<Object> getValues() {
    return values;
  }

  public Object get(int column) {
    return values.get(column);
  }

  public int size() {
    return values.size();
  }

  /**
   * Approximate heap footprint, charged against memory accounts while a row is buffered.
   */
  public long estimatedSize() {
    long size = ROW_OVERHEAD;
    for (Object value : values) {
      size += VALUE_OVERHEAD;
      if (value instanceof String) {
        size += 2L * ((String) value).length();
      }
    }
    return size;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Row && values.equals(((Row) obj).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
