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

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

import org.runnel.exec.message.ProcessorCoreSpec.Ordering;
import org.runnel.exec.record.Row;

import com.google.common.collect.ImmutableList;

/**
 * Orders rows on a list of columns. Nulls sort first in ascending order. Numbers compare by value whatever their
 * type.
 */
public class RowComparator implements Comparator<Row> {
  private final List<Ordering> ordering;

  public RowComparator(List<Ordering> ordering) {
    this.ordering = ImmutableList.copyOf(ordering);
  }

  @Override
  public int compare(Row left, Row right) {
    for (Ordering o : ordering) {
      int cmp = compareValues(left.get(o.getColumn()), right.get(o.getColumn()));
      if (cmp != 0) {
        return o.getDirection() == Ordering.Direction.DESC ? -cmp : cmp;
      }
    }
    return 0;
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  static int compareValues(Object left, Object right) {
    if (left == null || right == null) {
      return left == null ? (right == null ? 0 : -1) : 1;
    }
    if (left instanceof Long && right instanceof Long) {
      return Long.compare((Long) left, (Long) right);
    }
    if (left instanceof Double && right instanceof Double) {
      return Double.compare((Double) left, (Double) right);
    }
    if (left instanceof Number && right instanceof Number) {
      return compareNumbers((Number) left, (Number) right);
    }
    if (left.getClass() == right.getClass() && left instanceof Comparable) {
      return ((Comparable) left).compareTo(right);
    }
    // mixed types: group by type name
    return left.getClass().getName().compareTo(right.getClass().getName());
  }

  // a long and a double, compared exactly
  private static int compareNumbers(Number left, Number right) {
    final double l = left.doubleValue();
    final double r = right.doubleValue();
    if (Double.isNaN(l) || Double.isNaN(r) || Double.isInfinite(l) || Double.isInfinite(r)) {
      return Double.compare(l, r);
    }
    return toBigDecimal(left).compareTo(toBigDecimal(right));
  }

  private static BigDecimal toBigDecimal(Number value) {
    return value instanceof Long ? BigDecimal.valueOf((Long) value) : new BigDecimal(value.doubleValue());
  }
}
