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
package org.runnel.exec.metrics;

import com.codahale.metrics.Metric;
import com.codahale.metrics.MetricFilter;
import com.codahale.metrics.MetricRegistry;

/**
 * Holder of the process-wide metric registry.
 */
public class RunnelMetrics {

  private RunnelMetrics() {
  }

  private static class RegistryHolder {
    public static final MetricRegistry REGISTRY = new MetricRegistry();
  }

  public static MetricRegistry getInstance() {
    return RegistryHolder.REGISTRY;
  }

  /**
   * Registers {@code metric}, replacing a metric previously registered under the same name. Servers restarted in
   * the same JVM re-register their gauges.
   */
  public static <T extends Metric> T register(MetricRegistry registry, String name, T metric) {
    registry.remove(name);
    return registry.register(name, metric);
  }

  public static void resetMetrics() {
    RegistryHolder.REGISTRY.removeMatching(MetricFilter.ALL);
  }
}
