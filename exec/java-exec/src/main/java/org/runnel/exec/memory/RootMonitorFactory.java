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
package org.runnel.exec.memory;

import org.runnel.common.config.RunnelConfig;
import org.runnel.exec.ExecConstants;

public class RootMonitorFactory {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(RootMonitorFactory.class);

  private RootMonitorFactory() {
  }

  /**
   * Creates the node-wide monitor every other monitor descends from, sized by {@link ExecConstants#MEMORY_MAX}.
   */
  public static MemoryMonitor newRoot(RunnelConfig config) {
    final long limit = config.getBytes(ExecConstants.MEMORY_MAX);
    logger.info("Root memory monitor budget: {} bytes", limit);
    return MemoryMonitor.newRoot("root", limit,
        config.getBytes(ExecConstants.MEMORY_NOTEWORTHY_BYTES),
        config.getBoolean(ExecConstants.ERROR_ON_MEMORY_LEAK), null, null);
  }
}
