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
package org.runnel.exec;

import org.runnel.exec.server.options.TypeValidators.BooleanValidator;
import org.runnel.exec.server.options.TypeValidators.PositiveLongValidator;

public final class ExecConstants {
  private ExecConstants() {
    // Don't allow instantiation
  }

  /** Budget of the node-wide root memory monitor. */
  public static final String MEMORY_MAX = "runnel.exec.memory.max";
  /** Usage above which flow monitors log each new maximum. */
  public static final String MEMORY_NOTEWORTHY_BYTES = "runnel.exec.memory.noteworthy_bytes";
  public static final String ERROR_ON_MEMORY_LEAK = "runnel.exec.memory.error_on_leak";

  /** How long an inbound stream waits for its flow, and how long a flow waits for its inbound streams. */
  public static final String FLOW_STREAM_TIMEOUT = "runnel.exec.flow.stream_timeout";
  /** Capacity, in rows or metadata records, of the channels between processors. */
  public static final String ROW_CHANNEL_BUFFER = "runnel.exec.flow.row_channel_buffer";
  public static final String OUTBOX_FLUSH_ROWS = "runnel.exec.flow.outbox.flush_rows";

  public static final String REGEXP_CACHE_SIZE = "runnel.exec.regexp_cache_size";
  public static final String SHUTDOWN_GRACE_PERIOD = "runnel.exec.shutdown.grace_period";

  public static final String TEMP_STORAGE_ENABLED = "exec.flow.temp_storage.enabled";
  public static final BooleanValidator TEMP_STORAGE_ENABLED_VALIDATOR = new BooleanValidator(TEMP_STORAGE_ENABLED);

  public static final String MAX_RUNNING_FLOWS = "exec.flow.max_running_flows";
  public static final PositiveLongValidator MAX_RUNNING_FLOWS_VALIDATOR =
      new PositiveLongValidator(MAX_RUNNING_FLOWS, Integer.MAX_VALUE);

  /** Boot-time defaults of runtime options live under this prefix. */
  public static final String OPTION_DEFAULTS_ROOT = "runnel.exec.options.";

  public static String bootDefaultFor(String name) {
    return OPTION_DEFAULTS_ROOT + name;
  }
}
