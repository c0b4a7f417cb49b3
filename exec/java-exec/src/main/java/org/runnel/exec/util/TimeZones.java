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
package org.runnel.exec.util;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.runnel.common.exceptions.UserException;

/**
 * Resolves session time zone names.
 */
public final class TimeZones {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TimeZones.class);

  private TimeZones() {
  }

  /**
   * Accepts an IANA zone id ({@code America/New_York}), {@code UTC}, a fixed offset ({@code +05:30}) or a whole
   * number of hours east of UTC ({@code -8}). An empty name means UTC.
   *
   * @throws UserException validation error if the name matches none of these
   */
  public static ZoneId resolve(String name) {
    if (name == null || name.isEmpty()) {
      return ZoneOffset.UTC;
    }
    try {
      return ZoneId.of(name);
    } catch (DateTimeException e) {
      try {
        return ZoneOffset.ofHours(Integer.parseInt(name.trim()));
      } catch (NumberFormatException | DateTimeException ignored) {
        throw UserException.validationError(e)
            .message("cannot find time zone \"%s\"", name)
            .build(logger);
      }
    }
  }
}
