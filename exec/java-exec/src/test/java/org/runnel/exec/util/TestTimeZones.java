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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.Test;
import org.runnel.common.exceptions.ErrorType;
import org.runnel.common.exceptions.UserException;
import org.runnel.test.RunnelTest;

public class TestTimeZones extends RunnelTest {

  @Test
  public void emptyNameIsUtc() {
    assertEquals(ZoneOffset.UTC, TimeZones.resolve(""));
    assertEquals(ZoneOffset.UTC, TimeZones.resolve(null));
  }

  @Test
  public void resolvesRegionsAndOffsets() {
    assertEquals(ZoneId.of("America/New_York"), TimeZones.resolve("America/New_York"));
    assertEquals(ZoneOffset.ofHoursMinutes(5, 30), TimeZones.resolve("+05:30"));
    assertEquals(ZoneOffset.ofHours(-8), TimeZones.resolve("-8"));
    assertEquals(ZoneOffset.ofHours(3), TimeZones.resolve(" 3 "));
  }

  @Test
  public void unknownZoneIsValidationError() {
    try {
      TimeZones.resolve("Nowhere/Special");
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.VALIDATION, e.getErrorType());
      assertThat(e.getMessage(), containsString("cannot find time zone \"Nowhere/Special\""));
    }
  }

  @Test
  public void outOfRangeHoursAreRejected() {
    try {
      TimeZones.resolve("42");
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.VALIDATION, e.getErrorType());
    }
  }
}
