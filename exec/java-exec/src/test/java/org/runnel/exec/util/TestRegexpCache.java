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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.regex.Pattern;

import org.junit.Test;
import org.runnel.common.exceptions.ErrorType;
import org.runnel.common.exceptions.UserException;
import org.runnel.test.RunnelTest;

public class TestRegexpCache extends RunnelTest {

  @Test
  public void compiledPatternsAreReused() {
    final RegexpCache cache = new RegexpCache(4);
    final Pattern pattern = cache.getPattern("a+b");
    assertSame(pattern, cache.getPattern("a+b"));
    assertTrue(pattern.matcher("aaab").matches());
    assertEquals(1, cache.size());
  }

  @Test
  public void cacheIsBounded() {
    final RegexpCache cache = new RegexpCache(2);
    for (int i = 0; i < 10; i++) {
      cache.getPattern("x{" + i + "}");
    }
    assertTrue(cache.size() <= 2);
  }

  @Test
  public void invalidPatternIsValidationError() {
    final RegexpCache cache = new RegexpCache(4);
    try {
      cache.getPattern("(unclosed");
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.VALIDATION, e.getErrorType());
      assertThat(e.getMessage(), containsString("invalid regular expression"));
    }
    assertEquals(0, cache.size());
  }
}
