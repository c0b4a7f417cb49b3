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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Properties;

import org.junit.Test;
import org.runnel.common.config.RunnelConfig;
import org.runnel.common.exceptions.ErrorType;
import org.runnel.common.exceptions.UserException;
import org.runnel.exec.ExecConstants;
import org.runnel.exec.server.options.OptionValue.OptionScope;
import org.runnel.test.RunnelTest;

public class TestSystemOptionManager extends RunnelTest {

  @Test
  public void defaultsComeFromBootConfig() {
    final SystemOptionManager options = new SystemOptionManager(RunnelConfig.create());
    assertFalse(options.getOption(ExecConstants.TEMP_STORAGE_ENABLED_VALIDATOR));
    assertEquals(500, options.getOption(ExecConstants.MAX_RUNNING_FLOWS_VALIDATOR));
    assertEquals(OptionScope.BOOT, options.getOption(ExecConstants.MAX_RUNNING_FLOWS).scope);
  }

  @Test
  public void bootOverrideChangesDefault() {
    final Properties overrides = new Properties();
    overrides.setProperty(ExecConstants.bootDefaultFor(ExecConstants.MAX_RUNNING_FLOWS), "7");
    overrides.setProperty(ExecConstants.bootDefaultFor(ExecConstants.TEMP_STORAGE_ENABLED), "true");
    final SystemOptionManager options = new SystemOptionManager(RunnelConfig.create(overrides));
    assertEquals(7, options.getOption(ExecConstants.MAX_RUNNING_FLOWS_VALIDATOR));
    assertTrue(options.getOption(ExecConstants.TEMP_STORAGE_ENABLED_VALIDATOR));
  }

  @Test
  public void setThenDeleteRevertsToDefault() {
    final SystemOptionManager options = new SystemOptionManager(RunnelConfig.create());
    options.setOption(OptionValue.createLong(ExecConstants.MAX_RUNNING_FLOWS, 3, OptionScope.SYSTEM));
    assertEquals(3, options.getOption(ExecConstants.MAX_RUNNING_FLOWS_VALIDATOR));

    options.deleteOption(ExecConstants.MAX_RUNNING_FLOWS);
    assertEquals(500, options.getOption(ExecConstants.MAX_RUNNING_FLOWS_VALIDATOR));
  }

  @Test
  public void rejectsOutOfRangeValue() {
    final SystemOptionManager options = new SystemOptionManager(RunnelConfig.create());
    try {
      options.setOption(OptionValue.createLong(ExecConstants.MAX_RUNNING_FLOWS, 0, OptionScope.SYSTEM));
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.VALIDATION, e.getErrorType());
      assertThat(e.getMessage(), containsString("must be between 1 and"));
    }
    assertEquals(500, options.getOption(ExecConstants.MAX_RUNNING_FLOWS_VALIDATOR));
  }

  @Test
  public void rejectsWrongKind() {
    final SystemOptionManager options = new SystemOptionManager(RunnelConfig.create());
    try {
      options.setOption(OptionValue.createBoolean(ExecConstants.MAX_RUNNING_FLOWS, true, OptionScope.SYSTEM));
      fail();
    } catch (UserException e) {
      assertThat(e.getMessage(), containsString("must be of type LONG"));
    }
  }

  @Test
  public void unknownOptionIsRejected() {
    final SystemOptionManager options = new SystemOptionManager(RunnelConfig.create());
    try {
      options.getOption("exec.no_such_option");
      fail();
    } catch (UserException e) {
      assertThat(e.getMessage(), containsString("The option 'exec.no_such_option' does not exist."));
    }
  }
}
