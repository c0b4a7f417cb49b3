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

import org.runnel.common.config.RunnelConfig;

/**
 * Validates the values provided to runtime options.
 */
public abstract class OptionValidator {
  private final String optionName;

  public OptionValidator(String optionName) {
    this.optionName = optionName;
  }

  public String getOptionName() {
    return optionName;
  }

  /**
   * Gets the default option value for this validator, as loaded by {@link #loadDefault(RunnelConfig)}.
   *
   * @return default option value
   */
  public abstract OptionValue getDefault();

  /**
   * Reads the boot-time default of this option from the configuration.
   */
  public abstract void loadDefault(RunnelConfig bootConfig);

  /**
   * Validates the option value.
   *
   * @param value the value to validate
   * @throws org.runnel.common.exceptions.UserException message to describe error with value, including range
   */
  public abstract void validate(OptionValue value);

  public abstract OptionValue.Kind getKind();
}
