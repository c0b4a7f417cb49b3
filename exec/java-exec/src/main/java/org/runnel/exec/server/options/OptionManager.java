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

import org.runnel.exec.server.options.TypeValidators.BooleanValidator;
import org.runnel.exec.server.options.TypeValidators.LongValidator;

/**
 * Manager for runtime {@link OptionValue options}. Values may change while the node runs; readers should look an
 * option up each time they need it rather than caching it.
 */
public interface OptionManager {

  /**
   * Sets an option value.
   *
   * @param value option value
   * @throws org.runnel.common.exceptions.UserException message to describe error with value
   */
  void setOption(OptionValue value);

  /**
   * Removes a value set at runtime, reverting the option to its boot-time default.
   */
  void deleteOption(String name);

  /**
   * Gets the option value for the given option name.
   *
   * @param name option name
   * @return the option value, the default if it was never set
   * @throws org.runnel.common.exceptions.UserException if the option is unknown
   */
  OptionValue getOption(String name);

  boolean getOption(BooleanValidator validator);

  long getOption(LongValidator validator);
}
