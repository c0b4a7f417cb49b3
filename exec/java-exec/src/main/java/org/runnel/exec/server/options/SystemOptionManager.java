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

import java.util.Map;
import java.util.concurrent.ConcurrentMap;

import org.runnel.common.config.RunnelConfig;
import org.runnel.common.exceptions.UserException;
import org.runnel.exec.ExecConstants;
import org.runnel.exec.server.options.TypeValidators.BooleanValidator;
import org.runnel.exec.server.options.TypeValidators.LongValidator;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * {@link OptionManager} holding the node-wide values of runtime options. Only one instance of this class exists per
 * node. Defaults are read from the boot configuration under {@link ExecConstants#OPTION_DEFAULTS_ROOT}; values set
 * at runtime are kept in memory and apply to every flow set up afterwards.
 */
public class SystemOptionManager implements OptionManager {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SystemOptionManager.class);

  private static final Map<String, OptionValidator> VALIDATORS;

  static {
    final OptionValidator[] validators = new OptionValidator[] {
        ExecConstants.TEMP_STORAGE_ENABLED_VALIDATOR,
        ExecConstants.MAX_RUNNING_FLOWS_VALIDATOR
    };
    final ImmutableMap.Builder<String, OptionValidator> builder = ImmutableMap.builder();
    for (final OptionValidator validator : validators) {
      builder.put(validator.getOptionName(), validator);
    }
    VALIDATORS = builder.build();
  }

  private final ConcurrentMap<String, OptionValue> options = Maps.newConcurrentMap();
  private final Map<String, OptionValue> defaults;

  public SystemOptionManager(RunnelConfig bootConfig) {
    final ImmutableMap.Builder<String, OptionValue> builder = ImmutableMap.builder();
    for (final OptionValidator validator : VALIDATORS.values()) {
      validator.loadDefault(bootConfig);
      builder.put(validator.getOptionName(), validator.getDefault());
    }
    defaults = builder.build();
  }

  @Override
  public void setOption(final OptionValue value) {
    final OptionValidator validator = getValidator(value.name);
    validator.validate(value);
    logger.info("Setting option {} to {}", value.name, value.getValue());
    options.put(value.name, value);
  }

  @Override
  public void deleteOption(final String name) {
    getValidator(name);
    options.remove(name);
  }

  @Override
  public OptionValue getOption(final String name) {
    final OptionValue value = options.get(name);
    if (value != null) {
      return value;
    }
    getValidator(name);
    return defaults.get(name);
  }

  @Override
  public boolean getOption(BooleanValidator validator) {
    return getOption(validator.getOptionName()).bool_val;
  }

  @Override
  public long getOption(LongValidator validator) {
    return getOption(validator.getOptionName()).num_val;
  }

  private static OptionValidator getValidator(final String name) {
    final OptionValidator validator = VALIDATORS.get(name);
    if (validator == null) {
      throw UserException.validationError()
          .message(String.format("The option '%s' does not exist.", name))
          .build(logger);
    }
    return validator;
  }
}
