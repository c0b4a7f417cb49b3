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
import org.runnel.common.exceptions.UserException;
import org.runnel.exec.ExecConstants;
import org.runnel.exec.server.options.OptionValue.Kind;
import org.runnel.exec.server.options.OptionValue.OptionScope;

public class TypeValidators {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TypeValidators.class);

  public static class PositiveLongValidator extends LongValidator {
    private final long max;

    public PositiveLongValidator(String name, long max) {
      super(name);
      this.max = max;
    }

    @Override
    public void validate(final OptionValue v) {
      super.validate(v);
      if (v.num_val > max || v.num_val < 1) {
        throw UserException.validationError()
            .message(String.format("Option %s must be between %d and %d.", getOptionName(), 1, max))
            .build(logger);
      }
    }
  }

  public static class BooleanValidator extends TypeValidator {
    public BooleanValidator(String name) {
      super(name, Kind.BOOLEAN);
    }

    @Override
    public void loadDefault(RunnelConfig bootConfig) {
      setDefaultValue(OptionValue.createBoolean(getOptionName(),
          bootConfig.getBoolean(getConfigProperty()), OptionScope.BOOT));
    }
  }

  public static class LongValidator extends TypeValidator {
    public LongValidator(String name) {
      super(name, Kind.LONG);
    }

    @Override
    public void loadDefault(RunnelConfig bootConfig) {
      setDefaultValue(OptionValue.createLong(getOptionName(),
          bootConfig.getLong(getConfigProperty()), OptionScope.BOOT));
    }
  }

  public static abstract class TypeValidator extends OptionValidator {
    private final Kind kind;
    private OptionValue defaultValue = null;

    public TypeValidator(final String name, final Kind kind) {
      super(name);
      this.kind = kind;
    }

    @Override
    public OptionValue getDefault() {
      return defaultValue;
    }

    @Override
    public void validate(final OptionValue v) {
      if (v.kind != kind) {
        throw UserException.validationError()
            .message(String.format("Option %s must be of type %s but you tried to set to %s.", getOptionName(),
              kind.name(), v.kind.name()))
            .build(logger);
      }
    }

    @Override
    public Kind getKind() {
      return kind;
    }

    protected void setDefaultValue(OptionValue defaultValue) {
      this.defaultValue = defaultValue;
    }

    public String getConfigProperty() {
      return ExecConstants.bootDefaultFor(getOptionName());
    }
  }
}
