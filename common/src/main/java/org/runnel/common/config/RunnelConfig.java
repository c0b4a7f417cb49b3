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
package org.runnel.common.config;

import java.net.URL;
import java.time.Duration;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;

/**
 * Boot-time configuration of a node. Values come from, in decreasing order of
 * precedence:
 * <ul>
 * <li>properties handed to {@link #create(Properties)} (tests only),</li>
 * <li>a single copy of "{@code runnel-override.conf}" on the classpath, together
 *     with JVM system properties,</li>
 * <li>a single copy of "{@code runnel-default.conf}" on the classpath.</li>
 * </ul>
 * Runtime settings that may change while the node runs live in the option
 * manager instead.
 */
public class RunnelConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(RunnelConfig.class);

  private final Config config;

  @VisibleForTesting
  public RunnelConfig(Config config) {
    this.config = config;
    logger.trace("Given Config object is:\n{}",
        config.root().render(ConfigRenderOptions.defaults()));
  }

  public static RunnelConfig create() {
    return create(null, null);
  }

  public static RunnelConfig create(String overrideFileResourcePathname) {
    return create(overrideFileResourcePathname, null);
  }

  /**
   * <b><u>Do not use this method outside of test code.</u></b>
   */
  @VisibleForTesting
  public static RunnelConfig create(Properties testConfigurations) {
    return create(null, testConfigurations);
  }

  public static RunnelConfig create(Config config) {
    return new RunnelConfig(config.resolve());
  }

  private static RunnelConfig create(String overrideFileResourcePathname, Properties overriderProps) {
    final StringBuilder logString = new StringBuilder();
    final Stopwatch watch = Stopwatch.createStarted();
    overrideFileResourcePathname =
        overrideFileResourcePathname == null
            ? CommonConstants.CONFIG_OVERRIDE_RESOURCE_PATHNAME
            : overrideFileResourcePathname;

    final ClassLoader classLoader = Thread.currentThread().getContextClassLoader();

    // 1. Load defaults configuration file.
    final URL defaultUrl = classLoader.getResource(CommonConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME);
    if (defaultUrl != null) {
      logString.append("Base Configuration:\n\t- ").append(defaultUrl).append("\n");
    }
    Config fallback = ConfigFactory.parseResources(classLoader, CommonConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME);

    // 2. Load the overrides file along with JVM system properties.
    final URL overrideFileUrl = classLoader.getResource(overrideFileResourcePathname);
    if (overrideFileUrl != null) {
      logString.append("Override File: ").append(overrideFileUrl).append("\n");
    }
    Config effectiveConfig = ConfigFactory.load(overrideFileResourcePathname).withFallback(fallback);

    // 3. Apply any overriding properties.
    if (overriderProps != null) {
      logString.append("Overridden Properties:\n");
      for (Entry<Object, Object> entry : overriderProps.entrySet()) {
        logString.append("\t-").append(entry.getKey()).append(" = ").append(entry.getValue()).append("\n");
      }
      effectiveConfig = ConfigFactory.parseProperties(overriderProps).withFallback(effectiveConfig);
    }

    logger.info("Configuration file(s) identified in {}ms.\n{}",
        watch.elapsed(TimeUnit.MILLISECONDS), logString);
    return new RunnelConfig(effectiveConfig.resolve());
  }

  public boolean hasPath(String path) {
    return config.hasPath(path);
  }

  public boolean getBoolean(String path) {
    return config.getBoolean(path);
  }

  public int getInt(String path) {
    return config.getInt(path);
  }

  public long getLong(String path) {
    return config.getLong(path);
  }

  public String getString(String path) {
    return config.getString(path);
  }

  public Duration getDuration(String path) {
    return config.getDuration(path);
  }

  /**
   * Size setting in bytes; accepts HOCON size units such as {@code 4g} or {@code 10k}.
   */
  public long getBytes(String path) {
    return config.getBytes(path);
  }

  public Config getConfig(String path) {
    return config.getConfig(path);
  }

  /**
   * Returns a copy of this configuration with {@code path} set to {@code value}.
   */
  public RunnelConfig withValue(String path, Object value) {
    return new RunnelConfig(config.withValue(path,
        com.typesafe.config.ConfigValueFactory.fromAnyRef(value)));
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}
