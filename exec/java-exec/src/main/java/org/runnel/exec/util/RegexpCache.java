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

import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.runnel.common.exceptions.UserException;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;

/**
 * Node-wide cache of compiled regular expressions, shared by every flow.
 */
public class RegexpCache {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(RegexpCache.class);

  private final LoadingCache<String, Pattern> patterns;

  public RegexpCache(int size) {
    patterns = CacheBuilder.newBuilder()
        .maximumSize(size)
        .build(new CacheLoader<String, Pattern>() {
          @Override
          public Pattern load(String regex) {
            return Pattern.compile(regex);
          }
        });
  }

  /**
   * @throws UserException validation error if {@code regex} does not compile
   */
  public Pattern getPattern(String regex) {
    try {
      return patterns.get(regex);
    } catch (UncheckedExecutionException | ExecutionException e) {
      if (e.getCause() instanceof PatternSyntaxException) {
        throw UserException.validationError(e.getCause())
            .message("invalid regular expression: %s", e.getCause().getMessage())
            .build(logger);
      }
      throw UserException.systemError(e.getCause()).build(logger);
    }
  }

  public long size() {
    return patterns.size();
  }
}
