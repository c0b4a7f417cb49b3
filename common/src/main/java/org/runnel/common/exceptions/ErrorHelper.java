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
package org.runnel.common.exceptions;

import com.google.common.base.Throwables;
import com.google.common.collect.Iterables;

/**
 * Message helpers for {@link UserException}.
 */
public class ErrorHelper {

  private ErrorHelper() {
  }

  /**
   * Every exception of the causal chain with its stack, one frame per line. Used by verbose error messages.
   */
  static String buildCausesMessage(final Throwable t) {
    final StringBuilder sb = new StringBuilder();
    boolean first = true;
    for (Throwable ex : Throwables.getCausalChain(t)) {
      sb.append(first ? "  (" : "  Caused By (")
          .append(ex.getClass().getCanonicalName())
          .append(") ")
          .append(ex.getMessage())
          .append('\n');
      for (StackTraceElement frame : ex.getStackTrace()) {
        sb.append("    ").append(frame.getClassName()).append('.').append(frame.getMethodName())
            .append("():").append(frame.getLineNumber()).append('\n');
      }
      first = false;
    }
    return sb.toString();
  }

  /**
   * Message of the innermost cause, prefixed with its simple class name.
   */
  public static String getRootMessage(final Throwable t) {
    if (t == null) {
      return null;
    }
    final Throwable root = Throwables.getRootCause(t);
    final String message = root.getMessage();
    return root.getClass().getSimpleName() + (message != null ? ": " + message : "");
  }

  /**
   * @return the outermost user exception in the causal chain of {@code ex}, null if there is none
   */
  static UserException findWrappedUserException(Throwable ex) {
    if (ex == null) {
      return null;
    }
    return Iterables.getFirst(Iterables.filter(Throwables.getCausalChain(ex), UserException.class), null);
  }
}
