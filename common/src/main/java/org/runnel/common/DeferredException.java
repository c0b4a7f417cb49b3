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
package org.runnel.common;

import com.google.common.base.Preconditions;

/**
 * Closes a series of resources, remembering failures instead of stopping at the first one. {@link #close()}
 * rethrows the first failure with the later ones attached as suppressed exceptions.
 */
public class DeferredException implements AutoCloseable {
  private Exception exception;
  private boolean closed;

  public synchronized void addException(Exception e) {
    Preconditions.checkNotNull(e);
    Preconditions.checkState(!closed, "already closed");
    if (exception == null) {
      exception = e;
    } else if (exception != e) {
      exception.addSuppressed(e);
    }
  }

  /**
   * Closes {@code resource}, which may be null, and records what it throws.
   */
  public synchronized void suppressingClose(AutoCloseable resource) {
    Preconditions.checkState(!closed, "already closed");
    if (resource == null) {
      return;
    }
    try {
      resource.close();
    } catch (Exception e) {
      addException(e);
    }
  }

  /**
   * @return the first recorded failure, null if there is none yet
   */
  public synchronized Exception getException() {
    return exception;
  }

  @Override
  public synchronized void close() throws Exception {
    closed = true;
    final Exception e = exception;
    exception = null;
    if (e != null) {
      throw e;
    }
  }
}
