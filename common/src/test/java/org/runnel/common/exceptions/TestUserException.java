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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;

import org.junit.Test;
import org.runnel.test.RunnelTest;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Test various use cases around creating user exceptions
 */
public class TestUserException extends RunnelTest {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TestUserException.class);

  private Exception wrap(UserException uex, int numWraps) {
    Exception ex = uex;
    for (int i = 0; i < numWraps; i++) {
      ex = new Exception("wrap #" + (i + 1), ex);
    }

    return ex;
  }

  // make sure system exceptions are created properly
  @Test
  public void testBuildSystemException() {
    UserException uex = UserException.systemError(new RuntimeException("this is an exception")).build(logger);
    RemoteError error = uex.getOrCreateRemoteError(true);

    assertEquals(ErrorType.SYSTEM, error.getErrorType());
    assertEquals("RuntimeException: this is an exception", uex.getOriginalMessage());
    assertEquals(RuntimeException.class.getName(), error.getExceptionClass());
  }

  @Test
  public void testBuildUserExceptionWithCause() {
    String message = "Test message";

    UserException uex = UserException.executionError(new RuntimeException(message)).build(logger);

    // cause message should be used
    assertEquals(ErrorType.EXECUTION_ERROR, uex.getErrorType());
    assertEquals(message, uex.getOriginalMessage());
  }

  @Test
  public void testBuildUserExceptionWithCauseAndMessage() {
    String messageA = "Test message A";
    String messageB = "Test message B";

    UserException uex = UserException.executionError(new RuntimeException(messageA))
        .message(messageB)
        .build(logger);
    RemoteError error = uex.getOrCreateRemoteError(false);

    // passed message should override the cause message
    assertThat(error.getMessage(), not(containsString(messageA)));
    assertEquals(messageB, uex.getOriginalMessage());
  }

  @Test
  public void testBuildUserExceptionWithUserExceptionCauseAndMessage() {
    String messageA = "Test message A";
    String messageB = "Test message B";

    UserException original = UserException.connectionError().message(messageA).build(logger);
    UserException uex = UserException.executionError(wrap(original, 5))
        .message(messageB)
        .addContext("flow", "f1")
        .build(logger);

    //builder should return the unwrapped original user exception and not build a new one
    assertSame(original, uex);
    assertEquals(messageA, uex.getOriginalMessage());
    assertThat(uex.getMessage(), containsString("flow: f1"));
  }

  @Test
  public void testBuildUserExceptionWithFormattedMessage() {
    String format = "This is test #%d";

    UserException uex = UserException.validationError().message(format, 5).build(logger);

    assertEquals(ErrorType.VALIDATION, uex.getErrorType());
    assertEquals(String.format(format, 5), uex.getOriginalMessage());
  }

  @Test
  public void testMemoryErrorIsResourceError() {
    UserException uex = UserException.memoryError().build(logger);

    assertEquals(ErrorType.RESOURCE, uex.getErrorType());
    assertEquals(UserException.MEMORY_ERROR_MSG, uex.getOriginalMessage());
  }

  @Test
  public void testIdentityIsKeptInRemoteError() {
    UserException uex = UserException.planError().message("bad flow").addIdentity(7).build(logger);
    RemoteError error = uex.getOrCreateRemoteError(false);

    assertEquals(7, error.getNodeId());
    assertEquals(uex.getErrorId(), error.getErrorId());
    assertThat(error.getMessage(), containsString("on node 7"));
  }

  @Test
  public void testPlainExceptionBecomesSystemRemoteError() {
    RemoteError error = UserException.getOrCreateRemoteError(new IllegalStateException("boom"), 3, false);

    assertEquals(ErrorType.SYSTEM, error.getErrorType());
    assertEquals(3, error.getNodeId());
    assertThat(error.getMessage(), containsString("IllegalStateException: boom"));
  }

  @Test
  public void testRemoteErrorSurvivesJson() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    RemoteError error = UserException.resourceError().message("too big").addIdentity(2).build(logger)
        .getOrCreateRemoteError(false);

    RemoteError read = mapper.readValue(mapper.writeValueAsString(error), RemoteError.class);
    UserRemoteException remote = new UserRemoteException(read);

    assertNotNull(remote.getErrorId());
    assertEquals(ErrorType.RESOURCE, remote.getErrorType());
    assertEquals(error.getMessage(), remote.getMessage());
    assertEquals(2, remote.getNodeId());
  }
}
