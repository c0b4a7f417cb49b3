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

import org.slf4j.Logger;

/**
 * Base class for all user exceptions. The goal is to separate out common error conditions where we can give users
 * useful feedback.
 * <p>Throwing a user exception guarantees its message will be displayed to the user, along with any context
 * information added to the exception at various levels while being sent back to the gateway node.
 * <p>A specific class of user exceptions are system exceptions. They represent system level errors that don't
 * display any specific error message to the user apart from the root error message, along with the error id used to
 * retrieve the details from the logs.
 * <p>Any thrown exception that is not wrapped inside a user exception is converted to a system exception before
 * it leaves the node, see {@link #getOrCreateRemoteError(Throwable, int, boolean)}.
 */
public class UserException extends RunnelRuntimeException {
  private static final long serialVersionUID = -6720929331624621840L;

  public static final String MEMORY_ERROR_MSG = "One or more nodes ran out of memory while executing the flow.";

  /**
   * Creates a RESOURCE error with a prebuilt message for out of memory exceptions
   *
   * @param cause exception that will be wrapped inside a memory error
   * @return resource error builder
   */
  public static Builder memoryError(final Throwable cause) {
    return UserException.resourceError(cause)
      .message(MEMORY_ERROR_MSG);
  }

  public static Builder memoryError() {
    return memoryError(null);
  }

  /**
   * Wraps the passed exception inside a system error.
   * <p>The cause message will be used unless {@link Builder#message(String, Object...)} is called.
   * <p>If the wrapped exception is, or wraps, a user exception it will be returned by {@link Builder#build(Logger)}
   * instead of creating a new exception. Any added context will be added to the user exception as well.
   *
   * @param cause exception we want the user exception to wrap. If cause is, or wraps, a user exception it will be
   *              returned by the builder instead of creating a new user exception
   * @return user exception builder
   */
  public static Builder systemError(final Throwable cause) {
    return new Builder(ErrorType.SYSTEM, cause);
  }

  public static Builder connectionError() {
    return connectionError(null);
  }

  public static Builder connectionError(final Throwable cause) {
    return new Builder(ErrorType.CONNECTION, cause);
  }

  public static Builder executionError() {
    return executionError(null);
  }

  public static Builder executionError(final Throwable cause) {
    return new Builder(ErrorType.EXECUTION_ERROR, cause);
  }

  public static Builder validationError() {
    return validationError(null);
  }

  public static Builder validationError(final Throwable cause) {
    return new Builder(ErrorType.VALIDATION, cause);
  }

  public static Builder planError() {
    return planError(null);
  }

  public static Builder planError(final Throwable cause) {
    return new Builder(ErrorType.PLAN, cause);
  }

  public static Builder resourceError() {
    return resourceError(null);
  }

  public static Builder resourceError(final Throwable cause) {
    return new Builder(ErrorType.RESOURCE, cause);
  }

  /**
   * Builder class for UserException. You can wrap an existing exception, in this case it will first check if
   * this exception is, or wraps, a UserException. If it does then the builder will use the user exception as it is
   * (it will ignore the message passed to the constructor) and will add any additional context information to the
   * exception's context
   */
  public static class Builder {

    private final Throwable cause;
    private final ErrorType errorType;
    private final UserException uex;
    private final UserExceptionContext context;

    private String message;

    /**
     * Wraps an existing exception inside a user exception.
     *
     * @param errorType user exception type that should be created if the passed exception isn't,
     *                  or doesn't wrap a user exception
     * @param cause exception to wrap inside a user exception. Can be null
     */
    private Builder(final ErrorType errorType, final Throwable cause) {
      this.cause = cause;

      uex = ErrorHelper.findWrappedUserException(cause);
      if (uex != null) {
        this.errorType = null;
        this.context = uex.context;
      } else {
        this.errorType = errorType;
        this.context = new UserExceptionContext();
        this.message = cause != null ? cause.getMessage() : null;
      }
    }

    /**
     * sets or replaces the error message.
     * <p>This will be ignored if this builder is wrapping a user exception
     *
     * @see String#format(String, Object...)
     *
     * @param format format string
     * @param args Arguments referenced by the format specifiers in the format string
     * @return this builder
     */
    public Builder message(final String format, final Object... args) {
      // we can't replace the message of a user exception
      if (uex == null && format != null) {
        this.message = args.length == 0 ? format : String.format(format, args);
      }
      return this;
    }

    /**
     * add the identity of the node raising the error.
     * <p>if the context already has an identity, the new identity will be ignored
     */
    public Builder addIdentity(final int nodeId) {
      context.addIdentity(nodeId);
      return this;
    }

    /**
     * add a string line to the bottom of the context
     * @param value string line
     * @return this builder
     */
    public Builder addContext(final String value) {
      context.add(value);
      return this;
    }

    public Builder addContext(final String name, final String value) {
      context.add(name, value);
      return this;
    }

    public Builder addContext(final String name, final long value) {
      context.add(name, value);
      return this;
    }

    /**
     * builds a user exception or returns the wrapped one. If the error is a system error, the error message is
     * logged to the given {@link Logger}.
     *
     * @param logger the logger to write to
     * @return user exception
     */
    public UserException build(final Logger logger) {
      if (uex != null) {
        return uex;
      }

      boolean isSystemError = errorType == ErrorType.SYSTEM;

      // make sure system errors use the root error message and display the root cause class name
      if (isSystemError) {
        message = ErrorHelper.getRootMessage(cause);
      }

      final UserException newException = new UserException(this);

      // system errors are something an operator should look at and get logged as ERROR. Errors caused
      // by the request itself are only interesting to whoever sent it.
      if (isSystemError) {
        logger.error(newException.getMessage(), newException);
      } else {
        StringBuilder buf = new StringBuilder();
        buf.append("User Error Occurred");
        if (message != null) {
          buf.append(": ").append(message);
        }
        if (cause != null) {
          buf.append(" (").append(cause.getMessage()).append(")");
        }
        logger.info(buf.toString(), newException);
      }

      return newException;
    }
  }

  private final ErrorType errorType;

  private final UserExceptionContext context;

  protected UserException(final ErrorType errorType, final String message, final Throwable cause) {
    super(message, cause);

    this.errorType = errorType;
    this.context = new UserExceptionContext();
  }

  private UserException(final Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.context = builder.context;
  }

  /**
   * generates the message that will be displayed to the client without the stack trace.
   *
   * @return non verbose error message
   */
  @Override
  public String getMessage() {
    return generateMessage(true);
  }

  public String getMessage(boolean includeErrorIdAndIdentity) {
    return generateMessage(includeErrorIdAndIdentity);
  }

  /**
   * @return the error message that was passed to the builder
   */
  public String getOriginalMessage() {
    return super.getMessage();
  }

  /**
   * generates the message that will be displayed to the client. The message also contains the stack trace.
   *
   * @return verbose error message
   */
  public String getVerboseMessage() {
    return generateMessage(true) + "\n\n" + ErrorHelper.buildCausesMessage(getCause());
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  public String getErrorId() {
    return context.getErrorId();
  }

  public int getNodeId() {
    return context.getNodeId();
  }

  /**
   * creates a RemoteError object corresponding to this user exception, ready to travel in a response or in
   * stream metadata.
   *
   * @param verbose should the error object contain the verbose error message ?
   * @return remote error object
   */
  public RemoteError getOrCreateRemoteError(final boolean verbose) {
    final String message = verbose ? getVerboseMessage() : getMessage();
    return new RemoteError(errorType, context.getErrorId(), context.getNodeId(), message,
        getCause() != null ? getCause().getClass().getName() : null);
  }

  /**
   * Converts any failure into a remote error, wrapping it as a system error first unless it already is, or wraps,
   * a user exception.
   */
  public static RemoteError getOrCreateRemoteError(final Throwable t, final int nodeId, final boolean verbose) {
    final UserException uex = t instanceof UserException
        ? (UserException) t
        : UserException.systemError(t).addIdentity(nodeId).build(
            org.slf4j.LoggerFactory.getLogger(UserException.class));
    uex.context.addIdentity(nodeId);
    return uex.getOrCreateRemoteError(verbose);
  }

  /**
   * Generates a user error message that has the following structure:
   * ERROR TYPE ERROR: ERROR_MESSAGE
   * CONTEXT
   * [Error Id: ERROR_ID on node NODE_ID]
   *
   * @return generated user error message
   */
  private String generateMessage(boolean includeErrorIdAndIdentity) {
    return errorType + " ERROR: " + super.getMessage() + "\n\n" +
        context.generateContextMessage(includeErrorIdAndIdentity);
  }
}
