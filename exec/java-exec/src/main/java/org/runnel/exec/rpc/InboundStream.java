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
package org.runnel.exec.rpc;

import org.runnel.exec.message.ProducerMessage;

/**
 * Server side of a stream opened by a producer on another node. The first message carries the
 * {@link org.runnel.exec.message.StreamHeader header} naming the flow and stream it feeds.
 */
public interface InboundStream {

  /**
   * @return the next message, or {@code null} once the producer closed the stream
   */
  ProducerMessage receive() throws RpcException;
}
