// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package io.resilient.amqp;

import java.util.Map;

/**
 * API to send messages.
 *
 * <p>Instances are configured and created with a {@link PublisherBuilder}. Publish operations never
 * throw: failures are reported with a <code>false</code> return value and an {@link Event#ERROR}
 * event carrying an {@link AmqpException.AmqpPublishException}.
 *
 * @see PublisherBuilder
 */
public interface Publisher extends Resource, AutoCloseable {

  /**
   * Declare the exchange.
   *
   * @throws AmqpException if the declaration fails
   */
  void assertExchange();

  /**
   * Declare the configured queue and bind it to the exchange with the routing key.
   *
   * @throws AmqpException if no queue is configured or a declaration fails
   */
  void assertQueue();

  /**
   * Publish a message to the exchange with the configured routing key.
   *
   * @param message message body, encoded as UTF-8
   * @return true if the message was handed to the broker client
   */
  boolean publish(String message);

  /**
   * Publish a message with headers to the exchange with the configured routing key.
   *
   * @param message message body, encoded as UTF-8
   * @param headers message headers
   * @return true if the message was handed to the broker client
   */
  boolean publish(String message, Map<String, Object> headers);

  /**
   * Send a message directly to the configured queue.
   *
   * @param message message body, encoded as UTF-8
   * @return true if the message was handed to the broker client
   */
  boolean publishToQueue(String message);

  /**
   * Send a message with headers directly to the configured queue.
   *
   * @param message message body, encoded as UTF-8
   * @param headers message headers
   * @return true if the message was handed to the broker client
   */
  boolean publishToQueue(String message, Map<String, Object> headers);

  /** Close the channel and the connection the publisher owns, without triggering reconnection. */
  void stop();

  /** Stop the publisher for good. */
  @Override
  void close();
}
