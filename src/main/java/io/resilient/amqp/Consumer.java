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

import com.rabbitmq.client.Delivery;

/**
 * API to consume messages from a queue.
 *
 * <p>Instances are configured and created with a {@link ConsumerBuilder}. The consumer declares its
 * topology and subscribes with {@link #listen()}, then re-subscribes on its own after connection or
 * channel failures.
 *
 * @see ConsumerBuilder
 */
public interface Consumer extends Resource, AutoCloseable {

  /**
   * Declare the queue, its dead-letter exchange and queue, and the exchange and binding, depending
   * on the configuration.
   *
   * @throws AmqpException.AmqpTopologyException if a declaration fails
   */
  void assertTopology();

  /**
   * Declare the topology and subscribe to the queue.
   *
   * <p>Emits {@link Event#LISTEN} on success.
   *
   * @return the consumer tag
   * @throws AmqpException if the connection, the channel, the topology or the subscription fails
   */
  String listen();

  /**
   * Acknowledge a message.
   *
   * <p>Failures are logged, a channel destroyed by the operation triggers a reconnection.
   *
   * @param delivery the message
   */
  void acknowledgeMessage(Delivery delivery);

  /**
   * Reject a message without requeuing it, it goes to the dead-letter exchange if any.
   *
   * @param delivery the message
   */
  void rejectMessage(Delivery delivery);

  /**
   * Reject a message.
   *
   * @param delivery the message
   * @param requeue whether the broker should requeue the message
   */
  void rejectMessage(Delivery delivery, boolean requeue);

  /**
   * Close the channel and the connection the consumer owns, without triggering reconnection.
   *
   * <p>A later call to {@link #listen()} starts the consumer again.
   */
  void stop();

  /** Stop the consumer for good. */
  @Override
  void close();

  /** Callback for inbound messages. */
  @FunctionalInterface
  interface MessageHandler {

    /**
     * Handle a message.
     *
     * @param payload the message body, decoded as UTF-8
     * @param delivery the raw delivery (envelope, properties, body)
     */
    void handle(String payload, Delivery delivery);
  }
}
