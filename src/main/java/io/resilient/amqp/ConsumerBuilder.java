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

/** API to configure and create a {@link Consumer}. */
public interface ConsumerBuilder {

  /**
   * Name of the service, used as the consumer tag.
   *
   * @param serviceName service name
   * @return this builder instance
   */
  ConsumerBuilder serviceName(String serviceName);

  /**
   * The queue to consume from. Mandatory.
   *
   * @param queue queue name
   * @return this builder instance
   */
  ConsumerBuilder queue(String queue);

  /**
   * Exchange to bind the queue to. Optional.
   *
   * @param exchange exchange name
   * @return this builder instance
   */
  ConsumerBuilder exchange(String exchange);

  /**
   * Type of the exchange. Default is {@link ExchangeType#TOPIC}.
   *
   * @param exchangeType exchange type
   * @return this builder instance
   */
  ConsumerBuilder exchangeType(ExchangeType exchangeType);

  /**
   * Routing key of the binding between the exchange and the queue. Default is an empty string.
   *
   * @param routingKey binding key
   * @return this builder instance
   */
  ConsumerBuilder routingKey(String routingKey);

  /**
   * Whether the exchanges and queues are durable. Default is false.
   *
   * @param durable durable flag
   * @return this builder instance
   */
  ConsumerBuilder durable(boolean durable);

  /**
   * How messages are settled. Default is {@link AckMode#AUTOMATIC}.
   *
   * @param ackMode acknowledgment mode
   * @return this builder instance
   */
  ConsumerBuilder ackMode(AckMode ackMode);

  /**
   * Dead-letter exchange of the queue.
   *
   * <p>The exchange is declared as a topic exchange, with a queue of the same name bound to it with
   * <code>#</code>.
   *
   * @param deadLetterExchange exchange name
   * @return this builder instance
   */
  ConsumerBuilder deadLetterExchange(String deadLetterExchange);

  /**
   * Maximum number of unacknowledged messages. Default is 0 (no limit).
   *
   * @param prefetchCount prefetch count
   * @return this builder instance
   */
  ConsumerBuilder prefetchCount(int prefetchCount);

  /**
   * Whether this consumer consumes from the dead-letter queue itself, in which case it does not
   * declare a dead-letter exchange and queue. Default is false.
   *
   * @param deadLetterConsumer dead-letter consumer flag
   * @return this builder instance
   */
  ConsumerBuilder deadLetterConsumer(boolean deadLetterConsumer);

  /**
   * Callback for inbound messages.
   *
   * @param handler the callback
   * @return this builder instance
   */
  ConsumerBuilder messageHandler(Consumer.MessageHandler handler);

  /**
   * Use a connection shared with other clients.
   *
   * <p>The consumer creates and owns its connection by default.
   *
   * @param connectionProvider shared connection
   * @return this builder instance
   * @see Environment#connectionProvider()
   */
  ConsumerBuilder connectionProvider(ConnectionProvider connectionProvider);

  /**
   * Add {@link Resource.EventListener}s to the consumer.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  ConsumerBuilder listeners(Resource.EventListener... listeners);

  /**
   * Create the consumer. It does not connect until {@link Consumer#listen()} is called.
   *
   * @return the configured consumer
   */
  Consumer build();
}
