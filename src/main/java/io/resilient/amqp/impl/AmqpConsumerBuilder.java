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
package io.resilient.amqp.impl;

import io.resilient.amqp.AckMode;
import io.resilient.amqp.ConnectionProvider;
import io.resilient.amqp.Consumer;
import io.resilient.amqp.ConsumerBuilder;
import io.resilient.amqp.ExchangeType;
import io.resilient.amqp.Resource;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class AmqpConsumerBuilder implements ConsumerBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConsumerBuilder.class);

  static final Consumer.MessageHandler NO_OP_MESSAGE_HANDLER =
      (payload, delivery) ->
          LOGGER.debug(
              "No message handler, dropping message {}",
              delivery.getEnvelope().getDeliveryTag());

  private final AmqpEnvironment environment;
  private String serviceName = "";
  private String queue;
  private String exchange;
  private ExchangeType exchangeType = ExchangeType.TOPIC;
  private String routingKey = "";
  private boolean durable = false;
  private AckMode ackMode = AckMode.AUTOMATIC;
  private String deadLetterExchange;
  private int prefetchCount = 0;
  private boolean deadLetterConsumer = false;
  private Consumer.MessageHandler messageHandler = NO_OP_MESSAGE_HANDLER;
  private ConnectionManager connectionManager;
  private final List<Resource.EventListener> listeners = new ArrayList<>();

  AmqpConsumerBuilder(AmqpEnvironment environment) {
    this.environment = environment;
  }

  @Override
  public ConsumerBuilder serviceName(String serviceName) {
    this.serviceName = Utils.nullToEmpty(serviceName);
    return this;
  }

  @Override
  public ConsumerBuilder queue(String queue) {
    this.queue = queue;
    return this;
  }

  @Override
  public ConsumerBuilder exchange(String exchange) {
    this.exchange = exchange;
    return this;
  }

  @Override
  public ConsumerBuilder exchangeType(ExchangeType exchangeType) {
    this.exchangeType = exchangeType;
    return this;
  }

  @Override
  public ConsumerBuilder routingKey(String routingKey) {
    this.routingKey = Utils.nullToEmpty(routingKey);
    return this;
  }

  @Override
  public ConsumerBuilder durable(boolean durable) {
    this.durable = durable;
    return this;
  }

  @Override
  public ConsumerBuilder ackMode(AckMode ackMode) {
    this.ackMode = ackMode;
    return this;
  }

  @Override
  public ConsumerBuilder deadLetterExchange(String deadLetterExchange) {
    this.deadLetterExchange = deadLetterExchange;
    return this;
  }

  @Override
  public ConsumerBuilder prefetchCount(int prefetchCount) {
    this.prefetchCount = prefetchCount;
    return this;
  }

  @Override
  public ConsumerBuilder deadLetterConsumer(boolean deadLetterConsumer) {
    this.deadLetterConsumer = deadLetterConsumer;
    return this;
  }

  @Override
  public ConsumerBuilder messageHandler(Consumer.MessageHandler handler) {
    this.messageHandler = handler == null ? NO_OP_MESSAGE_HANDLER : handler;
    return this;
  }

  @Override
  public ConsumerBuilder connectionProvider(ConnectionProvider connectionProvider) {
    if (connectionProvider == null) {
      this.connectionManager = null;
    } else if (connectionProvider instanceof ConnectionManager) {
      this.connectionManager = (ConnectionManager) connectionProvider;
    } else {
      throw new IllegalArgumentException(
          "Connection provider must be created by an environment: " + connectionProvider);
    }
    return this;
  }

  @Override
  public ConsumerBuilder listeners(Resource.EventListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public Consumer build() {
    if (this.queue == null || this.queue.isBlank()) {
      throw new IllegalArgumentException("A queue must be specified");
    }
    if (this.exchangeType == null) {
      throw new IllegalArgumentException("Exchange type cannot be null");
    }
    if (this.ackMode == null) {
      throw new IllegalArgumentException("Ack mode cannot be null");
    }
    if (this.prefetchCount < 0) {
      throw new IllegalArgumentException("Prefetch count must be positive: " + this.prefetchCount);
    }
    return this.environment.addClient(new AmqpConsumer(this));
  }

  String clientName() {
    return this.environment.clientName("consumer", this.serviceName, this.queue);
  }

  AmqpEnvironment environment() {
    return this.environment;
  }

  String serviceName() {
    return this.serviceName;
  }

  String queue() {
    return this.queue;
  }

  String exchange() {
    return this.exchange;
  }

  ExchangeType exchangeType() {
    return this.exchangeType;
  }

  String routingKey() {
    return this.routingKey;
  }

  boolean durable() {
    return this.durable;
  }

  AckMode ackMode() {
    return this.ackMode;
  }

  String deadLetterExchange() {
    return this.deadLetterExchange;
  }

  int prefetchCount() {
    return this.prefetchCount;
  }

  boolean deadLetterConsumer() {
    return this.deadLetterConsumer;
  }

  Consumer.MessageHandler messageHandler() {
    return this.messageHandler;
  }

  ConnectionManager connectionManager() {
    return this.connectionManager;
  }

  List<Resource.EventListener> listeners() {
    return this.listeners;
  }
}
