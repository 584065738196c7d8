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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.resilient.amqp.AmqpException;
import io.resilient.amqp.ExchangeType;
import io.resilient.amqp.Publisher;
import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpPublisher extends AmqpClientBase implements Publisher {

  static final String DEFAULT_EXCHANGE = "";
  private static final int PERSISTENT_DELIVERY_MODE = 2;

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpPublisher.class);

  private final String serviceName;
  private final String exchange;
  private final ExchangeType exchangeType;
  private final String queue;
  private final String routingKey;
  private final boolean durable;

  AmqpPublisher(AmqpPublisherBuilder builder) {
    super(
        builder.clientName(),
        builder.environment(),
        builder.connectionManager(),
        builder.listeners());
    this.serviceName = builder.serviceName();
    this.exchange = builder.exchange();
    this.exchangeType = builder.exchangeType();
    this.queue = builder.queue();
    this.routingKey = builder.routingKey();
    this.durable = builder.durable();
    this.metricsCollector.openPublisher();
  }

  @Override
  public void assertExchange() {
    this.checkNotClosed();
    this.declareExchange(this.channel());
  }

  private void declareExchange(Channel channel) {
    try {
      channel.exchangeDeclare(this.exchange, this.exchangeType.type(), this.durable);
    } catch (IOException | RuntimeException e) {
      throw new AmqpException.AmqpTopologyException(
          "Could not declare exchange '" + this.exchange + "'", e);
    }
  }

  @Override
  public void assertQueue() {
    this.checkNotClosed();
    if (this.queue == null) {
      throw new AmqpException.AmqpResourceInvalidStateException(
          "No queue configured for publisher '%s'", this.name);
    }
    Channel channel = this.channel();
    this.declareExchange(channel);
    try {
      channel.queueDeclare(this.queue, this.durable, false, false, null);
      channel.queueBind(this.queue, this.exchange, this.routingKey);
    } catch (IOException | RuntimeException e) {
      throw new AmqpException.AmqpTopologyException(
          "Could not declare queue '" + this.queue + "'", e);
    }
  }

  @Override
  public boolean publish(String message) {
    return this.publish(message, Collections.emptyMap());
  }

  @Override
  public boolean publish(String message, Map<String, Object> headers) {
    return this.send(this.exchange, this.routingKey, message, headers, true);
  }

  @Override
  public boolean publishToQueue(String message) {
    return this.publishToQueue(message, Collections.emptyMap());
  }

  @Override
  public boolean publishToQueue(String message, Map<String, Object> headers) {
    if (this.queue == null) {
      return this.failed(
          new AmqpException.AmqpPublishException(
              "No queue configured for publisher '%s'", this.name));
    }
    return this.send(DEFAULT_EXCHANGE, this.queue, message, headers, false);
  }

  private boolean send(
      String exchange,
      String routingKey,
      String message,
      Map<String, Object> headers,
      boolean declareExchange) {
    try {
      this.checkNotClosed();
      Channel channel = this.channel();
      if (declareExchange) {
        this.declareExchange(channel);
      }
      AMQP.BasicProperties properties =
          new AMQP.BasicProperties.Builder()
              .deliveryMode(PERSISTENT_DELIVERY_MODE)
              .contentType("text/plain")
              .contentEncoding(UTF_8.name())
              .appId(this.serviceName)
              .headers(headers == null ? new HashMap<>() : new HashMap<>(headers))
              .build();
      channel.basicPublish(exchange, routingKey, properties, message.getBytes(UTF_8));
    } catch (Exception e) {
      return this.failed(
          new AmqpException.AmqpPublishException(
              "Could not publish message to exchange '"
                  + exchange
                  + "' with routing key '"
                  + routingKey
                  + "'",
              e));
    }
    this.metricsCollector.publish();
    return true;
  }

  private boolean failed(AmqpException.AmqpPublishException e) {
    LOGGER.warn("Publisher '{}' failed to publish message: {}", this.name, e.getMessage());
    this.metricsCollector.publishFailure();
    this.dispatch(Event.ERROR, e);
    return false;
  }

  @Override
  protected void closeMetrics() {
    this.metricsCollector.closePublisher();
  }
}
