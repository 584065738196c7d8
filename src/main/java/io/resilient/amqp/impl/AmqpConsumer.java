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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import io.resilient.amqp.AckMode;
import io.resilient.amqp.AmqpException;
import io.resilient.amqp.Consumer;
import io.resilient.amqp.ExchangeType;
import io.resilient.amqp.metrics.MetricsCollector;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpConsumer extends AmqpClientBase implements Consumer {

  static final String DEAD_LETTER_EXCHANGE_ARGUMENT = "x-dead-letter-exchange";
  static final String DEAD_LETTER_ROUTING_KEY = "#";

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConsumer.class);

  private final String serviceName;
  private final String queue;
  private final String exchange;
  private final ExchangeType exchangeType;
  private final String routingKey;
  private final boolean durable;
  private final AckMode ackMode;
  private final String deadLetterExchange;
  private final int prefetchCount;
  private final boolean deadLetterConsumer;
  private final MessageHandler messageHandler;
  // re-subscribes once after the next recovery cycle
  private final AtomicBoolean resubscribeOnReconnect = new AtomicBoolean(false);
  private final Object subscriptionLock = new Object();
  // guarded by subscriptionLock
  private Channel subscribedChannel;
  private volatile String consumerTag;

  AmqpConsumer(AmqpConsumerBuilder builder) {
    super(
        builder.clientName(),
        builder.environment(),
        builder.connectionManager(),
        builder.listeners());
    this.serviceName = builder.serviceName();
    this.queue = builder.queue();
    this.exchange = builder.exchange();
    this.exchangeType = builder.exchangeType();
    this.routingKey = builder.routingKey();
    this.durable = builder.durable();
    this.ackMode = builder.ackMode();
    this.deadLetterExchange = builder.deadLetterExchange();
    this.prefetchCount = builder.prefetchCount();
    this.deadLetterConsumer = builder.deadLetterConsumer();
    this.messageHandler = builder.messageHandler();
    this.addListener(
        context -> {
          if (context.event() == Event.RECONNECT
              && this.resubscribeOnReconnect.compareAndSet(true, false)) {
            this.resubscribe();
          }
        });
    this.metricsCollector.openConsumer();
  }

  @Override
  public void assertTopology() {
    this.checkNotClosed();
    this.declareTopology(this.channel());
  }

  private void declareTopology(Channel channel) {
    try {
      Map<String, Object> queueArguments = null;
      if (this.deadLetterExchange != null && !this.deadLetterConsumer) {
        channel.exchangeDeclare(
            this.deadLetterExchange, ExchangeType.TOPIC.type(), this.durable);
        channel.queueDeclare(this.deadLetterExchange, this.durable, false, false, null);
        channel.queueBind(
            this.deadLetterExchange, this.deadLetterExchange, DEAD_LETTER_ROUTING_KEY);
        queueArguments = Map.of(DEAD_LETTER_EXCHANGE_ARGUMENT, this.deadLetterExchange);
      }
      channel.queueDeclare(this.queue, this.durable, false, false, queueArguments);
      if (this.exchange != null) {
        channel.exchangeDeclare(this.exchange, this.exchangeType.type(), this.durable);
        channel.queueBind(this.queue, this.exchange, this.routingKey);
      }
    } catch (IOException | RuntimeException e) {
      throw new AmqpException.AmqpTopologyException(
          "Could not declare topology for queue '" + this.queue + "'", e);
    }
    LOGGER.debug("Topology declared for queue '{}'", this.queue);
  }

  @Override
  public String listen() {
    this.checkNotClosed();
    String tag;
    try {
      Channel channel = this.channel();
      synchronized (this.subscriptionLock) {
        if (channel == this.subscribedChannel) {
          LOGGER.debug("Consumer '{}' already listening on queue '{}'", this.name, this.queue);
          return this.consumerTag;
        }
        this.declareTopology(channel);
        try {
          channel.basicQos(this.prefetchCount);
          tag =
              channel.basicConsume(
                  this.queue,
                  this.ackMode == AckMode.AUTOMATIC,
                  this.serviceName,
                  (consumerTag, delivery) -> this.handleDelivery(delivery),
                  this::handleCancel);
        } catch (IOException | RuntimeException e) {
          throw new AmqpException(
              "Could not subscribe to queue '" + this.queue + "'", e);
        }
        this.subscribedChannel = channel;
        this.consumerTag = tag;
      }
    } catch (AmqpException e) {
      LOGGER.warn("Consumer '{}' could not listen to queue '{}'", this.name, this.queue, e);
      this.dispatch(Event.ERROR, e);
      throw e;
    }
    this.resubscribeOnReconnect.set(true);
    LOGGER.info("Consumer '{}' listening to queue '{}' (tag {})", this.name, this.queue, tag);
    this.dispatch(Event.LISTEN);
    return tag;
  }

  private void resubscribe() {
    try {
      this.listen();
    } catch (AmqpException.AmqpTopologyException e) {
      LOGGER.warn("Could not declare topology after recovery of '{}'", this.name);
    } catch (AmqpException e) {
      // the next recovery cycle tries again
      this.resubscribeOnReconnect.set(true);
    }
  }

  private void handleDelivery(Delivery delivery) {
    this.metricsCollector.consume();
    String payload = new String(delivery.getBody(), UTF_8);
    try {
      this.messageHandler.handle(payload, delivery);
    } catch (Exception e) {
      LOGGER.warn(
          "Error in message handler of '{}' (delivery tag {})",
          this.name,
          delivery.getEnvelope().getDeliveryTag(),
          e);
      this.dispatch(Event.ERROR, e);
    }
  }

  private void handleCancel(String tag) {
    LOGGER.warn("Consumer '{}' (tag {}) cancelled by the broker", this.name, tag);
    synchronized (this.subscriptionLock) {
      this.subscribedChannel = null;
    }
    this.signalDisconnect(
        new AmqpException("Consumer '%s' on queue '%s' cancelled by the broker", tag, this.queue));
  }

  @Override
  public void acknowledgeMessage(Delivery delivery) {
    long deliveryTag = delivery.getEnvelope().getDeliveryTag();
    this.settle(
        delivery,
        "acknowledge",
        channel -> channel.basicAck(deliveryTag, false),
        MetricsCollector.ConsumeDisposition.ACKNOWLEDGED);
  }

  @Override
  public void rejectMessage(Delivery delivery) {
    this.rejectMessage(delivery, false);
  }

  @Override
  public void rejectMessage(Delivery delivery, boolean requeue) {
    long deliveryTag = delivery.getEnvelope().getDeliveryTag();
    this.settle(
        delivery,
        requeue ? "requeue" : "reject",
        channel -> channel.basicNack(deliveryTag, false, requeue),
        requeue
            ? MetricsCollector.ConsumeDisposition.REQUEUED
            : MetricsCollector.ConsumeDisposition.REJECTED);
  }

  private void settle(
      Delivery delivery,
      String operation,
      ChannelOperation channelOperation,
      MetricsCollector.ConsumeDisposition disposition) {
    long deliveryTag = delivery.getEnvelope().getDeliveryTag();
    try {
      channelOperation.run(this.channelManager.getChannel(false));
      this.metricsCollector.consumeDisposition(disposition);
    } catch (IOException | RuntimeException e) {
      LOGGER.warn(
          "Could not {} message {} of '{}': {}",
          operation,
          deliveryTag,
          this.name,
          RetryPolicy.exceptionMessage(e));
    }
    if (!this.channelManager.checkChannel()) {
      LOGGER.warn(
          "Channel of '{}' unusable after {} of message {}, was it already settled?",
          this.name,
          operation,
          deliveryTag);
      synchronized (this.subscriptionLock) {
        this.subscribedChannel = null;
      }
      this.signalDisconnect(
          new AmqpException.AmqpChannelException(
              "Channel of '%s' closed after %s of message %d", this.name, operation, deliveryTag));
    }
  }

  @Override
  protected void beforeStop() {
    this.resubscribeOnReconnect.set(false);
    synchronized (this.subscriptionLock) {
      this.subscribedChannel = null;
    }
  }

  @Override
  protected void closeMetrics() {
    this.metricsCollector.closeConsumer();
  }

  String queue() {
    return this.queue;
  }

  @FunctionalInterface
  private interface ChannelOperation {

    void run(Channel channel) throws IOException;
  }
}
