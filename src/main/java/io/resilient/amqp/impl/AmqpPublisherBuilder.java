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

import io.resilient.amqp.ConnectionProvider;
import io.resilient.amqp.ExchangeType;
import io.resilient.amqp.Publisher;
import io.resilient.amqp.PublisherBuilder;
import io.resilient.amqp.Resource;
import java.util.ArrayList;
import java.util.List;

class AmqpPublisherBuilder implements PublisherBuilder {

  private final AmqpEnvironment environment;
  private String serviceName = "";
  private String exchange;
  private ExchangeType exchangeType = ExchangeType.TOPIC;
  private String queue;
  private String routingKey = "";
  private boolean durable = false;
  private ConnectionManager connectionManager;
  private final List<Resource.EventListener> listeners = new ArrayList<>();

  AmqpPublisherBuilder(AmqpEnvironment environment) {
    this.environment = environment;
  }

  @Override
  public PublisherBuilder serviceName(String serviceName) {
    this.serviceName = Utils.nullToEmpty(serviceName);
    return this;
  }

  @Override
  public PublisherBuilder exchange(String exchange) {
    this.exchange = exchange;
    return this;
  }

  @Override
  public PublisherBuilder exchangeType(ExchangeType exchangeType) {
    this.exchangeType = exchangeType;
    return this;
  }

  @Override
  public PublisherBuilder queue(String queue) {
    this.queue = queue;
    return this;
  }

  @Override
  public PublisherBuilder routingKey(String routingKey) {
    this.routingKey = Utils.nullToEmpty(routingKey);
    return this;
  }

  @Override
  public PublisherBuilder durable(boolean durable) {
    this.durable = durable;
    return this;
  }

  @Override
  public PublisherBuilder connectionProvider(ConnectionProvider connectionProvider) {
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
  public PublisherBuilder listeners(Resource.EventListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public Publisher build() {
    if (this.exchange == null) {
      throw new IllegalArgumentException("An exchange must be specified");
    }
    if (this.exchangeType == null) {
      throw new IllegalArgumentException("Exchange type cannot be null");
    }
    return this.environment.addClient(new AmqpPublisher(this));
  }

  String clientName() {
    return this.environment.clientName("publisher", this.serviceName, this.exchange);
  }

  AmqpEnvironment environment() {
    return this.environment;
  }

  String serviceName() {
    return this.serviceName;
  }

  String exchange() {
    return this.exchange;
  }

  ExchangeType exchangeType() {
    return this.exchangeType;
  }

  String queue() {
    return this.queue;
  }

  String routingKey() {
    return this.routingKey;
  }

  boolean durable() {
    return this.durable;
  }

  ConnectionManager connectionManager() {
    return this.connectionManager;
  }

  List<Resource.EventListener> listeners() {
    return this.listeners;
  }
}
