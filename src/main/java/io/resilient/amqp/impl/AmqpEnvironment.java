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

import com.rabbitmq.client.ConnectionFactory;
import io.resilient.amqp.AmqpException;
import io.resilient.amqp.ConnectionProvider;
import io.resilient.amqp.ConnectionSettings;
import io.resilient.amqp.ConsumerBuilder;
import io.resilient.amqp.Environment;
import io.resilient.amqp.PublisherBuilder;
import io.resilient.amqp.metrics.MetricsCollector;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class AmqpEnvironment implements Environment {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpEnvironment.class);

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private final long id;
  private final ConnectionSettings connectionSettings;
  private final ConnectionFactory connectionFactory;
  private final ExecutorService executorService;
  private final boolean internalExecutor;
  private final MetricsCollector metricsCollector;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicLong clientSequence = new AtomicLong(0);
  private final Set<AmqpClientBase> clients = ConcurrentHashMap.newKeySet();
  private final Set<ConnectionManager> connectionProviders = ConcurrentHashMap.newKeySet();

  AmqpEnvironment(
      ConnectionSettings connectionSettings,
      ConnectionFactory connectionFactory,
      ExecutorService executorService,
      MetricsCollector metricsCollector) {
    this.id = ID_SEQUENCE.getAndIncrement();
    this.connectionSettings = connectionSettings;
    this.connectionFactory = configure(connectionFactory, connectionSettings);
    if (executorService == null) {
      this.executorService = Utils.executorService("resilient-amqp-environment-%d-", this.id);
      this.internalExecutor = true;
    } else {
      this.executorService = executorService;
      this.internalExecutor = false;
    }
    this.metricsCollector = metricsCollector;
    LOGGER.debug("Environment {} created for {}", this.id, connectionSettings.uri());
  }

  private static ConnectionFactory configure(
      ConnectionFactory factory, ConnectionSettings settings) {
    factory.setHost(settings.host());
    factory.setPort(settings.port());
    factory.setVirtualHost(settings.virtualHost());
    factory.setUsername(settings.username());
    factory.setPassword(settings.password());
    factory.setConnectionTimeout(
        (int) Math.min(Integer.MAX_VALUE, settings.connectionTimeout().toMillis()));
    // recovery is done by the connection and channel managers
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    return factory;
  }

  @Override
  public ConsumerBuilder consumerBuilder() {
    this.checkNotClosed();
    return new AmqpConsumerBuilder(this);
  }

  @Override
  public PublisherBuilder publisherBuilder() {
    this.checkNotClosed();
    return new AmqpPublisherBuilder(this);
  }

  @Override
  public ConnectionProvider connectionProvider() {
    this.checkNotClosed();
    ConnectionManager connectionManager =
        this.connectionManager(this.clientName("shared", "", "connection"));
    this.connectionProviders.add(connectionManager);
    return connectionManager;
  }

  ConnectionManager connectionManager(String name) {
    return new ConnectionManager(
        this.connectionSettings.connectionName() + "-" + name,
        this.connectionSettings,
        this.connectionFactory,
        this.metricsCollector,
        Collections.emptyList());
  }

  String clientName(String type, String serviceName, String target) {
    StringBuilder builder = new StringBuilder(type).append('-');
    if (serviceName != null && !serviceName.isEmpty()) {
      builder.append(serviceName).append('-');
    }
    return builder
        .append(target)
        .append('-')
        .append(this.id)
        .append('-')
        .append(this.clientSequence.getAndIncrement())
        .toString();
  }

  <T extends AmqpClientBase> T addClient(T client) {
    this.clients.add(client);
    return client;
  }

  void removeClient(AmqpClientBase client) {
    this.clients.remove(client);
  }

  ExecutorService executorService() {
    return this.executorService;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  private void checkNotClosed() {
    if (this.closed.get()) {
      throw new AmqpException.AmqpResourceClosedException("Environment is closed");
    }
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing environment {}", this.id);
      List<AmqpClientBase> clientsToClose = new ArrayList<>(this.clients);
      for (AmqpClientBase client : clientsToClose) {
        try {
          client.close();
        } catch (Exception e) {
          LOGGER.warn("Error while closing {}", client, e);
        }
      }
      for (ConnectionManager connectionManager : this.connectionProviders) {
        try {
          connectionManager.close();
        } catch (Exception e) {
          LOGGER.warn("Error while closing {}", connectionManager, e);
        }
      }
      this.connectionProviders.clear();
      if (this.internalExecutor) {
        this.executorService.shutdownNow();
      }
      LOGGER.debug("Environment {} has been closed", this.id);
    }
  }

  @Override
  public String toString() {
    return "AmqpEnvironment{id=" + id + ", uri=" + connectionSettings.uri() + '}';
  }
}
