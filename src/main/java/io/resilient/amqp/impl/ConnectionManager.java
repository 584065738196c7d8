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

import static io.resilient.amqp.Resource.State.CLOSING;
import static io.resilient.amqp.Resource.State.CONNECTED;
import static io.resilient.amqp.Resource.State.CONNECTING;
import static io.resilient.amqp.Resource.State.DISCONNECTED;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import io.resilient.amqp.AmqpException;
import io.resilient.amqp.ConnectionProvider;
import io.resilient.amqp.ConnectionSettings;
import io.resilient.amqp.metrics.MetricsCollector;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns at most one broker connection, created lazily with retries.
 *
 * <p>A lost connection is cleared and reported with {@link Event#DISCONNECT}, it is not re-created
 * until the next {@link #getConnection()} call.
 */
final class ConnectionManager extends ResourceBase implements ConnectionProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionManager.class);

  private final String name;
  private final ConnectionSettings settings;
  private final ConnectionFactory connectionFactory;
  private final MetricsCollector metricsCollector;
  private final RetryPolicy retryPolicy;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final ShutdownListener shutdownListener = this::connectionShutdown;
  private final AtomicLong generation = new AtomicLong(0);
  private volatile boolean stopRequested = false;
  // guarded by lock
  private Connection connection;

  ConnectionManager(
      String name,
      ConnectionSettings settings,
      ConnectionFactory connectionFactory,
      MetricsCollector metricsCollector,
      List<EventListener> listeners) {
    super(listeners);
    this.name = name;
    this.settings = settings;
    this.connectionFactory = connectionFactory;
    this.metricsCollector = metricsCollector;
    this.retryPolicy = RetryPolicy.retryPolicy(settings.retry(), () -> !this.stopRequested);
  }

  @Override
  public Connection getConnection() {
    return this.getConnection(true);
  }

  @Override
  public Connection getConnection(boolean createIfMissing) {
    Connection current = this.currentConnection();
    if (current != null) {
      return current;
    }
    if (!createIfMissing) {
      throw new AmqpException.AmqpNoConnectionException(
          "No connection present for '%s' and not allowed to create a new one", this.name);
    }
    Connection created;
    long connectionGeneration;
    this.lock.writeLock().lock();
    try {
      if (this.connection != null) {
        return this.connection;
      }
      this.state(CONNECTING);
      try {
        created = this.createConnection();
      } catch (AmqpException e) {
        this.state(DISCONNECTED);
        throw e;
      }
      created.addShutdownListener(this.shutdownListener);
      this.connection = created;
      connectionGeneration = this.generation.incrementAndGet();
    } finally {
      this.lock.writeLock().unlock();
    }
    this.metricsCollector.openConnection();
    this.state(CONNECTED);
    if (connectionGeneration == 1) {
      LOGGER.info("Connection '{}' established to {}", this.name, this.settings.uri());
      this.dispatch(Event.CONNECT);
    } else {
      LOGGER.info("Connection '{}' re-established to {}", this.name, this.settings.uri());
      this.dispatch(Event.RECONNECT);
    }
    return created;
  }

  private Connection currentConnection() {
    this.lock.readLock().lock();
    try {
      return this.connection;
    } finally {
      this.lock.readLock().unlock();
    }
  }

  private Connection createConnection() {
    try {
      return this.retryPolicy.call(
          () -> this.connectionFactory.newConnection(this.name),
          "connection '%s' to %s",
          this.name,
          this.settings.uri());
    } catch (Exception e) {
      if (this.stopRequested) {
        throw new AmqpException.AmqpResourceClosedException(
            "Connection '" + this.name + "' stopped while connecting", e);
      }
      throw new AmqpException.AmqpConnectionException(
          "Could not connect to " + this.settings.uri() + " (" + RetryPolicy.exceptionMessage(e) + ")",
          e);
    }
  }

  private void connectionShutdown(ShutdownSignalException cause) {
    boolean clean = ExceptionUtils.cleanClose(cause) && !this.settings.recoverAfterCleanClose();
    this.lock.writeLock().lock();
    try {
      if (this.connection == null) {
        return;
      }
      this.connection = null;
    } finally {
      this.lock.writeLock().unlock();
    }
    this.metricsCollector.closeConnection();
    this.state(DISCONNECTED);
    if (clean) {
      LOGGER.info("Connection '{}' closed by the application", this.name);
      this.dispatch(Event.CLOSE);
    } else {
      LOGGER.warn(
          "Connection '{}' lost (reason: {})", this.name, ExceptionUtils.reason(cause));
      this.dispatch(Event.DISCONNECT, cause);
    }
  }

  /** Make a connection creation in progress give up, before a call to {@link #stop()}. */
  void abortConnecting() {
    this.stopRequested = true;
  }

  @Override
  public void stop() {
    this.stopRequested = true;
    Connection toClose;
    this.lock.writeLock().lock();
    try {
      toClose = this.connection;
      this.connection = null;
    } finally {
      this.stopRequested = false;
      this.lock.writeLock().unlock();
    }
    if (toClose == null) {
      LOGGER.debug("No connection to close for '{}'", this.name);
      this.state(DISCONNECTED);
      return;
    }
    this.state(CLOSING);
    toClose.removeShutdownListener(this.shutdownListener);
    IOException closeException = null;
    try {
      toClose.close();
    } catch (IOException e) {
      if (ExceptionUtils.alreadyClosed(e)) {
        LOGGER.debug("Connection '{}' was already closed", this.name);
      } else {
        closeException = e;
      }
    } catch (RuntimeException e) {
      if (ExceptionUtils.alreadyClosed(e)) {
        LOGGER.debug("Connection '{}' was already closed", this.name);
      } else {
        this.metricsCollector.closeConnection();
        this.state(DISCONNECTED);
        throw e;
      }
    }
    this.metricsCollector.closeConnection();
    this.state(DISCONNECTED);
    if (closeException != null) {
      throw new AmqpException("Error while closing connection '" + this.name + "'", closeException);
    }
    LOGGER.debug("Connection '{}' closed", this.name);
    this.dispatch(Event.CLOSE);
  }

  @Override
  public void close() {
    this.stop();
  }

  /**
   * Number of connections created so far.
   *
   * @return connection generation
   */
  long generation() {
    return this.generation.get();
  }

  ConnectionSettings settings() {
    return this.settings;
  }

  @Override
  public String toString() {
    return "ConnectionManager{name='" + name + "'}";
  }
}
