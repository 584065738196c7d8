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

import static io.resilient.amqp.Resource.State.CONNECTED;
import static io.resilient.amqp.Resource.State.CONNECTING;
import static io.resilient.amqp.Resource.State.DISCONNECTED;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import io.resilient.amqp.AmqpException;
import java.io.IOException;
import java.util.Collections;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns at most one channel on the connection of a {@link ConnectionManager}.
 *
 * <p>New channels are checked with a passive declaration of a built-in exchange before being
 * handed out.
 */
final class ChannelManager extends ResourceBase {

  static final String HEALTH_CHECK_EXCHANGE = "amq.direct";

  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelManager.class);

  private final String name;
  private final ConnectionManager connectionManager;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  // guarded by lock
  private Channel channel;
  private ShutdownListener shutdownListener;

  ChannelManager(String name, ConnectionManager connectionManager) {
    super(Collections.emptyList());
    this.name = name;
    this.connectionManager = connectionManager;
  }

  Channel getChannel() {
    return this.getChannel(true);
  }

  Channel getChannel(boolean createIfMissing) {
    Channel current = this.currentChannel();
    if (current != null) {
      return current;
    }
    if (!createIfMissing) {
      throw new AmqpException.AmqpChannelException(
          "No channel present for '%s' and not allowed to create a new one", this.name);
    }
    Channel created;
    this.lock.writeLock().lock();
    try {
      if (this.channel != null) {
        return this.channel;
      }
      this.state(CONNECTING);
      try {
        created = this.createChannel();
      } catch (AmqpException e) {
        this.state(DISCONNECTED);
        throw e;
      }
      this.channel = created;
      // fires right away if the channel is already closed
      ShutdownListener listener = cause -> this.channelShutdown(created, cause);
      this.shutdownListener = listener;
      created.addShutdownListener(listener);
      if (this.channel != created) {
        throw new AmqpException.AmqpChannelException(
            "Channel of '%s' closed right after creation", this.name);
      }
    } finally {
      this.lock.writeLock().unlock();
    }
    LOGGER.debug("Channel {} created for '{}'", created.getChannelNumber(), this.name);
    this.state(CONNECTED);
    return created;
  }

  private Channel currentChannel() {
    this.lock.readLock().lock();
    try {
      return this.channel;
    } finally {
      this.lock.readLock().unlock();
    }
  }

  private Channel createChannel() {
    Connection connection = this.connectionManager.getConnection();
    Channel created;
    try {
      created = connection.createChannel();
    } catch (IOException | RuntimeException e) {
      throw new AmqpException.AmqpChannelException(
          "Could not create channel for '" + this.name + "'", e);
    }
    if (created == null) {
      throw new AmqpException.AmqpChannelException(
          "Could not create channel for '%s', channel limit reached", this.name);
    }
    try {
      healthCheck(created);
    } catch (IOException | RuntimeException e) {
      closeQuietly(created);
      throw new AmqpException.AmqpChannelException(
          "Health check of new channel failed for '" + this.name + "'", e);
    }
    return created;
  }

  private static void healthCheck(Channel channel) throws IOException {
    channel.exchangeDeclarePassive(HEALTH_CHECK_EXCHANGE);
  }

  /**
   * Check the current channel is still usable.
   *
   * @return false if there is no channel or the health check fails
   */
  boolean checkChannel() {
    Channel current = this.currentChannel();
    if (current == null) {
      return false;
    }
    try {
      healthCheck(current);
      return true;
    } catch (IOException | RuntimeException e) {
      LOGGER.debug(
          "Health check failed for channel of '{}': {}",
          this.name,
          RetryPolicy.exceptionMessage(e));
      return false;
    }
  }

  private void channelShutdown(Channel closed, ShutdownSignalException cause) {
    this.lock.writeLock().lock();
    try {
      if (this.channel != closed) {
        LOGGER.debug("Ignoring shutdown of stale channel of '{}'", this.name);
        return;
      }
      this.channel = null;
      this.shutdownListener = null;
    } finally {
      this.lock.writeLock().unlock();
    }
    this.state(DISCONNECTED);
    boolean clean =
        ExceptionUtils.cleanClose(cause)
            && !this.connectionManager.settings().recoverAfterCleanClose();
    if (clean) {
      LOGGER.debug("Channel of '{}' closed by the application", this.name);
    } else if (cause.isHardError()) {
      // the connection manager reports connection failures
      LOGGER.debug(
          "Channel of '{}' closed with its connection (reason: {})",
          this.name,
          ExceptionUtils.reason(cause));
    } else {
      LOGGER.warn("Channel of '{}' lost (reason: {})", this.name, ExceptionUtils.reason(cause));
      this.dispatch(Event.DISCONNECT, cause);
    }
  }

  void closeChannel() {
    Channel toClose;
    ShutdownListener listener;
    this.lock.writeLock().lock();
    try {
      toClose = this.channel;
      listener = this.shutdownListener;
      this.channel = null;
      this.shutdownListener = null;
    } finally {
      this.lock.writeLock().unlock();
    }
    if (toClose != null) {
      toClose.removeShutdownListener(listener);
      try {
        toClose.close();
      } catch (IOException | TimeoutException | RuntimeException e) {
        if (ExceptionUtils.alreadyClosed(e)) {
          LOGGER.debug("Channel of '{}' was already closed", this.name);
        } else {
          LOGGER.warn("Error while closing channel of '{}'", this.name, e);
        }
      }
    }
    this.state(DISCONNECTED);
  }

  private void closeQuietly(Channel channel) {
    try {
      channel.close();
    } catch (IOException | TimeoutException | RuntimeException e) {
      LOGGER.debug("Error while closing rejected channel of '{}'", this.name, e);
    }
  }

  @Override
  public String toString() {
    return "ChannelManager{name='" + name + "'}";
  }
}
