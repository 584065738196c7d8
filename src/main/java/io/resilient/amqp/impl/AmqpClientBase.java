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

import com.rabbitmq.client.Channel;
import io.resilient.amqp.AmqpException;
import io.resilient.amqp.metrics.MetricsCollector;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for consumers and publishers.
 *
 * <p>It owns a {@link ChannelManager}, owns or shares a {@link ConnectionManager}, and runs a
 * reconnection cycle when one of them reports a failure. At most one cycle runs at a time and a
 * stopped client does not start any.
 */
abstract class AmqpClientBase extends ResourceBase {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpClientBase.class);

  protected final String name;
  protected final AmqpEnvironment environment;
  protected final ConnectionManager connectionManager;
  protected final ChannelManager channelManager;
  protected final MetricsCollector metricsCollector;
  private final boolean ownsConnectionManager;
  private final AtomicBoolean active = new AtomicBoolean(false);
  private final AtomicBoolean recovering = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final EventListener connectionListener = this::connectionEvent;
  private final EventListener channelListener = this::channelEvent;
  private volatile Future<?> recoveryTask;

  AmqpClientBase(
      String name,
      AmqpEnvironment environment,
      ConnectionManager sharedConnectionManager,
      List<EventListener> listeners) {
    super(listeners);
    this.name = name;
    this.environment = environment;
    this.metricsCollector = environment.metricsCollector();
    if (sharedConnectionManager == null) {
      this.connectionManager = environment.connectionManager(name);
      this.ownsConnectionManager = true;
    } else {
      this.connectionManager = sharedConnectionManager;
      this.ownsConnectionManager = false;
    }
    this.channelManager = new ChannelManager(name, this.connectionManager);
    this.connectionManager.addListener(this.connectionListener);
    this.channelManager.addListener(this.channelListener);
  }

  private void connectionEvent(Context context) {
    switch (context.event()) {
      case CONNECT:
      case RECONNECT:
        // connections made by the recovery cycle are reported when the cycle completes
        if (this.active.get() && !this.recovering.get()) {
          this.dispatch(Event.CONNECT);
        }
        break;
      case DISCONNECT:
        this.signalDisconnect(context.failureCause());
        break;
      case CLOSE:
        if (this.active.compareAndSet(true, false)) {
          LOGGER.info("Connection of '{}' closed by the application", this.name);
          this.channelManager.closeChannel();
          this.state(DISCONNECTED);
          this.dispatch(Event.CLOSE);
        }
        break;
      default:
        break;
    }
  }

  private void channelEvent(Context context) {
    if (context.event() == Event.DISCONNECT) {
      this.signalDisconnect(context.failureCause());
    }
  }

  /**
   * Start a reconnection cycle, unless one is already running or the client is stopped.
   *
   * @param cause failure cause, can be null
   */
  protected void signalDisconnect(Throwable cause) {
    if (!this.active.get()) {
      LOGGER.debug("Ignoring disconnection of '{}', it is not active", this.name);
      return;
    }
    if (!this.recovering.compareAndSet(false, true)) {
      LOGGER.debug("Recovery already in progress for '{}'", this.name);
      return;
    }
    LOGGER.info("'{}' disconnected, starting recovery", this.name);
    this.state(DISCONNECTED);
    this.dispatch(Event.DISCONNECT, cause);
    try {
      this.recoveryTask = this.environment.executorService().submit(this::recover);
    } catch (RejectedExecutionException e) {
      this.recovering.set(false);
      LOGGER.warn("Could not schedule recovery of '{}'", this.name, e);
      this.dispatch(Event.ERROR, e);
    }
  }

  private void recover() {
    try {
      this.channelManager.closeChannel();
      this.state(CONNECTING);
      this.channelManager.getChannel();
    } catch (Exception e) {
      this.recovering.set(false);
      if (this.active.get()) {
        LOGGER.warn("Recovery of '{}' failed", this.name, e);
        this.state(DISCONNECTED);
        this.dispatch(Event.ERROR, e);
      } else {
        LOGGER.debug("Recovery of '{}' stopped", this.name);
      }
      return;
    }
    if (!this.active.get()) {
      LOGGER.debug("'{}' stopped during recovery, releasing connection", this.name);
      this.recovering.set(false);
      try {
        this.releaseResources();
      } catch (AmqpException e) {
        LOGGER.warn("Error while releasing resources of '{}'", this.name, e);
      }
      return;
    }
    this.recovering.set(false);
    this.state(CONNECTED);
    this.metricsCollector.recover();
    LOGGER.info("'{}' recovered", this.name);
    this.dispatch(Event.RECONNECT);
  }

  /**
   * Return the channel of the client, connecting if necessary.
   *
   * @return the channel
   */
  protected Channel channel() {
    this.active.set(true);
    if (this.state() != CONNECTED) {
      this.state(CONNECTING);
    }
    try {
      Channel channel = this.channelManager.getChannel();
      this.state(CONNECTED);
      return channel;
    } catch (AmqpException e) {
      this.state(DISCONNECTED);
      throw e;
    }
  }

  protected void checkNotClosed() {
    if (this.closed.get()) {
      throw new AmqpException.AmqpResourceClosedException("'%s' is closed", this.name);
    }
  }

  protected boolean closed() {
    return this.closed.get();
  }

  /** Called at the beginning of {@link #stop()}. */
  protected void beforeStop() {}

  /** Called once, when the client is closed. */
  protected abstract void closeMetrics();

  public void stop() {
    this.active.set(false);
    this.state(CLOSING);
    this.beforeStop();
    Future<?> task = this.recoveryTask;
    if (task != null) {
      task.cancel(true);
    }
    try {
      this.releaseResources();
    } finally {
      this.recovering.set(false);
      this.state(DISCONNECTED);
    }
    LOGGER.info("'{}' stopped", this.name);
    this.dispatch(Event.CLOSE);
  }

  private void releaseResources() {
    if (this.ownsConnectionManager) {
      this.connectionManager.abortConnecting();
    }
    this.channelManager.closeChannel();
    if (this.ownsConnectionManager) {
      this.connectionManager.stop();
    }
  }

  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      try {
        this.stop();
      } finally {
        this.connectionManager.removeListener(this.connectionListener);
        this.channelManager.removeListener(this.channelListener);
        this.environment.removeClient(this);
        this.closeMetrics();
      }
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{name='" + name + "'}";
  }
}
