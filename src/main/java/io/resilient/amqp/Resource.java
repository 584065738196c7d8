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

/**
 * Marker interface for {@link Resource}-like classes.
 *
 * <p>Instances of these classes connect to the broker, lose their connection and recover it during
 * their lifecycle. Application can be interested in taking some actions for a given event (e.g.
 * stopping publishing when a {@link Publisher} is disconnected and resuming publishing when it has
 * reconnected).
 *
 * @see ConnectionProvider
 * @see Publisher
 * @see Consumer
 */
public interface Resource {

  /**
   * Current state of the resource.
   *
   * @return state
   */
  State state();

  /**
   * Register a listener for the events of the resource.
   *
   * @param listener the listener
   */
  void addListener(EventListener listener);

  /**
   * Unregister a listener.
   *
   * @param listener the listener
   */
  void removeListener(EventListener listener);

  /**
   * Application listener for a {@link Resource}.
   *
   * <p>They are usually registered at creation time. Exceptions thrown by listeners are logged and
   * do not reach the resource.
   *
   * @see PublisherBuilder#listeners(EventListener...)
   * @see ConsumerBuilder#listeners(EventListener...)
   */
  @FunctionalInterface
  interface EventListener {

    /**
     * Handle an event.
     *
     * @param context event context
     */
    void handle(Context context);
  }

  /** Context of a resource event. */
  interface Context {

    /**
     * The resource instance.
     *
     * @return resource instance
     */
    Resource resource();

    /**
     * The event.
     *
     * @return the event
     */
    Event event();

    /**
     * The failure cause, can be null.
     *
     * @return failure cause, null if no cause for failure
     */
    Throwable failureCause();
  }

  /** Events of a resource. */
  enum Event {
    /** First connection to the broker. */
    CONNECT,
    /** Connection or channel recovered after a failure. */
    RECONNECT,
    /** Connection or channel lost because of a failure. */
    DISCONNECT,
    /** Consumer subscribed to its queue. */
    LISTEN,
    /** Operation or recovery failure. */
    ERROR,
    /** Deliberate close. */
    CLOSE
  }

  /** Resource state. */
  enum State {
    /** No connection or channel. */
    DISCONNECTED,
    /** The resource is connecting or reconnecting. */
    CONNECTING,
    /** The resource is connected and functional. */
    CONNECTED,
    /** The resource is closing. */
    CLOSING
  }
}
