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

import com.rabbitmq.client.Connection;

/**
 * Lazily-created connection that can be shared by several clients.
 *
 * <p>The connection is created on first use, with the retry settings of the environment. It is not
 * re-created automatically after a failure: the next {@link #getConnection()} call creates a new
 * one.
 *
 * @see Environment#connectionProvider()
 * @see ConsumerBuilder#connectionProvider(ConnectionProvider)
 * @see PublisherBuilder#connectionProvider(ConnectionProvider)
 */
public interface ConnectionProvider extends Resource, AutoCloseable {

  /**
   * Return the current connection, creating it if necessary.
   *
   * @return the connection
   * @throws AmqpException.AmqpConnectionException if the connection cannot be created
   */
  Connection getConnection();

  /**
   * Return the current connection.
   *
   * @param createIfMissing whether to create the connection if there is none
   * @return the connection
   * @throws AmqpException.AmqpNoConnectionException if there is no connection and creation is not
   *     allowed
   */
  Connection getConnection(boolean createIfMissing);

  /** Close the current connection, if any. A later {@link #getConnection()} opens a new one. */
  void stop();

  /** Close the provider. */
  @Override
  void close();
}
