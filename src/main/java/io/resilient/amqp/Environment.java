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
 * The {@link Environment} is the main entry point to the library.
 *
 * <p>It holds the connection settings, the executor for recovery and the metrics collector, and
 * creates consumers, publishers and shared connections.
 *
 * <p>Applications are expected to use one environment instance and to close it when they stop.
 *
 * @see io.resilient.amqp.impl.AmqpEnvironmentBuilder
 */
public interface Environment extends AutoCloseable {

  /**
   * Create a builder to configure and create a {@link Consumer}.
   *
   * @return consumer builder
   */
  ConsumerBuilder consumerBuilder();

  /**
   * Create a builder to configure and create a {@link Publisher}.
   *
   * @return publisher builder
   */
  PublisherBuilder publisherBuilder();

  /**
   * Create a connection that several clients can share.
   *
   * @return shareable connection
   */
  ConnectionProvider connectionProvider();

  /** Close all the resources the environment created. */
  @Override
  void close();
}
