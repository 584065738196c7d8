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

/** API to configure and create a {@link Publisher}. */
public interface PublisherBuilder {

  /**
   * Name of the service, set as the <code>app-id</code> property of messages.
   *
   * @param serviceName service name
   * @return this builder instance
   */
  PublisherBuilder serviceName(String serviceName);

  /**
   * The exchange to publish to. Mandatory.
   *
   * @param exchange exchange name
   * @return this builder instance
   */
  PublisherBuilder exchange(String exchange);

  /**
   * Type of the exchange. Default is {@link ExchangeType#TOPIC}.
   *
   * @param exchangeType exchange type
   * @return this builder instance
   */
  PublisherBuilder exchangeType(ExchangeType exchangeType);

  /**
   * Queue for {@link Publisher#publishToQueue(String)} and {@link Publisher#assertQueue()}.
   *
   * @param queue queue name
   * @return this builder instance
   */
  PublisherBuilder queue(String queue);

  PublisherBuilder routingKey(String routingKey);

  PublisherBuilder durable(boolean durable);

  /**
   * Use a connection shared with other clients.
   *
   * @param connectionProvider shared connection
   * @return this builder instance
   */
  PublisherBuilder connectionProvider(ConnectionProvider connectionProvider);

  PublisherBuilder listeners(Resource.EventListener... listeners);

  /**
   * Create the publisher. It connects on the first publish or declaration.
   *
   * @return the configured publisher
   */
  Publisher build();
}
