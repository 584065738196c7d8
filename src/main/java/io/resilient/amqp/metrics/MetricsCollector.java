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
package io.resilient.amqp.metrics;

/** Interface to collect execution data of the client. */
public interface MetricsCollector {

  /** Called when a broker connection is opened. */
  void openConnection();

  /** Called when a broker connection is closed or lost. */
  void closeConnection();

  /** Called when a new {@link io.resilient.amqp.Publisher} is created. */
  void openPublisher();

  /** Called when a {@link io.resilient.amqp.Publisher} is closed. */
  void closePublisher();

  /** Called when a new {@link io.resilient.amqp.Consumer} is created. */
  void openConsumer();

  /** Called when a {@link io.resilient.amqp.Consumer} is closed. */
  void closeConsumer();

  /** Called when a consumer or a publisher has recovered after a failure. */
  void recover();

  /** Called when a message is handed to the broker client. */
  void publish();

  /** Called when a message could not be published. */
  void publishFailure();

  /** Called when a message is dispatched to a {@link io.resilient.amqp.Consumer}. */
  void consume();

  /**
   * Called when a message is settled by a {@link io.resilient.amqp.Consumer}.
   *
   * @param disposition disposition (outcome)
   */
  void consumeDisposition(ConsumeDisposition disposition);

  /** The client-to-broker dispositions. */
  enum ConsumeDisposition {
    /** see {@link io.resilient.amqp.Consumer#acknowledgeMessage(com.rabbitmq.client.Delivery)} */
    ACKNOWLEDGED,
    /** see {@link io.resilient.amqp.Consumer#rejectMessage(com.rabbitmq.client.Delivery)} */
    REJECTED,
    /** see {@link io.resilient.amqp.Consumer#rejectMessage(com.rabbitmq.client.Delivery, boolean)} */
    REQUEUED
  }
}
