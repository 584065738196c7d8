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
import io.resilient.amqp.ConnectionSettings;
import io.resilient.amqp.Environment;
import io.resilient.amqp.metrics.MetricsCollector;
import io.resilient.amqp.metrics.NoOpMetricsCollector;
import java.util.concurrent.ExecutorService;

/** Builder to create an {@link Environment} instance. */
public class AmqpEnvironmentBuilder {

  private ConnectionSettings connectionSettings = ConnectionSettings.builder().build();
  private ConnectionFactory connectionFactory;
  private ExecutorService executorService;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;

  public AmqpEnvironmentBuilder() {}

  /**
   * Set the broker address, credentials and retry settings.
   *
   * @param connectionSettings connection settings
   * @return this builder instance
   */
  public AmqpEnvironmentBuilder connectionSettings(ConnectionSettings connectionSettings) {
    this.connectionSettings = connectionSettings;
    return this;
  }

  /**
   * Set the broker client connection factory.
   *
   * <p>Use it for settings not covered by {@link ConnectionSettings}, e.g. TLS. The environment
   * applies its connection settings to the factory and disables the automatic recovery of the
   * broker client.
   *
   * @param connectionFactory the connection factory
   * @return this builder instance
   */
  public AmqpEnvironmentBuilder connectionFactory(ConnectionFactory connectionFactory) {
    this.connectionFactory = connectionFactory;
    return this;
  }

  /**
   * Set executor service used for internal tasks (e.g. connection recovery).
   *
   * <p>The library uses sensible defaults, override only in case of problems. It is the
   * developer's responsibility to shut down the executor when it is no longer needed.
   *
   * @param executorService the executor service
   * @return this builder instance
   */
  public AmqpEnvironmentBuilder executorService(ExecutorService executorService) {
    this.executorService = executorService;
    return this;
  }

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector metrics collector
   * @return this builder instance
   * @see io.resilient.amqp.metrics.MicrometerMetricsCollector
   */
  public AmqpEnvironmentBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector = metricsCollector;
    return this;
  }

  /**
   * Create the environment instance.
   *
   * @return the configured environment
   */
  public Environment build() {
    if (this.connectionSettings == null) {
      throw new IllegalArgumentException("Connection settings cannot be null");
    }
    return new AmqpEnvironment(
        this.connectionSettings,
        this.connectionFactory == null ? new ConnectionFactory() : this.connectionFactory,
        this.executorService,
        this.metricsCollector == null ? NoOpMetricsCollector.INSTANCE : this.metricsCollector);
  }
}
