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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.resilient.amqp.AmqpException;
import io.resilient.amqp.ConnectionProvider;
import io.resilient.amqp.ConnectionSettings;
import io.resilient.amqp.Environment;
import io.resilient.amqp.Publisher;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class AmqpEnvironmentTest {

  @Mock ConnectionFactory connectionFactory;
  @Mock Connection connection;

  Environment environment(ConnectionSettings settings) {
    return new AmqpEnvironmentBuilder()
        .connectionFactory(connectionFactory)
        .connectionSettings(settings)
        .build();
  }

  @Test
  void connectionFactoryShouldBeConfiguredFromSettings() {
    try (Environment ignored =
        environment(
            ConnectionSettings.builder()
                .host("broker")
                .port(5673)
                .virtualHost("orders")
                .username("app")
                .password("secret")
                .connectionTimeout(Duration.ofSeconds(5))
                .build())) {
      verify(connectionFactory).setHost("broker");
      verify(connectionFactory).setPort(5673);
      verify(connectionFactory).setVirtualHost("orders");
      verify(connectionFactory).setUsername("app");
      verify(connectionFactory).setPassword("secret");
      verify(connectionFactory).setConnectionTimeout(5000);
      verify(connectionFactory).setAutomaticRecoveryEnabled(false);
      verify(connectionFactory).setTopologyRecoveryEnabled(false);
    }
  }

  @Test
  void closeShouldCloseClientsAndSharedConnections() throws Exception {
    when(connectionFactory.newConnection(anyString())).thenReturn(connection);
    Environment environment = environment(ConnectionSettings.builder().build());
    ConnectionProvider connectionProvider = environment.connectionProvider();
    connectionProvider.getConnection();
    Publisher publisher =
        environment
            .publisherBuilder()
            .exchange("ex")
            .connectionProvider(connectionProvider)
            .build();
    environment.close();

    verify(connection).close();
    assertThat(publisher.publish("hello")).isFalse();
    assertThatThrownBy(environment::consumerBuilder)
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
    // idempotent
    environment.close();
  }

  @Test
  void connectionNameShouldIdentifyClient() throws Exception {
    when(connectionFactory.newConnection(anyString())).thenReturn(connection);
    when(connection.createChannel()).thenReturn(null);
    try (Environment environment =
        environment(ConnectionSettings.builder().connectionName("orders-app").build())) {
      Publisher publisher =
          environment.publisherBuilder().serviceName("billing").exchange("invoices").build();
      publisher.publish("hello");
      verify(connectionFactory).newConnection(startsWith("orders-app-publisher-billing-invoices-"));
    }
  }

  @Test
  void foreignConnectionProviderShouldBeRejected() {
    try (Environment environment = environment(ConnectionSettings.builder().build())) {
      ConnectionProvider foreign = mock(ConnectionProvider.class);
      assertThatThrownBy(() -> environment.consumerBuilder().connectionProvider(foreign))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  void builderShouldValidateMandatoryFields() {
    try (Environment environment = environment(ConnectionSettings.builder().build())) {
      assertThatThrownBy(() -> environment.consumerBuilder().build())
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> environment.publisherBuilder().build())
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> environment.consumerBuilder().queue("q").prefetchCount(-1).build())
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
