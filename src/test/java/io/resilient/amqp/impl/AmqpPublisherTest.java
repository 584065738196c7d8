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

import static io.resilient.amqp.Resource.Event.CONNECT;
import static io.resilient.amqp.Resource.Event.ERROR;
import static io.resilient.amqp.impl.TestUtils.fastRetrySettings;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.resilient.amqp.AmqpException;
import io.resilient.amqp.Environment;
import io.resilient.amqp.ExchangeType;
import io.resilient.amqp.Publisher;
import io.resilient.amqp.metrics.MicrometerMetricsCollector;
import java.io.IOException;
import java.net.ConnectException;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class AmqpPublisherTest {

  @Mock ConnectionFactory connectionFactory;
  @Mock Connection connection;
  @Mock Channel channel;
  @Mock AMQP.Exchange.DeclareOk declareOk;

  SimpleMeterRegistry registry = new SimpleMeterRegistry();
  Environment environment;
  TestUtils.EventRecorder events = new TestUtils.EventRecorder();

  @BeforeEach
  void init() throws Exception {
    lenient().when(connectionFactory.newConnection(anyString())).thenReturn(connection);
    lenient().when(connection.createChannel()).thenReturn(channel);
    lenient().when(channel.exchangeDeclarePassive(anyString())).thenReturn(declareOk);
    environment =
        new AmqpEnvironmentBuilder()
            .connectionFactory(connectionFactory)
            .connectionSettings(fastRetrySettings(2))
            .metricsCollector(new MicrometerMetricsCollector(registry))
            .build();
  }

  @AfterEach
  void tearDown() {
    environment.close();
  }

  Publisher publisher(String queue) {
    return environment
        .publisherBuilder()
        .serviceName("billing")
        .exchange("ex")
        .exchangeType(ExchangeType.DIRECT)
        .routingKey("rk")
        .queue(queue)
        .listeners(events)
        .build();
  }

  @Test
  void publishShouldSendPersistentTextMessageWithHeaders() throws Exception {
    Publisher publisher = publisher(null);
    assertThat(publisher.publish("hello", Map.of("a", 1))).isTrue();

    verify(channel).exchangeDeclare("ex", "direct", false);
    ArgumentCaptor<AMQP.BasicProperties> properties =
        ArgumentCaptor.forClass(AMQP.BasicProperties.class);
    verify(channel)
        .basicPublish(eq("ex"), eq("rk"), properties.capture(), aryEq("hello".getBytes(UTF_8)));
    assertThat(properties.getValue().getDeliveryMode()).isEqualTo(2);
    assertThat(properties.getValue().getContentType()).isEqualTo("text/plain");
    assertThat(properties.getValue().getContentEncoding()).isEqualTo("UTF-8");
    assertThat(properties.getValue().getAppId()).isEqualTo("billing");
    assertThat(properties.getValue().getHeaders()).containsEntry("a", 1).hasSize(1);
    assertThat(events.events()).containsExactly(CONNECT);
    assertThat(registry.get("resilient.amqp.published").counter().count()).isEqualTo(1.0);
  }

  @Test
  void publishFailureShouldReturnFalseAndEmitError() throws Exception {
    doThrow(new IOException("channel closed"))
        .when(channel)
        .basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));
    Publisher publisher = publisher(null);
    assertThat(publisher.publish("hello")).isFalse();
    assertThat(events.last(ERROR).failureCause())
        .isInstanceOf(AmqpException.AmqpPublishException.class)
        .hasCauseInstanceOf(IOException.class);
    assertThat(registry.get("resilient.amqp.published_failed").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("resilient.amqp.published").counter().count()).isZero();
  }

  @Test
  void unreachableBrokerShouldMakePublishReturnFalse() throws Exception {
    when(connectionFactory.newConnection(anyString()))
        .thenThrow(new ConnectException("Connection refused"));
    Publisher publisher = publisher(null);
    assertThat(publisher.publish("hello")).isFalse();
    assertThat(events.events()).containsExactly(ERROR);
    assertThat(events.last(ERROR).failureCause())
        .isInstanceOf(AmqpException.AmqpPublishException.class)
        .hasCauseInstanceOf(AmqpException.AmqpConnectionException.class);
  }

  @Test
  void publishToQueueShouldUseDefaultExchange() throws Exception {
    Publisher publisher = publisher("q");
    assertThat(publisher.publishToQueue("hello", Map.of("b", "2"))).isTrue();
    ArgumentCaptor<AMQP.BasicProperties> properties =
        ArgumentCaptor.forClass(AMQP.BasicProperties.class);
    verify(channel)
        .basicPublish(eq(""), eq("q"), properties.capture(), aryEq("hello".getBytes(UTF_8)));
    assertThat(properties.getValue().getHeaders()).containsEntry("b", "2");
    verify(channel, never()).exchangeDeclare(anyString(), anyString(), anyBoolean());
  }

  @Test
  void publishToQueueWithoutQueueShouldFail() throws Exception {
    Publisher publisher = publisher(null);
    assertThat(publisher.publishToQueue("hello")).isFalse();
    assertThat(events.last(ERROR).failureCause())
        .isInstanceOf(AmqpException.AmqpPublishException.class);
    verify(connectionFactory, never()).newConnection(anyString());
  }

  @Test
  void assertQueueShouldDeclareExchangeQueueAndBinding() throws Exception {
    publisher("q").assertQueue();
    verify(channel).exchangeDeclare("ex", "direct", false);
    verify(channel).queueDeclare("q", false, false, false, null);
    verify(channel).queueBind("q", "ex", "rk");
  }

  @Test
  void assertQueueWithoutQueueShouldFail() {
    Publisher publisher = publisher(null);
    assertThatThrownBy(publisher::assertQueue)
        .isInstanceOf(AmqpException.AmqpResourceInvalidStateException.class);
  }

  @Test
  void assertExchangeFailureShouldBeTopologyError() throws Exception {
    when(channel.exchangeDeclare(anyString(), anyString(), anyBoolean()))
        .thenThrow(new IOException("PRECONDITION_FAILED - inequivalent arg 'type'"));
    Publisher publisher = publisher(null);
    assertThatThrownBy(publisher::assertExchange)
        .isInstanceOf(AmqpException.AmqpTopologyException.class);
  }

  @Test
  void closedPublisherShouldNotPublish() throws Exception {
    Publisher publisher = publisher(null);
    assertThat(registry.get("resilient.amqp.publishers").gauge().value()).isEqualTo(1.0);
    publisher.close();
    assertThat(registry.get("resilient.amqp.publishers").gauge().value()).isZero();
    assertThat(publisher.publish("hello")).isFalse();
    assertThat(events.last(ERROR).failureCause())
        .hasCauseInstanceOf(AmqpException.AmqpResourceClosedException.class);
    verify(connectionFactory, never()).newConnection(anyString());
  }
}
