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

import static io.resilient.amqp.Resource.Event.DISCONNECT;
import static io.resilient.amqp.impl.TestUtils.fastRetrySettings;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import io.resilient.amqp.AmqpException;
import io.resilient.amqp.Resource;
import io.resilient.amqp.metrics.NoOpMetricsCollector;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class ChannelManagerTest {

  @Mock ConnectionFactory connectionFactory;
  @Mock Connection connection;
  @Mock Channel channel;
  @Mock Channel otherChannel;
  @Mock AMQP.Exchange.DeclareOk declareOk;

  TestUtils.EventRecorder events = new TestUtils.EventRecorder();
  ChannelManager channelManager;
  ExecutorService executorService;

  @BeforeEach
  void init() throws Exception {
    lenient().when(connectionFactory.newConnection(anyString())).thenReturn(connection);
    ConnectionManager connectionManager =
        new ConnectionManager(
            "test-connection",
            fastRetrySettings(3),
            connectionFactory,
            NoOpMetricsCollector.INSTANCE,
            Collections.emptyList());
    channelManager = new ChannelManager("test-channel", connectionManager);
    channelManager.addListener(events);
  }

  @AfterEach
  void tearDown() {
    if (executorService != null) {
      executorService.shutdownNow();
    }
  }

  ShutdownListener shutdownListener(Channel c) {
    ArgumentCaptor<ShutdownListener> captor = ArgumentCaptor.forClass(ShutdownListener.class);
    verify(c).addShutdownListener(captor.capture());
    return captor.getValue();
  }

  @Test
  void getChannelShouldCreateHealthCheckedChannelOnce() throws Exception {
    when(connection.createChannel()).thenReturn(channel);
    when(channel.exchangeDeclarePassive(ChannelManager.HEALTH_CHECK_EXCHANGE))
        .thenReturn(declareOk);
    assertThat(channelManager.getChannel()).isSameAs(channel);
    assertThat(channelManager.getChannel()).isSameAs(channel);
    assertThat(channelManager.getChannel(false)).isSameAs(channel);
    verify(connection, times(1)).createChannel();
    verify(channel, times(1)).exchangeDeclarePassive("amq.direct");
    assertThat(channelManager.state()).isEqualTo(Resource.State.CONNECTED);
  }

  @Test
  void concurrentCallsShouldCreateOneChannel() throws Exception {
    when(connection.createChannel())
        .thenAnswer(
            invocation -> {
              Thread.sleep(100);
              return channel;
            });
    when(channel.exchangeDeclarePassive(anyString())).thenReturn(declareOk);
    int concurrency = 5;
    executorService = Executors.newFixedThreadPool(concurrency);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Channel>> futures = new ArrayList<>();
    for (int i = 0; i < concurrency; i++) {
      futures.add(
          executorService.submit(
              () -> {
                start.await();
                return channelManager.getChannel();
              }));
    }
    start.countDown();
    for (Future<Channel> future : futures) {
      assertThat(future.get(10, TimeUnit.SECONDS)).isSameAs(channel);
    }
    verify(connection, times(1)).createChannel();
    verify(channel, times(1)).exchangeDeclarePassive("amq.direct");
    verify(channel, times(1)).addShutdownListener(any(ShutdownListener.class));
    assertThat(channelManager.state()).isEqualTo(Resource.State.CONNECTED);
  }

  @Test
  void getChannelWithoutCreationShouldFailWhenNoChannel() {
    assertThatThrownBy(() -> channelManager.getChannel(false))
        .isInstanceOf(AmqpException.AmqpChannelException.class);
  }

  @Test
  void nullChannelShouldBeAnError() throws Exception {
    when(connection.createChannel()).thenReturn(null);
    assertThatThrownBy(() -> channelManager.getChannel())
        .isInstanceOf(AmqpException.AmqpChannelException.class)
        .hasMessageContaining("channel limit");
    assertThat(channelManager.state()).isEqualTo(Resource.State.DISCONNECTED);
  }

  @Test
  void failedHealthCheckShouldCloseChannelAndCacheNothing() throws Exception {
    when(connection.createChannel()).thenReturn(channel, otherChannel);
    when(channel.exchangeDeclarePassive(anyString())).thenThrow(new IOException("not found"));
    when(otherChannel.exchangeDeclarePassive(anyString())).thenReturn(declareOk);
    assertThatThrownBy(() -> channelManager.getChannel())
        .isInstanceOf(AmqpException.AmqpChannelException.class)
        .hasCauseInstanceOf(IOException.class);
    verify(channel).close();
    assertThat(channelManager.getChannel()).isSameAs(otherChannel);
  }

  @Test
  void checkChannelShouldReflectHealthCheck() throws Exception {
    assertThat(channelManager.checkChannel()).isFalse();
    when(connection.createChannel()).thenReturn(channel);
    when(channel.exchangeDeclarePassive(anyString()))
        .thenReturn(declareOk)
        .thenReturn(declareOk)
        .thenThrow(
            new AlreadyClosedException(new ShutdownSignalException(false, false, null, channel)));
    channelManager.getChannel();
    assertThat(channelManager.checkChannel()).isTrue();
    assertThat(channelManager.checkChannel()).isFalse();
  }

  @Test
  void channelErrorShouldClearChannelAndEmitDisconnect() throws Exception {
    when(connection.createChannel()).thenReturn(channel, otherChannel);
    when(channel.exchangeDeclarePassive(anyString())).thenReturn(declareOk);
    when(otherChannel.exchangeDeclarePassive(anyString())).thenReturn(declareOk);
    channelManager.getChannel();
    ShutdownSignalException cause = new ShutdownSignalException(false, false, null, channel);
    shutdownListener(channel).shutdownCompleted(cause);
    assertThat(events.events()).containsExactly(DISCONNECT);
    assertThat(events.last(DISCONNECT).failureCause()).isSameAs(cause);
    assertThatThrownBy(() -> channelManager.getChannel(false))
        .isInstanceOf(AmqpException.AmqpChannelException.class);
    assertThat(channelManager.getChannel()).isSameAs(otherChannel);
  }

  @Test
  void lateShutdownOfReplacedChannelShouldNotClearCurrentChannel() throws Exception {
    when(connection.createChannel()).thenReturn(channel, otherChannel);
    when(channel.exchangeDeclarePassive(anyString())).thenReturn(declareOk);
    when(otherChannel.exchangeDeclarePassive(anyString())).thenReturn(declareOk);
    channelManager.getChannel();
    ShutdownListener staleListener = shutdownListener(channel);
    ShutdownSignalException cause = new ShutdownSignalException(false, false, null, channel);
    staleListener.shutdownCompleted(cause);
    assertThat(channelManager.getChannel()).isSameAs(otherChannel);

    // same signal delivered again to the listener of the first channel
    staleListener.shutdownCompleted(cause);
    assertThat(channelManager.getChannel(false)).isSameAs(otherChannel);
    assertThat(events.events()).containsExactly(DISCONNECT);
    assertThat(channelManager.state()).isEqualTo(Resource.State.CONNECTED);
  }

  @Test
  void channelClosedBeforeListenerRegistrationShouldNotBeCached() throws Exception {
    when(connection.createChannel()).thenReturn(channel, otherChannel);
    when(channel.exchangeDeclarePassive(anyString())).thenReturn(declareOk);
    when(otherChannel.exchangeDeclarePassive(anyString())).thenReturn(declareOk);
    ShutdownSignalException cause = new ShutdownSignalException(false, false, null, channel);
    // amqp-client calls the listener right away when the channel is already closed
    doAnswer(
            invocation -> {
              invocation.<ShutdownListener>getArgument(0).shutdownCompleted(cause);
              return null;
            })
        .when(channel)
        .addShutdownListener(any(ShutdownListener.class));
    assertThatThrownBy(() -> channelManager.getChannel())
        .isInstanceOf(AmqpException.AmqpChannelException.class)
        .hasMessageContaining("closed right after creation");
    assertThat(events.events()).containsExactly(DISCONNECT);
    assertThat(channelManager.state()).isEqualTo(Resource.State.DISCONNECTED);
    assertThatThrownBy(() -> channelManager.getChannel(false))
        .isInstanceOf(AmqpException.AmqpChannelException.class);
    assertThat(channelManager.getChannel()).isSameAs(otherChannel);
  }

  @Test
  void connectionErrorShouldClearChannelWithoutEvent() throws Exception {
    when(connection.createChannel()).thenReturn(channel);
    when(channel.exchangeDeclarePassive(anyString())).thenReturn(declareOk);
    channelManager.getChannel();
    shutdownListener(channel)
        .shutdownCompleted(new ShutdownSignalException(true, false, null, connection));
    assertThat(events.events()).isEmpty();
    assertThat(channelManager.checkChannel()).isFalse();
  }

  @Test
  void cleanChannelCloseShouldNotEmitDisconnect() throws Exception {
    when(connection.createChannel()).thenReturn(channel);
    when(channel.exchangeDeclarePassive(anyString())).thenReturn(declareOk);
    channelManager.getChannel();
    shutdownListener(channel)
        .shutdownCompleted(new ShutdownSignalException(false, true, null, channel));
    assertThat(events.events()).isEmpty();
  }

  @Test
  void closeChannelShouldRemoveListenerAndTolerateAlreadyClosed() throws Exception {
    when(connection.createChannel()).thenReturn(channel);
    when(channel.exchangeDeclarePassive(anyString())).thenReturn(declareOk);
    doThrow(new AlreadyClosedException(new ShutdownSignalException(false, false, null, channel)))
        .when(channel)
        .close();
    channelManager.getChannel();
    ShutdownListener listener = shutdownListener(channel);
    channelManager.closeChannel();
    verify(channel).removeShutdownListener(listener);
    verify(channel).close();
    assertThat(events.events()).isEmpty();
    assertThat(channelManager.state()).isEqualTo(Resource.State.DISCONNECTED);
    assertThatThrownBy(() -> channelManager.getChannel(false))
        .isInstanceOf(AmqpException.AmqpChannelException.class);
  }
}
