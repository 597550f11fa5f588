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
package io.amqptemplate.client.impl;

import static io.amqptemplate.client.StatusEvent.Type.CONNECTED;
import static io.amqptemplate.client.StatusEvent.Type.CONNECTION_BLOCKED;
import static io.amqptemplate.client.StatusEvent.Type.CONNECTION_FAILED;
import static io.amqptemplate.client.StatusEvent.Type.CONNECTION_SHUTDOWN;
import static io.amqptemplate.client.StatusEvent.Type.CONNECTION_UNBLOCKED;
import static io.amqptemplate.client.impl.TestUtils.types;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BlockedCallback;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ExceptionHandler;
import com.rabbitmq.client.Recoverable;
import com.rabbitmq.client.RecoveryListener;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.UnblockedCallback;
import io.amqptemplate.client.AmqpTemplateException;
import io.amqptemplate.client.StatusEvent;
import io.amqptemplate.client.metrics.NoOpMetricsCollector;
import java.net.ConnectException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class ConnectionSupervisorTest {

  @Mock ConnectionFactory connectionFactory;
  Connection connection;

  AutoCloseable mocks;
  List<StatusEvent> events;
  ConnectionSupervisor supervisor;

  @BeforeEach
  void init() throws Exception {
    mocks = MockitoAnnotations.openMocks(this);
    connection = mock(Connection.class, withSettings().extraInterfaces(Recoverable.class));
    when(connection.isOpen()).thenReturn(true);
    when(connectionFactory.newConnection(anyString())).thenReturn(connection);
    events = new CopyOnWriteArrayList<>();
    StatusEventSupport statusEventSupport = new StatusEventSupport(Collections.emptyList());
    statusEventSupport.subscribe(events::add);
    DefaultConnectionSettings<Void> settings =
        new DefaultConnectionSettings<>() {
          @Override
          Void toReturn() {
            return null;
          }
        };
    settings.host("rabbitmq.example.com");
    settings.port(5673);
    supervisor =
        new ConnectionSupervisor(
            connectionFactory,
            settings,
            "my-connection",
            statusEventSupport,
            NoOpMetricsCollector.INSTANCE);
  }

  @AfterEach
  void tearDown() throws Exception {
    mocks.close();
  }

  @Test
  void constructionConfiguresFactory() {
    verify(connectionFactory).setHost("rabbitmq.example.com");
    verify(connectionFactory).setPort(5673);
    verify(connectionFactory).setAutomaticRecoveryEnabled(true);
    verify(connectionFactory).setExceptionHandler(any(ExceptionHandler.class));
  }

  @Test
  void initializeOpensNamedConnection() throws Exception {
    assertThat(supervisor.initialize()).isSameAs(connection);
    verify(connectionFactory).newConnection("my-connection");
    assertThat(supervisor.isOpen()).isTrue();
    assertThat(supervisor.connection()).isSameAs(connection);
    assertThat(types(events)).containsExactly(CONNECTED);
    assertThat(events.get(0).description())
        .isEqualTo("Connection established to rabbitmq.example.com:5673");
  }

  @Test
  void initializeFailureIsReportedThenThrown() throws Exception {
    TimeoutException timeout = new TimeoutException("handshake timed out");
    when(connectionFactory.newConnection(anyString())).thenThrow(timeout);

    assertThatThrownBy(() -> supervisor.initialize())
        .isInstanceOf(AmqpTemplateException.ConnectionInitException.class)
        .hasCause(timeout);
    assertThat(types(events)).containsExactly(CONNECTION_FAILED);
    assertThat(events.get(0).failureCause()).isSameAs(timeout);
    assertThat(supervisor.isOpen()).isFalse();
  }

  @Test
  void shutdownIsReportedWithReplyCodeAndText() throws Exception {
    supervisor.initialize();
    ArgumentCaptor<ShutdownListener> listener = ArgumentCaptor.forClass(ShutdownListener.class);
    verify(connection).addShutdownListener(listener.capture());

    ShutdownSignalException cause =
        new ShutdownSignalException(
            true,
            false,
            new AMQP.Connection.Close.Builder()
                .replyCode(320)
                .replyText("CONNECTION_FORCED - broker forced connection closure")
                .build(),
            connection);
    listener.getValue().shutdownCompleted(cause);

    assertThat(types(events)).containsExactly(CONNECTED, CONNECTION_SHUTDOWN);
    StatusEvent event = events.get(1);
    assertThat(event.description())
        .isEqualTo(
            "Connection Shutdown: CONNECTION_FORCED - broker forced connection closure"
                + " (broker, code 320)");
    assertThat(event.failureCause()).isSameAs(cause);
  }

  @Test
  void blockedAndUnblockedAreReported() throws Exception {
    supervisor.initialize();
    ArgumentCaptor<BlockedCallback> blocked = ArgumentCaptor.forClass(BlockedCallback.class);
    ArgumentCaptor<UnblockedCallback> unblocked = ArgumentCaptor.forClass(UnblockedCallback.class);
    verify(connection).addBlockedListener(blocked.capture(), unblocked.capture());

    blocked.getValue().handle("low on memory");
    unblocked.getValue().handle();

    assertThat(types(events)).containsExactly(CONNECTED, CONNECTION_BLOCKED, CONNECTION_UNBLOCKED);
    assertThat(events.get(1).description()).isEqualTo("Connection Blocked: low on memory");
    assertThat(events.get(2).description()).isEqualTo("Connection Unblocked.");
  }

  @Test
  void recoveryIsReportedAsConnected() throws Exception {
    supervisor.initialize();
    ArgumentCaptor<RecoveryListener> listener = ArgumentCaptor.forClass(RecoveryListener.class);
    verify((Recoverable) connection).addRecoveryListener(listener.capture());

    listener.getValue().handleRecoveryStarted((Recoverable) connection);
    assertThat(types(events)).containsExactly(CONNECTED);
    listener.getValue().handleRecovery((Recoverable) connection);

    assertThat(types(events)).containsExactly(CONNECTED, CONNECTED);
    assertThat(events.get(1).description())
        .isEqualTo("Connection recovered to rabbitmq.example.com:5673");
  }

  @Test
  void newConnectionReplacesAndAbortsPreviousOne() throws Exception {
    Connection newConnection = mock(Connection.class);
    when(connectionFactory.newConnection(anyString()))
        .thenReturn(connection)
        .thenReturn(newConnection);
    supervisor.initialize();
    supervisor.initialize();

    verify(connection).abort(200, "Replaced by a new connection", 10_000);
    assertThat(supervisor.connection()).isSameAs(newConnection);
  }

  @Test
  void failedAttemptKeepsCurrentConnection() throws Exception {
    ConnectException refused = new ConnectException("Connection refused");
    when(connectionFactory.newConnection(anyString())).thenReturn(connection).thenThrow(refused);
    supervisor.initialize();
    when(connection.isOpen()).thenReturn(false);

    assertThatThrownBy(() -> supervisor.initialize())
        .isInstanceOf(AmqpTemplateException.ConnectionInitException.class)
        .hasCause(refused);
    verify(connection, never()).abort(anyInt(), anyString(), anyInt());
    assertThat(supervisor.connection()).isSameAs(connection);
    assertThat(types(events)).containsExactly(CONNECTED, CONNECTION_FAILED);

    supervisor.close("bye");
    verify(connection).abort(200, "bye", 10_000);
  }

  @Test
  void closeClosesOpenConnectionOnlyOnce() throws Exception {
    supervisor.initialize();
    supervisor.close("bye");
    supervisor.close("bye");

    verify(connection).close(200, "bye", 10_000);
    assertThat(supervisor.connection()).isNull();
    assertThat(supervisor.isOpen()).isFalse();
  }
}
