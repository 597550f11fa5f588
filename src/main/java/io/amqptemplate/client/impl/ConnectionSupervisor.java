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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Recoverable;
import com.rabbitmq.client.RecoveryListener;
import io.amqptemplate.client.AmqpTemplateException;
import io.amqptemplate.client.metrics.MetricsCollector;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the connection of a template.
 *
 * <p>Not thread-safe for handle replacement: callers serialize {@link #initialize()} and {@link
 * #close(String)}. The handle itself can be read concurrently.
 */
final class ConnectionSupervisor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionSupervisor.class);

  private final ConnectionFactory connectionFactory;
  private final String name;
  private final String address;
  private final int closeTimeoutMs;
  private final StatusEventSupport statusEventSupport;
  private final MetricsCollector metricsCollector;
  private final AtomicReference<Connection> connection = new AtomicReference<>();

  ConnectionSupervisor(
      ConnectionFactory connectionFactory,
      DefaultConnectionSettings<?> connectionSettings,
      String name,
      StatusEventSupport statusEventSupport,
      MetricsCollector metricsCollector) {
    this.connectionFactory = connectionFactory;
    this.name = name;
    this.address = connectionSettings.label();
    this.closeTimeoutMs = Utils.toIntMillis(connectionSettings.closeTimeout());
    this.statusEventSupport = statusEventSupport;
    this.metricsCollector = metricsCollector;
    connectionSettings.configure(this.connectionFactory);
    this.connectionFactory.setExceptionHandler(new StatusExceptionHandler(statusEventSupport));
  }

  /**
   * Open a new connection and replace the current one, if any.
   *
   * <p>The current connection is kept if the attempt fails, it may still be recovering.
   *
   * @return the new connection
   * @throws AmqpTemplateException.ConnectionInitException if the connection cannot be opened, the
   *     failure has already been reported as a status event
   */
  Connection initialize() {
    Utils.StopWatch stopWatch = new Utils.StopWatch();
    Connection newConnection;
    try {
      LOGGER.debug("Connecting '{}' to {}...", this.name, this.address);
      newConnection = this.connectionFactory.newConnection(this.name);
    } catch (Exception e) {
      LOGGER.error("Failed to establish connection '{}' to {}", this.name, this.address, e);
      this.statusEventSupport.dispatch(StatusEvents.connectionFailed(e));
      throw new AmqpTemplateException.ConnectionInitException(
          "Failed to establish connection to " + this.address, e);
    } finally {
      LOGGER.debug("Connection attempt for '{}' took {}", this.name, stopWatch.stop());
    }
    this.release("Replaced by a new connection");
    this.register(newConnection);
    this.connection.set(newConnection);
    this.metricsCollector.openConnection();
    LOGGER.info("Connection established to {}", this.address);
    this.statusEventSupport.dispatch(StatusEvents.connected(this.address));
    return newConnection;
  }

  private void register(Connection c) {
    c.addShutdownListener(
        cause -> {
          LOGGER.warn(
              "Connection '{}' shutdown: {}", this.name, StatusEvents.describe(cause));
          this.statusEventSupport.dispatch(StatusEvents.connectionShutdown(cause));
        });
    c.addBlockedListener(
        reason -> {
          LOGGER.warn("Connection '{}' blocked: {}", this.name, reason);
          this.statusEventSupport.dispatch(StatusEvents.connectionBlocked(reason));
        },
        () -> {
          LOGGER.info("Connection '{}' unblocked.", this.name);
          this.statusEventSupport.dispatch(StatusEvents.connectionUnblocked());
        });
    if (c instanceof Recoverable) {
      ((Recoverable) c)
          .addRecoveryListener(
              new RecoveryListener() {
                @Override
                public void handleRecovery(Recoverable recoverable) {
                  LOGGER.info("Recovered connection '{}' to {}", name, address);
                  statusEventSupport.dispatch(StatusEvents.recovered(address));
                }

                @Override
                public void handleRecoveryStarted(Recoverable recoverable) {
                  LOGGER.info("Connection '{}' to {} is recovering", name, address);
                }
              });
    }
  }

  Connection connection() {
    return this.connection.get();
  }

  boolean isOpen() {
    Connection c = this.connection.get();
    return c != null && c.isOpen();
  }

  /**
   * Close the connection gracefully if it is open, abort it otherwise.
   *
   * <p>Aborting a connection that is not open stops its recovery.
   *
   * @param reason close reason
   */
  void close(String reason) {
    Connection c = this.connection.getAndSet(null);
    if (c == null) {
      return;
    }
    try {
      if (c.isOpen()) {
        c.close(AMQP.REPLY_SUCCESS, reason, this.closeTimeoutMs);
        LOGGER.info("Connection '{}' closed.", this.name);
      } else {
        c.abort(AMQP.REPLY_SUCCESS, reason, this.closeTimeoutMs);
        LOGGER.debug("Connection '{}' was not open, aborted it.", this.name);
      }
    } catch (Exception e) {
      LOGGER.warn("Error while closing connection '{}': {}", this.name, e.getMessage());
    } finally {
      this.metricsCollector.closeConnection();
    }
  }

  private void release(String reason) {
    Connection previous = this.connection.getAndSet(null);
    if (previous != null) {
      LOGGER.debug("Aborting previous connection of '{}'", this.name);
      try {
        previous.abort(AMQP.REPLY_SUCCESS, reason, this.closeTimeoutMs);
      } catch (Exception e) {
        LOGGER.debug("Error while aborting previous connection: {}", e.getMessage());
      } finally {
        this.metricsCollector.closeConnection();
      }
    }
  }

  String address() {
    return this.address;
  }
}
