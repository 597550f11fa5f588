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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.amqptemplate.client.AmqpTemplateException;
import io.amqptemplate.client.AmqpTemplateException.ChannelUnavailableException;
import io.amqptemplate.client.AmqpTemplateException.ClientDisposedException;
import io.amqptemplate.client.AmqpTemplateException.ConnectionInitException;
import io.amqptemplate.client.Infrastructure;
import io.amqptemplate.client.ReturnListener;
import io.amqptemplate.client.StatusListener;
import io.amqptemplate.client.impl.Utils.RunnableWithException;
import io.amqptemplate.client.metrics.MetricsCollector;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes the connection supervisor, the channel manager, and the status events of a template.
 *
 * <p>The instance lock serializes initialization, re-initialization, and closing. Handles are read
 * without the lock.
 */
final class AmqpLifecycleManager implements LifecycleManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpLifecycleManager.class);

  static final String CHANNEL_CLOSE_REASON = "Closing channel via Dispose";
  static final String CONNECTION_CLOSE_REASON = "Closing connection via Dispose";

  private final String name;
  private final StatusEventSupport statusEventSupport;
  private final ConnectionSupervisor connectionSupervisor;
  private final ChannelManager channelManager;
  private final Infrastructure.Initializer infrastructureInitializer;
  private final MetricsCollector metricsCollector;
  private final ExecutorService initializationExecutor;
  private final Infrastructure infrastructure = new DefaultInfrastructure();
  private final Lock instanceLock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final Duration closeLockTimeout;

  AmqpLifecycleManager(
      ConnectionFactory connectionFactory,
      DefaultConnectionSettings<?> connectionSettings,
      String name,
      List<StatusListener> listeners,
      ReturnListener returnListener,
      Infrastructure.Initializer infrastructureInitializer,
      MetricsCollector metricsCollector) {
    this.name = name;
    this.metricsCollector = metricsCollector;
    this.infrastructureInitializer = infrastructureInitializer;
    this.statusEventSupport = new StatusEventSupport(listeners);
    this.connectionSupervisor =
        new ConnectionSupervisor(
            connectionFactory, connectionSettings, name, this.statusEventSupport, metricsCollector);
    this.channelManager =
        new ChannelManager(this.statusEventSupport, returnListener, metricsCollector);
    this.initializationExecutor = Utils.singleThreadExecutor("amqp-template-init-%s-", name);
    // an initialization attempt may hold the lock for a whole connection attempt
    this.closeLockTimeout =
        connectionSettings.connectionTimeout().plus(connectionSettings.closeTimeout());
  }

  @Override
  public CompletableFuture<Void> initialize() {
    checkNotDisposed();
    try {
      return CompletableFuture.runAsync(this::initializeSync, this.initializationExecutor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(disposedException());
    }
  }

  void initializeSync() {
    this.instanceLock.lock();
    try {
      checkNotDisposed();
      if (this.channelManager.openChannel() != null) {
        // a publish got the lock first and already opened the connection and the channel
        LOGGER.debug("Template '{}' already initialized", this.name);
        return;
      }
      Connection connection = this.connectionSupervisor.initialize();
      if (this.closed.get()) {
        this.connectionSupervisor.close(CONNECTION_CLOSE_REASON);
        throw disposedException();
      }
      try {
        this.createChannel(connection);
      } catch (ChannelUnavailableException e) {
        throw new ConnectionInitException("Failed to create channel", e);
      }
    } finally {
      this.instanceLock.unlock();
    }
  }

  @Override
  public Channel publishingChannel() {
    this.instanceLock.lock();
    try {
      checkNotDisposed();
      Channel channel = this.channelManager.openChannel();
      if (channel != null) {
        return channel;
      }
      LOGGER.warn("Channel is not open. Attempting to re-initialize connection/channel.");
      this.metricsCollector.reinitialization();
      try {
        channel = this.reinitialize();
      } catch (ConnectionInitException | ChannelUnavailableException e) {
        LOGGER.error("Failed to re-establish channel. Message not sent.");
        throw new ChannelUnavailableException("Channel is not available", e);
      }
      if (channel == null) {
        LOGGER.error("Failed to re-establish channel. Message not sent.");
        throw new ChannelUnavailableException("Channel is not available");
      }
      return channel;
    } finally {
      this.instanceLock.unlock();
    }
  }

  private Channel reinitialize() {
    Connection connection;
    if (this.connectionSupervisor.isOpen()) {
      LOGGER.debug("Connection of '{}' is open, re-creating channel only", this.name);
      connection = this.connectionSupervisor.connection();
    } else {
      connection = this.connectionSupervisor.initialize();
    }
    this.createChannel(connection);
    return this.channelManager.openChannel();
  }

  private Channel createChannel(Connection connection) {
    Channel channel;
    try {
      channel = this.channelManager.create(connection);
    } catch (ChannelUnavailableException e) {
      LOGGER.error("Failed to create channel for '{}'", this.name, e);
      this.statusEventSupport.dispatch(StatusEvents.connectionFailed(e));
      throw e;
    }
    if (this.infrastructureInitializer != null) {
      try {
        this.infrastructureInitializer.initialize(this.infrastructure);
      } catch (Exception e) {
        LOGGER.warn("Error in infrastructure initializer of '{}'", this.name, e);
        this.statusEventSupport.dispatch(StatusEvents.callbackError(e));
      }
    }
    return channel;
  }

  @Override
  public void subscribe(StatusListener listener) {
    checkNotDisposed();
    this.statusEventSupport.subscribe(listener);
  }

  @Override
  public Infrastructure infrastructure() {
    checkNotDisposed();
    return this.infrastructure;
  }

  @Override
  public void checkNotDisposed() {
    if (this.closed.get()) {
      throw disposedException();
    }
  }

  private AmqpTemplateException disposedException() {
    return new ClientDisposedException("Template '" + this.name + "' is closed");
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing template '{}'", this.name);
      BiConsumer<String, RunnableWithException> safeClose =
          (label, action) -> {
            try {
              action.run();
            } catch (Exception e) {
              LOGGER.info(
                  "Error during template '{}' closing ({}): {}", this.name, label, e.getMessage());
            }
          };
      boolean locked = false;
      try {
        locked = this.instanceLock.tryLock(this.closeLockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!locked) {
          LOGGER.info("Could not acquire lifecycle lock during closing");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.info("Interrupted while waiting for lifecycle lock");
      }
      try {
        safeClose.accept("channel", () -> this.channelManager.close(CHANNEL_CLOSE_REASON));
        safeClose.accept(
            "connection", () -> this.connectionSupervisor.close(CONNECTION_CLOSE_REASON));
        safeClose.accept("initialization executor", this.initializationExecutor::shutdownNow);
      } finally {
        if (locked) {
          try {
            this.instanceLock.unlock();
          } catch (Exception e) {
            LOGGER.debug("Error while releasing lifecycle lock: {}", e.getMessage());
          }
        }
      }
      LOGGER.debug("Template '{}' has been closed", this.name);
    }
  }

  private class DefaultInfrastructure implements Infrastructure {

    @Override
    public Connection connection() {
      return connectionSupervisor.connection();
    }

    @Override
    public Channel channel() {
      return channelManager.channel();
    }
  }
}
