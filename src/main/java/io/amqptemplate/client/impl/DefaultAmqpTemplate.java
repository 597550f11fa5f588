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
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import io.amqptemplate.client.AmqpTemplate;
import io.amqptemplate.client.AmqpTemplateException;
import io.amqptemplate.client.Infrastructure;
import io.amqptemplate.client.Message;
import io.amqptemplate.client.StatusListener;
import io.amqptemplate.client.metrics.MetricsCollector;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AmqpTemplate} implementation that publishes through a {@link LifecycleManager}.
 *
 * <p>The channel check and the publish are not atomic: a channel closing between the two makes
 * the publish fail with a {@link AmqpTemplateException.PublishFailedException}.
 */
public final class DefaultAmqpTemplate implements AmqpTemplate {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultAmqpTemplate.class);

  private static final int DELIVERY_MODE_PERSISTENT = 2;

  private final LifecycleManager lifecycleManager;
  private final MetricsCollector metricsCollector;
  private final CompletableFuture<Void> initialization;

  DefaultAmqpTemplate(LifecycleManager lifecycleManager, MetricsCollector metricsCollector) {
    this.lifecycleManager = lifecycleManager;
    this.metricsCollector = metricsCollector;
    this.initialization = this.lifecycleManager.initialize();
    this.initialization.exceptionally(
        t -> {
          LOGGER.debug("Failed to initialize AMQP connection: {}", t.getMessage());
          return null;
        });
  }

  @Override
  public void send(String exchange, String routingKey, byte[] body) {
    this.send(Message.of(exchange, routingKey, body, false));
  }

  @Override
  public void send(String exchange, String routingKey, byte[] body, boolean mandatory) {
    this.send(Message.of(exchange, routingKey, body, mandatory));
  }

  @Override
  public void send(Message message) {
    if (message == null) {
      throw new IllegalArgumentException("Message cannot be null");
    }
    Channel channel = this.lifecycleManager.publishingChannel();
    AMQP.BasicProperties properties =
        new AMQP.BasicProperties.Builder().deliveryMode(DELIVERY_MODE_PERSISTENT).build();
    try {
      channel.basicPublish(
          message.exchange(),
          message.routingKey(),
          message.mandatory(),
          properties,
          message.body());
      this.metricsCollector.publish();
      LOGGER.debug(
          "Message sent to exchange '{}' with routing key '{}'.",
          message.exchange(),
          message.routingKey());
    } catch (IOException | ShutdownSignalException e) {
      LOGGER.error(
          "Failed to send message to exchange '{}' with routing key '{}'.",
          message.exchange(),
          message.routingKey(),
          e);
      this.metricsCollector.publishFailure();
      throw new AmqpTemplateException.PublishFailedException(
          String.format(
              "Failed to send message to exchange '%s' with routing key '%s'",
              message.exchange(), message.routingKey()),
          e);
    }
  }

  @Override
  public void onStatusChanged(StatusListener listener) {
    this.lifecycleManager.subscribe(listener);
  }

  @Override
  public CompletableFuture<Void> initialization() {
    return this.initialization;
  }

  /**
   * Access to the raw connection and channel, for infrastructure setup only.
   *
   * @return infrastructure access
   */
  public Infrastructure infrastructure() {
    return this.lifecycleManager.infrastructure();
  }

  @Override
  public void close() {
    this.lifecycleManager.close();
  }
}
