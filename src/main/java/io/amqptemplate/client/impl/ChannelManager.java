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
import com.rabbitmq.client.Connection;
import io.amqptemplate.client.AmqpTemplateException;
import io.amqptemplate.client.ReturnListener;
import io.amqptemplate.client.ReturnedMessage;
import io.amqptemplate.client.metrics.MetricsCollector;
import java.io.IOException;
import java.lang.ref.WeakReference;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Owns the publishing channel of a template. */
final class ChannelManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelManager.class);

  private final StatusEventSupport statusEventSupport;
  private final ReturnListener returnListener;
  private final MetricsCollector metricsCollector;
  private final AtomicReference<ChannelHandle> handle = new AtomicReference<>();

  ChannelManager(
      StatusEventSupport statusEventSupport,
      ReturnListener returnListener,
      MetricsCollector metricsCollector) {
    this.statusEventSupport = statusEventSupport;
    this.returnListener = returnListener;
    this.metricsCollector = metricsCollector;
  }

  /**
   * Create a channel on the given connection and make it the current channel.
   *
   * @param connection parent connection
   * @return the new channel
   * @throws AmqpTemplateException.ChannelUnavailableException if the connection is not open or
   *     refuses the channel
   */
  Channel create(Connection connection) {
    if (connection == null || !connection.isOpen()) {
      throw new AmqpTemplateException.ChannelUnavailableException(
          "Cannot create channel, connection is not open");
    }
    Channel channel;
    try {
      channel = connection.createChannel();
    } catch (IOException | RuntimeException e) {
      throw new AmqpTemplateException.ChannelUnavailableException(
          "Error while creating channel", e);
    }
    if (channel == null) {
      throw new AmqpTemplateException.ChannelUnavailableException(
          "Cannot create channel, channel limit reached");
    }
    channel.addShutdownListener(
        cause -> {
          LOGGER.warn(
              "Channel {} shutdown: {}", channel.getChannelNumber(), StatusEvents.describe(cause));
          this.statusEventSupport.dispatch(StatusEvents.channelShutdown(cause));
        });
    channel.addReturnListener(
        ret -> {
          ReturnedMessage message =
              new ReturnedMessage(
                  ret.getReplyCode(),
                  ret.getReplyText(),
                  ret.getExchange(),
                  ret.getRoutingKey(),
                  ret.getBody());
          this.metricsCollector.publishReturned();
          this.handleReturn(message);
        });
    ChannelHandle previous = this.handle.getAndSet(new ChannelHandle(channel, connection));
    if (previous != null) {
      previous.abort();
    }
    LOGGER.info("Channel created.");
    return channel;
  }

  private void handleReturn(ReturnedMessage message) {
    if (this.returnListener == null) {
      LOGGER.warn("Message returned by the broker: {}", message);
    } else {
      try {
        this.returnListener.handle(message);
      } catch (Exception e) {
        LOGGER.warn("Error in return listener", e);
      }
    }
  }

  boolean isOpen() {
    ChannelHandle h = this.handle.get();
    return h != null && h.isOpen();
  }

  /**
   * The current channel if it is usable.
   *
   * @return the channel, or null if there is no open channel
   */
  Channel openChannel() {
    ChannelHandle h = this.handle.get();
    return h != null && h.isOpen() ? h.channel : null;
  }

  Channel channel() {
    ChannelHandle h = this.handle.get();
    return h == null ? null : h.channel;
  }

  /**
   * Close the channel gracefully if it is open and release it.
   *
   * @param reason close reason
   */
  void close(String reason) {
    ChannelHandle h = this.handle.getAndSet(null);
    if (h != null && h.channel.isOpen()) {
      try {
        h.channel.close(AMQP.REPLY_SUCCESS, reason);
        LOGGER.info("Channel disposed.");
      } catch (Exception e) {
        LOGGER.warn("Error while closing channel: {}", e.getMessage());
      }
    }
  }

  /** A channel with a weak reference to its connection. */
  static final class ChannelHandle {

    private final Channel channel;
    private final WeakReference<Connection> connection;

    ChannelHandle(Channel channel, Connection connection) {
      this.channel = channel;
      this.connection = new WeakReference<>(connection);
    }

    boolean isOpen() {
      Connection c = this.connection.get();
      return c != null && c.isOpen() && this.channel.isOpen();
    }

    private void abort() {
      if (this.channel.isOpen()) {
        try {
          this.channel.abort(AMQP.REPLY_SUCCESS, "Replaced by a new channel");
        } catch (Exception e) {
          LOGGER.debug("Error while aborting previous channel: {}", e.getMessage());
        }
      }
    }
  }
}
