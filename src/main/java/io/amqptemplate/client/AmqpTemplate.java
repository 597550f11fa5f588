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
package io.amqptemplate.client;

import java.util.concurrent.CompletableFuture;

/**
 * Long-lived handle to publish messages to an AMQP 0-9-1 broker.
 *
 * <p>The template owns one connection and one channel. It tolerates network interruptions and
 * broker restarts: the underlying connection recovers automatically and a publish on a broken
 * channel triggers one synchronous re-initialization attempt before giving up. Connectivity
 * changes are reported with {@link StatusEvent}s.
 *
 * <p>Instances are created with an {@link AmqpTemplateBuilder}. Construction does not wait for the
 * connection to be established, see {@link #initialization()}.
 *
 * <p>Implementations must be thread-safe.
 *
 * @see AmqpTemplateBuilder
 */
public interface AmqpTemplate extends AutoCloseable {

  /**
   * Publish a non-mandatory, persistent message.
   *
   * @param exchange exchange name, the empty string for the default exchange
   * @param routingKey routing key
   * @param body message body
   * @throws AmqpTemplateException.ChannelUnavailableException if no channel could be obtained
   * @throws AmqpTemplateException.PublishFailedException if the transport rejected the message
   * @throws AmqpTemplateException.ClientDisposedException if the template is closed
   */
  void send(String exchange, String routingKey, byte[] body);

  /**
   * Publish a persistent message.
   *
   * <p>If <code>mandatory</code> is set and the broker cannot route the message, the message is
   * handed to the {@link ReturnListener} of the template. This method does not fail in this case.
   *
   * @param exchange exchange name, the empty string for the default exchange
   * @param routingKey routing key
   * @param body message body
   * @param mandatory whether the broker must return the message if it cannot route it
   * @throws AmqpTemplateException.ChannelUnavailableException if no channel could be obtained
   * @throws AmqpTemplateException.PublishFailedException if the transport rejected the message
   * @throws AmqpTemplateException.ClientDisposedException if the template is closed
   */
  void send(String exchange, String routingKey, byte[] body, boolean mandatory);

  /**
   * Publish a message.
   *
   * @param message the message
   * @see #send(String, String, byte[], boolean)
   */
  void send(Message message);

  /**
   * Register a listener for connectivity changes.
   *
   * @param listener the listener
   */
  void onStatusChanged(StatusListener listener);

  /**
   * The initialization triggered at creation time.
   *
   * <p>The future completes once the connection and the channel are open. It completes
   * exceptionally with a {@link AmqpTemplateException.ConnectionInitException} if they could not
   * be opened. Failures are reported to the {@link StatusListener}s as well, so applications can
   * ignore this future.
   *
   * @return initialization future
   */
  CompletableFuture<Void> initialization();

  /**
   * Close the channel, then the connection.
   *
   * <p>Blocking and idempotent, never throws.
   */
  @Override
  void close();
}
