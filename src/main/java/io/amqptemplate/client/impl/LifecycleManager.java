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
import io.amqptemplate.client.Infrastructure;
import io.amqptemplate.client.StatusListener;
import java.util.concurrent.CompletableFuture;

/** Connection and channel lifecycle the publishing side of a template depends on. */
interface LifecycleManager extends AutoCloseable {

  /**
   * Open the connection and the channel asynchronously.
   *
   * @return completes when the channel is open, exceptionally if the initialization fails
   */
  CompletableFuture<Void> initialize();

  /**
   * Return an open channel, re-initializing the connection and/or the channel once if necessary.
   *
   * @return an open channel
   * @throws io.amqptemplate.client.AmqpTemplateException.ChannelUnavailableException if there is
   *     still no open channel after the re-initialization attempt
   * @throws io.amqptemplate.client.AmqpTemplateException.ClientDisposedException if closed
   */
  Channel publishingChannel();

  void subscribe(StatusListener listener);

  Infrastructure infrastructure();

  /** Throws if the lifecycle manager is closed. */
  void checkNotDisposed();

  /** Close the channel, then the connection. Never throws. */
  @Override
  void close();
}
