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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

/**
 * Access to the raw connection and channel of a template.
 *
 * <p>Meant only for out-of-band infrastructure setup (exchange, queue, and binding declarations).
 * Closing these resources or changing their configuration breaks the template.
 *
 * @see AmqpTemplateBuilder#infrastructureInitializer(Initializer)
 */
public interface Infrastructure {

  /**
   * The current connection.
   *
   * @return the connection, null if not initialized yet
   */
  Connection connection();

  /**
   * The current channel.
   *
   * @return the channel, null if not initialized yet
   */
  Channel channel();

  /** Callback to set up broker-side resources once the template has an open channel. */
  @FunctionalInterface
  interface Initializer {

    /**
     * Called after each successful (re-)initialization of the template.
     *
     * @param infrastructure access to the connection and channel
     * @throws Exception if the setup fails
     */
    void initialize(Infrastructure infrastructure) throws Exception;
  }
}
