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

import java.time.Duration;

/**
 * Settings for the connection of a template.
 *
 * <p>Automatic recovery is always enabled.
 *
 * @param <T> the type of object returned by methods, usually the object itself
 */
public interface ConnectionSettings<T> {

  /** Value to use the default port of the protocol (5672). */
  int USE_DEFAULT_PORT = -1;

  /**
   * The host to connect to.
   *
   * <p>Default is <code>localhost</code>.
   *
   * @param host
   * @return type-parameter object
   */
  T host(String host);

  /**
   * The port to use to connect.
   *
   * <p>Default is the protocol default port.
   *
   * @param port
   * @return type-parameter object
   * @see #USE_DEFAULT_PORT
   */
  T port(int port);

  /**
   * The username to use.
   *
   * <p>Default is <code>guest</code>.
   *
   * @param username username
   * @return type-parameter object
   */
  T username(String username);

  /**
   * The password to use.
   *
   * <p>Default is <code>guest</code>.
   *
   * @param password password
   * @return type-parameter object
   */
  T password(String password);

  /**
   * The virtual host to connect to.
   *
   * @param virtualHost
   * @return type-parameter object.
   */
  T virtualHost(String virtualHost);

  /**
   * Delay policy for automatic connection recovery attempts.
   *
   * <p>Default is a fixed delay of 5 seconds.
   *
   * @param policy back-off delay policy
   * @return type-parameter object
   */
  T recoveryDelayPolicy(BackOffDelayPolicy policy);

  /**
   * Timeout for TCP connection establishment and protocol handshake.
   *
   * <p>Default is 60 seconds.
   *
   * @param timeout
   * @return type-parameter object
   */
  T connectionTimeout(Duration timeout);

  /**
   * Maximum time to wait for the broker to confirm the connection closing.
   *
   * <p>Default is 10 seconds.
   *
   * @param timeout
   * @return type-parameter object
   */
  T closeTimeout(Duration timeout);
}
