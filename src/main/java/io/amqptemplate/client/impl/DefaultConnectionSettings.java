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

import com.rabbitmq.client.ConnectionFactory;
import io.amqptemplate.client.BackOffDelayPolicy;
import io.amqptemplate.client.ConnectionSettings;
import java.time.Duration;

abstract class DefaultConnectionSettings<T> implements ConnectionSettings<T> {

  static final String DEFAULT_HOST = "localhost";
  static final String DEFAULT_USERNAME = "guest";
  static final String DEFAULT_PASSWORD = "guest";
  static final String DEFAULT_VIRTUAL_HOST = "/";
  static final BackOffDelayPolicy DEFAULT_RECOVERY_DELAY_POLICY =
      BackOffDelayPolicy.fixed(Duration.ofSeconds(5));
  static final Duration DEFAULT_CONNECTION_TIMEOUT =
      Duration.ofMillis(ConnectionFactory.DEFAULT_CONNECTION_TIMEOUT);
  static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(10);

  private String host = DEFAULT_HOST;
  private int port = USE_DEFAULT_PORT;
  private String username = DEFAULT_USERNAME;
  private String password = DEFAULT_PASSWORD;
  private String virtualHost = DEFAULT_VIRTUAL_HOST;
  private BackOffDelayPolicy recoveryDelayPolicy = DEFAULT_RECOVERY_DELAY_POLICY;
  private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
  private Duration closeTimeout = DEFAULT_CLOSE_TIMEOUT;

  @Override
  public T host(String host) {
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("Host cannot be null or blank");
    }
    this.host = host;
    return toReturn();
  }

  @Override
  public T port(int port) {
    if (port != USE_DEFAULT_PORT && (port <= 0 || port > 65535)) {
      throw new IllegalArgumentException("Port must be between 1 and 65535, or -1 to use default");
    }
    this.port = port;
    return toReturn();
  }

  @Override
  public T username(String username) {
    this.username = username;
    return toReturn();
  }

  @Override
  public T password(String password) {
    this.password = password;
    return toReturn();
  }

  @Override
  public T virtualHost(String virtualHost) {
    this.virtualHost = virtualHost;
    return toReturn();
  }

  @Override
  public T recoveryDelayPolicy(BackOffDelayPolicy policy) {
    if (policy == null) {
      throw new IllegalArgumentException("Recovery delay policy cannot be null");
    }
    this.recoveryDelayPolicy = policy;
    return toReturn();
  }

  @Override
  public T connectionTimeout(Duration timeout) {
    this.connectionTimeout = checkPositive(timeout, "Connection timeout");
    return toReturn();
  }

  @Override
  public T closeTimeout(Duration timeout) {
    this.closeTimeout = checkPositive(timeout, "Close timeout");
    return toReturn();
  }

  abstract T toReturn();

  String host() {
    return this.host;
  }

  int port() {
    return this.port;
  }

  int effectivePort() {
    return this.port == USE_DEFAULT_PORT ? ConnectionFactory.DEFAULT_AMQP_PORT : this.port;
  }

  String username() {
    return this.username;
  }

  String virtualHost() {
    return this.virtualHost;
  }

  BackOffDelayPolicy recoveryDelayPolicy() {
    return this.recoveryDelayPolicy;
  }

  Duration connectionTimeout() {
    return this.connectionTimeout;
  }

  Duration closeTimeout() {
    return this.closeTimeout;
  }

  String label() {
    return this.host + ":" + this.effectivePort();
  }

  void configure(ConnectionFactory factory) {
    factory.setHost(this.host);
    factory.setPort(this.port);
    factory.setUsername(this.username);
    factory.setPassword(this.password);
    factory.setVirtualHost(this.virtualHost);
    factory.setConnectionTimeout(Utils.toIntMillis(this.connectionTimeout));
    factory.setAutomaticRecoveryEnabled(true);
    BackOffDelayPolicy policy = this.recoveryDelayPolicy;
    factory.setRecoveryDelayHandler(attempt -> policy.delay(attempt).toMillis());
  }

  void copyTo(DefaultConnectionSettings<?> copy) {
    copy.host(this.host);
    copy.port(this.port);
    copy.username(this.username);
    copy.password(this.password);
    copy.virtualHost(this.virtualHost);
    copy.recoveryDelayPolicy(this.recoveryDelayPolicy);
    copy.connectionTimeout(this.connectionTimeout);
    copy.closeTimeout(this.closeTimeout);
  }

  private static Duration checkPositive(Duration duration, String label) {
    if (duration == null || duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException(label + " must be positive");
    }
    return duration;
  }
}
