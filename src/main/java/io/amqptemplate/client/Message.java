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

import java.util.Arrays;

/**
 * Immutable outbound message.
 *
 * <p>Messages are always persistent (delivery mode 2).
 */
public final class Message {

  private final String exchange;
  private final String routingKey;
  private final byte[] body;
  private final boolean mandatory;

  private Message(String exchange, String routingKey, byte[] body, boolean mandatory) {
    if (exchange == null) {
      throw new IllegalArgumentException("Exchange cannot be null");
    }
    if (routingKey == null) {
      throw new IllegalArgumentException("Routing key cannot be null");
    }
    if (body == null) {
      throw new IllegalArgumentException("Body cannot be null");
    }
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.body = Arrays.copyOf(body, body.length);
    this.mandatory = mandatory;
  }

  /**
   * Create a non-mandatory message.
   *
   * @param exchange exchange name, the empty string for the default exchange
   * @param routingKey routing key
   * @param body body
   * @return the message
   */
  public static Message of(String exchange, String routingKey, byte[] body) {
    return new Message(exchange, routingKey, body, false);
  }

  /**
   * Create a message.
   *
   * @param exchange exchange name, the empty string for the default exchange
   * @param routingKey routing key
   * @param body body
   * @param mandatory mandatory flag
   * @return the message
   */
  public static Message of(String exchange, String routingKey, byte[] body, boolean mandatory) {
    return new Message(exchange, routingKey, body, mandatory);
  }

  public String exchange() {
    return this.exchange;
  }

  public String routingKey() {
    return this.routingKey;
  }

  /**
   * A copy of the body.
   *
   * @return body
   */
  public byte[] body() {
    return Arrays.copyOf(this.body, this.body.length);
  }

  public boolean persistent() {
    return true;
  }

  public boolean mandatory() {
    return this.mandatory;
  }

  @Override
  public String toString() {
    return "Message{"
        + "exchange='"
        + exchange
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + ", bodySize="
        + body.length
        + ", mandatory="
        + mandatory
        + '}';
  }
}
