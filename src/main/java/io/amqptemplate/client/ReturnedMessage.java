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

/** A mandatory message the broker could not route. */
public final class ReturnedMessage {

  private final int replyCode;
  private final String replyText;
  private final String exchange;
  private final String routingKey;
  private final byte[] body;

  public ReturnedMessage(
      int replyCode, String replyText, String exchange, String routingKey, byte[] body) {
    this.replyCode = replyCode;
    this.replyText = replyText;
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.body = body == null ? new byte[0] : Arrays.copyOf(body, body.length);
  }

  /**
   * AMQP reply code, e.g. 312 (NO_ROUTE).
   *
   * @return reply code
   */
  public int replyCode() {
    return this.replyCode;
  }

  public String replyText() {
    return this.replyText;
  }

  public String exchange() {
    return this.exchange;
  }

  public String routingKey() {
    return this.routingKey;
  }

  public byte[] body() {
    return Arrays.copyOf(this.body, this.body.length);
  }

  @Override
  public String toString() {
    return "ReturnedMessage{"
        + "replyCode="
        + replyCode
        + ", replyText='"
        + replyText
        + '\''
        + ", exchange='"
        + exchange
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + '}';
  }
}
