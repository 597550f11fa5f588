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

import static io.amqptemplate.client.StatusEvent.Type.CALLBACK_ERROR;
import static io.amqptemplate.client.StatusEvent.Type.CHANNEL_SHUTDOWN;
import static io.amqptemplate.client.StatusEvent.Type.CONNECTED;
import static io.amqptemplate.client.StatusEvent.Type.CONNECTION_BLOCKED;
import static io.amqptemplate.client.StatusEvent.Type.CONNECTION_FAILED;
import static io.amqptemplate.client.StatusEvent.Type.CONNECTION_SHUTDOWN;
import static io.amqptemplate.client.StatusEvent.Type.CONNECTION_UNBLOCKED;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;
import io.amqptemplate.client.StatusEvent;

/** Maps transport notifications to {@link StatusEvent}s. */
abstract class StatusEvents {

  static final int NO_REPLY_CODE = -1;

  private StatusEvents() {}

  static StatusEvent connected(String address) {
    return new StatusEvent(CONNECTED, "Connection established to " + address);
  }

  static StatusEvent recovered(String address) {
    return new StatusEvent(CONNECTED, "Connection recovered to " + address);
  }

  static StatusEvent connectionFailed(Throwable cause) {
    return new StatusEvent(
        CONNECTION_FAILED, "Failed to establish connection: " + message(cause), cause);
  }

  static StatusEvent connectionShutdown(ShutdownSignalException cause) {
    return new StatusEvent(CONNECTION_SHUTDOWN, "Connection Shutdown: " + describe(cause), cause);
  }

  static StatusEvent connectionBlocked(String reason) {
    return new StatusEvent(CONNECTION_BLOCKED, "Connection Blocked: " + reason);
  }

  static StatusEvent connectionUnblocked() {
    return new StatusEvent(CONNECTION_UNBLOCKED, "Connection Unblocked.");
  }

  static StatusEvent callbackError(Throwable cause) {
    return new StatusEvent(CALLBACK_ERROR, "Callback Exception: " + message(cause), cause);
  }

  static StatusEvent channelShutdown(ShutdownSignalException cause) {
    return new StatusEvent(CHANNEL_SHUTDOWN, "Channel Shutdown: " + describe(cause), cause);
  }

  static int replyCode(ShutdownSignalException sse) {
    Method reason = sse.getReason();
    if (reason instanceof AMQP.Connection.Close) {
      return ((AMQP.Connection.Close) reason).getReplyCode();
    } else if (reason instanceof AMQP.Channel.Close) {
      return ((AMQP.Channel.Close) reason).getReplyCode();
    } else {
      return NO_REPLY_CODE;
    }
  }

  static String replyText(ShutdownSignalException sse) {
    Method reason = sse.getReason();
    if (reason instanceof AMQP.Connection.Close) {
      return ((AMQP.Connection.Close) reason).getReplyText();
    } else if (reason instanceof AMQP.Channel.Close) {
      return ((AMQP.Channel.Close) reason).getReplyText();
    } else if (sse.getCause() != null) {
      return message(sse.getCause());
    } else {
      return sse.getMessage();
    }
  }

  // <reply text> (<initiator>[, code <reply code>])
  static String describe(ShutdownSignalException sse) {
    String initiator;
    if (sse.isInitiatedByApplication()) {
      initiator = "application";
    } else if (sse.getReason() != null) {
      initiator = "broker";
    } else {
      initiator = "library";
    }
    int replyCode = replyCode(sse);
    StringBuilder builder = new StringBuilder(replyText(sse)).append(" (").append(initiator);
    if (replyCode != NO_REPLY_CODE) {
      builder.append(", code ").append(replyCode);
    }
    return builder.append(")").toString();
  }

  private static String message(Throwable throwable) {
    if (throwable == null) {
      return "<no cause>";
    }
    return throwable.getMessage() == null
        ? throwable.getClass().getSimpleName()
        : throwable.getMessage();
  }
}
