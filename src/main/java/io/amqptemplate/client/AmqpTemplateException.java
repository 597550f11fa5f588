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

public class AmqpTemplateException extends RuntimeException {

  public AmqpTemplateException(Throwable cause) {
    super(cause);
  }

  public AmqpTemplateException(String format, Object... args) {
    super(String.format(format, args));
  }

  public AmqpTemplateException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * The connection could not be established.
   *
   * <p>Reported with {@link StatusEvent}s, never thrown to callers of {@link
   * AmqpTemplate#send(String, String, byte[])}.
   */
  public static class ConnectionInitException extends AmqpTemplateException {

    public ConnectionInitException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** No open channel after a re-initialization attempt. */
  public static class ChannelUnavailableException extends AmqpTemplateException {

    public ChannelUnavailableException(String format, Object... args) {
      super(format, args);
    }

    public ChannelUnavailableException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The transport did not accept a given message. */
  public static class PublishFailedException extends AmqpTemplateException {

    public PublishFailedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class ClientDisposedException extends AmqpTemplateException {

    public ClientDisposedException(String message) {
      super(message);
    }
  }
}
