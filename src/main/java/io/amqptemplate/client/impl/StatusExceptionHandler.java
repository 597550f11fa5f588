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
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.impl.ForgivingExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport exception handler that reports callback errors as status events.
 *
 * <p>Errors are not fatal: the default behavior of {@link ForgivingExceptionHandler} is kept.
 */
class StatusExceptionHandler extends ForgivingExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(StatusExceptionHandler.class);

  private final StatusEventSupport statusEventSupport;

  StatusExceptionHandler(StatusEventSupport statusEventSupport) {
    this.statusEventSupport = statusEventSupport;
  }

  @Override
  public void handleUnexpectedConnectionDriverException(Connection conn, Throwable exception) {
    super.handleUnexpectedConnectionDriverException(conn, exception);
    this.report("connection driver", exception);
  }

  @Override
  public void handleReturnListenerException(Channel channel, Throwable exception) {
    super.handleReturnListenerException(channel, exception);
    this.report("return listener", exception);
  }

  @Override
  public void handleBlockedListenerException(Connection connection, Throwable exception) {
    super.handleBlockedListenerException(connection, exception);
    this.report("blocked listener", exception);
  }

  @Override
  public void handleConnectionRecoveryException(Connection conn, Throwable exception) {
    super.handleConnectionRecoveryException(conn, exception);
    this.report("connection recovery", exception);
  }

  @Override
  public void handleChannelRecoveryException(Channel ch, Throwable exception) {
    super.handleChannelRecoveryException(ch, exception);
    this.report("channel recovery", exception);
  }

  private void report(String source, Throwable exception) {
    LOGGER.warn("Callback Exception occurred in {}: {}", source, exception.getMessage());
    this.statusEventSupport.dispatch(StatusEvents.callbackError(exception));
  }
}
