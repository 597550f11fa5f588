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

import io.amqptemplate.client.StatusEvent;
import io.amqptemplate.client.StatusListener;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Broadcasts {@link StatusEvent}s to the registered listeners, in registration order. */
class StatusEventSupport {

  private static final Logger LOGGER = LoggerFactory.getLogger(StatusEventSupport.class);

  private final List<StatusListener> listeners;

  StatusEventSupport(List<StatusListener> listeners) {
    this.listeners = new CopyOnWriteArrayList<>(listeners);
  }

  void subscribe(StatusListener listener) {
    if (listener == null) {
      throw new IllegalArgumentException("Status listener cannot be null");
    }
    this.listeners.add(listener);
  }

  void dispatch(StatusEvent event) {
    LOGGER.debug("Dispatching status event '{}' to {} listener(s)", event, this.listeners.size());
    this.listeners.forEach(
        l -> {
          try {
            l.handle(event);
          } catch (Exception e) {
            LOGGER.warn("Error in status listener", e);
          }
        });
  }
}
