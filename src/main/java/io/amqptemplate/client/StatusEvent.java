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

/**
 * Connectivity change notification.
 *
 * <p>Events are transient, the template does not keep any history of them.
 *
 * @see StatusListener
 */
public final class StatusEvent {

  private final Type type;
  private final String description;
  private final Throwable failureCause;

  public StatusEvent(Type type, String description) {
    this(type, description, null);
  }

  public StatusEvent(Type type, String description, Throwable failureCause) {
    this.type = type;
    this.description = description;
    this.failureCause = failureCause;
  }

  /**
   * The category of the event.
   *
   * @return event type
   */
  public Type type() {
    return this.type;
  }

  /**
   * Human-readable description of the event.
   *
   * @return description
   */
  public String description() {
    return this.description;
  }

  /**
   * The failure cause, can be null.
   *
   * @return failure cause, null if no cause for failure
   */
  public Throwable failureCause() {
    return this.failureCause;
  }

  @Override
  public String toString() {
    return this.type + ": " + this.description;
  }

  /** Event category. */
  public enum Type {
    /** The connection is established (or recovered). */
    CONNECTED,
    /** The connection could not be established. */
    CONNECTION_FAILED,
    /** The connection has been shut down, by the broker, the network, or the application. */
    CONNECTION_SHUTDOWN,
    /** The broker blocked the connection, usually because of a resource alarm. */
    CONNECTION_BLOCKED,
    /** The broker unblocked the connection. */
    CONNECTION_UNBLOCKED,
    /** An error occurred in a transport callback. */
    CALLBACK_ERROR,
    /** The publishing channel has been shut down. */
    CHANNEL_SHUTDOWN
  }
}
