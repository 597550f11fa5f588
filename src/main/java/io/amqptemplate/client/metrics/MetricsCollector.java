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
package io.amqptemplate.client.metrics;

/** Interface to collect execution data of the client. */
public interface MetricsCollector {

  /** Called when a new connection is opened. */
  void openConnection();

  /** Called when a connection is closed or replaced. */
  void closeConnection();

  /** Called when a message is handed to the transport. */
  void publish();

  /** Called when the transport rejects a message. */
  void publishFailure();

  /** Called when the broker returns an unroutable mandatory message. */
  void publishReturned();

  /** Called when a publish triggers a re-initialization of the connection or channel. */
  void reinitialization();
}
