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

import io.amqptemplate.client.metrics.MetricsCollector;

/** Builder for {@link AmqpTemplate} instances. */
public interface AmqpTemplateBuilder extends ConnectionSettings<AmqpTemplateBuilder> {

  /**
   * Client-provided name of the connection, visible in the broker management UI.
   *
   * @param name connection name
   * @return this builder instance
   */
  AmqpTemplateBuilder name(String name);

  /**
   * Add {@link StatusListener}s to the template.
   *
   * <p>Listeners registered here see the events of the initialization triggered at creation time.
   *
   * @param listeners
   * @return this builder instance
   */
  AmqpTemplateBuilder listeners(StatusListener... listeners);

  /**
   * Callback for mandatory messages the broker could not route.
   *
   * <p>Returned messages are logged if no listener is set.
   *
   * @param returnListener
   * @return this builder instance
   */
  AmqpTemplateBuilder returnListener(ReturnListener returnListener);

  /**
   * Callback to declare broker-side resources after each successful (re-)initialization.
   *
   * @param initializer
   * @return this builder instance
   */
  AmqpTemplateBuilder infrastructureInitializer(Infrastructure.Initializer initializer);

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector metrics collector
   * @return this builder instance
   * @see io.amqptemplate.client.metrics.MicrometerMetricsCollector
   */
  AmqpTemplateBuilder metricsCollector(MetricsCollector metricsCollector);

  /**
   * Create the template instance and start its initialization.
   *
   * @return the configured template
   */
  AmqpTemplate build();
}
