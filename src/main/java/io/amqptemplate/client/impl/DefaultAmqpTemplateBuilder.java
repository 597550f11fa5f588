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
import io.amqptemplate.client.AmqpTemplate;
import io.amqptemplate.client.AmqpTemplateBuilder;
import io.amqptemplate.client.BackOffDelayPolicy;
import io.amqptemplate.client.Infrastructure;
import io.amqptemplate.client.ReturnListener;
import io.amqptemplate.client.StatusListener;
import io.amqptemplate.client.metrics.MetricsCollector;
import io.amqptemplate.client.metrics.NoOpMetricsCollector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Entry point to create {@link AmqpTemplate} instances.
 *
 * <pre>{@code
 * AmqpTemplate template = new DefaultAmqpTemplateBuilder()
 *     .host("localhost")
 *     .listeners(event -> System.out.println(event.description()))
 *     .build();
 * template.send("my-exchange", "my-key", "hello".getBytes(StandardCharsets.UTF_8));
 * }</pre>
 */
public class DefaultAmqpTemplateBuilder implements AmqpTemplateBuilder {

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private final DefaultConnectionSettings<AmqpTemplateBuilder> connectionSettings =
      new DefaultConnectionSettings<>() {
        @Override
        AmqpTemplateBuilder toReturn() {
          return DefaultAmqpTemplateBuilder.this;
        }
      };
  private final List<StatusListener> listeners = new ArrayList<>();
  private String name;
  private ReturnListener returnListener;
  private Infrastructure.Initializer infrastructureInitializer;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private Supplier<ConnectionFactory> connectionFactorySupplier = ConnectionFactory::new;

  @Override
  public AmqpTemplateBuilder host(String host) {
    return this.connectionSettings.host(host);
  }

  @Override
  public AmqpTemplateBuilder port(int port) {
    return this.connectionSettings.port(port);
  }

  @Override
  public AmqpTemplateBuilder username(String username) {
    return this.connectionSettings.username(username);
  }

  @Override
  public AmqpTemplateBuilder password(String password) {
    return this.connectionSettings.password(password);
  }

  @Override
  public AmqpTemplateBuilder virtualHost(String virtualHost) {
    return this.connectionSettings.virtualHost(virtualHost);
  }

  @Override
  public AmqpTemplateBuilder recoveryDelayPolicy(BackOffDelayPolicy policy) {
    return this.connectionSettings.recoveryDelayPolicy(policy);
  }

  @Override
  public AmqpTemplateBuilder connectionTimeout(Duration timeout) {
    return this.connectionSettings.connectionTimeout(timeout);
  }

  @Override
  public AmqpTemplateBuilder closeTimeout(Duration timeout) {
    return this.connectionSettings.closeTimeout(timeout);
  }

  @Override
  public AmqpTemplateBuilder name(String name) {
    this.name = name;
    return this;
  }

  @Override
  public AmqpTemplateBuilder listeners(StatusListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public AmqpTemplateBuilder returnListener(ReturnListener returnListener) {
    this.returnListener = returnListener;
    return this;
  }

  @Override
  public AmqpTemplateBuilder infrastructureInitializer(Infrastructure.Initializer initializer) {
    this.infrastructureInitializer = initializer;
    return this;
  }

  @Override
  public AmqpTemplateBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  DefaultAmqpTemplateBuilder connectionFactory(Supplier<ConnectionFactory> supplier) {
    this.connectionFactorySupplier = supplier;
    return this;
  }

  @Override
  public AmqpTemplate build() {
    // settings are copied, changes to the builder do not affect created templates
    DefaultConnectionSettings<Void> settings =
        new DefaultConnectionSettings<>() {
          @Override
          Void toReturn() {
            return null;
          }
        };
    this.connectionSettings.copyTo(settings);
    String templateName =
        this.name == null ? "amqp-template-" + ID_SEQUENCE.getAndIncrement() : this.name;
    LifecycleManager lifecycleManager =
        new AmqpLifecycleManager(
            this.connectionFactorySupplier.get(),
            settings,
            templateName,
            List.copyOf(this.listeners),
            this.returnListener,
            this.infrastructureInitializer,
            this.metricsCollector);
    return new DefaultAmqpTemplate(lifecycleManager, this.metricsCollector);
  }
}
