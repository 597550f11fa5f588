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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rabbitmq.client.ConnectionFactory;
import io.amqptemplate.client.BackOffDelayPolicy;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class DefaultConnectionSettingsTest {

  DefaultConnectionSettings<Void> settings;

  @BeforeEach
  void init() {
    settings =
        new DefaultConnectionSettings<>() {
          @Override
          Void toReturn() {
            return null;
          }
        };
  }

  @Test
  void defaults() {
    assertThat(settings.host()).isEqualTo("localhost");
    assertThat(settings.port()).isEqualTo(-1);
    assertThat(settings.effectivePort()).isEqualTo(5672);
    assertThat(settings.username()).isEqualTo("guest");
    assertThat(settings.virtualHost()).isEqualTo("/");
    assertThat(settings.connectionTimeout()).isEqualTo(Duration.ofSeconds(60));
    assertThat(settings.closeTimeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(settings.recoveryDelayPolicy().delay(0)).isEqualTo(Duration.ofSeconds(5));
    assertThat(settings.recoveryDelayPolicy().delay(10)).isEqualTo(Duration.ofSeconds(5));
    assertThat(settings.label()).isEqualTo("localhost:5672");
  }

  @Test
  void configureAppliesSettingsToFactory() {
    settings.host("rabbitmq.example.com");
    settings.port(5673);
    settings.username("publisher");
    settings.password("secret");
    settings.virtualHost("orders");
    settings.connectionTimeout(Duration.ofSeconds(3));
    settings.recoveryDelayPolicy(
        BackOffDelayPolicy.fixedWithInitialDelay(Duration.ofMillis(100), Duration.ofSeconds(2)));

    ConnectionFactory factory = new ConnectionFactory();
    settings.configure(factory);

    assertThat(factory.getHost()).isEqualTo("rabbitmq.example.com");
    assertThat(factory.getPort()).isEqualTo(5673);
    assertThat(factory.getUsername()).isEqualTo("publisher");
    assertThat(factory.getPassword()).isEqualTo("secret");
    assertThat(factory.getVirtualHost()).isEqualTo("orders");
    assertThat(factory.getConnectionTimeout()).isEqualTo(3000);
    assertThat(factory.isAutomaticRecoveryEnabled()).isTrue();
    assertThat(factory.getRecoveryDelayHandler().getDelay(0)).isEqualTo(100);
    assertThat(factory.getRecoveryDelayHandler().getDelay(1)).isEqualTo(2000);
  }

  @Test
  void defaultRecoveryDelayIsFiveSeconds() {
    ConnectionFactory factory = new ConnectionFactory();
    settings.configure(factory);
    assertThat(factory.getRecoveryDelayHandler().getDelay(0)).isEqualTo(5000);
    assertThat(factory.getRecoveryDelayHandler().getDelay(3)).isEqualTo(5000);
  }

  @ParameterizedTest
  @ValueSource(ints = {0, -2, 65536})
  void invalidPortShouldThrow(int port) {
    assertThatThrownBy(() -> settings.port(port)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void invalidValuesShouldThrow() {
    assertThatThrownBy(() -> settings.host(null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> settings.host(" ")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> settings.connectionTimeout(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> settings.closeTimeout(Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> settings.recoveryDelayPolicy(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void copyToCopiesAllSettings() {
    settings.host("rabbitmq.example.com");
    settings.port(5673);
    settings.virtualHost("orders");
    settings.closeTimeout(Duration.ofSeconds(1));
    DefaultConnectionSettings<Void> copy =
        new DefaultConnectionSettings<>() {
          @Override
          Void toReturn() {
            return null;
          }
        };
    settings.copyTo(copy);

    assertThat(copy.label()).isEqualTo("rabbitmq.example.com:5673");
    assertThat(copy.virtualHost()).isEqualTo("orders");
    assertThat(copy.closeTimeout()).isEqualTo(Duration.ofSeconds(1));
    assertThat(copy.recoveryDelayPolicy()).isSameAs(settings.recoveryDelayPolicy());
  }
}
