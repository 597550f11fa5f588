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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

public class BackOffDelayPolicyTest {

  @Test
  void fixed() {
    BackOffDelayPolicy policy = BackOffDelayPolicy.fixed(Duration.ofSeconds(5));
    assertThat(policy.delay(0)).isEqualTo(Duration.ofSeconds(5));
    assertThat(policy.delay(1)).isEqualTo(Duration.ofSeconds(5));
    assertThat(policy.delay(100)).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  void fixedWithInitialDelay() {
    BackOffDelayPolicy policy =
        BackOffDelayPolicy.fixedWithInitialDelay(Duration.ZERO, Duration.ofSeconds(2));
    assertThat(policy.delay(0)).isEqualTo(Duration.ZERO);
    assertThat(policy.delay(1)).isEqualTo(Duration.ofSeconds(2));
    assertThat(policy.delay(2)).isEqualTo(Duration.ofSeconds(2));
  }

  @Test
  void invalidDelaysShouldThrow() {
    assertThatThrownBy(() -> BackOffDelayPolicy.fixed(null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> BackOffDelayPolicy.fixed(Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
