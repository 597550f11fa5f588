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

import java.time.Duration;

/**
 * Contract to determine a delay between connection recovery attempts.
 *
 * @see ConnectionSettings#recoveryDelayPolicy(BackOffDelayPolicy)
 */
public interface BackOffDelayPolicy {

  /**
   * Returns the delay to use for a given attempt.
   *
   * @param recoveryAttempt number of the recovery attempt
   * @return the delay
   */
  Duration delay(int recoveryAttempt);

  /**
   * Policy with a fixed delay.
   *
   * @param delay the fixed delay
   * @return fixed-delay policy
   */
  static BackOffDelayPolicy fixed(Duration delay) {
    return new FixedWithInitialDelayBackOffPolicy(delay, delay);
  }

  /**
   * Policy with an initial delay for the first attempt, then a fixed delay.
   *
   * @param initialDelay delay for the first attempt
   * @param delay delay for other attempts than the first one
   * @return fixed-delay policy with initial delay
   */
  static BackOffDelayPolicy fixedWithInitialDelay(Duration initialDelay, Duration delay) {
    return new FixedWithInitialDelayBackOffPolicy(initialDelay, delay);
  }

  final class FixedWithInitialDelayBackOffPolicy implements BackOffDelayPolicy {

    private final Duration initialDelay;
    private final Duration delay;

    private FixedWithInitialDelayBackOffPolicy(Duration initialDelay, Duration delay) {
      if (initialDelay == null || delay == null) {
        throw new IllegalArgumentException("Delays cannot be null");
      }
      if (initialDelay.isNegative() || delay.isNegative()) {
        throw new IllegalArgumentException("Delays cannot be negative");
      }
      this.initialDelay = initialDelay;
      this.delay = delay;
    }

    @Override
    public Duration delay(int recoveryAttempt) {
      return recoveryAttempt == 0 ? initialDelay : delay;
    }

    @Override
    public String toString() {
      return "FixedWithInitialDelayBackOffPolicy{"
          + "initialDelay="
          + initialDelay
          + ", delay="
          + delay
          + '}';
    }
  }
}
