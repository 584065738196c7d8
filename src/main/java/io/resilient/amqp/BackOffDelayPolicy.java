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
package io.resilient.amqp;

import java.time.Duration;

/**
 * Contract to determine a delay between attempts of some task.
 *
 * <p>The task is typically the creation of a connection.
 */
public interface BackOffDelayPolicy {

  Duration TIMEOUT = Duration.ofMillis(Long.MAX_VALUE);

  /**
   * Returns the delay to use after a given failed attempt.
   *
   * <p>The policy can return the TIMEOUT constant to indicate that the task should stop being
   * retried.
   *
   * @param attempt number of the attempt that just failed, starting at 1
   * @return the delay, TIMEOUT if the task should stop being retried
   */
  Duration delay(int attempt);

  /**
   * Policy with a fixed delay.
   *
   * @param delay the fixed delay
   * @return fixed-delay policy
   */
  static BackOffDelayPolicy fixed(Duration delay) {
    return exponential(delay, 1.0, null);
  }

  /**
   * Policy with a delay growing geometrically: <code>interval * backoff^(attempt - 1)</code>,
   * capped by <code>maxInterval</code> if set.
   *
   * @param interval delay after the first failed attempt
   * @param backoff multiplier applied for each further attempt, must be greater or equal to 1
   * @param maxInterval upper bound of the delay, can be null
   * @return exponential back-off policy
   */
  static BackOffDelayPolicy exponential(Duration interval, double backoff, Duration maxInterval) {
    return new ExponentialBackOffPolicy(interval, backoff, maxInterval);
  }

  /**
   * Wraps a policy to stop retrying once a number of attempts is reached.
   *
   * @param delegate policy providing the delays
   * @param maxAttempts total number of attempts
   * @return policy with a limited number of attempts
   */
  static BackOffDelayPolicy limited(BackOffDelayPolicy delegate, int maxAttempts) {
    return new LimitedAttemptsBackOffPolicy(delegate, maxAttempts);
  }

  final class ExponentialBackOffPolicy implements BackOffDelayPolicy {

    private static final long MAX_DELAY_MS = Long.MAX_VALUE / 2;

    private final Duration interval;
    private final double backoff;
    private final Duration maxInterval;

    private ExponentialBackOffPolicy(Duration interval, double backoff, Duration maxInterval) {
      this.interval = interval;
      this.backoff = backoff;
      this.maxInterval = maxInterval;
    }

    @Override
    public Duration delay(int attempt) {
      double millis = this.interval.toMillis() * Math.pow(this.backoff, Math.max(0, attempt - 1));
      if (this.maxInterval != null && millis > this.maxInterval.toMillis()) {
        return this.maxInterval;
      }
      // must stay below TIMEOUT, even when the computation overflows
      if (millis >= MAX_DELAY_MS) {
        return Duration.ofMillis(MAX_DELAY_MS);
      }
      return Duration.ofMillis((long) millis);
    }

    @Override
    public String toString() {
      return "ExponentialBackOffPolicy{"
          + "interval="
          + interval
          + ", backoff="
          + backoff
          + ", maxInterval="
          + maxInterval
          + '}';
    }
  }

  final class LimitedAttemptsBackOffPolicy implements BackOffDelayPolicy {

    private final BackOffDelayPolicy delegate;
    private final int maxAttempts;

    private LimitedAttemptsBackOffPolicy(BackOffDelayPolicy delegate, int maxAttempts) {
      this.delegate = delegate;
      this.maxAttempts = maxAttempts;
    }

    @Override
    public Duration delay(int attempt) {
      if (attempt >= this.maxAttempts) {
        return TIMEOUT;
      } else {
        return this.delegate.delay(attempt);
      }
    }

    @Override
    public String toString() {
      return "LimitedAttemptsBackOffPolicy{"
          + "delegate="
          + delegate
          + ", maxAttempts="
          + maxAttempts
          + '}';
    }
  }
}
