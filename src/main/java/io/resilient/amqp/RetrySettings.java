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
 * Retry settings for the creation of connections.
 *
 * <p>After a failed attempt the next one starts after <code>
 * min(interval * backoff^(attempt - 1), maxInterval)</code>.
 *
 * <p>Instances are immutable, use {@link #builder()} to create them.
 */
public final class RetrySettings {

  /** Value of {@link #maxTries()} to retry forever. */
  public static final int UNLIMITED = -1;

  private static final RetrySettings DEFAULT = builder().build();

  private final int maxTries;
  private final Duration interval;
  private final double backoff;
  private final Duration maxInterval;

  private RetrySettings(Builder builder) {
    this.maxTries = builder.maxTries;
    this.interval = builder.interval;
    this.backoff = builder.backoff;
    this.maxInterval = builder.maxInterval;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Settings with default values: unlimited tries, 1 second interval, no back-off, no cap.
   *
   * @return default settings
   */
  public static RetrySettings defaults() {
    return DEFAULT;
  }

  public int maxTries() {
    return this.maxTries;
  }

  public Duration interval() {
    return this.interval;
  }

  public double backoff() {
    return this.backoff;
  }

  /**
   * Upper bound of the delay between attempts.
   *
   * @return the cap, null if none
   */
  public Duration maxInterval() {
    return this.maxInterval;
  }

  /**
   * The delay policy corresponding to these settings.
   *
   * <p>A {@link #maxTries()} of 0 or 1 makes a single attempt.
   *
   * @return delay policy
   */
  public BackOffDelayPolicy delayPolicy() {
    BackOffDelayPolicy policy =
        BackOffDelayPolicy.exponential(this.interval, this.backoff, this.maxInterval);
    if (this.maxTries == UNLIMITED) {
      return policy;
    } else {
      return BackOffDelayPolicy.limited(policy, this.maxTries);
    }
  }

  @Override
  public String toString() {
    return "RetrySettings{"
        + "maxTries="
        + maxTries
        + ", interval="
        + interval
        + ", backoff="
        + backoff
        + ", maxInterval="
        + maxInterval
        + '}';
  }

  public static final class Builder {

    private int maxTries = UNLIMITED;
    private Duration interval = Duration.ofSeconds(1);
    private double backoff = 1.0;
    private Duration maxInterval;

    private Builder() {}

    /**
     * Total number of attempts, {@link #UNLIMITED} (the default) to retry forever.
     *
     * <p>0 does not mean unlimited: like 1, it makes a single attempt without retrying.
     *
     * @param maxTries number of attempts
     * @return this builder instance
     */
    public Builder maxTries(int maxTries) {
      this.maxTries = maxTries;
      return this;
    }

    /**
     * Delay after the first failed attempt. Default is 1 second.
     *
     * @param interval delay
     * @return this builder instance
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Multiplier applied to the delay after each failed attempt. Default is 1 (fixed delay).
     *
     * @param backoff multiplier
     * @return this builder instance
     */
    public Builder backoff(double backoff) {
      this.backoff = backoff;
      return this;
    }

    public Builder maxInterval(Duration maxInterval) {
      this.maxInterval = maxInterval;
      return this;
    }

    public RetrySettings build() {
      if (this.maxTries < UNLIMITED) {
        throw new IllegalArgumentException(
            "Max tries must be -1 (unlimited) or positive: " + this.maxTries);
      }
      if (this.interval == null || this.interval.isNegative()) {
        throw new IllegalArgumentException("Interval must be set and positive: " + this.interval);
      }
      if (Double.isNaN(this.backoff) || Double.isInfinite(this.backoff) || this.backoff < 1.0) {
        throw new IllegalArgumentException(
            "Back-off must be a finite number greater or equal to 1: " + this.backoff);
      }
      if (this.maxInterval != null && this.maxInterval.isNegative()) {
        throw new IllegalArgumentException("Max interval must be positive: " + this.maxInterval);
      }
      return new RetrySettings(this);
    }
  }
}
