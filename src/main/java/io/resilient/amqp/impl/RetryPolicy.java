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
package io.resilient.amqp.impl;

import static java.lang.String.format;

import io.resilient.amqp.BackOffDelayPolicy;
import io.resilient.amqp.RetrySettings;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls an operation until it succeeds or the delay policy says to stop.
 *
 * <p>The last exception of the operation is rethrown as is when the policy gives up.
 */
final class RetryPolicy {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);

  private static final long MAX_WAIT_SLICE_MS = 100;

  private final BackOffDelayPolicy delayPolicy;
  private final Predicate<Exception> retryCondition;
  private final BooleanSupplier keepTrying;

  RetryPolicy(BackOffDelayPolicy delayPolicy) {
    this(delayPolicy, e -> true, () -> true);
  }

  RetryPolicy(
      BackOffDelayPolicy delayPolicy,
      Predicate<Exception> retryCondition,
      BooleanSupplier keepTrying) {
    this.delayPolicy = delayPolicy;
    this.retryCondition = retryCondition;
    this.keepTrying = keepTrying;
  }

  static RetryPolicy retryPolicy(RetrySettings settings, BooleanSupplier keepTrying) {
    return new RetryPolicy(settings.delayPolicy(), e -> true, keepTrying);
  }

  <T> T call(Callable<T> operation, String format, Object... args) throws Exception {
    String description = format(format, args);
    int attempt = 0;
    long startTime = System.nanoTime();
    while (true) {
      attempt++;
      try {
        LOGGER.debug("Starting attempt #{} for operation '{}'", attempt, description);
        T result = operation.call();
        Duration operationDuration = Duration.ofNanos(System.nanoTime() - startTime);
        LOGGER.debug(
            "Operation '{}' completed in {} ms after {} attempt(s)",
            description,
            operationDuration.toMillis(),
            attempt);
        return result;
      } catch (Exception e) {
        if (!this.retryCondition.test(e) || !this.keepTrying.getAsBoolean()) {
          LOGGER.debug(
              "Operation '{}' failed and cannot be retried (reason: {})",
              description,
              exceptionMessage(e));
          throw e;
        }
        Duration delay = this.delayPolicy.delay(attempt);
        if (BackOffDelayPolicy.TIMEOUT.equals(delay)) {
          LOGGER.debug(
              "Could not complete task '{}' after {} attempt(s) (reason: {})",
              description,
              attempt,
              exceptionMessage(e));
          throw e;
        }
        LOGGER.warn(
            "Attempt #{} for operation '{}' failed (reason: {}), retrying in {} ms",
            attempt,
            description,
            exceptionMessage(e),
            delay.toMillis());
        if (!waitFor(delay)) {
          LOGGER.debug("Stopped retrying operation '{}' after {} attempt(s)", description, attempt);
          throw e;
        }
      }
    }
  }

  // sleeps in slices to give up quickly when the owner stops
  private boolean waitFor(Duration delay) {
    long delayInNanos = TimeUnit.MILLISECONDS.toNanos(delay.toMillis());
    long start = System.nanoTime();
    try {
      long elapsed = 0;
      while (elapsed < delayInNanos) {
        if (!this.keepTrying.getAsBoolean()) {
          return false;
        }
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(delayInNanos - elapsed) + 1;
        Thread.sleep(Math.min(remainingMs, MAX_WAIT_SLICE_MS));
        elapsed = System.nanoTime() - start;
      }
      return this.keepTrying.getAsBoolean();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  static String exceptionMessage(Exception e) {
    if (e == null) {
      return "unknown";
    } else if (e.getMessage() == null) {
      return e.getClass().getSimpleName();
    } else {
      return e.getMessage() + " [" + e.getClass().getSimpleName() + "]";
    }
  }
}
