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

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.ShutdownSignalException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  /**
   * Whether the exception, or one of its causes, indicates the connection or channel was already
   * closed.
   */
  static boolean alreadyClosed(Throwable e) {
    Throwable current = e;
    while (current != null) {
      if (current instanceof AlreadyClosedException) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return false;
  }

  /**
   * Whether the shutdown signal is a clean close initiated by the application, as opposed to a
   * broker error or a network failure.
   */
  static boolean cleanClose(ShutdownSignalException signal) {
    return signal.isInitiatedByApplication();
  }

  static String reason(ShutdownSignalException signal) {
    if (signal.getReason() == null) {
      return signal.getMessage();
    } else {
      return signal.getReason().protocolMethodName() + " " + signal.getMessage();
    }
  }
}
