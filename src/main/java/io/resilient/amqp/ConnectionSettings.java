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
 * Broker address, credentials and retry settings used to create connections.
 *
 * <p>Instances are immutable, use {@link #builder()} to create them.
 */
public final class ConnectionSettings {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5672;
  public static final String DEFAULT_VIRTUAL_HOST = "/";
  public static final String DEFAULT_USERNAME = "guest";
  public static final String DEFAULT_PASSWORD = "guest";

  private final String host;
  private final int port;
  private final String virtualHost;
  private final String username;
  private final String password;
  private final String connectionName;
  private final Duration connectionTimeout;
  private final RetrySettings retry;
  private final boolean recoverAfterCleanClose;

  private ConnectionSettings(Builder builder) {
    this.host = builder.host;
    this.port = builder.port;
    this.virtualHost = builder.virtualHost;
    this.username = builder.username;
    this.password = builder.password;
    this.connectionName = builder.connectionName;
    this.connectionTimeout = builder.connectionTimeout;
    this.retry = builder.retry;
    this.recoverAfterCleanClose = builder.recoverAfterCleanClose;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String host() {
    return this.host;
  }

  public int port() {
    return this.port;
  }

  public String virtualHost() {
    return this.virtualHost;
  }

  public String username() {
    return this.username;
  }

  public String password() {
    return this.password;
  }

  public String connectionName() {
    return this.connectionName;
  }

  public Duration connectionTimeout() {
    return this.connectionTimeout;
  }

  public RetrySettings retry() {
    return this.retry;
  }

  public boolean recoverAfterCleanClose() {
    return this.recoverAfterCleanClose;
  }

  /**
   * URI of the broker, without the password.
   *
   * @return the URI, for logging
   */
  public String uri() {
    String vhost = DEFAULT_VIRTUAL_HOST.equals(this.virtualHost) ? "%2F" : this.virtualHost;
    return String.format("amqp://%s@%s:%d/%s", this.username, this.host, this.port, vhost);
  }

  @Override
  public String toString() {
    return "ConnectionSettings{"
        + "uri="
        + uri()
        + ", connectionName='"
        + connectionName
        + '\''
        + ", connectionTimeout="
        + connectionTimeout
        + ", retry="
        + retry
        + ", recoverAfterCleanClose="
        + recoverAfterCleanClose
        + '}';
  }

  public static final class Builder {

    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private String virtualHost = DEFAULT_VIRTUAL_HOST;
    private String username = DEFAULT_USERNAME;
    private String password = DEFAULT_PASSWORD;
    private String connectionName = "resilient-amqp";
    private Duration connectionTimeout = Duration.ofSeconds(60);
    private RetrySettings retry = RetrySettings.defaults();
    private boolean recoverAfterCleanClose = false;

    private Builder() {}

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder virtualHost(String virtualHost) {
      this.virtualHost = virtualHost;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    /**
     * Prefix of the client-provided name of connections, visible in the management UI.
     *
     * @param connectionName name prefix
     * @return this builder instance
     */
    public Builder connectionName(String connectionName) {
      this.connectionName = connectionName;
      return this;
    }

    /**
     * TCP connection timeout of the broker client. Default is 60 seconds.
     *
     * @param connectionTimeout timeout
     * @return this builder instance
     */
    public Builder connectionTimeout(Duration connectionTimeout) {
      this.connectionTimeout = connectionTimeout;
      return this;
    }

    public Builder retry(RetrySettings retry) {
      this.retry = retry;
      return this;
    }

    /**
     * Whether a close initiated by the application (e.g. a management operation using the same
     * connection) is treated as a failure and triggers recovery.
     *
     * <p>Default is false: such a close is terminal.
     *
     * @param recoverAfterCleanClose true to recover after a clean close
     * @return this builder instance
     */
    public Builder recoverAfterCleanClose(boolean recoverAfterCleanClose) {
      this.recoverAfterCleanClose = recoverAfterCleanClose;
      return this;
    }

    public ConnectionSettings build() {
      if (this.host == null || this.host.isBlank()) {
        throw new IllegalArgumentException("Host must be set");
      }
      if (this.port <= 0 || this.port > 65535) {
        throw new IllegalArgumentException("Invalid port: " + this.port);
      }
      if (this.virtualHost == null) {
        throw new IllegalArgumentException("Virtual host must be set");
      }
      if (this.retry == null) {
        throw new IllegalArgumentException("Retry settings must be set");
      }
      if (this.connectionTimeout == null || this.connectionTimeout.isNegative()) {
        throw new IllegalArgumentException("Invalid connection timeout: " + this.connectionTimeout);
      }
      return new ConnectionSettings(this);
    }
  }
}
