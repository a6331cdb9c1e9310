/*

 Copyright 2004-2015, Martian Software, Inc.

 Licensed under the Apache License, Version 2.0 (the "License");
 you may not use this file except in compliance with the License.
 You may obtain a copy of the License at

 http://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing, software
 distributed under the License is distributed on an "AS IS" BASIS,
 WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 See the License for the specific language governing permissions and
 limitations under the License.

 */
package com.martiansoftware.pipelistener;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Immutable settings for a {@link NamedPipeConnectionListener}.
 *
 * <p>Instances are built with {@link #builder()} or read from
 * {@code pipelistener.*} properties via {@link #fromProperties(Properties)}.
 */
public final class NamedPipeTransportOptions {
  public static final String PROPERTY_PREFIX = "pipelistener.";
  public static final String DEFAULT_RESOURCE = "pipelistener.properties";

  static final int MAX_DEFAULT_PARALLELISM = 16;
  static final long DEFAULT_MAX_READ_BUFFER_SIZE = 1024 * 1024;
  static final long DEFAULT_MAX_WRITE_BUFFER_SIZE = 64 * 1024;

  private final int listenerParallelism;
  private final long maxReadBufferSize;
  private final long maxWriteBufferSize;
  private final boolean restrictToCurrentUser;
  private final String accessControlDescriptor;
  private final int maxRetainedHandles;
  private final int maxConsecutiveConnectFailures;
  private final long connectRetryDelayMillis;

  private NamedPipeTransportOptions(Builder builder) {
    this.listenerParallelism = builder.listenerParallelism;
    this.maxReadBufferSize = builder.maxReadBufferSize;
    this.maxWriteBufferSize = builder.maxWriteBufferSize;
    this.restrictToCurrentUser = builder.restrictToCurrentUser;
    this.accessControlDescriptor = builder.accessControlDescriptor;
    this.maxRetainedHandles = builder.maxRetainedHandles;
    this.maxConsecutiveConnectFailures = builder.maxConsecutiveConnectFailures;
    this.connectRetryDelayMillis = builder.connectRetryDelayMillis;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static NamedPipeTransportOptions defaults() {
    return builder().build();
  }

  /**
   * Reads options from the {@value #DEFAULT_RESOURCE} classpath resource, or
   * returns the defaults when there is no such resource.
   */
  public static NamedPipeTransportOptions load() throws IOException {
    ClassLoader loader = NamedPipeTransportOptions.class.getClassLoader();
    InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE);
    if (in == null) {
      return defaults();
    }
    Properties properties = new Properties();
    try {
      properties.load(in);
    } finally {
      in.close();
    }
    return fromProperties(properties);
  }

  /**
   * Builds options from {@code pipelistener.*} keys. Keys that are absent keep
   * their defaults.
   *
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static NamedPipeTransportOptions fromProperties(Properties properties) {
    Builder builder = builder();
    String value = property(properties, "listenerParallelism");
    if (value != null) {
      builder.listenerParallelism(parseInt("listenerParallelism", value));
    }
    value = property(properties, "maxReadBufferSize");
    if (value != null) {
      builder.maxReadBufferSize(parseLong("maxReadBufferSize", value));
    }
    value = property(properties, "maxWriteBufferSize");
    if (value != null) {
      builder.maxWriteBufferSize(parseLong("maxWriteBufferSize", value));
    }
    value = property(properties, "restrictToCurrentUser");
    if (value != null) {
      builder.restrictToCurrentUser(parseBoolean("restrictToCurrentUser", value));
    }
    value = property(properties, "accessControlDescriptor");
    if (value != null && !value.isEmpty()) {
      builder.accessControlDescriptor(value);
    }
    value = property(properties, "maxRetainedHandles");
    if (value != null) {
      builder.maxRetainedHandles(parseInt("maxRetainedHandles", value));
    }
    value = property(properties, "maxConsecutiveConnectFailures");
    if (value != null) {
      builder.maxConsecutiveConnectFailures(parseInt("maxConsecutiveConnectFailures", value));
    }
    value = property(properties, "connectRetryDelayMillis");
    if (value != null) {
      builder.connectRetryDelayMillis(parseLong("connectRetryDelayMillis", value));
    }
    return builder.build();
  }

  private static String property(Properties properties, String key) {
    String value = properties.getProperty(PROPERTY_PREFIX + key);
    return value == null ? null : value.trim();
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Invalid value for %s%s: '%s'", PROPERTY_PREFIX, key, value), e);
    }
  }

  private static long parseLong(String key, String value) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Invalid value for %s%s: '%s'", PROPERTY_PREFIX, key, value), e);
    }
  }

  private static boolean parseBoolean(String key, String value) {
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new IllegalArgumentException(
        String.format("Invalid value for %s%s: '%s'", PROPERTY_PREFIX, key, value));
  }

  /** Number of concurrent accept loops. */
  public int getListenerParallelism() {
    return listenerParallelism;
  }

  /** Maximum bytes buffered on the read side; 0 means unbounded. */
  public long getMaxReadBufferSize() {
    return maxReadBufferSize;
  }

  /** Maximum bytes buffered on the write side; 0 means unbounded. */
  public long getMaxWriteBufferSize() {
    return maxWriteBufferSize;
  }

  public boolean isRestrictToCurrentUser() {
    return restrictToCurrentUser;
  }

  /**
   * Explicit SDDL security descriptor for created pipes, or {@code null} to
   * use the default access control.
   */
  public String getAccessControlDescriptor() {
    return accessControlDescriptor;
  }

  public int getMaxRetainedHandles() {
    return maxRetainedHandles;
  }

  /** Broken-pipe retries allowed in a row per accept loop; 0 means unlimited. */
  public int getMaxConsecutiveConnectFailures() {
    return maxConsecutiveConnectFailures;
  }

  public long getConnectRetryDelayMillis() {
    return connectRetryDelayMillis;
  }

  public StreamBufferOptions getInputBufferOptions() {
    return StreamBufferOptions.forMaxBufferSize(maxReadBufferSize);
  }

  public StreamBufferOptions getOutputBufferOptions() {
    return StreamBufferOptions.forMaxBufferSize(maxWriteBufferSize);
  }

  @Override
  public String toString() {
    return "NamedPipeTransportOptions[listenerParallelism=" + listenerParallelism
        + ", maxReadBufferSize=" + maxReadBufferSize
        + ", maxWriteBufferSize=" + maxWriteBufferSize
        + ", restrictToCurrentUser=" + restrictToCurrentUser
        + ", accessControlDescriptor=" + accessControlDescriptor
        + ", maxRetainedHandles=" + maxRetainedHandles
        + ", maxConsecutiveConnectFailures=" + maxConsecutiveConnectFailures
        + ", connectRetryDelayMillis=" + connectRetryDelayMillis + "]";
  }

  public static final class Builder {
    private int listenerParallelism =
        Math.min(Runtime.getRuntime().availableProcessors(), MAX_DEFAULT_PARALLELISM);
    private long maxReadBufferSize = DEFAULT_MAX_READ_BUFFER_SIZE;
    private long maxWriteBufferSize = DEFAULT_MAX_WRITE_BUFFER_SIZE;
    private boolean restrictToCurrentUser = true;
    private String accessControlDescriptor;
    private int maxRetainedHandles = Runtime.getRuntime().availableProcessors() * 2;
    private int maxConsecutiveConnectFailures;
    private long connectRetryDelayMillis;

    private Builder() {
    }

    public Builder listenerParallelism(int listenerParallelism) {
      if (listenerParallelism < 1) {
        throw new IllegalArgumentException(
            "listenerParallelism must be at least 1: " + listenerParallelism);
      }
      this.listenerParallelism = listenerParallelism;
      return this;
    }

    public Builder maxReadBufferSize(long maxReadBufferSize) {
      if (maxReadBufferSize < 0) {
        throw new IllegalArgumentException(
            "maxReadBufferSize must not be negative: " + maxReadBufferSize);
      }
      this.maxReadBufferSize = maxReadBufferSize;
      return this;
    }

    public Builder maxWriteBufferSize(long maxWriteBufferSize) {
      if (maxWriteBufferSize < 0) {
        throw new IllegalArgumentException(
            "maxWriteBufferSize must not be negative: " + maxWriteBufferSize);
      }
      this.maxWriteBufferSize = maxWriteBufferSize;
      return this;
    }

    public Builder restrictToCurrentUser(boolean restrictToCurrentUser) {
      this.restrictToCurrentUser = restrictToCurrentUser;
      return this;
    }

    public Builder accessControlDescriptor(String accessControlDescriptor) {
      this.accessControlDescriptor = accessControlDescriptor;
      return this;
    }

    public Builder maxRetainedHandles(int maxRetainedHandles) {
      if (maxRetainedHandles < 0) {
        throw new IllegalArgumentException(
            "maxRetainedHandles must not be negative: " + maxRetainedHandles);
      }
      this.maxRetainedHandles = maxRetainedHandles;
      return this;
    }

    public Builder maxConsecutiveConnectFailures(int maxConsecutiveConnectFailures) {
      if (maxConsecutiveConnectFailures < 0) {
        throw new IllegalArgumentException(
            "maxConsecutiveConnectFailures must not be negative: " + maxConsecutiveConnectFailures);
      }
      this.maxConsecutiveConnectFailures = maxConsecutiveConnectFailures;
      return this;
    }

    public Builder connectRetryDelayMillis(long connectRetryDelayMillis) {
      if (connectRetryDelayMillis < 0) {
        throw new IllegalArgumentException(
            "connectRetryDelayMillis must not be negative: " + connectRetryDelayMillis);
      }
      this.connectRetryDelayMillis = connectRetryDelayMillis;
      return this;
    }

    public NamedPipeTransportOptions build() {
      return new NamedPipeTransportOptions(this);
    }
  }
}
