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

import java.net.SocketAddress;
import java.util.Locale;

/**
 * Address of a named pipe. Windows pipe names are case-insensitive, so two
 * endpoints are equal when their server and pipe names match ignoring case.
 */
public final class NamedPipeEndPoint extends SocketAddress {
  private static final long serialVersionUID = 1L;

  static final String LOCAL_SERVER = ".";
  private static final String PIPE_SEGMENT = "\\pipe\\";
  private static final String LOCAL_PIPE_PREFIX = "\\\\" + LOCAL_SERVER + PIPE_SEGMENT;

  private final String serverName;
  private final String pipeName;

  public NamedPipeEndPoint(String pipeName) {
    this(pipeName, LOCAL_SERVER);
  }

  public NamedPipeEndPoint(String pipeName, String serverName) {
    if (pipeName == null) {
      throw new IllegalArgumentException("Pipe name must not be null");
    }
    if (pipeName.regionMatches(true, 0, LOCAL_PIPE_PREFIX, 0, LOCAL_PIPE_PREFIX.length())) {
      pipeName = pipeName.substring(LOCAL_PIPE_PREFIX.length());
    }
    if (pipeName.isEmpty()) {
      throw new IllegalArgumentException("Pipe name must not be empty");
    }
    if (serverName == null || serverName.isEmpty()) {
      throw new IllegalArgumentException("Server name must not be empty");
    }
    this.pipeName = pipeName;
    this.serverName = serverName;
  }

  public String getPipeName() {
    return pipeName;
  }

  public String getServerName() {
    return serverName;
  }

  /**
   * Returns the full Win32 path, e.g. {@code \\.\pipe\name}.
   */
  public String getPath() {
    return "\\\\" + serverName + PIPE_SEGMENT + pipeName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NamedPipeEndPoint)) {
      return false;
    }
    NamedPipeEndPoint other = (NamedPipeEndPoint) o;
    return serverName.equalsIgnoreCase(other.serverName)
        && pipeName.equalsIgnoreCase(other.pipeName);
  }

  @Override
  public int hashCode() {
    return 31 * serverName.toLowerCase(Locale.ROOT).hashCode()
        + pipeName.toLowerCase(Locale.ROOT).hashCode();
  }

  @Override
  public String toString() {
    return getPath();
  }
}
