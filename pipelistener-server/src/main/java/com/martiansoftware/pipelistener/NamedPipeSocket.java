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
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;

/**
 * Implements a {@link Socket} backed by an accepted {@link PipeConnection}.
 *
 * Instances of this class always return {@code null} for
 * {@link Socket#getInetAddress()} and {@link Socket#getLocalAddress()}; the
 * socket addresses are the pipe's endpoint.
 */
public class NamedPipeSocket extends Socket {
  private final PipeConnection connection;

  public NamedPipeSocket(PipeConnection connection) {
    this.connection = connection;
  }

  public InputStream getInputStream() throws IOException {
    return connection.getInputStream();
  }

  public OutputStream getOutputStream() throws IOException {
    return connection.getOutputStream();
  }

  public SocketAddress getLocalSocketAddress() {
    return connection.getEndPoint();
  }

  public SocketAddress getRemoteSocketAddress() {
    return connection.getEndPoint();
  }

  public boolean isConnected() {
    return true;
  }

  public boolean isBound() {
    return true;
  }

  public boolean isClosed() {
    return connection.isClosed();
  }

  public void close() throws IOException {
    connection.close();
  }

  public PipeConnection getConnection() {
    return connection;
  }

  @Override
  public String toString() {
    return "NamedPipeSocket[" + connection.getConnectionId() + "]";
  }
}
