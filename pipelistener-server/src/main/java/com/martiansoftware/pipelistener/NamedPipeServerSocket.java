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
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketException;

/**
 * Implements a {@link ServerSocket} on top of a
 * {@link NamedPipeConnectionListener}, returning instances of
 * {@link NamedPipeSocket} from {@link #accept()}. Lets socket-based servers
 * serve a named pipe unchanged.
 */
public class NamedPipeServerSocket extends ServerSocket {
  private final NamedPipeConnectionListener listener;

  /**
   * Binds a listener to the specified pipe name or path using the options in
   * {@code pipelistener.properties}.
   */
  public NamedPipeServerSocket(String path) throws IOException {
    this(new NamedPipeTransportFactory(NamedPipeTransportOptions.load())
        .bind(new NamedPipeEndPoint(path)));
  }

  /**
   * Wraps an already started listener. Closing the socket closes the listener.
   */
  public NamedPipeServerSocket(NamedPipeConnectionListener listener) throws IOException {
    this.listener = listener;
  }

  public void bind(SocketAddress endpoint) throws IOException {
    throw new IOException("Named pipes do not support bind(), pass path to constructor");
  }

  public void bind(SocketAddress endpoint, int backlog) throws IOException {
    bind(endpoint);
  }

  public Socket accept() throws IOException {
    PipeConnection connection = listener.accept();
    if (connection == null) {
      throw new SocketException("Socket is closed");
    }
    return new NamedPipeSocket(connection);
  }

  public SocketAddress getLocalSocketAddress() {
    return listener.getEndPoint();
  }

  public boolean isBound() {
    return true;
  }

  public boolean isClosed() {
    return listener.isClosed();
  }

  public void close() throws IOException {
    listener.close();
  }

  public NamedPipeConnectionListener getListener() {
    return listener;
  }
}
