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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CancellationException;

/**
 * One server-side instance of a named pipe.
 *
 * <p>A handle starts out reserved: bound to the pipe name but not connected.
 * {@link #waitForConnection} blocks until a client attaches. After
 * {@link #disconnect()} the handle may wait for another client.
 */
public interface PipeHandle extends Closeable {

  /**
   * Blocks until a client connects to this handle.
   *
   * @throws IOException if the pipe broke while waiting
   * @throws CancellationException if {@code token} fired first
   */
  void waitForConnection(CancellationToken token) throws IOException;

  boolean isConnected();

  /**
   * Drops the connected client, returning the handle to the reserved state.
   */
  void disconnect() throws IOException;

  InputStream getInputStream() throws IOException;

  OutputStream getOutputStream() throws IOException;

  /**
   * Releases the OS handle. Closing twice is harmless.
   */
  void close() throws IOException;
}
