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

/**
 * An accepted client connection. Closing it gives the underlying pipe handle
 * back to the listener that accepted it.
 */
public interface PipeConnection extends Closeable {

  /**
   * Makes the connection ready for I/O. Called by the accept loop before the
   * connection is handed to {@code accept} callers.
   */
  void start();

  String getConnectionId();

  NamedPipeEndPoint getEndPoint();

  InputStream getInputStream() throws IOException;

  OutputStream getOutputStream() throws IOException;

  StreamBufferOptions getInputOptions();

  StreamBufferOptions getOutputOptions();

  boolean isClosed();
}
