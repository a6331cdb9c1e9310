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

import com.martiansoftware.pipelistener.win32.Win32MutexExclusivityGuard;
import com.martiansoftware.pipelistener.win32.Win32PipeHandleFactory;

import com.sun.jna.Platform;

import java.io.IOException;

/**
 * Binds {@link NamedPipeConnectionListener}s. By default handles are Win32
 * named pipes and the name is guarded by a kernel mutex on Windows or a lock
 * file elsewhere.
 */
public class NamedPipeTransportFactory {
  private final NamedPipeTransportOptions options;
  private final PipeHandleFactory handleFactory;
  private final PipeConnectionFactory connectionFactory;
  private final ExclusivityGuard.Factory guardFactory;

  public NamedPipeTransportFactory(NamedPipeTransportOptions options) {
    this(options, new Win32PipeHandleFactory(), PipeConnectionFactory.STREAM, defaultGuardFactory());
  }

  public NamedPipeTransportFactory(
      NamedPipeTransportOptions options,
      PipeHandleFactory handleFactory,
      PipeConnectionFactory connectionFactory,
      ExclusivityGuard.Factory guardFactory) {
    this.options = options;
    this.handleFactory = handleFactory;
    this.connectionFactory = connectionFactory;
    this.guardFactory = guardFactory;
  }

  static ExclusivityGuard.Factory defaultGuardFactory() {
    return Platform.isWindows()
        ? Win32MutexExclusivityGuard.factory()
        : FileLockExclusivityGuard.factory();
  }

  /**
   * Takes ownership of the pipe name and starts accepting on it.
   *
   * @throws AddressInUseException if another listener serves the name
   * @throws IOException if the first pipe instances could not be created
   */
  public NamedPipeConnectionListener bind(NamedPipeEndPoint endPoint) throws IOException {
    ExclusivityGuard guard = guardFactory.acquire(endPoint);
    NamedPipeConnectionListener listener = new NamedPipeConnectionListener(
        endPoint, options, handleFactory, connectionFactory, guard);
    try {
      listener.start();
    } catch (IOException e) {
      closeAfterFailedStart(listener, e);
      throw e;
    } catch (RuntimeException e) {
      closeAfterFailedStart(listener, e);
      throw e;
    }
    return listener;
  }

  public NamedPipeConnectionListener bind(String pipeName) throws IOException {
    return bind(new NamedPipeEndPoint(pipeName));
  }

  private static void closeAfterFailedStart(NamedPipeConnectionListener listener, Exception cause) {
    try {
      listener.close();
    } catch (IOException e) {
      cause.addSuppressed(e);
    }
  }
}
