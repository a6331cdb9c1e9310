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
package com.martiansoftware.pipelistener.win32;

import com.martiansoftware.pipelistener.AddressInUseException;
import com.martiansoftware.pipelistener.ExclusivityGuard;
import com.martiansoftware.pipelistener.NamedPipeEndPoint;
import com.martiansoftware.pipelistener.win32.Win32NamedPipeLibrary.HANDLE;

import com.sun.jna.Native;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ExclusivityGuard} backed by a named kernel mutex. The mutex only has
 * to exist: a second process opening the same name sees
 * {@code ERROR_ALREADY_EXISTS}.
 */
public final class Win32MutexExclusivityGuard implements ExclusivityGuard {
  static final String MUTEX_PREFIX = "pipelistener-";

  private final HANDLE mutex;
  private final String name;
  private final AtomicBoolean released = new AtomicBoolean();

  private Win32MutexExclusivityGuard(HANDLE mutex, String name) {
    this.mutex = mutex;
    this.name = name;
  }

  public static Factory factory() {
    return new Factory() {
      public ExclusivityGuard acquire(NamedPipeEndPoint endPoint) throws IOException {
        return Win32MutexExclusivityGuard.acquire(endPoint);
      }
    };
  }

  public static Win32MutexExclusivityGuard acquire(NamedPipeEndPoint endPoint)
      throws IOException {
    String name = MUTEX_PREFIX + endPoint.getPipeName();
    HANDLE mutex = Win32NamedPipeLibrary.INSTANCE.CreateMutex(null, false, name);
    int error = Native.getLastError();
    if (mutex == null) {
      throw new IOException(String.format("Could not create mutex %s, error %d", name, error));
    }
    if (error == Win32NamedPipeLibrary.ERROR_ALREADY_EXISTS) {
      Win32NamedPipeLibrary.INSTANCE.CloseHandle(mutex);
      throw new AddressInUseException("Named pipe " + endPoint + " is already in use");
    }
    return new Win32MutexExclusivityGuard(mutex, name);
  }

  public void close() throws IOException {
    if (released.compareAndSet(false, true)) {
      if (!Win32NamedPipeLibrary.INSTANCE.CloseHandle(mutex)) {
        throw new IOException(String.format(
            "Could not close mutex %s, error %d", name, Native.getLastError()));
      }
    }
  }
}
