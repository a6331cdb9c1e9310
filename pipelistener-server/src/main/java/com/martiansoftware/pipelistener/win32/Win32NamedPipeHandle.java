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

import com.martiansoftware.pipelistener.CancellationRegistration;
import com.martiansoftware.pipelistener.CancellationToken;
import com.martiansoftware.pipelistener.PipeHandle;
import com.martiansoftware.pipelistener.win32.Win32NamedPipeLibrary.HANDLE;
import com.martiansoftware.pipelistener.win32.Win32NamedPipeLibrary.OVERLAPPED;

import com.sun.jna.Memory;
import com.sun.jna.Native;
import com.sun.jna.Pointer;
import com.sun.jna.ptr.IntByReference;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link PipeHandle} backed by a native Win32 named pipe opened with
 * {@code FILE_FLAG_OVERLAPPED}. Every I/O call is issued overlapped and then
 * waited on, so blocking is still synchronous from the caller's view but the
 * connect wait can be cancelled with {@code CancelIoEx}.
 */
final class Win32NamedPipeHandle implements PipeHandle {
  private static final Win32NamedPipeLibrary API = Win32NamedPipeLibrary.INSTANCE;

  private final HANDLE handle;
  private final String path;
  private final InputStream is;
  private final OutputStream os;
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile boolean connected;

  Win32NamedPipeHandle(HANDLE handle, String path) {
    this.handle = handle;
    this.path = path;
    this.is = new Win32NamedPipeInputStream();
    this.os = new Win32NamedPipeOutputStream();
  }

  public void waitForConnection(CancellationToken token) throws IOException {
    token.throwIfCancellationRequested();
    final OverlappedOperation operation = new OverlappedOperation();
    try {
      boolean completed = API.ConnectNamedPipe(handle, operation.pointer());
      int error = completed ? 0 : Native.getLastError();
      if (error == Win32NamedPipeLibrary.ERROR_PIPE_CONNECTED) {
        // The client connected between CreateNamedPipe and ConnectNamedPipe.
        connected = true;
        return;
      }
      CancellationRegistration registration = token.register(new Runnable() {
        public void run() {
          API.CancelIoEx(handle, operation.pointer());
        }
      });
      try {
        operation.complete(error, "connect");
      } catch (Win32IOException e) {
        if (e.getErrorCode() == Win32NamedPipeLibrary.ERROR_OPERATION_ABORTED
            && token.isCancellationRequested()) {
          CancellationException cancelled =
              new CancellationException("Wait for connection on " + path + " was cancelled");
          cancelled.initCause(e);
          throw cancelled;
        }
        throw e;
      } finally {
        registration.close();
      }
      connected = true;
    } finally {
      operation.close();
    }
  }

  public boolean isConnected() {
    return connected && !closed.get();
  }

  public void disconnect() throws IOException {
    if (!API.DisconnectNamedPipe(handle)) {
      throw new Win32IOException("disconnect", path, Native.getLastError());
    }
    connected = false;
  }

  public InputStream getInputStream() {
    return is;
  }

  public OutputStream getOutputStream() {
    return os;
  }

  public void close() throws IOException {
    if (closed.compareAndSet(false, true)) {
      connected = false;
      if (!API.CloseHandle(handle)) {
        throw new Win32IOException("close", path, Native.getLastError());
      }
    }
  }

  @Override
  public String toString() {
    return "Win32NamedPipeHandle[" + path + (connected ? ", connected]" : "]");
  }

  /**
   * One overlapped I/O request with its own manual-reset event.
   */
  private final class OverlappedOperation {
    private final HANDLE event;
    private final OVERLAPPED overlapped;

    OverlappedOperation() throws IOException {
      event = API.CreateEvent(null, true, false, null);
      if (event == null) {
        throw new Win32IOException("create event for", path, Native.getLastError());
      }
      overlapped = new OVERLAPPED();
      overlapped.hEvent = event;
      overlapped.write();
    }

    Pointer pointer() {
      return overlapped.getPointer();
    }

    /**
     * Waits for the request to finish and returns the bytes transferred.
     * {@code error} is the last error of the call that issued the request, or
     * 0 if it completed synchronously.
     */
    int complete(int error, String operation) throws IOException {
      if (error != 0 && error != Win32NamedPipeLibrary.ERROR_IO_PENDING) {
        throw new Win32IOException(operation, path, error);
      }
      IntByReference transferred = new IntByReference();
      if (!API.GetOverlappedResult(handle, pointer(), transferred, true)) {
        throw new Win32IOException(operation, path, Native.getLastError());
      }
      return transferred.getValue();
    }

    void close() throws IOException {
      if (!API.CloseHandle(event)) {
        throw new Win32IOException("close event for", path, Native.getLastError());
      }
    }
  }

  private class Win32NamedPipeInputStream extends InputStream {

    public int read() throws IOException {
      byte[] b = new byte[1];
      if (read(b, 0, 1) == -1) {
        return -1;
      }
      // Make sure to & with 0xFF to avoid sign extension
      return 0xFF & b[0];
    }

    public int read(byte[] b, int off, int len) throws IOException {
      if (len == 0) {
        return 0;
      }
      Memory buffer = new Memory(len);
      OverlappedOperation operation = new OverlappedOperation();
      try {
        boolean completed = API.ReadFile(handle, buffer, len, null, operation.pointer());
        int read;
        try {
          read = operation.complete(completed ? 0 : Native.getLastError(), "read");
        } catch (Win32IOException e) {
          if (e.getErrorCode() == Win32NamedPipeLibrary.ERROR_BROKEN_PIPE
              || e.getErrorCode() == Win32NamedPipeLibrary.ERROR_PIPE_NOT_CONNECTED) {
            return -1;
          }
          throw e;
        }
        if (read == 0) {
          return -1;
        }
        buffer.read(0, b, off, read);
        return read;
      } finally {
        operation.close();
      }
    }
  }

  private class Win32NamedPipeOutputStream extends OutputStream {

    public void write(int b) throws IOException {
      write(new byte[] {(byte) (0xFF & b)}, 0, 1);
    }

    public void write(byte[] b, int off, int len) throws IOException {
      if (len == 0) {
        return;
      }
      Memory buffer = new Memory(len);
      buffer.write(0, b, off, len);
      OverlappedOperation operation = new OverlappedOperation();
      try {
        boolean completed = API.WriteFile(handle, buffer, len, null, operation.pointer());
        int written = operation.complete(completed ? 0 : Native.getLastError(), "write");
        if (written != len) {
          throw new IOException("Could not write " + len + " bytes as requested "
              + "(wrote " + written + " bytes instead)");
        }
      } finally {
        operation.close();
      }
    }
  }
}
