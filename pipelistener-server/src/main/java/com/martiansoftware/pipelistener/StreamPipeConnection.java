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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default {@link PipeConnection}: buffered blocking streams over the pipe
 * handle. The handle itself is unbuffered, so each direction gets a buffer
 * sized from its {@link StreamBufferOptions}.
 */
public class StreamPipeConnection implements PipeConnection {
  static final int DEFAULT_BUFFER_SIZE = 8192;

  private final ConnectedPipe pipe;
  private final PipeHandle handle;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile InputStream is;
  private volatile OutputStream os;

  public StreamPipeConnection(ConnectedPipe pipe) {
    this.pipe = pipe;
    this.handle = pipe.getHandle();
  }

  /**
   * Internal buffer size for one direction: half the configured maximum, so
   * as much again can be pending on the application side, or a fixed default
   * when unbounded.
   */
  static int bufferSizeFor(StreamBufferOptions options) {
    if (options.isUnbounded()) {
      return DEFAULT_BUFFER_SIZE;
    }
    return (int) Math.max(1, Math.min(Integer.MAX_VALUE, options.getResumeWriterThreshold()));
  }

  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Connection " + getConnectionId() + " already started");
    }
    try {
      is = new BufferedInputStream(handle.getInputStream(), bufferSizeFor(pipe.getInputOptions()));
      os = new BufferedOutputStream(
          handle.getOutputStream(), bufferSizeFor(pipe.getOutputOptions()));
    } catch (IOException e) {
      throw new IllegalStateException("Could not open streams for " + getConnectionId(), e);
    }
  }

  public String getConnectionId() {
    return pipe.getConnectionId();
  }

  public NamedPipeEndPoint getEndPoint() {
    return pipe.getEndPoint();
  }

  public InputStream getInputStream() throws IOException {
    checkOpen();
    return is;
  }

  public OutputStream getOutputStream() throws IOException {
    checkOpen();
    return os;
  }

  public StreamBufferOptions getInputOptions() {
    return pipe.getInputOptions();
  }

  public StreamBufferOptions getOutputOptions() {
    return pipe.getOutputOptions();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Flushes pending output, disconnects the client and hands the handle back.
   * A handle that fails to disconnect is closed instead of being reused.
   */
  public void close() throws IOException {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    IOException flushFailure = null;
    if (os != null) {
      try {
        os.flush();
      } catch (IOException e) {
        flushFailure = e;
      }
    }
    boolean disconnected = false;
    try {
      handle.disconnect();
      disconnected = true;
    } catch (IOException e) {
      NamedPipeLog.connectionDisconnectFailed(getConnectionId(), e);
    }
    if (disconnected) {
      pipe.getCloseCallback().onPipeDisconnected(handle);
    } else {
      try {
        handle.close();
      } catch (IOException e) {
        NamedPipeLog.handleCloseFailed(e);
      }
    }
    if (flushFailure != null) {
      throw flushFailure;
    }
  }

  private void checkOpen() throws IOException {
    if (!started.get()) {
      throw new IllegalStateException("Connection " + getConnectionId() + " not started");
    }
    if (closed.get()) {
      throw new IOException("Connection " + getConnectionId() + " is closed");
    }
  }

  @Override
  public String toString() {
    return "StreamPipeConnection[" + getConnectionId() + ", " + getEndPoint() + "]";
  }
}
