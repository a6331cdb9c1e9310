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

/**
 * Everything a {@link PipeConnectionFactory} needs to wrap a freshly
 * connected handle.
 */
public final class ConnectedPipe {

  /**
   * Takes back a handle once its connection has disconnected it.
   */
  public interface CloseCallback {
    void onPipeDisconnected(PipeHandle handle);
  }

  private final String connectionId;
  private final PipeHandle handle;
  private final NamedPipeEndPoint endPoint;
  private final StreamBufferOptions inputOptions;
  private final StreamBufferOptions outputOptions;
  private final CloseCallback closeCallback;

  public ConnectedPipe(
      String connectionId,
      PipeHandle handle,
      NamedPipeEndPoint endPoint,
      StreamBufferOptions inputOptions,
      StreamBufferOptions outputOptions,
      CloseCallback closeCallback) {
    this.connectionId = connectionId;
    this.handle = handle;
    this.endPoint = endPoint;
    this.inputOptions = inputOptions;
    this.outputOptions = outputOptions;
    this.closeCallback = closeCallback;
  }

  public String getConnectionId() {
    return connectionId;
  }

  public PipeHandle getHandle() {
    return handle;
  }

  public NamedPipeEndPoint getEndPoint() {
    return endPoint;
  }

  public StreamBufferOptions getInputOptions() {
    return inputOptions;
  }

  public StreamBufferOptions getOutputOptions() {
    return outputOptions;
  }

  public CloseCallback getCloseCallback() {
    return closeCallback;
  }
}
