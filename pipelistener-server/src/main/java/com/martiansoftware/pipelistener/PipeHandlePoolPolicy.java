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

/**
 * Pool policy for server pipe handles: only disconnected handles are reused.
 */
final class PipeHandlePoolPolicy implements PooledObjectPolicy<PipeHandle> {
  private final PipeHandleFactory factory;
  private final NamedPipeEndPoint endPoint;
  private final NamedPipeTransportOptions options;

  PipeHandlePoolPolicy(
      PipeHandleFactory factory, NamedPipeEndPoint endPoint, NamedPipeTransportOptions options) {
    this.factory = factory;
    this.endPoint = endPoint;
    this.options = options;
  }

  public PipeHandle create() throws IOException {
    return factory.create(endPoint, options);
  }

  public boolean canReturn(PipeHandle handle) {
    return !handle.isConnected();
  }

  public void destroy(PipeHandle handle) {
    try {
      handle.close();
    } catch (IOException e) {
      NamedPipeLog.handleCloseFailed(e);
    }
  }
}
