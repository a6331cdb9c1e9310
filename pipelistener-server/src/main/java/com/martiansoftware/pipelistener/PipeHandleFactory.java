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
 * Creates reserved server-side pipe handles.
 */
public interface PipeHandleFactory {

  /**
   * @throws IOException if the OS refuses to create the pipe instance, for
   *     example because the name is owned with a different access policy
   */
  PipeHandle create(NamedPipeEndPoint endPoint, NamedPipeTransportOptions options)
      throws IOException;
}
