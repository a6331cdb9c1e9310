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

/**
 * A cross-process lock on a pipe name, held for as long as one listener
 * serves that name.
 */
public interface ExclusivityGuard extends Closeable {

  /**
   * Acquires guards for endpoints.
   */
  interface Factory {
    /**
     * @throws AddressInUseException if another process holds the guard
     */
    ExclusivityGuard acquire(NamedPipeEndPoint endPoint) throws IOException;
  }

  /**
   * Releases the lock. Only the first call releases anything.
   */
  void close() throws IOException;
}
