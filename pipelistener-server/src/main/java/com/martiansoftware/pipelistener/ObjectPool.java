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

public interface ObjectPool<T> extends AutoCloseable {

  /**
   * Returns a cached object, or a new one if none is cached.
   *
   * @throws IOException if a new object could not be created
   * @throws IllegalStateException if the pool is closed
   */
  T acquire() throws IOException;

  /**
   * Hands an object back. Objects the policy rejects, or that do not fit, are
   * destroyed instead of cached.
   */
  void release(T object);

  /**
   * Destroys every cached object. Later releases destroy their argument.
   */
  void close();
}
