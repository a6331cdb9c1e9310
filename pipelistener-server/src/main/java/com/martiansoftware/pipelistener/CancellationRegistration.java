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
 * Handle returned by {@link CancellationToken#register(Runnable)}; closing it
 * removes the callback if it has not run yet.
 */
public interface CancellationRegistration extends AutoCloseable {
  CancellationRegistration EMPTY = new CancellationRegistration() {
    public void close() {
    }
  };

  void close();
}
