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

import java.util.concurrent.CancellationException;

/**
 * Observer side of a {@link CancellationSource}. Blocking operations in this
 * package take a token and give up with a {@link CancellationException} once
 * it fires.
 */
public final class CancellationToken {

  /** A token that is never cancelled. */
  public static final CancellationToken NONE = new CancellationToken(null);

  private final CancellationSource source;

  CancellationToken(CancellationSource source) {
    this.source = source;
  }

  public boolean isCancellationRequested() {
    return source != null && source.isCancellationRequested();
  }

  public void throwIfCancellationRequested() {
    if (isCancellationRequested()) {
      throw new CancellationException("Operation was cancelled");
    }
  }

  /**
   * Registers a callback to run when cancellation is requested. If the token is
   * already cancelled the callback runs immediately on the calling thread.
   */
  public CancellationRegistration register(Runnable callback) {
    if (source == null) {
      return CancellationRegistration.EMPTY;
    }
    return source.register(callback);
  }
}
