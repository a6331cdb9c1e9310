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

import java.util.ArrayList;
import java.util.List;

/**
 * Owner side of a cancellation signal. Cancelling fires every callback
 * registered through {@link #getToken()} exactly once.
 */
public final class CancellationSource implements AutoCloseable {
  private final Object lock = new Object();
  private final List<Runnable> callbacks = new ArrayList<Runnable>();
  private final CancellationToken token = new CancellationToken(this);
  private boolean cancelled;
  private boolean closed;

  public CancellationToken getToken() {
    return token;
  }

  public boolean isCancellationRequested() {
    synchronized (lock) {
      return cancelled;
    }
  }

  /**
   * Requests cancellation. Only the first call has any effect, and calls made
   * after {@link #close()} are ignored.
   */
  public void cancel() {
    List<Runnable> toRun;
    synchronized (lock) {
      if (cancelled || closed) {
        return;
      }
      cancelled = true;
      toRun = new ArrayList<Runnable>(callbacks);
      callbacks.clear();
    }
    for (Runnable callback : toRun) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        NamedPipeLog.cancellationCallbackFailed(e);
      }
    }
  }

  /**
   * Drops all pending callbacks. The cancelled state stays observable.
   */
  public void close() {
    synchronized (lock) {
      closed = true;
      callbacks.clear();
    }
  }

  CancellationRegistration register(final Runnable callback) {
    synchronized (lock) {
      if (!cancelled) {
        if (!closed) {
          callbacks.add(callback);
        }
        return new CancellationRegistration() {
          public void close() {
            unregister(callback);
          }
        };
      }
    }
    // Already cancelled, run inline outside the lock.
    callback.run();
    return CancellationRegistration.EMPTY;
  }

  private void unregister(Runnable callback) {
    synchronized (lock) {
      // Identity removal; the same Runnable may be registered more than once.
      for (int i = 0; i < callbacks.size(); i++) {
        if (callbacks.get(i) == callback) {
          callbacks.remove(i);
          return;
        }
      }
    }
  }
}
