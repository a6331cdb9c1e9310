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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * A synchronized, bounded free-list. Creation happens outside the lock so a
 * slow {@link PooledObjectPolicy#create()} does not block releases.
 */
public class DefaultObjectPool<T> implements ObjectPool<T> {
  private final PooledObjectPolicy<T> policy;
  private final int maxRetained;
  private final Deque<T> free;
  private boolean closed;

  public DefaultObjectPool(PooledObjectPolicy<T> policy, int maxRetained) {
    if (maxRetained < 0) {
      throw new IllegalArgumentException("maxRetained must not be negative: " + maxRetained);
    }
    this.policy = policy;
    this.maxRetained = maxRetained;
    this.free = new ArrayDeque<T>(Math.max(maxRetained, 1));
  }

  public T acquire() throws IOException {
    synchronized (this) {
      if (closed) {
        throw new IllegalStateException("Pool is closed");
      }
      T cached = free.pollFirst();
      if (cached != null) {
        return cached;
      }
    }
    return policy.create();
  }

  public void release(T object) {
    if (object == null) {
      return;
    }
    if (policy.canReturn(object)) {
      synchronized (this) {
        if (!closed && free.size() < maxRetained) {
          free.addFirst(object);
          return;
        }
      }
    }
    policy.destroy(object);
  }

  public void close() {
    List<T> toDestroy;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      toDestroy = new ArrayList<T>(free);
      free.clear();
    }
    for (T object : toDestroy) {
      policy.destroy(object);
    }
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  /** Number of objects currently cached. */
  public synchronized int available() {
    return free.size();
  }
}
