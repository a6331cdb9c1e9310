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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A bounded hand-off channel between accept loops and {@code accept} callers.
 *
 * <p>Writers use {@link #tryWrite} and, when it fails, {@link #waitToWrite};
 * readers use {@link #waitToRead} and {@link #tryRead}. The channel can be
 * completed once, optionally with a fault that every reader then observes.
 * Items written before a clean completion remain readable.
 */
public final class AcceptQueue<T> {
  private final int capacity;
  private final Deque<T> items;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();
  private boolean completed;
  private Throwable fault;

  public AcceptQueue() {
    this(1);
  }

  public AcceptQueue(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
    }
    this.capacity = capacity;
    this.items = new ArrayDeque<T>(capacity);
  }

  /**
   * Adds {@code item} if there is space and the queue is still open.
   */
  public boolean tryWrite(T item) {
    if (item == null) {
      throw new NullPointerException("item");
    }
    lock.lock();
    try {
      if (completed || items.size() >= capacity) {
        return false;
      }
      items.addLast(item);
      notEmpty.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until there is space to write.
   *
   * @return {@code false} if the queue was completed
   * @throws CancellationException if {@code token} fired first
   */
  public boolean waitToWrite(CancellationToken token) throws InterruptedException {
    CancellationRegistration registration = token.register(wakeAll());
    lock.lock();
    try {
      while (!completed && items.size() >= capacity) {
        token.throwIfCancellationRequested();
        notFull.await();
      }
      return !completed;
    } finally {
      lock.unlock();
      registration.close();
    }
  }

  /**
   * Removes and returns the head item, or {@code null} if there is none.
   */
  public T tryRead() {
    lock.lock();
    try {
      T item = items.pollFirst();
      if (item != null) {
        notFull.signalAll();
      }
      return item;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until an item is available.
   *
   * @return {@code false} once the queue is completed cleanly and drained
   * @throws ListenerFaultedException if the queue was completed with a fault
   * @throws CancellationException if {@code token} fired first
   */
  public boolean waitToRead(CancellationToken token)
      throws ListenerFaultedException, InterruptedException {
    CancellationRegistration registration = token.register(wakeAll());
    lock.lock();
    try {
      while (items.isEmpty()) {
        if (completed) {
          if (fault != null) {
            throw new ListenerFaultedException(fault);
          }
          return false;
        }
        token.throwIfCancellationRequested();
        notEmpty.await();
      }
      return true;
    } finally {
      lock.unlock();
      registration.close();
    }
  }

  /**
   * Completes the queue without a fault.
   *
   * @return {@code false} if it was already completed
   */
  public boolean complete() {
    return complete(null);
  }

  /**
   * Completes the queue; {@code cause} may be {@code null} for a clean close.
   * Only the first completion counts.
   */
  public boolean complete(Throwable cause) {
    lock.lock();
    try {
      if (completed) {
        return false;
      }
      completed = true;
      fault = cause;
      notEmpty.signalAll();
      notFull.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isCompleted() {
    lock.lock();
    try {
      return completed;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return items.size();
    } finally {
      lock.unlock();
    }
  }

  private Runnable wakeAll() {
    return new Runnable() {
      public void run() {
        lock.lock();
        try {
          notEmpty.signalAll();
          notFull.signalAll();
        } finally {
          lock.unlock();
        }
      }
    };
  }
}
