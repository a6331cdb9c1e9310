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
import java.io.InterruptedIOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accepts connections on a named pipe.
 *
 * <p>{@link #start()} launches {@code listenerParallelism} accept loops. Each
 * loop owns one reserved pipe handle and waits for a client on it. When a
 * client connects, the loop reserves the next handle <em>before</em>
 * publishing the connection, so the server always holds at least one
 * instance of the pipe name and no other process can claim it with a
 * different access policy.
 *
 * <p>Accepted connections pass through a single-slot queue to
 * {@link #accept(CancellationToken)}. The OS keeps its own backlog of waiting
 * clients, so the application-side queue only ever stores one connection.
 *
 * <p>{@link #close()} cancels the loops, releases the exclusivity guard, waits
 * for every loop to exit and only then closes the handle pool, so no loop can
 * touch a closed pool.
 */
public class NamedPipeConnectionListener implements Closeable {
  private final NamedPipeEndPoint endPoint;
  private final NamedPipeTransportOptions options;
  private final PipeConnectionFactory connectionFactory;
  private final ExclusivityGuard guard;
  private final DefaultObjectPool<PipeHandle> handlePool;
  private final AcceptQueue<PipeConnection> acceptedQueue = new AcceptQueue<PipeConnection>(1);
  private final CancellationSource listeningSource = new CancellationSource();
  private final CancellationToken listeningToken = listeningSource.getToken();
  private final StreamBufferOptions inputOptions;
  private final StreamBufferOptions outputOptions;
  private final ConnectedPipe.CloseCallback closeCallback;
  private final AtomicLong connectionIds = new AtomicLong();
  private final AtomicBoolean disposed = new AtomicBoolean();
  private final CountDownLatch disposeComplete = new CountDownLatch(1);
  private volatile Thread[] listeningThreads;

  public NamedPipeConnectionListener(
      NamedPipeEndPoint endPoint,
      NamedPipeTransportOptions options,
      PipeHandleFactory handleFactory,
      PipeConnectionFactory connectionFactory,
      ExclusivityGuard guard) {
    this.endPoint = endPoint;
    this.options = options;
    this.connectionFactory = connectionFactory;
    this.guard = guard;
    this.handlePool = new DefaultObjectPool<PipeHandle>(
        new PipeHandlePoolPolicy(handleFactory, endPoint, options),
        options.getMaxRetainedHandles());
    this.inputOptions = options.getInputBufferOptions();
    this.outputOptions = options.getOutputBufferOptions();
    this.closeCallback = new ConnectedPipe.CloseCallback() {
      public void onPipeDisconnected(PipeHandle handle) {
        returnHandle(handle);
      }
    };
  }

  public NamedPipeEndPoint getEndPoint() {
    return endPoint;
  }

  public NamedPipeTransportOptions getOptions() {
    return options;
  }

  /**
   * Starts the accept loops. The first handle of every loop is created on the
   * calling thread, so creation errors surface here. A failed start closes the
   * listener, stopping any loops that were already running.
   *
   * @throws IOException if a pipe instance could not be created
   * @throws IllegalStateException if already started or closed
   */
  public synchronized void start() throws IOException {
    if (disposed.get()) {
      throw new IllegalStateException("Listener for " + endPoint + " is closed");
    }
    if (listeningThreads != null) {
      throw new IllegalStateException("Listener for " + endPoint + " already started");
    }
    Thread[] threads = new Thread[options.getListenerParallelism()];
    listeningThreads = threads;
    try {
      for (int i = 0; i < threads.length; i++) {
        PipeHandle initialHandle = handlePool.acquire();
        Thread thread = new Thread(
            new AcceptLoop(initialHandle),
            "pipelistener-accept-" + endPoint.getPipeName() + "-" + i);
        thread.setDaemon(true);
        threads[i] = thread;
        thread.start();
      }
    } catch (IOException e) {
      closeAfterFailedStart(e);
      throw e;
    } catch (RuntimeException e) {
      closeAfterFailedStart(e);
      throw e;
    }
  }

  private void closeAfterFailedStart(Exception cause) {
    try {
      close();
    } catch (IOException e) {
      cause.addSuppressed(e);
    }
  }

  public boolean isStarted() {
    return listeningThreads != null;
  }

  public boolean isClosed() {
    return disposed.get();
  }

  /**
   * Equivalent to {@code accept(CancellationToken.NONE)}.
   */
  public PipeConnection accept() throws IOException {
    return accept(CancellationToken.NONE);
  }

  /**
   * Waits for the next accepted connection.
   *
   * @return the connection, or {@code null} once the listener has stopped
   * @throws ListenerFaultedException if the listener stopped because of a
   *     failure; the cause describes it
   * @throws CancellationException if {@code token} fired first; the listener
   *     is unaffected
   */
  public PipeConnection accept(CancellationToken token) throws IOException {
    try {
      while (acceptedQueue.waitToRead(token)) {
        PipeConnection connection = acceptedQueue.tryRead();
        if (connection != null) {
          NamedPipeLog.acceptedConnection(connection);
          return connection;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while accepting on " + endPoint);
    }
    return null;
  }

  /**
   * Takes back a handle whose client has been disconnected.
   */
  void returnHandle(PipeHandle handle) {
    // A connected handle is closed by the pool instead of cached.
    handlePool.release(handle);
  }

  /**
   * Same as {@link #close()}.
   */
  public void unbind() throws IOException {
    close();
  }

  /**
   * Stops the listener. Safe to call more than once, and before
   * {@link #start()}; concurrent callers return once the first has finished.
   * Connections still queued are closed, so {@link #accept()} returns
   * {@code null} afterwards.
   */
  public void close() throws IOException {
    if (!disposed.compareAndSet(false, true)) {
      awaitUninterruptibly(disposeComplete);
      return;
    }
    IOException failure = null;
    try {
      // A loop may be blocked waiting for a client; cancelling wakes it.
      listeningSource.cancel();
      listeningSource.close();
      try {
        guard.close();
      } catch (IOException e) {
        failure = e;
      }
      joinListeningThreads();
      acceptedQueue.complete();
      closeQueuedConnections();
      // Only now is it certain that no loop will acquire or return a handle.
      handlePool.close();
    } finally {
      disposeComplete.countDown();
    }
    if (failure != null) {
      throw failure;
    }
  }

  /**
   * Closes connections published but never accepted. Runs once no loop can
   * write, and before the pool closes so their handles are released to it.
   */
  private void closeQueuedConnections() {
    PipeConnection connection;
    while ((connection = acceptedQueue.tryRead()) != null) {
      try {
        connection.close();
      } catch (IOException e) {
        NamedPipeLog.handleCloseFailed(e);
      }
    }
  }

  private void joinListeningThreads() {
    Thread[] threads;
    synchronized (this) {
      threads = listeningThreads;
    }
    if (threads == null) {
      return;
    }
    boolean interrupted = false;
    for (Thread thread : threads) {
      if (thread == null) {
        continue;
      }
      while (true) {
        try {
          thread.join();
          break;
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private static void awaitUninterruptibly(CountDownLatch latch) {
    boolean interrupted = false;
    while (true) {
      try {
        latch.await();
        break;
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private String nextConnectionId() {
    return endPoint.getPipeName() + ":" + connectionIds.incrementAndGet();
  }

  @Override
  public String toString() {
    return "NamedPipeConnectionListener[" + endPoint + "]";
  }

  /**
   * One accept cycle. Owns exactly one reserved handle at a time.
   */
  private final class AcceptLoop implements Runnable {
    private PipeHandle nextHandle;
    private PipeConnection unpublished;
    private int consecutiveFailures;

    AcceptLoop(PipeHandle initialHandle) {
      this.nextHandle = initialHandle;
    }

    public void run() {
      try {
        while (true) {
          PipeHandle handle = nextHandle;
          try {
            handle.waitForConnection(listeningToken);
          } catch (IOException e) {
            if (listeningToken.isCancellationRequested()) {
              NamedPipeLog.connectionListenerAborted(endPoint, e);
              break;
            }
            // The client went away mid-connect. Drop this instance and keep listening.
            NamedPipeLog.connectionListenerBrokenPipe(endPoint, e);
            recoverFromBrokenPipe(handle, e);
            continue;
          } catch (CancellationException e) {
            if (!listeningToken.isCancellationRequested()) {
              throw e;
            }
            NamedPipeLog.connectionListenerAborted(endPoint, e);
            break;
          }
          consecutiveFailures = 0;

          PipeConnection connection = connectionFactory.create(new ConnectedPipe(
              nextConnectionId(), handle, endPoint, inputOptions, outputOptions, closeCallback));
          // The connection owns the connected handle from here on.
          unpublished = connection;
          nextHandle = null;
          connection.start();

          // Reserve the next instance before the connection becomes visible.
          nextHandle = handlePool.acquire();

          if (!publish(connection)) {
            break;
          }
        }

        closeUnpublished();
        closeHandle(nextHandle);
        acceptedQueue.complete();
      } catch (Throwable t) {
        NamedPipeLog.connectionListenerFaulted(endPoint, t);
        closeUnpublished();
        closeHandle(nextHandle);
        acceptedQueue.complete(t);
      }
    }

    /**
     * @return {@code false} if cancellation stopped the write
     */
    private boolean publish(PipeConnection connection) throws InterruptedException {
      try {
        while (!acceptedQueue.tryWrite(connection)) {
          if (!acceptedQueue.waitToWrite(listeningToken)) {
            throw new IllegalStateException("Accept queue writer was unexpectedly closed.");
          }
        }
      } catch (CancellationException e) {
        if (!listeningToken.isCancellationRequested()) {
          throw e;
        }
        NamedPipeLog.connectionListenerAborted(endPoint, e);
        return false;
      }
      unpublished = null;
      return true;
    }

    private void recoverFromBrokenPipe(PipeHandle broken, IOException cause)
        throws IOException, InterruptedException {
      closeHandle(broken);
      nextHandle = null;
      consecutiveFailures++;
      int limit = options.getMaxConsecutiveConnectFailures();
      if (limit > 0 && consecutiveFailures > limit) {
        throw new IOException(String.format(
            "Waiting for a connection on %s failed %d times in a row",
            endPoint, consecutiveFailures), cause);
      }
      pauseBeforeRetry();
      nextHandle = handlePool.acquire();
    }

    private void pauseBeforeRetry() throws InterruptedException {
      long delay = options.getConnectRetryDelayMillis();
      if (delay <= 0) {
        return;
      }
      final CountDownLatch cancelled = new CountDownLatch(1);
      CancellationRegistration registration = listeningToken.register(new Runnable() {
        public void run() {
          cancelled.countDown();
        }
      });
      try {
        cancelled.await(delay, TimeUnit.MILLISECONDS);
      } finally {
        registration.close();
      }
    }

    private void closeUnpublished() {
      PipeConnection connection = unpublished;
      unpublished = null;
      if (connection != null) {
        try {
          connection.close();
        } catch (IOException e) {
          NamedPipeLog.handleCloseFailed(e);
        }
      }
    }

    private void closeHandle(PipeHandle handle) {
      if (handle == null) {
        return;
      }
      try {
        handle.close();
      } catch (IOException e) {
        NamedPipeLog.handleCloseFailed(e);
      }
    }
  }
}
