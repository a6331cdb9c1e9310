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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@DisplayName("NamedPipeConnectionListener")
@Timeout(30)
class NamedPipeConnectionListenerTest {
  private static final AtomicInteger PIPE_COUNTER = new AtomicInteger();

  private FakePipeHandleFactory handles;
  private CountingGuard guard;
  private NamedPipeEndPoint endPoint;
  private ExecutorService executor;
  private NamedPipeConnectionListener listener;

  @BeforeEach
  void setUp() {
    handles = new FakePipeHandleFactory();
    guard = new CountingGuard();
    endPoint = new NamedPipeEndPoint("listener-test-" + PIPE_COUNTER.incrementAndGet());
    executor = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() throws IOException {
    if (listener != null) {
      listener.close();
    }
    executor.shutdownNow();
  }

  private NamedPipeConnectionListener newListener(NamedPipeTransportOptions.Builder options) {
    listener = new NamedPipeConnectionListener(
        endPoint, options.build(), handles, PipeConnectionFactory.STREAM, guard);
    return listener;
  }

  private NamedPipeConnectionListener newListener(int parallelism) {
    return newListener(NamedPipeTransportOptions.builder().listenerParallelism(parallelism));
  }

  private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("Condition not met within 5 seconds");
      }
      Thread.sleep(5);
    }
  }

  private int liveAcceptThreads() {
    int count = 0;
    String prefix = "pipelistener-accept-" + endPoint.getPipeName() + "-";
    for (Thread thread : Thread.getAllStackTraces().keySet()) {
      if (thread.getName().startsWith(prefix) && thread.isAlive()) {
        count++;
      }
    }
    return count;
  }

  private static String readAll(PipeConnection connection) throws IOException {
    InputStream in = connection.getInputStream();
    StringBuilder sb = new StringBuilder();
    byte[] buf = new byte[64];
    int n;
    while ((n = in.read(buf)) != -1) {
      sb.append(new String(buf, 0, n, StandardCharsets.UTF_8));
    }
    return sb.toString();
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  static final class CountingGuard implements ExclusivityGuard {
    final AtomicInteger closeCalls = new AtomicInteger();
    final AtomicInteger releases = new AtomicInteger();
    private final AtomicBoolean released = new AtomicBoolean();

    public void close() {
      closeCalls.incrementAndGet();
      if (released.compareAndSet(false, true)) {
        releases.incrementAndGet();
      }
    }
  }

  @Nested
  @DisplayName("Accepting")
  class AcceptingTests {

    @Test
    @DisplayName("Single loop buffers one connection and leaves the next client in the backlog")
    void singleLoop_threeClients() throws Exception {
      newListener(1).start();

      FakePipeHandle first = handles.connectClient(bytes("one"), 5, TimeUnit.SECONDS);
      assertNotNull(first);
      FakePipeHandle second = handles.connectClient(bytes("two"), 5, TimeUnit.SECONDS);
      assertNotNull(second);
      assertNotSame(first, second);

      Future<FakePipeHandle> third =
          executor.submit(() -> handles.connectClient(bytes("three"), 10, TimeUnit.SECONDS));
      assertThrows(TimeoutException.class, () -> third.get(200, TimeUnit.MILLISECONDS));

      PipeConnection c1 = listener.accept();
      assertEquals("one", readAll(c1));

      FakePipeHandle thirdHandle = third.get(5, TimeUnit.SECONDS);
      assertNotNull(thirdHandle, "third client should be accepted once the queue has space");

      PipeConnection c2 = listener.accept();
      assertEquals("two", readAll(c2));
      PipeConnection c3 = listener.accept();
      assertEquals("three", readAll(c3));
    }

    @Test
    @DisplayName("A replacement handle is reserved before the connection is observable")
    void replacementReservedBeforePublish() throws Exception {
      CountDownLatch releaseReplacement = handles.holdCreate(1);
      newListener(1).start();
      assertEquals(1, handles.createdCount());

      FakePipeHandle connected = handles.connectClient();
      try {
        assertTrue(handles.awaitCreateHeld(5, TimeUnit.SECONDS));

        CancellationSource source = new CancellationSource();
        Future<PipeConnection> early = executor.submit(() -> listener.accept(source.getToken()));
        assertThrows(TimeoutException.class, () -> early.get(200, TimeUnit.MILLISECONDS));
        source.cancel();
        ExecutionException e =
            assertThrows(ExecutionException.class, () -> early.get(5, TimeUnit.SECONDS));
        assertInstanceOf(CancellationException.class, e.getCause());
      } finally {
        releaseReplacement.countDown();
      }

      PipeConnection connection = listener.accept();

      assertEquals(1, handles.reservedCount());
      assertTrue(connected.isConnected());
      assertEquals(2, handles.createdCount());
      assertFalse(handles.created().get(1).isConnected());
      assertEquals(endPoint, connection.getEndPoint());
    }

    @Test
    @DisplayName("Every connection is delivered exactly once across loops and callers")
    void exactlyOnceDelivery() throws Exception {
      final int clients = 40;
      newListener(4).start();

      final Set<PipeConnection> seen = ConcurrentHashMap.newKeySet();
      final AtomicInteger accepted = new AtomicInteger();
      final AtomicBoolean duplicate = new AtomicBoolean();
      Runnable acceptor = () -> {
        try {
          PipeConnection c;
          while ((c = listener.accept()) != null) {
            if (!seen.add(c)) {
              duplicate.set(true);
            }
            accepted.incrementAndGet();
          }
        } catch (IOException e) {
          fail(e);
        }
      };
      Future<?> a1 = executor.submit(acceptor);
      Future<?> a2 = executor.submit(acceptor);

      for (int i = 0; i < clients; i++) {
        assertNotNull(handles.connectClient());
      }
      waitUntil(() -> accepted.get() == clients);
      listener.close();
      a1.get(5, TimeUnit.SECONDS);
      a2.get(5, TimeUnit.SECONDS);

      assertFalse(duplicate.get());
      assertEquals(clients, seen.size());
      assertEquals(clients, accepted.get());
    }

    @Test
    @DisplayName("Closing a connection returns its handle for reuse")
    void closedConnectionHandleIsReused() throws Exception {
      newListener(1).start();

      FakePipeHandle first = handles.connectClient();
      PipeConnection c1 = listener.accept();
      c1.close();
      assertFalse(first.isConnected());
      assertFalse(first.isClosed());

      handles.connectClient();
      listener.accept();
      waitUntil(() -> handles.waitingCount() == 1);

      assertEquals(2, handles.createdCount(), "disconnected handle should have been reused");
    }
  }

  @Nested
  @DisplayName("Fault handling")
  class FaultTests {

    @Test
    @DisplayName("A broken pipe while waiting does not stop the listener")
    void brokenPipeIsRecovered() throws Exception {
      newListener(1).start();

      FakePipeHandle broken = handles.breakNextWait(5, TimeUnit.SECONDS);
      assertNotNull(broken);

      FakePipeHandle next = handles.connectClient(bytes("after"), 5, TimeUnit.SECONDS);
      assertNotNull(next);
      assertNotSame(broken, next);
      assertTrue(broken.isClosed());

      PipeConnection connection = listener.accept();
      assertEquals("after", readAll(connection));
    }

    @Test
    @DisplayName("Creation errors at start surface synchronously")
    void startSurfacesCreationError() {
      IOException denied = new IOException("Access is denied");
      handles.failCreatesAfter(0, denied);
      newListener(2);

      IOException thrown = assertThrows(IOException.class, () -> listener.start());
      assertSame(denied, thrown);
    }

    @Test
    @DisplayName("A partially started listener shuts itself down")
    void partialStartClosesListener() throws Exception {
      handles.failCreatesAfter(1, new IOException("All pipe instances are busy"));
      newListener(3);

      assertThrows(IOException.class, () -> listener.start());

      assertTrue(listener.isClosed());
      assertEquals(0, liveAcceptThreads());
      assertEquals(1, handles.closedCount());
      assertEquals(1, guard.releases.get());
      assertNull(listener.accept());

      listener.close();
      assertEquals(1, guard.closeCalls.get());
    }

    @Test
    @DisplayName("A creation error while running faults the listener for every caller")
    void runtimeCreationErrorFaultsListener() throws Exception {
      IOException busy = new IOException("All pipe instances are busy");
      handles.failCreatesAfter(1, busy);
      newListener(1).start();

      handles.connectClient();

      ListenerFaultedException first =
          assertThrows(ListenerFaultedException.class, () -> listener.accept());
      assertSame(busy, first.getCause());
      ListenerFaultedException second =
          assertThrows(ListenerFaultedException.class, () -> listener.accept());
      assertSame(busy, second.getCause());
    }

    @Test
    @DisplayName("A connection whose replacement cannot be reserved is never delivered")
    void connectionWithoutReplacementIsClosed() throws Exception {
      IOException busy = new IOException("All pipe instances are busy");
      handles.failCreatesAfter(1, busy);
      final List<PipeConnection> made = new CopyOnWriteArrayList<PipeConnection>();
      listener = new NamedPipeConnectionListener(
          endPoint,
          NamedPipeTransportOptions.builder().listenerParallelism(1).build(),
          handles,
          pipe -> {
            PipeConnection connection = PipeConnectionFactory.STREAM.create(pipe);
            made.add(connection);
            return connection;
          },
          guard);
      listener.start();

      FakePipeHandle connected = handles.connectClient();

      ListenerFaultedException e =
          assertThrows(ListenerFaultedException.class, () -> listener.accept());
      assertSame(busy, e.getCause());
      assertEquals(1, made.size());
      assertTrue(made.get(0).isClosed());
      assertFalse(connected.isConnected());
    }

    @Test
    @DisplayName("Consecutive broken pipes beyond the limit fault the listener")
    void retryLimitFaultsListener() throws Exception {
      newListener(NamedPipeTransportOptions.builder()
          .listenerParallelism(1)
          .maxConsecutiveConnectFailures(2));
      listener.start();

      for (int i = 0; i < 3; i++) {
        assertNotNull(handles.breakNextWait(5, TimeUnit.SECONDS));
      }

      ListenerFaultedException e =
          assertThrows(ListenerFaultedException.class, () -> listener.accept());
      assertTrue(e.getCause().getMessage().contains("3 times in a row"));
    }

    @Test
    @DisplayName("Cancelling one accept call leaves the listener running")
    void callerCancellationIsLocal() throws Exception {
      newListener(1).start();
      CancellationSource source = new CancellationSource();

      Future<PipeConnection> cancelled = executor.submit(() -> listener.accept(source.getToken()));
      Thread.sleep(50);
      source.cancel();

      Exception e = assertThrows(Exception.class, () -> cancelled.get(5, TimeUnit.SECONDS));
      assertInstanceOf(CancellationException.class, e.getCause());

      handles.connectClient();
      assertNotNull(listener.accept());
    }

    @Test
    @DisplayName("An already cancelled token fails accept immediately")
    void acceptWithCancelledToken() throws Exception {
      newListener(1).start();
      CancellationSource source = new CancellationSource();
      source.cancel();

      assertThrows(CancellationException.class, () -> listener.accept(source.getToken()));
    }
  }

  @Nested
  @DisplayName("Shutdown")
  class ShutdownTests {

    @Test
    @DisplayName("close stops every loop, closes the pool and ends accept")
    void closeStopsEverything() throws Exception {
      newListener(3).start();
      waitUntil(() -> handles.waitingCount() == 3);

      Future<PipeConnection> waitingAccept = executor.submit(() -> listener.accept());
      Thread.sleep(50);

      listener.close();

      assertNull(waitingAccept.get(5, TimeUnit.SECONDS));
      assertNull(listener.accept());
      assertEquals(0, liveAcceptThreads());
      assertEquals(handles.createdCount(), handles.closedCount());
      assertEquals(1, guard.releases.get());
      assertTrue(listener.isClosed());
    }

    @Test
    @DisplayName("Connections closed after shutdown close their handles")
    void connectionClosedAfterShutdown() throws Exception {
      newListener(1).start();
      FakePipeHandle connected = handles.connectClient();
      PipeConnection connection = listener.accept();

      listener.close();
      assertFalse(connected.isClosed());

      connection.close();
      assertTrue(connected.isClosed());
    }

    @Test
    @DisplayName("A connection stuck in the queue at shutdown is closed")
    void unpublishedConnectionClosedOnShutdown() throws Exception {
      newListener(1).start();
      handles.connectClient();
      FakePipeHandle stuck = handles.connectClient();
      waitUntil(() -> handles.createdCount() == 3);

      listener.close();

      assertFalse(stuck.isConnected());
      assertTrue(stuck.isClosed());
    }

    @Test
    @DisplayName("A connection queued but not accepted is closed by close")
    void queuedConnectionClosedOnShutdown() throws Exception {
      newListener(1).start();
      FakePipeHandle queued = handles.connectClient();
      // The loop waits on its replacement handle only after publishing.
      waitUntil(() -> handles.createdCount() == 2 && handles.waitingCount() == 1);

      listener.close();

      assertNull(listener.accept());
      assertFalse(queued.isConnected());
      assertTrue(queued.isClosed());
      assertEquals(handles.createdCount(), handles.closedCount());
    }

    @Test
    @DisplayName("close is idempotent and safe before start")
    void closeTwiceBeforeStart() throws Exception {
      newListener(2);

      listener.close();
      listener.close();

      assertEquals(1, guard.closeCalls.get());
      assertEquals(1, guard.releases.get());
      assertNull(listener.accept());
      assertThrows(IllegalStateException.class, () -> listener.start());
    }

    @Test
    @DisplayName("Starting twice is rejected")
    void startTwice() throws Exception {
      newListener(1).start();
      assertThrows(IllegalStateException.class, () -> listener.start());
    }
  }
}
