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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CancellationSource")
class CancellationSourceTest {

  @Test
  @DisplayName("Callbacks run once on the first cancel")
  void callbacksRunOnce() {
    CancellationSource source = new CancellationSource();
    AtomicInteger calls = new AtomicInteger();
    source.getToken().register(calls::incrementAndGet);

    source.cancel();
    source.cancel();

    assertEquals(1, calls.get());
    assertTrue(source.isCancellationRequested());
    assertTrue(source.getToken().isCancellationRequested());
    assertThrows(CancellationException.class, () -> source.getToken().throwIfCancellationRequested());
  }

  @Test
  @DisplayName("Registering on a cancelled token runs the callback inline")
  void registerAfterCancel() {
    CancellationSource source = new CancellationSource();
    source.cancel();
    AtomicInteger calls = new AtomicInteger();

    CancellationRegistration registration = source.getToken().register(calls::incrementAndGet);

    assertEquals(1, calls.get());
    assertSame(CancellationRegistration.EMPTY, registration);
  }

  @Test
  @DisplayName("A closed registration is not run")
  void closedRegistrationSkipped() {
    CancellationSource source = new CancellationSource();
    AtomicInteger calls = new AtomicInteger();
    Runnable callback = calls::incrementAndGet;
    CancellationRegistration first = source.getToken().register(callback);
    source.getToken().register(callback);

    first.close();
    source.cancel();

    assertEquals(1, calls.get());
  }

  @Test
  @DisplayName("cancel after close is ignored")
  void cancelAfterClose() {
    CancellationSource source = new CancellationSource();
    AtomicInteger calls = new AtomicInteger();
    source.getToken().register(calls::incrementAndGet);

    source.close();
    source.cancel();

    assertEquals(0, calls.get());
    assertFalse(source.isCancellationRequested());
  }

  @Test
  @DisplayName("The NONE token never fires")
  void noneToken() {
    assertFalse(CancellationToken.NONE.isCancellationRequested());
    AtomicInteger calls = new AtomicInteger();
    assertSame(CancellationRegistration.EMPTY, CancellationToken.NONE.register(calls::incrementAndGet));
    CancellationToken.NONE.throwIfCancellationRequested();
    assertEquals(0, calls.get());
  }

  @Test
  @DisplayName("A throwing callback is logged and does not stop the others")
  void throwingCallbackLogged() {
    Logger logger = Logger.getLogger(NamedPipeLog.LOGGER_NAME);
    final List<LogRecord> records = new ArrayList<LogRecord>();
    Handler handler = new Handler() {
      public void publish(LogRecord record) {
        records.add(record);
      }

      public void flush() {
      }

      public void close() {
      }
    };
    logger.addHandler(handler);
    try {
      CancellationSource source = new CancellationSource();
      AtomicInteger calls = new AtomicInteger();
      source.getToken().register(() -> {
        throw new IllegalStateException("boom");
      });
      source.getToken().register(calls::incrementAndGet);

      source.cancel();

      assertEquals(1, calls.get());
      assertEquals(1, records.size());
      assertEquals(Level.WARNING, records.get(0).getLevel());
      assertEquals("boom", records.get(0).getThrown().getMessage());
    } finally {
      logger.removeHandler(handler);
    }
  }
}
