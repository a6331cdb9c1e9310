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
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StreamPipeConnection")
class StreamPipeConnectionTest {
  private FakePipeHandle handle;
  private List<PipeHandle> returned;
  private StreamPipeConnection connection;

  @BeforeEach
  void setUp() {
    handle = new FakePipeHandle(new FakePipeHandleFactory(), 0);
    handle.clientConnect("ping".getBytes(StandardCharsets.UTF_8));
    handle.forceConnected();
    returned = new ArrayList<PipeHandle>();
    StreamBufferOptions buffers = StreamBufferOptions.forMaxBufferSize(1024);
    connection = new StreamPipeConnection(new ConnectedPipe(
        "conn:1", handle, new NamedPipeEndPoint("conn"), buffers, buffers,
        returned::add));
  }

  @Test
  @DisplayName("Streams carry the client's bytes both ways")
  void streams() throws IOException {
    connection.start();

    byte[] buf = new byte[16];
    int n = connection.getInputStream().read(buf);
    assertEquals("ping", new String(buf, 0, n, StandardCharsets.UTF_8));

    OutputStream out = connection.getOutputStream();
    out.write("pong".getBytes(StandardCharsets.UTF_8));
    assertEquals(0, handle.getServerOutput().length, "output should be buffered until flush");
    out.flush();
    assertEquals("pong", new String(handle.getServerOutput(), StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("Streams are unavailable before start and after close")
  void streamLifecycle() throws IOException {
    assertThrows(IllegalStateException.class, () -> connection.getInputStream());

    connection.start();
    assertThrows(IllegalStateException.class, () -> connection.start());

    connection.close();
    assertTrue(connection.isClosed());
    assertThrows(IOException.class, () -> connection.getOutputStream());
  }

  @Test
  @DisplayName("close flushes, disconnects and hands the handle back once")
  void closeReturnsHandle() throws IOException {
    connection.start();
    connection.getOutputStream().write(42);

    connection.close();
    connection.close();

    assertArrayEquals(new byte[] {42}, handle.getServerOutput());
    assertFalse(handle.isConnected());
    assertFalse(handle.isClosed());
    assertEquals(1, returned.size());
    assertSame(handle, returned.get(0));
  }

  @Test
  @DisplayName("A handle that fails to disconnect is closed instead of returned")
  void failedDisconnectClosesHandle() throws IOException {
    connection.start();
    handle.failNextDisconnect(new IOException("The pipe is being closed"));

    connection.close();

    assertTrue(returned.isEmpty());
    assertTrue(handle.isClosed());
  }

  @Test
  void bufferSizes() {
    assertEquals(StreamPipeConnection.DEFAULT_BUFFER_SIZE,
        StreamPipeConnection.bufferSizeFor(StreamBufferOptions.forMaxBufferSize(0)));
    assertEquals(32768,
        StreamPipeConnection.bufferSizeFor(StreamBufferOptions.forMaxBufferSize(65536)));
    assertEquals(1,
        StreamPipeConnection.bufferSizeFor(StreamBufferOptions.forMaxBufferSize(1)));
  }
}
