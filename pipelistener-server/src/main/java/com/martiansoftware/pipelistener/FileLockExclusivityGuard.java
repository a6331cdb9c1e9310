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
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ExclusivityGuard} backed by an exclusive {@link FileLock} on a lock
 * file named after the pipe.
 */
public final class FileLockExclusivityGuard implements ExclusivityGuard {
  private final Path lockFile;
  private final FileChannel channel;
  private final FileLock lock;
  private final AtomicBoolean released = new AtomicBoolean();

  private FileLockExclusivityGuard(Path lockFile, FileChannel channel, FileLock lock) {
    this.lockFile = lockFile;
    this.channel = channel;
    this.lock = lock;
  }

  /**
   * Guards in the directory named by {@code java.io.tmpdir}.
   */
  public static Factory factory() {
    return factory(Paths.get(System.getProperty("java.io.tmpdir")));
  }

  public static Factory factory(final Path directory) {
    return new Factory() {
      public ExclusivityGuard acquire(NamedPipeEndPoint endPoint) throws IOException {
        return FileLockExclusivityGuard.acquire(directory, endPoint);
      }
    };
  }

  public static FileLockExclusivityGuard acquire(Path directory, NamedPipeEndPoint endPoint)
      throws IOException {
    Path lockFile = directory.resolve(lockFileName(endPoint));
    FileChannel channel = FileChannel.open(
        lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
    FileLock lock;
    try {
      lock = channel.tryLock();
    } catch (OverlappingFileLockException e) {
      channel.close();
      throw new AddressInUseException("Named pipe " + endPoint + " is already in use", e);
    } catch (IOException e) {
      channel.close();
      throw e;
    }
    if (lock == null) {
      channel.close();
      throw new AddressInUseException("Named pipe " + endPoint + " is already in use");
    }
    return new FileLockExclusivityGuard(lockFile, channel, lock);
  }

  static String lockFileName(NamedPipeEndPoint endPoint) {
    String name = endPoint.getServerName() + "-" + endPoint.getPipeName();
    return "pipelistener-"
        + name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", "_") + ".lock";
  }

  public Path getLockFile() {
    return lockFile;
  }

  public boolean isReleased() {
    return released.get();
  }

  public void close() throws IOException {
    if (released.compareAndSet(false, true)) {
      try {
        lock.release();
      } finally {
        channel.close();
      }
    }
  }
}
