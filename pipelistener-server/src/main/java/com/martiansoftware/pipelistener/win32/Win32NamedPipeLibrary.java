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
package com.martiansoftware.pipelistener.win32;

import java.util.Arrays;
import java.util.List;

import com.sun.jna.FromNativeContext;
import com.sun.jna.Native;
import com.sun.jna.Pointer;
import com.sun.jna.PointerType;
import com.sun.jna.Structure;
import com.sun.jna.ptr.IntByReference;

import com.sun.jna.win32.StdCallLibrary;
import com.sun.jna.win32.W32APIOptions;

/**
 * Bridges the kernel32 calls needed for overlapped named pipe servers to Java
 * using JNA. Loading this interface on a non-Windows platform fails, so it is
 * only touched once {@link com.sun.jna.Platform#isWindows()} holds.
 */
public interface Win32NamedPipeLibrary extends StdCallLibrary {
  int PIPE_ACCESS_DUPLEX = 3;
  int PIPE_TYPE_BYTE = 0;
  int PIPE_READMODE_BYTE = 0;
  int PIPE_WAIT = 0;
  int PIPE_REJECT_REMOTE_CLIENTS = 8;
  int PIPE_UNLIMITED_INSTANCES = 255;
  int FILE_FLAG_OVERLAPPED = 0x40000000;
  int FILE_FLAG_WRITE_THROUGH = 0x80000000;

  int ERROR_ALREADY_EXISTS = 183;
  int ERROR_BROKEN_PIPE = 109;
  int ERROR_NO_DATA = 232;
  int ERROR_PIPE_CONNECTED = 535;
  int ERROR_PIPE_NOT_CONNECTED = 233;
  int ERROR_OPERATION_ABORTED = 995;
  int ERROR_IO_PENDING = 997;

  HANDLE INVALID_HANDLE_VALUE =
    new HANDLE(Pointer.createConstant(Native.POINTER_SIZE == 8 ? -1 : 0xFFFFFFFFL));

  Win32NamedPipeLibrary INSTANCE = Native.load(
      "kernel32", Win32NamedPipeLibrary.class, W32APIOptions.UNICODE_OPTIONS);

  public static class SECURITY_ATTRIBUTES extends Structure {
    public int dwLength;
    public Pointer lpSecurityDescriptor;
    public boolean bInheritHandle;

    protected List<String> getFieldOrder() {
      return Arrays.asList("dwLength", "lpSecurityDescriptor", "bInheritHandle");
    }

    public SECURITY_ATTRIBUTES() {
      dwLength = size();
    }
  }

  public static class OVERLAPPED extends Structure {
    public Pointer Internal;
    public Pointer InternalHigh;
    public int Offset;
    public int OffsetHigh;
    public HANDLE hEvent;

    protected List<String> getFieldOrder() {
      return Arrays.asList("Internal", "InternalHigh", "Offset", "OffsetHigh", "hEvent");
    }
  }

  public static class HANDLE extends PointerType {
    public HANDLE() {
    }

    public HANDLE(Pointer p) {
      setPointer(p);
    }

    public Object fromNative(Object nativeValue, FromNativeContext context) {
      Object o = super.fromNative(nativeValue, context);
      if (INVALID_HANDLE_VALUE.equals(o)) {
        return INVALID_HANDLE_VALUE;
      }
      return o;
    }
  }

  HANDLE CreateNamedPipe(
    String lpName,
    int dwOpenMode,
    int dwPipeMode,
    int nMaxInstances,
    int nOutBufferSize,
    int nInBufferSize,
    int nDefaultTimeOut,
    SECURITY_ATTRIBUTES lpSecurityAttributes);
  boolean ConnectNamedPipe(HANDLE hNamedPipe, Pointer lpOverlapped);
  boolean DisconnectNamedPipe(HANDLE hNamedPipe);
  boolean ReadFile(
    HANDLE hFile,
    Pointer lpBuffer,
    int nNumberOfBytesToRead,
    IntByReference lpNumberOfBytesRead,
    Pointer lpOverlapped);
  boolean WriteFile(
    HANDLE hFile,
    Pointer lpBuffer,
    int nNumberOfBytesToWrite,
    IntByReference lpNumberOfBytesWritten,
    Pointer lpOverlapped);
  boolean GetOverlappedResult(
    HANDLE hFile,
    Pointer lpOverlapped,
    IntByReference lpNumberOfBytesTransferred,
    boolean bWait);
  boolean CancelIoEx(HANDLE hFile, Pointer lpOverlapped);
  HANDLE CreateEvent(
    SECURITY_ATTRIBUTES lpEventAttributes,
    boolean bManualReset,
    boolean bInitialState,
    String lpName);
  HANDLE CreateMutex(
    SECURITY_ATTRIBUTES lpMutexAttributes,
    boolean bInitialOwner,
    String lpName);
  boolean CloseHandle(HANDLE hObject);
  Pointer LocalFree(Pointer hMem);
}
