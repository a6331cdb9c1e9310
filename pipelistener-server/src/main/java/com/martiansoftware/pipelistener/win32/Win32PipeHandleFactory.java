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

import com.martiansoftware.pipelistener.NamedPipeEndPoint;
import com.martiansoftware.pipelistener.NamedPipeTransportOptions;
import com.martiansoftware.pipelistener.PipeHandle;
import com.martiansoftware.pipelistener.PipeHandleFactory;
import com.martiansoftware.pipelistener.win32.Win32NamedPipeLibrary.HANDLE;
import com.martiansoftware.pipelistener.win32.Win32NamedPipeLibrary.SECURITY_ATTRIBUTES;

import com.sun.jna.Native;
import com.sun.jna.Platform;
import com.sun.jna.Pointer;
import com.sun.jna.platform.win32.Advapi32Util;
import com.sun.jna.ptr.PointerByReference;

import java.io.IOException;

/**
 * Creates overlapped, write-through Win32 named pipe instances with no OS-side
 * buffering; buffering belongs to the connection's stream layer.
 */
public class Win32PipeHandleFactory implements PipeHandleFactory {
  private static final int OPEN_MODE = Win32NamedPipeLibrary.PIPE_ACCESS_DUPLEX
      | Win32NamedPipeLibrary.FILE_FLAG_OVERLAPPED
      | Win32NamedPipeLibrary.FILE_FLAG_WRITE_THROUGH;
  private static final int PIPE_MODE = Win32NamedPipeLibrary.PIPE_TYPE_BYTE
      | Win32NamedPipeLibrary.PIPE_READMODE_BYTE
      | Win32NamedPipeLibrary.PIPE_WAIT
      | Win32NamedPipeLibrary.PIPE_REJECT_REMOTE_CLIENTS;

  public PipeHandle create(NamedPipeEndPoint endPoint, NamedPipeTransportOptions options)
      throws IOException {
    if (!Platform.isWindows()) {
      throw new IOException("Win32 named pipes are not available on this platform");
    }
    String path = endPoint.getPath();
    String sddl = securityDescriptorFor(options);
    Pointer descriptor = sddl == null ? null : convertSecurityDescriptor(sddl);
    try {
      SECURITY_ATTRIBUTES attributes = null;
      if (descriptor != null) {
        attributes = new SECURITY_ATTRIBUTES();
        attributes.lpSecurityDescriptor = descriptor;
        attributes.bInheritHandle = false;
      }
      HANDLE handle = Win32NamedPipeLibrary.INSTANCE.CreateNamedPipe(
        path,
        OPEN_MODE,
        PIPE_MODE,
        Win32NamedPipeLibrary.PIPE_UNLIMITED_INSTANCES,
        /* nOutBufferSize */ 0,
        /* nInBufferSize */ 0,
        /* nDefaultTimeOut */ 0,
        attributes);
      if (handle == null || handle == Win32NamedPipeLibrary.INVALID_HANDLE_VALUE) {
        throw new Win32IOException("create", path, Native.getLastError());
      }
      return new Win32NamedPipeHandle(handle, path);
    } finally {
      if (descriptor != null) {
        Win32NamedPipeLibrary.INSTANCE.LocalFree(descriptor);
      }
    }
  }

  /**
   * An explicit descriptor wins; otherwise restricting to the current user
   * grants full access to that user's SID alone.
   */
  static String securityDescriptorFor(NamedPipeTransportOptions options) {
    if (options.getAccessControlDescriptor() != null) {
      return options.getAccessControlDescriptor();
    }
    if (options.isRestrictToCurrentUser()) {
      String sid = Advapi32Util.getAccountByName(Advapi32Util.getUserName()).sidString;
      return currentUserDescriptor(sid);
    }
    return null;
  }

  static String currentUserDescriptor(String sid) {
    return "O:" + sid + "D:P(A;;GA;;;" + sid + ")";
  }

  private static Pointer convertSecurityDescriptor(String sddl) throws IOException {
    PointerByReference descriptor = new PointerByReference();
    if (!Win32SecurityLibrary.INSTANCE.ConvertStringSecurityDescriptorToSecurityDescriptor(
        sddl, Win32SecurityLibrary.SDDL_REVISION_1, descriptor, null)) {
      throw new IOException(String.format(
          "Invalid access control descriptor '%s', error %d", sddl, Native.getLastError()));
    }
    return descriptor.getValue();
  }
}
