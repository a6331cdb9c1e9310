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

import com.sun.jna.Native;
import com.sun.jna.ptr.IntByReference;
import com.sun.jna.ptr.PointerByReference;

import com.sun.jna.win32.StdCallLibrary;
import com.sun.jna.win32.W32APIOptions;

/**
 * The advapi32 call used to turn an SDDL string into a security descriptor.
 */
public interface Win32SecurityLibrary extends StdCallLibrary {
  int SDDL_REVISION_1 = 1;

  Win32SecurityLibrary INSTANCE = Native.load(
      "advapi32", Win32SecurityLibrary.class, W32APIOptions.UNICODE_OPTIONS);

  boolean ConvertStringSecurityDescriptorToSecurityDescriptor(
    String StringSecurityDescriptor,
    int StringSDRevision,
    PointerByReference SecurityDescriptor,
    IntByReference SecurityDescriptorSize);
}
