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

import java.io.IOException;

/**
 * An {@link IOException} carrying the Win32 error code that caused it.
 */
public class Win32IOException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int errorCode;

  public Win32IOException(String operation, String path, int errorCode) {
    super(String.format("Could not %s named pipe %s, error %d", operation, path, errorCode));
    this.errorCode = errorCode;
  }

  public int getErrorCode() {
    return errorCode;
  }
}
