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

/**
 * Thrown when another listener already owns the pipe name.
 */
public class AddressInUseException extends IOException {
  private static final long serialVersionUID = 1L;

  public AddressInUseException(String message) {
    super(message);
  }

  public AddressInUseException(String message, Throwable cause) {
    super(message, cause);
  }
}
