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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Log events shared by the listener and its collaborators.
 */
final class NamedPipeLog {
  static final String LOGGER_NAME = "com.martiansoftware.pipelistener";

  private static final Logger LOG = Logger.getLogger(LOGGER_NAME);

  private NamedPipeLog() {
  }

  static void connectionListenerBrokenPipe(NamedPipeEndPoint endPoint, Throwable cause) {
    if (LOG.isLoggable(Level.FINE)) {
      LOG.log(Level.FINE, "Named pipe listener " + endPoint
          + " received broken pipe while waiting for a connection", cause);
    }
  }

  static void connectionListenerAborted(NamedPipeEndPoint endPoint, Throwable cause) {
    if (LOG.isLoggable(Level.FINE)) {
      LOG.log(Level.FINE, "Named pipe listener " + endPoint + " aborted", cause);
    }
  }

  static void connectionListenerFaulted(NamedPipeEndPoint endPoint, Throwable cause) {
    LOG.log(Level.SEVERE, "Named pipe listener " + endPoint + " failed", cause);
  }

  static void acceptedConnection(PipeConnection connection) {
    if (LOG.isLoggable(Level.FINE)) {
      LOG.fine("Connection id \"" + connection.getConnectionId() + "\" accepted on "
          + connection.getEndPoint());
    }
  }

  static void connectionDisconnectFailed(String connectionId, Throwable cause) {
    LOG.log(Level.WARNING,
        "Connection id \"" + connectionId + "\" failed to disconnect its pipe", cause);
  }

  static void handleCloseFailed(Throwable cause) {
    LOG.log(Level.WARNING, "Failed to close named pipe handle", cause);
  }

  static void cancellationCallbackFailed(Throwable cause) {
    LOG.log(Level.WARNING, "Cancellation callback threw", cause);
  }
}
