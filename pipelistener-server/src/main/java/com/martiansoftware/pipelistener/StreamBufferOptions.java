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

/**
 * Buffering limits for one direction of a connection. The writer into the
 * buffer pauses once {@link #getPauseWriterThreshold()} bytes are pending and
 * resumes when the backlog drops below {@link #getResumeWriterThreshold()}.
 * A maximum of zero means unbounded.
 */
public final class StreamBufferOptions {
  private final long pauseWriterThreshold;
  private final long resumeWriterThreshold;

  private StreamBufferOptions(long pauseWriterThreshold, long resumeWriterThreshold) {
    this.pauseWriterThreshold = pauseWriterThreshold;
    this.resumeWriterThreshold = resumeWriterThreshold;
  }

  public static StreamBufferOptions forMaxBufferSize(long maxBufferSize) {
    if (maxBufferSize < 0) {
      throw new IllegalArgumentException("Buffer size must not be negative: " + maxBufferSize);
    }
    return new StreamBufferOptions(maxBufferSize, maxBufferSize / 2);
  }

  public long getPauseWriterThreshold() {
    return pauseWriterThreshold;
  }

  public long getResumeWriterThreshold() {
    return resumeWriterThreshold;
  }

  public boolean isUnbounded() {
    return pauseWriterThreshold == 0;
  }

  @Override
  public String toString() {
    return isUnbounded()
        ? "StreamBufferOptions[unbounded]"
        : "StreamBufferOptions[pause=" + pauseWriterThreshold
            + ", resume=" + resumeWriterThreshold + "]";
  }
}
