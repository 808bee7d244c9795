/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.hgc.runtime;

import java.util.List;

/**
 * Requested outputs were not produced within the tick budget, or the
 * network stopped making progress
 */
public class DeadlineExceededException extends InterpreterException {
  private final long ticks;
  private final List<String> blockedChannels;

  public DeadlineExceededException(String message, long ticks,
                                   List<String> blockedChannels) {
    super(message + " after " + ticks + " ticks. Blocked channels: " +
          (blockedChannels.isEmpty() ? "none" :
                                       String.join(", ", blockedChannels)));
    this.ticks = ticks;
    this.blockedChannels = blockedChannels;
  }

  public long ticks() {
    return ticks;
  }

  public List<String> blockedChannels() {
    return blockedChannels;
  }

  private static final long serialVersionUID = 1L;
}
