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

package exm.hgc.common.exceptions;

import exm.hgc.common.lang.ChannelStrictness;

/**
 * A channel's declared strictness could not be established statically,
 * e.g. operations required to be totally ordered are not.
 */
public class LegalizationException extends UserException {
  private final String channelName;
  private final ChannelStrictness strictness;

  public LegalizationException(String channelName,
                      ChannelStrictness strictness, String message) {
    super(message);
    this.channelName = channelName;
    this.strictness = strictness;
  }

  public String channelName() {
    return channelName;
  }

  public ChannelStrictness strictness() {
    return strictness;
  }

  private static final long serialVersionUID = 1L;
}
