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

package exm.hgc.common.lang;

/**
 * Declared policy for reconciling several operations on one side of a
 * channel into one legal access per activation.
 */
public enum ChannelStrictness {
  /** Operations must be statically proven to never fire together */
  PROVEN_MUTUALLY_EXCLUSIVE("proven_mutually_exclusive"),
  /** Operations must be statically proven totally ordered by tokens */
  TOTAL_ORDER("total_order"),
  /** Fixed order enforced at runtime, unordered firings are errors */
  RUNTIME_ORDERED("runtime_ordered"),
  /** At most one operation may fire per activation, checked at runtime */
  RUNTIME_MUTUALLY_EXCLUSIVE("runtime_mutually_exclusive"),
  /** Arbitrary but fixed order, no proof or check */
  ARBITRARY_STATIC_ORDER("arbitrary_static_order");

  /** Strictness of channels that don't declare one */
  public static final ChannelStrictness DEFAULT = PROVEN_MUTUALLY_EXCLUSIVE;

  private final String text;

  private ChannelStrictness(String text) {
    this.text = text;
  }

  /**
   * @return the IR text form
   */
  public String text() {
    return text;
  }

  /**
   * @param text IR text form
   * @return the strictness, or null if not recognized
   */
  public static ChannelStrictness fromString(String text) {
    for (ChannelStrictness s: values()) {
      if (s.text.equals(text)) {
        return s;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return text;
  }
}
