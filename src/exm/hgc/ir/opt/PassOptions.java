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
package exm.hgc.ir.opt;

import exm.hgc.common.Settings;

/**
 * Options shared by all passes in a pipeline run
 */
public class PassOptions {
  /**
   * If true, procs will be inlined into a single proc downstream, so
   * the validator also checks that the program is ready for code
   * generation.
   */
  private final boolean inlineProcs;

  public PassOptions(boolean inlineProcs) {
    this.inlineProcs = inlineProcs;
  }

  public static PassOptions defaults() {
    return new PassOptions(false);
  }

  public static PassOptions fromSettings() {
    return new PassOptions(Settings.getBooleanUnchecked(Settings.INLINE_PROCS));
  }

  public boolean inlineProcs() {
    return inlineProcs;
  }

  @Override
  public String toString() {
    return "PassOptions(inlineProcs=" + inlineProcs + ")";
  }
}
