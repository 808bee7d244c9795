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

/**
 * An assert node's condition was false
 */
public class AssertionFailureException extends InterpreterException {
  private final String procName;
  private final String label;

  public AssertionFailureException(String procName, String label,
                                   String message) {
    super("Assertion failure in proc " + procName +
          (label.isEmpty() ? "" : " (" + label + ")") + ": " + message);
    this.procName = procName;
    this.label = label;
  }

  public String procName() {
    return procName;
  }

  public String label() {
    return label;
  }

  private static final long serialVersionUID = 1L;
}
