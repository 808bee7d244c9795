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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.hgc.common.exceptions.HGCRuntimeError;
import exm.hgc.common.exceptions.TypeMismatchException;
import exm.hgc.common.exceptions.UserException;
import exm.hgc.common.lang.Types.Type;
import exm.hgc.ir.legalize.ChannelOpRef;
import exm.hgc.ir.legalize.PredicateExclusivity;
import exm.hgc.ir.tree.Channel;
import exm.hgc.ir.tree.Node;
import exm.hgc.ir.tree.Opcode;
import exm.hgc.ir.tree.Proc;
import exm.hgc.ir.tree.ProcBuilder;
import exm.hgc.ir.tree.Program;

/**
 * Perform various sanity checks on IR.  Any failure indicates a compiler
 * bug, so is reported with an unchecked exception.
 *
 * The codegen validator, used when procs will be inlined downstream, also
 * checks that the program is ready for code generation: a channel side with several operations is
 * only allowed if they are proven mutually exclusive.
 */
public class Validate implements Pass {

  private final boolean checkCodegenReady;

  private Validate(boolean checkCodegenReady) {
    this.checkCodegenReady = checkCodegenReady;
  }

  public static Validate standardValidator() {
    return new Validate(false);
  }

  /**
   * @return validator that additionally checks code generation readiness
   */
  public static Validate codegenValidator() {
    return new Validate(true);
  }

  @Override
  public String getPassName() {
    return "Validate";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public boolean run(Logger logger, Program program, PassOptions options,
                     PassResults results) throws UserException {
    validate(logger, program, checkCodegenReady);
    return false;
  }

  public static void validate(Logger logger, Program program,
                              boolean codegenReady) {
    if (program.topProc() != null && program.proc(program.topProc()) == null) {
      throw new HGCRuntimeError("Top proc " + program.topProc() +
                                " does not exist");
    }
    for (Proc p: program.procs()) {
      checkProc(logger, program, p);
    }
    if (codegenReady) {
      checkCodegenReady(logger, program);
    }
  }

  private static void checkProc(Logger logger, Program program, Proc proc) {
    Map<Integer, Integer> positions = new HashMap<Integer, Integer>();
    Map<String, Node> names = new HashMap<String, Node>();
    boolean seenNonParam = false;
    List<Node> nodes = proc.nodes();
    for (int i = 0; i < nodes.size(); i++) {
      Node n = nodes.get(i);
      if (names.put(n.name(), n) != null) {
        throw new HGCRuntimeError("Duplicate node name " + n.name() +
                                  " in proc " + proc.name());
      }
      if (n.op() == Opcode.PARAM) {
        if (seenNonParam) {
          throw new HGCRuntimeError("Parameter " + n.name() + " after " +
                    "other nodes in proc " + proc.name());
        }
      } else {
        seenNonParam = true;
      }

      for (int operand: n.operands()) {
        if (!positions.containsKey(operand)) {
          throw new HGCRuntimeError("Operand " + operand + " of " + n.name()
              + " in proc " + proc.name() + " is not defined before use");
        }
      }

      Type inferred;
      try {
        inferred = ProcBuilder.inferType(program, proc, n);
      } catch (TypeMismatchException e) {
        throw new HGCRuntimeError("Ill-typed node in proc " + proc.name() +
                                  ": " + e.getMessage());
      }
      if (!inferred.equals(n.type())) {
        throw new HGCRuntimeError("Node " + n.name() + " has type " +
                n.type() + " but operands give " + inferred);
      }
      positions.put(n.id(), i);
    }

    if (proc.tokenParam() < 0) {
      throw new HGCRuntimeError("Proc " + proc.name() +
                                " has no token parameter");
    }
    if (!positions.containsKey(proc.nextToken()) ||
        !proc.node(proc.nextToken()).type().isToken()) {
      throw new HGCRuntimeError("Proc " + proc.name() +
                                " has no valid next token");
    }
    List<Integer> state = proc.stateParams();
    List<Integer> next = proc.nextState();
    if (state.size() != next.size() ||
        state.size() != proc.initValues().size()) {
      throw new HGCRuntimeError("Proc " + proc.name() + " has " +
          state.size() + " state elements, " + proc.initValues().size() +
          " initial values and " + next.size() + " next values");
    }
    for (int i = 0; i < state.size(); i++) {
      Type stateType = proc.node(state.get(i)).type();
      if (!positions.containsKey(next.get(i)) ||
          !proc.node(next.get(i)).type().equals(stateType) ||
          !proc.initValues().get(i).type().equals(stateType)) {
        throw new HGCRuntimeError("Bad next value or initial value for " +
            "state element " + i + " of proc " + proc.name());
      }
    }
    logger.trace("Validated proc " + proc.name());
  }

  private static void checkCodegenReady(Logger logger, Program program) {
    ListMultimap<Integer, ChannelOpRef> sends = ArrayListMultimap.create();
    ListMultimap<Integer, ChannelOpRef> receives =
                                            ArrayListMultimap.create();
    for (Proc p: program.procs()) {
      for (Node n: p.nodes()) {
        if (n.op() == Opcode.SEND) {
          sends.put(n.channelId(), new ChannelOpRef(p, n.id()));
        } else if (n.op() == Opcode.RECEIVE) {
          receives.put(n.channelId(), new ChannelOpRef(p, n.id()));
        }
      }
    }
    for (Channel c: program.channels()) {
      checkSideReady(c, "send", sends.get(c.id()));
      checkSideReady(c, "receive", receives.get(c.id()));
    }
    logger.trace("Program is ready for code generation");
  }

  private static void checkSideReady(Channel c, String side,
                                     List<ChannelOpRef> ops) {
    if (ops.size() > 1 &&
        !PredicateExclusivity.provenMutuallyExclusive(ops)) {
      throw new HGCRuntimeError("Channel " + c.name() + " has " + ops.size()
          + " " + side + " operations that are not proven mutually "
          + "exclusive, with strictness " + c.strictness());
    }
  }
}
