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
package exm.hgc.ir.legalize;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.hgc.common.exceptions.HGCRuntimeError;
import exm.hgc.common.exceptions.UserException;
import exm.hgc.common.lang.ChannelOps;
import exm.hgc.common.lang.Types;
import exm.hgc.common.lang.Value;
import exm.hgc.common.util.Misc;
import exm.hgc.ir.legalize.LegalizationPlan.Policy;
import exm.hgc.ir.tree.Channel;
import exm.hgc.ir.tree.Node;
import exm.hgc.ir.tree.Opcode;
import exm.hgc.ir.tree.Proc;
import exm.hgc.ir.tree.ProcBuilder;
import exm.hgc.ir.tree.Program;

/**
 * Route the operations of one channel side through a new adapter proc.
 *
 * Each operation i gets a private request channel carrying its predicate
 * and a private data channel (send side) or response channel (receive
 * side).  The operation is rewired onto its private channel, after a
 * request send.  The adapter then has the only operation on the original
 * channel side.
 */
public class AdapterSynthesizer {

  public static final String ORDERING_VIOLATION_LABEL =
                                        "runtime_ordering_violation";
  public static final String EXCLUSIVITY_VIOLATION_LABEL =
                                        "runtime_exclusivity_violation";

  private final Logger logger;
  private final Program program;
  private final TokenOrder order;

  public AdapterSynthesizer(Logger logger, Program program,
                            TokenOrder order) {
    this.logger = logger;
    this.program = program;
    this.order = order;
  }

  /**
   * @return the new adapter proc, already added to the program
   */
  public Proc synthesize(LegalizationPlan plan) throws UserException {
    if (!plan.synthesizesAdapter()) {
      throw new HGCRuntimeError("No adapter needed for " + plan);
    }
    ChannelOpGroup group = plan.group();
    Channel c = group.channel();
    String dataSuffix = group.side() == ChannelSide.SEND ? "__data_"
                                                         : "__resp_";
    List<Channel> requests = new ArrayList<Channel>();
    List<Channel> privates = new ArrayList<Channel>();
    for (int i = 0; i < group.size(); i++) {
      requests.add(program.createChannel(c.name() + "__req_" + i,
          Types.BOOL, ChannelOps.SEND_RECEIVE, c.flowControl(),
          c.strictness()));
      privates.add(program.createChannel(c.name() + dataSuffix + i,
          c.payloadType(), ChannelOps.SEND_RECEIVE, c.flowControl(),
          c.strictness()));
    }

    for (int i = 0; i < group.size(); i++) {
      rewire(group, i, requests.get(i), privates.get(i));
    }

    Proc adapter = new Proc(program.uniqueProcName(
                  c.name() + "__" + group.side() + "_adapter"), true);
    AdapterBuilder b = new AdapterBuilder(program, adapter);
    buildAdapter(b, plan, requests, privates);
    program.addProc(adapter);
    logger.debug("Synthesized " + adapter.name() + " with " +
                 adapter.nodeCount() + " nodes for " + group.describe());
    return adapter;
  }

  /**
   * Insert the request send before the operation and move the operation
   * onto its private channel.  Operations in the same proc are also
   * threaded in reference order.
   */
  private void rewire(ChannelOpGroup group, int i, Channel request,
                      Channel priv) throws UserException {
    ChannelOpRef ref = group.op(i);
    Proc proc = ref.proc();
    Node node = ref.node();
    ProcBuilder b = new ProcBuilder(program, proc);
    b.setInsertionPoint(node.id());

    int tok = node.tokenOperand();
    if (i > 0) {
      ChannelOpRef prev = group.op(i - 1);
      if (prev.proc() == proc && !order.happensBefore(prev, ref)) {
        Node prevNode = prev.node();
        int prevTok = prevNode.id();
        if (prevNode.op() == Opcode.RECEIVE) {
          prevTok = b.tupleIndex(b.fresh(prevNode.name() + "_token"),
                                 prevNode.id(), 0).id();
        }
        tok = b.afterAll(b.fresh(node.name() + "_after_" + prevNode.name()),
                         Arrays.asList(tok, prevTok)).id();
      }
    }

    Integer pred = node.predicate();
    int reqData;
    if (pred != null) {
      reqData = pred;
    } else {
      reqData = b.literal(b.fresh(node.name() + "_always"),
                          Value.bool(true)).id();
    }
    Node reqSend = b.send(b.fresh(node.name() + "_req"), tok, reqData,
                          null, request.id());
    b.setTokenOperand(node.id(), reqSend.id());
    node.setChannelId(priv.id());
    order.invalidate(proc);
    logger.trace("Rewired " + ref + " onto " + priv.name());
  }

  /**
   * The adapter holds a turn index.  Each activation takes only the
   * request of the operation whose turn it is, then advances the turn,
   * wrapping after the last operation.  A whole round of turns matches
   * one activation of each source proc.  Whichever operation fires, the
   * adapter transfers its payload through a single operation on the
   * original channel.
   *
   * Checked orders also keep a fired bit for each operation with an
   * unordered predecessor.  Mutual exclusion keeps one bit recording
   * whether anything fired earlier in the round.
   */
  private void buildAdapter(AdapterBuilder b, LegalizationPlan plan,
      List<Channel> requests, List<Channel> privates) throws UserException {
    ChannelOpGroup group = plan.group();
    int n = group.size();
    int width = Misc.bitsToIndex(n);
    int t = b.tokenParam("tok").id();
    int turn = b.stateParam("turn", Types.bits(width),
                            Value.bits(width, 0)).id();

    boolean checked = plan.policy() == Policy.CHECKED_ORDER;
    boolean exclusive = plan.policy() == Policy.MUTUAL_EXCLUSION;
    Map<Integer, Integer> fired = new LinkedHashMap<Integer, Integer>();
    if (checked) {
      for (int i = 0; i < n; i++) {
        if (plan.tracksFired(i)) {
          fired.put(i, b.stateParam("fired_" + i, Types.BOOL,
                                    Value.bool(false)).id());
        }
      }
    }
    Integer anyFired = null;
    if (exclusive) {
      anyFired = b.stateParam("any_fired", Types.BOOL,
                              Value.bool(false)).id();
    }

    List<Integer> fire = new ArrayList<Integer>(n);
    List<Integer> data = new ArrayList<Integer>(n);
    int isTurn = -1;
    for (int i = 0; i < n; i++) {
      isTurn = b.binary(b.fresh("is_turn_" + i), Opcode.EQ, turn,
                        b.constant(Value.bits(width, i))).id();
      Node req = b.receive(b.fresh("req_" + i), t, isTurn,
                           requests.get(i).id());
      t = b.tupleIndex(b.fresh("req_" + i + "_token"), req.id(), 0).id();
      int valid = b.tupleIndex(b.fresh("req_" + i + "_pred"),
                               req.id(), 1).id();
      int fireI = b.binary(b.fresh("fire_" + i), Opcode.AND,
                           isTurn, valid).id();
      fire.add(fireI);

      if (checked && !plan.unorderedPredecessors(i).isEmpty()) {
        t = orderCheck(b, plan, i, t, fireI, fired);
      }
      if (exclusive && i > 0) {
        int overlap = b.binary(b.fresh("overlap_" + i), Opcode.AND,
                               fireI, anyFired).id();
        int ok = b.not(b.fresh("exclusive_" + i), overlap).id();
        String msg = "Operation " + group.op(i) + " on channel " +
            group.channel().name() + " fired in the same activation as " +
            "an earlier operation: predicate was not mutually exclusive";
        t = b.assertion(b.fresh("exclusive_check_" + i), t, ok, msg,
                        EXCLUSIVITY_VIOLATION_LABEL).id();
      }

      if (group.side() == ChannelSide.SEND) {
        Node in = b.receive(b.fresh("data_" + i), t, fireI,
                            privates.get(i).id());
        t = b.tupleIndex(b.fresh("data_" + i + "_token"), in.id(), 0).id();
        data.add(b.tupleIndex(b.fresh("data_" + i + "_value"),
                              in.id(), 1).id());
      }
    }

    int anyFire = b.nary(b.fresh("any_fire"), Opcode.OR, fire).id();
    t = transfer(b, group, t, anyFire, fire, data, privates);

    // isTurn of the last operation marks the end of a round
    int isLast = isTurn;
    List<Integer> next = new ArrayList<Integer>();
    int inc = b.binary(b.fresh("turn_inc"), Opcode.ADD, turn,
                       b.constant(Value.bits(width, 1))).id();
    next.add(b.sel(b.fresh("next_turn"), isLast, inc,
                   b.constant(Value.bits(width, 0))).id());
    for (Map.Entry<Integer, Integer> e: fired.entrySet()) {
      int j = e.getKey();
      int seen = b.binary(b.fresh("fired_or_" + j), Opcode.OR,
                          e.getValue(), fire.get(j)).id();
      next.add(b.sel(b.fresh("next_fired_" + j), isLast, seen,
                     b.constant(Value.bool(false))).id());
    }
    if (exclusive) {
      int seen = b.binary(b.fresh("any_fired_or"), Opcode.OR,
                          anyFired, anyFire).id();
      next.add(b.sel(b.fresh("next_any_fired"), isLast, seen,
                     b.constant(Value.bool(false))).id());
    }
    b.proc().setNext(t, next);
  }

  /**
   * Assert that operation i does not fire after an unordered earlier
   * operation already fired in this round
   * @return token after the assertion
   */
  private int orderCheck(AdapterBuilder b, LegalizationPlan plan, int i,
      int t, int fireI, Map<Integer, Integer> fired) throws UserException {
    ChannelOpGroup group = plan.group();
    List<Integer> conflicts = new ArrayList<Integer>();
    List<String> names = new ArrayList<String>();
    for (int j: plan.unorderedPredecessors(i)) {
      conflicts.add(b.binary(b.fresh("conflict_" + i + "_" + j),
                    Opcode.AND, fireI, fired.get(j)).id());
      names.add(group.op(j).toString());
    }
    int anyConflict = conflicts.size() == 1 ? conflicts.get(0) :
          b.nary(b.fresh("any_conflict_" + i), Opcode.OR, conflicts).id();
    int inOrder = b.not(b.fresh("in_order_" + i), anyConflict).id();
    String msg = "Operation " + group.op(i) + " on channel " +
        group.channel().name() + " fired out of turn: predicate was not " +
        "mutually exclusive with unordered operation " +
        StringUtils.join(names, ", ") + ", which already fired in this round";
    return b.assertion(b.fresh("order_check_" + i), t, inOrder, msg,
                       ORDERING_VIOLATION_LABEL).id();
  }

  /**
   * The single operation on the original channel.  A send takes the
   * payload of whichever operation fires.  A receive hands its payload
   * to the response channel of whichever operation fires.
   * @param data payloads received from the data channels, send side only
   * @return token after the transfer
   */
  private int transfer(AdapterBuilder b, ChannelOpGroup group, int t,
      int anyFire, List<Integer> fire, List<Integer> data,
      List<Channel> privates) throws UserException {
    Channel c = group.channel();
    int n = fire.size();
    if (group.side() == ChannelSide.SEND) {
      int payload = data.get(n - 1);
      for (int i = n - 2; i >= 0; i--) {
        payload = b.sel(b.fresh("payload_" + i), fire.get(i), payload,
                        data.get(i)).id();
      }
      return b.send(b.fresh(c.name() + "_send"), t, payload, anyFire,
                    c.id()).id();
    }

    Node recv = b.receive(b.fresh(c.name() + "_recv"), t, anyFire, c.id());
    t = b.tupleIndex(b.fresh(c.name() + "_recv_token"), recv.id(), 0).id();
    int payload = b.tupleIndex(b.fresh(c.name() + "_recv_data"),
                               recv.id(), 1).id();
    for (int i = 0; i < n; i++) {
      t = b.send(b.fresh("resp_" + i), t, payload, fire.get(i),
                 privates.get(i).id()).id();
    }
    return t;
  }

  /**
   * Builder that shares one literal node per distinct value
   */
  private static class AdapterBuilder extends ProcBuilder {
    private final Map<Value, Integer> constants = new HashMap<Value, Integer>();

    AdapterBuilder(Program program, Proc proc) {
      super(program, proc);
    }

    int constant(Value value) throws UserException {
      Integer h = constants.get(value);
      if (h == null) {
        h = literal(fresh("lit_" + value.text()), value).id();
        constants.put(value, h);
      }
      return h;
    }
  }
}
