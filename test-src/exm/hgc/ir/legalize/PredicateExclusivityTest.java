package exm.hgc.ir.legalize;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.hgc.common.Logging;
import exm.hgc.frontend.IRParser;
import exm.hgc.ir.tree.Node;
import exm.hgc.ir.tree.Opcode;
import exm.hgc.ir.tree.Proc;
import exm.hgc.ir.tree.Program;

public class PredicateExclusivityTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("PredicateExclusivityTest.hgc.log", true);
  }

  /**
   * Build a proc with one send on channel 0 per predicate.  Each
   * predicate is a node name defined in defs, or null for unpredicated.
   */
  private static List<ChannelOpRef> sends(String defs, String... preds)
      throws Exception {
    StringBuilder sb = new StringBuilder();
    sb.append("package preds\n");
    sb.append("chan c(bits[8], id=0, kind=streaming, ops=send_only)\n");
    sb.append("chan x_in(bits[8], id=1, kind=streaming, ops=receive_only)\n");
    sb.append("top proc p(tok: token, s: bits[1], init={0}) {\n");
    sb.append("  x_recv: (token, bits[8]) = receive(tok, channel_id=1)\n");
    sb.append("  x: bits[8] = tuple_index(x_recv, index=1)\n");
    sb.append(defs);
    sb.append("  data: bits[8] = literal(value=7)\n");
    for (int i = 0; i < preds.length; i++) {
      sb.append("  send_" + i + ": token = send(tok, data, ");
      if (preds[i] != null) {
        sb.append("predicate=" + preds[i] + ", ");
      }
      sb.append("channel_id=0)\n");
    }
    sb.append("  done: token = after_all(");
    for (int i = 0; i < preds.length; i++) {
      sb.append((i > 0 ? ", " : "") + "send_" + i);
    }
    sb.append(")\n");
    sb.append("  next(done, s)\n");
    sb.append("}\n");
    Program program = IRParser.parse(sb.toString());
    Proc p = program.proc("p");
    List<ChannelOpRef> result = new ArrayList<ChannelOpRef>();
    for (Node n: p.nodes()) {
      if (n.op() == Opcode.SEND) {
        result.add(new ChannelOpRef(p, n.id()));
      }
    }
    return result;
  }

  private static boolean exclusive(String defs, String... preds)
      throws Exception {
    return PredicateExclusivity.provenMutuallyExclusive(sends(defs, preds));
  }

  @Test
  public void testSingleOperation() throws Exception {
    assertTrue(exclusive("", (String)null));
  }

  @Test
  public void testUnpredicated() throws Exception {
    assertFalse(exclusive("", null, null));
    assertFalse(exclusive("  ns: bits[1] = not(s)\n", "s", null));
  }

  @Test
  public void testNegation() throws Exception {
    String defs = "  ns: bits[1] = not(s)\n" +
                  "  nns: bits[1] = not(ns)\n";
    assertTrue(exclusive(defs, "s", "ns"));
    assertTrue(exclusive(defs, "nns", "ns"));
    assertFalse("Double negation is the same predicate",
                exclusive(defs, "s", "nns"));
    assertFalse(exclusive(defs, "s", "s"));
  }

  @Test
  public void testComparisons() throws Exception {
    String defs = "  one: bits[8] = literal(value=1)\n" +
                  "  two: bits[8] = literal(value=2)\n" +
                  "  x_is_1: bits[1] = eq(x, one)\n" +
                  "  x_is_2: bits[1] = eq(two, x)\n" +
                  "  x_not_1: bits[1] = ne(x, one)\n" +
                  "  x_not_2: bits[1] = ne(x, two)\n";
    assertTrue(exclusive(defs, "x_is_1", "x_is_2"));
    assertTrue(exclusive(defs, "x_is_1", "x_not_1"));
    assertFalse(exclusive(defs, "x_is_1", "x_not_2"));
    assertFalse(exclusive(defs, "x_not_1", "x_not_2"));
  }

  @Test
  public void testConjunction() throws Exception {
    String defs = "  ns: bits[1] = not(s)\n" +
                  "  one: bits[8] = literal(value=1)\n" +
                  "  x_is_1: bits[1] = eq(x, one)\n" +
                  "  both: bits[1] = and(s, x_is_1)\n" +
                  "  either: bits[1] = or(s, x_is_1)\n";
    assertTrue(exclusive(defs, "both", "ns"));
    assertFalse("Disjunctions are not analyzed",
                exclusive(defs, "either", "ns"));
  }

  @Test
  public void testPairwise() throws Exception {
    String defs = "  zero: bits[8] = literal(value=0)\n" +
                  "  one: bits[8] = literal(value=1)\n" +
                  "  two: bits[8] = literal(value=2)\n" +
                  "  x_is_0: bits[1] = eq(x, zero)\n" +
                  "  x_is_1: bits[1] = eq(x, one)\n" +
                  "  x_is_2: bits[1] = eq(x, two)\n";
    assertTrue(exclusive(defs, "x_is_0", "x_is_1", "x_is_2"));
    assertFalse(exclusive(defs, "x_is_0", "x_is_1", "x_is_1"));
  }

  @Test
  public void testConstantFalse() throws Exception {
    String defs = "  never: bits[1] = literal(value=0)\n" +
                  "  always: bits[1] = literal(value=1)\n" +
                  "  not_always: bits[1] = not(always)\n";
    assertTrue(exclusive(defs, "never", "s"));
    assertTrue(exclusive(defs, "not_always", "s"));
    assertFalse(exclusive(defs, "always", "s"));
  }

  @Test
  public void testAcrossProcs() throws Exception {
    Program program = IRParser.parse(
        "package two\n" +
        "chan c(bits[8], id=0, kind=streaming, ops=send_only)\n" +
        "top proc a(tok: token, s: bits[1], init={0}) {\n" +
        "  d: bits[8] = literal(value=1)\n" +
        "  snd: token = send(tok, d, predicate=s, channel_id=0)\n" +
        "  ns: bits[1] = not(s)\n" +
        "  next(snd, ns)\n" +
        "}\n" +
        "proc b(tok: token, s: bits[1], init={1}) {\n" +
        "  d: bits[8] = literal(value=1)\n" +
        "  never: bits[1] = literal(value=0)\n" +
        "  ns: bits[1] = not(s)\n" +
        "  snd: token = send(tok, d, predicate=ns, channel_id=0)\n" +
        "  snd2: token = send(snd, d, predicate=never, channel_id=0)\n" +
        "  next(snd2, ns)\n" +
        "}\n");
    Proc a = program.proc("a");
    Proc b = program.proc("b");
    int aPred = a.nodeByName("s").id();
    int bPred = b.nodeByName("ns").id();
    int bNever = b.nodeByName("never").id();
    assertFalse("Predicates in different procs are not compared",
                PredicateExclusivity.disjoint(a, aPred, b, bPred));
    assertTrue("Constant false is disjoint from anything",
               PredicateExclusivity.disjoint(a, aPred, b, bNever));
  }
}
