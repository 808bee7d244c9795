package exm.hgc.ir.legalize;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.hgc.common.Logging;
import exm.hgc.frontend.IRParser;
import exm.hgc.ir.tree.Proc;
import exm.hgc.ir.tree.ProcBuilder;
import exm.hgc.ir.tree.Program;

public class TokenDependencyAnalysisTest {

  private static final String IR =
      "package deps\n" +
      "chan c(bits[8], id=0, kind=streaming, ops=send_receive)\n" +
      "top proc p(tok: token, init={}) {\n" +
      "  r0: (token, bits[8]) = receive(tok, channel_id=0)\n" +
      "  r0_tok: token = tuple_index(r0, index=0)\n" +
      "  r0_data: bits[8] = tuple_index(r0, index=1)\n" +
      "  r1: (token, bits[8]) = receive(r0_tok, channel_id=0)\n" +
      "  r2: (token, bits[8]) = receive(r0_tok, channel_id=0)\n" +
      "  r1_tok: token = tuple_index(r1, index=0)\n" +
      "  r2_tok: token = tuple_index(r2, index=0)\n" +
      "  joined: token = after_all(r1_tok, r2_tok)\n" +
      "  s0: token = send(joined, r0_data, channel_id=0)\n" +
      "  s1: token = send(tok, r0_data, channel_id=0)\n" +
      "  all: token = after_all(s0, s1)\n" +
      "  next(all)\n" +
      "}\n";

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("TokenDependencyAnalysisTest.hgc.log", true);
  }

  private static int h(Proc p, String name) {
    return p.nodeByName(name).id();
  }

  @Test
  public void testChainsAndJoins() throws Exception {
    Program program = IRParser.parse(IR);
    Proc p = program.proc("p");
    TokenDependencyAnalysis deps = new TokenDependencyAnalysis(p);

    assertTrue(deps.happensBefore(h(p, "r0"), h(p, "r1")));
    assertTrue(deps.happensBefore(h(p, "r0"), h(p, "r2")));
    assertFalse("Order is not symmetric",
                deps.happensBefore(h(p, "r1"), h(p, "r0")));
    assertFalse("Siblings are unordered", deps.ordered(h(p, "r1"), h(p, "r2")));

    // Through after_all
    assertTrue(deps.happensBefore(h(p, "r1"), h(p, "s0")));
    assertTrue(deps.happensBefore(h(p, "r2"), h(p, "s0")));
    assertTrue("Transitive", deps.happensBefore(h(p, "r0"), h(p, "s0")));
  }

  @Test
  public void testDataDoesNotOrder() throws Exception {
    Program program = IRParser.parse(IR);
    Proc p = program.proc("p");
    TokenDependencyAnalysis deps = new TokenDependencyAnalysis(p);

    // s1 uses r0's data but only the proc token
    assertFalse(deps.ordered(h(p, "r0"), h(p, "s1")));
    assertFalse(deps.ordered(h(p, "s0"), h(p, "s1")));
  }

  @Test
  public void testTotalOrder() throws Exception {
    Program program = IRParser.parse(IR);
    Proc p = program.proc("p");
    TokenDependencyAnalysis deps = new TokenDependencyAnalysis(p);

    assertTrue(deps.isTotallyOrdered(Arrays.asList(h(p, "r0"), h(p, "r1"),
                                                   h(p, "s0"))));
    assertFalse(deps.isTotallyOrdered(Arrays.asList(h(p, "r0"), h(p, "r1"),
                                                    h(p, "r2"))));
    assertTrue("Single operation",
               deps.isTotallyOrdered(Arrays.asList(h(p, "s1"))));
  }

  @Test
  public void testAcrossProcs() throws Exception {
    Program program = IRParser.parse(IR +
        "proc q(tok: token, init={}) {\n" +
        "  r: (token, bits[8]) = receive(tok, channel_id=0)\n" +
        "  r_tok: token = tuple_index(r, index=0)\n" +
        "  next(r_tok)\n" +
        "}\n");
    Proc p = program.proc("p");
    Proc q = program.proc("q");
    TokenOrder order = new TokenOrder();
    ChannelOpRef r0 = new ChannelOpRef(p, h(p, "r0"));
    ChannelOpRef r1 = new ChannelOpRef(p, h(p, "r1"));
    ChannelOpRef qr = new ChannelOpRef(q, h(q, "r"));

    assertTrue(order.happensBefore(r0, r1));
    assertFalse(order.ordered(r0, qr));
    assertTrue(order.isTotallyOrdered(Arrays.asList(r0, r1)));
    assertFalse("Operations in different procs are never ordered",
                order.isTotallyOrdered(Arrays.asList(r0, qr)));
  }

  @Test
  public void testInvalidateAfterRewiring() throws Exception {
    Program program = IRParser.parse(IR);
    Proc p = program.proc("p");
    TokenOrder order = new TokenOrder();
    ChannelOpRef r1 = new ChannelOpRef(p, h(p, "r1"));
    ChannelOpRef r2 = new ChannelOpRef(p, h(p, "r2"));
    assertFalse(order.ordered(r1, r2));

    // Thread r2 after r1
    ProcBuilder b = new ProcBuilder(program, p);
    b.setInsertionPoint(h(p, "r2"));
    int r1Tok = b.tupleIndex(b.fresh("r1_token"), h(p, "r1"), 0).id();
    b.setTokenOperand(h(p, "r2"), r1Tok);

    order.invalidate(p);
    assertTrue(order.happensBefore(r1, r2));
    assertFalse(order.happensBefore(r2, r1));
  }
}
