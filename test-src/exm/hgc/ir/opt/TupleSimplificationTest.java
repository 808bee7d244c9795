package exm.hgc.ir.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.hgc.common.Logging;
import exm.hgc.frontend.IRParser;
import exm.hgc.ir.tree.Proc;
import exm.hgc.ir.tree.Program;

public class TupleSimplificationTest {

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("TupleSimplificationTest.hgc.log", true);
  }

  private static final String IR =
      "package tuples\n" +
      "chan c(bits[8], id=0, kind=streaming, ops=send_receive)\n" +
      "top proc p(tok: token, init={}) {\n" +
      "  r: (token, bits[8]) = receive(tok, channel_id=0)\n" +
      "  r_tok: token = tuple_index(r, index=0)\n" +
      "  r_data: bits[8] = tuple_index(r, index=1)\n" +
      "  k: bits[8] = literal(value=3)\n" +
      "  t: (bits[8], bits[8]) = tuple(k, r_data)\n" +
      "  second: bits[8] = tuple_index(t, index=1)\n" +
      "  again: (token, bits[8]) = tuple(r_tok, r_data)\n" +
      "  again_tok: token = tuple_index(again, index=0)\n" +
      "  s: token = send(again_tok, second, channel_id=0)\n" +
      "  next(s)\n" +
      "}\n";

  @Test
  public void testIndexOfTuple() throws Exception {
    Program program = IRParser.parse(IR);
    Proc p = program.proc("p");
    boolean changed = new TupleSimplification().runOnProc(logger, program, p,
                                                  PassOptions.defaults());
    assertTrue(changed);
    assertEquals("Send takes the tuple element directly",
                 p.nodeByName("r_data").id(),
                 p.nodeByName("s").dataOperand());
    assertFalse(p.hasUses(p.nodeByName("second").id()));
  }

  @Test
  public void testReassembledTuple() throws Exception {
    Program program = IRParser.parse(IR);
    Proc p = program.proc("p");
    new TupleSimplification().runOnProc(logger, program, p,
                                        PassOptions.defaults());
    // again rebuilds r, so again_tok reads r instead
    assertEquals(p.nodeByName("r").id(),
                 p.nodeByName("again_tok").operand(0));
  }

  @Test
  public void testWithDeadCodeElimination() throws Exception {
    Program program = IRParser.parse(IR);
    PassPipeline pipeline = new PassPipeline(null);
    pipeline.addPass(new TupleSimplification());
    pipeline.addPass(new DeadCodeEliminator());
    pipeline.addPass(Validate.standardValidator());
    PassResults results = new PassResults();
    assertTrue(pipeline.runPipeline(logger, program, PassOptions.defaults(),
                                    results));

    Proc p = program.proc("p");
    for (String gone: new String[] {"t", "second", "again", "k"}) {
      assertNull(gone + " removed", p.nodeByName(gone));
    }
    assertEquals(3, results.invocationCount());
    assertTrue(results.changedBy("Tuple simplification"));
    assertTrue(results.changedBy("Dead code elimination"));
    assertFalse(results.changedBy("Validate"));

    // Nothing more to do
    assertFalse(pipeline.runPipeline(logger, program, PassOptions.defaults(),
                                     new PassResults()));
  }
}
