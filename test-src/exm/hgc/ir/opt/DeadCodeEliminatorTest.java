package exm.hgc.ir.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.hgc.common.Logging;
import exm.hgc.common.Settings;
import exm.hgc.frontend.IRParser;
import exm.hgc.ir.tree.Proc;
import exm.hgc.ir.tree.Program;

public class DeadCodeEliminatorTest {

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("DeadCodeEliminatorTest.hgc.log", true);
  }

  @Test
  public void testRemovesUnusedChains() throws Exception {
    Program program = IRParser.parse(
        "package dce\n" +
        "chan c(bits[8], id=0, kind=streaming, ops=send_receive)\n" +
        "top proc p(tok: token, st: bits[8], unused: bits[1], " +
        "init={0, 0}) {\n" +
        "  r: (token, bits[8]) = receive(tok, channel_id=0)\n" +
        "  r_data: bits[8] = tuple_index(r, index=1)\n" +
        "  one: bits[8] = literal(value=1)\n" +
        "  inc: bits[8] = add(st, one)\n" +
        "  dead1: bits[8] = add(r_data, one)\n" +
        "  dead2: bits[8] = sub(dead1, one)\n" +
        "  ok: bits[1] = literal(value=1)\n" +
        "  a: token = assert(tok, ok, message=\"m\", label=\"l\")\n" +
        "  next(tok, inc, unused)\n" +
        "}\n");
    Proc p = program.proc("p");
    assertEquals(11, p.nodeCount());

    assertTrue(DeadCodeEliminator.eliminate(logger, p));
    assertNull(p.nodeByName("dead1"));
    assertNull(p.nodeByName("dead2"));
    assertNull("Only used by dead code", p.nodeByName("r_data"));
    // Side effects, parameters and next-state values stay
    assertNotNull(p.nodeByName("r"));
    assertNotNull(p.nodeByName("a"));
    assertNotNull(p.nodeByName("unused"));
    assertNotNull(p.nodeByName("inc"));
    assertNotNull(p.nodeByName("ok"));

    assertFalse(DeadCodeEliminator.eliminate(logger, p));
    Validate.validate(logger, program, false);
  }

  @Test
  public void testDisabledBySettings() throws Exception {
    Program program = IRParser.parse(
        "package dce\n" +
        "top proc p(tok: token, init={}) {\n" +
        "  k: bits[8] = literal(value=1)\n" +
        "  next(tok)\n" +
        "}\n");
    PassPipeline pipeline = new PassPipeline(null);
    DeadCodeEliminator dce = new DeadCodeEliminator();
    pipeline.addPass(dce);
    Settings.set(dce.getConfigEnabledKey(), "false");
    try {
      assertFalse(pipeline.passEnabled(dce));
      assertFalse(pipeline.runPipeline(logger, program,
                  PassOptions.defaults(), new PassResults()));
      assertNotNull(program.proc("p").nodeByName("k"));
    } finally {
      Settings.set(dce.getConfigEnabledKey(), "true");
    }
    assertTrue(pipeline.runPipeline(logger, program,
               PassOptions.defaults(), new PassResults()));
    assertNull(program.proc("p").nodeByName("k"));
  }
}
