package exm.hgc.ir.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.hgc.common.Logging;
import exm.hgc.common.Settings;
import exm.hgc.common.exceptions.LegalizationException;
import exm.hgc.frontend.IRParser;
import exm.hgc.ir.opt.PassResults.Invocation;
import exm.hgc.ir.tree.Program;

public class StandardPipelineTest {

  private static Logger logger;

  private static final String IR =
      "package pipeline\n" +
      "chan in(bits[8], id=0, kind=streaming, ops=receive_only, " +
      "strictness=total_order)\n" +
      "chan out(bits[8], id=1, kind=streaming, ops=send_only)\n" +
      "top proc p(tok: token, init={}) {\n" +
      "  r0: (token, bits[8]) = receive(tok, channel_id=0)\n" +
      "  r0_tok: token = tuple_index(r0, index=0)\n" +
      "  r0_data: bits[8] = tuple_index(r0, index=1)\n" +
      "  r1: (token, bits[8]) = receive(r0_tok, channel_id=0)\n" +
      "  r1_tok: token = tuple_index(r1, index=0)\n" +
      "  r1_data: bits[8] = tuple_index(r1, index=1)\n" +
      "  unused: bits[8] = add(r0_data, r1_data)\n" +
      "  s: token = send(r1_tok, r0_data, channel_id=1)\n" +
      "  next(s)\n" +
      "}\n";

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("StandardPipelineTest.hgc.log", true);
  }

  @After
  public void resetSettings() {
    Settings.set(Settings.LEGALIZE_ONLY, "false");
    Settings.set(Settings.COMPILER_DEBUG, "true");
  }

  private static List<String> passNames(PassResults results) {
    List<String> names = new ArrayList<String>();
    for (Invocation i: results.invocations()) {
      names.add(i.passName);
    }
    return names;
  }

  @Test
  public void testOptimizingPipeline() throws Exception {
    Program program = IRParser.parse(IR);
    PassResults results = new PassResults();
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream irOutput = new PrintStream(bytes, true, "UTF-8");

    assertTrue(StandardPipeline.run(logger, irOutput, program,
                                    PassOptions.defaults(), results));
    assertEquals(Arrays.asList("Tuple simplification",
        "Dead code elimination", "Validate", "Channel legalization",
        "Validate", "Dead code elimination", "Validate"),
        passNames(results));
    assertTrue(results.changedBy("Dead code elimination"));
    assertTrue(results.changedBy("Channel legalization"));

    String log = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    assertTrue(log.contains("Initial IR"));
    assertTrue(log.contains("IR after Channel legalization"));
    assertTrue(log.contains("Final IR"));
    assertTrue(log.contains("in__receive_adapter"));
  }

  @Test
  public void testWithoutDebugValidation() throws Exception {
    Settings.set(Settings.COMPILER_DEBUG, "false");
    PassResults results = new PassResults();
    StandardPipeline.run(logger, null, IRParser.parse(IR),
                         PassOptions.defaults(), results);
    assertEquals(Arrays.asList("Tuple simplification",
        "Dead code elimination", "Channel legalization",
        "Dead code elimination", "Validate"), passNames(results));
  }

  @Test
  public void testLegalizeOnly() throws Exception {
    Settings.set(Settings.LEGALIZE_ONLY, "true");
    Program program = IRParser.parse(IR);
    PassResults results = new PassResults();
    assertTrue(StandardPipeline.run(logger, null, program,
                                    new PassOptions(true), results));
    assertEquals(Arrays.asList("Channel legalization", "Validate"),
                 passNames(results));
    // Dead code is left alone
    assertNotNull(program.proc("p").nodeByName("unused"));
    // Ready for code generation
    Validate.validate(logger, program, true);
  }

  @Test
  public void testLegalizationFailure() throws Exception {
    Settings.set(Settings.LEGALIZE_ONLY, "true");
    // Default strictness requires proven exclusivity
    Program program = IRParser.parse(IR.replace(
                        ", strictness=total_order", ""));
    PassResults results = new PassResults();
    try {
      StandardPipeline.run(logger, null, program, PassOptions.defaults(),
                           results);
      fail("Receives on in are not exclusive");
    } catch (LegalizationException e) {
      assertEquals("in", e.channelName());
      assertEquals("Failed pass is not recorded", 0,
                   results.invocationCount());
    }
  }
}
