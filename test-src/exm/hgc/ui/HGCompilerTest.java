package exm.hgc.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.hgc.common.Logging;
import exm.hgc.common.exceptions.HGCFatal;

public class HGCompilerTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("HGCompilerTest.hgc.log", true);
  }

  private static final String BACK_TO_BACK =
      "package test\n" +
      "chan in(bits[32], id=0, kind=streaming, ops=receive_only, " +
      "strictness=runtime_ordered)\n" +
      "chan out(bits[32], id=1, kind=streaming, ops=send_only, " +
      "strictness=runtime_ordered)\n" +
      "top proc my_proc(tok: token, init={}) {\n" +
      "  recv0: (token, bits[32]) = receive(tok, channel_id=0)\n" +
      "  recv0_tok: token = tuple_index(recv0, index=0)\n" +
      "  recv0_data: bits[32] = tuple_index(recv0, index=1)\n" +
      "  recv1: (token, bits[32]) = receive(recv0_tok, channel_id=0)\n" +
      "  recv1_tok: token = tuple_index(recv1, index=0)\n" +
      "  recv1_data: bits[32] = tuple_index(recv1, index=1)\n" +
      "  send0: token = send(recv1_tok, recv1_data, channel_id=1)\n" +
      "  send1: token = send(send0, recv0_data, channel_id=1)\n" +
      "  next(send1)\n" +
      "}\n";

  private File input(String text) throws Exception {
    File f = tmp.newFile("input.ir");
    FileUtils.writeStringToFile(f, text, StandardCharsets.UTF_8);
    return f;
  }

  private int exitCode(File in, File out) {
    try {
      new HGCompiler(logger).compile(in, out, null);
      return ExitCode.SUCCESS.code();
    } catch (HGCFatal e) {
      return e.exitCode;
    }
  }

  @Test
  public void testCompile() throws Exception {
    File out = new File(tmp.getRoot(), "output.ir");
    new HGCompiler(logger).compile(input(BACK_TO_BACK), out, null);
    String text = FileUtils.readFileToString(out, StandardCharsets.UTF_8);
    assertTrue(text, text.contains("proc in__receive_adapter"));
    assertTrue(text, text.contains("proc out__send_adapter"));
    assertTrue(text, text.contains("top proc my_proc"));
  }

  @Test
  public void testSyntaxError() throws Exception {
    File out = new File(tmp.getRoot(), "output.ir");
    assertEquals(ExitCode.ERROR_PARSER.code(),
        exitCode(input("package test\nchan in(bits[32]"), out));
    assertTrue("No output written", !out.exists());
  }

  @Test
  public void testLegalizationError() throws Exception {
    File out = new File(tmp.getRoot(), "output.ir");
    String unordered = BACK_TO_BACK.replace("runtime_ordered",
                                            "proven_mutually_exclusive");
    assertEquals(ExitCode.ERROR_USER.code(),
                 exitCode(input(unordered), out));
  }

  @Test
  public void testMissingInput() throws Exception {
    File in = new File(tmp.getRoot(), "missing.ir");
    File out = new File(tmp.getRoot(), "output.ir");
    try {
      new HGCompiler(logger).compile(in, out, null);
      fail("Input does not exist");
    } catch (HGCFatal e) {
      assertEquals(ExitCode.ERROR_IO.code(), e.exitCode);
    }
  }
}
