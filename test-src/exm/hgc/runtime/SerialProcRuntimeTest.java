package exm.hgc.runtime;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.collect.ImmutableMap;

import exm.hgc.common.Logging;
import exm.hgc.common.exceptions.HGCRuntimeError;
import exm.hgc.common.lang.Value;
import exm.hgc.frontend.IRParser;
import exm.hgc.ir.tree.Program;

public class SerialProcRuntimeTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("SerialProcRuntimeTest.hgc.log", true);
  }

  /** Accumulates inputs and emits running sums */
  private static final String ACCUMULATOR =
      "package acc\n" +
      "chan in(bits[8], id=0, kind=streaming, ops=receive_only)\n" +
      "chan out(bits[8], id=1, kind=streaming, ops=send_only)\n" +
      "top proc acc(tok: token, sum: bits[8], init={250}) {\n" +
      "  r: (token, bits[8]) = receive(tok, channel_id=0)\n" +
      "  r_tok: token = tuple_index(r, index=0)\n" +
      "  r_data: bits[8] = tuple_index(r, index=1)\n" +
      "  next_sum: bits[8] = add(sum, r_data)\n" +
      "  s: token = send(r_tok, next_sum, channel_id=1)\n" +
      "  next(s, next_sum)\n" +
      "}\n";

  /** Forwards between two procs over an internal channel */
  private static final String PIPELINE =
      "package two_stage\n" +
      "chan in(bits[8], id=0, kind=streaming, ops=receive_only)\n" +
      "chan mid(bits[8], id=1, kind=streaming, ops=send_receive)\n" +
      "chan out(bits[8], id=2, kind=streaming, ops=send_only)\n" +
      "proc second(tok: token, init={}) {\n" +
      "  r: (token, bits[8]) = receive(tok, channel_id=1)\n" +
      "  r_tok: token = tuple_index(r, index=0)\n" +
      "  r_data: bits[8] = tuple_index(r, index=1)\n" +
      "  lo: bits[4] = bit_slice(r_data, start=0, width=4)\n" +
      "  hi: bits[4] = bit_slice(r_data, start=4, width=4)\n" +
      "  big: bits[1] = ugt(hi, lo)\n" +
      "  flipped: bits[8] = not(r_data)\n" +
      "  picked: bits[8] = sel(big, cases=[r_data, flipped])\n" +
      "  s: token = send(r_tok, picked, channel_id=2)\n" +
      "  next(s)\n" +
      "}\n" +
      "top proc first(tok: token, init={}) {\n" +
      "  r: (token, bits[8]) = receive(tok, channel_id=0)\n" +
      "  r_tok: token = tuple_index(r, index=0)\n" +
      "  r_data: bits[8] = tuple_index(r, index=1)\n" +
      "  s: token = send(r_tok, r_data, channel_id=1)\n" +
      "  next(s)\n" +
      "}\n";

  @Test
  public void testStateAndWraparound() throws Exception {
    SerialProcRuntime runtime = new SerialProcRuntime(
                                      IRParser.parse(ACCUMULATOR));
    ChannelQueue in = runtime.queueManager().getQueueByName("in");
    ChannelQueue out = runtime.queueManager().getQueueByName("out");
    for (long v: new long[] {1, 2, 3, 4}) {
      in.write(Value.bits(8, v));
    }
    assertEquals(4, runtime.tickUntilOutput(ImmutableMap.of("out", 4L), 10));
    assertEquals(Value.bits(8, 251), out.read());
    assertEquals(Value.bits(8, 253), out.read());
    assertEquals("Wraps at 8 bits", Value.bits(8, 0), out.read());
    assertEquals(Value.bits(8, 4), out.read());
    assertNull(out.read());
    assertEquals(Arrays.asList(Value.bits(8, 4)),
                 runtime.interpreter("acc").state());
    assertEquals(4, runtime.interpreter("acc").activations());
  }

  @Test
  public void testOneActivationPerTick() throws Exception {
    SerialProcRuntime runtime = new SerialProcRuntime(
                                      IRParser.parse(ACCUMULATOR));
    ChannelQueue in = runtime.queueManager().getQueueByName("in");
    in.write(Value.bits(8, 1));
    in.write(Value.bits(8, 1));
    assertTrue(runtime.tick());
    assertEquals(1, runtime.queueManager().getQueueByName("out").getSize());
    assertEquals(1, in.getSize());
    assertTrue(runtime.tick());
    assertEquals(2, runtime.queueManager().getQueueByName("out").getSize());

    int ticks = 0;
    while (runtime.tick()) {
      assertTrue("Should settle", ++ticks < 3);
    }
    assertFalse(runtime.tick());
    assertEquals(2, runtime.interpreter("acc").activations());
    assertEquals(Arrays.asList("in"), runtime.blockedChannels());
  }

  @Test
  public void testProcsRetriedWithinTick() throws Exception {
    SerialProcRuntime runtime = new SerialProcRuntime(
                                      IRParser.parse(PIPELINE));
    ChannelQueue in = runtime.queueManager().getQueueByName("in");
    ChannelQueue out = runtime.queueManager().getQueueByName("out");
    in.write(Value.bits(8, 0x12));
    in.write(Value.bits(8, 0x34));

    // second runs before first, so only resumes once first has sent
    runtime.tick();
    assertEquals("One value through both stages", 1, out.getSize());
    runtime.tickUntilOutput(ImmutableMap.of("out", 2L), 5);
    assertEquals(Value.bits(8, 0x12), out.read());
    assertEquals(Value.bits(8, 0x34), out.read());

    in.write(Value.bits(8, 0x51));
    runtime.tickUntilOutput(ImmutableMap.of("out", 1L), 5);
    assertEquals("High nibble bigger, so inverted",
                 Value.bits(8, 0xae), out.read());
  }

  @Test
  public void testNoProgress() throws Exception {
    SerialProcRuntime runtime = new SerialProcRuntime(
                                      IRParser.parse(PIPELINE));
    try {
      runtime.tickUntilOutput(ImmutableMap.of("out", 1L), 100);
      fail("Nothing to read");
    } catch (DeadlineExceededException e) {
      assertTrue(e.getMessage(),
          e.getMessage().contains("Blocked channels: mid, in"));
      assertEquals(Arrays.asList("mid", "in"), e.blockedChannels());
      assertTrue("Gave up early", e.ticks() < 100);
    }
  }

  @Test
  public void testDeadline() throws Exception {
    SerialProcRuntime runtime = new SerialProcRuntime(
                                      IRParser.parse(ACCUMULATOR));
    ChannelQueue in = runtime.queueManager().getQueueByName("in");
    for (int i = 0; i < 10; i++) {
      in.write(Value.bits(8, i));
    }
    try {
      runtime.tickUntilOutput(ImmutableMap.of("out", 10L), 3);
      fail("Only one activation per tick");
    } catch (DeadlineExceededException e) {
      assertEquals(3, e.ticks());
      assertTrue(e.getMessage(), e.getMessage().contains("deadline"));
    }
    assertEquals(3, runtime.queueManager().getQueueByName("out").getSize());
  }

  @Test
  public void testPredicatedReceive() throws Exception {
    Program p = IRParser.parse(
        "package pred\n" +
        "chan in(bits[8], id=0, kind=streaming, ops=receive_only)\n" +
        "chan out(bits[8], id=1, kind=streaming, ops=send_only)\n" +
        "top proc p(tok: token, on: bits[1], init={0}) {\n" +
        "  r: (token, bits[8]) = receive(tok, predicate=on, channel_id=0)\n" +
        "  r_tok: token = tuple_index(r, index=0)\n" +
        "  r_data: bits[8] = tuple_index(r, index=1)\n" +
        "  s: token = send(r_tok, r_data, channel_id=1)\n" +
        "  off: bits[1] = not(on)\n" +
        "  next(s, off)\n" +
        "}\n");
    SerialProcRuntime runtime = new SerialProcRuntime(p);
    ChannelQueue in = runtime.queueManager().getQueueByName("in");
    ChannelQueue out = runtime.queueManager().getQueueByName("out");
    in.write(Value.bits(8, 9));
    runtime.tickUntilOutput(ImmutableMap.of("out", 3L), 5);
    assertEquals("Receive not taken gives zero", Value.bits(8, 0),
                 out.read());
    assertEquals(Value.bits(8, 9), out.read());
    assertEquals(Value.bits(8, 0), out.read());
    assertTrue(in.isEmpty());
  }

  @Test
  public void testAssertionFailure() throws Exception {
    Program p = IRParser.parse(
        "package asserts\n" +
        "chan in(bits[8], id=0, kind=streaming, ops=receive_only)\n" +
        "top proc checker(tok: token, init={}) {\n" +
        "  r: (token, bits[8]) = receive(tok, channel_id=0)\n" +
        "  r_tok: token = tuple_index(r, index=0)\n" +
        "  r_data: bits[8] = tuple_index(r, index=1)\n" +
        "  limit: bits[8] = literal(value=100)\n" +
        "  small: bits[1] = ult(r_data, limit)\n" +
        "  a: token = assert(r_tok, small, message=\"too big\", " +
        "label=\"range_check\")\n" +
        "  next(a)\n" +
        "}\n");
    SerialProcRuntime runtime = new SerialProcRuntime(p);
    ChannelQueue in = runtime.queueManager().getQueueByName("in");
    in.write(Value.bits(8, 5));
    in.write(Value.bits(8, 200));
    assertTrue(runtime.tick());
    try {
      runtime.tick();
      fail("200 is not below 100");
    } catch (AssertionFailureException e) {
      assertEquals("checker", e.procName());
      assertEquals("range_check", e.label());
      assertTrue(e.getMessage().contains("too big"));
    }
  }

  @Test
  public void testQueueTypeCheck() throws Exception {
    SerialProcRuntime runtime = new SerialProcRuntime(
                                      IRParser.parse(ACCUMULATOR));
    ChannelQueue in = runtime.queueManager().getQueueByName("in");
    exception.expect(HGCRuntimeError.class);
    in.write(Value.bits(16, 1));
  }

  @Test
  public void testUnknownQueue() throws Exception {
    SerialProcRuntime runtime = new SerialProcRuntime(
                                      IRParser.parse(ACCUMULATOR));
    exception.expect(HGCRuntimeError.class);
    exception.expectMessage("No channel named nowhere");
    runtime.queueManager().getQueueByName("nowhere");
  }
}
