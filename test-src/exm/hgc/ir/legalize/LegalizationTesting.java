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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;

import exm.hgc.common.Logging;
import exm.hgc.common.exceptions.UserException;
import exm.hgc.common.lang.ChannelStrictness;
import exm.hgc.common.lang.Value;
import exm.hgc.frontend.IRParser;
import exm.hgc.ir.opt.PassOptions;
import exm.hgc.ir.opt.PassPipeline;
import exm.hgc.ir.opt.PassResults;
import exm.hgc.ir.opt.StandardPipeline;
import exm.hgc.ir.tree.Node;
import exm.hgc.ir.tree.Opcode;
import exm.hgc.ir.tree.Proc;
import exm.hgc.ir.tree.Program;
import exm.hgc.runtime.ChannelQueue;
import exm.hgc.runtime.InterpreterException;
import exm.hgc.runtime.SerialProcRuntime;

/**
 * Fixtures and helpers shared by legalization tests
 */
class LegalizationTesting {

  static final String STRICTNESS_PLACEHOLDER = "${strictness}";

  /**
   * Ways of running legalization: on its own, or inside the optimizing
   * pipeline with or without a downstream proc inlining step.
   */
  static enum PassVariant {
    LEGALIZATION_ONLY,
    STANDARD_PIPELINE,
    STANDARD_PIPELINE_INLINE_PROCS;

    boolean inlinesProcs() {
      return this == STANDARD_PIPELINE_INLINE_PROCS;
    }
  }

  /**
   * Load ir/NAME.ir from the test resources with every channel's
   * strictness filled in
   */
  static String fixtureText(String name, ChannelStrictness strictness)
      throws IOException {
    String text = Resources.toString(Resources.getResource("ir/" + name +
                                     ".ir"), StandardCharsets.UTF_8);
    return StringUtils.replace(text, STRICTNESS_PLACEHOLDER,
                               strictness.text());
  }

  static Program parseFixture(String name, ChannelStrictness strictness)
      throws IOException, UserException {
    return IRParser.parse(name + ".ir", fixtureText(name, strictness));
  }

  /**
   * @return true if channel legalization changed the program
   */
  static boolean legalize(Program program) throws UserException {
    return legalize(program, PassVariant.LEGALIZATION_ONLY);
  }

  static boolean legalize(Program program, PassVariant variant)
      throws UserException {
    Logger logger = Logging.getHGCLogger();
    PassOptions options = new PassOptions(variant.inlinesProcs());
    PassPipeline pipeline;
    if (variant == PassVariant.LEGALIZATION_ONLY) {
      pipeline = StandardPipeline.legalizationPipeline(null,
                                              variant.inlinesProcs());
    } else {
      pipeline = StandardPipeline.optimizingPipeline(null, true,
                                              variant.inlinesProcs());
    }
    PassResults results = new PassResults();
    pipeline.runPipeline(logger, program, options, results);
    return results.changedBy(new ChannelLegalizationPass().getPassName());
  }

  /**
   * @return proc and node names of every operation of the given opcode
   *         on the named channel
   */
  static List<String> channelOps(Program program, String channelName,
                                 Opcode op) {
    int id = program.channelByName(channelName).id();
    List<String> result = new ArrayList<String>();
    for (Proc proc: program.procs()) {
      for (Node n: proc.effectNodes()) {
        if (n.op() == op && n.channelId() == id) {
          result.add(proc.name() + "." + n.name());
        }
      }
    }
    return result;
  }

  static void writeBits(ChannelQueue q, int width, long... values) {
    for (long v: values) {
      q.write(Value.bits(width, v));
    }
  }

  /**
   * Write 0, 1, ..., count - 1 as bits[32]
   */
  static void writeSequence(ChannelQueue q, int count) {
    for (int i = 0; i < count; i++) {
      q.write(Value.bits(32, i));
    }
  }

  static List<Long> drain(ChannelQueue q) {
    List<Long> result = new ArrayList<Long>();
    Value v;
    while ((v = q.read()) != null) {
      result.add(v.asLong());
    }
    return result;
  }

  static List<Long> sequence(long... values) {
    List<Long> result = new ArrayList<Long>();
    for (long v: values) {
      result.add(v);
    }
    return result;
  }

  /**
   * Run until the named channel holds count values
   */
  static void tickUntil(SerialProcRuntime runtime, String channel,
                        long count, long maxTicks)
      throws InterpreterException {
    runtime.tickUntilOutput(ImmutableMap.of(channel, count), maxTicks);
  }
}
