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
import java.util.List;

import org.apache.log4j.Logger;

import exm.hgc.common.exceptions.UserException;
import exm.hgc.ir.opt.Pass;
import exm.hgc.ir.opt.PassOptions;
import exm.hgc.ir.opt.PassResults;
import exm.hgc.ir.tree.Program;

/**
 * Legalize channel sides that have several operations.
 *
 * Every side is analyzed and resolved before anything is rewritten, so
 * if any side cannot be legalized the program is left untouched.
 */
public class ChannelLegalizationPass implements Pass {

  @Override
  public String getPassName() {
    return "Channel legalization";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public boolean run(Logger logger, Program program, PassOptions options,
                     PassResults results) throws UserException {
    TokenOrder order = new TokenOrder();
    StrictnessResolver resolver = new StrictnessResolver(logger, order);

    List<LegalizationPlan> plans = new ArrayList<LegalizationPlan>();
    for (ChannelOpGroup group: ChannelOpGroup.collectMultiOpSides(program)) {
      boolean exclusive =
            PredicateExclusivity.provenMutuallyExclusive(group.ops());
      if (logger.isTraceEnabled()) {
        logger.trace(group.describe() + " with strictness " +
            group.channel().strictness() + " exclusive: " + exclusive);
      }
      plans.add(resolver.resolve(group, exclusive));
    }

    AdapterSynthesizer synthesizer =
                        new AdapterSynthesizer(logger, program, order);
    boolean changed = false;
    for (LegalizationPlan plan: plans) {
      if (plan.synthesizesAdapter()) {
        synthesizer.synthesize(plan);
        changed = true;
      }
    }
    logger.debug("Legalized " + plans.size() + " channel sides, changed: "
                 + changed);
    return changed;
  }
}
