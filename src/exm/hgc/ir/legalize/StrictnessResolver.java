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

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.hgc.common.exceptions.HGCRuntimeError;
import exm.hgc.common.exceptions.LegalizationException;
import exm.hgc.common.lang.ChannelStrictness;

/**
 * Map a channel side's declared strictness and what could be proven about
 * its operations to a legalization plan, or a static error.
 */
public class StrictnessResolver {

  private final Logger logger;
  private final TokenOrder order;

  public StrictnessResolver(Logger logger, TokenOrder order) {
    this.logger = logger;
    this.order = order;
  }

  /**
   * @param group a channel side with more than one operation
   * @param exclusive whether the operations were proven mutually exclusive
   * @throws LegalizationException if the strictness requires a proof
   *                               that could not be found
   */
  public LegalizationPlan resolve(ChannelOpGroup group, boolean exclusive)
      throws LegalizationException {
    if (group.size() <= 1) {
      throw new HGCRuntimeError("Nothing to legalize for single operation: "
                                + group.describe());
    }
    ChannelStrictness strictness = group.channel().strictness();
    LegalizationPlan plan;
    switch (strictness) {
      case PROVEN_MUTUALLY_EXCLUSIVE:
        if (!exclusive) {
          throw new LegalizationException(group.channel().name(), strictness,
              "Could not prove operations on " + group.describe() +
              " are mutually exclusive, as required by strictness " +
              strictness);
        }
        plan = LegalizationPlan.leaveAsIs(group, "proven mutually exclusive");
        break;
      case TOTAL_ORDER:
        if (order.isTotallyOrdered(group.ops())) {
          plan = LegalizationPlan.staticOrder(group, "totally ordered");
        } else if (exclusive) {
          plan = LegalizationPlan.leaveAsIs(group,
                                            "proven mutually exclusive");
        } else {
          throw new LegalizationException(group.channel().name(), strictness,
              "Operations on " + group.describe() +
              " is not totally ordered, as required by strictness " +
              strictness);
        }
        break;
      case RUNTIME_ORDERED:
        plan = LegalizationPlan.checkedOrder(group, "runtime ordered",
                                             unorderedPredecessors(group));
        break;
      case RUNTIME_MUTUALLY_EXCLUSIVE:
        plan = LegalizationPlan.mutualExclusion(group,
                                         "runtime mutually exclusive");
        break;
      case ARBITRARY_STATIC_ORDER:
        plan = LegalizationPlan.staticOrder(group, "arbitrary static order");
        break;
      default:
        throw new HGCRuntimeError("Unknown strictness " + strictness);
    }
    logger.debug("Resolved " + plan);
    return plan;
  }

  private ListMultimap<Integer, Integer> unorderedPredecessors(
                                                ChannelOpGroup group) {
    ListMultimap<Integer, Integer> result = ArrayListMultimap.create();
    for (int i = 0; i < group.size(); i++) {
      for (int j = 0; j < i; j++) {
        if (!order.happensBefore(group.op(j), group.op(i))) {
          result.put(i, j);
        }
      }
    }
    return result;
  }
}
