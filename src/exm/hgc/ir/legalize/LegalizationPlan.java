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

import java.util.List;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

/**
 * Decision for one channel side: leave it alone, or synthesize an adapter
 * with a given runtime policy.
 */
public class LegalizationPlan {

  public static enum Policy {
    /** Operations proven mutually exclusive; nothing to do */
    LEAVE_AS_IS,
    /** Serve operations in reference order without runtime checks */
    STATIC_ORDER,
    /** Serve operations in reference order, asserting unordered
     *  operations do not both fire in a round */
    CHECKED_ORDER,
    /** Forward whichever operation fires, asserting at most one does */
    MUTUAL_EXCLUSION,
  }

  private final ChannelOpGroup group;
  private final Policy policy;
  private final String reason;

  /**
   * For CHECKED_ORDER: index of each operation to indices of earlier
   * operations it is not ordered after
   */
  private final ListMultimap<Integer, Integer> unorderedPredecessors;

  private LegalizationPlan(ChannelOpGroup group, Policy policy,
      String reason, ListMultimap<Integer, Integer> unorderedPredecessors) {
    this.group = group;
    this.policy = policy;
    this.reason = reason;
    this.unorderedPredecessors = unorderedPredecessors;
  }

  public static LegalizationPlan leaveAsIs(ChannelOpGroup group,
                                           String reason) {
    return new LegalizationPlan(group, Policy.LEAVE_AS_IS, reason,
                                ArrayListMultimap.<Integer, Integer>create());
  }

  public static LegalizationPlan staticOrder(ChannelOpGroup group,
                                             String reason) {
    return new LegalizationPlan(group, Policy.STATIC_ORDER, reason,
                                ArrayListMultimap.<Integer, Integer>create());
  }

  public static LegalizationPlan checkedOrder(ChannelOpGroup group,
      String reason, ListMultimap<Integer, Integer> unorderedPredecessors) {
    return new LegalizationPlan(group, Policy.CHECKED_ORDER, reason,
                                unorderedPredecessors);
  }

  public static LegalizationPlan mutualExclusion(ChannelOpGroup group,
                                                 String reason) {
    return new LegalizationPlan(group, Policy.MUTUAL_EXCLUSION, reason,
                                ArrayListMultimap.<Integer, Integer>create());
  }

  public ChannelOpGroup group() {
    return group;
  }

  public Policy policy() {
    return policy;
  }

  public String reason() {
    return reason;
  }

  public boolean synthesizesAdapter() {
    return policy != Policy.LEAVE_AS_IS;
  }

  public boolean isOrdered() {
    return policy == Policy.STATIC_ORDER || policy == Policy.CHECKED_ORDER;
  }

  public List<Integer> unorderedPredecessors(int opIndex) {
    return unorderedPredecessors.get(opIndex);
  }

  /**
   * @return true if the adapter must remember whether op fired this round
   */
  public boolean tracksFired(int opIndex) {
    return unorderedPredecessors.containsValue(opIndex);
  }

  @Override
  public String toString() {
    return group.describe() + ": " + policy + " (" + reason + ")";
  }
}
