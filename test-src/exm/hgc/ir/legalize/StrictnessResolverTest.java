package exm.hgc.ir.legalize;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.hgc.common.Logging;
import exm.hgc.common.exceptions.LegalizationException;
import exm.hgc.common.lang.ChannelStrictness;
import exm.hgc.ir.legalize.LegalizationPlan.Policy;
import exm.hgc.ir.tree.Program;

public class StrictnessResolverTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("StrictnessResolverTest.hgc.log", true);
  }

  /**
   * Resolve the first multi-operation side of a fixture
   */
  private static LegalizationPlan resolve(String fixture,
      ChannelStrictness strictness) throws Exception {
    Program p = LegalizationTesting.parseFixture(fixture, strictness);
    List<ChannelOpGroup> groups = ChannelOpGroup.collectMultiOpSides(p);
    ChannelOpGroup group = groups.get(0);
    boolean exclusive =
          PredicateExclusivity.provenMutuallyExclusive(group.ops());
    return new StrictnessResolver(logger, new TokenOrder())
                                          .resolve(group, exclusive);
  }

  @Test
  public void testGroups() throws Exception {
    Program p = LegalizationTesting.parseFixture("partial_order",
                                      ChannelStrictness.RUNTIME_ORDERED);
    List<ChannelOpGroup> groups = ChannelOpGroup.collectMultiOpSides(p);
    assertEquals("Receives on in, then sends on out", 2, groups.size());
    assertEquals("in", groups.get(0).channel().name());
    assertEquals(ChannelSide.RECEIVE, groups.get(0).side());
    assertEquals(3, groups.get(0).size());
    assertEquals("recv0", groups.get(0).op(0).node().name());
    assertEquals("recv2", groups.get(0).op(2).node().name());
    assertEquals("out", groups.get(1).channel().name());
    assertEquals(ChannelSide.SEND, groups.get(1).side());
    assertTrue(groups.get(1).isSingleProc());
  }

  @Test
  public void testProvenExclusiveLeftAsIs() throws Exception {
    LegalizationPlan plan = resolve("complementary_receives",
                            ChannelStrictness.PROVEN_MUTUALLY_EXCLUSIVE);
    assertEquals(Policy.LEAVE_AS_IS, plan.policy());
    assertFalse(plan.synthesizesAdapter());
  }

  @Test
  public void testNotProvenExclusive() throws Exception {
    exception.expect(LegalizationException.class);
    exception.expectMessage("proven_mutually_exclusive");
    resolve("back_to_back", ChannelStrictness.PROVEN_MUTUALLY_EXCLUSIVE);
  }

  @Test
  public void testTotalOrder() throws Exception {
    LegalizationPlan plan = resolve("back_to_back",
                                    ChannelStrictness.TOTAL_ORDER);
    assertEquals(Policy.STATIC_ORDER, plan.policy());
    assertTrue(plan.synthesizesAdapter());
    assertTrue(plan.isOrdered());
  }

  @Test
  public void testTotalOrderFallsBackToExclusive() throws Exception {
    // Complementary predicates on two procs: no order, but exclusive
    Program p = LegalizationTesting.parseFixture("two_procs_alternating",
                                         ChannelStrictness.TOTAL_ORDER);
    ChannelOpGroup group = ChannelOpGroup.collectMultiOpSides(p).get(0);
    LegalizationPlan plan = new StrictnessResolver(logger, new TokenOrder())
                                          .resolve(group, true);
    assertEquals(Policy.LEAVE_AS_IS, plan.policy());
  }

  @Test
  public void testNotTotallyOrdered() throws Exception {
    exception.expect(LegalizationException.class);
    exception.expectMessage("is not totally ordered");
    resolve("two_procs_always_firing", ChannelStrictness.TOTAL_ORDER);
  }

  @Test
  public void testRuntimeOrdered() throws Exception {
    LegalizationPlan plan = resolve("partial_order",
                                    ChannelStrictness.RUNTIME_ORDERED);
    assertEquals(Policy.CHECKED_ORDER, plan.policy());
    assertTrue(plan.isOrdered());
    assertEquals(Collections.emptyList(), plan.unorderedPredecessors(0));
    assertEquals("recv1 follows recv0", Collections.emptyList(),
                 plan.unorderedPredecessors(1));
    assertEquals("recv2 is unordered with recv1", Arrays.asList(1),
                 plan.unorderedPredecessors(2));
    assertFalse(plan.tracksFired(0));
    assertTrue(plan.tracksFired(1));
    assertFalse(plan.tracksFired(2));
  }

  @Test
  public void testRuntimeOrderedAcrossProcs() throws Exception {
    LegalizationPlan plan = resolve("two_procs_always_firing",
                                    ChannelStrictness.RUNTIME_ORDERED);
    assertEquals(Arrays.asList(0), plan.unorderedPredecessors(1));
  }

  @Test
  public void testNeverFailing() throws Exception {
    assertEquals(Policy.MUTUAL_EXCLUSION, resolve("two_procs_always_firing",
        ChannelStrictness.RUNTIME_MUTUALLY_EXCLUSIVE).policy());
    assertEquals(Policy.STATIC_ORDER, resolve("two_procs_always_firing",
        ChannelStrictness.ARBITRARY_STATIC_ORDER).policy());
    assertFalse(resolve("two_procs_always_firing",
        ChannelStrictness.RUNTIME_MUTUALLY_EXCLUSIVE).isOrdered());
  }
}
